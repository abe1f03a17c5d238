package io.eventasaurus.ticketing.infrastructure.external;

/**
 * 결제 대행사 연동 인터페이스
 * <p>
 * 애플리케이션 계층은 이 인터페이스에만 의존한다.
 * - 운영: StripePaymentGatewayClient
 * - local 프로파일: MockPaymentGatewayClient
 * - 테스트: Mockito mock 주입
 * <p>
 * 모든 호출은 짧은 타임아웃을 가지며, 실패/타임아웃은 PaymentGatewayException 으로 통일된다.
 */
public interface PaymentGatewayClient {

    CheckoutSession createCheckoutSession(CheckoutSessionRequest request);

    PaymentIntentStatus getPaymentIntent(String paymentReference);

    CheckoutSessionStatus getCheckoutSession(String sessionId);

    /**
     * 서명 검증 후 이벤트 파싱
     *
     * @throws InvalidWebhookSignatureException 서명/타임스탬프/본문 형식 중 하나라도 맞지 않는 경우
     */
    PaymentWebhookEvent verifyWebhookSignature(String payload, String signatureHeader, String secret);
}
