package io.eventasaurus.ticketing.infrastructure.external;

import io.eventasaurus.ticketing.infrastructure.external.stripe.StripeSignatureVerifier;
import io.eventasaurus.ticketing.infrastructure.external.stripe.StripeWebhookEventParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mock 결제 대행사 (local 프로파일)
 * <p>
 * 시뮬레이션 규칙:
 * - 세션 생성 즉시 결제 완료된 것으로 간주 (sync 호출 시 paid / succeeded)
 * - 웹훅 서명 검증은 실제 구현과 동일 (StripeSignatureVerifier.sign 으로 서명 가능)
 */
@Slf4j
@Component
@Profile("local")
@RequiredArgsConstructor
public class MockPaymentGatewayClient implements PaymentGatewayClient {

    private static final String MOCK_CHECKOUT_URL = "http://localhost:8080/mock-checkout/";

    private final StripeSignatureVerifier signatureVerifier;
    private final StripeWebhookEventParser eventParser;

    private final Map<String, String> intentBySession = new ConcurrentHashMap<>();
    private final Map<String, String> sessionByIdempotencyKey = new ConcurrentHashMap<>();

    @Override
    public CheckoutSession createCheckoutSession(CheckoutSessionRequest request) {
        String sessionId = sessionByIdempotencyKey.computeIfAbsent(request.idempotencyKey(), key -> {
            String id = "cs_mock_" + shortId();
            intentBySession.put(id, "pi_mock_" + shortId());
            return id;
        });

        log.info("Mock gateway: checkout session orderId={}, sessionId={}, total={}",
            request.orderId(), sessionId, request.totalCents());
        return new CheckoutSession(sessionId, MOCK_CHECKOUT_URL + sessionId, null);
    }

    @Override
    public PaymentIntentStatus getPaymentIntent(String paymentReference) {
        if (!intentBySession.containsValue(paymentReference)) {
            throw new PaymentGatewayException("Mock gateway: unknown payment intent " + paymentReference, 404, null);
        }
        return new PaymentIntentStatus(paymentReference, "succeeded");
    }

    @Override
    public CheckoutSessionStatus getCheckoutSession(String sessionId) {
        String intentId = intentBySession.get(sessionId);
        if (intentId == null) {
            throw new PaymentGatewayException("Mock gateway: unknown checkout session " + sessionId, 404, null);
        }
        return new CheckoutSessionStatus(sessionId, "paid", intentId);
    }

    @Override
    public PaymentWebhookEvent verifyWebhookSignature(String payload, String signatureHeader, String secret) {
        signatureVerifier.verify(payload, signatureHeader, secret);
        return eventParser.parse(payload);
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
