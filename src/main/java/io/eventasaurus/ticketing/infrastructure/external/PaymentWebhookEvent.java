package io.eventasaurus.ticketing.infrastructure.external;

/**
 * 서명 검증을 통과한 웹훅 이벤트
 *
 * @param id              대행사 이벤트 id (evt_...)
 * @param rawType         원본 타입 문자열 (UNHANDLED 로깅용)
 * @param objectId        data.object.id (payment intent 또는 checkout session id), UNHANDLED 이면 null 일 수 있음
 * @param paymentStatus   checkout session 의 payment_status, 그 외 null
 * @param paymentIntentId checkout session 에 연결된 payment intent id, 그 외 null
 */
public record PaymentWebhookEvent(
    String id,
    WebhookEventType type,
    String rawType,
    String objectId,
    String paymentStatus,
    String paymentIntentId
) {

    public boolean isPaid() {
        return "paid".equals(paymentStatus);
    }
}
