package io.eventasaurus.ticketing.infrastructure.external;

/**
 * @param paymentReference 세션 생성 시점에 이미 intent 가 있으면 그 id, 보통은 null
 */
public record CheckoutSession(String sessionId, String checkoutUrl, String paymentReference) {
}
