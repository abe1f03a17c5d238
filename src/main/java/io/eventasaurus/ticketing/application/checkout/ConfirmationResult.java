package io.eventasaurus.ticketing.application.checkout;

import io.eventasaurus.ticketing.domain.order.OrderStatus;

/**
 * @param transitioned 이번 호출이 PENDING → CONFIRMED 전이를 수행했으면 true
 */
public record ConfirmationResult(Long orderId, OrderStatus status, boolean transitioned) {

    public static ConfirmationResult transitioned(Long orderId) {
        return new ConfirmationResult(orderId, OrderStatus.CONFIRMED, true);
    }

    public static ConfirmationResult unchanged(Long orderId) {
        return new ConfirmationResult(orderId, OrderStatus.CONFIRMED, false);
    }
}
