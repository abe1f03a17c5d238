package io.eventasaurus.ticketing.application.checkout;

import io.eventasaurus.ticketing.domain.order.Order;

/**
 * 트랜잭션 커밋 후 결제 세션 생성에 필요한 값
 */
public record PendingCheckout(Order order, String ticketTitle, String payoutAccountId) {
}
