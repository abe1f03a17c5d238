package io.eventasaurus.ticketing.infrastructure.kafka.message;

import io.eventasaurus.ticketing.domain.order.OrderConfirmedEvent;

import java.time.LocalDateTime;

/**
 * order-confirmed 토픽 메시지 (영수증/알림 소비자용)
 */
public record OrderConfirmedMessage(
    Long orderId,
    Long userId,
    Long ticketId,
    Long eventId,
    Integer quantity,
    Long totalCents,
    String currency,
    LocalDateTime confirmedAt
) {

    public static OrderConfirmedMessage from(OrderConfirmedEvent event) {
        return new OrderConfirmedMessage(
            event.orderId(),
            event.userId(),
            event.ticketId(),
            event.eventId(),
            event.quantity(),
            event.totalCents(),
            event.currency(),
            event.confirmedAt()
        );
    }
}
