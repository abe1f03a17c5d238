package io.eventasaurus.ticketing.domain.order;

import java.time.LocalDateTime;

/**
 * 주문 확정 도메인 이벤트
 * confirm() 이 실제 전이를 수행했을 때만 한 번 발행된다.
 */
public record OrderConfirmedEvent(
    Long orderId,
    Long userId,
    Long ticketId,
    Long eventId,
    Integer quantity,
    Long totalCents,
    String currency,
    String confirmationEventId,
    LocalDateTime confirmedAt
) {

    public static OrderConfirmedEvent of(Order order, String confirmationEventId, LocalDateTime confirmedAt) {
        return new OrderConfirmedEvent(
            order.getId(),
            order.getUserId(),
            order.getTicketId(),
            order.getEventId(),
            order.getQuantity(),
            order.getTotalCents(),
            order.getCurrency(),
            confirmationEventId,
            confirmedAt
        );
    }
}
