package io.eventasaurus.ticketing.application.checkout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.eventasaurus.ticketing.domain.order.Order;
import io.eventasaurus.ticketing.domain.order.PricingSnapshot;

import java.time.LocalDateTime;

/**
 * 주문 성공 화면 / 영수증 표시용 읽기 전용 응답
 */
public record OrderDetailResponse(
    @JsonProperty("order_id") Long orderId,
    @JsonProperty("ticket_id") Long ticketId,
    @JsonProperty("event_id") Long eventId,
    Integer quantity,
    String status,
    @JsonProperty("confirmed_at") LocalDateTime confirmedAt,
    String currency,
    @JsonProperty("unit_price_cents") Long unitPriceCents,
    @JsonProperty("pricing_model") String pricingModel,
    @JsonProperty("subtotal_cents") Long subtotalCents,
    @JsonProperty("tip_cents") Long tipCents,
    @JsonProperty("total_cents") Long totalCents,
    @JsonProperty("created_at") LocalDateTime createdAt
) {

    public static OrderDetailResponse from(Order order) {
        PricingSnapshot snapshot = order.getPricingSnapshot();
        return new OrderDetailResponse(
            order.getId(),
            order.getTicketId(),
            order.getEventId(),
            order.getQuantity(),
            order.getStatus().value(),
            order.getConfirmedAt(),
            order.getCurrency(),
            snapshot.getUnitPriceCents(),
            snapshot.getPricingModel().name().toLowerCase(),
            order.getSubtotalCents(),
            snapshot.getTipCents(),
            order.getTotalCents(),
            order.getCreatedAt()
        );
    }
}
