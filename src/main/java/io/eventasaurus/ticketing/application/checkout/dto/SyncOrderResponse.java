package io.eventasaurus.ticketing.application.checkout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.eventasaurus.ticketing.domain.order.OrderStatus;

public record SyncOrderResponse(
    @JsonProperty("order_id") Long orderId,
    String status,
    boolean confirmed
) {

    public static SyncOrderResponse of(Long orderId, OrderStatus status) {
        return new SyncOrderResponse(orderId, status.value(), status == OrderStatus.CONFIRMED);
    }
}
