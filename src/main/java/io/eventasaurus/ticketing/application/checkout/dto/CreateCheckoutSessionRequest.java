package io.eventasaurus.ticketing.application.checkout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record CreateCheckoutSessionRequest(
    @NotNull(message = "ticket_id is required")
    @JsonProperty("ticket_id")
    Long ticketId,

    Integer quantity,

    @JsonProperty("custom_price_cents")
    Long customPriceCents,

    @JsonProperty("tip_cents")
    Long tipCents
) {

    /**
     * 수량 미지정 시 1매
     */
    public int quantityOrDefault() {
        return quantity == null ? 1 : quantity;
    }
}
