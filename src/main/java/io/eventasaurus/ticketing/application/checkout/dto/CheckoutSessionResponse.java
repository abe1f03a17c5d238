package io.eventasaurus.ticketing.application.checkout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CheckoutSessionResponse(
    boolean success,
    @JsonProperty("checkout_url") String checkoutUrl,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("order_id") Long orderId
) {

    public static CheckoutSessionResponse of(Long orderId, String sessionId, String checkoutUrl) {
        return new CheckoutSessionResponse(true, checkoutUrl, sessionId, orderId);
    }
}
