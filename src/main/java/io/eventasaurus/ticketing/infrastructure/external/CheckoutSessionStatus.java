package io.eventasaurus.ticketing.infrastructure.external;

public record CheckoutSessionStatus(String id, String paymentStatus, String paymentIntentId) {

    public boolean isPaid() {
        return "paid".equals(paymentStatus);
    }
}
