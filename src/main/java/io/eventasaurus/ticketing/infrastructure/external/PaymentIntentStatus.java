package io.eventasaurus.ticketing.infrastructure.external;

public record PaymentIntentStatus(String id, String status) {

    public boolean isSucceeded() {
        return "succeeded".equals(status);
    }
}
