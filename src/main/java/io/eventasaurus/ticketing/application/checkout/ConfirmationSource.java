package io.eventasaurus.ticketing.application.checkout;

public enum ConfirmationSource {
    WEBHOOK,
    SYNC;

    public String tag() {
        return name().toLowerCase();
    }
}
