package io.eventasaurus.ticketing.infrastructure.external;

import java.util.Arrays;

/**
 * 처리 대상 웹훅 이벤트 종류. 모르는 타입은 UNHANDLED 로 파싱되어 무시된다.
 */
public enum WebhookEventType {

    PAYMENT_SUCCEEDED("payment_intent.succeeded"),
    PAYMENT_FAILED("payment_intent.payment_failed"),
    SESSION_COMPLETED("checkout.session.completed"),
    SESSION_EXPIRED("checkout.session.expired"),
    UNHANDLED(null);

    private final String providerType;

    WebhookEventType(String providerType) {
        this.providerType = providerType;
    }

    public static WebhookEventType from(String rawType) {
        return Arrays.stream(values())
            .filter(type -> type.providerType != null && type.providerType.equals(rawType))
            .findFirst()
            .orElse(UNHANDLED);
    }
}
