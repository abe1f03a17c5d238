package io.eventasaurus.ticketing.application.usecase.payment;

/**
 * 웹훅 처리 결과. 모든 값이 200 응답으로 이어진다.
 */
public enum WebhookOutcome {
    CONFIRMED,
    ALREADY_CONFIRMED,
    LEFT_PENDING,       // 결제 실패 / 세션 만료 / 미결제 세션 완료
    ORDER_NOT_FOUND,
    DUPLICATE,
    UNHANDLED;

    public String tag() {
        return name().toLowerCase();
    }
}
