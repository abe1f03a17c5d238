package io.eventasaurus.ticketing.domain.ticket;

public enum PricingModel {
    FIXED,      // base_price_cents 고정
    FLEXIBLE    // 구매자가 minimum 이상 금액을 직접 지정
}
