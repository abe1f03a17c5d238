package io.eventasaurus.ticketing.domain.order;

import io.eventasaurus.ticketing.domain.ticket.PricingModel;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 시점의 가격 계산 근거.
 * 모든 컬럼은 updatable = false 이며 이후 티켓 가격이 바뀌어도 다시 계산하지 않는다.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PricingSnapshot {

    @Column(name = "unit_price_cents", nullable = false, updatable = false)
    private Long unitPriceCents;

    @Enumerated(EnumType.STRING)
    @Column(name = "pricing_model", nullable = false, updatable = false, length = 20)
    private PricingModel pricingModel;

    @Column(name = "base_price_cents", nullable = false, updatable = false)
    private Long basePriceCents;

    @Column(name = "custom_price_cents", updatable = false)
    private Long customPriceCents;

    @Column(name = "minimum_price_cents", nullable = false, updatable = false)
    private Long minimumPriceCents;

    @Column(name = "suggested_price_cents", updatable = false)
    private Long suggestedPriceCents;

    @Column(name = "tip_cents", nullable = false, updatable = false)
    private Long tipCents;

    @Column(name = "ticket_tippable", nullable = false, updatable = false)
    private boolean ticketTippable;

    PricingSnapshot(Long unitPriceCents, PricingModel pricingModel, Long basePriceCents, Long customPriceCents,
                    Long minimumPriceCents, Long suggestedPriceCents, Long tipCents, boolean ticketTippable) {
        this.unitPriceCents = unitPriceCents;
        this.pricingModel = pricingModel;
        this.basePriceCents = basePriceCents;
        this.customPriceCents = customPriceCents;
        this.minimumPriceCents = minimumPriceCents;
        this.suggestedPriceCents = suggestedPriceCents;
        this.tipCents = tipCents;
        this.ticketTippable = ticketTippable;
    }
}
