package io.eventasaurus.ticketing.domain.order;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.domain.ticket.Ticket;

/**
 * 가격 계산기 (순수 함수, 부수효과 없음)
 * <p>
 * 규칙:
 * - FIXED: 단가 = base_price_cents, custom_price_cents 지정 시 거절 (조용한 할인 방지)
 * - FLEXIBLE: 단가 = custom_price_cents, 미지정 또는 minimum 미만이면 거절
 * - tip: tippable 티켓에만 허용. 0 은 "팁 없음"으로 취급한다.
 * - total: MAX_TOTAL_CENTS 이하. 넘거나 long 범위를 벗어나면 INVALID_INPUT
 */
public final class PricingCalculator {

    /**
     * 결제 대행사가 한 번에 청구할 수 있는 최대 금액 (999,999.99)
     */
    public static final long MAX_TOTAL_CENTS = 99_999_999L;

    private PricingCalculator() {
    }

    public static PriceQuote calculate(Ticket ticket, Integer quantity, Long customPriceCents, Long tipCents) {
        validateQuantity(quantity);
        long tip = resolveTip(ticket, tipCents);
        long unitPrice = resolveUnitPrice(ticket, customPriceCents);

        long subtotal;
        long total;
        try {
            subtotal = Math.multiplyExact(unitPrice, quantity.longValue());
            total = Math.addExact(subtotal, tip);
        } catch (ArithmeticException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Order total exceeds the maximum chargeable amount");
        }
        if (total > MAX_TOTAL_CENTS) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Order total exceeds the maximum chargeable amount");
        }

        PricingSnapshot snapshot = new PricingSnapshot(
            unitPrice,
            ticket.getPricingModel(),
            ticket.getBasePriceCents(),
            ticket.isFlexible() ? customPriceCents : null,
            ticket.getMinimumPriceCents(),
            ticket.getSuggestedPriceCents(),
            tip,
            ticket.isTippable()
        );

        return new PriceQuote(snapshot, quantity, subtotal, total);
    }

    private static void validateQuantity(Integer quantity) {
        if (quantity == null || quantity < 1) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
    }

    private static long resolveUnitPrice(Ticket ticket, Long customPriceCents) {
        return switch (ticket.getPricingModel()) {
            case FIXED -> {
                if (customPriceCents != null) {
                    throw new BusinessException(ErrorCode.CUSTOM_PRICE_NOT_ALLOWED);
                }
                yield ticket.getBasePriceCents();
            }
            case FLEXIBLE -> {
                if (customPriceCents == null) {
                    throw new BusinessException(ErrorCode.CUSTOM_PRICE_REQUIRED);
                }
                if (customPriceCents < 0) {
                    throw new BusinessException(ErrorCode.INVALID_INPUT, "Custom price must not be negative");
                }
                if (customPriceCents < ticket.getMinimumPriceCents()) {
                    throw new BusinessException(ErrorCode.PRICE_BELOW_MINIMUM);
                }
                yield customPriceCents;
            }
        };
    }

    private static long resolveTip(Ticket ticket, Long tipCents) {
        if (tipCents == null || tipCents == 0) {
            return 0L;
        }
        if (tipCents < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tip must not be negative");
        }
        if (!ticket.isTippable()) {
            throw new BusinessException(ErrorCode.TIP_NOT_ALLOWED);
        }
        return tipCents;
    }
}
