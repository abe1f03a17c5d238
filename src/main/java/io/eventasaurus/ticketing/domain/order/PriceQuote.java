package io.eventasaurus.ticketing.domain.order;

/**
 * PricingCalculator 결과.
 * subtotal = unit_price * quantity, total = subtotal + tip
 */
public record PriceQuote(
    PricingSnapshot snapshot,
    int quantity,
    long subtotalCents,
    long totalCents
) {

    public long unitPriceCents() {
        return snapshot.getUnitPriceCents();
    }

    public long tipCents() {
        return snapshot.getTipCents();
    }
}
