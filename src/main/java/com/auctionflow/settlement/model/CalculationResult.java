package com.auctionflow.settlement.model;

import java.math.BigDecimal;

/**
 * Verified outcome of a settlement calculation.
 * All four monetary figures are at presentation scale and reconcile within tolerance.
 */
public record CalculationResult(
    BigDecimal subtotal,
    BigDecimal buyersPremiumAmount,
    BigDecimal taxAmount,
    BigDecimal grandTotal,
    String currency,
    CalculationBreakdown breakdown,
    String checksum
) {

    public CalculationTotals totals() {
        return new CalculationTotals(subtotal, buyersPremiumAmount, taxAmount, grandTotal);
    }
}
