package com.auctionflow.settlement.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Line-by-line explanation of how the totals were reached.
 */
public record CalculationBreakdown(
    List<ItemLine> items,
    PremiumLine buyersPremium,
    TaxLine tax
) {

    public CalculationBreakdown {
        items = List.copyOf(items);
    }

    /**
     * Per-item total, rounded to presentation scale.
     */
    public record ItemLine(
        String lotId,
        String title,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal totalPrice
    ) {}

    /**
     * Applied premium rate. appliedTier is null in flat mode and when no tier matched.
     */
    public record PremiumLine(
        BigDecimal rate,
        BigDecimal amount,
        PremiumTier appliedTier
    ) {}

    /**
     * Applied tax rate and the unrounded base it was charged on.
     */
    public record TaxLine(
        BigDecimal rate,
        BigDecimal taxableAmount,
        BigDecimal amount
    ) {}
}
