package com.auctionflow.settlement.model;

import java.math.BigDecimal;

/**
 * Subtotal bracket with its own buyer's premium rate.
 * The range is [minAmount, maxAmount); a null maxAmount means no upper bound
 * and a null minAmount is read as zero.
 */
public record PremiumTier(
    String id,
    String name,
    BigDecimal minAmount,
    BigDecimal maxAmount,
    BigDecimal rate
) {

    /**
     * Lower bound with null read as zero.
     */
    public BigDecimal lowerBound() {
        return minAmount != null ? minAmount : BigDecimal.ZERO;
    }

    public boolean isUnbounded() {
        return maxAmount == null;
    }

    /**
     * Check whether the subtotal falls inside this bracket.
     */
    public boolean contains(BigDecimal subtotal) {
        return subtotal.compareTo(lowerBound()) >= 0
                && (isUnbounded() || subtotal.compareTo(maxAmount) < 0);
    }
}
