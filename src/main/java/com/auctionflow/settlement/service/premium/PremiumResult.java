package com.auctionflow.settlement.service.premium;

import com.auctionflow.settlement.model.PremiumTier;

import java.math.BigDecimal;

/**
 * Rounded premium amount, the rate that produced it and the matched tier, if any.
 */
public record PremiumResult(
    BigDecimal amount,
    BigDecimal appliedRate,
    PremiumTier appliedTier
) {

    public boolean isTiered() {
        return appliedTier != null;
    }
}
