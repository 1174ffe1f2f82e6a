package com.auctionflow.settlement.service;

import com.auctionflow.settlement.exception.CalculationException;

import java.math.BigDecimal;

/**
 * Rate range checks shared by the premium and tax calculators.
 */
public final class RateBounds {

    private RateBounds() {}

    public static boolean isWithinUnitInterval(BigDecimal rate) {
        return rate.signum() >= 0 && rate.compareTo(BigDecimal.ONE) <= 0;
    }

    /**
     * @throws CalculationException INVALID_RATE when the rate is outside [0, 1]
     */
    public static BigDecimal requireValid(String label, BigDecimal rate) {
        if (rate == null || !isWithinUnitInterval(rate)) {
            throw CalculationException.invalidRate(
                    "Invalid " + label + ": " + rate + ". Rate must be between 0 and 1.");
        }
        return rate;
    }
}
