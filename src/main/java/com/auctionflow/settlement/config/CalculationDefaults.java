package com.auctionflow.settlement.config;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolved defaults for a calculation: the single supported currency,
 * the fallback premium and tax rates, and the verifier tolerance.
 */
public record CalculationDefaults(
        String currency,
        BigDecimal premiumRate,
        BigDecimal taxRate,
        BigDecimal verificationTolerance
) {

    public static final BigDecimal DEFAULT_PREMIUM_RATE = new BigDecimal("0.10");
    public static final BigDecimal DEFAULT_TAX_RATE = new BigDecimal("0.085");
    public static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.01");

    public CalculationDefaults {
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(premiumRate, "premiumRate");
        Objects.requireNonNull(taxRate, "taxRate");
        Objects.requireNonNull(verificationTolerance, "verificationTolerance");
        currency = currency.trim().toUpperCase(Locale.ROOT);
        if (currency.length() != 3) {
            throw new IllegalArgumentException("Currency must be a 3-letter ISO code: " + currency);
        }
        requireUnitInterval("premiumRate", premiumRate);
        requireUnitInterval("taxRate", taxRate);
        if (verificationTolerance.signum() < 0) {
            throw new IllegalArgumentException("Verification tolerance must not be negative: " + verificationTolerance);
        }
    }

    public static CalculationDefaults standard() {
        return new CalculationDefaults("USD", DEFAULT_PREMIUM_RATE, DEFAULT_TAX_RATE, DEFAULT_TOLERANCE);
    }

    private static void requireUnitInterval(String name, BigDecimal rate) {
        if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException(name + " must be between 0 and 1, got " + rate);
        }
    }
}
