package com.auctionflow.settlement.model;

import java.math.BigDecimal;

/**
 * Result of re-checking a set of totals.
 * On failure, error names the violated check and discrepancy carries the
 * offending amount when there is one.
 */
public record VerificationOutcome(
    boolean accurate,
    String error,
    BigDecimal discrepancy
) {

    public static VerificationOutcome passed() {
        return new VerificationOutcome(true, null, null);
    }

    public static VerificationOutcome failed(String error, BigDecimal discrepancy) {
        return new VerificationOutcome(false, error, discrepancy);
    }
}
