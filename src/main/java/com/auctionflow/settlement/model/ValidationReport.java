package com.auctionflow.settlement.model;

import java.util.List;

/**
 * All input problems found before a calculation is attempted.
 */
public record ValidationReport(
    boolean valid,
    List<String> errors
) {

    public static ValidationReport of(List<String> errors) {
        return new ValidationReport(errors.isEmpty(), List.copyOf(errors));
    }
}
