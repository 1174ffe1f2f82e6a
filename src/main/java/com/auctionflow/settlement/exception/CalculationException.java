package com.auctionflow.settlement.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Terminal failure of a single calculation.
 */
@Getter
public class CalculationException extends RuntimeException {

    private final CalculationErrorKind kind;
    private final BigDecimal discrepancy;

    public CalculationException(CalculationErrorKind kind, String message) {
        this(kind, message, null);
    }

    public CalculationException(CalculationErrorKind kind, String message, BigDecimal discrepancy) {
        super(message);
        this.kind = kind;
        this.discrepancy = discrepancy;
    }

    public static CalculationException emptyInput(String message) {
        return new CalculationException(CalculationErrorKind.EMPTY_INPUT, message);
    }

    public static CalculationException invalidItem(String message) {
        return new CalculationException(CalculationErrorKind.INVALID_ITEM, message);
    }

    public static CalculationException zeroSubtotal() {
        return new CalculationException(CalculationErrorKind.ZERO_SUBTOTAL, "Subtotal cannot be zero");
    }

    public static CalculationException invalidRate(String message) {
        return new CalculationException(CalculationErrorKind.INVALID_RATE, message);
    }

    public static CalculationException verificationFailed(String message, BigDecimal discrepancy) {
        return new CalculationException(CalculationErrorKind.VERIFICATION_FAILED, message, discrepancy);
    }
}
