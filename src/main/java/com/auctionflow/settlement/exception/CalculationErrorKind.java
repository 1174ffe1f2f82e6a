package com.auctionflow.settlement.exception;

/**
 * Why a calculation failed. None of these are transient, so none are retried.
 */
public enum CalculationErrorKind {

    EMPTY_INPUT(true),
    INVALID_ITEM(true),
    ZERO_SUBTOTAL(true),
    INVALID_RATE(true),
    VERIFICATION_FAILED(false);

    private final boolean clientError;

    CalculationErrorKind(boolean clientError) {
        this.clientError = clientError;
    }

    /**
     * True when the caller supplied bad data; false when the engine or its
     * configuration produced an inconsistent result.
     */
    public boolean isClientError() {
        return clientError;
    }
}
