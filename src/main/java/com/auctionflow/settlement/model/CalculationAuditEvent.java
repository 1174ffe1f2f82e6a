package com.auctionflow.settlement.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One audit record per calculation attempt, successful or not.
 * Figures and checksum are set on success; errorKind and errorMessage on failure.
 */
public record CalculationAuditEvent(
    String eventType,
    String entityType,
    String correlationId,
    Instant occurredAt,
    long durationMs,
    Outcome outcome,
    InputSummary inputs,
    CalculationTotals totals,
    String currency,
    String checksum,
    String errorKind,
    String errorMessage
) {

    public static final String CALCULATION_PERFORMED = "calculation_performed";
    public static final String ENTITY_TYPE = "invoice_calculation";

    public enum Outcome { SUCCEEDED, FAILED }

    /**
     * What went in, without the item details.
     */
    public record InputSummary(
        int itemCount,
        BigDecimal buyersPremiumRate,
        BigDecimal taxRate,
        boolean tieredPremium
    ) {

        public static InputSummary of(CalculationInputs inputs) {
            if (inputs == null) {
                return new InputSummary(0, null, null, false);
            }
            return new InputSummary(inputs.itemCount(), inputs.buyersPremiumRate(), inputs.taxRate(), inputs.usesTiers());
        }
    }

    public static CalculationAuditEvent succeeded(String correlationId, long durationMs,
                                                  CalculationInputs inputs, CalculationResult result) {
        return new CalculationAuditEvent(CALCULATION_PERFORMED, ENTITY_TYPE, correlationId, Instant.now(),
                durationMs, Outcome.SUCCEEDED, InputSummary.of(inputs), result.totals(),
                result.currency(), result.checksum(), null, null);
    }

    public static CalculationAuditEvent failed(String correlationId, long durationMs,
                                               CalculationInputs inputs, String errorKind, String errorMessage) {
        return new CalculationAuditEvent(CALCULATION_PERFORMED, ENTITY_TYPE, correlationId, Instant.now(),
                durationMs, Outcome.FAILED, InputSummary.of(inputs), null, null, null, errorKind, errorMessage);
    }
}
