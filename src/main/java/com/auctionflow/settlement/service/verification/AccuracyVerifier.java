package com.auctionflow.settlement.service.verification;

import com.auctionflow.settlement.config.CalculationDefaults;
import com.auctionflow.settlement.model.CalculationTotals;
import com.auctionflow.settlement.model.VerificationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Independently re-derives the grand total from its components.
 *
 * Checks, in order, stopping at the first violation:
 * 1. every figure is present and non-negative
 * 2. |subtotal + premium + tax - grand total| is within tolerance
 *
 * Works on any set of totals, including ones read back from storage.
 */
@Service
@Slf4j
public class AccuracyVerifier {

    private final BigDecimal tolerance;

    public AccuracyVerifier(CalculationDefaults defaults) {
        this.tolerance = defaults.verificationTolerance();
    }

    public VerificationOutcome verify(CalculationTotals totals) {
        if (totals == null) {
            return VerificationOutcome.failed("Totals are missing", null);
        }

        Map<String, BigDecimal> figures = new LinkedHashMap<>();
        figures.put("subtotal", totals.subtotal());
        figures.put("buyers_premium_amount", totals.buyersPremiumAmount());
        figures.put("tax_amount", totals.taxAmount());
        figures.put("grand_total", totals.grandTotal());

        for (Map.Entry<String, BigDecimal> figure : figures.entrySet()) {
            if (figure.getValue() == null) {
                return VerificationOutcome.failed("Non-negativity check failed: " + figure.getKey() + " is missing", null);
            }
            if (figure.getValue().signum() < 0) {
                return VerificationOutcome.failed(
                        "Non-negativity check failed: " + figure.getKey() + " is " + figure.getValue().toPlainString(),
                        figure.getValue());
            }
        }

        BigDecimal expected = totals.subtotal().add(totals.buyersPremiumAmount()).add(totals.taxAmount());
        BigDecimal discrepancy = expected.subtract(totals.grandTotal()).abs();
        if (discrepancy.compareTo(tolerance) > 0) {
            log.warn("Reconciliation check failed: components sum to {} but grand total is {}",
                    expected.toPlainString(), totals.grandTotal().toPlainString());
            return VerificationOutcome.failed(String.format(
                    "Reconciliation check failed: subtotal + premium + tax = %s, grand_total = %s, discrepancy %s exceeds tolerance %s",
                    expected.toPlainString(), totals.grandTotal().toPlainString(),
                    discrepancy.toPlainString(), tolerance.toPlainString()),
                    discrepancy);
        }

        return VerificationOutcome.passed();
    }
}
