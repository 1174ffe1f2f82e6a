package com.auctionflow.settlement.service.verification;

import com.auctionflow.settlement.config.CalculationDefaults;
import com.auctionflow.settlement.model.CalculationTotals;
import com.auctionflow.settlement.model.VerificationOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for AccuracyVerifier.
 *
 * Tests verify:
 * - consistent totals pass
 * - tolerance is inclusive at one cent
 * - tampered or negative figures fail with a message naming the check
 */
class AccuracyVerifierTest {

    private final AccuracyVerifier verifier = new AccuracyVerifier(CalculationDefaults.standard());

    @Test
    @DisplayName("Should accept consistent totals")
    void shouldAcceptConsistentTotals() {
        VerificationOutcome outcome = verifier.verify(totals("100.00", "10.00", "9.35", "119.35"));

        assertThat(outcome.accurate()).isTrue();
        assertThat(outcome.error()).isNull();
    }

    @Test
    @DisplayName("Should accept a one-cent rounding difference")
    void shouldAcceptDifferenceWithinTolerance() {
        assertThat(verifier.verify(totals("100.00", "10.00", "9.35", "119.36")).accurate()).isTrue();
        assertThat(verifier.verify(totals("100.00", "10.00", "9.35", "119.34")).accurate()).isTrue();
    }

    @Test
    @DisplayName("Should catch a grand total altered beyond tolerance")
    void shouldDetectTamperedGrandTotal() {
        VerificationOutcome outcome = verifier.verify(totals("100.00", "10.00", "9.35", "119.37"));

        assertThat(outcome.accurate()).isFalse();
        assertThat(outcome.error()).contains("Reconciliation check failed");
        assertThat(outcome.discrepancy()).isEqualByComparingTo("0.02");
    }

    @Test
    @DisplayName("Should reject a negative component")
    void shouldRejectNegativeComponent() {
        VerificationOutcome outcome = verifier.verify(totals("100.00", "-10.00", "9.35", "99.35"));

        assertThat(outcome.accurate()).isFalse();
        assertThat(outcome.error()).contains("Non-negativity").contains("buyers_premium_amount");
    }

    @Test
    @DisplayName("Should check non-negativity before reconciliation")
    void shouldCheckSignsFirst() {
        VerificationOutcome outcome = verifier.verify(totals("100.00", "10.00", "-1.00", "500.00"));

        assertThat(outcome.error()).startsWith("Non-negativity").contains("tax_amount");
    }

    @Test
    @DisplayName("Should reject missing figures")
    void shouldRejectMissingFigure() {
        VerificationOutcome outcome = verifier.verify(new CalculationTotals(
                new BigDecimal("100.00"), new BigDecimal("10.00"), new BigDecimal("9.35"), null));

        assertThat(outcome.accurate()).isFalse();
        assertThat(outcome.error()).contains("grand_total");
    }

    @Test
    @DisplayName("Should honour a configured tolerance")
    void shouldUseConfiguredTolerance() {
        AccuracyVerifier strict = new AccuracyVerifier(new CalculationDefaults(
                "USD", new BigDecimal("0.10"), new BigDecimal("0.085"), BigDecimal.ZERO));

        assertThat(strict.verify(totals("100.00", "10.00", "9.35", "119.36")).accurate()).isFalse();
        assertThat(strict.verify(totals("100.00", "10.00", "9.35", "119.35")).accurate()).isTrue();
    }

    private CalculationTotals totals(String subtotal, String premium, String tax, String grandTotal) {
        return new CalculationTotals(new BigDecimal(subtotal), new BigDecimal(premium),
                new BigDecimal(tax), new BigDecimal(grandTotal));
    }
}
