package com.auctionflow.settlement.service.premium;

import com.auctionflow.settlement.config.CalculationDefaults;
import com.auctionflow.settlement.config.MonetaryContext;
import com.auctionflow.settlement.exception.CalculationErrorKind;
import com.auctionflow.settlement.exception.CalculationException;
import com.auctionflow.settlement.model.PremiumTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PremiumCalculator.
 *
 * Tests verify:
 * - flat rate and default rate handling
 * - tier selection, boundaries, ordering and gap fallback
 * - rate validation in both modes
 */
class PremiumCalculatorTest {

    private PremiumCalculator calculator;

    private final List<PremiumTier> standardTiers = List.of(
            tier("T1", "0", "1000", "0.15"),
            tier("T2", "1000", "5000", "0.12"),
            tier("T3", "5000", null, "0.10"));

    @BeforeEach
    void setUp() {
        calculator = new PremiumCalculator(MonetaryContext.standard(), CalculationDefaults.standard());
    }

    @Test
    @DisplayName("Should apply flat rate and round to two places")
    void shouldApplyFlatRate() {
        PremiumResult result = calculator.calculate(new BigDecimal("100.00"), new BigDecimal("0.10"), null);

        assertThat(result.amount()).isEqualByComparingTo("10.00");
        assertThat(result.amount().scale()).isEqualTo(2);
        assertThat(result.appliedRate()).isEqualByComparingTo("0.10");
        assertThat(result.appliedTier()).isNull();
    }

    @Test
    @DisplayName("Should use the default rate when none is supplied")
    void shouldUseDefaultRate() {
        PremiumResult result = calculator.calculate(new BigDecimal("200.00"), null, List.of());

        assertThat(result.amount()).isEqualByComparingTo("20.00");
        assertThat(result.appliedRate()).isEqualByComparingTo("0.10");
    }

    @Test
    @DisplayName("Should honour an explicit zero rate")
    void shouldHonourZeroRate() {
        PremiumResult result = calculator.calculate(new BigDecimal("200.00"), BigDecimal.ZERO, null);

        assertThat(result.amount()).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("Should round half to even")
    void shouldUseBankersRounding() {
        // 1.025 -> 1.02, 1.035 -> 1.04
        assertThat(calculator.calculate(new BigDecimal("10.25"), new BigDecimal("0.10"), null).amount())
                .isEqualByComparingTo("1.02");
        assertThat(calculator.calculate(new BigDecimal("10.35"), new BigDecimal("0.10"), null).amount())
                .isEqualByComparingTo("1.04");
    }

    @Test
    @DisplayName("Should reject flat rates outside [0, 1]")
    void shouldRejectInvalidFlatRate() {
        assertInvalidRate(() -> calculator.calculate(new BigDecimal("100"), new BigDecimal("1.01"), null));
        assertInvalidRate(() -> calculator.calculate(new BigDecimal("100"), new BigDecimal("-0.01"), null));
    }

    @Test
    @DisplayName("Should pick the tier containing the subtotal")
    void shouldSelectMatchingTier() {
        PremiumResult low = calculator.calculate(new BigDecimal("500.00"), null, standardTiers);
        PremiumResult high = calculator.calculate(new BigDecimal("10000.00"), null, standardTiers);

        assertThat(low.amount()).isEqualByComparingTo("75.00");
        assertThat(low.appliedTier().id()).isEqualTo("T1");
        assertThat(high.amount()).isEqualByComparingTo("1000.00");
        assertThat(high.appliedTier().id()).isEqualTo("T3");
    }

    @Test
    @DisplayName("Should treat min as inclusive and max as exclusive")
    void shouldRespectTierBoundaries() {
        PremiumResult atBoundary = calculator.calculate(new BigDecimal("1000.00"), null, standardTiers);
        PremiumResult justBelow = calculator.calculate(new BigDecimal("999.99"), null, standardTiers);

        assertThat(atBoundary.appliedTier().id()).isEqualTo("T2");
        assertThat(atBoundary.amount()).isEqualByComparingTo("120.00");
        assertThat(justBelow.appliedTier().id()).isEqualTo("T1");
    }

    @Test
    @DisplayName("Should sort tiers before matching")
    void shouldSortUnorderedTiers() {
        List<PremiumTier> shuffled = List.of(standardTiers.get(2), standardTiers.get(0), standardTiers.get(1));

        PremiumResult result = calculator.calculate(new BigDecimal("2500.00"), null, shuffled);

        assertThat(result.appliedTier().id()).isEqualTo("T2");
        assertThat(result.amount()).isEqualByComparingTo("300.00");
    }

    @Test
    @DisplayName("Should keep caller order for tiers with equal minimums")
    void shouldBreakTiesByInputOrder() {
        List<PremiumTier> overlapping = List.of(
                tier("A", "0", null, "0.05"),
                tier("B", "0", "1000", "0.20"));

        PremiumResult result = calculator.calculate(new BigDecimal("100.00"), null, overlapping);

        assertThat(result.appliedTier().id()).isEqualTo("A");
        assertThat(result.amount()).isEqualByComparingTo("5.00");
    }

    @Test
    @DisplayName("Should fall back to the default rate when no tier matches")
    void shouldFallBackOnTierGap() {
        List<PremiumTier> gapped = List.of(
                tier("LOW", "0", "100", "0.20"),
                tier("HIGH", "200", null, "0.05"));

        PremiumResult result = calculator.calculate(new BigDecimal("150.00"), null, gapped);

        assertThat(result.appliedTier()).isNull();
        assertThat(result.isTiered()).isFalse();
        assertThat(result.appliedRate()).isEqualByComparingTo("0.10");
        assertThat(result.amount()).isEqualByComparingTo("15.00");
    }

    @Test
    @DisplayName("Should let tiers take precedence over the flat rate")
    void shouldPreferTiersOverFlatRate() {
        List<PremiumTier> single = List.of(tier("ALL", "0", null, "0.20"));

        PremiumResult result = calculator.calculate(new BigDecimal("100.00"), new BigDecimal("0.50"), single);

        assertThat(result.appliedRate()).isEqualByComparingTo("0.20");
        assertThat(result.amount()).isEqualByComparingTo("20.00");
    }

    @Test
    @DisplayName("Should still reject an invalid flat rate when tiers are supplied")
    void shouldRejectInvalidFlatRateWithTiers() {
        assertInvalidRate(() -> calculator.calculate(new BigDecimal("100"), new BigDecimal("2"), standardTiers));
    }

    @Test
    @DisplayName("Should reject a tier rate outside [0, 1]")
    void shouldRejectInvalidTierRate() {
        List<PremiumTier> tiers = List.of(tier("BAD", "0", null, "1.5"));

        assertInvalidRate(() -> calculator.calculate(new BigDecimal("100"), null, tiers));
    }

    @Test
    @DisplayName("Single unbounded tier should equal flat mode at the same rate")
    void singleTierShouldMatchFlatMode() {
        BigDecimal rate = new BigDecimal("0.175");
        BigDecimal subtotal = new BigDecimal("1234.567");

        PremiumResult flat = calculator.calculate(subtotal, rate, null);
        PremiumResult tiered = calculator.calculate(subtotal, null, List.of(tier("ALL", "0", null, "0.175")));

        assertThat(tiered.amount()).isEqualTo(flat.amount());
    }

    private void assertInvalidRate(org.assertj.core.api.ThrowableAssert.ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(CalculationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CalculationErrorKind.INVALID_RATE));
    }

    private static PremiumTier tier(String id, String min, String max, String rate) {
        return new PremiumTier(id, "Tier " + id,
                new BigDecimal(min),
                max != null ? new BigDecimal(max) : null,
                new BigDecimal(rate));
    }
}
