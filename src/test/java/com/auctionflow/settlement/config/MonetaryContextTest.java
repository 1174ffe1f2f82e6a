package com.auctionflow.settlement.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonetaryContextTest {

    private final MonetaryContext money = MonetaryContext.standard();

    @Test
    @DisplayName("Should default to 28 digits, HALF_EVEN and two places")
    void shouldUseStandardSettings() {
        assertThat(money.mathContext().getPrecision()).isEqualTo(28);
        assertThat(money.roundingMode()).isEqualTo(RoundingMode.HALF_EVEN);
        assertThat(money.scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should round half to even at the output boundary")
    void shouldRoundHalfEven() {
        assertThat(money.round(new BigDecimal("2.345"))).isEqualTo(new BigDecimal("2.34"));
        assertThat(money.round(new BigDecimal("2.355"))).isEqualTo(new BigDecimal("2.36"));
        assertThat(money.round(new BigDecimal("7"))).isEqualTo(new BigDecimal("7.00"));
    }

    @Test
    @DisplayName("Should not round intermediate arithmetic to the presentation scale")
    void shouldKeepWorkingPrecision() {
        assertThat(money.multiply(new BigDecimal("33.333"), new BigDecimal("0.085")))
                .isEqualByComparingTo("2.833305");
    }

    @Test
    @DisplayName("Should format in plain notation")
    void shouldFormatPlain() {
        assertThat(money.format(new BigDecimal("1E+3"))).isEqualTo("1000.00");
    }

    @Test
    @DisplayName("Should allow independent contexts side by side")
    void shouldAllowCoexistingContexts() {
        MonetaryContext wide = MonetaryContext.withPrecision(50);

        assertThat(wide.mathContext().getPrecision()).isEqualTo(50);
        assertThat(money.mathContext().getPrecision()).isEqualTo(28);
    }

    @Test
    @DisplayName("Should reject precision below 28 and non-banker rounding")
    void shouldRejectWeakConfiguration() {
        assertThatThrownBy(() -> MonetaryContext.withPrecision(16)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MonetaryContext(new MathContext(28, RoundingMode.HALF_UP), 2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
