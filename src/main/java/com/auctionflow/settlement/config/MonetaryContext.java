package com.auctionflow.settlement.config;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Decimal arithmetic rules for every monetary calculation.
 *
 * Intermediate arithmetic runs at the working precision with banker's rounding.
 * Values are only brought to the presentation scale through {@link #round(BigDecimal)},
 * which callers invoke at output boundaries.
 *
 * Instances are immutable and passed explicitly, so differently configured contexts
 * can coexist in one JVM.
 */
public record MonetaryContext(MathContext mathContext, int scale) {

    public static final int MIN_PRECISION = 28;
    public static final int DEFAULT_SCALE = 2;

    public MonetaryContext {
        Objects.requireNonNull(mathContext, "mathContext");
        if (mathContext.getPrecision() < MIN_PRECISION) {
            throw new IllegalArgumentException(
                    "Working precision must be at least " + MIN_PRECISION + " digits, got " + mathContext.getPrecision());
        }
        if (mathContext.getRoundingMode() != RoundingMode.HALF_EVEN) {
            throw new IllegalArgumentException("Monetary rounding must be HALF_EVEN, got " + mathContext.getRoundingMode());
        }
        if (scale < 0) {
            throw new IllegalArgumentException("Scale must not be negative: " + scale);
        }
    }

    /**
     * 28 significant digits, HALF_EVEN, two decimal places.
     */
    public static MonetaryContext standard() {
        return withPrecision(MIN_PRECISION);
    }

    public static MonetaryContext withPrecision(int precision) {
        return new MonetaryContext(new MathContext(precision, RoundingMode.HALF_EVEN), DEFAULT_SCALE);
    }

    public RoundingMode roundingMode() {
        return mathContext.getRoundingMode();
    }

    public BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return left.multiply(right, mathContext);
    }

    public BigDecimal add(BigDecimal left, BigDecimal right) {
        return left.add(right, mathContext);
    }

    public BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return left.subtract(right, mathContext);
    }

    /**
     * Round to the presentation scale. The only place amounts lose precision.
     */
    public BigDecimal round(BigDecimal value) {
        return value.setScale(scale, mathContext.getRoundingMode());
    }

    /**
     * Fixed-point rendering at the presentation scale, never in scientific notation.
     */
    public String format(BigDecimal value) {
        return round(value).toPlainString();
    }
}
