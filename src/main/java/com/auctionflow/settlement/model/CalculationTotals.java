package com.auctionflow.settlement.model;

import java.math.BigDecimal;

/**
 * The four final figures of a calculation, each at presentation scale.
 */
public record CalculationTotals(
    BigDecimal subtotal,
    BigDecimal buyersPremiumAmount,
    BigDecimal taxAmount,
    BigDecimal grandTotal
) {}
