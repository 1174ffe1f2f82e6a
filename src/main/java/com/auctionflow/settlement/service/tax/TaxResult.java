package com.auctionflow.settlement.service.tax;

import java.math.BigDecimal;

/**
 * Rounded tax amount, the rate applied and the unrounded taxable base.
 */
public record TaxResult(
    BigDecimal amount,
    BigDecimal appliedRate,
    BigDecimal taxableAmount
) {}
