package com.auctionflow.settlement.model;

import java.math.BigDecimal;

/**
 * A won lot on the settlement: quantity times unit price contributes to the subtotal.
 */
public record LineItem(
    String lotId,
    String title,
    int quantity,
    BigDecimal unitPrice
) {}
