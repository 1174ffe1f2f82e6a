package com.auctionflow.settlement.model;

import com.auctionflow.settlement.config.MonetaryContext;

import java.math.BigDecimal;
import java.util.List;

/**
 * Wire shape of a calculation result.
 * Monetary figures are strings with exactly two decimal places; unit prices, rates and the
 * taxable base are plain decimal strings.
 */
public record CalculationResponse(
    String subtotal,
    String buyersPremiumAmount,
    String taxAmount,
    String grandTotal,
    String currency,
    String checksum,
    Breakdown breakdown
) {

    public record Breakdown(
        List<Item> items,
        Premium buyersPremium,
        Tax tax
    ) {}

    public record Item(
        String lotId,
        String title,
        int quantity,
        String unitPrice,
        String totalPrice
    ) {}

    public record Premium(
        String rate,
        String amount,
        PremiumTier appliedTier
    ) {}

    public record Tax(
        String rate,
        String taxableAmount,
        String amount
    ) {}

    public static CalculationResponse from(CalculationResult result, MonetaryContext money) {
        CalculationBreakdown breakdown = result.breakdown();
        List<Item> items = breakdown.items().stream()
                .map(line -> new Item(
                        line.lotId(),
                        line.title(),
                        line.quantity(),
                        line.unitPrice().toPlainString(),
                        money.format(line.totalPrice())))
                .toList();

        return new CalculationResponse(
                money.format(result.subtotal()),
                money.format(result.buyersPremiumAmount()),
                money.format(result.taxAmount()),
                money.format(result.grandTotal()),
                result.currency(),
                result.checksum(),
                new Breakdown(
                        items,
                        new Premium(
                                breakdown.buyersPremium().rate().toPlainString(),
                                money.format(breakdown.buyersPremium().amount()),
                                breakdown.buyersPremium().appliedTier()),
                        new Tax(
                                breakdown.tax().rate().toPlainString(),
                                breakdown.tax().taxableAmount().toPlainString(),
                                money.format(breakdown.tax().amount()))));
    }

    /**
     * Parse the four figures back for re-verification.
     *
     * @throws NumberFormatException when a figure is not a decimal number
     */
    public CalculationTotals toTotals() {
        return new CalculationTotals(parse(subtotal), parse(buyersPremiumAmount), parse(taxAmount), parse(grandTotal));
    }

    private static BigDecimal parse(String value) {
        return value != null ? new BigDecimal(value.trim()) : null;
    }
}
