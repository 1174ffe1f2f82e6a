package com.auctionflow.settlement.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything a calculation needs, already resolved by the caller.
 * Null rates fall back to the configured defaults; a non-empty tier list
 * takes precedence over the flat premium rate. Null tier entries are dropped.
 */
public record CalculationInputs(
    List<LineItem> items,
    BigDecimal buyersPremiumRate,
    BigDecimal taxRate,
    List<PremiumTier> premiumTiers
) {

    public CalculationInputs {
        // Null items are kept; the subtotal calculator rejects them as invalid
        items = items != null ? Collections.unmodifiableList(new ArrayList<>(items)) : null;
        premiumTiers = premiumTiers != null ? premiumTiers.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public static CalculationInputs flat(List<LineItem> items, BigDecimal buyersPremiumRate, BigDecimal taxRate) {
        return new CalculationInputs(items, buyersPremiumRate, taxRate, List.of());
    }

    public static CalculationInputs tiered(List<LineItem> items, List<PremiumTier> tiers, BigDecimal taxRate) {
        return new CalculationInputs(items, null, taxRate, tiers);
    }

    public boolean usesTiers() {
        return !premiumTiers.isEmpty();
    }

    public int itemCount() {
        return items != null ? items.size() : 0;
    }
}
