package com.auctionflow.settlement.service.validation;

import com.auctionflow.settlement.model.CalculationInputs;
import com.auctionflow.settlement.model.LineItem;
import com.auctionflow.settlement.model.PremiumTier;
import com.auctionflow.settlement.model.ValidationReport;
import com.auctionflow.settlement.service.RateBounds;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects every problem with a calculation request up front, so a caller can
 * report them all at once instead of fixing one engine failure at a time.
 * Item numbers in messages are 1-based.
 */
@Service
public class CalculationInputValidator {

    public ValidationReport validate(CalculationInputs inputs) {
        List<String> errors = new ArrayList<>();

        if (inputs == null || inputs.items() == null || inputs.items().isEmpty()) {
            errors.add("At least one item is required");
        } else {
            List<LineItem> items = inputs.items();
            for (int i = 0; i < items.size(); i++) {
                validateItem(items.get(i), i + 1, errors);
            }
        }

        if (inputs != null) {
            validateRate(inputs.buyersPremiumRate(), "Buyer's premium rate", errors);
            validateRate(inputs.taxRate(), "Tax rate", errors);
            validateTiers(inputs.premiumTiers(), errors);
        }

        return ValidationReport.of(errors);
    }

    private void validateItem(LineItem item, int number, List<String> errors) {
        if (item == null) {
            errors.add("Item " + number + ": item is missing");
            return;
        }
        if (item.lotId() == null || item.lotId().isBlank()) {
            errors.add("Item " + number + ": lot_id is required");
        }
        if (item.title() == null || item.title().isBlank()) {
            errors.add("Item " + number + ": title is required");
        }
        if (item.quantity() <= 0) {
            errors.add("Item " + number + ": quantity must be greater than 0");
        }
        if (item.unitPrice() == null) {
            errors.add("Item " + number + ": unit_price is required");
        } else if (item.unitPrice().signum() < 0) {
            errors.add("Item " + number + ": unit_price must not be negative");
        }
    }

    private void validateRate(BigDecimal rate, String label, List<String> errors) {
        if (rate != null && !RateBounds.isWithinUnitInterval(rate)) {
            errors.add(label + " must be between 0 and 1");
        }
    }

    private void validateTiers(List<PremiumTier> tiers, List<String> errors) {
        for (PremiumTier tier : tiers) {
            String label = "Premium tier " + (tier.id() != null ? tier.id() : tier.name());
            if (tier.rate() == null || !RateBounds.isWithinUnitInterval(tier.rate())) {
                errors.add(label + ": rate must be between 0 and 1");
            }
            if (tier.maxAmount() != null && tier.maxAmount().compareTo(tier.lowerBound()) <= 0) {
                errors.add(label + ": max_amount must be greater than min_amount");
            }
        }
    }
}
