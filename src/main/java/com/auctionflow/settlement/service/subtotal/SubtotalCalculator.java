package com.auctionflow.settlement.service.subtotal;

import com.auctionflow.settlement.config.MonetaryContext;
import com.auctionflow.settlement.exception.CalculationException;
import com.auctionflow.settlement.model.LineItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Sums quantity x unit price over the line items.
 *
 * Line totals and the running sum are exact; the sum is brought to the working
 * precision once at the end, so the result does not depend on item order.
 */
@Service
@Slf4j
public class SubtotalCalculator {

    private final MonetaryContext money;

    public SubtotalCalculator(MonetaryContext money) {
        this.money = money;
    }

    /**
     * @return unrounded subtotal
     * @throws CalculationException EMPTY_INPUT, INVALID_ITEM or ZERO_SUBTOTAL
     */
    public BigDecimal calculate(List<LineItem> items) {
        if (items == null || items.isEmpty()) {
            throw CalculationException.emptyInput("At least one item is required for calculation");
        }

        BigDecimal subtotal = BigDecimal.ZERO;
        for (int i = 0; i < items.size(); i++) {
            LineItem item = items.get(i);
            validate(item, i);
            subtotal = subtotal.add(lineTotal(item));
        }

        subtotal = subtotal.round(money.mathContext());
        if (subtotal.signum() == 0) {
            throw CalculationException.zeroSubtotal();
        }

        log.debug("Subtotal over {} items: {}", items.size(), subtotal.toPlainString());
        return subtotal;
    }

    /**
     * Exact quantity x unit price.
     */
    public BigDecimal lineTotal(LineItem item) {
        return item.unitPrice().multiply(BigDecimal.valueOf(item.quantity()));
    }

    private void validate(LineItem item, int index) {
        if (item == null) {
            throw CalculationException.invalidItem("Item " + (index + 1) + " is missing");
        }
        if (item.quantity() <= 0 || item.unitPrice() == null || item.unitPrice().signum() < 0) {
            throw CalculationException.invalidItem(String.format(
                    "Invalid item data: quantity must be positive and unit_price non-negative (lot: %s, quantity: %d, unit_price: %s)",
                    item.lotId(), item.quantity(), item.unitPrice()));
        }
    }
}
