package com.auctionflow.settlement.service.total;

import com.auctionflow.settlement.config.MonetaryContext;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Grand total = rounded subtotal + premium + tax.
 * The subtotal is rounded here and nowhere earlier.
 */
@Service
public class GrandTotalAggregator {

    private final MonetaryContext money;

    public GrandTotalAggregator(MonetaryContext money) {
        this.money = money;
    }

    public BigDecimal aggregate(BigDecimal subtotal, BigDecimal premiumAmount, BigDecimal taxAmount) {
        BigDecimal sum = money.add(money.add(money.round(subtotal), premiumAmount), taxAmount);
        return money.round(sum);
    }
}
