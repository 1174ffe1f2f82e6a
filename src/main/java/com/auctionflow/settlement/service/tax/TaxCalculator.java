package com.auctionflow.settlement.service.tax;

import com.auctionflow.settlement.config.CalculationDefaults;
import com.auctionflow.settlement.config.MonetaryContext;
import com.auctionflow.settlement.service.RateBounds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Tax on subtotal plus buyer's premium.
 */
@Service
@Slf4j
public class TaxCalculator {

    private final MonetaryContext money;
    private final BigDecimal defaultRate;

    public TaxCalculator(MonetaryContext money, CalculationDefaults defaults) {
        this.money = money;
        this.defaultRate = defaults.taxRate();
    }

    /**
     * @param subtotal unrounded subtotal
     * @param premiumAmount rounded premium amount
     * @param rate caller's tax rate, or null for the default
     * @throws com.auctionflow.settlement.exception.CalculationException INVALID_RATE
     */
    public TaxResult calculate(BigDecimal subtotal, BigDecimal premiumAmount, BigDecimal rate) {
        BigDecimal taxRate = rate != null ? RateBounds.requireValid("tax rate", rate) : defaultRate;

        BigDecimal taxableAmount = money.add(subtotal, premiumAmount);
        BigDecimal amount = money.round(money.multiply(taxableAmount, taxRate));

        log.debug("Tax {} on base {} at rate {}", amount, taxableAmount.toPlainString(), taxRate);
        return new TaxResult(amount, taxRate, taxableAmount);
    }
}
