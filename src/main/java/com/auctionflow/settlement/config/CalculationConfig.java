package com.auctionflow.settlement.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Calculation engine configuration.
 *
 * Default rates apply only when the caller leaves a rate out.
 * They are plain values here; the engine never looks rates up at runtime.
 */
@Configuration
@Slf4j
public class CalculationConfig {

    @Value("${app.calculation.precision:28}")
    private int precision;

    @Value("${app.calculation.currency:USD}")
    private String currency;

    @Value("${app.calculation.default-premium-rate:0.10}")
    private BigDecimal defaultPremiumRate;

    @Value("${app.calculation.default-tax-rate:0.085}")
    private BigDecimal defaultTaxRate;

    @Value("${app.calculation.verification-tolerance:0.01}")
    private BigDecimal verificationTolerance;

    @Bean
    public MonetaryContext monetaryContext() {
        log.info("Creating monetary context: precision={}, rounding=HALF_EVEN, scale={}",
                precision, MonetaryContext.DEFAULT_SCALE);
        return MonetaryContext.withPrecision(precision);
    }

    @Bean
    public CalculationDefaults calculationDefaults() {
        CalculationDefaults defaults = new CalculationDefaults(
                currency, defaultPremiumRate, defaultTaxRate, verificationTolerance);
        log.info("Calculation defaults: currency={}, premiumRate={}, taxRate={}, tolerance={}",
                defaults.currency(), defaults.premiumRate(), defaults.taxRate(), defaults.verificationTolerance());
        return defaults;
    }
}
