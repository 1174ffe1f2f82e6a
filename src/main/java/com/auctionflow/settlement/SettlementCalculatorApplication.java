package com.auctionflow.settlement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Settlement Calculator Application.
 *
 * Computes and verifies buyer's premium, tax and grand totals for auction settlements.
 */
@SpringBootApplication
public class SettlementCalculatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SettlementCalculatorApplication.class, args);
    }
}
