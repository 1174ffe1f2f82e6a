package com.auctionflow.settlement.service.checksum;

import com.auctionflow.settlement.config.MonetaryContext;
import com.auctionflow.settlement.model.CalculationTotals;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Deterministic fingerprint of a calculation's final figures.
 *
 * The figures are rendered at exactly two decimal places, joined with the currency
 * as "subtotal|premium|tax|grand|CCY", and hashed with a 32-bit polynomial rolling
 * hash (h = 31h + c). The unsigned hash is written in base 36, zero-padded to
 * {@value #LENGTH} characters.
 *
 * This is an integrity fingerprint for audit correlation, not a security control:
 * anyone can recompute it for altered figures.
 */
@Service
public class ChecksumGenerator {

    public static final int LENGTH = 7;
    private static final int RADIX = 36;

    private final MonetaryContext money;

    public ChecksumGenerator(MonetaryContext money) {
        this.money = money;
    }

    public String generate(CalculationTotals totals, String currency) {
        return encode(rollingHash(canonicalForm(totals, currency)));
    }

    public boolean matches(CalculationTotals totals, String currency, String checksum) {
        return checksum != null && generate(totals, currency).equals(checksum);
    }

    /**
     * The exact string the checksum is computed over.
     */
    public String canonicalForm(CalculationTotals totals, String currency) {
        return String.join("|",
                money.format(totals.subtotal()),
                money.format(totals.buyersPremiumAmount()),
                money.format(totals.taxAmount()),
                money.format(totals.grandTotal()),
                currency.toUpperCase(Locale.ROOT));
    }

    static int rollingHash(String input) {
        int hash = 0;
        for (int i = 0; i < input.length(); i++) {
            hash = 31 * hash + input.charAt(i);
        }
        return hash;
    }

    static String encode(int hash) {
        String digits = Long.toString(Integer.toUnsignedLong(hash), RADIX);
        StringBuilder padded = new StringBuilder(LENGTH);
        for (int i = digits.length(); i < LENGTH; i++) {
            padded.append('0');
        }
        return padded.append(digits).toString();
    }
}
