package com.auctionflow.settlement.service.premium;

import com.auctionflow.settlement.config.CalculationDefaults;
import com.auctionflow.settlement.config.MonetaryContext;
import com.auctionflow.settlement.model.PremiumTier;
import com.auctionflow.settlement.service.RateBounds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the buyer's premium, either flat or from a subtotal-indexed tier table.
 *
 * TIER SELECTION:
 * - Tiers are sorted ascending by min amount (stable, so equal minimums keep caller order)
 * - The first tier whose [min, max) range contains the subtotal wins
 * - No match falls back to the default flat rate and reports no applied tier
 */
@Service
@Slf4j
public class PremiumCalculator {

    private final MonetaryContext money;
    private final BigDecimal defaultRate;

    public PremiumCalculator(MonetaryContext money, CalculationDefaults defaults) {
        this.money = money;
        this.defaultRate = defaults.premiumRate();
    }

    /**
     * @param subtotal unrounded subtotal
     * @param flatRate caller's flat rate, or null for the default
     * @param tiers tier table; null or empty selects flat mode
     * @throws com.auctionflow.settlement.exception.CalculationException INVALID_RATE
     */
    public PremiumResult calculate(BigDecimal subtotal, BigDecimal flatRate, List<PremiumTier> tiers) {
        // A bad flat rate is rejected even when tiers override it
        if (flatRate != null) {
            RateBounds.requireValid("buyer's premium rate", flatRate);
        }

        if (tiers != null && !tiers.isEmpty()) {
            return calculateTiered(subtotal, tiers);
        }

        BigDecimal rate = flatRate != null ? flatRate : defaultRate;
        return new PremiumResult(money.round(money.multiply(subtotal, rate)), rate, null);
    }

    private PremiumResult calculateTiered(BigDecimal subtotal, List<PremiumTier> tiers) {
        tiers.forEach(tier -> RateBounds.requireValid(
                "premium tier rate (tier: " + tier.id() + ")", tier.rate()));

        Optional<PremiumTier> match = findTier(subtotal, tiers);
        if (match.isPresent()) {
            PremiumTier tier = match.get();
            log.debug("Premium tier {} ({}) applies to subtotal {} at rate {}",
                    tier.id(), tier.name(), subtotal.toPlainString(), tier.rate());
            return new PremiumResult(money.round(money.multiply(subtotal, tier.rate())), tier.rate(), tier);
        }

        log.warn("Premium tier gap: no tier covers subtotal {}, falling back to default rate {}",
                subtotal.toPlainString(), defaultRate);
        return new PremiumResult(money.round(money.multiply(subtotal, defaultRate)), defaultRate, null);
    }

    /**
     * Lowest-bracket tier containing the subtotal.
     */
    public Optional<PremiumTier> findTier(BigDecimal subtotal, List<PremiumTier> tiers) {
        return tiers.stream()
                .sorted(Comparator.comparing(PremiumTier::lowerBound))
                .filter(tier -> tier.contains(subtotal))
                .findFirst();
    }
}
