package com.auctionflow.settlement.service;

import com.auctionflow.settlement.config.AppMetrics;
import com.auctionflow.settlement.config.CalculationDefaults;
import com.auctionflow.settlement.config.CorrelationContext;
import com.auctionflow.settlement.config.MonetaryContext;
import com.auctionflow.settlement.exception.CalculationException;
import com.auctionflow.settlement.model.CalculationAuditEvent;
import com.auctionflow.settlement.model.CalculationBreakdown;
import com.auctionflow.settlement.model.CalculationBreakdown.ItemLine;
import com.auctionflow.settlement.model.CalculationBreakdown.PremiumLine;
import com.auctionflow.settlement.model.CalculationBreakdown.TaxLine;
import com.auctionflow.settlement.model.CalculationInputs;
import com.auctionflow.settlement.model.CalculationResult;
import com.auctionflow.settlement.model.CalculationTotals;
import com.auctionflow.settlement.model.LineItem;
import com.auctionflow.settlement.model.VerificationOutcome;
import com.auctionflow.settlement.service.audit.AuditEventPublisher;
import com.auctionflow.settlement.service.checksum.ChecksumGenerator;
import com.auctionflow.settlement.service.premium.PremiumCalculator;
import com.auctionflow.settlement.service.premium.PremiumResult;
import com.auctionflow.settlement.service.subtotal.SubtotalCalculator;
import com.auctionflow.settlement.service.tax.TaxCalculator;
import com.auctionflow.settlement.service.tax.TaxResult;
import com.auctionflow.settlement.service.total.GrandTotalAggregator;
import com.auctionflow.settlement.service.verification.AccuracyVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Sole entry point of the calculation engine.
 *
 * Pipeline: subtotal → premium → tax → grand total → verification → checksum.
 * The first failing stage ends the run; its exception reaches the caller unchanged
 * and no partial result is ever returned.
 *
 * Each compute call emits exactly one audit event. Audit delivery is best-effort:
 * a publisher failure is logged and counted but never alters the outcome.
 */
@Service
@Slf4j
public class CalculationOrchestrator {

    private final SubtotalCalculator subtotalCalculator;
    private final PremiumCalculator premiumCalculator;
    private final TaxCalculator taxCalculator;
    private final GrandTotalAggregator grandTotalAggregator;
    private final AccuracyVerifier accuracyVerifier;
    private final ChecksumGenerator checksumGenerator;
    private final AuditEventPublisher auditPublisher;
    private final MonetaryContext money;
    private final CalculationDefaults defaults;
    private final AppMetrics metrics;

    public CalculationOrchestrator(
            SubtotalCalculator subtotalCalculator,
            PremiumCalculator premiumCalculator,
            TaxCalculator taxCalculator,
            GrandTotalAggregator grandTotalAggregator,
            AccuracyVerifier accuracyVerifier,
            ChecksumGenerator checksumGenerator,
            AuditEventPublisher auditPublisher,
            MonetaryContext money,
            CalculationDefaults defaults,
            AppMetrics metrics) {
        this.subtotalCalculator = subtotalCalculator;
        this.premiumCalculator = premiumCalculator;
        this.taxCalculator = taxCalculator;
        this.grandTotalAggregator = grandTotalAggregator;
        this.accuracyVerifier = accuracyVerifier;
        this.checksumGenerator = checksumGenerator;
        this.auditPublisher = auditPublisher;
        this.money = money;
        this.defaults = defaults;
        this.metrics = metrics;
    }

    /**
     * Compute and verify the totals for one settlement.
     *
     * @throws CalculationException on the first failing stage
     */
    public CalculationResult compute(CalculationInputs inputs) {
        String correlationId = CorrelationContext.currentOrGenerate();
        long startTime = System.currentTimeMillis();

        try {
            CalculationResult result = runPipeline(inputs);
            long elapsed = System.currentTimeMillis() - startTime;

            metrics.recordCalculationTime(elapsed);
            metrics.incrementSuccess();
            log.info("Calculation {} complete in {}ms: {} items, grand total {} {} (checksum {})",
                    correlationId, elapsed, inputs.itemCount(), result.grandTotal(), result.currency(), result.checksum());

            publishQuietly(CalculationAuditEvent.succeeded(correlationId, elapsed, inputs, result));
            return result;
        } catch (CalculationException e) {
            long elapsed = System.currentTimeMillis() - startTime;

            metrics.recordCalculationTime(elapsed);
            metrics.incrementFailure(e.getKind());
            log.warn("Calculation {} failed after {}ms: {} - {}", correlationId, elapsed, e.getKind(), e.getMessage());

            publishQuietly(CalculationAuditEvent.failed(correlationId, elapsed, inputs, e.getKind().name(), e.getMessage()));
            throw e;
        } catch (RuntimeException e) {
            long elapsed = System.currentTimeMillis() - startTime;

            metrics.recordCalculationTime(elapsed);
            metrics.incrementUnexpectedFailure();
            log.error("Calculation {} failed unexpectedly after {}ms", correlationId, elapsed, e);

            publishQuietly(CalculationAuditEvent.failed(correlationId, elapsed, inputs,
                    AppMetrics.UNEXPECTED, e.getClass().getSimpleName() + ": " + e.getMessage()));
            throw e;
        }
    }

    /**
     * Re-check a previously computed or persisted result.
     */
    public VerificationOutcome verify(CalculationResult result) {
        if (result == null) {
            return VerificationOutcome.failed("Result is missing", null);
        }
        return accuracyVerifier.verify(result.totals());
    }

    private CalculationResult runPipeline(CalculationInputs inputs) {
        if (inputs == null || inputs.items() == null) {
            throw CalculationException.emptyInput("Calculation inputs with an item list are required");
        }

        BigDecimal subtotal = subtotalCalculator.calculate(inputs.items());
        PremiumResult premium = premiumCalculator.calculate(subtotal, inputs.buyersPremiumRate(), inputs.premiumTiers());
        TaxResult tax = taxCalculator.calculate(subtotal, premium.amount(), inputs.taxRate());
        BigDecimal grandTotal = grandTotalAggregator.aggregate(subtotal, premium.amount(), tax.amount());

        CalculationTotals totals = new CalculationTotals(
                money.round(subtotal), premium.amount(), tax.amount(), grandTotal);

        VerificationOutcome outcome = accuracyVerifier.verify(totals);
        if (!outcome.accurate()) {
            throw CalculationException.verificationFailed(outcome.error(), outcome.discrepancy());
        }

        String checksum = checksumGenerator.generate(totals, defaults.currency());

        return new CalculationResult(
                totals.subtotal(),
                totals.buyersPremiumAmount(),
                totals.taxAmount(),
                totals.grandTotal(),
                defaults.currency(),
                buildBreakdown(inputs.items(), premium, tax),
                checksum);
    }

    private CalculationBreakdown buildBreakdown(List<LineItem> items, PremiumResult premium, TaxResult tax) {
        List<ItemLine> lines = items.stream()
                .map(item -> new ItemLine(
                        item.lotId(),
                        item.title(),
                        item.quantity(),
                        item.unitPrice(),
                        money.round(subtotalCalculator.lineTotal(item))))
                .toList();

        return new CalculationBreakdown(
                lines,
                new PremiumLine(premium.appliedRate(), premium.amount(), premium.appliedTier()),
                new TaxLine(tax.appliedRate(), tax.taxableAmount(), tax.amount()));
    }

    private void publishQuietly(CalculationAuditEvent event) {
        try {
            auditPublisher.publish(event);
        } catch (RuntimeException e) {
            metrics.incrementAuditFailures();
            log.warn("Failed to publish audit event for calculation {}: {}", event.correlationId(), e.getMessage(), e);
        }
    }
}
