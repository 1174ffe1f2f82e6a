package com.auctionflow.settlement.config;

import com.auctionflow.settlement.exception.CalculationErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Calculation engine metrics.
 *
 * Key metrics:
 * - calculation.time                 → wall-clock time per compute call
 * - calculation.total                → all compute calls
 * - calculation.success              → verified results returned
 * - calculation.failed{kind=...}     → failures by error kind, UNEXPECTED for anything else
 * - calculation.verification.failed  → results rejected by the accuracy verifier
 * - audit.publish.failed             → audit events that could not be delivered
 *
 * View at: http://localhost:8080/actuator/metrics
 */
@Component
@Getter
public class AppMetrics {

    public static final String UNEXPECTED = "UNEXPECTED";

    private final Timer calculationTimer;
    private final Counter calculationsTotalCounter;
    private final Counter calculationsSuccessCounter;
    private final Counter verificationFailedCounter;
    private final Counter auditFailedCounter;
    private final Counter unexpectedFailedCounter;
    private final Map<CalculationErrorKind, Counter> failureCounters = new EnumMap<>(CalculationErrorKind.class);

    public AppMetrics(MeterRegistry registry) {
        this.calculationTimer = Timer.builder("calculation.time")
                .description("Settlement calculation time")
                .register(registry);

        this.calculationsTotalCounter = Counter.builder("calculation.total")
                .description("Total calculations (success + failed)")
                .register(registry);

        this.calculationsSuccessCounter = Counter.builder("calculation.success")
                .description("Calculations that produced a verified result")
                .register(registry);

        this.verificationFailedCounter = Counter.builder("calculation.verification.failed")
                .description("Calculations rejected by the accuracy verifier")
                .register(registry);

        this.auditFailedCounter = Counter.builder("audit.publish.failed")
                .description("Audit events that failed to publish")
                .register(registry);

        this.unexpectedFailedCounter = Counter.builder("calculation.failed")
                .description("Failed calculations by error kind")
                .tag("kind", UNEXPECTED)
                .register(registry);

        for (CalculationErrorKind kind : CalculationErrorKind.values()) {
            failureCounters.put(kind, Counter.builder("calculation.failed")
                    .description("Failed calculations by error kind")
                    .tag("kind", kind.name())
                    .register(registry));
        }
    }

    public void recordCalculationTime(long millis) {
        calculationTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementSuccess() {
        calculationsTotalCounter.increment();
        calculationsSuccessCounter.increment();
    }

    public void incrementFailure(CalculationErrorKind kind) {
        calculationsTotalCounter.increment();
        failureCounters.get(kind).increment();
        if (kind == CalculationErrorKind.VERIFICATION_FAILED) {
            verificationFailedCounter.increment();
        }
    }

    public void incrementUnexpectedFailure() {
        calculationsTotalCounter.increment();
        unexpectedFailedCounter.increment();
    }

    public void incrementAuditFailures() {
        auditFailedCounter.increment();
    }

    public double failureCount() {
        return failureCounters.values().stream().mapToDouble(Counter::count).sum() + unexpectedFailedCounter.count();
    }

    public double failureCount(CalculationErrorKind kind) {
        return failureCounters.get(kind).count();
    }
}
