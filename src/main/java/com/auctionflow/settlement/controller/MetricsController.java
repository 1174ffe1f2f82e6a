package com.auctionflow.settlement.controller;

import com.auctionflow.settlement.config.AppMetrics;
import com.auctionflow.settlement.exception.CalculationErrorKind;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * REST endpoint for calculation metrics.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final AppMetrics appMetrics;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("timestamp", Instant.now().toString());
        response.put("calculations", getCalculationMetrics());
        response.put("timing", getTimerStats(appMetrics.getCalculationTimer()));
        response.put("audit_failures", (long) appMetrics.getAuditFailedCounter().count());

        return response;
    }

    @GetMapping("/calculations")
    public Map<String, Object> getCalculationMetrics() {
        Map<String, Object> calculations = new LinkedHashMap<>();

        double total = appMetrics.getCalculationsTotalCounter().count();
        double success = appMetrics.getCalculationsSuccessCounter().count();

        calculations.put("total", (long) total);
        calculations.put("success", (long) success);
        calculations.put("failed", (long) appMetrics.failureCount());

        Map<String, Long> byKind = new LinkedHashMap<>();
        for (CalculationErrorKind kind : CalculationErrorKind.values()) {
            byKind.put(kind.name(), (long) appMetrics.failureCount(kind));
        }
        byKind.put(AppMetrics.UNEXPECTED, (long) appMetrics.getUnexpectedFailedCounter().count());
        calculations.put("failed_by_kind", byKind);

        if (total > 0) {
            calculations.put("success_rate", String.format("%.2f%%", (success / total) * 100));
        } else {
            calculations.put("success_rate", "N/A");
        }

        return calculations;
    }

    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();

        long count = timer.count();
        stats.put("count", count);

        if (count > 0) {
            stats.put("total_time_ms", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avg_time_ms", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("max_time_ms", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("total_time_ms", "0.00");
            stats.put("avg_time_ms", "N/A");
            stats.put("max_time_ms", "N/A");
        }

        return stats;
    }
}
