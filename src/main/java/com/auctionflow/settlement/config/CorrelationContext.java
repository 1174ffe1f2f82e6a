package com.auctionflow.settlement.config;

import org.slf4j.MDC;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;

/**
 * Correlation id helper shared by the HTTP filter and the calculation orchestrator.
 * The id lives in the SLF4J MDC so every log line and audit event of a request carries it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID = "correlationId";
    public static final String CORRELATION_HEADER = "X-Correlation-Id";

    private CorrelationContext() {}

    /**
     * Adopt the caller's header, or generate an id, and echo it on the response.
     */
    public static String ensureForHttp(HttpServletRequest request, HttpServletResponse response) {
        String correlationId = request.getHeader(CORRELATION_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = generate();
        }
        MDC.put(CORRELATION_ID, correlationId);

        if (response != null) {
            response.setHeader(CORRELATION_HEADER, correlationId);
        }
        return correlationId;
    }

    /**
     * Current id from MDC, or a fresh one when called outside a request.
     * A fresh id is not stored in MDC.
     */
    public static String currentOrGenerate() {
        String correlationId = MDC.get(CORRELATION_ID);
        return correlationId != null && !correlationId.isBlank() ? correlationId : generate();
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID);
    }
}
