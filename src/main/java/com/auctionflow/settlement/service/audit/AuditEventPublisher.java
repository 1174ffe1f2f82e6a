package com.auctionflow.settlement.service.audit;

import com.auctionflow.settlement.model.CalculationAuditEvent;

/**
 * Sink for calculation audit events.
 *
 * Implementations may throw; the orchestrator treats delivery as best-effort
 * and never lets a publishing failure change a calculation's outcome.
 */
public interface AuditEventPublisher {

    void publish(CalculationAuditEvent event);
}
