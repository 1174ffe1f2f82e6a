package com.auctionflow.settlement.service.audit;

import com.auctionflow.settlement.model.CalculationAuditEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Writes audit events as single-line JSON to the AUDIT logger.
 * In production the AUDIT logger is routed to the audit store by the logging backend.
 */
@Service
@Slf4j
public class LoggingAuditEventPublisher implements AuditEventPublisher {

    static final String AUDIT_LOGGER = "AUDIT";

    private static final Logger auditLog = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public LoggingAuditEventPublisher(ObjectMapper objectMapper,
                                      @Value("${app.audit.enabled:true}") boolean enabled) {
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        log.info("Audit publishing {}", enabled ? "ENABLED" : "DISABLED");
    }

    @Override
    public void publish(CalculationAuditEvent event) {
        if (!enabled) {
            log.debug("Audit disabled, dropping {} event {}", event.eventType(), event.correlationId());
            return;
        }
        try {
            auditLog.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize audit event " + event.correlationId(), e);
        }
    }
}
