package com.purchasingpower.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.orchestrator.model.audit.AuditEntry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes audit entries as single-line JSON to the {@code AUDIT} logger.
 * Route that logger to durable storage in logback-spring.xml.
 */
@Component
@RequiredArgsConstructor
public class LoggingAuditSink implements AuditSink {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    private final ObjectMapper objectMapper;

    @Override
    public void record(AuditEntry entry) {
        try {
            AUDIT.info(objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize audit entry " + entry.subjectId(), e);
        }
    }
}
