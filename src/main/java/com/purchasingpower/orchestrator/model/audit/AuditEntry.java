package com.purchasingpower.orchestrator.model.audit;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the durable audit trail.
 *
 * @param category    RELEVANCE_CHECK, COMPLIANCE_VIOLATION, APPROVAL...
 * @param traceId     request trace id, may be null
 * @param subjectId   id of the action, violation or approval request
 * @param details     category-specific values
 */
public record AuditEntry(String category, String traceId, String subjectId, Instant timestamp, Map<String, Object> details) {

    public static final String RELEVANCE_CHECK = "RELEVANCE_CHECK";
    public static final String COMPLIANCE_VIOLATION = "COMPLIANCE_VIOLATION";
    public static final String APPROVAL = "APPROVAL";

    public static AuditEntry of(String category, String traceId, String subjectId, Map<String, Object> details) {
        return new AuditEntry(category, traceId, subjectId, Instant.now(), details);
    }
}
