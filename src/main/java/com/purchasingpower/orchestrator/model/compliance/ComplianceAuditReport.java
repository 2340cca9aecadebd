package com.purchasingpower.orchestrator.model.compliance;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregated compliance figures over a time window.
 */
@Value
@Builder
public class ComplianceAuditReport {

    Instant from;

    Instant to;

    long totalChecks;

    long totalActions;

    long validatedActions;

    long totalViolations;

    /**
     * validatedActions / totalActions, 1.0 when nothing was checked
     */
    double complianceRate;

    Map<String, Long> violationsByAgent;

    Map<String, Long> violationsByType;

    @Builder.Default
    Instant generatedAt = Instant.now();
}
