package com.purchasingpower.orchestrator.model.compliance;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Compliance verdict for all actions attached to one agent response.
 * Computed on demand and never persisted here.
 */
@Value
@Builder
public class ComplianceValidationResult {

    String traceId;

    String agentId;

    int totalActions;

    int validatedActions;

    int unvalidatedActions;

    @Builder.Default
    List<ComplianceViolation> violations = List.of();

    boolean compliant;

    @Builder.Default
    Instant checkedAt = Instant.now();
}
