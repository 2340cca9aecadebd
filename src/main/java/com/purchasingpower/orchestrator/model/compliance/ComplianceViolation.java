package com.purchasingpower.orchestrator.model.compliance;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class ComplianceViolation {

    public static final String UNVALIDATED_ACTION = "UnvalidatedAction";
    public static final String SEVERITY_CRITICAL = "Critical";

    @Builder.Default
    String violationId = UUID.randomUUID().toString();

    String agentId;

    String actionId;

    String actionType;

    @Builder.Default
    String violationType = UNVALIDATED_ACTION;

    String description;

    @Builder.Default
    String severity = SEVERITY_CRITICAL;

    @Builder.Default
    Instant detectedAt = Instant.now();

    String traceId;

    @Builder.Default
    Map<String, Object> context = Map.of();
}
