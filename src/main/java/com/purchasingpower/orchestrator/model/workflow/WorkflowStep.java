package com.purchasingpower.orchestrator.model.workflow;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only history entry of a workflow.
 */
@Value
@Builder
public class WorkflowStep {
    String stepName;
    String agentId;
    boolean completed;
    String result;
    String errorMessage;
    Instant completedAt;
}
