package com.purchasingpower.orchestrator.service.compliance;

import com.purchasingpower.orchestrator.exception.ComplianceViolationException;
import com.purchasingpower.orchestrator.model.action.AgentAction;
import com.purchasingpower.orchestrator.model.agent.AgentResponse;
import com.purchasingpower.orchestrator.model.compliance.ComplianceAuditReport;
import com.purchasingpower.orchestrator.model.compliance.ComplianceValidationResult;
import com.purchasingpower.orchestrator.model.compliance.ComplianceViolation;

import java.time.Instant;
import java.util.List;

/**
 * Last gate before an agent response reaches a caller: every attached action must carry
 * validation metadata.
 *
 * <p>An action is validated iff its validation reason is non-empty, its confidence lies in
 * [0, 1] and it either needs no approval or has an approval request id.
 *
 * @since 1.0.0
 */
public interface AgentComplianceChecker {

    boolean isActionValidated(AgentAction action);

    /**
     * Counts compliant and non-compliant actions. Each violation is reported to the audit sink
     * without waiting for the write.
     */
    ComplianceValidationResult validateAgentResponse(AgentResponse response, List<AgentAction> actions, String traceId);

    /**
     * Fire-and-forget. A sink failure is logged locally and never reaches the caller.
     */
    void reportComplianceViolation(ComplianceViolation violation);

    /**
     * @throws ComplianceViolationException when any action is not validated
     */
    ComplianceValidationResult ensureCompliance(AgentResponse response, List<AgentAction> actions, String traceId);

    ComplianceAuditReport generateComplianceAuditReport(Instant from, Instant to);
}
