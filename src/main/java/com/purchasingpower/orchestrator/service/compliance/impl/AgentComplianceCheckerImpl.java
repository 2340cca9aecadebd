package com.purchasingpower.orchestrator.service.compliance.impl;

import com.purchasingpower.orchestrator.client.AuditSink;
import com.purchasingpower.orchestrator.exception.ComplianceViolationException;
import com.purchasingpower.orchestrator.model.action.AgentAction;
import com.purchasingpower.orchestrator.model.agent.AgentResponse;
import com.purchasingpower.orchestrator.model.audit.AuditEntry;
import com.purchasingpower.orchestrator.model.compliance.ComplianceAuditReport;
import com.purchasingpower.orchestrator.model.compliance.ComplianceValidationResult;
import com.purchasingpower.orchestrator.model.compliance.ComplianceViolation;
import com.purchasingpower.orchestrator.service.compliance.AgentComplianceChecker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class AgentComplianceCheckerImpl implements AgentComplianceChecker {

    private static final int HISTORY_CAPACITY = 10_000;

    private final AuditSink auditSink;
    private final Executor executor;

    private final Deque<ComplianceValidationResult> checks = new ArrayDeque<>();
    private final Deque<ComplianceViolation> violations = new ArrayDeque<>();

    public AgentComplianceCheckerImpl(AuditSink auditSink, @Qualifier("validationExecutor") Executor executor) {
        this.auditSink = auditSink;
        this.executor = executor;
    }

    @Override
    public boolean isActionValidated(AgentAction action) {
        if (action == null) {
            return false;
        }
        double confidence = action.getConfidenceScore();
        boolean hasReason = action.getValidationReason() != null && !action.getValidationReason().isEmpty();
        boolean confidenceInRange = confidence >= 0.0 && confidence <= 1.0;
        boolean approvalSatisfied = !action.isRequiresApproval()
                || (action.getApprovalRequestId() != null && !action.getApprovalRequestId().isEmpty());
        return hasReason && confidenceInRange && approvalSatisfied;
    }

    @Override
    public ComplianceValidationResult validateAgentResponse(AgentResponse response, List<AgentAction> actions, String traceId) {
        String agentId = response != null ? response.getAgentId() : null;
        List<AgentAction> checked = actions != null ? actions : List.of();
        List<ComplianceViolation> found = new ArrayList<>();

        for (AgentAction action : checked) {
            if (isActionValidated(action)) {
                continue;
            }
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("validationReason", action != null ? action.getValidationReason() : null);
            context.put("confidenceScore", action != null ? action.getConfidenceScore() : null);
            context.put("requiresApproval", action != null && action.isRequiresApproval());
            context.put("approvalRequestId", action != null ? action.getApprovalRequestId() : null);

            String actionType = action != null ? action.getActionType() : null;
            ComplianceViolation violation = ComplianceViolation.builder()
                    .agentId(action != null && action.getAgentId() != null ? action.getAgentId() : agentId)
                    .actionId(action != null ? action.getId() : null)
                    .actionType(actionType)
                    .violationType(ComplianceViolation.UNVALIDATED_ACTION)
                    .description("Action '" + actionType + "' lacks validation metadata")
                    .severity(ComplianceViolation.SEVERITY_CRITICAL)
                    .traceId(traceId)
                    .context(context)
                    .build();
            found.add(violation);
            reportComplianceViolation(violation);
        }

        ComplianceValidationResult result = ComplianceValidationResult.builder()
                .traceId(traceId)
                .agentId(agentId)
                .totalActions(checked.size())
                .validatedActions(checked.size() - found.size())
                .unvalidatedActions(found.size())
                .violations(List.copyOf(found))
                .compliant(found.isEmpty())
                .build();
        remember(checks, result);

        if (result.isCompliant()) {
            log.debug("✅ [{}] {} actions from {} are compliant", traceId, checked.size(), agentId);
        } else {
            log.warn("⚠️ [{}] {} of {} actions from {} lack validation metadata",
                    traceId, found.size(), checked.size(), agentId);
        }
        return result;
    }

    @Override
    public void reportComplianceViolation(ComplianceViolation violation) {
        remember(violations, violation);
        log.warn("🔴 [{}] Compliance violation {}: {} (agent {}, action {})", violation.getTraceId(),
                violation.getViolationType(), violation.getDescription(), violation.getAgentId(), violation.getActionId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("agentId", violation.getAgentId());
        details.put("actionId", violation.getActionId());
        details.put("actionType", violation.getActionType());
        details.put("violationType", violation.getViolationType());
        details.put("severity", violation.getSeverity());
        details.put("description", violation.getDescription());
        details.put("context", violation.getContext());
        AuditEntry entry = new AuditEntry(AuditEntry.COMPLIANCE_VIOLATION, violation.getTraceId(),
                violation.getViolationId(), violation.getDetectedAt(), details);

        try {
            CompletableFuture.runAsync(() -> auditSink.record(entry), executor)
                    .exceptionally(error -> {
                        log.error("🔴 [{}] Audit sink unavailable, violation {} kept in local log only: {}",
                                violation.getTraceId(), violation.getViolationId(), violation.getDescription(), error);
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.error("🔴 [{}] Audit executor saturated, violation {} kept in local log only: {}",
                    violation.getTraceId(), violation.getViolationId(), violation.getDescription(), e);
        }
    }

    @Override
    public ComplianceValidationResult ensureCompliance(AgentResponse response, List<AgentAction> actions, String traceId) {
        ComplianceValidationResult result = validateAgentResponse(response, actions, traceId);
        if (!result.isCompliant()) {
            throw new ComplianceViolationException(String.format(
                    "Agent response contains %d unvalidated action(s) out of %d",
                    result.getUnvalidatedActions(), result.getTotalActions()), result);
        }
        return result;
    }

    @Override
    public ComplianceAuditReport generateComplianceAuditReport(Instant from, Instant to) {
        List<ComplianceValidationResult> checksInRange = snapshot(checks).stream()
                .filter(c -> inRange(c.getCheckedAt(), from, to))
                .toList();
        List<ComplianceViolation> violationsInRange = snapshot(violations).stream()
                .filter(v -> inRange(v.getDetectedAt(), from, to))
                .toList();

        long totalActions = checksInRange.stream().mapToLong(ComplianceValidationResult::getTotalActions).sum();
        long validatedActions = checksInRange.stream().mapToLong(ComplianceValidationResult::getValidatedActions).sum();

        log.info("📊 Compliance report {} - {}: {} checks, {} violations", from, to, checksInRange.size(), violationsInRange.size());
        return ComplianceAuditReport.builder()
                .from(from)
                .to(to)
                .totalChecks(checksInRange.size())
                .totalActions(totalActions)
                .validatedActions(validatedActions)
                .totalViolations(violationsInRange.size())
                .complianceRate(totalActions == 0 ? 1.0 : (double) validatedActions / totalActions)
                .violationsByAgent(countBy(violationsInRange, v -> String.valueOf(v.getAgentId())))
                .violationsByType(countBy(violationsInRange, v -> String.valueOf(v.getActionType())))
                .build();
    }

    private static boolean inRange(Instant at, Instant from, Instant to) {
        return (from == null || !at.isBefore(from)) && (to == null || !at.isAfter(to));
    }

    private static Map<String, Long> countBy(List<ComplianceViolation> items, Function<ComplianceViolation, String> key) {
        return items.stream().collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }

    private static <T> void remember(Deque<T> history, T item) {
        synchronized (history) {
            history.addLast(item);
            if (history.size() > HISTORY_CAPACITY) {
                history.removeFirst();
            }
        }
    }

    private static <T> List<T> snapshot(Deque<T> history) {
        synchronized (history) {
            return List.copyOf(history);
        }
    }
}
