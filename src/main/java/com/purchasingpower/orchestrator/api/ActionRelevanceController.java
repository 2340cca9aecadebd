package com.purchasingpower.orchestrator.api;

import com.purchasingpower.orchestrator.model.action.ActionRelevanceRequest;
import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.approval.UserApprovalRequest;
import com.purchasingpower.orchestrator.model.approval.UserApprovalResponse;
import com.purchasingpower.orchestrator.model.action.ScheduledAction;
import com.purchasingpower.orchestrator.model.compliance.ComplianceAuditReport;
import com.purchasingpower.orchestrator.service.approval.UserApprovalService;
import com.purchasingpower.orchestrator.service.compliance.AgentComplianceChecker;
import com.purchasingpower.orchestrator.service.validation.ActionRelevanceValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for action relevance checks, approvals and compliance reporting.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ActionRelevanceController {

    private final ActionRelevanceValidator relevanceValidator;
    private final UserApprovalService approvalService;
    private final AgentComplianceChecker complianceChecker;

    /**
     * POST /api/v1/actions/relevance
     */
    @PostMapping("/actions/relevance")
    public CompletableFuture<ResponseEntity<ActionRelevanceResult>> validate(@RequestBody ActionRelevanceRequest request) {
        if (request.getAction() == null) {
            throw new IllegalArgumentException("action is required");
        }
        return relevanceValidator.validateActionRelevance(request).thenApply(ResponseEntity::ok);
    }

    /**
     * POST /api/v1/actions/relevance/batch
     */
    @PostMapping("/actions/relevance/batch")
    public CompletableFuture<ResponseEntity<List<ActionRelevanceResult>>> validateBatch(
            @RequestBody List<ActionRelevanceRequest> requests) {
        log.info("📦 Batch relevance request with {} actions", requests.size());
        return relevanceValidator.validateBatchActionRelevance(requests).thenApply(ResponseEntity::ok);
    }

    /**
     * GET /api/v1/actions/relevance/audit?contactId=&start=&end=&actionType=
     */
    @GetMapping("/actions/relevance/audit")
    public ResponseEntity<List<ActionRelevanceResult>> audit(
            @RequestParam(required = false) String contactId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(required = false) String actionType) {
        return ResponseEntity.ok(relevanceValidator.getValidationAuditLog(contactId, start, end, actionType));
    }

    /**
     * GET /api/v1/approvals?userId=&includeExpired=
     */
    @GetMapping("/approvals")
    public ResponseEntity<List<UserApprovalRequest>> pendingApprovals(
            @RequestParam(required = false) String userId,
            @RequestParam(defaultValue = "false") boolean includeExpired) {
        return ResponseEntity.ok(approvalService.getPendingApprovals(userId, includeExpired));
    }

    /**
     * POST /api/v1/approvals/{requestId}
     *
     * Returns the action to execute, or 204 when it was rejected or the request is unknown.
     */
    @PostMapping("/approvals/{requestId}")
    public ResponseEntity<ScheduledAction> decide(@PathVariable String requestId, @RequestBody UserApprovalResponse response) {
        UserApprovalResponse decision = response.toBuilder().requestId(requestId).build();
        return approvalService.processApprovalResponse(decision)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * GET /api/v1/compliance/report?from=&to=
     */
    @GetMapping("/compliance/report")
    public ResponseEntity<ComplianceAuditReport> complianceReport(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ResponseEntity.ok(complianceChecker.generateComplianceAuditReport(from, to));
    }
}
