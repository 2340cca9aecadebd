package com.purchasingpower.orchestrator.service.approval.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.orchestrator.client.AuditSink;
import com.purchasingpower.orchestrator.client.ContactContextLookup;
import com.purchasingpower.orchestrator.client.TextCompletion;
import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.action.ContactContext;
import com.purchasingpower.orchestrator.model.action.ScheduledAction;
import com.purchasingpower.orchestrator.model.agent.UrgencyLevel;
import com.purchasingpower.orchestrator.model.approval.ApprovalDecision;
import com.purchasingpower.orchestrator.model.approval.ApprovalStatus;
import com.purchasingpower.orchestrator.model.approval.UserApprovalRequest;
import com.purchasingpower.orchestrator.model.approval.UserApprovalResponse;
import com.purchasingpower.orchestrator.model.audit.AuditEntry;
import com.purchasingpower.orchestrator.service.approval.UserApprovalService;
import com.purchasingpower.orchestrator.service.validation.ActionRelevanceConfig;
import com.purchasingpower.orchestrator.service.validation.ActionRelevanceValidator;
import com.purchasingpower.orchestrator.util.LogText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory approval queue.
 *
 * <p>Settings (override mode, threshold, timeout, approval lists) are read from the validator's
 * current config on every call, so a config update applies immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserApprovalServiceImpl implements UserApprovalService {

    private static final Duration DEFER_DELAY = Duration.ofHours(1);
    private static final Duration SIMILARITY_WINDOW = Duration.ofHours(24);

    private static final String APPROVAL_SYSTEM_PROMPT = """
            You are helping determine if a scheduled action requires human approval.
            Consider factors like:
            - Action sensitivity and potential impact
            - Confidence level of the relevance assessment
            - Contact context and relationship status
            - Risk of automation errors
            - Industry compliance requirements

            Respond with JSON: { "requiresApproval": true/false, "reason": "explanation" }
            """;

    private final ActionRelevanceValidator relevanceValidator;
    private final ContactContextLookup contextLookup;
    private final TextCompletion textCompletion;
    private final ObjectMapper objectMapper;
    private final AuditSink auditSink;

    private final Map<String, UserApprovalRequest> pendingApprovals = new ConcurrentHashMap<>();

    // ================================================================
    // APPROVAL REQUIREMENT
    // ================================================================

    @Override
    public boolean requiresUserApproval(ScheduledAction action, ActionRelevanceResult relevanceResult,
                                        String userId, String traceId) {
        ActionRelevanceConfig config = relevanceValidator.getValidationConfig();
        try {
            log.debug("🔍 [{}] Approval requirement for {} ({}) in mode {}",
                    traceId, action.getId(), action.getActionType(), config.getOverrideMode());

            return switch (config.getOverrideMode()) {
                case ALWAYS_ASK -> true;
                case NEVER_ASK -> false;
                case RISK_BASED -> riskBased(action, relevanceResult, config, traceId);
                case LLM_DECISION -> {
                    ContactContext context = contextLookup.lookup(action.getContactId(), action.getOrganizationId());
                    yield llmRecommendsApproval(action, relevanceResult, context, traceId);
                }
            };
        } catch (RuntimeException e) {
            log.error("❌ [{}] Error evaluating approval requirement for action {}, requiring approval",
                    traceId, action != null ? action.getId() : null, e);
            return true;
        }
    }

    private boolean riskBased(ScheduledAction action, ActionRelevanceResult relevanceResult,
                              ActionRelevanceConfig config, String traceId) {
        if (config.getAlwaysRequireApprovalActions().contains(action.getActionType())) {
            log.debug("⚠️ [{}] High-risk action type requires approval: {}", traceId, action.getActionType());
            return true;
        }
        if (config.getNeverRequireApprovalActions().contains(action.getActionType())) {
            log.debug("[{}] Safe action type, no approval required: {}", traceId, action.getActionType());
            return false;
        }
        double confidence = relevanceResult != null ? relevanceResult.getConfidenceScore() : 0.0;
        if (confidence < config.getUserApprovalThreshold()) {
            log.debug("[{}] Low confidence requires approval: {} < {}", traceId, confidence, config.getUserApprovalThreshold());
            return true;
        }
        return false;
    }

    @Override
    public boolean llmRecommendsApproval(ScheduledAction action, ActionRelevanceResult relevanceResult,
                                         ContactContext context, String traceId) {
        String userPrompt = String.format("""
                        Evaluate if this action requires human approval:

                        ACTION:
                        - Type: %s
                        - Description: %s
                        - Priority: %s

                        RELEVANCE ASSESSMENT:
                        - Is Relevant: %s
                        - Confidence: %.2f
                        - Reason: %s

                        CONTACT CONTEXT:
                        - Last Interaction: %s
                        - Summary: %s

                        Should this action require human approval before execution?
                        """,
                action.getActionType(), action.getDescription(), action.getPriority(),
                relevanceResult != null && relevanceResult.isRelevant(),
                relevanceResult != null ? relevanceResult.getConfidenceScore() : 0.0,
                relevanceResult != null ? relevanceResult.getReasoning() : "none",
                context != null ? context.getLastInteraction() : null,
                context != null && context.getInteractionSummary() != null ? context.getInteractionSummary() : "No summary available");

        try {
            String raw = textCompletion.complete(APPROVAL_SYSTEM_PROMPT, userPrompt, traceId);
            String json = LogText.extractJson(raw);
            JsonNode node = json != null ? objectMapper.readTree(json) : null;
            if (node == null || !node.has("requiresApproval") || !node.get("requiresApproval").isBoolean()) {
                log.warn("⚠️ [{}] Unparsable LLM approval decision, requiring approval: {}", traceId, LogText.truncate(raw, 200));
                return true;
            }
            boolean requiresApproval = node.get("requiresApproval").asBoolean();
            log.debug("🤖 [{}] LLM approval recommendation: {} ({})", traceId, requiresApproval,
                    node.hasNonNull("reason") ? node.get("reason").asText() : "no reason");
            return requiresApproval;
        } catch (JsonProcessingException e) {
            log.warn("⚠️ [{}] LLM approval decision is not valid JSON, requiring approval: {}", traceId, e.getOriginalMessage());
            return true;
        } catch (RuntimeException e) {
            log.error("❌ [{}] LLM approval recommendation failed for action {}, requiring approval", traceId, action.getId(), e);
            return true;
        }
    }

    // ================================================================
    // REQUEST LIFECYCLE
    // ================================================================

    @Override
    public UserApprovalRequest createApprovalRequest(ScheduledAction action, ActionRelevanceResult relevanceResult,
                                                     String userId, String reason, Map<String, Object> userOverrides,
                                                     String traceId) {
        Preconditions.checkArgument(action != null, "action is required");
        ActionRelevanceConfig config = relevanceValidator.getValidationConfig();
        Instant now = Instant.now();

        UserApprovalRequest request = UserApprovalRequest.builder()
                .action(action)
                .relevanceResult(relevanceResult)
                .approvalReason(reason)
                .userId(userId)
                .originalUserOverrides(userOverrides != null ? Map.copyOf(userOverrides) : Map.of())
                .alternativeActions(new ArrayList<>(relevanceValidator.suggestAlternativeActions(action, null, traceId)))
                .requestedAt(now)
                .expiresAt(now.plus(Duration.ofMinutes(config.getUserApprovalTimeoutMinutes())))
                .status(ApprovalStatus.PENDING)
                .traceId(traceId)
                .build();
        pendingApprovals.put(request.getRequestId(), request);

        log.info("📝 [{}] Created approval request {} for action {}, expires at {}",
                traceId, request.getRequestId(), action.getId(), request.getExpiresAt());
        audit(request, "CREATED", reason);
        return request;
    }

    @Override
    public Optional<ScheduledAction> processApprovalResponse(UserApprovalResponse response) {
        Preconditions.checkArgument(response != null && response.getRequestId() != null, "requestId is required");
        Preconditions.checkArgument(response.getDecision() != null, "decision is required");

        UserApprovalRequest request = pendingApprovals.get(response.getRequestId());
        if (request == null) {
            log.warn("⚠️ Approval request not found: {}", response.getRequestId());
            return Optional.empty();
        }

        if (response.isApplyToSimilarActions() && relevanceValidator.getValidationConfig().isEnableBulkApproval()
                && (response.getDecision() == ApprovalDecision.APPROVE || response.getDecision() == ApprovalDecision.REJECT)) {
            int settled = applyBulkApproval(response, response.getUserId() != null ? response.getUserId() : request.getUserId());
            log.info("📋 [{}] Bulk decision applied to {} similar actions", request.getTraceId(), settled);
        }

        if (pendingApprovals.remove(response.getRequestId()) == null) {
            log.warn("⚠️ Approval request {} was settled concurrently", response.getRequestId());
            return Optional.empty();
        }

        ScheduledAction action = request.getAction();
        Optional<ScheduledAction> outcome = switch (response.getDecision()) {
            case APPROVE -> {
                request.setStatus(ApprovalStatus.APPROVED);
                yield Optional.of(action);
            }
            case REJECT -> {
                request.setStatus(ApprovalStatus.REJECTED);
                log.info("❌ [{}] Action rejected by user: {} ({})", request.getTraceId(), action.getId(), response.getReason());
                yield Optional.empty();
            }
            case MODIFY -> {
                request.setStatus(ApprovalStatus.MODIFIED);
                log.info("🔧 [{}] Action modified by user: {}", request.getTraceId(), action.getId());
                yield Optional.of(applyModifications(action, response.getSuggestedModifications()));
            }
            case DEFER -> {
                request.setStatus(ApprovalStatus.DEFERRED);
                ScheduledAction deferred = action.copy();
                deferred.setExecuteAt(Instant.now().plus(DEFER_DELAY));
                log.info("⏰ [{}] Action deferred by user: {} until {}", request.getTraceId(), action.getId(), deferred.getExecuteAt());
                yield Optional.of(deferred);
            }
        };

        log.info("✅ [{}] Processed approval response {}: {}", request.getTraceId(), response.getRequestId(), response.getDecision());
        audit(request, response.getDecision().name(), response.getReason());
        return outcome;
    }

    @Override
    public List<UserApprovalRequest> getPendingApprovals(String userId, boolean includeExpired) {
        Instant now = Instant.now();
        return pendingApprovals.values().stream()
                .filter(r -> userId == null || userId.equals(r.getUserId()))
                .filter(r -> includeExpired || !r.isExpired(now))
                .filter(r -> r.getStatus() == ApprovalStatus.PENDING)
                .sorted(Comparator.comparing(UserApprovalRequest::getRequestedAt))
                .toList();
    }

    @Override
    public Optional<UserApprovalRequest> getApprovalRequest(String requestId) {
        return Optional.ofNullable(requestId).map(pendingApprovals::get);
    }

    @Override
    public int applyBulkApproval(UserApprovalResponse response, String userId) {
        UserApprovalRequest original = pendingApprovals.get(response.getRequestId());
        if (original == null) {
            return 0;
        }
        ApprovalStatus status = switch (response.getDecision()) {
            case APPROVE -> ApprovalStatus.APPROVED;
            case REJECT -> ApprovalStatus.REJECTED;
            default -> null;
        };
        if (status == null) {
            return 0;
        }

        int settled = 0;
        for (UserApprovalRequest candidate : List.copyOf(pendingApprovals.values())) {
            if (candidate.getRequestId().equals(original.getRequestId())
                    || !Objects.equals(candidate.getUserId(), userId)
                    || candidate.getStatus() != ApprovalStatus.PENDING
                    || !isSimilar(candidate.getAction(), original.getAction())) {
                continue;
            }
            if (pendingApprovals.remove(candidate.getRequestId(), candidate)) {
                candidate.setStatus(status);
                audit(candidate, "BULK_" + response.getDecision().name(), response.getReason());
                settled++;
            }
        }
        log.info("📋 Bulk {} applied to {} similar actions for user {}", response.getDecision(), settled, userId);
        return settled;
    }

    @Override
    public int cleanupExpiredApprovals() {
        Instant now = Instant.now();
        int expired = 0;
        for (UserApprovalRequest request : List.copyOf(pendingApprovals.values())) {
            if (request.isExpired(now) && pendingApprovals.remove(request.getRequestId(), request)) {
                request.setStatus(ApprovalStatus.EXPIRED);
                log.warn("🕒 [{}] Approval request expired: {} ({})",
                        request.getTraceId(), request.getRequestId(), request.getAction().getActionType());
                audit(request, "EXPIRED", null);
                expired++;
            }
        }
        if (expired > 0) {
            log.info("🧹 Cleaned up {} expired approval requests", expired);
        }
        return expired;
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private static boolean isSimilar(ScheduledAction a, ScheduledAction b) {
        if (a == null || b == null || a.getExecuteAt() == null || b.getExecuteAt() == null) {
            return false;
        }
        return Objects.equals(a.getActionType(), b.getActionType())
                && Objects.equals(a.getContactId(), b.getContactId())
                && Duration.between(a.getExecuteAt(), b.getExecuteAt()).abs().compareTo(SIMILARITY_WINDOW) < 0;
    }

    private static ScheduledAction applyModifications(ScheduledAction original, Map<String, Object> modifications) {
        ScheduledAction modified = original.copy();
        if (modifications == null) {
            return modified;
        }
        Map<String, Object> parameters = new HashMap<>(modified.getParameters());
        modifications.forEach((key, value) -> {
            switch (key.toLowerCase(Locale.ROOT)) {
                case "description" -> modified.setDescription(String.valueOf(value));
                case "executeat" -> {
                    try {
                        modified.setExecuteAt(Instant.parse(String.valueOf(value)));
                    } catch (DateTimeParseException e) {
                        log.warn("⚠️ Ignoring invalid executeAt modification '{}': {}", value, e.getMessage());
                    }
                }
                case "priority" -> {
                    try {
                        modified.setPriority(UrgencyLevel.valueOf(String.valueOf(value).trim().toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        log.warn("⚠️ Ignoring invalid priority modification '{}'", value);
                    }
                }
                default -> parameters.put(key, value);
            }
        });
        modified.setParameters(parameters);
        return modified;
    }

    private void audit(UserApprovalRequest request, String event, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("event", event);
        details.put("actionId", request.getAction().getId());
        details.put("actionType", request.getAction().getActionType());
        details.put("userId", request.getUserId());
        details.put("status", request.getStatus());
        if (reason != null) {
            details.put("reason", reason);
        }
        try {
            auditSink.record(AuditEntry.of(AuditEntry.APPROVAL, request.getTraceId(), request.getRequestId(), details));
        } catch (RuntimeException e) {
            log.error("🔴 [{}] Failed to write approval audit entry for {}", request.getTraceId(), request.getRequestId(), e);
        }
    }
}
