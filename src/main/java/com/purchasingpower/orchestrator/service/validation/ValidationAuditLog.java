package com.purchasingpower.orchestrator.service.validation;

import com.purchasingpower.orchestrator.client.AuditSink;
import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.audit.AuditEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded in-memory history of relevance results, mirrored to the durable {@link AuditSink}.
 *
 * <p>The oldest entries are evicted once the capacity from the current config is reached.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidationAuditLog {

    private final AuditSink auditSink;
    private final Deque<ActionRelevanceResult> entries = new ArrayDeque<>();

    public void record(ActionRelevanceResult result, int capacity) {
        synchronized (entries) {
            entries.addLast(result);
            while (entries.size() > Math.max(1, capacity)) {
                entries.removeFirst();
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("actionType", result.getActionType());
        details.put("contactId", result.getContactId());
        details.put("relevant", result.isRelevant());
        details.put("confidenceScore", result.getConfidenceScore());
        details.put("validationMethod", result.getValidationMethod());
        details.put("reasoning", result.getReasoning());
        try {
            auditSink.record(AuditEntry.of(AuditEntry.RELEVANCE_CHECK, result.getTraceId(), result.getActionId(), details));
        } catch (RuntimeException e) {
            log.error("🔴 [{}] Failed to write relevance audit entry for action {}", result.getTraceId(), result.getActionId(), e);
        }
    }

    /**
     * Newest first. Every filter is optional.
     */
    public List<ActionRelevanceResult> query(String contactId, Instant start, Instant end, String actionType) {
        List<ActionRelevanceResult> snapshot;
        synchronized (entries) {
            snapshot = List.copyOf(entries);
        }
        return snapshot.stream()
                .filter(r -> contactId == null || contactId.equals(r.getContactId()))
                .filter(r -> start == null || !r.getEvaluatedAt().isBefore(start))
                .filter(r -> end == null || !r.getEvaluatedAt().isAfter(end))
                .filter(r -> actionType == null || actionType.equalsIgnoreCase(r.getActionType()))
                .sorted(Comparator.comparing(ActionRelevanceResult::getEvaluatedAt).reversed())
                .toList();
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
