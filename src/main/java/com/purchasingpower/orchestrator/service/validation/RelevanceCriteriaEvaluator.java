package com.purchasingpower.orchestrator.service.validation;

import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.action.ContactContext;
import com.purchasingpower.orchestrator.model.action.ValidationMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Tier 1: static relevance criteria attached to the action, checked against the contact context.
 *
 * <p>Supported criteria:
 * <ul>
 *   <li>{@code dealStatus} - equals the context's {@code dealStatus} attribute (case-insensitive)</li>
 *   <li>{@code contactEngagement} - equals the context's {@code engagementLevel} attribute</li>
 *   <li>{@code contactStatus} - equals the contact's relationship stage</li>
 *   <li>{@code lastInteractionAge} - last interaction at most N days ago</li>
 *   <li>{@code expiresAt} - ISO-8601 instant the action must run before</li>
 * </ul>
 * Unknown criteria pass. A criterion that cannot be evaluated fails.
 *
 * <p>All passing is conclusively relevant; all failing, or expiry, is conclusively stale.
 * No criteria or a partial failure leaves the decision to later tiers.
 */
@Slf4j
@Component
public class RelevanceCriteriaEvaluator {

    static final String EXPIRES_AT = "expiresAt";

    public TierVerdict evaluate(Map<String, Object> criteria, ContactContext context, String traceId) {
        ActionRelevanceResult.ActionRelevanceResultBuilder result = ActionRelevanceResult.builder()
                .contactId(context != null ? context.getContactId() : null)
                .validationMethod(ValidationMethod.RULE_BASED)
                .checkedBy(getClass().getSimpleName())
                .traceId(traceId);

        if (criteria == null || criteria.isEmpty()) {
            return new TierVerdict(TierVerdict.Outcome.INCONCLUSIVE, result
                    .relevant(true)
                    .confidenceScore(0.5)
                    .reasoning("No relevance criteria defined")
                    .build(), 0.5);
        }

        List<String> failed = new ArrayList<>();
        criteria.forEach((key, value) -> {
            if (!passes(key, value, context, traceId)) {
                failed.add(key);
                log.debug("[{}] Relevance criterion failed: {} = {}", traceId, key, value);
            }
        });

        if (failed.isEmpty()) {
            return new TierVerdict(TierVerdict.Outcome.RELEVANT, result
                    .relevant(true)
                    .confidenceScore(1.0)
                    .reasoning("All relevance criteria passed")
                    .build(), 1.0);
        }

        double relevanceScore = Math.max(0.0, 1.0 - (double) failed.size() / criteria.size());
        boolean conclusive = failed.size() == criteria.size() || failed.contains(EXPIRES_AT);
        return new TierVerdict(conclusive ? TierVerdict.Outcome.STALE : TierVerdict.Outcome.INCONCLUSIVE, result
                .relevant(false)
                .confidenceScore(conclusive ? 1.0 : 1.0 - relevanceScore)
                .reasoning("Failed criteria: " + String.join(", ", failed))
                .failedCriteria(List.copyOf(failed))
                .build(), conclusive ? 0.0 : relevanceScore);
    }

    private boolean passes(String key, Object expected, ContactContext context, String traceId) {
        try {
            switch (key.toLowerCase(Locale.ROOT)) {
                case "dealstatus":
                    return matches(expected, attribute(context, "dealStatus"));
                case "contactengagement":
                    return matches(expected, attribute(context, "engagementLevel"));
                case "contactstatus":
                    return matches(expected, context != null ? context.getContactStatus() : null);
                case "lastinteractionage": {
                    long maxDays = Long.parseLong(String.valueOf(expected).trim());
                    Instant last = context != null ? context.getLastInteraction() : null;
                    return last != null && Duration.between(last, Instant.now()).toDays() <= maxDays;
                }
                case "expiresat":
                    return Instant.now().isBefore(Instant.parse(String.valueOf(expected).trim()));
                default:
                    log.warn("[{}] Unknown relevance criterion: {}", traceId, key);
                    return true;
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("[{}] Cannot evaluate criterion {}={}: {}", traceId, key, expected, e.getMessage());
            return false;
        }
    }

    private static Object attribute(ContactContext context, String name) {
        if (context == null || context.getAdditionalData() == null) {
            return null;
        }
        return context.getAdditionalData().get(name);
    }

    private static boolean matches(Object expected, Object actual) {
        return actual != null && Objects.toString(expected, "").equalsIgnoreCase(actual.toString());
    }
}
