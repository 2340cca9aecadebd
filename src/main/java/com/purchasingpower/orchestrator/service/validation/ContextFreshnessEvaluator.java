package com.purchasingpower.orchestrator.service.validation;

import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.action.ContactContext;
import com.purchasingpower.orchestrator.model.action.ValidationMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Tier 2: re-derives freshness from the contact's stage, sentiment and interaction recency.
 *
 * <p>Stale when the contact reached a terminal stage, sentiment is strongly negative, or nobody
 * has interacted for {@code staleInteractionDays}. Relevant when there was a recent interaction
 * with positive sentiment. Anything else stays inconclusive.
 */
@Slf4j
@Component
public class ContextFreshnessEvaluator {

    public TierVerdict evaluate(ContactContext context, ActionRelevanceConfig config, String traceId) {
        ActionRelevanceResult.ActionRelevanceResultBuilder result = ActionRelevanceResult.builder()
                .contactId(context != null ? context.getContactId() : null)
                .validationMethod(ValidationMethod.CONTEXTUAL)
                .checkedBy(getClass().getSimpleName())
                .traceId(traceId);

        if (context == null) {
            return inconclusive(result, "No contact context available");
        }

        String status = context.getContactStatus();
        if (status != null && config.getTerminalContactStatuses().contains(status.toLowerCase(Locale.ROOT))) {
            return stale(result, "Contact is in terminal stage '" + status + "'", 0.95);
        }

        Double sentiment = context.getSentimentScore();
        if (sentiment != null && sentiment < config.getNegativeSentimentThreshold()) {
            return stale(result, String.format("Contact sentiment %.2f is strongly negative", sentiment), 0.85);
        }

        Instant last = context.getLastInteraction();
        if (last != null) {
            long days = Duration.between(last, Instant.now()).toDays();
            if (days > config.getStaleInteractionDays()) {
                return stale(result, "No interaction for " + days + " days", 0.8);
            }
            if (days <= config.getRecentInteractionDays()
                    && sentiment != null && sentiment >= config.getPositiveSentimentThreshold()) {
                return new TierVerdict(TierVerdict.Outcome.RELEVANT, result
                        .relevant(true)
                        .confidenceScore(0.8)
                        .reasoning(String.format("Recent interaction (%d days ago) with positive sentiment %.2f", days, sentiment))
                        .build(), 1.0);
            }
        }

        log.debug("[{}] Contact context for {} is inconclusive", traceId, context.getContactId());
        return inconclusive(result, "Contact context neither confirms nor contradicts the action");
    }

    private static TierVerdict stale(ActionRelevanceResult.ActionRelevanceResultBuilder result, String reason, double confidence) {
        return new TierVerdict(TierVerdict.Outcome.STALE, result
                .relevant(false)
                .confidenceScore(confidence)
                .reasoning(reason)
                .build(), 0.0);
    }

    private static TierVerdict inconclusive(ActionRelevanceResult.ActionRelevanceResultBuilder result, String reason) {
        return new TierVerdict(TierVerdict.Outcome.INCONCLUSIVE, result
                .relevant(false)
                .confidenceScore(0.5)
                .reasoning(reason)
                .build(), 0.5);
    }
}
