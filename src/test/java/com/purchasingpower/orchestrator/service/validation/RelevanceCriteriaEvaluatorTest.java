package com.purchasingpower.orchestrator.service.validation;

import com.purchasingpower.orchestrator.model.action.ContactContext;
import com.purchasingpower.orchestrator.model.action.ValidationMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Relevance Criteria Tier Tests")
class RelevanceCriteriaEvaluatorTest {

    private final RelevanceCriteriaEvaluator evaluator = new RelevanceCriteriaEvaluator();

    private static ContactContext context() {
        return ContactContext.builder()
                .contactId("c-1")
                .contactStatus("active")
                .lastInteraction(Instant.now().minus(Duration.ofDays(2)))
                .additionalData(Map.of("dealStatus", "Negotiating", "engagementLevel", "high"))
                .build();
    }

    @Test
    @DisplayName("No criteria is inconclusive")
    void noCriteria() {
        TierVerdict verdict = evaluator.evaluate(Map.of(), context(), "t-1");

        assertThat(verdict.outcome()).isEqualTo(TierVerdict.Outcome.INCONCLUSIVE);
        assertThat(verdict.relevanceScore()).isEqualTo(0.5);
        assertThat(verdict.result().getReasoning()).isEqualTo("No relevance criteria defined");
    }

    @Test
    @DisplayName("All criteria passing is conclusively relevant")
    void allPass() {
        TierVerdict verdict = evaluator.evaluate(Map.of(
                "dealStatus", "negotiating",
                "contactEngagement", "HIGH",
                "contactStatus", "active",
                "lastInteractionAge", 7), context(), "t-1");

        assertThat(verdict.outcome()).isEqualTo(TierVerdict.Outcome.RELEVANT);
        assertThat(verdict.result().isRelevant()).isTrue();
        assertThat(verdict.result().getConfidenceScore()).isEqualTo(1.0);
        assertThat(verdict.result().getValidationMethod()).isEqualTo(ValidationMethod.RULE_BASED);
        assertThat(verdict.result().getContactId()).isEqualTo("c-1");
    }

    @Test
    @DisplayName("Every criterion failing is conclusively stale")
    void allFail() {
        TierVerdict verdict = evaluator.evaluate(Map.of("dealStatus", "closed", "contactStatus", "lost"), context(), "t-1");

        assertThat(verdict.outcome()).isEqualTo(TierVerdict.Outcome.STALE);
        assertThat(verdict.relevanceScore()).isZero();
        assertThat(verdict.result().getFailedCriteria()).containsExactlyInAnyOrder("dealStatus", "contactStatus");
    }

    @Test
    @DisplayName("Partial failure is inconclusive with the share of passed criteria as score")
    void partialFailure() {
        Map<String, Object> criteria = new LinkedHashMap<>();
        criteria.put("dealStatus", "negotiating");
        criteria.put("contactStatus", "client");
        criteria.put("contactEngagement", "high");
        criteria.put("lastInteractionAge", "1");

        TierVerdict verdict = evaluator.evaluate(criteria, context(), "t-1");

        assertThat(verdict.outcome()).isEqualTo(TierVerdict.Outcome.INCONCLUSIVE);
        assertThat(verdict.relevanceScore()).isCloseTo(0.5, within(1e-9));
        assertThat(verdict.result().getConfidenceScore()).isCloseTo(0.5, within(1e-9));
        assertThat(verdict.result().getReasoning()).isEqualTo("Failed criteria: contactStatus, lastInteractionAge");
    }

    @Test
    @DisplayName("An expired action is stale even when other criteria pass")
    void expiredIsStale() {
        TierVerdict verdict = evaluator.evaluate(Map.of(
                "dealStatus", "negotiating",
                "expiresAt", Instant.now().minus(Duration.ofHours(1)).toString()), context(), "t-1");

        assertThat(verdict.outcome()).isEqualTo(TierVerdict.Outcome.STALE);
        assertThat(verdict.result().getFailedCriteria()).containsExactly("expiresAt");
    }

    @Test
    @DisplayName("Unknown criteria pass and unparsable ones fail")
    void unknownAndUnparsable() {
        assertThat(evaluator.evaluate(Map.of("favouriteColour", "blue"), context(), "t-1").outcome())
                .isEqualTo(TierVerdict.Outcome.RELEVANT);
        assertThat(evaluator.evaluate(Map.of("lastInteractionAge", "a week"), context(), "t-1").outcome())
                .isEqualTo(TierVerdict.Outcome.STALE);
    }

    @Test
    @DisplayName("Missing context fails attribute criteria instead of throwing")
    void nullContext() {
        TierVerdict verdict = evaluator.evaluate(Map.of("dealStatus", "open"), null, "t-1");

        assertThat(verdict.outcome()).isEqualTo(TierVerdict.Outcome.STALE);
        assertThat(verdict.result().getContactId()).isNull();
    }
}
