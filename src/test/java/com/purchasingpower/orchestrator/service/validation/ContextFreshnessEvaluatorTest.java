package com.purchasingpower.orchestrator.service.validation;

import com.purchasingpower.orchestrator.model.action.ContactContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Context Freshness Tier Tests")
class ContextFreshnessEvaluatorTest {

    private final ContextFreshnessEvaluator evaluator = new ContextFreshnessEvaluator();
    private final ActionRelevanceConfig config = ActionRelevanceConfig.defaults();

    private static ContactContext.ContactContextBuilder contact() {
        return ContactContext.builder().contactId("c-1").contactStatus("active");
    }

    private static Instant daysAgo(int days) {
        return Instant.now().minus(Duration.ofDays(days)).minus(Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("Terminal contact stage is stale")
    void terminalStage() {
        TierVerdict verdict = evaluator.evaluate(contact().contactStatus("Lost").build(), config, "t-1");

        assertThat(verdict.isStale()).isTrue();
        assertThat(verdict.result().getConfidenceScore()).isEqualTo(0.95);
        assertThat(verdict.result().getReasoning()).contains("terminal stage 'Lost'");
    }

    @Test
    @DisplayName("Strongly negative sentiment is stale")
    void negativeSentiment() {
        TierVerdict verdict = evaluator.evaluate(contact().sentimentScore(-0.8).build(), config, "t-1");

        assertThat(verdict.isStale()).isTrue();
        assertThat(verdict.result().isRelevant()).isFalse();
    }

    @Test
    @DisplayName("Long silence is stale")
    void longSilence() {
        TierVerdict verdict = evaluator.evaluate(contact().lastInteraction(daysAgo(45)).build(), config, "t-1");

        assertThat(verdict.isStale()).isTrue();
        assertThat(verdict.result().getReasoning()).isEqualTo("No interaction for 45 days");
    }

    @Test
    @DisplayName("Recent interaction with positive sentiment is relevant")
    void recentAndPositive() {
        TierVerdict verdict = evaluator.evaluate(
                contact().lastInteraction(daysAgo(2)).sentimentScore(0.6).build(), config, "t-1");

        assertThat(verdict.outcome()).isEqualTo(TierVerdict.Outcome.RELEVANT);
        assertThat(verdict.relevanceScore()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Recent interaction with neutral sentiment stays inconclusive")
    void recentButNeutral() {
        TierVerdict verdict = evaluator.evaluate(
                contact().lastInteraction(daysAgo(2)).sentimentScore(0.0).build(), config, "t-1");

        assertThat(verdict.isConclusive()).isFalse();
    }

    @Test
    @DisplayName("Thresholds come from the config snapshot")
    void configurableThresholds() {
        ActionRelevanceConfig strict = config.toBuilder().staleInteractionDays(10).build();

        assertThat(evaluator.evaluate(contact().lastInteraction(daysAgo(15)).build(), config, "t-1").isConclusive())
                .isFalse();
        assertThat(evaluator.evaluate(contact().lastInteraction(daysAgo(15)).build(), strict, "t-1").isStale())
                .isTrue();
    }

    @Test
    void missingContextIsInconclusive() {
        TierVerdict verdict = evaluator.evaluate(null, config, "t-1");

        assertThat(verdict.outcome()).isEqualTo(TierVerdict.Outcome.INCONCLUSIVE);
        assertThat(verdict.result().getReasoning()).isEqualTo("No contact context available");
    }
}
