package com.purchasingpower.orchestrator.service.validation.impl;

import com.purchasingpower.orchestrator.client.AuditSink;
import com.purchasingpower.orchestrator.client.ContactContextLookup;
import com.purchasingpower.orchestrator.model.action.ActionRelevanceRequest;
import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.action.ActionScope;
import com.purchasingpower.orchestrator.model.action.ContactContext;
import com.purchasingpower.orchestrator.model.action.ScheduledAction;
import com.purchasingpower.orchestrator.model.action.ValidationMethod;
import com.purchasingpower.orchestrator.model.audit.AuditEntry;
import com.purchasingpower.orchestrator.service.validation.ActionRelevanceConfig;
import com.purchasingpower.orchestrator.service.validation.ContextFreshnessEvaluator;
import com.purchasingpower.orchestrator.service.validation.LlmRelevanceJudge;
import com.purchasingpower.orchestrator.service.validation.RelevanceCriteriaEvaluator;
import com.purchasingpower.orchestrator.service.validation.ValidationAuditLog;
import com.purchasingpower.orchestrator.workflow.CancellationSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Action Relevance Validator Tests")
class ActionRelevanceValidatorImplTest {

    @Mock
    private LlmRelevanceJudge llmJudge;

    @Mock
    private ContactContextLookup contextLookup;

    @Mock
    private AuditSink auditSink;

    private ValidationAuditLog auditLog;
    private ActionRelevanceValidatorImpl validator;

    @BeforeEach
    void setUp() {
        auditLog = new ValidationAuditLog(auditSink);
        validator = new ActionRelevanceValidatorImpl(new RelevanceCriteriaEvaluator(), new ContextFreshnessEvaluator(),
                llmJudge, contextLookup, auditLog, ActionRelevanceConfig.defaults());
    }

    private static ScheduledAction action(String id, String type, ActionScope scope, Map<String, Object> criteria) {
        return ScheduledAction.builder()
                .id(id)
                .actionType(type)
                .description("test " + type)
                .contactId("c-1")
                .organizationId("org-1")
                .executeAt(Instant.now().plus(Duration.ofHours(2)))
                .relevanceCriteria(new HashMap<>(criteria))
                .actionScope(scope)
                .build();
    }

    /** Fresh context that neither confirms nor contradicts anything. */
    private static ContactContext neutralContext() {
        return ContactContext.builder()
                .contactId("c-1")
                .organizationId("org-1")
                .contactStatus("active")
                .additionalData(Map.of("dealStatus", "open"))
                .build();
    }

    private static ActionRelevanceRequest request(ScheduledAction action) {
        return ActionRelevanceRequest.builder()
                .action(action)
                .currentContext(neutralContext())
                .traceId("t-" + action.getId())
                .build();
    }

    private void llmAnswers(boolean relevant, double confidence) {
        when(llmJudge.judge(any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            ScheduledAction action = invocation.getArgument(0);
            return CompletableFuture.completedFuture(ActionRelevanceResult.builder()
                    .actionId(action.getId())
                    .relevant(relevant)
                    .confidenceScore(confidence)
                    .reasoning("model says " + relevant)
                    .validationMethod(ValidationMethod.LLM)
                    .build());
        });
    }

    // ================================================================
    // PIPELINE
    // ================================================================

    @Nested
    @DisplayName("Tiered pipeline")
    class Pipeline {

        @Test
        @DisplayName("Conclusive criteria short-circuit before the LLM")
        void criteriaShortCircuit() {
            // Given
            ScheduledAction action = action("a-1", "congrats_email", ActionScope.HYBRID, Map.of("dealStatus", "closed"));

            // When
            ActionRelevanceResult result = validator.validateActionRelevance(request(action)).join();

            // Then
            assertThat(result.isRelevant()).isFalse();
            assertThat(result.getValidationMethod()).isEqualTo(ValidationMethod.RULE_BASED);
            assertThat(result.getFailedCriteria()).containsExactly("dealStatus");
            assertThat(result.getAlternatives()).containsExactly("follow_up_email");
            assertThat(result.getTraceId()).isEqualTo("t-a-1");
            assertThat(action.getLastRelevanceCheck()).isNotNull();
            verifyNoInteractions(llmJudge, contextLookup);
        }

        @Test
        @DisplayName("Inner-world scope never reaches the LLM and settles on the criteria score")
        void innerWorldSkipsLlm() {
            ScheduledAction action = action("a-2", "tag_contact", ActionScope.INNER_WORLD,
                    Map.of("dealStatus", "open", "contactStatus", "client"));

            ActionRelevanceResult result = validator.validateActionRelevance(request(action)).join();

            assertThat(result.isRelevant()).isTrue();
            assertThat(result.getConfidenceScore()).isEqualTo(0.5);
            assertThat(result.getReasoning()).contains("threshold");
            verifyNoInteractions(llmJudge);
        }

        @Test
        @DisplayName("Inconclusive rule tiers defer to the LLM")
        void llmDecides() {
            llmAnswers(true, 0.9);

            ActionRelevanceResult result = validator.validateActionRelevance(
                    request(action("a-3", "send_email", ActionScope.HYBRID, Map.of()))).join();

            assertThat(result.isRelevant()).isTrue();
            assertThat(result.getConfidenceScore()).isEqualTo(0.9);
            assertThat(result.getValidationMethod()).isEqualTo(ValidationMethod.LLM);
            assertThat(result.getActionType()).isEqualTo("send_email");
        }

        @Test
        @DisplayName("Relevant verdict below the scope threshold is downgraded")
        void belowThreshold() {
            llmAnswers(true, 0.6);

            ActionRelevanceResult result = validator.validateActionRelevance(
                    request(action("a-4", "property_recommendation", ActionScope.HYBRID, Map.of()))).join();

            assertThat(result.isRelevant()).isFalse();
            assertThat(result.getReasoning()).contains("below threshold");
            assertThat(result.getAlternatives()).containsExactly("market_update");
        }

        @Test
        @DisplayName("Real-world scope runs every tier and a stale tier overrides the LLM")
        void realWorldRunsAllTiers() {
            llmAnswers(true, 0.9);
            ScheduledAction action = action("a-5", "appointment_reminder", ActionScope.REAL_WORLD,
                    Map.of("contactStatus", "lost"));
            ActionRelevanceRequest request = request(action).toBuilder()
                    .currentContext(neutralContext().toBuilder().contactStatus("lost").build())
                    .build();

            ActionRelevanceResult result = validator.validateActionRelevance(request).join();

            assertThat(result.isRelevant()).isFalse();
            assertThat(result.getConfidenceScore()).isEqualTo(0.95);
            assertThat(result.getValidationMethod()).isEqualTo(ValidationMethod.RULE_BASED_PLUS_LLM);
            assertThat(result.getReasoning()).startsWith("Contact is in terminal stage").contains("LLM: model says true");
            assertThat(result.getAlternatives()).containsExactly("reschedule_request");
            verify(llmJudge, times(1)).judge(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Real-world scope runs the LLM even when the caller opts out")
        void realWorldIgnoresRequestOptOut() {
            // Given
            llmAnswers(true, 0.9);
            ActionRelevanceRequest request = request(action("a-5b", "schedule_showing", ActionScope.REAL_WORLD,
                    Map.of("dealStatus", "open")))
                    .toBuilder().useLlmValidation(false).build();

            // When
            ActionRelevanceResult result = validator.validateActionRelevance(request).join();

            // Then
            assertThat(result.getValidationMethod()).isNotEqualTo(ValidationMethod.RULE_BASED);
            assertThat(result.getReasoning()).contains("model says true");
            verify(llmJudge, times(1)).judge(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("The global LLM switch still disables the tier for real-world actions")
        void realWorldRespectsGlobalSwitch() {
            // Given
            validator.updateValidationConfig(ActionRelevanceConfig.defaults().toBuilder()
                    .enableLlmValidation(false)
                    .build());
            ActionRelevanceRequest request = request(action("a-5c", "schedule_showing", ActionScope.REAL_WORLD, Map.of()));

            // When
            ActionRelevanceResult result = validator.validateActionRelevance(request).join();

            // Then
            assertThat(result.isRelevant()).isFalse();
            assertThat(result.getReasoning()).endsWith("default action: suppress");
            verifyNoInteractions(llmJudge);
        }

        @Test
        @DisplayName("Without the LLM an inconclusive check is suppressed by default")
        void uncertaintySuppressed() {
            ActionRelevanceRequest request = request(action("a-6", "send_email", ActionScope.HYBRID, Map.of()))
                    .toBuilder().useLlmValidation(false).build();

            ActionRelevanceResult result = validator.validateActionRelevance(request).join();

            assertThat(result.isRelevant()).isFalse();
            assertThat(result.getReasoning()).endsWith("default action: suppress");
            verifyNoInteractions(llmJudge);
        }

        @Test
        @DisplayName("Proceed-on-uncertainty lets the action through at the threshold")
        void uncertaintyProceeds() {
            validator.updateValidationConfig(ActionRelevanceConfig.defaults().toBuilder()
                    .enableLlmValidation(false)
                    .defaultActionOnUncertainty(ActionRelevanceConfig.PROCEED)
                    .build());

            ActionRelevanceResult result = validator.validateActionRelevance(
                    request(action("a-7", "send_email", ActionScope.HYBRID, Map.of()))).join();

            assertThat(result.isRelevant()).isTrue();
            assertThat(result.getConfidenceScore()).isEqualTo(0.7);
        }

        @Test
        @DisplayName("Outdated supplied context is fetched again")
        void staleContextRefreshed() {
            when(contextLookup.lookup("c-1", "org-1")).thenReturn(neutralContext().toBuilder().contactStatus("closed").build());
            ActionRelevanceRequest request = request(action("a-8", "send_email", ActionScope.HYBRID, Map.of()))
                    .toBuilder()
                    .currentContext(neutralContext().toBuilder().retrievedAt(Instant.now().minus(Duration.ofHours(1))).build())
                    .build();

            ActionRelevanceResult result = validator.validateActionRelevance(request).join();

            assertThat(result.isRelevant()).isFalse();
            assertThat(result.getValidationMethod()).isEqualTo(ValidationMethod.CONTEXTUAL);
            verify(contextLookup).lookup("c-1", "org-1");
        }

        @Test
        @DisplayName("Missing action becomes an audited error result")
        void missingAction() {
            ActionRelevanceResult result = validator.validateActionRelevance(
                    ActionRelevanceRequest.builder().traceId("t-x").build()).join();

            assertThat(result.isRelevant()).isFalse();
            assertThat(result.getValidationMethod()).isEqualTo(ValidationMethod.ERROR);
            assertThat(result.getReasoning()).isEqualTo("validation error: action is required");
            assertThat(auditLog.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Cancelled validation fails without running any tier")
        void cancelled() {
            CancellationSignal signal = CancellationSignal.create();
            signal.cancel("caller gone");

            ActionRelevanceResult result = validator.validateActionRelevance(
                    request(action("a-9", "send_email", ActionScope.HYBRID, Map.of())), signal).join();

            assertThat(result.getReasoning()).isEqualTo("validation error: validation cancelled: caller gone");
            verifyNoInteractions(llmJudge);
        }
    }

    // ================================================================
    // BATCH
    // ================================================================

    @Test
    @DisplayName("Batch keeps input order and isolates a failing item")
    void batchPreservesOrder() {
        validator.updateValidationConfig(ActionRelevanceConfig.defaults().toBuilder().batchParallelism(2).build());
        List<ActionRelevanceRequest> requests = List.of(
                request(action("b-1", "send_email", ActionScope.HYBRID, Map.of("dealStatus", "open"))),
                ActionRelevanceRequest.builder().traceId("t-broken").build(),
                request(action("b-3", "send_email", ActionScope.HYBRID, Map.of("dealStatus", "won"))));

        List<ActionRelevanceResult> results = validator.validateBatchActionRelevance(requests).join();

        assertThat(results).extracting(ActionRelevanceResult::getActionId).containsExactly("b-1", null, "b-3");
        assertThat(results).extracting(ActionRelevanceResult::isRelevant).containsExactly(true, false, false);
        assertThat(results.get(1).getValidationMethod()).isEqualTo(ValidationMethod.ERROR);
    }

    @Test
    @DisplayName("Cancelled batch reports every remaining item as cancelled")
    void batchCancelled() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel("stop");

        List<ActionRelevanceResult> results = validator.validateBatchActionRelevance(List.of(
                request(action("c-1", "send_email", ActionScope.HYBRID, Map.of())),
                request(action("c-2", "send_email", ActionScope.HYBRID, Map.of()))), signal).join();

        assertThat(results).hasSize(2)
                .allSatisfy(r -> assertThat(r.getReasoning()).isEqualTo("validation error: batch cancelled: stop"));
        assertThat(validator.validateBatchActionRelevance(List.of()).join()).isEmpty();
    }

    // ================================================================
    // AUDIT & CONFIG
    // ================================================================

    @Test
    @DisplayName("Audit log filters by contact and action type")
    void auditQuery() {
        ScheduledAction other = action("d-2", "send_sms", ActionScope.HYBRID, Map.of("dealStatus", "open"));
        other.setContactId("c-2");
        validator.validateActionRelevance(request(action("d-1", "send_email", ActionScope.HYBRID, Map.of("dealStatus", "open")))).join();
        validator.validateActionRelevance(request(other)).join();

        assertThat(validator.getValidationAuditLog("c-2", null, null, null))
                .extracting(ActionRelevanceResult::getActionId).containsExactly("d-2");
        assertThat(validator.getValidationAuditLog(null, null, null, "SEND_EMAIL"))
                .extracting(ActionRelevanceResult::getActionId).containsExactly("d-1");
        assertThat(validator.getValidationAuditLog(null, Instant.now().plusSeconds(60), null, null)).isEmpty();
        verify(auditSink, times(2)).record(argThat(entry -> AuditEntry.RELEVANCE_CHECK.equals(entry.category())));
    }

    @Test
    @DisplayName("Disabled audit logging records nothing")
    void auditDisabled() {
        validator.updateValidationConfig(ActionRelevanceConfig.defaults().toBuilder().enableAuditLogging(false).build());

        validator.validateActionRelevance(request(action("e-1", "send_email", ActionScope.HYBRID, Map.of("dealStatus", "open")))).join();

        assertThat(auditLog.size()).isZero();
        verify(auditSink, never()).record(any());
    }

    @Test
    @DisplayName("Invalid config updates are rejected and the previous config stays")
    void invalidConfigRejected() {
        ActionRelevanceConfig before = validator.getValidationConfig();

        assertThatThrownBy(() -> validator.updateValidationConfig(before.toBuilder().minimumConfidenceScore(1.5).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validator.updateValidationConfig(before.toBuilder().batchParallelism(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(validator.getValidationConfig()).isSameAs(before);
    }

    // ================================================================
    // HELPERS
    // ================================================================

    @Test
    @DisplayName("Alternatives are new pending actions pointing back at the original")
    void alternatives() {
        ScheduledAction original = action("f-1", "Congrats_Email", ActionScope.REAL_WORLD, Map.of());

        List<ScheduledAction> alternatives = validator.suggestAlternativeActions(original, neutralContext(), "t-f");

        assertThat(alternatives).singleElement().satisfies(alt -> {
            assertThat(alt.getActionType()).isEqualTo("follow_up_email");
            assertThat(alt.getId()).isNotEqualTo("f-1");
            assertThat(alt.getContactId()).isEqualTo("c-1");
            assertThat(alt.getParameters()).containsEntry("suggestedAlternativeOf", "f-1");
            assertThat(alt.getExecuteAt()).isAfter(Instant.now().plus(Duration.ofMinutes(59)));
        });
        assertThat(validator.suggestAlternativeActions(action("f-2", "call", ActionScope.HYBRID, Map.of()), null, "t")).isEmpty();
    }

    @Test
    @DisplayName("Quick check uses the rule tiers only")
    void quickCheck() {
        ContactContext context = neutralContext();

        assertThat(validator.isActionStillRelevant(action("g-1", "x", ActionScope.HYBRID, Map.of("dealStatus", "open")), context, "t")).isTrue();
        assertThat(validator.isActionStillRelevant(action("g-2", "x", ActionScope.HYBRID, Map.of("dealStatus", "won")), context, "t")).isFalse();
        assertThat(validator.isActionStillRelevant(action("g-3", "x", ActionScope.INNER_WORLD, Map.of()), context, "t")).isTrue();
        assertThat(validator.isActionStillRelevant(action("g-4", "x", ActionScope.HYBRID, Map.of()), context, "t")).isFalse();
        assertThat(validator.isActionStillRelevant(null, context, "t")).isFalse();
        verifyNoInteractions(llmJudge);
    }
}
