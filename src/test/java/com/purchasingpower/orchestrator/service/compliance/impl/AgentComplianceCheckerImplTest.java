package com.purchasingpower.orchestrator.service.compliance.impl;

import com.purchasingpower.orchestrator.client.AuditSink;
import com.purchasingpower.orchestrator.exception.ComplianceViolationException;
import com.purchasingpower.orchestrator.model.action.AgentAction;
import com.purchasingpower.orchestrator.model.agent.AgentResponse;
import com.purchasingpower.orchestrator.model.audit.AuditEntry;
import com.purchasingpower.orchestrator.model.compliance.ComplianceAuditReport;
import com.purchasingpower.orchestrator.model.compliance.ComplianceValidationResult;
import com.purchasingpower.orchestrator.model.compliance.ComplianceViolation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("Agent Compliance Checker Tests")
class AgentComplianceCheckerImplTest {

    @Mock
    private AuditSink auditSink;

    private AgentComplianceCheckerImpl checker;

    private final AgentResponse response = AgentResponse.builder().success(true).agentId("scheduler").build();

    @BeforeEach
    void setUp() {
        checker = new AgentComplianceCheckerImpl(auditSink, Runnable::run);
    }

    private static AgentAction validated(String type) {
        return AgentAction.builder().actionType(type).build().withValidation("Hybrid: ok", 0.9, false, null);
    }

    @Test
    @DisplayName("An action is compliant only with a reason, an in-range confidence and a satisfied approval")
    void actionInvariant() {
        assertThat(checker.isActionValidated(validated("send_email"))).isTrue();
        assertThat(checker.isActionValidated(validated("send_email").withValidation("RealWorld: ok", 0.9, true, "req-1"))).isTrue();

        assertThat(checker.isActionValidated(AgentAction.builder().actionType("raw").build())).isFalse();
        assertThat(checker.isActionValidated(validated("x").withValidation("", 0.9, false, null))).isFalse();
        assertThat(checker.isActionValidated(validated("x").withValidation("ok", 0.9, true, ""))).isFalse();
        assertThat(checker.isActionValidated(validated("x").withValidation("ok", Double.NaN, false, null))).isFalse();
        assertThat(checker.isActionValidated(validated("x").withValidation("ok", 1.2, false, null))).isFalse();
        assertThat(checker.isActionValidated(validated("x").withValidation("ok", 0.9, true, null))).isFalse();
        assertThat(checker.isActionValidated(null)).isFalse();
    }

    @Test
    @DisplayName("Only empty text fails the invariant, whitespace still counts as present")
    void whitespaceIsNotEmpty() {
        // Given
        AgentAction spacedReason = validated("x").withValidation(" ", 0.5, false, null);
        AgentAction spacedApproval = validated("x").withValidation("ok", 0.5, true, " ");

        // When / Then
        assertThat(checker.isActionValidated(spacedReason)).isTrue();
        assertThat(checker.isActionValidated(spacedApproval)).isTrue();
        assertThat(checker.ensureCompliance(response, List.of(spacedReason, spacedApproval), "t-ws").isCompliant()).isTrue();
    }

    @Test
    @DisplayName("A saturated audit executor never reaches the caller")
    void executorRejectionContained() {
        // Given
        AgentComplianceCheckerImpl saturated = new AgentComplianceCheckerImpl(auditSink, task -> {
            throw new RejectedExecutionException("queue full");
        });

        // When
        ComplianceValidationResult result = saturated.validateAgentResponse(response,
                List.of(AgentAction.builder().actionType("send_sms").build()), "t-rej");

        // Then
        assertThat(result.isCompliant()).isFalse();
        assertThat(result.getViolations()).hasSize(1);
        assertThat(saturated.generateComplianceAuditReport(null, null).getTotalViolations()).isEqualTo(1);
        verifyNoInteractions(auditSink);
    }

    @Test
    @DisplayName("Compliant response produces no violations")
    void compliantResponse() {
        ComplianceValidationResult result = checker.validateAgentResponse(response,
                List.of(validated("a"), validated("b")), "t-1");

        assertThat(result.isCompliant()).isTrue();
        assertThat(result.getTotalActions()).isEqualTo(2);
        assertThat(result.getValidatedActions()).isEqualTo(2);
        verifyNoInteractions(auditSink);
    }

    @Test
    @DisplayName("Each unvalidated action is reported as a critical violation")
    void violationsReported() {
        AgentAction raw = AgentAction.builder().actionType("send_sms").agentId("sms-agent").build();
        AgentAction anonymous = AgentAction.builder().actionType("call").build();

        ComplianceValidationResult result = checker.validateAgentResponse(response,
                List.of(validated("a"), raw, anonymous), "t-2");

        assertThat(result.isCompliant()).isFalse();
        assertThat(result.getUnvalidatedActions()).isEqualTo(2);
        assertThat(result.getViolations()).extracting(ComplianceViolation::getAgentId)
                .containsExactly("sms-agent", "scheduler");
        assertThat(result.getViolations()).allSatisfy(v -> {
            assertThat(v.getSeverity()).isEqualTo(ComplianceViolation.SEVERITY_CRITICAL);
            assertThat(v.getViolationType()).isEqualTo(ComplianceViolation.UNVALIDATED_ACTION);
            assertThat(v.getTraceId()).isEqualTo("t-2");
        });
        verify(auditSink, times(2)).record(argThat(entry -> AuditEntry.COMPLIANCE_VIOLATION.equals(entry.category())));
    }

    @Test
    @DisplayName("ensureCompliance throws with the failing result attached")
    void ensureComplianceThrows() {
        List<AgentAction> actions = List.of(AgentAction.builder().actionType("send_sms").build());

        assertThatThrownBy(() -> checker.ensureCompliance(response, actions, "t-3"))
                .isInstanceOf(ComplianceViolationException.class)
                .hasMessage("Agent response contains 1 unvalidated action(s) out of 1")
                .satisfies(e -> assertThat(((ComplianceViolationException) e).getResult().isCompliant()).isFalse());
        assertThat(checker.ensureCompliance(response, List.of(), "t-4").isCompliant()).isTrue();
    }

    @Test
    @DisplayName("Audit sink failure never reaches the caller")
    void sinkFailureContained() {
        doThrow(new IllegalStateException("audit store down")).when(auditSink).record(any());

        ComplianceValidationResult result = checker.validateAgentResponse(response,
                List.of(AgentAction.builder().actionType("send_sms").build()), "t-5");

        assertThat(result.isCompliant()).isFalse();
        assertThat(checker.generateComplianceAuditReport(null, null).getTotalViolations()).isEqualTo(1);
    }

    @Test
    @DisplayName("Report aggregates checks and violations in the window")
    void report() {
        Instant start = Instant.now().minusSeconds(1);
        checker.validateAgentResponse(response, List.of(validated("a"), validated("b")), "t-6");
        checker.validateAgentResponse(response, List.of(
                validated("c"),
                AgentAction.builder().actionType("send_sms").build(),
                AgentAction.builder().actionType("send_sms").agentId("sms-agent").build()), "t-7");

        ComplianceAuditReport report = checker.generateComplianceAuditReport(start, Instant.now().plusSeconds(1));

        assertThat(report.getTotalChecks()).isEqualTo(2);
        assertThat(report.getTotalActions()).isEqualTo(5);
        assertThat(report.getValidatedActions()).isEqualTo(3);
        assertThat(report.getComplianceRate()).isEqualTo(0.6);
        assertThat(report.getViolationsByAgent()).containsEntry("scheduler", 1L).containsEntry("sms-agent", 1L);
        assertThat(report.getViolationsByType()).containsEntry("send_sms", 2L);

        ComplianceAuditReport empty = checker.generateComplianceAuditReport(
                Instant.now().plus(Duration.ofHours(1)), null);
        assertThat(empty.getTotalActions()).isZero();
        assertThat(empty.getComplianceRate()).isEqualTo(1.0);
    }
}
