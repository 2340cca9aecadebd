package com.purchasingpower.orchestrator.workflow.impl;

import com.purchasingpower.orchestrator.agent.AgentHandle;
import com.purchasingpower.orchestrator.agent.impl.AgentRegistryImpl;
import com.purchasingpower.orchestrator.config.OrchestrationProperties;
import com.purchasingpower.orchestrator.model.agent.AgentCapability;
import com.purchasingpower.orchestrator.model.agent.AgentIntent;
import com.purchasingpower.orchestrator.model.agent.AgentRequest;
import com.purchasingpower.orchestrator.model.agent.AgentResponse;
import com.purchasingpower.orchestrator.model.agent.ErrorKind;
import com.purchasingpower.orchestrator.model.workflow.WorkflowState;
import com.purchasingpower.orchestrator.model.workflow.WorkflowStatus;
import com.purchasingpower.orchestrator.workflow.AgentCommunicationBus;
import com.purchasingpower.orchestrator.workflow.AgentConcurrencyLimiter;
import com.purchasingpower.orchestrator.workflow.CancellationSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("Agent Communication Bus Tests")
class AgentCommunicationBusImplTest {

    private OrchestrationProperties properties;
    private AgentRegistryImpl registry;
    private InMemoryWorkflowStateStore store;
    private AgentCommunicationBusImpl bus;

    @BeforeEach
    void setUp() {
        properties = new OrchestrationProperties();
        properties.setAgentCallTimeout(Duration.ofSeconds(2));
        registry = spy(new AgentRegistryImpl(properties));
        store = new InMemoryWorkflowStateStore();
        bus = newBus();
    }

    private AgentCommunicationBusImpl newBus() {
        return new AgentCommunicationBusImpl(registry, store,
                new AgentConcurrencyLimiter(10, Duration.ofSeconds(1)), Runnable::run, properties);
    }

    private void register(String id, AgentHandle handle, AgentIntent... intents) {
        registry.registerAgent(id, handle, AgentCapability.builder()
                .agentId(id)
                .agentName(id)
                .version("1.0.0")
                .supportedIntents(List.of(intents))
                .build());
    }

    private static AgentHandle answering(String content) {
        return request -> CompletableFuture.completedFuture(AgentResponse.builder()
                .success(true)
                .content(content)
                .confidence(0.9)
                .build());
    }

    private static AgentRequest request(AgentIntent intent) {
        return AgentRequest.builder().intent(intent).originalUserInput("hello").build();
    }

    // ================================================================
    // ROUTING
    // ================================================================

    @Test
    @DisplayName("Request is routed to the agent for its intent and metrics are updated exactly once")
    void route_updatesMetricsOnce() {
        // Given
        register("comms", answering("sent"), AgentIntent.COMMUNICATION);

        // When
        AgentResponse response = bus.routeRequest(request(AgentIntent.COMMUNICATION)).join();

        // Then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getAgentId()).isEqualTo("comms");
        assertThat(response.getOrchestrationMethod()).isEqualTo(AgentCommunicationBus.METHOD_CUSTOM);
        verify(registry, times(1)).updateAgentMetrics(eq("comms"), anyLong(), eq(true), anyDouble());
    }

    @Test
    @DisplayName("Missing intent falls back to GENERAL_INQUIRY")
    void route_fallsBackToGeneralInquiry() {
        register("general", answering("fallback answer"), AgentIntent.GENERAL_INQUIRY);

        AgentResponse response = bus.routeRequest(request(AgentIntent.MARKET_INTELLIGENCE)).join();

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getAgentId()).isEqualTo("general");
        assertThat(response.getContent()).isEqualTo("fallback answer");
    }

    @Test
    @DisplayName("No agent at all answers NOT_FOUND without touching metrics")
    void route_noSuitableAgent() {
        AgentResponse response = bus.routeRequest(request(AgentIntent.MARKET_INTELLIGENCE)).join();

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getErrorMessage()).isEqualTo("No suitable agents available");
        assertThat(response.getErrorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(response.getStatusCode()).isEqualTo(404);
        verify(registry, times(0)).updateAgentMetrics(anyString(), anyLong(), anyBoolean(), anyDouble());
    }

    @Test
    @DisplayName("Agent exception becomes an INTERNAL failure and a failed metrics sample")
    void route_agentThrows() {
        register("broken", request -> {
            throw new IllegalStateException("database down");
        }, AgentIntent.CONTACT_MANAGEMENT);

        AgentResponse response = bus.routeRequest(request(AgentIntent.CONTACT_MANAGEMENT)).join();

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getErrorKind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(response.getErrorMessage()).contains("database down");
        assertThat(response.isRetryable()).isFalse();
        verify(registry, times(1)).updateAgentMetrics(eq("broken"), anyLong(), eq(false), anyDouble());
    }

    @Test
    @DisplayName("Agent that never answers times out with a retryable TIMEOUT")
    void route_agentTimeout() {
        properties.setAgentCallTimeout(Duration.ofMillis(50));
        bus = newBus();
        register("slow", request -> new CompletableFuture<>(), AgentIntent.DATA_ANALYSIS);

        AgentResponse response = bus.routeRequest(request(AgentIntent.DATA_ANALYSIS))
                .orTimeout(5, TimeUnit.SECONDS).join();

        assertThat(response.getErrorKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(response.isRetryable()).isTrue();
        assertThat(response.getStatusCode()).isEqualTo(503);
        verify(registry, times(1)).updateAgentMetrics(eq("slow"), anyLong(), eq(false), anyDouble());
    }

    @Test
    @DisplayName("Explicit target agent wins over intent-based selection")
    void route_targetAgent() {
        register("a", answering("from a"), AgentIntent.GENERAL_INQUIRY);
        register("b", answering("from b"), AgentIntent.GENERAL_INQUIRY);

        AgentResponse response = bus.routeRequest(request(AgentIntent.GENERAL_INQUIRY).toBuilder()
                .targetAgentId("b").build()).join();

        assertThat(response.getAgentId()).isEqualTo("b");
    }

    @Test
    @DisplayName("Cancelled request is answered without invoking any agent")
    void route_cancelledBeforeRouting() {
        AtomicInteger calls = new AtomicInteger();
        register("a", request -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(AgentResponse.builder().success(true).build());
        }, AgentIntent.GENERAL_INQUIRY);
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel("user left");

        AgentResponse response = bus.routeRequest(request(AgentIntent.GENERAL_INQUIRY), signal).join();

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getErrorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("Orchestration method is validated and stamped on later requests")
    void orchestrationMethod() {
        register("a", answering("ok"), AgentIntent.GENERAL_INQUIRY);

        bus.setOrchestrationMethod(AgentCommunicationBus.METHOD_CONNECTED_AGENT);

        assertThat(bus.routeRequest(request(AgentIntent.GENERAL_INQUIRY)).join().getOrchestrationMethod())
                .isEqualTo(AgentCommunicationBus.METHOD_CONNECTED_AGENT);
        assertThatThrownBy(() -> bus.setOrchestrationMethod("carrier_pigeon"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(bus.getOrchestrationMethod()).isEqualTo(AgentCommunicationBus.METHOD_CONNECTED_AGENT);
    }

    // ================================================================
    // WORKFLOWS
    // ================================================================

    @Test
    @DisplayName("Follow-up response chains a second hop carrying its data, then completes")
    void workflow_followUp() {
        // Given
        register("classifier", request -> CompletableFuture.completedFuture(AgentResponse.builder()
                .success(true)
                .content("summarize this")
                .requiresFollowUp(true)
                .nextIntent(AgentIntent.REPORT_GENERATION)
                .data(Map.of("contactId", "c-1"))
                .build()), AgentIntent.INTENT_CLASSIFICATION);
        register("reporter", request -> CompletableFuture.completedFuture(AgentResponse.builder()
                .success(true)
                .content("report for " + request.getContext().get("contactId"))
                .build()), AgentIntent.REPORT_GENERATION);

        // When
        WorkflowState state = bus.executeWorkflow("wf-1", request(AgentIntent.INTENT_CLASSIFICATION)).join();

        // Then
        assertThat(state.getCurrentState()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(state.isCompleted()).isTrue();
        assertThat(state.getCompletedResponses()).extracting(AgentResponse::getAgentId)
                .containsExactly("classifier", "reporter");
        assertThat(state.getCompletedResponses().get(1).getContent()).isEqualTo("report for c-1");
        assertThat(state.getExecutionHistory()).hasSize(2);
        assertThat(state.getPendingRequests()).isEmpty();
        assertThat(bus.getWorkflowState("wf-1")).get()
                .extracting(WorkflowState::getCurrentState).isEqualTo(WorkflowStatus.COMPLETED);
    }

    @Test
    @DisplayName("Failed hop ends the workflow in ERROR")
    void workflow_failedHop() {
        WorkflowState state = bus.executeWorkflow("wf-2", request(AgentIntent.MARKET_INTELLIGENCE)).join();

        assertThat(state.getCurrentState()).isEqualTo(WorkflowStatus.ERROR);
        assertThat(state.getErrorMessage()).isEqualTo("No suitable agents available");
        assertThat(state.isCompleted()).isFalse();
        assertThat(state.getExecutionHistory()).hasSize(1);
        assertThat(state.getCompletedResponses()).extracting(AgentResponse::isSuccess).containsExactly(false);
    }

    @Test
    @DisplayName("Agents that keep asking for follow-ups are stopped at the hop limit")
    void workflow_hopLimit() {
        properties.setMaxWorkflowHops(3);
        bus = newBus();
        register("loop", request -> CompletableFuture.completedFuture(AgentResponse.builder()
                .success(true)
                .requiresFollowUp(true)
                .nextIntent(AgentIntent.WORKFLOW_AUTOMATION)
                .build()), AgentIntent.WORKFLOW_AUTOMATION);

        WorkflowState state = bus.executeWorkflow("wf-3", request(AgentIntent.WORKFLOW_AUTOMATION)).join();

        assertThat(state.getCurrentState()).isEqualTo(WorkflowStatus.ERROR);
        assertThat(state.getCompletedResponses()).hasSize(3);
        assertThat(state.getErrorMessage()).contains("3 hops");
    }

    @Test
    @DisplayName("Cancelling during a hop lets it finish, then stops the workflow")
    void workflow_cancelledBetweenHops() {
        CancellationSignal signal = CancellationSignal.create();
        register("first", request -> {
            signal.cancel("shutdown");
            return CompletableFuture.completedFuture(AgentResponse.builder()
                    .success(true)
                    .requiresFollowUp(true)
                    .nextIntent(AgentIntent.REPORT_GENERATION)
                    .build());
        }, AgentIntent.INTENT_CLASSIFICATION);
        register("second", answering("never"), AgentIntent.REPORT_GENERATION);

        WorkflowState state = bus.executeWorkflow("wf-4", request(AgentIntent.INTENT_CLASSIFICATION), signal).join();

        assertThat(state.getCurrentState()).isEqualTo(WorkflowStatus.ERROR);
        assertThat(state.getErrorMessage()).isEqualTo("Workflow cancelled: shutdown");
        assertThat(state.getCompletedResponses()).extracting(AgentResponse::getAgentId).containsExactly("first");
    }

    @Test
    @DisplayName("Looking up a finished workflow twice returns equal, independent snapshots")
    void workflowLookup_isIdempotent() {
        // Given
        register("comms", answering("sent"), AgentIntent.COMMUNICATION);
        bus.executeWorkflow("wf-5", request(AgentIntent.COMMUNICATION)).join();

        // When
        WorkflowState first = bus.getWorkflowState("wf-5").orElseThrow();
        WorkflowState second = bus.getWorkflowState("wf-5").orElseThrow();

        // Then
        assertThat(first).isEqualTo(second).isNotSameAs(second);
        assertThat(first.getCompletedResponses()).isNotSameAs(second.getCompletedResponses());

        first.getCompletedResponses().clear();
        first.setCurrentState(WorkflowStatus.ERROR);
        assertThat(bus.getWorkflowState("wf-5")).contains(second);
    }

    @Test
    @DisplayName("Unknown workflow id is reported as absent, repeatedly")
    void unknownWorkflow() {
        assertThat(bus.getWorkflowState("nope")).isEmpty();
        assertThat(bus.getWorkflowState("nope")).isEmpty();
        assertThat(store.size()).isZero();
    }
}
