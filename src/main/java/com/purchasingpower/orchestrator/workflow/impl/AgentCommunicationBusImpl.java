package com.purchasingpower.orchestrator.workflow.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.orchestrator.agent.AgentHandle;
import com.purchasingpower.orchestrator.agent.AgentRegistry;
import com.purchasingpower.orchestrator.config.OrchestrationProperties;
import com.purchasingpower.orchestrator.exception.AgentTimeoutException;
import com.purchasingpower.orchestrator.model.agent.AgentCapability;
import com.purchasingpower.orchestrator.model.agent.AgentIntent;
import com.purchasingpower.orchestrator.model.agent.AgentRequest;
import com.purchasingpower.orchestrator.model.agent.AgentResponse;
import com.purchasingpower.orchestrator.model.agent.ErrorKind;
import com.purchasingpower.orchestrator.model.workflow.WorkflowState;
import com.purchasingpower.orchestrator.model.workflow.WorkflowStep;
import com.purchasingpower.orchestrator.util.LogText;
import com.purchasingpower.orchestrator.workflow.AgentCommunicationBus;
import com.purchasingpower.orchestrator.workflow.AgentConcurrencyLimiter;
import com.purchasingpower.orchestrator.workflow.AgentSelector;
import com.purchasingpower.orchestrator.workflow.CancellationSignal;
import com.purchasingpower.orchestrator.workflow.WorkflowStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Default bus: intent lookup, best-agent selection, bounded invocation and workflow tracking.
 *
 * <p>Per request: Received, AgentSelected, Executing, then Completed or Failed. Each routed
 * request that reaches an agent produces exactly one metrics update for that agent.
 *
 * <p>Workflows auto-loop: follow-up hops are chained inside one {@link #executeWorkflow} call,
 * strictly one after another, up to the configured hop limit.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class AgentCommunicationBusImpl implements AgentCommunicationBus {

    private final AgentRegistry registry;
    private final WorkflowStateStore stateStore;
    private final AgentConcurrencyLimiter limiter;
    private final Executor executor;
    private final Duration agentCallTimeout;
    private final AgentIntent fallbackIntent;
    private final int maxWorkflowHops;
    private final AtomicReference<String> orchestrationMethod;

    public AgentCommunicationBusImpl(AgentRegistry registry,
                                     WorkflowStateStore stateStore,
                                     AgentConcurrencyLimiter limiter,
                                     @Qualifier("agentExecutor") Executor executor,
                                     OrchestrationProperties properties) {
        this.registry = registry;
        this.stateStore = stateStore;
        this.limiter = limiter;
        this.executor = executor;
        this.agentCallTimeout = properties.getAgentCallTimeout();
        this.fallbackIntent = properties.getFallbackIntent();
        this.maxWorkflowHops = properties.getMaxWorkflowHops();
        this.orchestrationMethod = new AtomicReference<>(validMethod(properties.getDefaultMethod()));
    }

    // ================================================================
    // ROUTING
    // ================================================================

    @Override
    public CompletableFuture<AgentResponse> routeRequest(AgentRequest request, CancellationSignal cancellation) {
        Preconditions.checkNotNull(request, "request cannot be null");
        CancellationSignal signal = cancellation != null ? cancellation : CancellationSignal.none();

        // Read once so a concurrent method switch does not affect this request
        String method = orchestrationMethod.get();
        AgentRequest stamped = request.toBuilder().orchestrationMethod(method).build();

        if (signal.isCancelled()) {
            log.info("[{}] Request {} cancelled before routing: {}", stamped.getTraceId(), stamped.getId(), signal.getReason());
            ErrorKind kind = signal.isPastDeadline() ? ErrorKind.TIMEOUT : ErrorKind.CANCELLED;
            return CompletableFuture.completedFuture(
                    stamp(AgentResponse.failure(stamped, kind, 503, "Request cancelled: " + signal.getReason()), method));
        }

        Optional<AgentCapability> selected = selectAgent(stamped);
        if (selected.isEmpty()) {
            log.warn("⚠️ [{}] No suitable agent for intent {} (fallback {} also empty)",
                    stamped.getTraceId(), stamped.getIntent(), fallbackIntent);
            return CompletableFuture.completedFuture(stamp(AgentResponse.noSuitableAgent(stamped), method));
        }

        AgentCapability capability = selected.get();
        String agentId = capability.getAgentId();
        log.debug("[{}] Request {} ({}) -> agent {}", stamped.getTraceId(), stamped.getId(), stamped.getIntent(), agentId);

        Optional<AgentHandle> handle = registry.getAgentHandle(agentId);
        if (handle.isEmpty()) {
            // Unregistered between selection and invocation
            registry.updateAgentMetrics(agentId, 0, false, 0.0);
            return CompletableFuture.completedFuture(stamp(AgentResponse.failure(stamped, ErrorKind.NOT_FOUND, 404,
                    "Agent " + agentId + " is no longer registered").toBuilder().agentId(agentId).build(), method));
        }

        long start = System.nanoTime();
        return limiter.acquire(capability.concurrencyKey())
                .thenComposeAsync(permit -> invoke(handle.get(), stamped).whenComplete((r, e) -> permit.release()), executor)
                .handle((response, error) -> complete(stamped, agentId, method, start, response, error));
    }

    private Optional<AgentCapability> selectAgent(AgentRequest request) {
        String target = request.getTargetAgentId();
        if (target != null) {
            Optional<AgentCapability> targeted = registry.getAgentCapability(target).filter(AgentCapability::isActive);
            if (targeted.isPresent()) {
                return targeted;
            }
            log.debug("[{}] Target agent {} unavailable, selecting by intent", request.getTraceId(), target);
        }

        List<AgentCapability> candidates = registry.findAgentsForIntent(request.getIntent(), request.getIndustry());
        if (candidates.isEmpty() && request.getIntent() != fallbackIntent) {
            log.info("[{}] No agent for intent {}, falling back to {}", request.getTraceId(), request.getIntent(), fallbackIntent);
            candidates = registry.findAgentsForIntent(fallbackIntent, request.getIndustry());
        }
        return AgentSelector.selectBest(candidates);
    }

    private CompletableFuture<AgentResponse> invoke(AgentHandle handle, AgentRequest request) {
        CompletableFuture<AgentResponse> call;
        try {
            call = handle.executeTask(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (call == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Agent returned no response future"));
        }
        return call.copy().orTimeout(agentCallTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private AgentResponse complete(AgentRequest request, String agentId, String method, long startNanos,
                                   AgentResponse response, Throwable error) {
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        if (error == null && response != null) {
            registry.updateAgentMetrics(agentId, elapsed, response.isSuccess(), response.getConfidence());
            log.info("{} [{}] Agent {} answered request {} in {}ms", response.isSuccess() ? "✅" : "⚠️",
                    request.getTraceId(), agentId, request.getId(), elapsed);
            return stamp(response.toBuilder()
                    .requestId(request.getId())
                    .traceId(request.getTraceId())
                    .agentId(response.getAgentId() != null ? response.getAgentId() : agentId)
                    .processingTimeMs(elapsed)
                    .build(), method);
        }

        registry.updateAgentMetrics(agentId, elapsed, false, 0.0);
        AgentResponse failure = toFailure(request, agentId, error);
        return stamp(failure.toBuilder().agentId(agentId).processingTimeMs(elapsed).build(), method);
    }

    private AgentResponse toFailure(AgentRequest request, String agentId, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            log.error("🔴 [{}] Agent {} completed request {} without a response", request.getTraceId(), agentId, request.getId());
            return AgentResponse.failure(request, ErrorKind.INTERNAL, 500, "Agent returned no response");
        }
        if (cause instanceof AgentTimeoutException timeout) {
            log.warn("⚠️ [{}] {}", request.getTraceId(), timeout.getMessage());
            return AgentResponse.failure(request, ErrorKind.TIMEOUT, 503, timeout.getMessage());
        }
        if (cause instanceof TimeoutException) {
            String message = "Agent " + agentId + " did not respond within " + agentCallTimeout.toSeconds() + "s";
            log.warn("⚠️ [{}] {}", request.getTraceId(), message);
            return AgentResponse.failure(request, ErrorKind.TIMEOUT, 503, message);
        }
        log.error("🔴 [{}] Agent {} failed on request {}: {}", request.getTraceId(), agentId, request.getId(), cause.getMessage(), cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return AgentResponse.failure(request, ErrorKind.INTERNAL, 500, message);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static AgentResponse stamp(AgentResponse response, String method) {
        return response.toBuilder().orchestrationMethod(method).build();
    }

    // ================================================================
    // WORKFLOWS
    // ================================================================

    @Override
    public CompletableFuture<WorkflowState> executeWorkflow(String workflowId, AgentRequest initialRequest,
                                                            CancellationSignal cancellation) {
        Preconditions.checkArgument(workflowId != null && !workflowId.isBlank(), "workflowId cannot be empty");
        Preconditions.checkNotNull(initialRequest, "initialRequest cannot be null");
        CancellationSignal signal = cancellation != null ? cancellation : CancellationSignal.none();

        WorkflowState state = WorkflowState.start(workflowId, initialRequest, orchestrationMethod.get());
        stateStore.put(state);
        log.info("🚀 [{}] Workflow {} started with intent {}", initialRequest.getTraceId(), workflowId, initialRequest.getIntent());

        return runHop(workflowId, initialRequest, 1, signal)
                .exceptionally(error -> {
                    Throwable cause = unwrap(error);
                    log.error("🔴 [{}] Workflow {} failed: {}", initialRequest.getTraceId(), workflowId, cause.getMessage(), cause);
                    return finish(workflowId, s -> s.markError("Workflow failed: " + cause.getMessage()));
                });
    }

    private CompletableFuture<WorkflowState> runHop(String workflowId, AgentRequest request, int hop, CancellationSignal signal) {
        if (signal.isCancelled()) {
            return CompletableFuture.completedFuture(cancelled(workflowId, signal));
        }

        return routeRequest(request, signal).thenCompose(response -> {
            recordStep(workflowId, request, response, hop);

            if (!response.isSuccess()) {
                log.warn("⚠️ [{}] Workflow {} stopped at hop {}: {}", request.getTraceId(), workflowId, hop, response.getErrorMessage());
                return done(finish(workflowId, s -> s.markError(response.getErrorMessage())));
            }
            if (!response.wantsFollowUp()) {
                log.info("✅ [{}] Workflow {} completed after {} hop(s)", request.getTraceId(), workflowId, hop);
                return done(finish(workflowId, WorkflowState::markCompleted));
            }
            if (hop >= maxWorkflowHops) {
                log.warn("⚠️ [{}] Workflow {} hit the hop limit ({})", request.getTraceId(), workflowId, maxWorkflowHops);
                return done(finish(workflowId, s -> s.markError(
                        "Workflow stopped after " + maxWorkflowHops + " hops without completing")));
            }

            AgentRequest followUp = request.followUp(response);
            stateStore.update(workflowId, s -> s.getPendingRequests().add(followUp));
            log.debug("[{}] Workflow {} hop {} -> follow-up {} ({})", request.getTraceId(), workflowId, hop,
                    followUp.getId(), followUp.getIntent());

            if (signal.isCancelled()) {
                return done(cancelled(workflowId, signal));
            }
            return runHop(workflowId, followUp, hop + 1, signal);
        });
    }

    private void recordStep(String workflowId, AgentRequest request, AgentResponse response, int hop) {
        WorkflowStep step = WorkflowStep.builder()
                .stepName("hop-" + hop + ":" + request.getIntent())
                .agentId(response.getAgentId())
                .completed(response.isSuccess())
                .result(response.isSuccess() ? LogText.truncate(response.getContent(), 2000) : null)
                .errorMessage(response.getErrorMessage())
                .completedAt(Instant.now())
                .build();

        stateStore.update(workflowId, s -> {
            s.getPendingRequests().removeIf(pending -> pending.getId().equals(request.getId()));
            s.getCompletedResponses().add(response);
            s.getExecutionHistory().add(step);
        });
    }

    private WorkflowState cancelled(String workflowId, CancellationSignal signal) {
        log.info("Workflow {} cancelled: {}", workflowId, signal.getReason());
        return finish(workflowId, s -> s.markError("Workflow cancelled: " + signal.getReason()));
    }

    private WorkflowState finish(String workflowId, Consumer<WorkflowState> mutation) {
        return stateStore.update(workflowId, mutation)
                .orElseThrow(() -> new IllegalStateException("Workflow " + workflowId + " disappeared from the store"));
    }

    private static CompletableFuture<WorkflowState> done(WorkflowState state) {
        return CompletableFuture.completedFuture(state);
    }

    @Override
    public Optional<WorkflowState> getWorkflowState(String workflowId) {
        return stateStore.get(workflowId);
    }

    // ================================================================
    // ORCHESTRATION METHOD
    // ================================================================

    @Override
    public void setOrchestrationMethod(String method) {
        String valid = validMethod(method);
        String previous = orchestrationMethod.getAndSet(valid);
        log.info("Orchestration method changed from {} to {}", previous, valid);
    }

    @Override
    public String getOrchestrationMethod() {
        return orchestrationMethod.get();
    }

    private static String validMethod(String method) {
        Preconditions.checkArgument(method != null && ORCHESTRATION_METHODS.contains(method),
                "Unknown orchestration method '%s', expected one of %s", method, ORCHESTRATION_METHODS);
        return method;
    }
}
