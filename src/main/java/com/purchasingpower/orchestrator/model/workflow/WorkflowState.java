package com.purchasingpower.orchestrator.model.workflow;

import com.purchasingpower.orchestrator.model.agent.AgentRequest;
import com.purchasingpower.orchestrator.model.agent.AgentResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one caller-identified workflow.
 *
 * <p>Terminal once {@code completed} is set or {@code currentState} is ERROR.
 * The store hands out {@link #snapshot()} copies, so readers never see a half-applied step.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowState {

    private String workflowId;

    private String traceId;

    @Builder.Default
    private WorkflowStatus currentState = WorkflowStatus.PROCESSING;

    @Builder.Default
    private List<AgentRequest> pendingRequests = new ArrayList<>();

    @Builder.Default
    private List<AgentResponse> completedResponses = new ArrayList<>();

    @Builder.Default
    private List<WorkflowStep> executionHistory = new ArrayList<>();

    private boolean completed;

    private String errorMessage;

    private String orchestrationMethod;

    private Instant startedAt;

    private Instant completedAt;

    public static WorkflowState start(String workflowId, AgentRequest initialRequest, String orchestrationMethod) {
        WorkflowState state = WorkflowState.builder()
                .workflowId(workflowId)
                .traceId(initialRequest.getTraceId())
                .orchestrationMethod(orchestrationMethod)
                .startedAt(Instant.now())
                .build();
        state.getPendingRequests().add(initialRequest);
        return state;
    }

    public void markCompleted() {
        this.completed = true;
        this.currentState = WorkflowStatus.COMPLETED;
        this.completedAt = Instant.now();
    }

    public void markError(String message) {
        this.currentState = WorkflowStatus.ERROR;
        this.errorMessage = message;
        this.completedAt = Instant.now();
    }

    public WorkflowState snapshot() {
        return toBuilder()
                .pendingRequests(new ArrayList<>(pendingRequests))
                .completedResponses(new ArrayList<>(completedResponses))
                .executionHistory(new ArrayList<>(executionHistory))
                .build();
    }
}
