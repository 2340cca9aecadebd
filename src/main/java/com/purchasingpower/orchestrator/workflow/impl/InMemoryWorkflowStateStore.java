package com.purchasingpower.orchestrator.workflow.impl;

import com.purchasingpower.orchestrator.model.workflow.WorkflowState;
import com.purchasingpower.orchestrator.workflow.WorkflowStateStore;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Process-local store. State lives as long as the process; nothing is persisted.
 */
@Component
public class InMemoryWorkflowStateStore implements WorkflowStateStore {

    private final Map<String, WorkflowState> workflows = new ConcurrentHashMap<>();

    @Override
    public void put(WorkflowState state) {
        workflows.put(state.getWorkflowId(), state.snapshot());
    }

    @Override
    public Optional<WorkflowState> get(String workflowId) {
        if (workflowId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(workflows.get(workflowId)).map(this::read);
    }

    @Override
    public Optional<WorkflowState> update(String workflowId, Consumer<WorkflowState> mutation) {
        WorkflowState[] after = new WorkflowState[1];
        workflows.computeIfPresent(workflowId, (id, state) -> {
            mutation.accept(state);
            after[0] = state.snapshot();
            return state;
        });
        return Optional.ofNullable(after[0]);
    }

    @Override
    public boolean remove(String workflowId) {
        return workflowId != null && workflows.remove(workflowId) != null;
    }

    @Override
    public int size() {
        return workflows.size();
    }

    // Snapshot under the key's lock so a concurrent update is never half-visible
    private WorkflowState read(WorkflowState state) {
        WorkflowState[] copy = new WorkflowState[1];
        workflows.computeIfPresent(state.getWorkflowId(), (id, current) -> {
            copy[0] = current.snapshot();
            return current;
        });
        return copy[0];
    }
}
