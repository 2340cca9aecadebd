package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.model.workflow.WorkflowState;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Owner of all workflow state, keyed by workflow id.
 *
 * <p>Mutations go through {@link #update}, which applies the change atomically for that id.
 * Reads return snapshots that later updates do not affect.
 */
public interface WorkflowStateStore {

    /**
     * Store a fresh state, replacing whatever the id held before.
     */
    void put(WorkflowState state);

    Optional<WorkflowState> get(String workflowId);

    /**
     * Apply a mutation atomically.
     *
     * @return snapshot after the mutation, empty if the id is unknown
     */
    Optional<WorkflowState> update(String workflowId, Consumer<WorkflowState> mutation);

    boolean remove(String workflowId);

    int size();
}
