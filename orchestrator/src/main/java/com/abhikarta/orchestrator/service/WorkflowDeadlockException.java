package com.abhikarta.orchestrator.service;

import java.util.List;
import java.util.UUID;

/**
 * A workflow can make no further progress: nothing is ready, nothing waits
 * for a human, and not every node is terminal.
 */
public class WorkflowDeadlockException extends RuntimeException {

    private final UUID workflowId;
    private final List<String> stuckNodeIds;

    public WorkflowDeadlockException(UUID workflowId, List<String> stuckNodeIds) {
        super("no runnable nodes; pending: " + String.join(", ", stuckNodeIds));
        this.workflowId   = workflowId;
        this.stuckNodeIds = List.copyOf(stuckNodeIds);
    }

    public UUID         getWorkflowId()   { return workflowId; }
    public List<String> getStuckNodeIds() { return stuckNodeIds; }
}
