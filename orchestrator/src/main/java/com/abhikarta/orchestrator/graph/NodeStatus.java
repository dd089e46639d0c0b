package com.abhikarta.orchestrator.graph;

/**
 * Execution state of a single node.
 *
 * Transitions:
 *   PENDING      → RUNNING       (dispatched by the scheduler)
 *   PENDING      → WAITING_HITL  (human_in_loop node whose dependencies are met)
 *   PENDING      → SKIPPED       (upstream failure, or a false branch condition)
 *   RUNNING      → COMPLETED | FAILED
 *   WAITING_HITL → COMPLETED     (human approval)
 *   WAITING_HITL → FAILED        (human rejection)
 *
 * Terminal nodes are never deleted; they stay in the graph as the audit record.
 */
public enum NodeStatus {
    PENDING,
    RUNNING,
    WAITING_HITL,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
