package com.abhikarta.orchestrator.model;

/**
 * Lifecycle of a Workflow row.
 *
 * Transitions:
 *   RUNNING → COMPLETED                 every node terminal
 *   RUNNING → WAITING_HITL → RUNNING    suspended on a human checkpoint, then approved
 *   RUNNING | WAITING_HITL → FAILED     HITL rejection or deadlock
 */
public enum WorkflowState {
    RUNNING,
    WAITING_HITL,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Lowercase form used in API payloads. */
    public String value() {
        return name().toLowerCase();
    }
}
