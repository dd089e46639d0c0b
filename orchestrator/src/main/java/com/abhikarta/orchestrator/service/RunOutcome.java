package com.abhikarta.orchestrator.service;

/** How a worker run ended. */
public enum RunOutcome {
    /** Workflow reached COMPLETED. */
    COMPLETED,
    /** Workflow is waiting on at least one HITL request. */
    SUSPENDED,
    /** Workflow is FAILED, or was already terminal when the run started. */
    FAILED,
    /** The workflow was not RUNNING, or stopped running mid-run; nothing more was dispatched. */
    NOT_RUNNABLE
}
