package com.abhikarta.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Resubmits workflows left RUNNING by a previous process.
 *
 * Their workers died with the JVM. Nodes caught mid-call are reset to PENDING
 * when the graph is reloaded, so such a node may be dispatched a second time.
 */
@Component
public class WorkflowRecoveryJob {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRecoveryJob.class);

    private final WorkflowStore      store;
    private final WorkflowWorkerPool pool;

    public WorkflowRecoveryJob(WorkflowStore store, WorkflowWorkerPool pool) {
        this.store = store;
        this.pool  = pool;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverRunningWorkflows() {
        List<UUID> orphaned = store.findRunningWorkflowIds();
        if (orphaned.isEmpty()) {
            return;
        }
        log.warn("Resuming {} workflow(s) left RUNNING by a previous process", orphaned.size());
        orphaned.forEach(pool::submit);
    }
}
