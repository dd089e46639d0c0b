package com.abhikarta.orchestrator.service;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs workflows on a fixed pool of worker threads, one worker per workflow.
 *
 * {@link #submit} is the only way to get a workflow executed: facades call it
 * after starting a workflow or resolving a HITL request, the recovery job
 * calls it at startup.
 *
 * A submit for a workflow whose worker is still active does not start a
 * second worker. It marks the workflow for exactly one more run, which
 * happens as soon as the current worker returns, so a resume signal that
 * races with a suspending worker is never lost.
 */
@Component
public class WorkflowWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkflowWorkerPool.class);

    private final WorkflowRunner runner;
    private final Executor       executor;
    private final ExecutorService owned;

    // workflow id → "run again after the current run"; absent means no active worker
    private final ConcurrentMap<UUID, Boolean> active = new ConcurrentHashMap<>();

    @Autowired
    public WorkflowWorkerPool(WorkflowRunner runner, @Value("${abhikarta.workers:4}") int workers) {
        this.runner   = runner;
        this.owned    = Executors.newFixedThreadPool(workers);
        this.executor = owned;
    }

    /** For callers that supply their own executor, e.g. a direct executor in tests. */
    public WorkflowWorkerPool(WorkflowRunner runner, Executor executor) {
        this.runner   = runner;
        this.owned    = null;
        this.executor = executor;
    }

    public void submit(UUID workflowId) {
        boolean[] start = {false};
        active.compute(workflowId, (id, rerun) -> {
            if (rerun == null) {
                start[0] = true;
                return Boolean.FALSE;
            }
            return Boolean.TRUE;
        });
        if (!start[0]) {
            log.debug("Workflow {} already has an active worker; queued one more run", workflowId);
            return;
        }
        try {
            executor.execute(() -> drain(workflowId));
        } catch (RejectedExecutionException e) {
            active.remove(workflowId);
            log.error("Worker pool rejected workflow {}: {}", workflowId, e.getMessage());
        }
    }

    /** True while a worker for this workflow is running or about to run. */
    public boolean isActive(UUID workflowId) {
        return active.containsKey(workflowId);
    }

    private void drain(UUID workflowId) {
        do {
            try {
                RunOutcome outcome = runner.run(workflowId);
                log.debug("Workflow {} worker run ended: {}", workflowId, outcome);
            } catch (RuntimeException e) {
                log.error("Worker for workflow {} crashed: {}", workflowId, e.getMessage(), e);
            }
        } while (rerunRequested(workflowId));
    }

    /** Atomically either consume a pending re-run request or release the workflow. */
    private boolean rerunRequested(UUID workflowId) {
        return active.compute(workflowId, (id, rerun) -> Boolean.TRUE.equals(rerun) ? Boolean.FALSE : null) != null;
    }

    @PreDestroy
    public void shutdown() {
        if (owned != null) {
            owned.shutdown();
        }
    }
}
