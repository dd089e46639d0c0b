package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.model.Workflow;
import com.abhikarta.orchestrator.model.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * One worker run of one workflow, starting from its persisted state.
 *
 * The workflow id is the whole resume token. Only RUNNING workflows are
 * run; DAG executions go to {@link DagScheduler}, plan executions to
 * {@link PlanExecutor}.
 */
@Component
public class WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final WorkflowStore store;
    private final DagScheduler  dagScheduler;
    private final PlanExecutor  planExecutor;

    public WorkflowRunner(WorkflowStore store, DagScheduler dagScheduler, PlanExecutor planExecutor) {
        this.store        = store;
        this.dagScheduler = dagScheduler;
        this.planExecutor = planExecutor;
    }

    public RunOutcome run(UUID workflowId) {
        MDC.put("workflowId", workflowId.toString());
        try {
            Optional<Workflow> found = store.findWorkflow(workflowId);
            if (found.isEmpty()) {
                log.warn("Workflow {} not found; nothing to run", workflowId);
                return RunOutcome.NOT_RUNNABLE;
            }
            Workflow workflow = found.get();
            if (workflow.getState() != WorkflowState.RUNNING) {
                log.debug("Workflow {} is {}; not running", workflowId, workflow.getState());
                return RunOutcome.NOT_RUNNABLE;
            }

            try {
                return workflow.isPlanExecution()
                        ? planExecutor.run(workflow)
                        : dagScheduler.run(workflow);
            } catch (WorkflowDeadlockException e) {
                store.failWorkflow(workflowId, "Deadlock: " + e.getMessage(), null);
                return RunOutcome.FAILED;
            } catch (RuntimeException e) {
                log.error("Unhandled error running workflow {}: {}", workflowId, e.getMessage(), e);
                store.failWorkflow(workflowId, "Worker error: " + e.getMessage(), null);
                return RunOutcome.FAILED;
            }
        } finally {
            MDC.clear();
        }
    }
}
