package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.dag.DagRegistry;
import com.abhikarta.orchestrator.graph.Graph;
import com.abhikarta.orchestrator.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for DAG workflows.
 *
 * Starting a workflow persists it and hands it to the worker pool; the call
 * returns as soon as the rows are committed. Callers poll
 * {@link #getWorkflowStatus} for progress.
 */
@Service
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final WorkflowStore      store;
    private final DagRegistry        dagRegistry;
    private final WorkflowWorkerPool workers;

    public WorkflowService(WorkflowStore store, DagRegistry dagRegistry, WorkflowWorkerPool workers) {
        this.store       = store;
        this.dagRegistry = dagRegistry;
        this.workers     = workers;
    }

    public UUID startWorkflow(String dagId, String sessionId, String userId, Graph graph) {
        Workflow workflow = store.createWorkflow(
                new Workflow(dagId, graph.getName(), sessionId, userId), graph);
        log.info("Starting DAG workflow {} ('{}') for user {}", workflow.getId(), dagId, userId);
        workers.submit(workflow.getId());
        return workflow.getId();
    }

    /** @return the new workflow id, or empty if no DAG has that id */
    public Optional<UUID> startWorkflowFromDag(String dagId, String sessionId, String userId) {
        return dagRegistry.createGraphFromDag(dagId)
                .map(graph -> startWorkflow(dagId, sessionId, userId, graph));
    }

    public Optional<WorkflowStatusView> getWorkflowStatus(UUID workflowId) {
        return store.findWorkflow(workflowId).map(workflow -> new WorkflowStatusView(
                workflow,
                store.nodes(workflowId),
                store.events(workflowId),
                store.stepLogs(workflowId),
                store.hitlHistory(workflowId)));
    }

    public List<Workflow> listWorkflows(String userId) {
        return store.listWorkflows(userId);
    }
}
