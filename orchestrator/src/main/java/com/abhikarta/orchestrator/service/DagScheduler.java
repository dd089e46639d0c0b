package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.graph.Graph;
import com.abhikarta.orchestrator.graph.Node;
import com.abhikarta.orchestrator.graph.NodeStatus;
import com.abhikarta.orchestrator.graph.NodeType;
import com.abhikarta.orchestrator.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Drives a DAG workflow from its persisted state to COMPLETED, or to a
 * suspension on human input.
 *
 * Each pass of the loop:
 *   0. Stop if the workflow is no longer RUNNING (a HITL rejection mid-run)
 *   1. Skip every PENDING node below a failed node (persisted)
 *   2. Compute the ready set from COMPLETED and SKIPPED nodes
 *   3. Dispatch every ready agent/tool node, then go again
 *   4. Nothing dispatchable:
 *        all nodes terminal          → complete the workflow
 *        human input ready/awaited   → raise HITL requests and suspend
 *        otherwise                   → {@link WorkflowDeadlockException}
 *
 * A ready human_in_loop node never blocks unrelated ready work: it is only
 * asked about once nothing else can run.
 */
@Component
public class DagScheduler {

    private static final Logger log = LoggerFactory.getLogger(DagScheduler.class);

    private final WorkflowStore  store;
    private final NodeDispatcher dispatcher;

    public DagScheduler(WorkflowStore store, NodeDispatcher dispatcher) {
        this.store      = store;
        this.dispatcher = dispatcher;
    }

    /**
     * @throws WorkflowDeadlockException if the graph stalls
     */
    public RunOutcome run(Workflow workflow) {
        UUID workflowId = workflow.getId();
        Graph graph = store.loadGraph(workflowId);

        while (true) {
            if (!store.isRunning(workflowId)) {
                log.info("Workflow {} stopped running; worker exits", workflowId);
                return RunOutcome.NOT_RUNNABLE;
            }

            List<Node> skipped = graph.propagateFailures();
            if (!skipped.isEmpty()) {
                store.recordSkipped(workflowId, skipped);
            }

            List<Node> ready = graph.getReadyNodes(graph.satisfiedIds());
            List<Node> runnable = ready.stream()
                    .filter(n -> n.getType() != NodeType.HUMAN_IN_LOOP)
                    .toList();

            if (!runnable.isEmpty()) {
                log.debug("Workflow {}: dispatching batch {}", workflowId,
                        runnable.stream().map(Node::getNodeId).toList());
                for (Node node : runnable) {
                    if (!dispatcher.execute(workflow, node, node.getInput())) {
                        return RunOutcome.NOT_RUNNABLE;
                    }
                }
                continue;
            }

            if (graph.isTerminal()) {
                store.completeWorkflow(workflowId, graph);
                return RunOutcome.COMPLETED;
            }

            List<Node> humanReady = ready.stream()
                    .filter(n -> n.getType() == NodeType.HUMAN_IN_LOOP)
                    .toList();
            if (!humanReady.isEmpty() || !graph.nodesIn(NodeStatus.WAITING_HITL).isEmpty()) {
                humanReady.forEach(Node::awaitHuman);
                store.suspendForHuman(workflowId, humanReady, 0);
                log.info("Workflow {} waiting for human input", workflowId);
                return RunOutcome.SUSPENDED;
            }

            throw new WorkflowDeadlockException(workflowId,
                    graph.nodesIn(NodeStatus.PENDING).stream().map(Node::getNodeId).toList());
        }
    }
}
