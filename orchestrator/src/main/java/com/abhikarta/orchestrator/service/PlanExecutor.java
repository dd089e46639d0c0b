package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.graph.Graph;
import com.abhikarta.orchestrator.graph.Node;
import com.abhikarta.orchestrator.graph.NodeCondition;
import com.abhikarta.orchestrator.graph.NodeStatus;
import com.abhikarta.orchestrator.graph.NodeType;
import com.abhikarta.orchestrator.model.HitlStatus;
import com.abhikarta.orchestrator.model.Workflow;
import com.abhikarta.orchestrator.planning.ExecutionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Runs a compiled plan under its execution mode.
 *
 * Same driver as the DAG scheduler (rebuild from rows, propagate failures,
 * compute ready set) with three differences:
 * <ol>
 *   <li>Batch size depends on the mode: PARALLEL runs every dispatchable ready
 *       step, every other mode runs only the first in step order.</li>
 *   <li>After each batch, a completed checkpoint step without an APPROVED
 *       request for the current pass raises a HITL request and suspends.</li>
 *   <li>CONDITIONAL evaluates a step's condition before dispatch; LOOP starts
 *       another pass when all steps are terminal, up to max_iterations.</li>
 * </ol>
 * Only persisted state crosses a suspension: loop pass, node rows and HITL
 * requests are all read back on resume.
 */
@Component
public class PlanExecutor {

    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    private final WorkflowStore          store;
    private final NodeDispatcher         dispatcher;
    private final StepConditionEvaluator conditions;

    public PlanExecutor(WorkflowStore store, NodeDispatcher dispatcher, StepConditionEvaluator conditions) {
        this.store      = store;
        this.dispatcher = dispatcher;
        this.conditions = conditions;
    }

    /**
     * @throws WorkflowDeadlockException if the plan stalls
     */
    public RunOutcome run(Workflow workflow) {
        UUID workflowId = workflow.getId();
        ExecutionMode mode = workflow.getExecutionMode() == null
                ? ExecutionMode.SEQUENTIAL
                : ExecutionMode.fromValue(workflow.getExecutionMode());
        Graph graph = store.loadGraph(workflowId);
        Set<String> approvedCheckpoints = new HashSet<>();

        while (true) {
            if (!store.isRunning(workflowId)) {
                log.info("Workflow {} stopped running; worker exits", workflowId);
                return RunOutcome.NOT_RUNNABLE;
            }

            List<Node> awaitingReview = unapprovedCheckpoints(workflow, graph, approvedCheckpoints);
            if (!awaitingReview.isEmpty()) {
                store.suspendForHuman(workflowId, awaitingReview, workflow.getLoopIteration());
                log.info("Workflow {} paused at checkpoint(s) {}", workflowId,
                        awaitingReview.stream().map(Node::getNodeId).toList());
                return RunOutcome.SUSPENDED;
            }

            List<Node> skipped = graph.propagateFailures();
            if (!skipped.isEmpty()) {
                store.recordSkipped(workflowId, skipped);
            }

            List<Node> ready = graph.getReadyNodes(graph.satisfiedIds());
            List<Node> dispatchable = ready.stream()
                    .filter(n -> n.getType() != NodeType.HUMAN_IN_LOOP)
                    .toList();

            if (!dispatchable.isEmpty()) {
                List<Node> batch = switch (mode) {
                    case PARALLEL -> dispatchable;
                    case SEQUENTIAL, CONDITIONAL, LOOP -> dispatchable.subList(0, 1);
                };
                for (Node node : batch) {
                    if (node.getStatus() != NodeStatus.PENDING) {
                        continue;   // skipped as a branch of an earlier step in this batch
                    }
                    if (mode == ExecutionMode.CONDITIONAL && !conditionHolds(workflow, node, graph)) {
                        continue;
                    }
                    if (!dispatcher.execute(workflow, node, inputFor(node, graph))) {
                        return RunOutcome.NOT_RUNNABLE;
                    }
                }
                continue;
            }

            if (graph.isTerminal()) {
                if (mode == ExecutionMode.LOOP && anotherPass(workflow, graph)) {
                    int next = store.startNextIteration(workflowId);
                    workflow.setLoopIteration(next);
                    graph.resetAll();
                    approvedCheckpoints.clear();
                    log.info("Workflow {} starting loop pass {}/{}", workflowId, next + 1,
                            workflow.getMaxIterations());
                    continue;
                }
                store.completeWorkflow(workflowId, graph);
                return RunOutcome.COMPLETED;
            }

            List<Node> humanReady = ready.stream()
                    .filter(n -> n.getType() == NodeType.HUMAN_IN_LOOP)
                    .toList();
            if (!humanReady.isEmpty() || !graph.nodesIn(NodeStatus.WAITING_HITL).isEmpty()) {
                humanReady.forEach(Node::awaitHuman);
                store.suspendForHuman(workflowId, humanReady, workflow.getLoopIteration());
                return RunOutcome.SUSPENDED;
            }

            throw new WorkflowDeadlockException(workflowId,
                    graph.nodesIn(NodeStatus.PENDING).stream().map(Node::getNodeId).toList());
        }
    }

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    private List<Node> unapprovedCheckpoints(Workflow workflow, Graph graph, Set<String> approved) {
        List<Node> pending = new ArrayList<>();
        for (Node node : graph.nodes()) {
            if (!node.isCheckpoint()
                    || node.getStatus() != NodeStatus.COMPLETED
                    || approved.contains(node.getNodeId())) {
                continue;
            }
            Optional<HitlStatus> status = store.checkpointStatus(
                    workflow.getId(), node.getNodeId(), workflow.getLoopIteration());
            if (status.isPresent() && status.get() == HitlStatus.APPROVED) {
                approved.add(node.getNodeId());
            } else {
                pending.add(node);
            }
        }
        return pending;
    }

    // ------------------------------------------------------------------
    // Conditional and loop mode
    // ------------------------------------------------------------------

    /**
     * False skips the step and its branches. Such skips are not failures:
     * dependents of a skipped step still run.
     */
    private boolean conditionHolds(Workflow workflow, Node node, Graph graph) {
        NodeCondition condition = node.getCondition();
        if (condition == null
                || conditions.evaluate(condition.expression(), graph, workflow.getLoopIteration())) {
            return true;
        }
        List<Node> skipped = new ArrayList<>();
        node.skip("Condition not met: " + condition.expression(), false);
        skipped.add(node);
        for (String branchId : condition.branches()) {
            graph.getNode(branchId)
                    .filter(b -> b.getStatus() == NodeStatus.PENDING)
                    .ifPresent(b -> {
                        b.skip("Branch of '" + node.getNodeId() + "' not taken", false);
                        skipped.add(b);
                    });
        }
        store.recordSkipped(workflow.getId(), skipped);
        log.info("Step '{}' skipped: condition '{}' is false", node.getNodeId(), condition.expression());
        return false;
    }

    private boolean anotherPass(Workflow workflow, Graph graph) {
        int completedPasses = workflow.getLoopIteration() + 1;
        if (completedPasses >= workflow.getMaxIterations()) {
            return false;
        }
        String condition = workflow.getLoopCondition();
        return condition == null || condition.isBlank()
                || conditions.evaluate(condition, graph, completedPasses);
    }

    // ------------------------------------------------------------------
    // Step input
    // ------------------------------------------------------------------

    /**
     * The step's own input, plus {@code previous_result} when the step asks for
     * it: the single dependency's result, or a map keyed by dependency id.
     */
    private Map<String, Object> inputFor(Node node, Graph graph) {
        Map<String, Object> input = new LinkedHashMap<>(node.getInput());
        if (!node.isUsePreviousResult() || node.getDependencies().isEmpty()) {
            return input;
        }
        Map<String, Object> previous = new LinkedHashMap<>();
        for (String depId : node.getDependencies()) {
            graph.getNode(depId)
                    .filter(dep -> dep.getResult() != null)
                    .ifPresent(dep -> previous.put(depId, dep.getResult()));
        }
        if (node.getDependencies().size() == 1) {
            Object only = previous.values().stream().findFirst().orElse(null);
            if (only != null) {
                input.put("previous_result", only);
            }
        } else if (!previous.isEmpty()) {
            input.put("previous_result", previous);
        }
        return input;
    }
}
