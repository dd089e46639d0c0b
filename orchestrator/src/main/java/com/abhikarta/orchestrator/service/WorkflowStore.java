package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.graph.Graph;
import com.abhikarta.orchestrator.graph.Node;
import com.abhikarta.orchestrator.graph.NodeCondition;
import com.abhikarta.orchestrator.graph.NodeStatus;
import com.abhikarta.orchestrator.graph.NodeType;
import com.abhikarta.orchestrator.model.*;
import com.abhikarta.orchestrator.repository.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The only writer of workflow state.
 *
 * Every public method is one transaction keyed by primary key. Workers call
 * in here between capability calls, never around them, so a slow agent never
 * holds a connection or a lock.
 *
 * Transitions lock the workflow row (plan row for approve/reject) before
 * reading its state; a transition that finds the workflow no longer in the
 * state it expects does nothing.
 *
 * Workers own an in-memory Graph only while running. Whatever they need after
 * a suspension or a restart must be written here first: {@link #loadGraph}
 * rebuilds the Graph from workflow_nodes rows alone.
 */
@Service
public class WorkflowStore {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStore.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {};

    private final WorkflowRepository      workflowRepo;
    private final WorkflowNodeRepository  nodeRepo;
    private final WorkflowEventRepository eventRepo;
    private final HitlRequestRepository   hitlRepo;
    private final StepLogRepository       stepLogRepo;
    private final PlanRepository          planRepo;
    private final ObjectMapper            objectMapper;

    public WorkflowStore(WorkflowRepository workflowRepo,
                         WorkflowNodeRepository nodeRepo,
                         WorkflowEventRepository eventRepo,
                         HitlRequestRepository hitlRepo,
                         StepLogRepository stepLogRepo,
                         PlanRepository planRepo,
                         ObjectMapper objectMapper) {
        this.workflowRepo = workflowRepo;
        this.nodeRepo     = nodeRepo;
        this.eventRepo    = eventRepo;
        this.hitlRepo     = hitlRepo;
        this.stepLogRepo  = stepLogRepo;
        this.planRepo     = planRepo;
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Creation and loading
    // ------------------------------------------------------------------

    /**
     * Persist a new RUNNING workflow together with one row per graph node.
     *
     * Steps:
     *  1. Save the Workflow row to obtain its id
     *  2. Save a WorkflowNode row per node, in graph order
     *  3. Store the structural snapshot and a workflow_started event
     */
    @Transactional
    public Workflow createWorkflow(Workflow workflow, Graph graph) {
        Workflow saved = workflowRepo.save(workflow);
        UUID workflowId = saved.getId();

        int position = 0;
        for (Node node : graph.nodes()) {
            nodeRepo.save(toRow(workflowId, node, position++));
        }

        saved.setGraphJson(toJson(graph.snapshot()));
        workflowRepo.save(saved);
        event(workflowId, null, WorkflowEvent.WORKFLOW_STARTED,
                "Started '" + graph.getName() + "' with " + graph.size() + " node(s)");
        log.info("Workflow {} created for graph '{}' ({} nodes)", workflowId, graph.getGraphId(), graph.size());
        return saved;
    }

    /**
     * Approve a plan and start the workflow that executes it, in one transaction.
     *
     * The plan row is locked and its status re-read, so two concurrent
     * approvals (or an approval racing a rejection) cannot both succeed.
     *
     * @return the new workflow, or empty if the plan is no longer pending approval
     */
    @Transactional
    public Optional<Workflow> createPlanWorkflow(UUID planId, String approvedBy, Workflow workflow, Graph graph) {
        Optional<Plan> found = planRepo.lockById(planId)
                .filter(p -> p.getStatus() == PlanStatus.PENDING_APPROVAL);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Plan plan = found.get();
        workflow.setPlanId(planId);
        Workflow saved = createWorkflow(workflow, graph);

        plan.setStatus(PlanStatus.APPROVED);
        plan.setApprovedBy(approvedBy);
        plan.setWorkflowId(saved.getId());
        planRepo.save(plan);
        log.info("Plan {} approved by {}; workflow {} started", planId, approvedBy, saved.getId());
        return Optional.of(saved);
    }

    /** @return false if the plan is unknown or no longer pending approval */
    @Transactional
    public boolean rejectPlan(UUID planId, String userId, String reason) {
        Optional<Plan> found = planRepo.lockById(planId)
                .filter(p -> p.getStatus() == PlanStatus.PENDING_APPROVAL);
        if (found.isEmpty()) {
            return false;
        }
        Plan plan = found.get();
        plan.setStatus(PlanStatus.REJECTED);
        plan.setApprovedBy(userId);
        plan.setRejectionReason(reason);
        planRepo.save(plan);
        log.info("Plan {} rejected by {}: {}", planId, userId, reason);
        return true;
    }

    @Transactional(readOnly = true)
    public List<HitlRequest> pendingHitl(UUID workflowId) {
        return workflowId == null
                ? hitlRepo.findByStatusOrderByCreatedAtAsc(HitlStatus.PENDING)
                : hitlRepo.findByWorkflowIdAndStatusOrderByCreatedAtAsc(workflowId, HitlStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public Optional<HitlRequest> findHitl(UUID hitlId) {
        return hitlRepo.findById(hitlId);
    }

    @Transactional(readOnly = true)
    public List<HitlRequest> hitlHistory(UUID workflowId) {
        return hitlRepo.findByWorkflowIdOrderByCreatedAtAsc(workflowId);
    }

    @Transactional(readOnly = true)
    public Optional<Workflow> findWorkflow(UUID workflowId) {
        return workflowRepo.findById(workflowId);
    }

    @Transactional(readOnly = true)
    public List<Workflow> listWorkflows(String userId) {
        return userId == null || userId.isBlank()
                ? workflowRepo.findAllByOrderByCreatedAtDesc()
                : workflowRepo.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /** Checked by workers before each batch: a rejection may have failed the workflow mid-run. */
    @Transactional(readOnly = true)
    public boolean isRunning(UUID workflowId) {
        return workflowRepo.findById(workflowId)
                .map(w -> w.getState() == WorkflowState.RUNNING)
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public List<UUID> findRunningWorkflowIds() {
        return workflowRepo.findByState(WorkflowState.RUNNING).stream().map(Workflow::getId).toList();
    }

    /**
     * Rebuild the execution Graph of a workflow from its node rows.
     *
     * A row found RUNNING belongs to a worker that died mid-call. It is put
     * back to PENDING and will be dispatched again.
     */
    @Transactional
    public Graph loadGraph(UUID workflowId) {
        Workflow workflow = workflowRepo.findById(workflowId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow: " + workflowId));
        List<WorkflowNode> rows = nodeRepo.findByWorkflowIdOrderByPositionAsc(workflowId);

        Graph graph = new Graph(workflow.getDagId(), workflow.getName(), null);
        for (WorkflowNode row : rows) {
            if (row.getStatus() == NodeStatus.RUNNING) {
                log.warn("Node '{}' of workflow {} was RUNNING with no live worker; resetting to PENDING",
                        row.getNodeId(), workflowId);
                row.setStatus(NodeStatus.PENDING);
                row.setStartedAt(null);
                nodeRepo.save(row);
            }
            graph.addNode(fromRow(row));
        }
        for (WorkflowNode row : rows) {
            for (String dep : fromJson(row.getDependenciesJson(), STRING_LIST, List.<String>of())) {
                graph.addEdge(dep, row.getNodeId());
            }
        }
        return graph;
    }

    // ------------------------------------------------------------------
    // Node transitions
    // ------------------------------------------------------------------

    /**
     * Claim a node for dispatch.
     *
     * @return false, with nothing written, if the workflow is no longer RUNNING
     */
    @Transactional
    public boolean markRunning(UUID workflowId, Node node) {
        Workflow workflow = lockedWorkflow(workflowId);
        if (workflow.getState() != WorkflowState.RUNNING) {
            log.info("Workflow {} is {}; node '{}' not dispatched",
                    workflowId, workflow.getState(), node.getNodeId());
            return false;
        }
        WorkflowNode row = row(workflowId, node.getNodeId());
        row.setStatus(NodeStatus.RUNNING);
        row.setStartedAt(Instant.now());
        nodeRepo.save(row);
        event(workflowId, node.getNodeId(), WorkflowEvent.NODE_STARTED, null);
        return true;
    }

    /**
     * Persist a node's terminal outcome. Plan executions also get a step log
     * entry tagged with the current loop pass.
     */
    @Transactional
    public void recordOutcome(Workflow workflow, Node node) {
        UUID workflowId = workflow.getId();
        WorkflowNode row = row(workflowId, node.getNodeId());
        row.setStatus(node.getStatus());
        row.setResultJson(node.getResult() == null ? null : toJson(node.getResult()));
        row.setError(node.getError());
        row.setFinishedAt(Instant.now());
        nodeRepo.save(row);

        boolean success = node.getStatus() == NodeStatus.COMPLETED;
        event(workflowId, node.getNodeId(),
                success ? WorkflowEvent.NODE_COMPLETED : WorkflowEvent.NODE_FAILED,
                success ? null : node.getError());

        if (workflow.isPlanExecution()) {
            stepLogRepo.save(new StepLog(workflowId, node.getNodeId(), workflow.getLoopIteration(),
                    success, row.getResultJson(), node.getError()));
        }
    }

    @Transactional
    public void recordSkipped(UUID workflowId, List<Node> nodes) {
        for (Node node : nodes) {
            WorkflowNode row = row(workflowId, node.getNodeId());
            row.setStatus(NodeStatus.SKIPPED);
            row.setError(node.getError());
            row.setUpstreamFailed(node.isUpstreamFailed());
            row.setFinishedAt(Instant.now());
            nodeRepo.save(row);
            event(workflowId, node.getNodeId(), WorkflowEvent.NODE_SKIPPED, node.getError());
        }
    }

    // ------------------------------------------------------------------
    // Human-in-the-loop
    // ------------------------------------------------------------------

    /**
     * Raise one HITL request per node and suspend the workflow, atomically.
     *
     * human_in_loop nodes move to WAITING_HITL; plan checkpoint nodes are
     * already COMPLETED and keep their status. A checkpoint that already has
     * a PENDING request for this pass is not asked again.
     *
     * Doing both in one transaction means an approval can never land between
     * "request visible" and "workflow suspended" and be lost.
     */
    @Transactional
    public List<HitlRequest> suspendForHuman(UUID workflowId, List<Node> nodes, int iteration) {
        Workflow workflow = lockedWorkflow(workflowId);
        if (workflow.getState().isTerminal()) {
            return List.of();
        }

        List<HitlRequest> raised = new ArrayList<>();
        for (Node node : nodes) {
            Optional<HitlRequest> existing = hitlRepo
                    .findFirstByWorkflowIdAndNodeIdAndIterationOrderByCreatedAtDesc(
                            workflowId, node.getNodeId(), iteration)
                    .filter(HitlRequest::isPending);
            if (existing.isPresent()) {
                raised.add(existing.get());
                continue;
            }
            if (node.getType() == NodeType.HUMAN_IN_LOOP) {
                WorkflowNode row = row(workflowId, node.getNodeId());
                row.setStatus(NodeStatus.WAITING_HITL);
                nodeRepo.save(row);
            }
            String message = node.getType() == NodeType.HUMAN_IN_LOOP
                    ? node.getMessage()
                    : "Review results at checkpoint " + node.getNodeId();
            HitlRequest request = hitlRepo.save(new HitlRequest(
                    workflowId, node.getNodeId(), workflow.getPlanId(), iteration, message));
            event(workflowId, node.getNodeId(), WorkflowEvent.HITL_REQUESTED, message);
            log.info("HITL request {} raised for node '{}' of workflow {}",
                    request.getId(), node.getNodeId(), workflowId);
            raised.add(request);
        }

        workflow.setState(WorkflowState.WAITING_HITL);
        workflowRepo.save(workflow);
        return raised;
    }

    /** Status of the most recent request for a checkpoint in a given loop pass. */
    @Transactional(readOnly = true)
    public Optional<HitlStatus> checkpointStatus(UUID workflowId, String nodeId, int iteration) {
        return hitlRepo.findFirstByWorkflowIdAndNodeIdAndIterationOrderByCreatedAtDesc(
                        workflowId, nodeId, iteration)
                .map(HitlRequest::getStatus);
    }

    /**
     * Resolve a pending request as approved.
     *
     * A waiting human_in_loop node completes with {@code {approved: true, response}}.
     * The workflow goes back to RUNNING so a worker may pick it up.
     *
     * @return the owning workflow id, or empty if the request is unknown or already resolved
     */
    @Transactional
    public Optional<UUID> approveHitl(UUID hitlId, String userId, String response) {
        Optional<UUID> owner = hitlRepo.findWorkflowIdById(hitlId);
        if (owner.isEmpty()) {
            return Optional.empty();
        }
        UUID workflowId = owner.get();
        Workflow workflow = lockedWorkflow(workflowId);
        Optional<HitlRequest> found = hitlRepo.findById(hitlId).filter(HitlRequest::isPending);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        HitlRequest request = found.get();
        request.resolve(HitlStatus.APPROVED, userId, response);
        hitlRepo.save(request);

        WorkflowNode row = row(workflowId, request.getNodeId());
        if (row.getStatus() == NodeStatus.WAITING_HITL) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("approved", true);
            result.put("response", response);
            row.setStatus(NodeStatus.COMPLETED);
            row.setResultJson(toJson(result));
            row.setError(null);
            row.setFinishedAt(Instant.now());
            nodeRepo.save(row);
        }
        event(workflowId, request.getNodeId(), WorkflowEvent.HITL_APPROVED,
                "Approved by " + userId + (response == null ? "" : ": " + response));

        if (workflow.getState() == WorkflowState.WAITING_HITL) {
            workflow.setState(WorkflowState.RUNNING);
            workflowRepo.save(workflow);
        }
        log.info("HITL request {} approved by {} (workflow {})", hitlId, userId, workflowId);
        return Optional.of(workflowId);
    }

    /**
     * Resolve a pending request as rejected. Terminal for the workflow: the
     * node (if waiting) and the workflow both fail with the rejection reason,
     * and any other pending request of the workflow is closed.
     *
     * @return the owning workflow id, or empty if the request is unknown or already resolved
     */
    @Transactional
    public Optional<UUID> rejectHitl(UUID hitlId, String userId, String reason) {
        Optional<UUID> owner = hitlRepo.findWorkflowIdById(hitlId);
        if (owner.isEmpty()) {
            return Optional.empty();
        }
        UUID workflowId = owner.get();
        Workflow workflow = lockedWorkflow(workflowId);
        Optional<HitlRequest> found = hitlRepo.findById(hitlId).filter(HitlRequest::isPending);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        HitlRequest request = found.get();
        request.resolve(HitlStatus.REJECTED, userId, reason);
        hitlRepo.save(request);

        String error = "HITL rejected: " + (reason == null ? "no reason given" : reason);

        WorkflowNode row = row(workflowId, request.getNodeId());
        if (row.getStatus() == NodeStatus.WAITING_HITL) {
            row.setStatus(NodeStatus.FAILED);
            row.setError(error);
            row.setFinishedAt(Instant.now());
            nodeRepo.save(row);
        }
        event(workflowId, request.getNodeId(), WorkflowEvent.HITL_REJECTED, error);

        for (HitlRequest other : hitlRepo.findByWorkflowIdAndStatusOrderByCreatedAtAsc(
                workflowId, HitlStatus.PENDING)) {
            other.resolve(HitlStatus.REJECTED, userId, "Workflow failed: " + error);
            hitlRepo.save(other);
        }

        log.info("HITL request {} rejected by {} (workflow {})", hitlId, userId, workflowId);
        terminate(workflow, WorkflowState.FAILED, error, null);
        return Optional.of(workflowId);
    }

    // ------------------------------------------------------------------
    // Loop passes
    // ------------------------------------------------------------------

    /**
     * Reset every node row to PENDING and advance the loop counter.
     *
     * @return the new zero-based pass number
     */
    @Transactional
    public int startNextIteration(UUID workflowId) {
        Workflow workflow = lockedWorkflow(workflowId);
        if (workflow.getState() != WorkflowState.RUNNING) {
            log.warn("Workflow {} is {}; not starting another pass", workflowId, workflow.getState());
            return workflow.getLoopIteration();
        }
        int next = workflow.getLoopIteration() + 1;
        workflow.setLoopIteration(next);
        workflowRepo.save(workflow);

        for (WorkflowNode row : nodeRepo.findByWorkflowIdOrderByPositionAsc(workflowId)) {
            row.setStatus(NodeStatus.PENDING);
            row.setResultJson(null);
            row.setError(null);
            row.setUpstreamFailed(false);
            row.setStartedAt(null);
            row.setFinishedAt(null);
            nodeRepo.save(row);
        }
        event(workflowId, null, WorkflowEvent.LOOP_ITERATION, "Starting pass " + (next + 1));
        return next;
    }

    // ------------------------------------------------------------------
    // Terminal transitions
    // ------------------------------------------------------------------

    /**
     * Every node is terminal. The workflow completes even when some nodes
     * failed; the result JSON says how many.
     */
    @Transactional
    public void completeWorkflow(UUID workflowId, Graph graph) {
        Map<String, Object> results = new LinkedHashMap<>();
        for (Node node : graph.nodes()) {
            if (node.getStatus() == NodeStatus.COMPLETED) {
                results.put(node.getNodeId(), node.getResult());
            }
        }
        int failed = graph.nodesIn(NodeStatus.FAILED).size();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("success", failed == 0);
        summary.put("completed", graph.nodesIn(NodeStatus.COMPLETED).size());
        summary.put("failed", failed);
        summary.put("skipped", graph.nodesIn(NodeStatus.SKIPPED).size());
        summary.put("results", results);

        Workflow workflow = lockedWorkflow(workflowId);
        if (workflow.getState().isTerminal()) {
            log.warn("Workflow {} already {}; not completing", workflowId, workflow.getState());
            return;
        }
        workflow.setResultJson(toJson(summary));
        terminate(workflow, WorkflowState.COMPLETED, null, graph);
    }

    @Transactional
    public void failWorkflow(UUID workflowId, String error, Graph graph) {
        terminate(lockedWorkflow(workflowId), WorkflowState.FAILED, error, graph);
    }

    private void terminate(Workflow workflow, WorkflowState state, String error, Graph graph) {
        if (workflow.getState().isTerminal()) {
            log.warn("Workflow {} already {}; ignoring transition to {}",
                    workflow.getId(), workflow.getState(), state);
            return;
        }
        workflow.setState(state);
        workflow.setError(error);
        workflow.setCompletedAt(Instant.now());
        if (graph != null) {
            workflow.setGraphJson(toJson(graph.snapshot()));
        }
        workflowRepo.save(workflow);

        if (state == WorkflowState.COMPLETED) {
            event(workflow.getId(), null, WorkflowEvent.WORKFLOW_COMPLETED, workflow.getResultJson());
            log.info("Workflow {} COMPLETED", workflow.getId());
        } else {
            event(workflow.getId(), null, WorkflowEvent.WORKFLOW_FAILED, error);
            log.error("Workflow {} FAILED: {}", workflow.getId(), error);
        }

        if (workflow.getPlanId() != null) {
            planRepo.findById(workflow.getPlanId()).ifPresent(plan -> {
                if (plan.getStatus() == PlanStatus.APPROVED) {
                    plan.setStatus(PlanStatus.EXECUTED);
                    planRepo.save(plan);
                }
            });
        }
    }

    // ------------------------------------------------------------------
    // Read projections
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public List<WorkflowNode> nodes(UUID workflowId) {
        return nodeRepo.findByWorkflowIdOrderByPositionAsc(workflowId);
    }

    @Transactional(readOnly = true)
    public List<WorkflowEvent> events(UUID workflowId) {
        return eventRepo.findByWorkflowIdOrderByCreatedAtAsc(workflowId);
    }

    @Transactional(readOnly = true)
    public List<StepLog> stepLogs(UUID workflowId) {
        return stepLogRepo.findByWorkflowIdOrderByExecutedAtAsc(workflowId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Workflow lockedWorkflow(UUID workflowId) {
        return workflowRepo.lockById(workflowId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow: " + workflowId));
    }

    private WorkflowNode row(UUID workflowId, String nodeId) {
        return nodeRepo.findByWorkflowIdAndNodeId(workflowId, nodeId)
                .orElseThrow(() -> new IllegalStateException(
                        "No row for node '" + nodeId + "' of workflow " + workflowId));
    }

    private void event(UUID workflowId, String nodeId, String type, String message) {
        eventRepo.save(new WorkflowEvent(workflowId, nodeId, type, message));
    }

    private WorkflowNode toRow(UUID workflowId, Node node, int position) {
        WorkflowNode row = new WorkflowNode(workflowId, node.getNodeId(), position, node.getType());
        row.setName(node.getName());
        row.setAgentId(node.getAgentId());
        row.setToolName(node.getToolName());
        row.setConfigJson(toJson(node.getConfig()));
        row.setDependenciesJson(toJson(List.copyOf(node.getDependencies())));
        row.setStatus(node.getStatus());
        row.setCheckpoint(node.isCheckpoint());
        row.setParallelGroup(node.getParallelGroup());
        row.setConditionJson(node.getCondition() == null ? null : toJson(node.getCondition()));
        row.setUsePreviousResult(node.isUsePreviousResult());
        return row;
    }

    private Node fromRow(WorkflowNode row) {
        Node node = new Node(row.getNodeId(), row.getNodeType(), row.getAgentId(), row.getToolName(),
                fromJson(row.getConfigJson(), JSON_MAP, Map.of()));
        node.setName(row.getName());
        node.setCheckpoint(row.isCheckpoint());
        node.setParallelGroup(row.getParallelGroup());
        node.setUsePreviousResult(row.isUsePreviousResult());
        if (row.getConditionJson() != null) {
            node.setCondition(fromJson(row.getConditionJson(), new TypeReference<NodeCondition>() {}, null));
        }
        Object result = row.getResultJson() == null
                ? null
                : fromJson(row.getResultJson(), new TypeReference<Object>() {}, null);
        node.restoreState(row.getStatus(), result, row.getError(), row.isUpstreamFailed());
        return node;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize workflow state: " + e.getMessage(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T ifAbsent) {
        if (json == null || json.isBlank()) {
            return ifAbsent;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt workflow state JSON: " + e.getMessage(), e);
        }
    }
}
