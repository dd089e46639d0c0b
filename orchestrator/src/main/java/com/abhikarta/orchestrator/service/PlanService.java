package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.graph.Graph;
import com.abhikarta.orchestrator.model.Plan;
import com.abhikarta.orchestrator.model.PlanStatus;
import com.abhikarta.orchestrator.model.Workflow;
import com.abhikarta.orchestrator.planning.ExecutionMode;
import com.abhikarta.orchestrator.planning.ExecutionPlan;
import com.abhikarta.orchestrator.planning.PlanCompiler;
import com.abhikarta.orchestrator.repository.PlanRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Facade for the autonomous path: create, approve and reject plans.
 *
 * Creating a plan never executes it. Approval compiles the stored execution
 * plan into a Graph, starts a workflow for it and hands that workflow to the
 * worker pool.
 */
@Service
public class PlanService {

    private static final Logger log = LoggerFactory.getLogger(PlanService.class);

    private final PlanSupervisor     supervisor;
    private final PlanRepository     planRepo;
    private final WorkflowStore      store;
    private final WorkflowWorkerPool workers;
    private final ObjectMapper       objectMapper;
    private final int                defaultMaxIterations;

    public PlanService(PlanSupervisor supervisor,
                       PlanRepository planRepo,
                       WorkflowStore store,
                       WorkflowWorkerPool workers,
                       ObjectMapper objectMapper,
                       @Value("${abhikarta.loop.default-max-iterations:5}") int defaultMaxIterations) {
        this.supervisor           = supervisor;
        this.planRepo             = planRepo;
        this.store                = store;
        this.workers              = workers;
        this.objectMapper         = objectMapper;
        this.defaultMaxIterations = defaultMaxIterations;
    }

    public PlanDraft createPlan(String userId, String sessionId, String request) {
        return supervisor.createPlan(userId, sessionId, request);
    }

    /**
     * Approve a pending plan and start executing it.
     *
     * Steps:
     *  1. Check the plan exists and is pending approval
     *  2. Rebuild the ExecutionPlan from its stored JSON and compile it
     *  3. In one transaction: create the workflow, mark the plan approved
     *  4. Submit the workflow to the worker pool
     */
    public PlanActionResult approvePlan(UUID planId, String userId) {
        Optional<Plan> found = planRepo.findById(planId);
        if (found.isEmpty()) {
            return PlanActionResult.notFound(planId);
        }
        Plan plan = found.get();
        if (plan.getStatus() != PlanStatus.PENDING_APPROVAL) {
            return PlanActionResult.invalidState(planId, plan.getStatus(),
                    "Plan is " + plan.getStatus().value() + ", not pending_approval");
        }

        ExecutionPlan executionPlan;
        Graph graph;
        try {
            executionPlan = objectMapper.readValue(plan.getExecutionPlanJson(), ExecutionPlan.class);
            graph = PlanCompiler.compile("plan_" + planId, executionPlan);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Stored plan {} cannot be executed: {}", planId, e.getMessage());
            return PlanActionResult.invalidState(planId, plan.getStatus(),
                    "Stored plan cannot be executed: " + e.getMessage());
        }

        Workflow workflow = new Workflow(graph.getGraphId(), describe(plan), plan.getSessionId(), plan.getUserId());
        ExecutionMode mode = executionPlan.effectiveMode();
        workflow.setExecutionMode(mode.value());
        if (mode == ExecutionMode.LOOP) {
            workflow.setMaxIterations(executionPlan.loopConfig() == null
                    ? Math.max(1, defaultMaxIterations)
                    : executionPlan.loopConfig().effectiveMaxIterations(defaultMaxIterations));
            workflow.setLoopCondition(executionPlan.loopConfig() == null
                    ? null
                    : executionPlan.loopConfig().condition());
        }

        Optional<Workflow> started = store.createPlanWorkflow(planId, userId, workflow, graph);
        if (started.isEmpty()) {
            // lost a race with another approve or reject
            return PlanActionResult.invalidState(planId, null, "Plan is no longer pending_approval");
        }
        UUID workflowId = started.get().getId();
        workers.submit(workflowId);
        return PlanActionResult.ok(planId, PlanStatus.APPROVED, workflowId);
    }

    public PlanActionResult rejectPlan(UUID planId, String userId, String reason) {
        Optional<Plan> found = planRepo.findById(planId);
        if (found.isEmpty()) {
            return PlanActionResult.notFound(planId);
        }
        if (!store.rejectPlan(planId, userId, reason)) {
            return PlanActionResult.invalidState(planId, found.get().getStatus(),
                    "Plan is " + found.get().getStatus().value() + ", not pending_approval");
        }
        return PlanActionResult.ok(planId, PlanStatus.REJECTED, null);
    }

    @Transactional(readOnly = true)
    public Optional<Plan> getPlan(UUID planId) {
        return planRepo.findById(planId);
    }

    @Transactional(readOnly = true)
    public List<Plan> listPlans(String userId, Optional<PlanStatus> status) {
        boolean anyUser = userId == null || userId.isBlank();
        if (status.isPresent()) {
            return anyUser
                    ? planRepo.findByStatusOrderByCreatedAtDesc(status.get())
                    : planRepo.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status.get());
        }
        return anyUser
                ? planRepo.findAllByOrderByCreatedAtDesc()
                : planRepo.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /** Parsed execution plan of a stored plan, for display. */
    public Optional<ExecutionPlan> executionPlanOf(Plan plan) {
        try {
            return Optional.of(objectMapper.readValue(plan.getExecutionPlanJson(), ExecutionPlan.class));
        } catch (JsonProcessingException e) {
            log.warn("Stored plan {} has unreadable execution plan: {}", plan.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String describe(Plan plan) {
        String request = plan.getUserRequest();
        return request.length() <= 80 ? request : request.substring(0, 77) + "...";
    }
}
