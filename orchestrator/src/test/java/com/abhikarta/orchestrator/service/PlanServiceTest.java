package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.graph.Graph;
import com.abhikarta.orchestrator.model.Plan;
import com.abhikarta.orchestrator.model.PlanStatus;
import com.abhikarta.orchestrator.model.Workflow;
import com.abhikarta.orchestrator.planning.ExecutionMode;
import com.abhikarta.orchestrator.planning.ExecutionPlan;
import com.abhikarta.orchestrator.planning.LoopConfig;
import com.abhikarta.orchestrator.planning.PlanStep;
import com.abhikarta.orchestrator.repository.PlanRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PlanService.
 *
 * The supervisor, store and pool are mocked; plan JSON goes through a real
 * ObjectMapper and a real PlanCompiler, so approval is checked end to end
 * up to the point where a workflow row would be written.
 */
@ExtendWith(MockitoExtension.class)
class PlanServiceTest {

    @Mock PlanSupervisor     supervisor;
    @Mock PlanRepository     planRepo;
    @Mock WorkflowStore      store;
    @Mock WorkflowWorkerPool workers;

    final ObjectMapper objectMapper = new ObjectMapper();
    PlanService service;

    final UUID planId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new PlanService(supervisor, planRepo, store, workers, objectMapper, 5);
    }

    private Plan storedPlan(ExecutionPlan executionPlan) throws Exception {
        Plan plan = new Plan("alice", "s1", "count the words in hello world", "create_stategraph",
                objectMapper.writeValueAsString(executionPlan), "summary", false);
        plan.setId(planId);
        return plan;
    }

    private static ExecutionPlan twoSteps(ExecutionMode mode, LoopConfig loop) {
        return new ExecutionPlan(ExecutionPlan.TYPE_STATEGRAPH, null, mode,
                List.of(PlanStep.agent("s1", "Echo", "echo_agent", Map.of("input", "hello"), List.of()),
                        PlanStep.tool("s2", "Count", "word_count", Map.of("text", "hello world"), List.of("s1"))),
                null, null, loop);
    }

    @Test
    void approve_pendingPlan_startsWorkflowAndSubmitsIt() throws Exception {
        when(planRepo.findById(planId)).thenReturn(Optional.of(storedPlan(twoSteps(ExecutionMode.PARALLEL, null))));
        Workflow started = new Workflow("plan_" + planId, "x", "s1", "alice");
        started.setId(UUID.randomUUID());
        when(store.createPlanWorkflow(eq(planId), eq("bob"), any(), any())).thenReturn(Optional.of(started));

        PlanActionResult result = service.approvePlan(planId, "bob");

        assertThat(result.isOk()).isTrue();
        assertThat(result.status()).isEqualTo(PlanStatus.APPROVED);
        assertThat(result.workflowId()).isEqualTo(started.getId());
        verify(workers).submit(started.getId());

        ArgumentCaptor<Workflow> workflow = ArgumentCaptor.forClass(Workflow.class);
        ArgumentCaptor<Graph>    graph    = ArgumentCaptor.forClass(Graph.class);
        verify(store).createPlanWorkflow(eq(planId), eq("bob"), workflow.capture(), graph.capture());
        assertThat(workflow.getValue().getExecutionMode()).isEqualTo("parallel");
        assertThat(workflow.getValue().getName()).isEqualTo("count the words in hello world");
        assertThat(graph.getValue().getGraphId()).isEqualTo("plan_" + planId);
        assertThat(graph.getValue().getNode("s2").orElseThrow().getDependencies()).containsExactly("s1");
    }

    @Test
    void approve_loopPlan_carriesCapAndCondition() throws Exception {
        when(planRepo.findById(planId)).thenReturn(Optional.of(
                storedPlan(twoSteps(ExecutionMode.LOOP, new LoopConfig(3, "#iteration < 2")))));
        when(store.createPlanWorkflow(eq(planId), eq("bob"), any(), any())).thenReturn(Optional.empty());

        service.approvePlan(planId, "bob");

        ArgumentCaptor<Workflow> workflow = ArgumentCaptor.forClass(Workflow.class);
        verify(store).createPlanWorkflow(eq(planId), eq("bob"), workflow.capture(), any());
        assertThat(workflow.getValue().getMaxIterations()).isEqualTo(3);
        assertThat(workflow.getValue().getLoopCondition()).isEqualTo("#iteration < 2");
    }

    @Test
    void approve_loopPlanWithoutConfig_usesDefaultCap() throws Exception {
        when(planRepo.findById(planId)).thenReturn(Optional.of(storedPlan(twoSteps(ExecutionMode.LOOP, null))));
        when(store.createPlanWorkflow(eq(planId), eq("bob"), any(), any())).thenReturn(Optional.empty());

        service.approvePlan(planId, "bob");

        ArgumentCaptor<Workflow> workflow = ArgumentCaptor.forClass(Workflow.class);
        verify(store).createPlanWorkflow(eq(planId), eq("bob"), workflow.capture(), any());
        assertThat(workflow.getValue().getMaxIterations()).isEqualTo(5);
    }

    @Test
    void approve_unknownPlan_isNotFound() {
        when(planRepo.findById(planId)).thenReturn(Optional.empty());

        PlanActionResult result = service.approvePlan(planId, "bob");

        assertThat(result.outcome()).isEqualTo(PlanActionResult.Outcome.NOT_FOUND);
        verifyNoInteractions(store, workers);
    }

    @Test
    void approve_alreadyRejected_isInvalidState() throws Exception {
        Plan plan = storedPlan(twoSteps(ExecutionMode.SEQUENTIAL, null));
        plan.setStatus(PlanStatus.REJECTED);
        when(planRepo.findById(planId)).thenReturn(Optional.of(plan));

        PlanActionResult result = service.approvePlan(planId, "bob");

        assertThat(result.outcome()).isEqualTo(PlanActionResult.Outcome.INVALID_STATE);
        assertThat(result.error()).contains("rejected");
        verifyNoInteractions(store, workers);
    }

    @Test
    void approve_lostRace_isInvalidStateAndNothingSubmitted() throws Exception {
        when(planRepo.findById(planId)).thenReturn(Optional.of(storedPlan(twoSteps(ExecutionMode.SEQUENTIAL, null))));
        when(store.createPlanWorkflow(eq(planId), eq("bob"), any(), any())).thenReturn(Optional.empty());

        PlanActionResult result = service.approvePlan(planId, "bob");

        assertThat(result.outcome()).isEqualTo(PlanActionResult.Outcome.INVALID_STATE);
        verify(workers, never()).submit(any());
    }

    @Test
    void approve_storedPlanDoesNotCompile_isInvalidState() throws Exception {
        ExecutionPlan cyclic = new ExecutionPlan(null, null, ExecutionMode.SEQUENTIAL,
                List.of(PlanStep.agent("a", null, "echo_agent", Map.of(), List.of("b")),
                        PlanStep.agent("b", null, "echo_agent", Map.of(), List.of("a"))),
                null, null, null);
        when(planRepo.findById(planId)).thenReturn(Optional.of(storedPlan(cyclic)));

        PlanActionResult result = service.approvePlan(planId, "bob");

        assertThat(result.outcome()).isEqualTo(PlanActionResult.Outcome.INVALID_STATE);
        assertThat(result.error()).startsWith("Stored plan cannot be executed");
        verifyNoInteractions(store, workers);
    }

    @Test
    void reject_pendingPlan_ok() throws Exception {
        when(planRepo.findById(planId)).thenReturn(Optional.of(storedPlan(twoSteps(null, null))));
        when(store.rejectPlan(planId, "bob", "no")).thenReturn(true);

        PlanActionResult result = service.rejectPlan(planId, "bob", "no");

        assertThat(result.isOk()).isTrue();
        assertThat(result.status()).isEqualTo(PlanStatus.REJECTED);
        assertThat(result.workflowId()).isNull();
    }

    @Test
    void reject_notPending_isInvalidState() throws Exception {
        Plan plan = storedPlan(twoSteps(null, null));
        plan.setStatus(PlanStatus.EXECUTED);
        when(planRepo.findById(planId)).thenReturn(Optional.of(plan));
        when(store.rejectPlan(planId, "bob", "no")).thenReturn(false);

        assertThat(service.rejectPlan(planId, "bob", "no").outcome())
                .isEqualTo(PlanActionResult.Outcome.INVALID_STATE);
    }

    @Test
    void listPlans_routesByFilter() {
        service.listPlans("alice", Optional.of(PlanStatus.PENDING_APPROVAL));
        service.listPlans(" ", Optional.of(PlanStatus.EXECUTED));
        service.listPlans("alice", Optional.empty());
        service.listPlans(null, Optional.empty());

        verify(planRepo).findByUserIdAndStatusOrderByCreatedAtDesc("alice", PlanStatus.PENDING_APPROVAL);
        verify(planRepo).findByStatusOrderByCreatedAtDesc(PlanStatus.EXECUTED);
        verify(planRepo).findByUserIdOrderByCreatedAtDesc("alice");
        verify(planRepo).findAllByOrderByCreatedAtDesc();
    }

    @Test
    void executionPlanOf_unreadableJson_isEmpty() {
        Plan plan = new Plan("alice", "s1", "x", "create_stategraph", "not json", "s", false);

        assertThat(service.executionPlanOf(plan)).isEmpty();
    }
}
