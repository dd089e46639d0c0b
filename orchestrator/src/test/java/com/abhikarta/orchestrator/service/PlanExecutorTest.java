package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.capability.AgentRegistry;
import com.abhikarta.orchestrator.capability.ToolRegistry;
import com.abhikarta.orchestrator.capability.impl.EchoAgent;
import com.abhikarta.orchestrator.capability.impl.WordCountTool;
import com.abhikarta.orchestrator.graph.Graph;
import com.abhikarta.orchestrator.graph.Node;
import com.abhikarta.orchestrator.graph.NodeCondition;
import com.abhikarta.orchestrator.graph.NodeStatus;
import com.abhikarta.orchestrator.model.HitlStatus;
import com.abhikarta.orchestrator.model.Workflow;
import com.abhikarta.orchestrator.planning.ExecutionMode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PlanExecutor, one section per execution mode.
 *
 * Same setup as DagSchedulerTest: mocked WorkflowStore, real registries,
 * dispatcher and SpEL evaluator.
 */
@ExtendWith(MockitoExtension.class)
class PlanExecutorTest {

    @Mock WorkflowStore store;

    final AtomicBoolean running = new AtomicBoolean(true);
    List<RecordingAgent.Call> journal;
    SimpleMeterRegistry meters;
    PlanExecutor executor;

    @BeforeEach
    void setUp() {
        journal = RecordingAgent.journal();
        meters = new SimpleMeterRegistry();
        AgentRegistry agents = new AgentRegistry(List.of(
                new EchoAgent(),
                new RecordingAgent("ok", false, journal),
                new RecordingAgent("bad", true, journal)), meters);
        ToolRegistry tools = new ToolRegistry(List.of(new WordCountTool()), meters);
        executor = new PlanExecutor(store, new NodeDispatcher(agents, tools, store), new StepConditionEvaluator());

        lenient().when(store.isRunning(any())).thenAnswer(inv -> running.get());
        lenient().when(store.markRunning(any(), any())).thenAnswer(inv -> running.get());
    }

    private static Workflow planWorkflow(ExecutionMode mode) {
        Workflow workflow = new Workflow("plan_x", "plan", "s1", "alice");
        workflow.setId(UUID.randomUUID());
        workflow.setPlanId(UUID.randomUUID());
        workflow.setExecutionMode(mode.value());
        return workflow;
    }

    private static Node step(String id) {
        return Node.agent(id, "ok", Map.of("input", id));
    }

    private List<String> calledSteps() {
        return journal.stream().map(c -> c.input().get("input").toString()).toList();
    }

    // ------------------------------------------------------------------
    // Sequential and parallel
    // ------------------------------------------------------------------

    /** s3 depends on s1 but is listed before s2. */
    private static Graph forkedPlan() {
        return new Graph("plan_x", null, null)
                .addNode(step("s1")).addNode(step("s3")).addNode(step("s2"))
                .addEdge("s1", "s3");
    }

    @Test
    void sequential_runsOneReadyStepAtATimeInListOrder() {
        Workflow workflow = planWorkflow(ExecutionMode.SEQUENTIAL);
        Graph graph = forkedPlan();
        when(store.loadGraph(workflow.getId())).thenReturn(graph);

        RunOutcome outcome = executor.run(workflow);

        assertThat(outcome).isEqualTo(RunOutcome.COMPLETED);
        assertThat(calledSteps()).containsExactly("s1", "s3", "s2");
        verify(store).completeWorkflow(workflow.getId(), graph);
    }

    @Test
    void parallel_runsWholeReadyBatchBeforeRecomputing() {
        Workflow workflow = planWorkflow(ExecutionMode.PARALLEL);
        Graph graph = forkedPlan();
        when(store.loadGraph(workflow.getId())).thenReturn(graph);

        executor.run(workflow);

        assertThat(calledSteps()).containsExactly("s1", "s2", "s3");
        assertThat(graph.nodesIn(NodeStatus.COMPLETED)).hasSize(3);
    }

    @Test
    void parallel_failedStepDoesNotStopItsSiblings() {
        Workflow workflow = planWorkflow(ExecutionMode.PARALLEL);
        Graph graph = new Graph("plan_x", null, null)
                .addNode(Node.agent("s1", "bad", Map.of("input", "s1")))
                .addNode(step("s2"))
                .addNode(step("s3"))
                .addEdge("s1", "s3");
        when(store.loadGraph(workflow.getId())).thenReturn(graph);

        executor.run(workflow);

        assertThat(calledSteps()).containsExactly("s1", "s2");
        assertThat(graph.getNode("s3").orElseThrow().getStatus()).isEqualTo(NodeStatus.SKIPPED);
    }

    @Test
    void parallel_workflowFailsMidBatch_restOfBatchNotDispatched() {
        RecordingAgent failsWorkflowMidCall = new RecordingAgent("stopper", false, journal) {
            @Override
            public Map<String, Object> execute(Map<String, Object> input) {
                running.set(false);
                return super.execute(input);
            }
        };
        AgentRegistry agents = new AgentRegistry(List.of(failsWorkflowMidCall,
                new RecordingAgent("ok", false, journal)), meters);
        ToolRegistry tools = new ToolRegistry(List.of(new WordCountTool()), meters);
        executor = new PlanExecutor(store, new NodeDispatcher(agents, tools, store), new StepConditionEvaluator());

        Workflow workflow = planWorkflow(ExecutionMode.PARALLEL);
        Graph graph = new Graph("plan_x", null, null)
                .addNode(Node.agent("s1", "stopper", Map.of("input", "s1")))
                .addNode(step("s2"));
        when(store.loadGraph(workflow.getId())).thenReturn(graph);

        assertThat(executor.run(workflow)).isEqualTo(RunOutcome.NOT_RUNNABLE);
        assertThat(calledSteps()).containsExactly("s1");
        assertThat(graph.getNode("s2").orElseThrow().getStatus()).isEqualTo(NodeStatus.PENDING);
        verify(store, never()).completeWorkflow(any(), any());
    }

    @Test
    void echoScenario_stepResultCarriesEcho() {
        Workflow workflow = planWorkflow(ExecutionMode.SEQUENTIAL);
        Graph graph = new Graph("plan_x", null, null)
                .addNode(Node.agent("step_1", "echo_agent", Map.of("input", "hello")));
        when(store.loadGraph(workflow.getId())).thenReturn(graph);

        assertThat(executor.run(workflow)).isEqualTo(RunOutcome.COMPLETED);

        Map<?, ?> result = (Map<?, ?>) graph.getNode("step_1").orElseThrow().getResult();
        assertThat(result.get("success")).isEqualTo(true);
        assertThat(result.get("echo")).isEqualTo("hello");
    }

    @Test
    void usePreviousResult_feedsDependencyResultIntoInput() {
        Workflow workflow = planWorkflow(ExecutionMode.SEQUENTIAL);
        Node second = step("s2");
        second.setUsePreviousResult(true);
        Graph graph = new Graph("plan_x", null, null).addNode(step("s1")).addNode(second).addEdge("s1", "s2");
        when(store.loadGraph(workflow.getId())).thenReturn(graph);

        executor.run(workflow);

        Map<String, Object> input = journal.get(1).input();
        assertThat(input).containsEntry("input", "s2");
        assertThat(input.get("previous_result")).isInstanceOf(Map.class);
        assertThat(((Map<?, ?>) input.get("previous_result")).get("echo")).isEqualTo("s1");
    }

    @Test
    void usePreviousResult_severalDependencies_keyedByStepId() {
        Workflow workflow = planWorkflow(ExecutionMode.SEQUENTIAL);
        Node join = step("join");
        join.setUsePreviousResult(true);
        Graph graph = new Graph("plan_x", null, null)
                .addNode(step("a")).addNode(step("b")).addNode(join)
                .addEdge("a", "join").addEdge("b", "join");
        when(store.loadGraph(workflow.getId())).thenReturn(graph);

        executor.run(workflow);

        Map<String, ?> previous = (Map<String, ?>) journal.get(2).input().get("previous_result");
        assertThat(previous.keySet()).containsExactlyInAnyOrder("a", "b");
    }

    // ------------------------------------------------------------------
    // Loop
    // ------------------------------------------------------------------

    @Test
    void loop_runsExactlyMaxIterationsPasses() {
        Workflow workflow = planWorkflow(ExecutionMode.LOOP);
        workflow.setMaxIterations(3);
        Graph graph = new Graph("plan_x", null, null).addNode(step("s1")).addNode(step("s2")).addEdge("s1", "s2");
        when(store.loadGraph(workflow.getId())).thenReturn(graph);
        when(store.startNextIteration(workflow.getId())).thenReturn(1, 2);

        RunOutcome outcome = executor.run(workflow);

        assertThat(outcome).isEqualTo(RunOutcome.COMPLETED);
        assertThat(calledSteps()).containsExactly("s1", "s2", "s1", "s2", "s1", "s2");
        verify(store, times(2)).startNextIteration(workflow.getId());
        verify(store).completeWorkflow(workflow.getId(), graph);
    }

    @Test
    void loop_singleIterationCap_runsOnce() {
        Workflow workflow = planWorkflow(ExecutionMode.LOOP);
        workflow.setMaxIterations(1);
        when(store.loadGraph(workflow.getId())).thenReturn(new Graph("plan_x", null, null).addNode(step("s1")));

        executor.run(workflow);

        assertThat(calledSteps()).containsExactly("s1");
        verify(store, never()).startNextIteration(any());
    }

    @Test
    void loop_continueConditionStopsEarly() {
        Workflow workflow = planWorkflow(ExecutionMode.LOOP);
        workflow.setMaxIterations(5);
        workflow.setLoopCondition("#iteration < 2");
        when(store.loadGraph(workflow.getId())).thenReturn(new Graph("plan_x", null, null).addNode(step("s1")));
        when(store.startNextIteration(workflow.getId())).thenReturn(1);

        executor.run(workflow);

        assertThat(calledSteps()).containsExactly("s1", "s1");
    }

    @Test
    void loop_resumedMidway_continuesFromPersistedPass() {
        Workflow workflow = planWorkflow(ExecutionMode.LOOP);
        workflow.setMaxIterations(3);
        workflow.setLoopIteration(2);
        when(store.loadGraph(workflow.getId())).thenReturn(new Graph("plan_x", null, null).addNode(step("s1")));

        executor.run(workflow);

        assertThat(calledSteps()).containsExactly("s1");
        verify(store, never()).startNextIteration(any());
    }

    // ------------------------------------------------------------------
    // Conditional
    // ------------------------------------------------------------------

    @Test
    void conditional_falseConditionSkipsStepAndBranchesButNotDependents() {
        Workflow workflow = planWorkflow(ExecutionMode.CONDITIONAL);
        Node gated = step("gated");
        gated.setCondition(new NodeCondition("#results['s1']['echo'] == 'other'", List.of("branch")));
        Graph graph = new Graph("plan_x", null, null)
                .addNode(step("s1")).addNode(gated).addNode(step("branch")).addNode(step("after"))
                .addEdge("s1", "gated").addEdge("gated", "after");
        when(store.loadGraph(workflow.getId())).thenReturn(graph);

        RunOutcome outcome = executor.run(workflow);

        assertThat(outcome).isEqualTo(RunOutcome.COMPLETED);
        assertThat(calledSteps()).containsExactly("s1", "after");
        assertThat(graph.getNode("gated").orElseThrow().getStatus()).isEqualTo(NodeStatus.SKIPPED);
        assertThat(graph.getNode("gated").orElseThrow().isUpstreamFailed()).isFalse();
        assertThat(graph.getNode("branch").orElseThrow().getStatus()).isEqualTo(NodeStatus.SKIPPED);
        verify(store).recordSkipped(eq(workflow.getId()), argThat(nodes -> nodes.size() == 2));
    }

    @Test
    void conditional_trueConditionRunsStep() {
        Workflow workflow = planWorkflow(ExecutionMode.CONDITIONAL);
        Node gated = step("gated");
        gated.setCondition(new NodeCondition("#status['s1'] == 'COMPLETED'", List.of()));
        Graph graph = new Graph("plan_x", null, null).addNode(step("s1")).addNode(gated).addEdge("s1", "gated");
        when(store.loadGraph(workflow.getId())).thenReturn(graph);

        executor.run(workflow);

        assertThat(calledSteps()).containsExactly("s1", "gated");
    }

    @Test
    void sequential_ignoresConditions() {
        Workflow workflow = planWorkflow(ExecutionMode.SEQUENTIAL);
        Node gated = step("gated");
        gated.setCondition(new NodeCondition("false", List.of()));
        when(store.loadGraph(workflow.getId())).thenReturn(new Graph("plan_x", null, null).addNode(gated));

        executor.run(workflow);

        assertThat(calledSteps()).containsExactly("gated");
    }

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    @Test
    void checkpoint_completedWithoutApproval_suspends() {
        Workflow workflow = planWorkflow(ExecutionMode.SEQUENTIAL);
        Node first = step("s1");
        first.setCheckpoint(true);
        Graph graph = new Graph("plan_x", null, null).addNode(first).addNode(step("s2")).addEdge("s1", "s2");
        when(store.loadGraph(workflow.getId())).thenReturn(graph);
        when(store.checkpointStatus(workflow.getId(), "s1", 0)).thenReturn(Optional.empty());

        RunOutcome outcome = executor.run(workflow);

        assertThat(outcome).isEqualTo(RunOutcome.SUSPENDED);
        assertThat(calledSteps()).containsExactly("s1");
        verify(store).suspendForHuman(eq(workflow.getId()),
                argThat(nodes -> nodes.size() == 1 && nodes.get(0).getNodeId().equals("s1")), eq(0));
    }

    @Test
    void checkpoint_approved_resumesWithoutRerunningIt() {
        Workflow workflow = planWorkflow(ExecutionMode.SEQUENTIAL);
        Node first = step("s1");
        first.setCheckpoint(true);
        first.restoreState(NodeStatus.COMPLETED, Map.of("echo", "s1"), null, false);
        Graph graph = new Graph("plan_x", null, null).addNode(first).addNode(step("s2")).addEdge("s1", "s2");
        when(store.loadGraph(workflow.getId())).thenReturn(graph);
        when(store.checkpointStatus(workflow.getId(), "s1", 0)).thenReturn(Optional.of(HitlStatus.APPROVED));

        RunOutcome outcome = executor.run(workflow);

        assertThat(outcome).isEqualTo(RunOutcome.COMPLETED);
        assertThat(calledSteps()).containsExactly("s2");
        verify(store, times(1)).checkpointStatus(workflow.getId(), "s1", 0);
    }

    @Test
    void checkpoint_inLoop_isAskedAgainEachPass() {
        Workflow workflow = planWorkflow(ExecutionMode.LOOP);
        workflow.setMaxIterations(2);
        workflow.setLoopIteration(1);
        Node only = step("s1");
        only.setCheckpoint(true);
        when(store.loadGraph(workflow.getId())).thenReturn(new Graph("plan_x", null, null).addNode(only));
        when(store.checkpointStatus(workflow.getId(), "s1", 1)).thenReturn(Optional.empty());

        assertThat(executor.run(workflow)).isEqualTo(RunOutcome.SUSPENDED);
        verify(store).suspendForHuman(eq(workflow.getId()), any(), eq(1));
    }

    @Test
    void humanStep_inPlan_suspendsLikeDagNode() {
        Workflow workflow = planWorkflow(ExecutionMode.SEQUENTIAL);
        Graph graph = new Graph("plan_x", null, null)
                .addNode(step("s1")).addNode(Node.humanInLoop("review", "ok?")).addEdge("s1", "review");
        when(store.loadGraph(workflow.getId())).thenReturn(graph);

        assertThat(executor.run(workflow)).isEqualTo(RunOutcome.SUSPENDED);
        assertThat(graph.getNode("review").orElseThrow().getStatus()).isEqualTo(NodeStatus.WAITING_HITL);
    }

    @Test
    void dagReuse_threeLinearSteps_recordedInDependencyOrder() {
        Workflow workflow = planWorkflow(ExecutionMode.SEQUENTIAL);
        Graph graph = new Graph("plan_x", null, null)
                .addNode(step("greet")).addNode(step("count")).addNode(step("stamp"))
                .addEdge("greet", "count").addEdge("count", "stamp");
        when(store.loadGraph(workflow.getId())).thenReturn(graph);

        executor.run(workflow);

        InOrder inOrder = inOrder(store);
        inOrder.verify(store).recordOutcome(eq(workflow), argThat(n -> n.getNodeId().equals("greet")));
        inOrder.verify(store).recordOutcome(eq(workflow), argThat(n -> n.getNodeId().equals("count")));
        inOrder.verify(store).recordOutcome(eq(workflow), argThat(n -> n.getNodeId().equals("stamp")));
        verify(store, times(3)).recordOutcome(eq(workflow), any());
    }
}
