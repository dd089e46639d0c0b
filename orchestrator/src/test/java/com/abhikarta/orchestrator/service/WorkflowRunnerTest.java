package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.model.Workflow;
import com.abhikarta.orchestrator.model.WorkflowState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowRunnerTest {

    @Mock WorkflowStore store;
    @Mock DagScheduler  dagScheduler;
    @Mock PlanExecutor  planExecutor;

    @InjectMocks WorkflowRunner runner;

    private final UUID workflowId = UUID.randomUUID();

    private Workflow workflow(WorkflowState state, UUID planId) {
        Workflow workflow = new Workflow("echo_pipeline", "Echo", "s1", "alice");
        workflow.setId(workflowId);
        workflow.setState(state);
        workflow.setPlanId(planId);
        when(store.findWorkflow(workflowId)).thenReturn(Optional.of(workflow));
        return workflow;
    }

    @Test
    void dagWorkflow_goesToScheduler() {
        Workflow workflow = workflow(WorkflowState.RUNNING, null);
        when(dagScheduler.run(workflow)).thenReturn(RunOutcome.COMPLETED);

        assertThat(runner.run(workflowId)).isEqualTo(RunOutcome.COMPLETED);
        verifyNoInteractions(planExecutor);
    }

    @Test
    void planWorkflow_goesToPlanExecutor() {
        Workflow workflow = workflow(WorkflowState.RUNNING, UUID.randomUUID());
        when(planExecutor.run(workflow)).thenReturn(RunOutcome.SUSPENDED);

        assertThat(runner.run(workflowId)).isEqualTo(RunOutcome.SUSPENDED);
        verifyNoInteractions(dagScheduler);
    }

    @Test
    void waitingWorkflow_isNotRun() {
        workflow(WorkflowState.WAITING_HITL, null);

        assertThat(runner.run(workflowId)).isEqualTo(RunOutcome.NOT_RUNNABLE);
        verifyNoInteractions(dagScheduler, planExecutor);
    }

    @Test
    void unknownWorkflow_isNotRun() {
        when(store.findWorkflow(workflowId)).thenReturn(Optional.empty());

        assertThat(runner.run(workflowId)).isEqualTo(RunOutcome.NOT_RUNNABLE);
    }

    @Test
    void deadlock_failsWorkflowWithStuckNodes() {
        Workflow workflow = workflow(WorkflowState.RUNNING, null);
        when(dagScheduler.run(workflow)).thenThrow(new WorkflowDeadlockException(workflowId, List.of("b", "c")));

        assertThat(runner.run(workflowId)).isEqualTo(RunOutcome.FAILED);
        verify(store).failWorkflow(workflowId, "Deadlock: no runnable nodes; pending: b, c", null);
    }

    @Test
    void unexpectedError_failsWorkflowAndClearsMdc() {
        Workflow workflow = workflow(WorkflowState.RUNNING, null);
        when(dagScheduler.run(workflow)).thenThrow(new IllegalStateException("row vanished"));

        assertThat(runner.run(workflowId)).isEqualTo(RunOutcome.FAILED);
        verify(store).failWorkflow(workflowId, "Worker error: row vanished", null);
        assertThat(MDC.get("workflowId")).isNull();
    }

    @Test
    void normalRun_neverFailsWorkflow() {
        Workflow workflow = workflow(WorkflowState.RUNNING, null);
        when(dagScheduler.run(workflow)).thenReturn(RunOutcome.COMPLETED);

        runner.run(workflowId);

        verify(store, never()).failWorkflow(any(), anyString(), any());
    }
}
