package com.abhikarta.orchestrator.planning;

import com.abhikarta.orchestrator.graph.Graph;
import com.abhikarta.orchestrator.graph.Node;
import com.abhikarta.orchestrator.graph.NodeType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanCompilerTest {

    private static ExecutionPlan plan(List<PlanStep> steps, List<String> checkpoints) {
        return new ExecutionPlan(null, null, ExecutionMode.SEQUENTIAL, steps, null, checkpoints, null);
    }

    @Test
    void compile_oneNodePerStep_inStepOrder() {
        Graph graph = PlanCompiler.compile("plan_1", plan(List.of(
                PlanStep.agent("s1", "Echo", "echo_agent", Map.of("input", "hi"), List.of()),
                PlanStep.tool("s2", null, "word_count", Map.of("text", "a b"), List.of("s1"))),
                List.of("s2")));

        assertThat(graph.nodes()).extracting(Node::getNodeId).containsExactly("s1", "s2");
        Node s1 = graph.getNode("s1").orElseThrow();
        Node s2 = graph.getNode("s2").orElseThrow();
        assertThat(s1.getName()).isEqualTo("Echo");
        assertThat(s1.getInput()).containsEntry("input", "hi");
        assertThat(s1.isCheckpoint()).isFalse();
        assertThat(s2.getType()).isEqualTo(NodeType.TOOL);
        assertThat(s2.getToolName()).isEqualTo("word_count");
        assertThat(s2.getDependencies()).containsExactly("s1");
        assertThat(s2.isCheckpoint()).isTrue();
    }

    @Test
    void compile_carriesConditionAndHumanMessage() {
        PlanStep gated = new PlanStep("s2", null, StepType.AGENT, "echo_agent", null, null, List.of("s1"),
                "g1", new StepCondition("#iteration == 0", List.of("s3")), true, null);
        PlanStep human = new PlanStep("s3", null, StepType.HUMAN_IN_LOOP, null, null, null, List.of(),
                null, null, false, "Look at this");

        Graph graph = PlanCompiler.compile("p", plan(List.of(
                PlanStep.agent("s1", null, "echo_agent", null, null), gated, human), null));

        Node s2 = graph.getNode("s2").orElseThrow();
        assertThat(s2.getCondition().expression()).isEqualTo("#iteration == 0");
        assertThat(s2.getCondition().branches()).containsExactly("s3");
        assertThat(s2.getParallelGroup()).isEqualTo("g1");
        assertThat(s2.isUsePreviousResult()).isTrue();
        assertThat(graph.getNode("s3").orElseThrow().getMessage()).isEqualTo("Look at this");
    }

    @Test
    void compile_unknownDependency_throws() {
        ExecutionPlan bad = plan(List.of(
                PlanStep.agent("s1", null, "echo_agent", null, List.of("ghost"))), null);

        assertThatThrownBy(() -> PlanCompiler.compile("p", bad)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void compile_cycle_throws() {
        ExecutionPlan bad = plan(List.of(
                PlanStep.agent("s1", null, "echo_agent", null, List.of("s2")),
                PlanStep.agent("s2", null, "echo_agent", null, List.of("s1"))), null);

        assertThatThrownBy(() -> PlanCompiler.compile("p", bad))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void compile_unknownBranch_throws() {
        PlanStep gated = new PlanStep("s1", null, StepType.AGENT, "echo_agent", null, null, null,
                null, new StepCondition("true", List.of("nowhere")), false, null);

        assertThatThrownBy(() -> PlanCompiler.compile("p", plan(List.of(gated), null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nowhere");
    }

    @Test
    void compile_missingType_throws() {
        PlanStep untyped = new PlanStep("s1", null, null, "echo_agent", null, null, null,
                null, null, false, null);

        assertThatThrownBy(() -> PlanCompiler.compile("p", plan(List.of(untyped), null)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
