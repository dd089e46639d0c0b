package com.abhikarta.orchestrator.planning;

import com.abhikarta.orchestrator.graph.Graph;
import com.abhikarta.orchestrator.graph.Node;
import com.abhikarta.orchestrator.graph.NodeCondition;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Compiles an {@link ExecutionPlan} into a {@link Graph}, one node per step,
 * in step list order.
 */
public final class PlanCompiler {

    private PlanCompiler() {}

    /**
     * @throws IllegalArgumentException on a blank or duplicate step id, a missing
     *         step type, an unknown dependency or branch, or a dependency cycle
     */
    public static Graph compile(String graphId, ExecutionPlan plan) {
        Graph graph = new Graph(graphId, graphId, null);
        Set<String> checkpoints = new HashSet<>(plan.hitlCheckpoints());

        for (PlanStep step : plan.steps()) {
            if (step.type() == null) {
                throw new IllegalArgumentException("Step '" + step.stepId() + "' has no type");
            }
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("input", step.input());
            if (step.message() != null) {
                config.put("message", step.message());
            }
            Node node = new Node(step.stepId(), step.type().nodeType(), step.agentId(), step.toolName(), config);
            node.setName(step.displayName());
            node.setParallelGroup(step.parallelGroup());
            node.setUsePreviousResult(step.usePreviousResult());
            node.setCheckpoint(checkpoints.contains(step.stepId()));
            if (step.conditional() != null && step.conditional().condition() != null) {
                node.setCondition(new NodeCondition(step.conditional().condition(), step.conditional().branches()));
            }
            graph.addNode(node);
        }

        for (PlanStep step : plan.steps()) {
            for (String dep : step.dependencies()) {
                graph.addEdge(dep, step.stepId());
            }
            if (step.conditional() != null) {
                for (String branch : step.conditional().branches()) {
                    if (graph.getNode(branch).isEmpty()) {
                        throw new IllegalArgumentException(
                                "Step '" + step.stepId() + "' names unknown branch '" + branch + "'");
                    }
                }
            }
        }
        return graph;
    }
}
