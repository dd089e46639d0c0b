package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.capability.AgentRegistry;
import com.abhikarta.orchestrator.capability.CapabilityResult;
import com.abhikarta.orchestrator.capability.ToolRegistry;
import com.abhikarta.orchestrator.graph.Node;
import com.abhikarta.orchestrator.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Runs one node through its full lifecycle:
 * PENDING → RUNNING (persisted) → capability call → COMPLETED | FAILED (persisted).
 *
 * Failure is node-local. Nothing thrown by a capability escapes this class;
 * it becomes the node's error so sibling nodes of the same batch still run.
 */
@Component
public class NodeDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NodeDispatcher.class);

    private final AgentRegistry agents;
    private final ToolRegistry  tools;
    private final WorkflowStore store;

    public NodeDispatcher(AgentRegistry agents, ToolRegistry tools, WorkflowStore store) {
        this.agents = agents;
        this.tools  = tools;
        this.store  = store;
    }

    /**
     * @param input the mapping handed to the capability; usually {@code node.getInput()},
     *              possibly enriched with upstream results by the plan executor
     * @return false if the workflow stopped RUNNING before the node could be claimed;
     *         the capability is not called and the node stays PENDING
     */
    public boolean execute(Workflow workflow, Node node, Map<String, Object> input) {
        MDC.put("nodeId", node.getNodeId());
        try {
            if (!store.markRunning(workflow.getId(), node)) {
                return false;
            }
            node.markRunning();

            CapabilityResult outcome = call(node, input);
            if (outcome.success()) {
                node.complete(outcome.result());
                log.info("Node '{}' completed", node.getNodeId());
            } else {
                node.fail(outcome.error());
                log.warn("Node '{}' failed: {}", node.getNodeId(), outcome.error());
            }
            store.recordOutcome(workflow, node);
            return true;
        } finally {
            MDC.remove("nodeId");
        }
    }

    private CapabilityResult call(Node node, Map<String, Object> input) {
        try {
            return switch (node.getType()) {
                case AGENT         -> agents.execute(node.getAgentId(), input);
                case TOOL          -> tools.execute(node.getToolName(), input);
                case HUMAN_IN_LOOP -> CapabilityResult.failure(
                        "human_in_loop node '" + node.getNodeId() + "' cannot be dispatched");
            };
        } catch (RuntimeException e) {
            log.warn("Dispatch of node '{}' threw: {}", node.getNodeId(), e.toString());
            return CapabilityResult.failure(e.getMessage() == null ? e.toString() : e.getMessage());
        }
    }
}
