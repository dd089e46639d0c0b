package com.abhikarta.orchestrator.dag;

import com.abhikarta.orchestrator.graph.Graph;
import com.abhikarta.orchestrator.graph.Node;
import com.abhikarta.orchestrator.graph.NodeType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A statically defined workflow template, as stored in {@code dags/*.json}:
 *
 * <pre>
 * {
 *   "dag_id": "echo_pipeline",
 *   "name": "Echo pipeline",
 *   "description": "...",
 *   "nodes": [
 *     {"node_id": "a", "node_type": "agent", "agent_id": "echo_agent",
 *      "config": {"input": {"input": "hi"}}, "dependencies": []}
 *   ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DagDefinition(
        @JsonProperty("dag_id")      String dagId,
        @JsonProperty("name")        String name,
        @JsonProperty("description") String description,
        @JsonProperty("nodes")       List<DagNodeDefinition> nodes) {

    public DagDefinition {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    /**
     * Build a fresh Graph with every node PENDING.
     *
     * Nodes are added first, then edges, so dependencies may reference nodes
     * declared later in the file.
     *
     * @throws DagDefinitionException on an unknown node type, duplicate id,
     *                                unknown dependency or cycle
     */
    public Graph toGraph() {
        if (dagId == null || dagId.isBlank()) {
            throw new DagDefinitionException("DAG definition has no dag_id");
        }
        Graph graph = new Graph(dagId, name, description);
        try {
            for (DagNodeDefinition def : nodes) {
                NodeType type = NodeType.fromValue(def.nodeType());
                graph.addNode(new Node(def.nodeId(), type, def.agentId(), def.toolName(), def.config()));
            }
            for (DagNodeDefinition def : nodes) {
                for (String dep : def.dependencies()) {
                    graph.addEdge(dep, def.nodeId());
                }
            }
        } catch (IllegalArgumentException e) {
            throw new DagDefinitionException("Invalid DAG '" + dagId + "': " + e.getMessage(), e);
        }
        return graph;
    }
}
