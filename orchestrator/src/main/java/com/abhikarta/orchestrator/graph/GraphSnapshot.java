package com.abhikarta.orchestrator.graph;

import java.util.List;

/**
 * Immutable view of a {@link Graph}: structure plus the status of each node.
 * Serialized to JSON and stored on the workflow row as {@code graph_json}.
 */
public record GraphSnapshot(
        String graphId,
        String name,
        String description,
        List<NodeSnapshot> nodes,
        List<Graph.Edge> edges,
        List<String> startNodes
) {
    public record NodeSnapshot(
            String nodeId,
            String name,
            String type,
            String agentId,
            String toolName,
            List<String> dependencies,
            String status,
            String error
    ) {}
}
