package com.abhikarta.orchestrator.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A named directed acyclic graph of {@link Node}s.
 *
 * Acyclicity is enforced on construction: {@link #addEdge} refuses any edge
 * that would close a cycle, so a Graph instance can never starve the scheduler
 * through a dependency loop.
 *
 * Node iteration order is insertion order. The sequential plan modes rely on it
 * to mean "step list order"; the DAG scheduler treats each ready set as unordered.
 *
 * Not thread-safe. A graph is owned by exactly one worker at a time.
 */
public class Graph {

    /** A dependency pair: {@code to} waits for {@code from}. */
    public record Edge(String from, String to) {}

    private final String graphId;
    private final String name;
    private final String description;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();

    public Graph(String graphId, String name, String description) {
        this.graphId     = graphId;
        this.name        = name == null ? graphId : name;
        this.description = description;
    }

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    /**
     * Register a node.
     *
     * @throws IllegalArgumentException if a node with the same id already exists
     */
    public Graph addNode(Node node) {
        if (nodes.containsKey(node.getNodeId())) {
            throw new IllegalArgumentException(
                    "Duplicate node id '" + node.getNodeId() + "' in graph " + graphId);
        }
        nodes.put(node.getNodeId(), node);
        return this;
    }

    /**
     * Record that {@code toId} depends on {@code fromId}.
     *
     * @throws IllegalArgumentException if either id is unknown, or the edge would create a cycle
     */
    public Graph addEdge(String fromId, String toId) {
        Node from = nodes.get(fromId);
        Node to   = nodes.get(toId);
        if (from == null || to == null) {
            throw new IllegalArgumentException("Edge %s -> %s references an unknown node in graph %s"
                    .formatted(fromId, toId, graphId));
        }
        if (to.getDependencies().contains(fromId)) {
            return this;
        }
        if (fromId.equals(toId) || dependsOn(fromId, toId)) {
            throw new IllegalArgumentException("Edge %s -> %s would create a cycle in graph %s"
                    .formatted(fromId, toId, graphId));
        }
        to.addDependency(fromId);
        edges.add(new Edge(fromId, toId));
        return this;
    }

    /** True if {@code nodeId} transitively depends on {@code ancestorId}. */
    private boolean dependsOn(String nodeId, String ancestorId) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        stack.push(nodeId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!seen.add(current)) continue;
            for (String dep : nodes.get(current).getDependencies()) {
                if (dep.equals(ancestorId)) return true;
                stack.push(dep);
            }
        }
        return false;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /**
     * Every PENDING node whose dependencies are all contained in {@code completedIds}.
     *
     * The returned nodes are mutually independent and may be dispatched in any order.
     * Human-in-loop nodes are included; callers decide how to handle them.
     */
    public List<Node> getReadyNodes(Set<String> completedIds) {
        List<Node> ready = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (node.getStatus() == NodeStatus.PENDING
                    && completedIds.containsAll(node.getDependencies())) {
                ready.add(node);
            }
        }
        return ready;
    }

    /** Ids of nodes that satisfy their dependents: COMPLETED or SKIPPED. */
    public Set<String> satisfiedIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Node node : nodes.values()) {
            if (node.getStatus() == NodeStatus.COMPLETED || node.getStatus() == NodeStatus.SKIPPED) {
                ids.add(node.getNodeId());
            }
        }
        return ids;
    }

    /**
     * Skip every PENDING node that has a failed ancestor.
     *
     * Runs to a fixpoint, so a whole chain below a failed node is skipped in
     * one call. Only nodes skipped by this call are returned.
     */
    public List<Node> propagateFailures() {
        List<Node> skipped = new ArrayList<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Node node : nodes.values()) {
                if (node.getStatus() != NodeStatus.PENDING) continue;
                for (String depId : node.getDependencies()) {
                    Node dep = nodes.get(depId);
                    boolean blocked = dep.getStatus() == NodeStatus.FAILED
                            || (dep.getStatus() == NodeStatus.SKIPPED && dep.isUpstreamFailed());
                    if (blocked) {
                        node.skip("Skipped: upstream node '" + depId + "' did not complete", true);
                        skipped.add(node);
                        changed = true;
                        break;
                    }
                }
            }
        }
        return skipped;
    }

    /** True once every node is COMPLETED, FAILED or SKIPPED. */
    public boolean isTerminal() {
        return nodes.values().stream().allMatch(n -> n.getStatus().isTerminal());
    }

    public List<Node> nodesIn(NodeStatus status) {
        return nodes.values().stream().filter(n -> n.getStatus() == status).toList();
    }

    /** Nodes with no dependencies: the initial ready set. */
    public List<Node> startNodes() {
        return nodes.values().stream().filter(n -> n.getDependencies().isEmpty()).toList();
    }

    public Optional<Node> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Collection<Node> nodes()  { return Collections.unmodifiableCollection(nodes.values()); }
    public List<Edge>       edges()  { return Collections.unmodifiableList(edges); }
    public int              size()   { return nodes.size(); }
    public String getGraphId()       { return graphId; }
    public String getName()          { return name; }
    public String getDescription()   { return description; }

    // ------------------------------------------------------------------
    // Loop support and serialization
    // ------------------------------------------------------------------

    /** Reset every node to PENDING, keeping structure. Used between loop passes. */
    public void resetAll() {
        nodes.values().forEach(Node::reset);
    }

    /** Structural snapshot (nodes, edges, statuses) for persistence and display. */
    public GraphSnapshot snapshot() {
        List<GraphSnapshot.NodeSnapshot> nodeSnapshots = nodes.values().stream()
                .map(n -> new GraphSnapshot.NodeSnapshot(
                        n.getNodeId(),
                        n.getName(),
                        n.getType().value(),
                        n.getAgentId(),
                        n.getToolName(),
                        List.copyOf(n.getDependencies()),
                        n.getStatus().name(),
                        n.getError()))
                .toList();
        return new GraphSnapshot(
                graphId,
                name,
                description,
                nodeSnapshots,
                List.copyOf(edges),
                startNodes().stream().map(Node::getNodeId).toList());
    }
}
