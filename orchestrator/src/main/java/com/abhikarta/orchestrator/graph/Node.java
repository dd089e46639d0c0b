package com.abhikarta.orchestrator.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One unit of work inside a {@link Graph}.
 *
 * Identity and routing (id, type, agent/tool target, config) are fixed at
 * construction. Dependencies are added only through {@link Graph#addEdge} so the
 * graph can refuse edges that would close a cycle. Status, result and error are
 * mutated by the worker that owns the graph, through the transition methods below.
 */
public class Node {

    private final String nodeId;
    private final NodeType type;
    private final String agentId;
    private final String toolName;
    private final Map<String, Object> config;

    private final Set<String> dependencies = new LinkedHashSet<>();

    private NodeStatus status = NodeStatus.PENDING;
    private Object result;
    private String error;

    // True when this node was skipped because something upstream failed.
    // Such a node never satisfies its own dependents.
    private boolean upstreamFailed;

    // Plan-step metadata; absent for nodes loaded from DAG definitions.
    private String name;
    private String parallelGroup;
    private NodeCondition condition;
    private boolean checkpoint;
    private boolean usePreviousResult;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public Node(String nodeId, NodeType type, String agentId, String toolName, Map<String, Object> config) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Node type must not be null (node " + nodeId + ")");
        }
        this.nodeId   = nodeId;
        this.type     = type;
        this.agentId  = agentId;
        this.toolName = toolName;
        this.config   = config == null ? new LinkedHashMap<>() : new LinkedHashMap<>(config);
    }

    public static Node agent(String nodeId, String agentId, Map<String, Object> input) {
        return new Node(nodeId, NodeType.AGENT, agentId, null, inputConfig(input));
    }

    public static Node tool(String nodeId, String toolName, Map<String, Object> input) {
        return new Node(nodeId, NodeType.TOOL, null, toolName, inputConfig(input));
    }

    public static Node humanInLoop(String nodeId, String message) {
        Map<String, Object> config = new LinkedHashMap<>();
        if (message != null) {
            config.put("message", message);
        }
        return new Node(nodeId, NodeType.HUMAN_IN_LOOP, null, null, config);
    }

    private static Map<String, Object> inputConfig(Map<String, Object> input) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("input", input == null ? Map.of() : input);
        return config;
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    public void markRunning() {
        require(status == NodeStatus.PENDING, "start");
        status = NodeStatus.RUNNING;
    }

    public void awaitHuman() {
        require(type == NodeType.HUMAN_IN_LOOP, "await human input on a non-HITL node");
        require(status == NodeStatus.PENDING, "await human input");
        status = NodeStatus.WAITING_HITL;
    }

    public void complete(Object result) {
        require(status == NodeStatus.RUNNING || status == NodeStatus.WAITING_HITL, "complete");
        this.status = NodeStatus.COMPLETED;
        this.result = result;
        this.error  = null;
    }

    public void fail(String error) {
        require(status == NodeStatus.RUNNING || status == NodeStatus.WAITING_HITL, "fail");
        this.status = NodeStatus.FAILED;
        this.error  = error;
    }

    /**
     * @param upstreamFailed true when the skip is caused by a failed ancestor;
     *                       false for a branch that was simply not taken
     */
    public void skip(String reason, boolean upstreamFailed) {
        require(status == NodeStatus.PENDING, "skip");
        this.status         = NodeStatus.SKIPPED;
        this.error          = reason;
        this.upstreamFailed = upstreamFailed;
    }

    /** Put the node back to PENDING for another loop pass. */
    public void reset() {
        this.status         = NodeStatus.PENDING;
        this.result         = null;
        this.error          = null;
        this.upstreamFailed = false;
    }

    /**
     * Overwrite execution state wholesale. Used only when a graph is rebuilt
     * from persisted rows, never during a run.
     */
    public void restoreState(NodeStatus status, Object result, String error, boolean upstreamFailed) {
        this.status         = status == null ? NodeStatus.PENDING : status;
        this.result         = result;
        this.error          = error;
        this.upstreamFailed = upstreamFailed;
    }

    private void require(boolean condition, String action) {
        if (!condition) {
            throw new IllegalStateException(
                    "Cannot %s node '%s' in state %s".formatted(action, nodeId, status));
        }
    }

    // ------------------------------------------------------------------
    // Dependencies (mutated by Graph only)
    // ------------------------------------------------------------------

    void addDependency(String nodeId) {
        dependencies.add(nodeId);
    }

    public Set<String> getDependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public String      getNodeId()   { return nodeId; }
    public NodeType    getType()     { return type; }
    public String      getAgentId()  { return agentId; }
    public NodeStatus  getStatus()   { return status; }
    public Object      getResult()   { return result; }
    public String      getError()    { return error; }
    public boolean     isUpstreamFailed() { return upstreamFailed; }

    public Map<String, Object> getConfig() { return Collections.unmodifiableMap(config); }

    /** Tool name; DAG files may carry it inside config instead of on the node. */
    public String getToolName() {
        if (toolName != null) return toolName;
        Object fromConfig = config.get("tool_name");
        return fromConfig == null ? null : fromConfig.toString();
    }

    /** A copy of the {@code config.input} mapping handed to the capability provider. */
    public Map<String, Object> getInput() {
        Map<String, Object> input = new LinkedHashMap<>();
        if (config.get("input") instanceof Map<?, ?> m) {
            m.forEach((key, value) -> input.put(String.valueOf(key), value));
        }
        return input;
    }

    /** Prompt shown to the reviewer of a human_in_loop node. */
    public String getMessage() {
        Object message = config.get("message");
        return message == null ? "Approval required" : message.toString();
    }

    public String getName()                       { return name == null ? nodeId : name; }
    public String getParallelGroup()              { return parallelGroup; }
    public NodeCondition getCondition()           { return condition; }
    public boolean isCheckpoint()                 { return checkpoint; }
    public boolean isUsePreviousResult()          { return usePreviousResult; }

    public void setName(String name)                        { this.name = name; }
    public void setParallelGroup(String parallelGroup)      { this.parallelGroup = parallelGroup; }
    public void setCondition(NodeCondition condition)       { this.condition = condition; }
    public void setCheckpoint(boolean checkpoint)           { this.checkpoint = checkpoint; }
    public void setUsePreviousResult(boolean usePrevious)   { this.usePreviousResult = usePrevious; }

    @Override
    public String toString() {
        return "Node[" + nodeId + ", " + type.value() + ", " + status + "]";
    }
}
