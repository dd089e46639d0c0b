package com.abhikarta.orchestrator.model;

import com.abhikarta.orchestrator.graph.NodeStatus;
import com.abhikarta.orchestrator.graph.NodeType;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable state of one graph node within a Workflow.
 *
 * Workers never keep a Graph across a suspension; they rebuild it from these
 * rows, so every field the scheduler reads must be here. JSON columns hold the
 * node config, dependency list, result and condition.
 *
 * The owning workflow is referenced by id rather than by association so worker
 * threads never trigger lazy loading outside a transaction.
 *
 * DB table: workflow_nodes  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_nodes",
       uniqueConstraints = @UniqueConstraint(columnNames = {"workflow_id", "node_id"}))
public class WorkflowNode {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "node_id", nullable = false)
    private String nodeId;

    // Insertion order within the graph; sequential modes follow it.
    @Column(nullable = false)
    private int position;

    @Column
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "node_type", nullable = false)
    private NodeType nodeType;

    @Column(name = "agent_id")
    private String agentId;

    @Column(name = "tool_name")
    private String toolName;

    @Column(name = "config_json", columnDefinition = "TEXT")
    private String configJson;

    // JSON array of node ids.
    @Column(name = "dependencies_json", columnDefinition = "TEXT")
    private String dependenciesJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private NodeStatus status = NodeStatus.PENDING;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "upstream_failed", nullable = false)
    private boolean upstreamFailed = false;

    @Column(nullable = false)
    private boolean checkpoint = false;

    @Column(name = "parallel_group")
    private String parallelGroup;

    @Column(name = "condition_json", columnDefinition = "TEXT")
    private String conditionJson;

    @Column(name = "use_previous_result", nullable = false)
    private boolean usePreviousResult = false;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WorkflowNode() {}   // required by JPA

    public WorkflowNode(UUID workflowId, String nodeId, int position, NodeType nodeType) {
        this.workflowId = workflowId;
        this.nodeId     = nodeId;
        this.position   = position;
        this.nodeType   = nodeType;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()                { return id; }
    public UUID       getWorkflowId()        { return workflowId; }
    public String     getNodeId()            { return nodeId; }
    public int        getPosition()          { return position; }
    public String     getName()              { return name; }
    public NodeType   getNodeType()          { return nodeType; }
    public String     getAgentId()           { return agentId; }
    public String     getToolName()          { return toolName; }
    public String     getConfigJson()        { return configJson; }
    public String     getDependenciesJson()  { return dependenciesJson; }
    public NodeStatus getStatus()            { return status; }
    public String     getResultJson()        { return resultJson; }
    public String     getError()             { return error; }
    public boolean    isUpstreamFailed()     { return upstreamFailed; }
    public boolean    isCheckpoint()         { return checkpoint; }
    public String     getParallelGroup()     { return parallelGroup; }
    public String     getConditionJson()     { return conditionJson; }
    public boolean    isUsePreviousResult()  { return usePreviousResult; }
    public Instant    getStartedAt()         { return startedAt; }
    public Instant    getFinishedAt()        { return finishedAt; }

    public void setName(String name)                        { this.name = name; }
    public void setAgentId(String agentId)                  { this.agentId = agentId; }
    public void setToolName(String toolName)                { this.toolName = toolName; }
    public void setConfigJson(String configJson)            { this.configJson = configJson; }
    public void setDependenciesJson(String v)               { this.dependenciesJson = v; }
    public void setStatus(NodeStatus status)                { this.status = status; }
    public void setResultJson(String resultJson)            { this.resultJson = resultJson; }
    public void setError(String error)                      { this.error = error; }
    public void setUpstreamFailed(boolean upstreamFailed)   { this.upstreamFailed = upstreamFailed; }
    public void setCheckpoint(boolean checkpoint)           { this.checkpoint = checkpoint; }
    public void setParallelGroup(String parallelGroup)      { this.parallelGroup = parallelGroup; }
    public void setConditionJson(String conditionJson)      { this.conditionJson = conditionJson; }
    public void setUsePreviousResult(boolean v)             { this.usePreviousResult = v; }
    public void setStartedAt(Instant startedAt)             { this.startedAt = startedAt; }
    public void setFinishedAt(Instant finishedAt)           { this.finishedAt = finishedAt; }
}
