package com.abhikarta.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One execution of a Graph, either a pre-defined DAG or a compiled Plan.
 *
 * The row doubles as the resume token: a worker needs only the workflow id to
 * rebuild the Graph from workflow_nodes and carry on. For plan executions the
 * loop counter and execution mode live here too.
 *
 * DB table: workflows  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflows")
public class Workflow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // DAG id, or "plan_<uuid>" for compiled plans.
    @Column(name = "dag_id", nullable = false)
    private String dagId;

    @Column
    private String name;

    @Column(name = "session_id")
    private String sessionId;

    @Column(name = "user_id")
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowState state = WorkflowState.RUNNING;

    // Null for plain DAG executions.
    @Column(name = "plan_id")
    private UUID planId;

    // Lowercase execution mode value; null for DAG executions.
    @Column(name = "execution_mode")
    private String executionMode;

    // Zero-based pass counter for loop mode. Always 0 in other modes.
    @Column(name = "loop_iteration", nullable = false)
    private int loopIteration = 0;

    @Column(name = "max_iterations", nullable = false)
    private int maxIterations = 1;

    // Optional SpEL continue-condition evaluated after each loop pass.
    @Column(name = "loop_condition", columnDefinition = "TEXT")
    private String loopCondition;

    // Structural snapshot refreshed on every terminal transition.
    @Column(name = "graph_json", columnDefinition = "TEXT")
    private String graphJson;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Workflow() {}   // required by JPA

    public Workflow(String dagId, String name, String sessionId, String userId) {
        this.dagId     = dagId;
        this.name      = name;
        this.sessionId = sessionId;
        this.userId    = userId;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()            { return id; }
    public String        getDagId()         { return dagId; }
    public String        getName()          { return name; }
    public String        getSessionId()     { return sessionId; }
    public String        getUserId()        { return userId; }
    public WorkflowState getState()         { return state; }
    public UUID          getPlanId()        { return planId; }
    public String        getExecutionMode() { return executionMode; }
    public int           getLoopIteration() { return loopIteration; }
    public int           getMaxIterations() { return maxIterations; }
    public String        getLoopCondition() { return loopCondition; }
    public String        getGraphJson()     { return graphJson; }
    public String        getResultJson()    { return resultJson; }
    public String        getError()         { return error; }
    public Instant       getCreatedAt()     { return createdAt; }
    public Instant       getUpdatedAt()     { return updatedAt; }
    public Instant       getCompletedAt()   { return completedAt; }

    public void setId(UUID id)                          { this.id = id; }
    public void setState(WorkflowState state)           { this.state = state; }
    public void setPlanId(UUID planId)                  { this.planId = planId; }
    public void setExecutionMode(String executionMode)  { this.executionMode = executionMode; }
    public void setLoopIteration(int loopIteration)     { this.loopIteration = loopIteration; }
    public void setMaxIterations(int maxIterations)     { this.maxIterations = maxIterations; }
    public void setLoopCondition(String loopCondition)  { this.loopCondition = loopCondition; }
    public void setGraphJson(String graphJson)          { this.graphJson = graphJson; }
    public void setResultJson(String resultJson)        { this.resultJson = resultJson; }
    public void setError(String error)                  { this.error = error; }
    public void setCompletedAt(Instant completedAt)     { this.completedAt = completedAt; }

    public boolean isPlanExecution() { return planId != null; }
}
