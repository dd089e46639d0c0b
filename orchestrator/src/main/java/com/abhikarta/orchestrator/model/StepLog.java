package com.abhikarta.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One entry per executed plan step, in execution order.
 *
 * DB table: step_logs  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "step_logs")
public class StepLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "step_id", nullable = false)
    private String stepId;

    @Column(nullable = false)
    private int iteration;

    @Column(nullable = false)
    private boolean success;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "executed_at", nullable = false, updatable = false)
    private Instant executedAt = Instant.now();

    protected StepLog() {}   // required by JPA

    public StepLog(UUID workflowId, String stepId, int iteration,
                   boolean success, String resultJson, String error) {
        this.workflowId = workflowId;
        this.stepId     = stepId;
        this.iteration  = iteration;
        this.success    = success;
        this.resultJson = resultJson;
        this.error      = error;
    }

    public UUID    getId()         { return id; }
    public UUID    getWorkflowId() { return workflowId; }
    public String  getStepId()     { return stepId; }
    public int     getIteration()  { return iteration; }
    public boolean isSuccess()     { return success; }
    public String  getResultJson() { return resultJson; }
    public String  getError()      { return error; }
    public Instant getExecutedAt() { return executedAt; }
}
