package com.abhikarta.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * An autonomous plan built from a free-form request, waiting for (or past)
 * human approval.
 *
 * {@code executionPlanJson} holds the full typed plan (steps, mode, loop
 * config, checkpoints) so approval can compile it into a workflow without
 * calling the planner again.
 *
 * DB table: plans  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "plans")
public class Plan {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "session_id")
    private String sessionId;

    @Column(name = "user_request", nullable = false, columnDefinition = "TEXT")
    private String userRequest;

    // Lowercase plan type value: use_existing_dag, create_stategraph, simple_execution.
    @Column(name = "plan_type", nullable = false)
    private String planType;

    @Column(name = "execution_plan_json", nullable = false, columnDefinition = "TEXT")
    private String executionPlanJson;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(name = "requires_hitl", nullable = false)
    private boolean requiresHitl = false;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PlanStatus status = PlanStatus.PENDING_APPROVAL;

    // Set on approval.
    @Column(name = "workflow_id")
    private UUID workflowId;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Plan() {}   // required by JPA

    public Plan(String userId, String sessionId, String userRequest,
                String planType, String executionPlanJson, String summary, boolean requiresHitl) {
        this.userId            = userId;
        this.sessionId         = sessionId;
        this.userRequest       = userRequest;
        this.planType          = planType;
        this.executionPlanJson = executionPlanJson;
        this.summary           = summary;
        this.requiresHitl      = requiresHitl;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()                { return id; }
    public String     getUserId()            { return userId; }
    public String     getSessionId()         { return sessionId; }
    public String     getUserRequest()       { return userRequest; }
    public String     getPlanType()          { return planType; }
    public String     getExecutionPlanJson() { return executionPlanJson; }
    public String     getSummary()           { return summary; }
    public boolean    isRequiresHitl()       { return requiresHitl; }
    public PlanStatus getStatus()            { return status; }
    public UUID       getWorkflowId()        { return workflowId; }
    public String     getApprovedBy()        { return approvedBy; }
    public String     getRejectionReason()   { return rejectionReason; }
    public Instant    getCreatedAt()         { return createdAt; }
    public Instant    getUpdatedAt()         { return updatedAt; }

    public void setId(UUID id)                          { this.id = id; }
    public void setStatus(PlanStatus status)            { this.status = status; }
    public void setWorkflowId(UUID workflowId)          { this.workflowId = workflowId; }
    public void setApprovedBy(String approvedBy)        { this.approvedBy = approvedBy; }
    public void setRejectionReason(String reason)       { this.rejectionReason = reason; }
}
