package com.abhikarta.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A pending or resolved human checkpoint.
 *
 * Raised when a workflow reaches a human_in_loop node or a plan checkpoint.
 * Resolution happens exactly once; the optimistic {@code version} column makes
 * two concurrent resolutions of the same request fail rather than both win.
 *
 * DB table: hitl_requests  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "hitl_requests")
public class HitlRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "node_id", nullable = false)
    private String nodeId;

    // Set for plan checkpoints.
    @Column(name = "plan_id")
    private UUID planId;

    // Loop pass the checkpoint belongs to; 0 outside loop mode.
    @Column(nullable = false)
    private int iteration = 0;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private HitlStatus status = HitlStatus.PENDING;

    @Column(name = "responded_by")
    private String respondedBy;

    @Column(columnDefinition = "TEXT")
    private String response;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "responded_at")
    private Instant respondedAt;

    @Version
    private long version;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected HitlRequest() {}   // required by JPA

    public HitlRequest(UUID workflowId, String nodeId, UUID planId, int iteration, String message) {
        this.workflowId = workflowId;
        this.nodeId     = nodeId;
        this.planId     = planId;
        this.iteration  = iteration;
        this.message    = message;
    }

    /** Move out of PENDING. Callers check {@link #isPending()} first. */
    public void resolve(HitlStatus outcome, String respondedBy, String response) {
        this.status      = outcome;
        this.respondedBy = respondedBy;
        this.response    = response;
        this.respondedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID       getId()          { return id; }
    public UUID       getWorkflowId()  { return workflowId; }
    public String     getNodeId()      { return nodeId; }
    public UUID       getPlanId()      { return planId; }
    public int        getIteration()   { return iteration; }
    public String     getMessage()     { return message; }
    public HitlStatus getStatus()      { return status; }
    public String     getRespondedBy() { return respondedBy; }
    public String     getResponse()    { return response; }
    public Instant    getCreatedAt()   { return createdAt; }
    public Instant    getRespondedAt() { return respondedAt; }

    public boolean isPending() { return status == HitlStatus.PENDING; }
}
