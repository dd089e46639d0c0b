package com.abhikarta.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit entry for a workflow: node transitions, HITL activity,
 * terminal outcome.
 *
 * DB table: workflow_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_events")
public class WorkflowEvent {

    public static final String WORKFLOW_STARTED   = "workflow_started";
    public static final String WORKFLOW_COMPLETED = "workflow_completed";
    public static final String WORKFLOW_FAILED    = "workflow_failed";
    public static final String NODE_STARTED       = "node_started";
    public static final String NODE_COMPLETED     = "node_completed";
    public static final String NODE_FAILED        = "node_failed";
    public static final String NODE_SKIPPED       = "node_skipped";
    public static final String HITL_REQUESTED     = "hitl_requested";
    public static final String HITL_APPROVED      = "hitl_approved";
    public static final String HITL_REJECTED      = "hitl_rejected";
    public static final String LOOP_ITERATION     = "loop_iteration";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    // Null for workflow-level events.
    @Column(name = "node_id")
    private String nodeId;

    @Column(name = "event_type", nullable = false)
    private String eventType;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected WorkflowEvent() {}   // required by JPA

    public WorkflowEvent(UUID workflowId, String nodeId, String eventType, String message) {
        this.workflowId = workflowId;
        this.nodeId     = nodeId;
        this.eventType  = eventType;
        this.message    = message;
    }

    public UUID    getId()         { return id; }
    public UUID    getWorkflowId() { return workflowId; }
    public String  getNodeId()     { return nodeId; }
    public String  getEventType()  { return eventType; }
    public String  getMessage()    { return message; }
    public Instant getCreatedAt()  { return createdAt; }
}
