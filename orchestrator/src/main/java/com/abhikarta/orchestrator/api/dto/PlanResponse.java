package com.abhikarta.orchestrator.api.dto;

import com.abhikarta.orchestrator.model.Plan;
import com.abhikarta.orchestrator.planning.ExecutionPlan;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for GET /plans/{id} and the entries of GET /plans.
 * executionPlan is null when the stored JSON cannot be read.
 */
public record PlanResponse(
        UUID          id,
        String        userId,
        String        sessionId,
        String        userRequest,
        String        planType,
        String        status,
        String        summary,
        boolean       requiresHitl,
        ExecutionPlan executionPlan,
        UUID          workflowId,
        String        approvedBy,
        String        rejectionReason,
        Instant       createdAt,
        Instant       updatedAt
) {
    public static PlanResponse from(Plan p, ExecutionPlan executionPlan) {
        return new PlanResponse(
                p.getId(),
                p.getUserId(),
                p.getSessionId(),
                p.getUserRequest(),
                p.getPlanType(),
                p.getStatus().value(),
                p.getSummary(),
                p.isRequiresHitl(),
                executionPlan,
                p.getWorkflowId(),
                p.getApprovedBy(),
                p.getRejectionReason(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
