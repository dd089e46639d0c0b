package com.abhikarta.orchestrator.api.dto;

import com.abhikarta.orchestrator.model.HitlRequest;

import java.time.Instant;
import java.util.UUID;

/**
 * A human-in-the-loop request as returned by GET /hitl and GET /workflows/{id}.
 */
public record HitlResponse(
        UUID    id,
        UUID    workflowId,
        String  nodeId,
        UUID    planId,
        int     iteration,
        String  message,
        String  status,
        String  respondedBy,
        String  response,
        Instant createdAt,
        Instant respondedAt
) {
    public static HitlResponse from(HitlRequest h) {
        return new HitlResponse(
                h.getId(),
                h.getWorkflowId(),
                h.getNodeId(),
                h.getPlanId(),
                h.getIteration(),
                h.getMessage(),
                h.getStatus().value(),
                h.getRespondedBy(),
                h.getResponse(),
                h.getCreatedAt(),
                h.getRespondedAt()
        );
    }
}
