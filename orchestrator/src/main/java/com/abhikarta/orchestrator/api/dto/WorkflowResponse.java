package com.abhikarta.orchestrator.api.dto;

import com.abhikarta.orchestrator.model.Workflow;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /workflows and the entries of GET /workflows.
 */
public record WorkflowResponse(
        UUID    id,
        String  dagId,
        String  name,
        String  state,
        String  sessionId,
        String  userId,
        UUID    planId,
        String  executionMode,
        int     loopIteration,
        String  error,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt
) {
    public static WorkflowResponse from(Workflow w) {
        return new WorkflowResponse(
                w.getId(),
                w.getDagId(),
                w.getName(),
                w.getState().value(),
                w.getSessionId(),
                w.getUserId(),
                w.getPlanId(),
                w.getExecutionMode(),
                w.getLoopIteration(),
                w.getError(),
                w.getCreatedAt(),
                w.getUpdatedAt(),
                w.getCompletedAt()
        );
    }
}
