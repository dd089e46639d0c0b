package com.abhikarta.orchestrator.api.dto;

import com.abhikarta.orchestrator.model.WorkflowNode;

import java.time.Instant;

/**
 * One node of GET /workflows/{id}. resultJson is the capability's raw output.
 */
public record NodeResponse(
        String  nodeId,
        String  name,
        String  nodeType,
        String  agentId,
        String  toolName,
        String  status,
        String  resultJson,
        String  error,
        boolean checkpoint,
        Instant startedAt,
        Instant finishedAt
) {
    public static NodeResponse from(WorkflowNode n) {
        return new NodeResponse(
                n.getNodeId(),
                n.getName(),
                n.getNodeType().value(),
                n.getAgentId(),
                n.getToolName(),
                n.getStatus().name(),
                n.getResultJson(),
                n.getError(),
                n.isCheckpoint(),
                n.getStartedAt(),
                n.getFinishedAt()
        );
    }
}
