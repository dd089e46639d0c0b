package com.abhikarta.orchestrator.api.dto;

import com.abhikarta.orchestrator.model.WorkflowEvent;

import java.time.Instant;

public record EventResponse(String nodeId, String eventType, String message, Instant createdAt) {

    public static EventResponse from(WorkflowEvent e) {
        return new EventResponse(e.getNodeId(), e.getEventType(), e.getMessage(), e.getCreatedAt());
    }
}
