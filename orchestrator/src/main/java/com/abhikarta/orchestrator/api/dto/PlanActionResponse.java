package com.abhikarta.orchestrator.api.dto;

import com.abhikarta.orchestrator.service.PlanActionResult;

import java.util.UUID;

/** Response body for POST /plans/{id}/approve and /reject. */
public record PlanActionResponse(UUID planId, String status, UUID workflowId) {

    public static PlanActionResponse from(PlanActionResult result) {
        return new PlanActionResponse(result.planId(), result.status().value(), result.workflowId());
    }
}
