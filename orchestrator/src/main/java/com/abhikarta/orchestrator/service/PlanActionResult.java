package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.model.PlanStatus;

import java.util.UUID;

/**
 * Outcome of approving or rejecting a plan.
 *
 * @param workflowId set only when an approval started a workflow
 */
public record PlanActionResult(Outcome outcome, UUID planId, PlanStatus status, UUID workflowId, String error) {

    public enum Outcome { OK, NOT_FOUND, INVALID_STATE }

    static PlanActionResult ok(UUID planId, PlanStatus status, UUID workflowId) {
        return new PlanActionResult(Outcome.OK, planId, status, workflowId, null);
    }

    static PlanActionResult notFound(UUID planId) {
        return new PlanActionResult(Outcome.NOT_FOUND, planId, null, null, "Plan not found: " + planId);
    }

    static PlanActionResult invalidState(UUID planId, PlanStatus status, String error) {
        return new PlanActionResult(Outcome.INVALID_STATE, planId, status, null, error);
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }
}
