package com.abhikarta.orchestrator.api.dto;

import com.abhikarta.orchestrator.planning.ExecutionPlan;
import com.abhikarta.orchestrator.planning.PlanStep;
import com.abhikarta.orchestrator.service.PlanDraft;

import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /plans. The plan is persisted but not executed;
 * the caller approves it via POST /plans/{planId}/approve.
 */
public record PlanDraftResponse(
        UUID           planId,
        String         planType,
        String         status,
        ExecutionPlan  executionPlan,
        List<PlanStep> taskBreakdown,
        String         planSummary,
        boolean        requiresHitl,
        boolean        pendingApproval,
        List<String>   messages
) {
    public static PlanDraftResponse from(PlanDraft draft) {
        return new PlanDraftResponse(
                draft.planId(),
                draft.planType().value(),
                draft.status().value(),
                draft.executionPlan(),
                draft.taskBreakdown(),
                draft.summary(),
                draft.requiresHitl(),
                draft.pendingApproval(),
                draft.messages()
        );
    }
}
