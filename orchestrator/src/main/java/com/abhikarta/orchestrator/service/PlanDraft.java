package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.model.PlanStatus;
import com.abhikarta.orchestrator.planning.ExecutionPlan;
import com.abhikarta.orchestrator.planning.PlanStep;
import com.abhikarta.orchestrator.planning.PlanType;
import com.abhikarta.orchestrator.planning.RequestAnalysis;
import com.abhikarta.orchestrator.planning.StrategyDecision;

import java.util.List;
import java.util.UUID;

/**
 * What {@code createPlan} hands back: the persisted plan awaiting approval,
 * the decisions that produced it, and the supervisor's message trail.
 */
public record PlanDraft(
        UUID             planId,
        PlanType         planType,
        PlanStatus       status,
        RequestAnalysis  analysis,
        StrategyDecision decision,
        ExecutionPlan    executionPlan,
        String           summary,
        boolean          requiresHitl,
        List<String>     messages) {

    public List<PlanStep> taskBreakdown() {
        return executionPlan.steps();
    }

    public boolean pendingApproval() {
        return status == PlanStatus.PENDING_APPROVAL;
    }
}
