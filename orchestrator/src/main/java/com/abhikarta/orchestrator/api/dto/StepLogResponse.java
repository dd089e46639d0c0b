package com.abhikarta.orchestrator.api.dto;

import com.abhikarta.orchestrator.model.StepLog;

import java.time.Instant;

public record StepLogResponse(
        String  stepId,
        int     iteration,
        boolean success,
        String  resultJson,
        String  error,
        Instant executedAt
) {
    public static StepLogResponse from(StepLog s) {
        return new StepLogResponse(
                s.getStepId(),
                s.getIteration(),
                s.isSuccess(),
                s.getResultJson(),
                s.getError(),
                s.getExecutedAt()
        );
    }
}
