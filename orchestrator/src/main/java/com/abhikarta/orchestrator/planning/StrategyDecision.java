package com.abhikarta.orchestrator.planning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of the decide stage.
 *
 * {@code selectedDagId} is only meaningful for {@link PlanType#USE_EXISTING_DAG}.
 * A missing execution mode means sequential; a missing plan type is malformed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StrategyDecision(
        @JsonProperty("strategy")        PlanType planType,
        @JsonProperty("reasoning")       String reasoning,
        @JsonProperty("selected_dag_id") String selectedDagId,
        @JsonProperty("execution_mode")  ExecutionMode executionMode,
        @JsonProperty("estimated_steps") int estimatedSteps) {

    public StrategyDecision {
        if (planType == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        executionMode = executionMode == null ? ExecutionMode.SEQUENTIAL : executionMode;
    }

    public static StrategyDecision fallback() {
        return new StrategyDecision(PlanType.CREATE_STATEGRAPH,
                "Creating custom StateGraph for flexible execution",
                null, ExecutionMode.SEQUENTIAL, 3);
    }
}
