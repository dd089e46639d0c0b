package com.abhikarta.orchestrator.planning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * The approved-or-pending unit of work: steps plus how to run them.
 *
 * @param type            {@code dag} when compiled from a DAG, else {@code stategraph}
 * @param dagId           source DAG id for {@code dag} plans
 * @param executionMode   may be absent in planner output; see {@link #effectiveMode()}
 * @param parallelGroups  informational grouping reported by the planner
 * @param hitlCheckpoints step ids after which a human must approve before execution goes on
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionPlan(
        @JsonProperty("type")             String type,
        @JsonProperty("dag_id")           String dagId,
        @JsonProperty("execution_mode")   ExecutionMode executionMode,
        @JsonProperty("steps")            List<PlanStep> steps,
        @JsonProperty("parallel_groups")  Map<String, Object> parallelGroups,
        @JsonProperty("hitl_checkpoints") List<String> hitlCheckpoints,
        @JsonProperty("loop_config")      LoopConfig loopConfig) {

    public static final String TYPE_DAG        = "dag";
    public static final String TYPE_STATEGRAPH = "stategraph";

    public ExecutionPlan {
        type            = type == null ? TYPE_STATEGRAPH : type;
        steps           = steps == null ? List.of() : List.copyOf(steps);
        parallelGroups  = parallelGroups == null ? Map.of() : parallelGroups;
        hitlCheckpoints = hitlCheckpoints == null ? List.of() : List.copyOf(hitlCheckpoints);
    }

    /** Same plan with a different execution mode. */
    public ExecutionPlan withExecutionMode(ExecutionMode mode) {
        return new ExecutionPlan(type, dagId, mode, steps, parallelGroups, hitlCheckpoints, loopConfig);
    }

    @JsonIgnore
    public ExecutionMode effectiveMode() {
        return executionMode == null ? ExecutionMode.SEQUENTIAL : executionMode;
    }

    @JsonIgnore
    public boolean requiresHitl() {
        return !hitlCheckpoints.isEmpty()
                || steps.stream().anyMatch(s -> s.type() == StepType.HUMAN_IN_LOOP);
    }
}
