package com.abhikarta.orchestrator.planning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One step of an execution plan. Compiled 1:1 into a graph node on approval.
 *
 * Agent steps name {@code agentId}, tool steps name {@code toolName};
 * human_in_loop steps carry only a {@code message}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanStep(
        @JsonProperty("step_id")             String stepId,
        @JsonProperty("name")                String name,
        @JsonProperty("type")                StepType type,
        @JsonProperty("agent_id")            String agentId,
        @JsonProperty("tool_name")           String toolName,
        @JsonProperty("input")               Map<String, Object> input,
        @JsonProperty("dependencies")        List<String> dependencies,
        @JsonProperty("parallel_group")      String parallelGroup,
        @JsonProperty("conditional")         StepCondition conditional,
        @JsonProperty("use_previous_result") boolean usePreviousResult,
        @JsonProperty("message")             String message) {

    public PlanStep {
        input        = input == null ? Map.of() : input;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static PlanStep agent(String stepId, String name, String agentId,
                                 Map<String, Object> input, List<String> dependencies) {
        return new PlanStep(stepId, name, StepType.AGENT, agentId, null, input,
                dependencies, null, null, false, null);
    }

    public static PlanStep tool(String stepId, String name, String toolName,
                                Map<String, Object> input, List<String> dependencies) {
        return new PlanStep(stepId, name, StepType.TOOL, null, toolName, input,
                dependencies, null, null, false, null);
    }

    /** Agent id or tool name, whichever the step targets. */
    @JsonIgnore
    public String resource() {
        return agentId != null ? agentId : toolName;
    }

    @JsonIgnore
    public String displayName() {
        return name == null || name.isBlank() ? stepId : name;
    }
}
