package com.abhikarta.orchestrator.planning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Branch guard of a conditional-mode step.
 *
 * @param condition SpEL expression over {@code #results} and {@code #status}
 * @param branches  step ids skipped together with this step when the condition is false
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepCondition(
        @JsonProperty("condition") String condition,
        @JsonProperty("branches")  List<String> branches) {

    public StepCondition {
        branches = branches == null ? List.of() : List.copyOf(branches);
    }
}
