package com.abhikarta.orchestrator.planning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Output of the analyze stage. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestAnalysis(
        @JsonProperty("intent")             String intent,
        @JsonProperty("complexity")         String complexity,
        @JsonProperty("requires_hitl")      boolean requiresHitl,
        @JsonProperty("key_requirements")   List<String> keyRequirements,
        @JsonProperty("suggested_approach") String suggestedApproach) {

    public RequestAnalysis {
        complexity      = complexity == null ? "moderate" : complexity;
        keyRequirements = keyRequirements == null ? List.of() : List.copyOf(keyRequirements);
    }

    /** Used when the planner is unavailable or its answer cannot be parsed. */
    public static RequestAnalysis fallback(String request) {
        return new RequestAnalysis(request, "moderate", false, List.of(request), "Sequential execution");
    }
}
