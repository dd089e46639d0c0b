package com.abhikarta.orchestrator.planning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param maxIterations pass cap; null means the configured default
 * @param condition     optional SpEL continue-condition checked after each pass
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoopConfig(
        @JsonProperty("max_iterations") Integer maxIterations,
        @JsonProperty("condition")      String condition) {

    /** Effective cap: the configured default when absent, never below 1. */
    public int effectiveMaxIterations(int defaultMax) {
        int max = maxIterations == null ? defaultMax : maxIterations;
        return Math.max(1, max);
    }
}
