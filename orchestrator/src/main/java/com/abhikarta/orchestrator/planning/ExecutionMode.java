package com.abhikarta.orchestrator.planning;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the plan executor walks a compiled plan.
 *
 * <ul>
 *   <li>SEQUENTIAL: one ready step at a time, in step list order.</li>
 *   <li>PARALLEL: every ready step of a batch before recomputing readiness.</li>
 *   <li>CONDITIONAL: sequential, but a step's condition is evaluated first.</li>
 *   <li>LOOP: repeated sequential passes, capped by max_iterations.</li>
 * </ul>
 */
public enum ExecutionMode {
    SEQUENTIAL("sequential"),
    PARALLEL("parallel"),
    CONDITIONAL("conditional"),
    LOOP("loop");

    private final String value;

    ExecutionMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** @throws IllegalArgumentException on an unknown value */
    @JsonCreator
    public static ExecutionMode fromValue(String value) {
        for (ExecutionMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) return mode;
        }
        throw new IllegalArgumentException("Unknown execution mode: " + value);
    }
}
