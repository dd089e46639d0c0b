package com.abhikarta.orchestrator.planning;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How a plan's steps were obtained. */
public enum PlanType {
    USE_EXISTING_DAG("use_existing_dag"),
    CREATE_STATEGRAPH("create_stategraph"),
    SIMPLE_EXECUTION("simple_execution");

    private final String value;

    PlanType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** @throws IllegalArgumentException on an unknown value */
    @JsonCreator
    public static PlanType fromValue(String value) {
        for (PlanType type : values()) {
            if (type.value.equalsIgnoreCase(value)) return type;
        }
        throw new IllegalArgumentException("Unknown plan type: " + value);
    }
}
