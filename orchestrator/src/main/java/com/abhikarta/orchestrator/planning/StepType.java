package com.abhikarta.orchestrator.planning;

import com.abhikarta.orchestrator.graph.NodeType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StepType {
    AGENT(NodeType.AGENT),
    TOOL(NodeType.TOOL),
    HUMAN_IN_LOOP(NodeType.HUMAN_IN_LOOP);

    private final NodeType nodeType;

    StepType(NodeType nodeType) {
        this.nodeType = nodeType;
    }

    public NodeType nodeType() {
        return nodeType;
    }

    @JsonValue
    public String value() {
        return nodeType.value();
    }

    @JsonCreator
    public static StepType fromValue(String value) {
        NodeType type = NodeType.fromValue(value);
        for (StepType stepType : values()) {
            if (stepType.nodeType == type) return stepType;
        }
        throw new IllegalArgumentException("Unknown step type: " + value);
    }
}
