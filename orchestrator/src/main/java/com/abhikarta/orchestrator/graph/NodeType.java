package com.abhikarta.orchestrator.graph;

/**
 * Kind of work a graph node performs.
 *
 * The wire value is the lower-case name used in DAG definition files,
 * persisted rows and planner output.
 */
public enum NodeType {
    AGENT("agent"),
    TOOL("tool"),
    HUMAN_IN_LOOP("human_in_loop");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve a wire value ("agent", "tool", "human_in_loop"), case-insensitively.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static NodeType fromValue(String value) {
        if (value != null) {
            for (NodeType t : values()) {
                if (t.value.equalsIgnoreCase(value.strip())) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + value);
    }
}
