package com.abhikarta.orchestrator.dag;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One node entry of a DAG definition file.
 *
 * @param nodeType one of {@code agent}, {@code tool}, {@code human_in_loop}
 * @param config   opaque node config; agent and tool nodes read {@code config.input}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DagNodeDefinition(
        @JsonProperty("node_id")      String nodeId,
        @JsonProperty("node_type")    String nodeType,
        @JsonProperty("agent_id")     String agentId,
        @JsonProperty("tool_name")    String toolName,
        @JsonProperty("config")       Map<String, Object> config,
        @JsonProperty("dependencies") List<String> dependencies) {

    public DagNodeDefinition {
        config       = config == null ? Map.of() : config;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
