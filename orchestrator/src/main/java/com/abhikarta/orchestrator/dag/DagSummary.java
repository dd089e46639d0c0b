package com.abhikarta.orchestrator.dag;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Listing entry; the planner prompt shows these to choose a DAG for reuse. */
public record DagSummary(
        @JsonProperty("dag_id")      String dagId,
        @JsonProperty("name")        String name,
        @JsonProperty("description") String description,
        @JsonProperty("node_count")  int nodeCount) {

    public static DagSummary from(DagDefinition dag) {
        return new DagSummary(dag.dagId(), dag.name(), dag.description(), dag.nodes().size());
    }
}
