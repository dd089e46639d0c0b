package com.abhikarta.orchestrator.dag;

import com.abhikarta.orchestrator.graph.Graph;

import java.util.List;
import java.util.Optional;

/**
 * Source of pre-defined DAG templates.
 */
public interface DagRegistry {

    Optional<DagDefinition> getDagConfig(String dagId);

    /** A new Graph instance on every call; graphs are never shared between workflows. */
    Optional<Graph> createGraphFromDag(String dagId);

    List<DagSummary> listDags();
}
