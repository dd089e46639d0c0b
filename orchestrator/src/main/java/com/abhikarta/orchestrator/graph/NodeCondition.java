package com.abhikarta.orchestrator.graph;

import java.util.List;

/**
 * Branch guard attached to a node compiled from a conditional plan step.
 *
 * @param expression predicate evaluated against prior results just before dispatch
 * @param branches   ids of further nodes that are skipped along with this one
 *                   when the predicate does not hold
 */
public record NodeCondition(String expression, List<String> branches) {

    public NodeCondition {
        branches = branches == null ? List.of() : List.copyOf(branches);
    }
}
