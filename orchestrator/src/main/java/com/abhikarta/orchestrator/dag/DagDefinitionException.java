package com.abhikarta.orchestrator.dag;

/** A DAG definition that cannot be turned into a valid Graph. */
public class DagDefinitionException extends RuntimeException {

    public DagDefinitionException(String message) {
        super(message);
    }

    public DagDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
