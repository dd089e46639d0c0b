package com.abhikarta.orchestrator.planning;

/** The planner's answer could not be turned into the expected typed decision. */
public class PlanParseException extends RuntimeException {

    public PlanParseException(String message) {
        super(message);
    }

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
