package com.abhikarta.orchestrator.planning;

/** The planning strategy could not produce any answer (no key, HTTP error, timeout). */
public class PlanningUnavailableException extends RuntimeException {

    private final int statusCode;

    public PlanningUnavailableException(String message) {
        this(message, -1, null);
    }

    public PlanningUnavailableException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public PlanningUnavailableException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed call, or -1 when no response was received. */
    public int statusCode() { return statusCode; }
}
