package com.abhikarta.orchestrator.model;

/**
 * Approval lifecycle of an autonomous Plan.
 *
 * Transitions:
 *   PENDING_APPROVAL → APPROVED → EXECUTED
 *   PENDING_APPROVAL → REJECTED
 */
public enum PlanStatus {
    PENDING_APPROVAL,
    APPROVED,
    REJECTED,
    EXECUTED;

    public String value() {
        return name().toLowerCase();
    }

    /** Accepts both {@code pending_approval} and {@code PENDING_APPROVAL}. */
    public static PlanStatus fromValue(String value) {
        return PlanStatus.valueOf(value.trim().toUpperCase());
    }
}
