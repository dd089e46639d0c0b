package com.abhikarta.orchestrator.model;

/** A HITL request is resolved exactly once: PENDING → APPROVED | REJECTED. */
public enum HitlStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public String value() {
        return name().toLowerCase();
    }
}
