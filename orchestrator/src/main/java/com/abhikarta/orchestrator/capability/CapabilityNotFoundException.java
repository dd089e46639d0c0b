package com.abhikarta.orchestrator.capability;

public class CapabilityNotFoundException extends RuntimeException {
    public CapabilityNotFoundException(String kind, String id) {
        super("No " + kind + " registered with id: '" + id + "'");
    }
}
