package com.abhikarta.orchestrator.planning;

/**
 * Pluggable text generator behind every planning decision.
 *
 * Callers expect JSON but must tolerate anything: every call site in the
 * supervisor falls back to a fixed decision when the answer cannot be parsed
 * or this method throws.
 */
public interface PlanningStrategy {

    /**
     * @throws PlanningUnavailableException if no answer could be obtained
     */
    String generate(String prompt);
}
