package com.abhikarta.orchestrator.api.dto;

/** Request body for POST /plans/{id}/approve and /reject. reason is ignored on approval. */
public record PlanDecisionRequest(String userId, String reason) {}
