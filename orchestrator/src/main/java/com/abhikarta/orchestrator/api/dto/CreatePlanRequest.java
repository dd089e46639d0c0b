package com.abhikarta.orchestrator.api.dto;

/** Request body for POST /plans. */
public record CreatePlanRequest(String userId, String sessionId, String request) {}
