package com.abhikarta.orchestrator.api.dto;

/**
 * Request body for POST /hitl/{id}/approve and /reject.
 * Approvals read {@code response}, rejections read {@code reason}.
 */
public record HitlDecisionRequest(String userId, String response, String reason) {}
