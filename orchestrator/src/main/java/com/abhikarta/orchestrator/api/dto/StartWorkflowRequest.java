package com.abhikarta.orchestrator.api.dto;

/**
 * Request body for POST /workflows.
 *
 * Required: dagId, userId. sessionId may be omitted for one-off runs.
 */
public record StartWorkflowRequest(String dagId, String sessionId, String userId) {}
