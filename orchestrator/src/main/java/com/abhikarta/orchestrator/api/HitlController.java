package com.abhikarta.orchestrator.api;

import com.abhikarta.orchestrator.api.dto.HitlDecisionRequest;
import com.abhikarta.orchestrator.api.dto.HitlResponse;
import com.abhikarta.orchestrator.service.HitlService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST API for human-in-the-loop requests, shared by DAG and plan workflows.
 *
 * GET  /hitl?workflowId=     pending requests, oldest first
 * POST /hitl/{id}/approve    approve; the workflow resumes in the background
 * POST /hitl/{id}/reject     reject; the workflow fails with the reason
 *
 * Approving or rejecting an already resolved request returns 409.
 */
@RestController
@RequestMapping("/hitl")
public class HitlController {

    private final HitlService hitlService;

    public HitlController(HitlService hitlService) {
        this.hitlService = hitlService;
    }

    @GetMapping
    public List<HitlResponse> pending(@RequestParam(required = false) UUID workflowId) {
        return hitlService.getPendingRequests(Optional.ofNullable(workflowId)).stream()
                .map(HitlResponse::from)
                .toList();
    }

    @PostMapping("/{id}/approve")
    public HitlResponse approve(@PathVariable UUID id, @RequestBody HitlDecisionRequest req) {
        requireRequest(id);
        if (!hitlService.approveHitl(id, req.userId(), req.response())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "HITL request already resolved: " + id);
        }
        return requireRequest(id);
    }

    @PostMapping("/{id}/reject")
    public HitlResponse reject(@PathVariable UUID id, @RequestBody HitlDecisionRequest req) {
        requireRequest(id);
        if (!hitlService.rejectHitl(id, req.userId(), req.reason())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "HITL request already resolved: " + id);
        }
        return requireRequest(id);
    }

    private HitlResponse requireRequest(UUID id) {
        return hitlService.getRequest(id)
                .map(HitlResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "HITL request not found: " + id));
    }
}
