package com.abhikarta.orchestrator.api;

import com.abhikarta.orchestrator.api.dto.CreatePlanRequest;
import com.abhikarta.orchestrator.api.dto.PlanActionResponse;
import com.abhikarta.orchestrator.api.dto.PlanDecisionRequest;
import com.abhikarta.orchestrator.api.dto.PlanDraftResponse;
import com.abhikarta.orchestrator.api.dto.PlanResponse;
import com.abhikarta.orchestrator.model.Plan;
import com.abhikarta.orchestrator.model.PlanStatus;
import com.abhikarta.orchestrator.service.PlanActionResult;
import com.abhikarta.orchestrator.service.PlanService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST API for autonomous plans.
 *
 * POST /plans                    plan a free-form request; nothing runs yet
 * GET  /plans?userId=&status=    list plans, newest first
 * GET  /plans/{id}               one plan with its execution plan
 * POST /plans/{id}/approve       approve and start executing
 * POST /plans/{id}/reject        reject; nothing will run
 */
@RestController
@RequestMapping("/plans")
public class PlanController {

    private final PlanService planService;

    public PlanController(PlanService planService) {
        this.planService = planService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/plans \
     *     -H "Content-Type: application/json" \
     *     -d '{"userId":"alice","request":"echo hello"}'
     */
    @PostMapping
    public ResponseEntity<PlanDraftResponse> create(@RequestBody CreatePlanRequest req) {
        if (req.request() == null || req.request().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "request is required");
        }
        PlanDraftResponse body = PlanDraftResponse.from(
                planService.createPlan(req.userId(), req.sessionId(), req.request()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping
    public List<PlanResponse> list(@RequestParam(required = false) String userId,
                                   @RequestParam(required = false) String status) {
        Optional<PlanStatus> filter;
        try {
            filter = Optional.ofNullable(status).map(PlanStatus::fromValue);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return planService.listPlans(userId, filter).stream()
                .map(this::toResponse)
                .toList();
    }

    @GetMapping("/{id}")
    public PlanResponse getPlan(@PathVariable UUID id) {
        return planService.getPlan(id)
                .map(this::toResponse)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Plan not found: " + id));
    }

    @PostMapping("/{id}/approve")
    public PlanActionResponse approve(@PathVariable UUID id, @RequestBody PlanDecisionRequest req) {
        return respond(planService.approvePlan(id, req.userId()));
    }

    @PostMapping("/{id}/reject")
    public PlanActionResponse reject(@PathVariable UUID id, @RequestBody PlanDecisionRequest req) {
        return respond(planService.rejectPlan(id, req.userId(), req.reason()));
    }

    private PlanActionResponse respond(PlanActionResult result) {
        return switch (result.outcome()) {
            case OK            -> PlanActionResponse.from(result);
            case NOT_FOUND     -> throw new ResponseStatusException(HttpStatus.NOT_FOUND, result.error());
            case INVALID_STATE -> throw new ResponseStatusException(HttpStatus.CONFLICT, result.error());
        };
    }

    private PlanResponse toResponse(Plan plan) {
        return PlanResponse.from(plan, planService.executionPlanOf(plan).orElse(null));
    }
}
