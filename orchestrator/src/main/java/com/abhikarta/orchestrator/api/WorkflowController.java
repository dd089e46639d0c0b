package com.abhikarta.orchestrator.api;

import com.abhikarta.orchestrator.api.dto.StartWorkflowRequest;
import com.abhikarta.orchestrator.api.dto.WorkflowResponse;
import com.abhikarta.orchestrator.api.dto.WorkflowStatusResponse;
import com.abhikarta.orchestrator.service.WorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for DAG workflows.
 *
 * POST /workflows          start a workflow from a registered DAG
 * GET  /workflows?userId=  list workflows, newest first
 * GET  /workflows/{id}     workflow state with nodes, events, step logs and pending HITL
 */
@RestController
@RequestMapping("/workflows")
public class WorkflowController {

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    /**
     * Start a workflow. Execution continues in the background; poll GET /workflows/{id}.
     *
     * Example:
     *   curl -X POST http://localhost:8080/workflows \
     *     -H "Content-Type: application/json" \
     *     -d '{"dagId":"echo_pipeline","userId":"alice"}'
     */
    @PostMapping
    public ResponseEntity<WorkflowStatusResponse> start(@RequestBody StartWorkflowRequest req) {
        if (req.dagId() == null || req.dagId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "dagId is required");
        }
        UUID workflowId = workflowService.startWorkflowFromDag(req.dagId(), req.sessionId(), req.userId())
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "DAG not found: " + req.dagId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(status(workflowId));
    }

    @GetMapping
    public List<WorkflowResponse> list(@RequestParam(required = false) String userId) {
        return workflowService.listWorkflows(userId).stream()
                .map(WorkflowResponse::from)
                .toList();
    }

    /** Returns 404 if the workflow ID is not found. */
    @GetMapping("/{id}")
    public WorkflowStatusResponse getWorkflow(@PathVariable UUID id) {
        return status(id);
    }

    private WorkflowStatusResponse status(UUID id) {
        return workflowService.getWorkflowStatus(id)
                .map(WorkflowStatusResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Workflow not found: " + id));
    }
}
