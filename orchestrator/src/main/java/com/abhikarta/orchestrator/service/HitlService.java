package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.model.HitlRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves human-in-the-loop requests for both DAG and plan workflows.
 *
 * Approval commits first, then resubmits the workflow so a worker picks up
 * from the persisted node rows. Rejection is terminal and needs no worker.
 */
@Service
public class HitlService {

    private final WorkflowStore      store;
    private final WorkflowWorkerPool workers;

    public HitlService(WorkflowStore store, WorkflowWorkerPool workers) {
        this.store   = store;
        this.workers = workers;
    }

    public List<HitlRequest> getPendingRequests(Optional<UUID> workflowId) {
        return store.pendingHitl(workflowId.orElse(null));
    }

    public Optional<HitlRequest> getRequest(UUID hitlId) {
        return store.findHitl(hitlId);
    }

    /** @return false if the request is unknown or already resolved */
    public boolean approveHitl(UUID hitlId, String userId, String response) {
        Optional<UUID> workflowId = store.approveHitl(hitlId, userId, response);
        workflowId.ifPresent(workers::submit);
        return workflowId.isPresent();
    }

    /** @return false if the request is unknown or already resolved */
    public boolean rejectHitl(UUID hitlId, String userId, String reason) {
        return store.rejectHitl(hitlId, userId, reason).isPresent();
    }
}
