package com.abhikarta.orchestrator.repository;

import com.abhikarta.orchestrator.model.HitlRequest;
import com.abhikarta.orchestrator.model.HitlStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the hitl_requests table.
 */
public interface HitlRequestRepository extends JpaRepository<HitlRequest, UUID> {

    /**
     * Owner of a request, read without loading the entity, so the request
     * itself can be read fresh once the workflow row is locked.
     */
    @Query("SELECT h.workflowId FROM HitlRequest h WHERE h.id = :id")
    Optional<UUID> findWorkflowIdById(@Param("id") UUID id);

    List<HitlRequest> findByStatusOrderByCreatedAtAsc(HitlStatus status);

    List<HitlRequest> findByWorkflowIdAndStatusOrderByCreatedAtAsc(UUID workflowId, HitlStatus status);

    List<HitlRequest> findByWorkflowIdOrderByCreatedAtAsc(UUID workflowId);

    /**
     * Latest request for one checkpoint occurrence. A node can be asked about
     * once per loop pass, so the iteration is part of the key.
     */
    Optional<HitlRequest> findFirstByWorkflowIdAndNodeIdAndIterationOrderByCreatedAtDesc(
            UUID workflowId, String nodeId, int iteration);
}
