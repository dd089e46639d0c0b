package com.abhikarta.orchestrator.repository;

import com.abhikarta.orchestrator.model.Workflow;
import com.abhikarta.orchestrator.model.WorkflowState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the workflows table.
 */
public interface WorkflowRepository extends JpaRepository<Workflow, UUID> {

    /**
     * SELECT ... FOR UPDATE on one workflow row.
     *
     * Every state transition goes through this, so a worker and an HTTP
     * request resolving a HITL request never both write the row from a stale
     * read. Must run inside a @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Workflow w WHERE w.id = :id")
    Optional<Workflow> lockById(@Param("id") UUID id);

    /** Used at startup to find workflows orphaned by a restart. */
    List<Workflow> findByState(WorkflowState state);

    List<Workflow> findByUserIdOrderByCreatedAtDesc(String userId);

    List<Workflow> findAllByOrderByCreatedAtDesc();
}
