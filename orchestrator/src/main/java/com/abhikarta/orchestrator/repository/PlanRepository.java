package com.abhikarta.orchestrator.repository;

import com.abhikarta.orchestrator.model.Plan;
import com.abhikarta.orchestrator.model.PlanStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PlanRepository extends JpaRepository<Plan, UUID> {

    /** Row lock for approve/reject: a plan leaves PENDING_APPROVAL exactly once. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Plan p WHERE p.id = :id")
    Optional<Plan> lockById(@Param("id") UUID id);

    List<Plan> findByUserIdOrderByCreatedAtDesc(String userId);

    List<Plan> findByUserIdAndStatusOrderByCreatedAtDesc(String userId, PlanStatus status);

    List<Plan> findByStatusOrderByCreatedAtDesc(PlanStatus status);

    List<Plan> findAllByOrderByCreatedAtDesc();

    Optional<Plan> findByWorkflowId(UUID workflowId);
}
