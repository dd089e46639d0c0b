package com.abhikarta.orchestrator.repository;

import com.abhikarta.orchestrator.model.StepLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface StepLogRepository extends JpaRepository<StepLog, UUID> {

    List<StepLog> findByWorkflowIdOrderByExecutedAtAsc(UUID workflowId);
}
