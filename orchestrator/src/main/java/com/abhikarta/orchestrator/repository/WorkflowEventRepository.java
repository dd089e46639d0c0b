package com.abhikarta.orchestrator.repository;

import com.abhikarta.orchestrator.model.WorkflowEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WorkflowEventRepository extends JpaRepository<WorkflowEvent, UUID> {

    List<WorkflowEvent> findByWorkflowIdOrderByCreatedAtAsc(UUID workflowId);
}
