package com.abhikarta.orchestrator.repository;

import com.abhikarta.orchestrator.model.WorkflowNode;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowNodeRepository extends JpaRepository<WorkflowNode, UUID> {

    /** All nodes of a workflow in graph insertion order. */
    List<WorkflowNode> findByWorkflowIdOrderByPositionAsc(UUID workflowId);

    Optional<WorkflowNode> findByWorkflowIdAndNodeId(UUID workflowId, String nodeId);
}
