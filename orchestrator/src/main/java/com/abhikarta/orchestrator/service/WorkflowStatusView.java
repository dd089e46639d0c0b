package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.model.HitlRequest;
import com.abhikarta.orchestrator.model.StepLog;
import com.abhikarta.orchestrator.model.Workflow;
import com.abhikarta.orchestrator.model.WorkflowEvent;
import com.abhikarta.orchestrator.model.WorkflowNode;

import java.util.List;

/** Everything persisted about one workflow, read in one go for status display. */
public record WorkflowStatusView(
        Workflow            workflow,
        List<WorkflowNode>  nodes,
        List<WorkflowEvent> events,
        List<StepLog>       stepLogs,
        List<HitlRequest>   hitlRequests) {

    public List<HitlRequest> pendingHitl() {
        return hitlRequests.stream().filter(HitlRequest::isPending).toList();
    }
}
