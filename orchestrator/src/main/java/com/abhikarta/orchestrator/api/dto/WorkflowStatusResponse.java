package com.abhikarta.orchestrator.api.dto;

import com.abhikarta.orchestrator.service.WorkflowStatusView;

import java.util.List;

/**
 * Response body for GET /workflows/{id}: the workflow plus everything recorded under it.
 */
public record WorkflowStatusResponse(
        WorkflowResponse      workflow,
        String                resultJson,
        List<NodeResponse>    nodes,
        List<EventResponse>   events,
        List<StepLogResponse> stepLogs,
        List<HitlResponse>    pendingHitl
) {
    public static WorkflowStatusResponse from(WorkflowStatusView view) {
        return new WorkflowStatusResponse(
                WorkflowResponse.from(view.workflow()),
                view.workflow().getResultJson(),
                view.nodes().stream().map(NodeResponse::from).toList(),
                view.events().stream().map(EventResponse::from).toList(),
                view.stepLogs().stream().map(StepLogResponse::from).toList(),
                view.pendingHitl().stream().map(HitlResponse::from).toList()
        );
    }
}
