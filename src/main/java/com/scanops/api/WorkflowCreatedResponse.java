package com.scanops.api;

import com.scanops.workflow.AdmissionOutcome;
import com.scanops.workflow.WorkflowCreation;
import com.scanops.workflow.WorkflowView;

public record WorkflowCreatedResponse(
        WorkflowView session,
        AdmissionOutcome admission,
        String message
) {
    public static WorkflowCreatedResponse from(WorkflowCreation creation) {
        AdmissionOutcome admission = creation.admission();
        String message = admission.started()
                ? "Workflow started"
                : admission.queuePosition() == null
                ? "Workflow created"
                : "Workflow queued at position " + admission.queuePosition();
        return new WorkflowCreatedResponse(creation.session(), admission, message);
    }
}
