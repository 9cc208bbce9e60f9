package com.scanops.workflow;

public record WorkflowCreation(WorkflowView session, AdmissionOutcome admission) {
}
