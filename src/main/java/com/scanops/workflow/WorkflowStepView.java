package com.scanops.workflow;

import com.scanops.entity.StepStatus;
import com.scanops.entity.WorkflowPhase;
import com.scanops.entity.WorkflowStep;
import org.springframework.lang.Nullable;

import java.time.OffsetDateTime;
import java.util.UUID;

public record WorkflowStepView(
        UUID id,
        int stepNumber,
        WorkflowPhase phase,
        String name,
        String description,
        StepStatus status,
        @Nullable OffsetDateTime startedAt,
        @Nullable OffsetDateTime completedAt,
        @Nullable String error,
        @Nullable String errorImpact,
        @Nullable String errorSolution
) {
    static WorkflowStepView from(WorkflowStep step) {
        return new WorkflowStepView(step.getId(), step.getStepNumber(), step.getPhase(), step.getName(),
                step.getDescription(), step.getStatus(), step.getStartedAt(), step.getCompletedAt(),
                step.getError(), step.getErrorImpact(), step.getErrorSolution());
    }
}
