package com.scanops.workflow;

import com.scanops.entity.StepStatus;
import com.scanops.entity.WorkflowObjective;
import com.scanops.entity.WorkflowPhase;
import com.scanops.entity.WorkflowSession;
import com.scanops.entity.WorkflowStatus;
import com.scanops.entity.WorkflowStep;
import org.springframework.lang.Nullable;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Detached snapshot of a session. {@code progress} is derived from the steps when they are loaded.
 */
public record WorkflowView(
        UUID id,
        String userId,
        String name,
        String target,
        WorkflowObjective objective,
        int maxSteps,
        WorkflowStatus status,
        @Nullable WorkflowPhase currentPhase,
        int progress,
        int riskScore,
        int totalVulnerabilities,
        int criticalVulnerabilities,
        int highVulnerabilities,
        @Nullable Map<String, Object> report,
        @Nullable String error,
        @Nullable UUID runId,
        OffsetDateTime createdAt,
        @Nullable OffsetDateTime startedAt,
        @Nullable OffsetDateTime completedAt,
        List<WorkflowStepView> steps,
        List<FindingView> findings
) {

    static WorkflowView summary(WorkflowSession session) {
        return of(session, List.of(), List.of(), session.getProgress());
    }

    static WorkflowView detailed(WorkflowSession session, List<WorkflowStep> steps, List<FindingView> findings) {
        return of(session, steps.stream().map(WorkflowStepView::from).toList(), findings, progressOf(steps));
    }

    /**
     * Completed steps over all steps, as a whole percentage.
     */
    static int progressOf(List<WorkflowStep> steps) {
        if (steps.isEmpty()) {
            return 0;
        }
        long completed = steps.stream().filter(s -> s.getStatus() == StepStatus.COMPLETED).count();
        return (int) (completed * 100 / steps.size());
    }

    private static WorkflowView of(WorkflowSession session, List<WorkflowStepView> steps,
                                   List<FindingView> findings, int progress) {
        return new WorkflowView(session.getId(), session.getUserId(), session.getName(), session.getTarget(),
                session.getObjective(), session.getMaxSteps(), session.getStatus(), session.getCurrentPhase(),
                progress, session.getRiskScore(), session.getTotalVulnerabilities(),
                session.getCriticalVulnerabilities(), session.getHighVulnerabilities(), session.getReport(),
                session.getError(), session.getRun() == null ? null : session.getRun().getId(),
                session.getCreatedAt(), session.getStartedAt(), session.getCompletedAt(), steps, findings);
    }
}
