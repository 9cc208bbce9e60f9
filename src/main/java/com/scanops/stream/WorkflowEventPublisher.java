package com.scanops.stream;

import com.scanops.entity.Finding;
import com.scanops.entity.WorkflowStep;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.UUID;

import static com.scanops.stream.RunEventPublisher.payload;

/**
 * Typed emitters for the per-session workflow channel.
 */
@Component
public class WorkflowEventPublisher {

    private final EventChannelHub hub;

    public WorkflowEventPublisher(EventChannelHub hub) {
        this.hub = hub;
    }

    public void emitStepUpdate(UUID sessionId, WorkflowStep step) {
        hub.emit(sessionId.toString(), StreamEventType.STEP_UPDATE, payload(
                "stepNumber", step.getStepNumber(),
                "phase", step.getPhase().name(),
                "status", step.getStatus().name(),
                "error", step.getError()));
    }

    public void emitProgress(UUID sessionId, int progress, @Nullable String phase) {
        hub.emit(sessionId.toString(), StreamEventType.PROGRESS, payload("progress", progress, "phase", phase));
    }

    public void emitFindingAdded(UUID sessionId, Finding finding) {
        hub.emit(sessionId.toString(), StreamEventType.FINDING_ADDED, payload(
                "findingId", finding.getId() == null ? null : finding.getId().toString(),
                "severity", finding.getSeverity().name(),
                "title", finding.getTitle(),
                "tool", finding.getTool()));
    }

    public void emitLog(UUID sessionId, String message) {
        hub.emit(sessionId.toString(), StreamEventType.LOG, payload("message", message));
    }

    public void emitCompleted(UUID sessionId, int riskScore) {
        hub.emit(sessionId.toString(), StreamEventType.COMPLETED, payload("riskScore", riskScore));
    }

    public void emitFailed(UUID sessionId, String error) {
        hub.emit(sessionId.toString(), StreamEventType.FAILED, payload("error", error));
    }
}
