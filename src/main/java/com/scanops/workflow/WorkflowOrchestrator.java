package com.scanops.workflow;

import com.scanops.audit.AuditLogService;
import com.scanops.config.ScanOpsProperties;
import com.scanops.entity.ArtifactType;
import com.scanops.entity.Finding;
import com.scanops.entity.StepStatus;
import com.scanops.entity.WorkflowPhase;
import com.scanops.entity.WorkflowStatus;
import com.scanops.entity.WorkflowStep;
import com.scanops.execution.BackendResetResult;
import com.scanops.execution.ExecutionBackendClient;
import com.scanops.execution.ExecutionListener;
import com.scanops.execution.ScanMetricsService;
import com.scanops.execution.ScanPromptService;
import com.scanops.execution.ToolExecutionRequest;
import com.scanops.execution.ToolExecutionResult;
import com.scanops.execution.ToolExecutionTimeoutException;
import com.scanops.execution.ToolOrchestrationService;
import com.scanops.runs.BoundRunCancelledEvent;
import com.scanops.runs.OutputAccumulator;
import com.scanops.runs.RunPersistenceService;
import com.scanops.scope.Caller;
import com.scanops.stream.RunEventPublisher;
import com.scanops.stream.WorkflowEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs workflow sessions through the six phases, one session at a time. Sessions that cannot claim
 * the slot wait in CREATED and are started in creation order whenever the running one finishes.
 */
@Service
@Slf4j
public class WorkflowOrchestrator {

    public static final int DEFAULT_LIST_LIMIT = 10;
    public static final int MAX_LIST_LIMIT = 100;
    static final String RESTART_ERROR = "Service restarted while workflow was running";
    private static final int MAX_DRAIN_ATTEMPTS = 50;

    private final WorkflowPersistenceService persistence;
    private final WorkflowAdmissionControl admissionControl;
    private final ToolOrchestrationService toolOrchestrationService;
    private final ScanPromptService promptService;
    private final RunPersistenceService runPersistence;
    private final RunEventPublisher runEvents;
    private final WorkflowEventPublisher workflowEvents;
    private final ExecutionBackendClient backendClient;
    private final ScanMetricsService metricsService;
    private final AuditLogService auditLogService;
    private final ScanOpsProperties properties;
    private final ExecutorService scanExecutor;
    private final Clock clock;

    public WorkflowOrchestrator(WorkflowPersistenceService persistence,
                                WorkflowAdmissionControl admissionControl,
                                ToolOrchestrationService toolOrchestrationService,
                                ScanPromptService promptService,
                                RunPersistenceService runPersistence,
                                RunEventPublisher runEvents,
                                WorkflowEventPublisher workflowEvents,
                                ExecutionBackendClient backendClient,
                                ScanMetricsService metricsService,
                                AuditLogService auditLogService,
                                ScanOpsProperties properties,
                                @Qualifier("scanExecutor") ExecutorService scanExecutor,
                                Clock clock) {
        this.persistence = persistence;
        this.admissionControl = admissionControl;
        this.toolOrchestrationService = toolOrchestrationService;
        this.promptService = promptService;
        this.runPersistence = runPersistence;
        this.runEvents = runEvents;
        this.workflowEvents = workflowEvents;
        this.backendClient = backendClient;
        this.metricsService = metricsService;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.scanExecutor = scanExecutor;
        this.clock = clock;
    }

    public WorkflowCreation create(CreateWorkflowCommand command) {
        WorkflowView created = persistence.createSession(command);
        auditLogService.record(command.userId(), "workflow.create", AuditLogService.RESOURCE_WORKFLOW,
                created.id().toString(), command.objective().wireName() + " -> " + command.target());
        AdmissionOutcome admission = start(created.id());
        WorkflowView current = persistence.findView(created.id()).orElse(created);
        return new WorkflowCreation(current, admission);
    }

    /**
     * Starts the session if the workflow slot is free, otherwise leaves it waiting.
     */
    public AdmissionOutcome start(UUID sessionId) {
        if (!admissionControl.tryClaim(sessionId)) {
            int position = persistence.queuePosition(sessionId);
            log.info("Workflow session {} queued at position {}", sessionId, position);
            workflowEvents.emitLog(sessionId, "Workflow queued at position " + position
                    + "; another workflow is running");
            return AdmissionOutcome.queued(position);
        }
        Optional<DriverContext> context = persistence.markRunning(sessionId);
        if (context.isEmpty()) {
            log.warn("Workflow session {} could not be started; releasing the slot", sessionId);
            admissionControl.release(sessionId);
            return new AdmissionOutcome(false, null);
        }
        DriverContext ctx = context.get();
        resetBackend(sessionId);
        runEvents.emitInit(ctx.runId(), properties.getWorkflow().getToolSlug(), ctx.target());
        workflowEvents.emitLog(sessionId, "Workflow started against " + ctx.target());
        try {
            scanExecutor.execute(() -> drive(ctx));
        } catch (RejectedExecutionException ex) {
            log.error("Scan executor rejected workflow session {}", sessionId, ex);
            failSession(ctx, "Workflow could not be scheduled: " + ex.getMessage());
            return new AdmissionOutcome(false, null);
        }
        log.info("Workflow session {} started", sessionId);
        return AdmissionOutcome.startedNow();
    }

    /**
     * Starts the oldest waiting session, if any. Called whenever a session finishes.
     */
    public void drainNext() {
        for (int attempt = 0; attempt < MAX_DRAIN_ATTEMPTS; attempt++) {
            Optional<UUID> next = persistence.oldestWaiting();
            if (next.isEmpty()) {
                return;
            }
            AdmissionOutcome outcome = start(next.get());
            if (outcome.started() || outcome.queuePosition() != null) {
                return;
            }
        }
    }

    void drive(DriverContext ctx) {
        UUID sessionId = ctx.sessionId();
        long startedMs = clock.millis();
        OutputAccumulator accumulator = new OutputAccumulator(ctx.runId(), clock,
                properties.getWorker().getOutputFlushInterval(),
                properties.getWorker().getOutputFlushBytes(),
                content -> runPersistence.writeArtifact(ctx.runId(), ArtifactType.STDOUT, content));
        try {
            Optional<WorkflowPhase> phase = Optional.of(PhaseTransitions.first());
            int riskScore = 0;
            while (phase.isPresent()) {
                if (!stillRunning(sessionId)) {
                    log.info("Workflow session {} left RUNNING; driver stops before {}", sessionId, phase.get());
                    accumulator.flush();
                    return;
                }
                WorkflowPhase current = phase.get();
                if (current.aiDriven()) {
                    boolean succeeded = runPhase(ctx, current, accumulator);
                    if (!succeeded && properties.getWorkflow().isAbortOnPhaseFailure()) {
                        accumulator.flush();
                        failSession(ctx, "Phase " + current.title() + " failed; remaining phases aborted");
                        return;
                    }
                } else {
                    accumulator.flush();
                    riskScore = runFinalReport(ctx, current, clock.millis() - startedMs);
                }
                phase = PhaseTransitions.next(current);
            }
            completeSession(ctx, riskScore, clock.millis() - startedMs);
        } catch (RuntimeException ex) {
            accumulator.flush();
            String message = StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Workflow session {} failed", sessionId, ex);
            failSession(ctx, message);
        }
    }

    /**
     * Runs one AI phase. Failures are contained: they become a finding and a failed step.
     *
     * @return whether the phase succeeded
     */
    boolean runPhase(DriverContext ctx, WorkflowPhase phase, OutputAccumulator accumulator) {
        UUID sessionId = ctx.sessionId();
        publishStep(sessionId, persistence.updateStep(sessionId, phase, StepStatus.RUNNING, null), phase);
        accumulator.append("\n[Phase " + phase.stepNumber() + "] " + phase.title() + "\n");
        try {
            List<Finding> previous = phase == WorkflowPhase.EXPLOITATION_CHAIN ? persistence.findings(sessionId) : List.of();
            ToolExecutionRequest request = new ToolExecutionRequest(
                    phase.name().toLowerCase(Locale.ROOT),
                    ctx.target(),
                    promptService.phaseTask(phase, ctx.target(), ctx.objective(), previous),
                    ctx.objective().wireName(),
                    Math.min(phase.maxToolCalls(), ctx.maxSteps()),
                    properties.getWorker().getDefaultToolTimeout(),
                    Map.of("phase", phase.name()),
                    List.of());
            ToolExecutionResult result = toolOrchestrationService.execute(request, listenerFor(ctx, accumulator));
            accumulator.flush();
            if (!stillRunning(sessionId)) {
                log.info("Discarding {} result of session {}: no longer running", phase, sessionId);
                return true;
            }
            for (Finding finding : persistence.saveFindings(sessionId,
                    FindingSynthesizer.fromPhase(phase, ctx.target(), result))) {
                workflowEvents.emitFindingAdded(sessionId, finding);
            }
            publishStep(sessionId, persistence.updateStep(sessionId, phase, StepStatus.COMPLETED, null), phase);
            return true;
        } catch (ToolExecutionTimeoutException ex) {
            contain(ctx, phase, StepStatus.TIMEOUT, ex.getMessage(), accumulator);
            return false;
        } catch (RuntimeException ex) {
            String message = StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
            log.warn("Phase {} of session {} failed: {}", phase, sessionId, message);
            contain(ctx, phase, StepStatus.FAILED, message, accumulator);
            return false;
        }
    }

    private void contain(DriverContext ctx, WorkflowPhase phase, StepStatus status, String error,
                         OutputAccumulator accumulator) {
        UUID sessionId = ctx.sessionId();
        accumulator.append("[Phase " + phase.stepNumber() + "] " + status + ": " + error + "\n");
        accumulator.flush();
        if (!stillRunning(sessionId)) {
            return;
        }
        Finding failure = FindingSynthesizer.fromFailure(phase, ctx.target(), error,
                StepErrorAdvisor.solution(status, error));
        persistence.saveFindings(sessionId, List.of(failure)).forEach(f -> workflowEvents.emitFindingAdded(sessionId, f));
        publishStep(sessionId, persistence.updateStep(sessionId, phase, status, error), phase);
        workflowEvents.emitLog(sessionId, phase.title() + " " + status.name().toLowerCase(Locale.ROOT) + ": " + error);
    }

    private int runFinalReport(DriverContext ctx, WorkflowPhase phase, long elapsedMs) {
        UUID sessionId = ctx.sessionId();
        publishStep(sessionId, persistence.updateStep(sessionId, phase, StepStatus.RUNNING, null), phase);
        WorkflowReport report = persistence.writeFinalReport(sessionId, elapsedMs);
        runEvents.emitOutput(ctx.runId(), report.stdoutSummary());
        publishStep(sessionId, persistence.updateStep(sessionId, phase, StepStatus.COMPLETED, null), phase);
        return report.riskScore();
    }

    private void completeSession(DriverContext ctx, int riskScore, long elapsedMs) {
        if (!persistence.complete(ctx.sessionId())) {
            log.info("Workflow session {} was not completed: no longer running", ctx.sessionId());
            return;
        }
        workflowEvents.emitProgress(ctx.sessionId(), 100, null);
        workflowEvents.emitCompleted(ctx.sessionId(), riskScore);
        runEvents.emitCompleted(ctx.runId(), 0, elapsedMs / 1000);
        metricsService.recordWorkflowFinished(WorkflowStatus.COMPLETED.name());
        log.info("Workflow session {} completed with risk score {}", ctx.sessionId(), riskScore);
        finish(ctx.sessionId());
    }

    private void failSession(DriverContext ctx, String error) {
        try {
            for (WorkflowStep step : persistence.fail(ctx.sessionId(), error)) {
                workflowEvents.emitStepUpdate(ctx.sessionId(), step);
            }
            workflowEvents.emitFailed(ctx.sessionId(), error);
            runEvents.emitFailed(ctx.runId(), error);
            metricsService.recordWorkflowFinished(WorkflowStatus.FAILED.name());
        } catch (RuntimeException ex) {
            log.error("Could not record failure of workflow session {}", ctx.sessionId(), ex);
        } finally {
            finish(ctx.sessionId());
        }
    }

    private void finish(UUID sessionId) {
        if (admissionControl.release(sessionId)) {
            log.debug("Workflow slot released by session {}", sessionId);
        }
        drainNext();
    }

    public CancelOutcome cancel(UUID sessionId, Caller caller) {
        requireAccess(sessionId, caller);
        CancelOutcome outcome = cancelSession(sessionId);
        auditLogService.record(caller.userId(), "workflow.cancel", AuditLogService.RESOURCE_WORKFLOW,
                sessionId.toString(), outcome.message());
        return outcome;
    }

    /**
     * Stopping the bound run of a session stops the session too.
     */
    @EventListener
    public void onBoundRunCancelled(BoundRunCancelledEvent event) {
        try {
            cancelSession(event.sessionId());
        } catch (ResponseStatusException ex) {
            log.debug("Session {} of stopped run {} not cancelled: {}", event.sessionId(), event.runId(), ex.getReason());
        }
    }

    CancelOutcome cancelSession(UUID sessionId) {
        WorkflowPersistenceService.CancelResult result = persistence.cancel(sessionId);
        if (result.outcome().alreadyCancelled()) {
            return result.outcome();
        }
        for (WorkflowStep step : result.skippedSteps()) {
            workflowEvents.emitStepUpdate(sessionId, step);
        }
        workflowEvents.emitFailed(sessionId, WorkflowPersistenceService.CANCELLED_MESSAGE);
        if (result.cancelledRunId() != null) {
            runEvents.emitFailed(result.cancelledRunId(), WorkflowPersistenceService.CANCELLED_MESSAGE);
        }
        metricsService.recordWorkflowFinished(WorkflowStatus.CANCELLED.name());
        resetBackend(sessionId);
        log.info("Workflow session {} cancelled", sessionId);
        finish(sessionId);
        return result.outcome();
    }

    public void delete(UUID sessionId, Caller caller) {
        requireAccess(sessionId, caller);
        WorkflowStatus status = persistence.status(sessionId).orElse(WorkflowStatus.CANCELLED);
        if (status == WorkflowStatus.CREATED || status == WorkflowStatus.RUNNING || status == WorkflowStatus.PAUSED) {
            cancelSession(sessionId);
        }
        persistence.deleteSessionGraph(sessionId);
        auditLogService.record(caller.userId(), "workflow.delete", AuditLogService.RESOURCE_WORKFLOW,
                sessionId.toString(), null);
    }

    public WorkflowView getStatus(UUID sessionId, Caller caller) {
        WorkflowView view = persistence.findView(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Workflow not found: " + sessionId));
        if (!caller.canAccess(view.userId())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Not allowed to access workflow " + sessionId);
        }
        return view;
    }

    /**
     * Lists the caller's sessions, newest first. Filtering by FAILED also returns TIMEOUT sessions.
     */
    public Page<WorkflowView> list(Caller caller, @Nullable WorkflowStatus status,
                                   @Nullable Integer limit, @Nullable Integer offset) {
        int pageSize = limit == null ? DEFAULT_LIST_LIMIT : limit;
        int skip = offset == null ? 0 : offset;
        if (pageSize < 1 || pageSize > MAX_LIST_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        if (skip < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "offset must not be negative");
        }
        Set<WorkflowStatus> statuses = status == null ? null
                : status == WorkflowStatus.FAILED ? EnumSet.of(WorkflowStatus.FAILED, WorkflowStatus.TIMEOUT)
                : EnumSet.of(status);
        return persistence.listViews(caller.userId(), statuses,
                PageRequest.of(skip / pageSize, pageSize, Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    public Map<WorkflowStatus, Long> counts(Caller caller) {
        return persistence.counts(caller.userId());
    }

    public void deleteFinding(UUID sessionId, UUID findingId, Caller caller) {
        requireAccess(sessionId, caller);
        persistence.deleteFinding(sessionId, findingId);
    }

    public int deleteToolFindings(UUID sessionId, String tool, Caller caller) {
        requireAccess(sessionId, caller);
        return persistence.deleteToolFindings(sessionId, tool);
    }

    /**
     * No driver survives a restart: sessions left RUNNING are failed, the slot is freed and the
     * backlog resumes.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverAndDrain() {
        List<UUID> orphaned = persistence.failOrphanedSessions(RESTART_ERROR);
        orphaned.forEach(admissionControl::release);
        admissionControl.holder().ifPresent(holder -> {
            log.warn("Releasing stale workflow slot held by session {}", holder);
            admissionControl.release(holder);
        });
        if (!orphaned.isEmpty()) {
            log.warn("Failed {} workflow session(s) left running by a previous process", orphaned.size());
        }
        drainNext();
    }

    private void requireAccess(UUID sessionId, Caller caller) {
        String owner = persistence.ownerOf(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Workflow not found: " + sessionId));
        if (!caller.canAccess(owner)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Not allowed to access workflow " + sessionId);
        }
    }

    private boolean stillRunning(UUID sessionId) {
        return persistence.status(sessionId).map(s -> s == WorkflowStatus.RUNNING).orElse(false);
    }

    private void publishStep(UUID sessionId, WorkflowPersistenceService.StepUpdate update, WorkflowPhase phase) {
        if (!update.applied()) {
            return;
        }
        workflowEvents.emitStepUpdate(sessionId, update.step());
        workflowEvents.emitProgress(sessionId, update.progress(), phase.name());
    }

    private void resetBackend(UUID sessionId) {
        BackendResetResult reset = backendClient.reset();
        if (!reset.success()) {
            log.warn("Backend reset for workflow session {} failed: {}", sessionId, reset.message());
        }
    }

    private ExecutionListener listenerFor(DriverContext ctx, OutputAccumulator accumulator) {
        return new ExecutionListener() {
            @Override
            public void onOutput(String chunk) {
                accumulator.append(chunk);
                runEvents.emitOutput(ctx.runId(), chunk);
            }

            @Override
            public void onToolStart(String toolName, int toolIndex, int totalTools) {
                runEvents.emitToolStart(ctx.runId(), toolName, toolIndex, totalTools);
                workflowEvents.emitLog(ctx.sessionId(), "Running " + toolName);
            }

            @Override
            public void onToolComplete(String toolName, long durationMs) {
                runEvents.emitToolComplete(ctx.runId(), toolName, durationMs);
            }

            @Override
            public void onProgress(int progress, String phase) {
                runEvents.emitProgress(ctx.runId(), progress, phase);
            }
        };
    }
}
