package com.scanops.workflow;

import com.scanops.config.ScanOpsProperties;
import com.scanops.entity.ArtifactType;
import com.scanops.entity.Finding;
import com.scanops.entity.Run;
import com.scanops.entity.RunStatus;
import com.scanops.entity.Severity;
import com.scanops.entity.StepStatus;
import com.scanops.entity.Tool;
import com.scanops.entity.WorkflowPhase;
import com.scanops.entity.WorkflowSession;
import com.scanops.entity.WorkflowStatus;
import com.scanops.entity.WorkflowStep;
import com.scanops.repository.FindingRepository;
import com.scanops.repository.RunAnalysisRepository;
import com.scanops.repository.RunArtifactRepository;
import com.scanops.repository.RunJobRepository;
import com.scanops.repository.RunRepository;
import com.scanops.repository.ToolRepository;
import com.scanops.repository.WorkflowSessionRepository;
import com.scanops.repository.WorkflowStepRepository;
import com.scanops.runs.RunCreateCommand;
import com.scanops.runs.RunPersistenceService;
import com.scanops.runs.RunTransition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional state of workflow sessions, their steps, findings and bound run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowPersistenceService {

    public static final String CANCELLED_MESSAGE = "Workflow cancelled";

    private final WorkflowSessionRepository sessionRepository;
    private final WorkflowStepRepository stepRepository;
    private final FindingRepository findingRepository;
    private final ToolRepository toolRepository;
    private final RunRepository runRepository;
    private final RunArtifactRepository artifactRepository;
    private final RunAnalysisRepository analysisRepository;
    private final RunJobRepository jobRepository;
    private final RunPersistenceService runPersistence;
    private final ScanOpsProperties properties;

    /**
     * Creates the session in CREATED, its six PENDING steps and its PENDING bound run. The bound run
     * is never queued; the workflow driver moves it.
     */
    @Transactional
    public WorkflowView createSession(CreateWorkflowCommand command) {
        Tool tool = workflowTool();
        Map<String, Object> params = new HashMap<>();
        params.put("objective", command.objective().wireName());
        params.put("maxSteps", command.maxSteps());
        Run run = runPersistence.createPending(
                new RunCreateCommand(command.userId(), tool, null, command.target(), params), false);

        String name = StringUtils.hasText(command.name())
                ? command.name().trim()
                : "Security assessment of " + command.target();
        WorkflowSession session = sessionRepository.save(WorkflowSession.builder()
                .userId(command.userId())
                .name(name)
                .target(command.target())
                .objective(command.objective())
                .maxSteps(command.maxSteps())
                .status(WorkflowStatus.CREATED)
                .run(run)
                .build());
        run.setWorkflowSessionId(session.getId());
        runRepository.save(run);

        List<WorkflowStep> steps = new ArrayList<>();
        for (WorkflowPhase phase : WorkflowPhase.values()) {
            steps.add(stepRepository.save(WorkflowStep.builder()
                    .session(session)
                    .phase(phase)
                    .stepNumber(phase.stepNumber())
                    .name(phase.title())
                    .description(phase.description())
                    .status(StepStatus.PENDING)
                    .build()));
        }
        log.info("Workflow session {} created for user {} against {}", session.getId(), command.userId(), command.target());
        return WorkflowView.detailed(session, steps, List.of());
    }

    /**
     * Marks a CREATED session RUNNING together with its bound run.
     *
     * @return the driver context, empty when the session vanished or is no longer CREATED
     */
    @Transactional
    public Optional<DriverContext> markRunning(UUID sessionId) {
        Optional<WorkflowSession> found = sessionRepository.findById(sessionId);
        if (found.isEmpty() || found.get().getStatus() != WorkflowStatus.CREATED) {
            return Optional.empty();
        }
        WorkflowSession session = found.get();
        session.setStatus(WorkflowStatus.RUNNING);
        session.setStartedAt(OffsetDateTime.now());
        session.setCurrentPhase(PhaseTransitions.first());
        sessionRepository.save(session);
        UUID runId = session.getRun().getId();
        runPersistence.transitionIfActive(runId, RunStatus.RUNNING, RunTransition.none());
        return Optional.of(new DriverContext(session.getId(), runId, session.getUserId(), session.getTarget(),
                session.getObjective(), session.getMaxSteps()));
    }

    @Transactional(readOnly = true)
    public int queuePosition(UUID sessionId) {
        WorkflowSession session = requireSession(sessionId);
        return (int) sessionRepository.countByStatusAndCreatedAtBefore(WorkflowStatus.CREATED, session.getCreatedAt()) + 1;
    }

    @Transactional(readOnly = true)
    public Optional<UUID> oldestWaiting() {
        return sessionRepository.findFirstByStatusOrderByCreatedAtAsc(WorkflowStatus.CREATED).map(WorkflowSession::getId);
    }

    @Transactional(readOnly = true)
    public Optional<WorkflowStatus> status(UUID sessionId) {
        return sessionRepository.findById(sessionId).map(WorkflowSession::getStatus);
    }

    @Transactional(readOnly = true)
    public Optional<String> ownerOf(UUID sessionId) {
        return sessionRepository.findById(sessionId).map(WorkflowSession::getUserId);
    }

    /**
     * Moves a step and recomputes the session progress. A RUNNING step also becomes the session's
     * current phase. Steps only move forward: the update is ignored when the session is no longer
     * RUNNING or the step is already closed.
     */
    @Transactional
    public StepUpdate updateStep(UUID sessionId, WorkflowPhase phase, StepStatus status, @Nullable String error) {
        WorkflowSession session = lockSession(sessionId);
        WorkflowStep step = requireStep(sessionId, phase);
        if (session.getStatus() != WorkflowStatus.RUNNING || !step.getStatus().isOpen()
                || (step.getStatus() == StepStatus.RUNNING && status == StepStatus.PENDING)) {
            log.debug("Ignoring {} -> {} for step {} of session {} in status {}",
                    step.getStatus(), status, phase, sessionId, session.getStatus());
            return new StepUpdate(step, session.getProgress(), false);
        }
        applyStepStatus(step, status, error);

        if (status == StepStatus.RUNNING) {
            session.setCurrentPhase(phase);
        }
        int progress = WorkflowView.progressOf(stepRepository.findBySessionIdOrderByStepNumberAsc(sessionId));
        session.setProgress(progress);
        sessionRepository.save(session);
        return new StepUpdate(step, progress, true);
    }

    @Transactional
    public List<Finding> saveFindings(UUID sessionId, List<Finding> findings) {
        WorkflowSession session = sessionRepository.getReferenceById(sessionId);
        List<Finding> saved = new ArrayList<>();
        for (Finding finding : findings) {
            finding.setSession(session);
            saved.add(findingRepository.save(finding));
        }
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Finding> findings(UUID sessionId) {
        return findingRepository.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    /**
     * Aggregates the session findings into the report, stores it on the session and on the bound
     * run (analysis, stdout summary) and attaches the findings to the run.
     */
    @Transactional
    public WorkflowReport writeFinalReport(UUID sessionId, long processingTimeMs) {
        WorkflowSession session = requireSession(sessionId);
        List<Finding> findings = findingRepository.findBySessionIdOrderByCreatedAtAsc(sessionId);
        WorkflowReport report = WorkflowReportBuilder.build(session.getTarget(), findings,
                session.getStartedAt(), OffsetDateTime.now());
        session.setReport(report.document());
        applyStats(session, report.totalVulnerabilities(), report.criticalVulnerabilities(),
                report.highVulnerabilities(), report.riskScore());
        sessionRepository.save(session);

        Run run = session.getRun();
        if (run != null) {
            runPersistence.appendArtifact(run.getId(), ArtifactType.STDOUT, report.stdoutSummary());
            runPersistence.writeArtifact(run.getId(), ArtifactType.ANALYSIS, report.analysisSummary());
            runPersistence.saveAnalysis(run.getId(), truncate(report.analysisSummary(), RunPersistenceService.SUMMARY_LENGTH),
                    report.observations(), String.join("\n", WorkflowReportBuilder.RECOMMENDATIONS),
                    null, 0, processingTimeMs);
            findingRepository.attachSessionFindingsToRun(sessionId, run);
        }
        return report;
    }

    /**
     * Completes a RUNNING session and its bound run.
     *
     * @return false when the session left RUNNING meanwhile, e.g. it was cancelled during the report
     */
    @Transactional
    public boolean complete(UUID sessionId) {
        WorkflowSession session = lockSession(sessionId);
        if (session.getStatus() != WorkflowStatus.RUNNING) {
            return false;
        }
        OffsetDateTime now = OffsetDateTime.now();
        session.setStatus(WorkflowStatus.COMPLETED);
        session.setCompletedAt(now);
        session.setProgress(100);
        sessionRepository.save(session);
        if (session.getRun() != null) {
            long duration = session.getStartedAt() == null ? 0 : Duration.between(session.getStartedAt(), now).toSeconds();
            runPersistence.transitionIfActive(session.getRun().getId(), RunStatus.COMPLETED,
                    RunTransition.completed(0, duration));
        }
        return true;
    }

    /**
     * Fails a session: the running step fails with the same error and the bound run is failed.
     *
     * @return steps that changed, for event emission
     */
    @Transactional
    public List<WorkflowStep> fail(UUID sessionId, String error) {
        WorkflowSession session = lockSession(sessionId);
        if (session.getStatus().isTerminal()) {
            return List.of();
        }
        session.setStatus(WorkflowStatus.FAILED);
        session.setError(error);
        session.setCompletedAt(OffsetDateTime.now());
        sessionRepository.save(session);

        List<WorkflowStep> changed = new ArrayList<>();
        for (WorkflowStep step : stepRepository.findBySessionIdOrderByStepNumberAsc(sessionId)) {
            if (step.getStatus() == StepStatus.RUNNING) {
                applyStepStatus(step, StepStatus.FAILED, error);
                changed.add(step);
            }
        }
        if (session.getRun() != null) {
            runPersistence.transitionIfActive(session.getRun().getId(), RunStatus.FAILED, RunTransition.failed(error));
        }
        return changed;
    }

    /**
     * Cancels a session that has not finished yet. Open steps become SKIPPED.
     *
     * @throws ResponseStatusException NOT_FOUND for an unknown session, CONFLICT when it already finished
     */
    @Transactional
    public CancelResult cancel(UUID sessionId) {
        WorkflowSession session = lockSession(sessionId);
        if (session.getStatus() == WorkflowStatus.CANCELLED) {
            return new CancelResult(CancelOutcome.alreadyCancelled(sessionId), List.of(), false, null);
        }
        if (session.getStatus().isTerminal()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Workflow " + sessionId + " already finished with status " + session.getStatus());
        }
        boolean wasRunning = session.getStatus() == WorkflowStatus.RUNNING;
        session.setStatus(WorkflowStatus.CANCELLED);
        session.setCompletedAt(OffsetDateTime.now());
        session.setError(CANCELLED_MESSAGE);
        sessionRepository.save(session);

        List<WorkflowStep> skipped = new ArrayList<>();
        for (WorkflowStep step : stepRepository.findBySessionIdOrderByStepNumberAsc(sessionId)) {
            if (step.getStatus().isOpen()) {
                step.setStatus(StepStatus.SKIPPED);
                step.setCompletedAt(OffsetDateTime.now());
                skipped.add(stepRepository.save(step));
            }
        }
        UUID cancelledRunId = null;
        if (session.getRun() != null && runPersistence.transitionIfActive(session.getRun().getId(),
                RunStatus.CANCELLED, RunTransition.failed(CANCELLED_MESSAGE)).isPresent()) {
            cancelledRunId = session.getRun().getId();
        }
        return new CancelResult(CancelOutcome.cancelled(sessionId), skipped, wasRunning, cancelledRunId);
    }

    /**
     * Removes the session with its steps and findings and the bound run with everything it owns.
     */
    @Transactional
    public void deleteSessionGraph(UUID sessionId) {
        WorkflowSession session = requireSession(sessionId);
        UUID runId = session.getRun() == null ? null : session.getRun().getId();
        findingRepository.deleteBySessionId(sessionId);
        if (runId != null) {
            findingRepository.deleteByRunId(runId);
        }
        stepRepository.deleteBySessionId(sessionId);
        sessionRepository.deleteSession(sessionId);
        if (runId != null) {
            analysisRepository.deleteByRunId(runId);
            artifactRepository.deleteByRunId(runId);
            jobRepository.deleteByRunId(runId);
            runRepository.deleteRun(runId);
        }
        log.info("Deleted workflow session {} and bound run {}", sessionId, runId);
    }

    @Transactional
    public void deleteFinding(UUID sessionId, UUID findingId) {
        Finding finding = findingRepository.findById(findingId)
                .filter(f -> f.getSession() != null && sessionId.equals(f.getSession().getId()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Finding " + findingId + " not found in workflow " + sessionId));
        findingRepository.delete(finding);
        findingRepository.flush();
        recalculateStats(sessionId);
    }

    @Transactional
    public int deleteToolFindings(UUID sessionId, String tool) {
        requireSession(sessionId);
        int removed = findingRepository.deleteBySessionIdAndTool(sessionId, tool);
        recalculateStats(sessionId);
        return removed;
    }

    @Transactional
    public void recalculateStats(UUID sessionId) {
        WorkflowSession session = requireSession(sessionId);
        List<Finding> findings = findingRepository.findBySessionIdOrderByCreatedAtAsc(sessionId);
        Map<Severity, Integer> counts = WorkflowReportBuilder.countBySeverity(findings);
        applyStats(session, findings.size(), counts.get(Severity.CRITICAL),
                counts.get(Severity.HIGH), WorkflowReportBuilder.riskScore(findings));
        sessionRepository.save(session);
    }

    /**
     * Fails every RUNNING session; used at startup when no driver can still be alive.
     */
    @Transactional
    public List<UUID> failOrphanedSessions(String reason) {
        List<UUID> failed = new ArrayList<>();
        for (WorkflowSession session : sessionRepository.findByStatus(WorkflowStatus.RUNNING)) {
            fail(session.getId(), reason);
            failed.add(session.getId());
        }
        return failed;
    }

    @Transactional(readOnly = true)
    public Optional<WorkflowView> findView(UUID sessionId) {
        return sessionRepository.findById(sessionId).map(session -> WorkflowView.detailed(session,
                stepRepository.findBySessionIdOrderByStepNumberAsc(sessionId),
                findingRepository.findBySessionIdOrderByCreatedAtAsc(sessionId).stream().map(FindingView::from).toList()));
    }

    @Transactional(readOnly = true)
    public Page<WorkflowView> listViews(String userId, @Nullable Collection<WorkflowStatus> statuses, Pageable pageable) {
        Page<WorkflowSession> page = statuses == null || statuses.isEmpty()
                ? sessionRepository.findByUserId(userId, pageable)
                : sessionRepository.findByUserIdAndStatusIn(userId, statuses, pageable);
        return page.map(WorkflowView::summary);
    }

    @Transactional(readOnly = true)
    public Map<WorkflowStatus, Long> counts(String userId) {
        Map<WorkflowStatus, Long> counts = new EnumMap<>(WorkflowStatus.class);
        for (WorkflowStatus status : WorkflowStatus.values()) {
            counts.put(status, 0L);
        }
        sessionRepository.countByStatusForUser(userId).forEach(c -> counts.put(c.getStatus(), c.getTotal()));
        return counts;
    }

    private Tool workflowTool() {
        String slug = properties.getWorkflow().getToolSlug();
        return toolRepository.findBySlug(slug).orElseGet(() -> {
            log.info("Provisioning workflow tool '{}'", slug);
            return toolRepository.save(Tool.builder()
                    .slug(slug)
                    .name("Smart Scan")
                    .enabled(true)
                    .binary(slug)
                    .build());
        });
    }

    private void applyStepStatus(WorkflowStep step, StepStatus status, @Nullable String error) {
        OffsetDateTime now = OffsetDateTime.now();
        step.setStatus(status);
        switch (status) {
            case RUNNING -> step.setStartedAt(now);
            case COMPLETED, SKIPPED -> step.setCompletedAt(now);
            case FAILED, TIMEOUT -> {
                step.setCompletedAt(now);
                step.setError(error);
                step.setErrorImpact(StepErrorAdvisor.impact(step.getPhase(), status));
                step.setErrorSolution(StepErrorAdvisor.solution(status, error));
            }
            default -> {
            }
        }
        stepRepository.save(step);
    }

    private WorkflowStep requireStep(UUID sessionId, WorkflowPhase phase) {
        return stepRepository.findBySessionIdAndStepNumber(sessionId, phase.stepNumber())
                .orElseThrow(() -> new IllegalStateException("Missing step " + phase + " of session " + sessionId));
    }

    private WorkflowSession lockSession(UUID sessionId) {
        return sessionRepository.findForUpdate(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Workflow not found: " + sessionId));
    }

    private WorkflowSession requireSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Workflow not found: " + sessionId));
    }

    private static void applyStats(WorkflowSession session, int total, int critical, int high, int riskScore) {
        session.setTotalVulnerabilities(total);
        session.setCriticalVulnerabilities(critical);
        session.setHighVulnerabilities(high);
        session.setRiskScore(riskScore);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    /**
     * Step after an update, with the session progress it produced.
     *
     * @param applied false when the update was ignored and the step is returned unchanged
     */
    public record StepUpdate(WorkflowStep step, int progress, boolean applied) {
    }

    /**
     * @param cancelledRunId the bound run when this call cancelled it, null when it was already finished
     */
    public record CancelResult(CancelOutcome outcome, List<WorkflowStep> skippedSteps, boolean wasRunning,
                               @Nullable UUID cancelledRunId) {
    }
}
