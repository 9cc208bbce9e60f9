package com.scanops.runs;

import com.scanops.entity.ArtifactType;
import com.scanops.entity.Run;
import com.scanops.entity.RunAnalysis;
import com.scanops.entity.RunArtifact;
import com.scanops.entity.RunStatus;
import com.scanops.entity.Tool;
import com.scanops.repository.FindingRepository;
import com.scanops.repository.RunAnalysisRepository;
import com.scanops.repository.RunArtifactRepository;
import com.scanops.repository.RunJobRepository;
import com.scanops.repository.RunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional state changes of runs and their artifacts. Every status change locks the run row and
 * checks the transition table, so concurrent stop and completion cannot both win.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunPersistenceService {

    public static final int SUMMARY_LENGTH = 500;

    private final RunRepository runRepository;
    private final RunArtifactRepository artifactRepository;
    private final RunAnalysisRepository analysisRepository;
    private final FindingRepository findingRepository;
    private final RunJobRepository jobRepository;
    private final RunJobQueue jobQueue;

    @Transactional
    public Run createPending(RunCreateCommand command, boolean enqueue) {
        Run run = runRepository.save(Run.builder()
                .userId(command.userId())
                .tool(command.tool())
                .scope(command.scope())
                .target(command.target())
                .params(command.params() == null ? new HashMap<>() : new HashMap<>(command.params()))
                .status(RunStatus.PENDING)
                .build());
        if (enqueue) {
            jobQueue.enqueue(run.getId());
        }
        return run;
    }

    @Transactional(readOnly = true)
    public Optional<Run> find(UUID runId) {
        return runRepository.findById(runId);
    }

    @Transactional(readOnly = true)
    public Optional<RunExecutionContext> loadExecutionContext(UUID runId) {
        return runRepository.findById(runId).map(run -> {
            Tool tool = run.getTool();
            return new RunExecutionContext(run.getId(), run.getUserId(), tool.getSlug(), tool.getName(),
                    tool.getBinary(), tool.getTimeoutSeconds(), run.getTarget(),
                    run.getParams() == null ? new HashMap<>() : new HashMap<>(run.getParams()));
        });
    }

    @Transactional(readOnly = true)
    public Optional<RunView> findView(UUID runId) {
        return runRepository.findById(runId)
                .map(run -> RunView.from(run, artifactRepository.findByRunIdOrderByCreatedAtAsc(runId)));
    }

    /**
     * Pages over runs; a null owner lists every user's runs.
     */
    @Transactional(readOnly = true)
    public Page<RunView> listViews(@Nullable String userId, @Nullable RunStatus status, Pageable pageable) {
        Page<Run> page;
        if (userId == null) {
            page = status == null ? runRepository.findAll(pageable) : runRepository.findByStatus(status, pageable);
        } else {
            page = status == null
                    ? runRepository.findByUserId(userId, pageable)
                    : runRepository.findByUserIdAndStatus(userId, status, pageable);
        }
        return page.map(run -> RunView.from(run, List.of()));
    }

    @Transactional(readOnly = true)
    public boolean isActive(UUID runId) {
        return runRepository.findById(runId).map(run -> run.getStatus().isActive()).orElse(false);
    }

    /**
     * Applies a legal transition or fails.
     *
     * @throws ResponseStatusException NOT_FOUND for an unknown run, CONFLICT for an illegal transition
     */
    @Transactional
    public Run transition(UUID runId, RunStatus next, RunTransition detail) {
        Run run = runRepository.findForUpdate(runId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + runId));
        if (!run.getStatus().canTransitionTo(next)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Run " + runId + " cannot move from " + run.getStatus() + " to " + next);
        }
        return apply(run, next, detail);
    }

    /**
     * Applies the transition when it is legal; otherwise leaves the run untouched. Used by completion
     * paths that may race with a stop.
     */
    @Transactional
    public Optional<Run> transitionIfActive(UUID runId, RunStatus next, RunTransition detail) {
        Optional<Run> locked = runRepository.findForUpdate(runId);
        if (locked.isEmpty()) {
            return Optional.empty();
        }
        Run run = locked.get();
        if (!run.getStatus().canTransitionTo(next)) {
            log.debug("Ignoring {} -> {} for run {}", run.getStatus(), next, runId);
            return Optional.empty();
        }
        return Optional.of(apply(run, next, detail));
    }

    /**
     * Moves an active run to CANCELLED and pulls its job from the queue if it has not started.
     *
     * @throws ResponseStatusException CONFLICT when the run is already terminal
     */
    @Transactional
    public Run cancel(UUID runId, String reason) {
        Run run = transition(runId, RunStatus.CANCELLED, RunTransition.failed(reason));
        if (jobQueue.removeQueued(runId)) {
            log.info("Removed queued job of cancelled run {}", runId);
        }
        return run;
    }

    private Run apply(Run run, RunStatus next, RunTransition detail) {
        OffsetDateTime now = OffsetDateTime.now();
        run.setStatus(next);
        if (next == RunStatus.RUNNING) {
            run.setStartedAt(now);
        }
        if (next.isTerminal()) {
            run.setCompletedAt(now);
            if (detail.durationSeconds() != null) {
                run.setDurationSeconds(detail.durationSeconds());
            } else if (run.getStartedAt() != null) {
                run.setDurationSeconds(Duration.between(run.getStartedAt(), now).toSeconds());
            }
        }
        if (detail.exitCode() != null) {
            run.setExitCode(detail.exitCode());
        }
        if (detail.error() != null) {
            run.setError(detail.error());
        }
        return runRepository.save(run);
    }

    /**
     * Replaces the content of the run's artifact of the given type, creating it on first write.
     */
    @Transactional
    public RunArtifact writeArtifact(UUID runId, ArtifactType type, String content) {
        RunArtifact artifact = artifactRepository.findByRunIdAndType(runId, type)
                .orElseGet(() -> newArtifact(runId, type));
        artifact.setContent(content);
        artifact.setSize(utf8Size(content));
        return artifactRepository.save(artifact);
    }

    @Transactional
    public RunArtifact appendArtifact(UUID runId, ArtifactType type, String chunk) {
        RunArtifact artifact = artifactRepository.findByRunIdAndType(runId, type)
                .orElseGet(() -> newArtifact(runId, type));
        String content = (artifact.getContent() == null ? "" : artifact.getContent()) + chunk;
        artifact.setContent(content);
        artifact.setSize(utf8Size(content));
        return artifactRepository.save(artifact);
    }

    @Transactional
    public RunAnalysis saveAnalysis(UUID runId, String summary, @Nullable String observations,
                                    @Nullable String recommendations, @Nullable String model,
                                    long tokensUsed, long processingTimeMs) {
        RunAnalysis analysis = analysisRepository.findByRunId(runId)
                .orElseGet(() -> RunAnalysis.builder().run(runRepository.getReferenceById(runId)).build());
        analysis.setSummary(summary);
        analysis.setObservations(observations);
        analysis.setRecommendations(recommendations);
        analysis.setModelUsed(model);
        analysis.setTokensUsed(tokensUsed);
        analysis.setProcessingTimeMs(processingTimeMs);
        return analysisRepository.save(analysis);
    }

    /**
     * Removes a standalone run with its analysis, artifacts, findings and queue rows.
     */
    @Transactional
    public void deleteRunGraph(UUID runId) {
        analysisRepository.deleteByRunId(runId);
        artifactRepository.deleteByRunId(runId);
        findingRepository.deleteByRunId(runId);
        jobRepository.deleteByRunId(runId);
        runRepository.deleteRun(runId);
        log.info("Deleted run {} and its dependent rows", runId);
    }

    private RunArtifact newArtifact(UUID runId, ArtifactType type) {
        Run run = runRepository.findById(runId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + runId));
        return RunArtifact.builder()
                .run(run)
                .type(type)
                .mimeType(type.mimeType())
                .build();
    }

    static long utf8Size(@Nullable String content) {
        return content == null ? 0L : content.getBytes(StandardCharsets.UTF_8).length;
    }
}
