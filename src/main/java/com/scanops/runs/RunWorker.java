package com.scanops.runs;

import com.scanops.config.ScanOpsProperties;
import com.scanops.entity.ArtifactType;
import com.scanops.entity.Run;
import com.scanops.entity.RunJob;
import com.scanops.entity.RunJobStatus;
import com.scanops.entity.RunStatus;
import com.scanops.execution.ExecutionListener;
import com.scanops.execution.JsonProcessingService;
import com.scanops.execution.ScanMetricsService;
import com.scanops.execution.ScanPromptService;
import com.scanops.execution.ToolExecutionRequest;
import com.scanops.execution.ToolExecutionResult;
import com.scanops.execution.ToolExecutionTimeoutException;
import com.scanops.execution.ToolOrchestrationService;
import com.scanops.entity.Tool;
import com.scanops.stream.RunEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * The single consumer of the run queue. Jobs run one at a time on the scan executor because the
 * backend keeps per-scan state that cannot be shared. Jobs are never retried.
 */
@Component
@Slf4j
public class RunWorker {

    static final int DEFAULT_MAX_TOOL_CALLS = 5;

    private final RunJobQueue jobQueue;
    private final RunPersistenceService persistence;
    private final ToolOrchestrationService toolOrchestrationService;
    private final ScanPromptService promptService;
    private final RunEventPublisher runEvents;
    private final JsonProcessingService jsonProcessingService;
    private final ScanMetricsService metricsService;
    private final ScanOpsProperties properties;
    private final ExecutorService scanExecutor;
    private final Clock clock;

    public RunWorker(RunJobQueue jobQueue,
                     RunPersistenceService persistence,
                     ToolOrchestrationService toolOrchestrationService,
                     ScanPromptService promptService,
                     RunEventPublisher runEvents,
                     JsonProcessingService jsonProcessingService,
                     ScanMetricsService metricsService,
                     ScanOpsProperties properties,
                     @Qualifier("scanExecutor") ExecutorService scanExecutor,
                     Clock clock) {
        this.jobQueue = jobQueue;
        this.persistence = persistence;
        this.toolOrchestrationService = toolOrchestrationService;
        this.promptService = promptService;
        this.runEvents = runEvents;
        this.jsonProcessingService = jsonProcessingService;
        this.metricsService = metricsService;
        this.properties = properties;
        this.scanExecutor = scanExecutor;
        this.clock = clock;
    }

    /**
     * Schedules a drain pass. Safe to call any number of times.
     */
    public void signal() {
        try {
            scanExecutor.execute(this::drain);
        } catch (RejectedExecutionException ex) {
            log.warn("Scan executor rejected a drain pass: {}", ex.getMessage());
        }
    }

    /**
     * Jobs left ACTIVE by a previous process are resolved before the queue is drained again.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverAndDrain() {
        List<RunJob> stale = jobQueue.activeJobs();
        for (RunJob job : stale) {
            Optional<Run> run = persistence.find(job.getRunId());
            if (run.isPresent() && run.get().getStatus() == RunStatus.PENDING) {
                log.info("Re-queueing job {} of run {} that never started", job.getId(), job.getRunId());
                jobQueue.requeue(job.getId());
                continue;
            }
            String error = "Worker restarted while run was active";
            persistence.transitionIfActive(job.getRunId(), RunStatus.FAILED, RunTransition.failed(error))
                    .ifPresent(failed -> runEvents.emitFailed(failed.getId(), error));
            jobQueue.finish(job.getId(), RunJobStatus.FAILED, error);
        }
        signal();
    }

    void drain() {
        Optional<RunJob> next;
        while ((next = jobQueue.claimNext()).isPresent()) {
            RunJob job = next.get();
            try {
                process(job);
            } catch (RuntimeException ex) {
                log.error("Unexpected failure while processing job {} of run {}", job.getId(), job.getRunId(), ex);
                jobQueue.finish(job.getId(), RunJobStatus.FAILED, ex.getMessage());
            }
        }
    }

    void process(RunJob job) {
        UUID runId = job.getRunId();
        Optional<RunExecutionContext> loaded = persistence.loadExecutionContext(runId);
        if (loaded.isEmpty()) {
            jobQueue.finish(job.getId(), RunJobStatus.FAILED, "Run not found");
            return;
        }
        RunExecutionContext context = loaded.get();
        if (persistence.transitionIfActive(runId, RunStatus.RUNNING, RunTransition.none()).isEmpty()) {
            log.info("Skipping job {}: run {} is no longer pending", job.getId(), runId);
            jobQueue.finish(job.getId(), RunJobStatus.DONE, "Skipped: run no longer pending");
            return;
        }
        runEvents.emitInit(runId, context.toolSlug(), context.target());
        log.info("Run {} started: tool={}, target={}", runId, context.toolSlug(), context.target());

        OutputAccumulator accumulator = new OutputAccumulator(runId, clock,
                properties.getWorker().getOutputFlushInterval(),
                properties.getWorker().getOutputFlushBytes(),
                content -> persistence.writeArtifact(runId, ArtifactType.STDOUT, content));
        long startedMs = clock.millis();
        try {
            ToolExecutionResult result = toolOrchestrationService.execute(buildRequest(context),
                    listenerFor(runId, accumulator));
            complete(job, runId, result, accumulator, clock.millis() - startedMs);
        } catch (ToolExecutionTimeoutException ex) {
            accumulator.flush();
            terminate(job, runId, RunStatus.TIMEOUT, ex.getMessage());
        } catch (RuntimeException ex) {
            accumulator.flush();
            String message = StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
            log.warn("Run {} failed: {}", runId, message);
            terminate(job, runId, RunStatus.FAILED, message);
        }
    }

    private void complete(RunJob job, UUID runId, ToolExecutionResult result,
                          OutputAccumulator accumulator, long processingMs) {
        if (!persistence.isActive(runId)) {
            log.info("Run {} was stopped while executing; discarding its result", runId);
            jobQueue.finish(job.getId(), RunJobStatus.DONE, "Run stopped during execution");
            return;
        }
        int exitCode = result.anyInvocationFailed() ? 1 : 0;
        long durationSeconds = Math.max(0, processingMs / 1000);
        Optional<Run> completed = persistence.transitionIfActive(runId, RunStatus.COMPLETED,
                RunTransition.completed(exitCode, durationSeconds));
        if (completed.isEmpty()) {
            log.info("Run {} was stopped before completion; discarding its result", runId);
            jobQueue.finish(job.getId(), RunJobStatus.DONE, "Run stopped during execution");
            return;
        }

        String stdout = StringUtils.hasText(result.stdout()) ? result.stdout() : accumulator.content();
        if (StringUtils.hasText(stdout)) {
            persistence.writeArtifact(runId, ArtifactType.STDOUT, stdout);
        }
        if (StringUtils.hasText(result.stderr())) {
            persistence.writeArtifact(runId, ArtifactType.STDERR, result.stderr());
        }
        if (StringUtils.hasText(result.analysis())) {
            persistence.writeArtifact(runId, ArtifactType.ANALYSIS, result.analysis());
            persistence.saveAnalysis(runId, summarize(result.analysis()), result.analysis(), null,
                    result.model(), result.tokensUsed(), processingMs);
        }
        if (!result.subInvocations().isEmpty()) {
            persistence.writeArtifact(runId, ArtifactType.TOOLS_METADATA,
                    jsonProcessingService.toJson(result.subInvocations()));
        }

        runEvents.emitCompleted(runId, exitCode, durationSeconds);
        metricsService.recordRunFinished(RunStatus.COMPLETED.name());
        jobQueue.finish(job.getId(), RunJobStatus.DONE, null);
    }

    private void terminate(RunJob job, UUID runId, RunStatus status, String message) {
        Optional<Run> failed = persistence.transitionIfActive(runId, status, RunTransition.failed(message));
        if (failed.isPresent()) {
            runEvents.emitFailed(runId, message);
            metricsService.recordRunFinished(status.name());
        }
        jobQueue.finish(job.getId(), RunJobStatus.FAILED, message);
    }

    private ToolExecutionRequest buildRequest(RunExecutionContext context) {
        Tool tool = Tool.builder()
                .slug(context.toolSlug())
                .name(context.toolName())
                .binary(context.binary())
                .build();
        return new ToolExecutionRequest(
                context.toolSlug(),
                context.target(),
                promptService.runTask(tool),
                null,
                intParam(context, "maxTools", DEFAULT_MAX_TOOL_CALLS),
                resolveTimeout(context),
                context.params(),
                stringListParam(context, "backendTools"));
    }

    Duration resolveTimeout(RunExecutionContext context) {
        int requested = intParam(context, RunSubmissionService.PARAM_TIMEOUT_SECONDS, 0);
        if (requested > 0) {
            return Duration.ofSeconds(requested);
        }
        if (context.manifestTimeoutSeconds() != null && context.manifestTimeoutSeconds() > 0) {
            return Duration.ofSeconds(context.manifestTimeoutSeconds());
        }
        return properties.getWorker().getDefaultToolTimeout();
    }

    private ExecutionListener listenerFor(UUID runId, OutputAccumulator accumulator) {
        return new ExecutionListener() {
            @Override
            public void onOutput(String chunk) {
                accumulator.append(chunk);
                runEvents.emitOutput(runId, chunk);
            }

            @Override
            public void onToolStart(String toolName, int toolIndex, int totalTools) {
                runEvents.emitToolStart(runId, toolName, toolIndex, totalTools);
            }

            @Override
            public void onToolComplete(String toolName, long durationMs) {
                runEvents.emitToolComplete(runId, toolName, durationMs);
            }

            @Override
            public void onProgress(int progress, String phase) {
                runEvents.emitProgress(runId, progress, phase);
            }
        };
    }

    private static String summarize(String analysis) {
        return analysis.length() <= RunPersistenceService.SUMMARY_LENGTH
                ? analysis
                : analysis.substring(0, RunPersistenceService.SUMMARY_LENGTH);
    }

    private static int intParam(RunExecutionContext context, String key, int fallback) {
        Object value = context.params().get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && StringUtils.hasText(text)) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException ex) {
                return fallback;
            }
        }
        return fallback;
    }

    private static List<String> stringListParam(RunExecutionContext context, String key) {
        Object value = context.params().get(key);
        if (value instanceof List<?> list) {
            return list.stream().filter(item -> item != null).map(Object::toString).toList();
        }
        return List.of();
    }
}
