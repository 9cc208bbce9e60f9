package com.scanops.runs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanops.config.ScanOpsProperties;
import com.scanops.entity.ArtifactType;
import com.scanops.entity.Run;
import com.scanops.entity.RunJob;
import com.scanops.entity.RunJobStatus;
import com.scanops.entity.RunStatus;
import com.scanops.execution.JsonProcessingService;
import com.scanops.execution.ScanMetricsService;
import com.scanops.execution.ScanPromptService;
import com.scanops.execution.SubInvocation;
import com.scanops.execution.ToolExecutionRequest;
import com.scanops.execution.ToolExecutionResult;
import com.scanops.execution.ToolExecutionTimeoutException;
import com.scanops.execution.ToolOrchestrationService;
import com.scanops.stream.RunEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RunWorkerTest {

    private RunJobQueue jobQueue;
    private RunPersistenceService persistence;
    private ToolOrchestrationService orchestration;
    private RunEventPublisher runEvents;
    private ScanOpsProperties properties;
    private RunWorker worker;

    private final UUID runId = UUID.randomUUID();
    private final RunJob job = RunJob.builder().id(UUID.randomUUID()).runId(runId).status(RunJobStatus.ACTIVE).build();

    @BeforeEach
    void setUp() {
        jobQueue = mock(RunJobQueue.class);
        persistence = mock(RunPersistenceService.class);
        orchestration = mock(ToolOrchestrationService.class);
        runEvents = mock(RunEventPublisher.class);
        ScanPromptService promptService = mock(ScanPromptService.class);
        when(promptService.runTask(any())).thenReturn("scan it");
        properties = new ScanOpsProperties();
        worker = new RunWorker(jobQueue, persistence, orchestration, promptService, runEvents,
                new JsonProcessingService(new ObjectMapper()), new ScanMetricsService(), properties,
                mock(ExecutorService.class), Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void testSuccessfulRunWritesArtifactsAndCompletes() {
        givenContext(Map.of());
        givenActiveTransitions();
        when(persistence.isActive(runId)).thenReturn(true);
        List<SubInvocation> calls = List.of(
                new SubInvocation("nmap_scan", "{}", "22/tcp open ssh", "", 0, 1200),
                new SubInvocation("nikto_scan", "{}", "Error: host unreachable", "", null, 300));
        when(orchestration.execute(any(), any()))
                .thenReturn(new ToolExecutionResult("Port 22 open", calls, 42, "raw output", "", "gpt-4o"));

        worker.process(job);

        verify(runEvents).emitInit(runId, "nmap", "10.0.0.1");
        verify(persistence).writeArtifact(runId, ArtifactType.STDOUT, "raw output");
        verify(persistence).writeArtifact(eq(runId), eq(ArtifactType.TOOLS_METADATA), anyString());
        verify(persistence).writeArtifact(runId, ArtifactType.ANALYSIS, "Port 22 open");
        verify(persistence).saveAnalysis(eq(runId), eq("Port 22 open"), eq("Port 22 open"), any(), eq("gpt-4o"),
                eq(42L), anyLong());
        verify(persistence, never()).writeArtifact(eq(runId), eq(ArtifactType.STDERR), anyString());

        ArgumentCaptor<RunTransition> transition = ArgumentCaptor.forClass(RunTransition.class);
        verify(persistence).transitionIfActive(eq(runId), eq(RunStatus.COMPLETED), transition.capture());
        assertEquals(1, transition.getValue().exitCode());
        verify(runEvents).emitCompleted(runId, 1, 0L);
        verify(jobQueue).finish(job.getId(), RunJobStatus.DONE, null);
    }

    @Test
    void testTimeoutEndsRunAsTimeout() {
        givenContext(Map.of());
        givenActiveTransitions();
        when(orchestration.execute(any(), any()))
                .thenThrow(new ToolExecutionTimeoutException("nmap", Duration.ofSeconds(30)));

        worker.process(job);

        verify(persistence).transitionIfActive(eq(runId), eq(RunStatus.TIMEOUT), any());
        verify(runEvents).emitFailed(eq(runId), anyString());
        verify(jobQueue).finish(eq(job.getId()), eq(RunJobStatus.FAILED), anyString());
        verify(runEvents, never()).emitCompleted(any(), any(), any());
    }

    @Test
    void testRunCancelledBeforeStartIsSkipped() {
        givenContext(Map.of());
        when(persistence.transitionIfActive(eq(runId), eq(RunStatus.RUNNING), any())).thenReturn(Optional.empty());

        worker.process(job);

        verifyNoInteractions(orchestration);
        verify(runEvents, never()).emitInit(any(), any(), any());
        verify(jobQueue).finish(eq(job.getId()), eq(RunJobStatus.DONE), anyString());
    }

    @Test
    void testRunStoppedDuringExecutionDiscardsResult() {
        givenContext(Map.of());
        givenActiveTransitions();
        when(persistence.isActive(runId)).thenReturn(false);
        when(orchestration.execute(any(), any()))
                .thenReturn(new ToolExecutionResult("late", List.of(), 0, "late output", "", null));

        worker.process(job);

        verify(persistence, never()).writeArtifact(eq(runId), eq(ArtifactType.ANALYSIS), anyString());
        verify(persistence, never()).transitionIfActive(eq(runId), eq(RunStatus.COMPLETED), any());
        verify(jobQueue).finish(eq(job.getId()), eq(RunJobStatus.DONE), anyString());
    }

    @Test
    void testRunStoppedBeforeCompletionGetsNoArtifacts() {
        givenContext(Map.of());
        givenActiveTransitions();
        when(persistence.transitionIfActive(eq(runId), eq(RunStatus.COMPLETED), any())).thenReturn(Optional.empty());
        when(persistence.isActive(runId)).thenReturn(true);
        when(orchestration.execute(any(), any()))
                .thenReturn(new ToolExecutionResult("Port 22 open", List.of(), 0, "raw output", "", null));

        worker.process(job);

        verify(persistence, never()).writeArtifact(any(), any(), any());
        verify(persistence, never()).saveAnalysis(any(), any(), any(), any(), any(), anyLong(), anyLong());
        verify(runEvents, never()).emitCompleted(any(), any(), any());
        verify(jobQueue).finish(job.getId(), RunJobStatus.DONE, "Run stopped during execution");
    }

    @Test
    void testEmptyOutputsAreNotStored() {
        givenContext(Map.of());
        givenActiveTransitions();
        when(persistence.isActive(runId)).thenReturn(true);
        when(orchestration.execute(any(), any()))
                .thenReturn(new ToolExecutionResult("", List.of(), 0, "", "", null));

        worker.process(job);

        verify(persistence, never()).writeArtifact(any(), any(), any());
        verify(runEvents).emitCompleted(runId, 0, 0L);
        verify(jobQueue).finish(job.getId(), RunJobStatus.DONE, null);
    }

    @Test
    void testMissingRunFailsJob() {
        when(persistence.loadExecutionContext(runId)).thenReturn(Optional.empty());

        worker.process(job);

        verify(jobQueue).finish(job.getId(), RunJobStatus.FAILED, "Run not found");
        verifyNoInteractions(orchestration);
    }

    @Test
    void testRequestCarriesTimeoutAndToolBudgetFromParams() {
        givenContext(Map.of(RunSubmissionService.PARAM_TIMEOUT_SECONDS, 90, "maxTools", "3",
                "backendTools", List.of("nmap_scan")));
        givenActiveTransitions();
        when(persistence.isActive(runId)).thenReturn(true);
        when(orchestration.execute(any(), any())).thenReturn(new ToolExecutionResult("", List.of(), 0, "", "", null));

        worker.process(job);

        ArgumentCaptor<ToolExecutionRequest> request = ArgumentCaptor.forClass(ToolExecutionRequest.class);
        verify(orchestration).execute(request.capture(), any());
        assertEquals(Duration.ofSeconds(90), request.getValue().timeout());
        assertEquals(3, request.getValue().maxToolCalls());
        assertEquals(List.of("nmap_scan"), request.getValue().allowedTools());
        assertEquals("10.0.0.1", request.getValue().target());
    }

    @Test
    void testResolveTimeoutFallsBackToManifestThenDefault() {
        RunExecutionContext manifest = new RunExecutionContext(runId, "u1", "nmap", "Nmap", "nmap", 45, "10.0.0.1", Map.of());
        RunExecutionContext bare = new RunExecutionContext(runId, "u1", "nmap", "Nmap", "nmap", null, "10.0.0.1", Map.of());

        assertEquals(Duration.ofSeconds(45), worker.resolveTimeout(manifest));
        assertEquals(properties.getWorker().getDefaultToolTimeout(), worker.resolveTimeout(bare));
    }

    @Test
    void testRecoveryRequeuesNeverStartedJobsAndFailsTheRest() {
        RunJob pending = RunJob.builder().id(UUID.randomUUID()).runId(UUID.randomUUID()).status(RunJobStatus.ACTIVE).build();
        when(jobQueue.activeJobs()).thenReturn(List.of(pending, job));
        when(persistence.find(pending.getRunId()))
                .thenReturn(Optional.of(Run.builder().id(pending.getRunId()).status(RunStatus.PENDING).build()));
        when(persistence.find(runId)).thenReturn(Optional.of(Run.builder().id(runId).status(RunStatus.RUNNING).build()));
        when(persistence.transitionIfActive(eq(runId), eq(RunStatus.FAILED), any()))
                .thenReturn(Optional.of(Run.builder().id(runId).status(RunStatus.FAILED).build()));

        worker.recoverAndDrain();

        verify(jobQueue).requeue(pending.getId());
        verify(jobQueue).finish(eq(job.getId()), eq(RunJobStatus.FAILED), anyString());
        verify(runEvents).emitFailed(eq(runId), anyString());
    }

    private void givenContext(Map<String, Object> params) {
        when(persistence.loadExecutionContext(runId)).thenReturn(Optional.of(
                new RunExecutionContext(runId, "u1", "nmap", "Nmap", "nmap", null, "10.0.0.1", params)));
    }

    private void givenActiveTransitions() {
        when(persistence.transitionIfActive(eq(runId), any(), any()))
                .thenAnswer(inv -> Optional.of(Run.builder().id(runId).status(inv.getArgument(1)).build()));
    }
}
