package com.scanops.workflow;

import com.scanops.audit.AuditLogService;
import com.scanops.config.ScanOpsProperties;
import com.scanops.entity.StepStatus;
import com.scanops.entity.WorkflowObjective;
import com.scanops.entity.WorkflowPhase;
import com.scanops.entity.WorkflowStatus;
import com.scanops.entity.WorkflowStep;
import com.scanops.execution.BackendResetResult;
import com.scanops.execution.ExecutionBackendClient;
import com.scanops.execution.ScanMetricsService;
import com.scanops.execution.ScanPromptService;
import com.scanops.execution.ToolExecutionResult;
import com.scanops.execution.ToolExecutionTimeoutException;
import com.scanops.execution.ToolOrchestrationService;
import com.scanops.runs.BoundRunCancelledEvent;
import com.scanops.runs.RunPersistenceService;
import com.scanops.scope.Caller;
import com.scanops.stream.RunEventPublisher;
import com.scanops.stream.WorkflowEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class WorkflowOrchestratorTest {

    private WorkflowPersistenceService persistence;
    private WorkflowAdmissionControl admissionControl;
    private ToolOrchestrationService toolOrchestration;
    private RunEventPublisher runEvents;
    private WorkflowEventPublisher workflowEvents;
    private ExecutionBackendClient backendClient;
    private ExecutorService scanExecutor;
    private ScanOpsProperties properties;
    private WorkflowOrchestrator orchestrator;

    private final UUID sessionId = UUID.randomUUID();
    private final UUID runId = UUID.randomUUID();
    private DriverContext context;

    @BeforeEach
    void setUp() {
        persistence = mock(WorkflowPersistenceService.class);
        admissionControl = mock(WorkflowAdmissionControl.class);
        toolOrchestration = mock(ToolOrchestrationService.class);
        runEvents = mock(RunEventPublisher.class);
        workflowEvents = mock(WorkflowEventPublisher.class);
        backendClient = mock(ExecutionBackendClient.class);
        scanExecutor = mock(ExecutorService.class);
        properties = new ScanOpsProperties();
        ScanPromptService promptService = mock(ScanPromptService.class);
        when(promptService.phaseTask(any(), any(), any(), any())).thenReturn("phase task");
        when(backendClient.reset()).thenReturn(new BackendResetResult(true, "ok"));
        when(persistence.oldestWaiting()).thenReturn(Optional.empty());

        orchestrator = new WorkflowOrchestrator(persistence, admissionControl, toolOrchestration, promptService,
                mock(RunPersistenceService.class), runEvents, workflowEvents, backendClient, new ScanMetricsService(),
                mock(AuditLogService.class), properties, scanExecutor, Clock.systemUTC());
        context = new DriverContext(sessionId, runId, "u1", "10.0.0.1", WorkflowObjective.QUICK, 20);
    }

    @Test
    void testSecondWorkflowWaitsInQueue() {
        when(admissionControl.tryClaim(sessionId)).thenReturn(false);
        when(persistence.queuePosition(sessionId)).thenReturn(1);

        AdmissionOutcome outcome = orchestrator.start(sessionId);

        assertFalse(outcome.started());
        assertEquals(1, outcome.queuePosition());
        verify(persistence, never()).markRunning(any());
        verify(workflowEvents).emitLog(eq(sessionId), contains("position 1"));
        verifyNoInteractions(scanExecutor);
    }

    @Test
    void testClaimedSlotStartsDriver() {
        when(admissionControl.tryClaim(sessionId)).thenReturn(true);
        when(persistence.markRunning(sessionId)).thenReturn(Optional.of(context));

        AdmissionOutcome outcome = orchestrator.start(sessionId);

        assertTrue(outcome.started());
        verify(backendClient).reset();
        verify(runEvents).emitInit(runId, properties.getWorkflow().getToolSlug(), "10.0.0.1");
        verify(scanExecutor).execute(any(Runnable.class));
    }

    @Test
    void testSessionThatCannotStartReleasesSlot() {
        when(admissionControl.tryClaim(sessionId)).thenReturn(true);
        when(persistence.markRunning(sessionId)).thenReturn(Optional.empty());

        AdmissionOutcome outcome = orchestrator.start(sessionId);

        assertFalse(outcome.started());
        assertNull(outcome.queuePosition());
        verify(admissionControl).release(sessionId);
    }

    @Test
    void testDriverRunsEveryPhaseAndCompletes() {
        givenRunningSession();
        when(toolOrchestration.execute(any(), any()))
                .thenReturn(new ToolExecutionResult("Open port 22", List.of(), 5, "22/tcp open", "", null));
        when(persistence.writeFinalReport(eq(sessionId), anyLong())).thenReturn(report(42));
        when(persistence.complete(sessionId)).thenReturn(true);

        orchestrator.drive(context);

        verify(toolOrchestration, times(5)).execute(any(), any());
        for (WorkflowPhase phase : WorkflowPhase.values()) {
            verify(persistence).updateStep(sessionId, phase, StepStatus.COMPLETED, null);
        }
        verify(workflowEvents).emitCompleted(sessionId, 42);
        verify(runEvents).emitCompleted(eq(runId), eq(0), any());
        verify(admissionControl).release(sessionId);
        verify(persistence).oldestWaiting();
    }

    @Test
    void testFailedPhaseIsContainedAndWorkflowContinues() {
        givenRunningSession();
        when(toolOrchestration.execute(any(), any()))
                .thenThrow(new ToolExecutionTimeoutException("automated_scan", Duration.ofSeconds(5)))
                .thenReturn(new ToolExecutionResult("", List.of(), 0, "", "", null));
        when(persistence.writeFinalReport(eq(sessionId), anyLong())).thenReturn(report(1));
        when(persistence.complete(sessionId)).thenReturn(true);

        orchestrator.drive(context);

        verify(persistence).updateStep(eq(sessionId), eq(WorkflowPhase.INTELLIGENCE_PLANNING),
                eq(StepStatus.TIMEOUT), anyString());
        verify(persistence, atLeastOnce()).saveFindings(eq(sessionId), any());
        verify(persistence).complete(sessionId);
        verify(persistence, never()).fail(any(), any());
    }

    @Test
    void testAbortOnPhaseFailureFailsSession() {
        properties.getWorkflow().setAbortOnPhaseFailure(true);
        givenRunningSession();
        when(toolOrchestration.execute(any(), any())).thenThrow(new IllegalStateException("model unavailable"));
        when(persistence.fail(eq(sessionId), anyString())).thenReturn(List.of());

        orchestrator.drive(context);

        verify(toolOrchestration, times(1)).execute(any(), any());
        verify(persistence).fail(eq(sessionId), contains("remaining phases aborted"));
        verify(workflowEvents).emitFailed(eq(sessionId), anyString());
        verify(runEvents).emitFailed(eq(runId), anyString());
        verify(admissionControl).release(sessionId);
        verify(persistence, never()).writeFinalReport(any(), anyLong());
    }

    @Test
    void testDriverStopsWhenSessionLeavesRunning() {
        when(persistence.status(sessionId)).thenReturn(Optional.of(WorkflowStatus.CANCELLED));

        orchestrator.drive(context);

        verifyNoInteractions(toolOrchestration);
        verify(persistence, never()).complete(any());
    }

    @Test
    void testCancelSkipsStepsAndFailsBoundRun() {
        WorkflowStep skipped = WorkflowStep.builder().phase(WorkflowPhase.AUTOMATED_SCAN).status(StepStatus.SKIPPED).build();
        when(persistence.ownerOf(sessionId)).thenReturn(Optional.of("u1"));
        when(persistence.cancel(sessionId)).thenReturn(new WorkflowPersistenceService.CancelResult(
                CancelOutcome.cancelled(sessionId), List.of(skipped), true, runId));

        CancelOutcome outcome = orchestrator.cancel(sessionId, Caller.engineer("u1"));

        assertFalse(outcome.alreadyCancelled());
        verify(workflowEvents).emitStepUpdate(sessionId, skipped);
        verify(workflowEvents).emitFailed(sessionId, WorkflowPersistenceService.CANCELLED_MESSAGE);
        verify(runEvents).emitFailed(runId, WorkflowPersistenceService.CANCELLED_MESSAGE);
        verify(backendClient).reset();
        verify(admissionControl).release(sessionId);
    }

    @Test
    void testRepeatedCancelHasNoSideEffects() {
        when(persistence.ownerOf(sessionId)).thenReturn(Optional.of("u1"));
        when(persistence.cancel(sessionId)).thenReturn(new WorkflowPersistenceService.CancelResult(
                CancelOutcome.alreadyCancelled(sessionId), List.of(), false, null));

        assertTrue(orchestrator.cancel(sessionId, Caller.engineer("u1")).alreadyCancelled());
        verifyNoInteractions(workflowEvents, runEvents, backendClient);
    }

    @Test
    void testCancelOfOtherUsersSessionIsForbidden() {
        when(persistence.ownerOf(sessionId)).thenReturn(Optional.of("owner"));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> orchestrator.cancel(sessionId, Caller.engineer("intruder")));
        assertEquals(HttpStatus.FORBIDDEN, ex.getStatusCode());
        verify(persistence, never()).cancel(any());
    }

    @Test
    void testStoppedBoundRunCancelsSession() {
        when(persistence.cancel(sessionId)).thenReturn(new WorkflowPersistenceService.CancelResult(
                CancelOutcome.cancelled(sessionId), List.of(), true, null));

        orchestrator.onBoundRunCancelled(new BoundRunCancelledEvent(sessionId, runId, "u1"));

        verify(workflowEvents).emitFailed(sessionId, WorkflowPersistenceService.CANCELLED_MESSAGE);
        verify(runEvents, never()).emitFailed(any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFailedFilterIncludesTimeout() {
        when(persistence.listViews(any(), any(), any(Pageable.class))).thenReturn(new PageImpl<>(List.of()));

        orchestrator.list(Caller.engineer("u1"), WorkflowStatus.FAILED, null, null);

        ArgumentCaptor<Collection<WorkflowStatus>> statuses = ArgumentCaptor.forClass(Collection.class);
        verify(persistence).listViews(eq("u1"), statuses.capture(), any(Pageable.class));
        assertEquals(Set.of(WorkflowStatus.FAILED, WorkflowStatus.TIMEOUT), Set.copyOf(statuses.getValue()));
    }

    @Test
    void testRecoveryFailsOrphansAndReleasesStaleSlot() {
        UUID stale = UUID.randomUUID();
        when(persistence.failOrphanedSessions(anyString())).thenReturn(List.of(sessionId));
        when(admissionControl.holder()).thenReturn(Optional.of(stale));

        orchestrator.recoverAndDrain();

        verify(admissionControl).release(sessionId);
        verify(admissionControl).release(stale);
        verify(persistence).oldestWaiting();
    }

    private void givenRunningSession() {
        when(persistence.status(sessionId)).thenReturn(Optional.of(WorkflowStatus.RUNNING));
        when(persistence.updateStep(any(), any(), any(), any())).thenAnswer(inv -> new WorkflowPersistenceService.StepUpdate(
                WorkflowStep.builder().phase(inv.getArgument(1)).status(inv.getArgument(2)).build(), 0, true));
        when(persistence.saveFindings(any(), any())).thenAnswer(inv -> inv.getArgument(1));
        when(persistence.findings(sessionId)).thenReturn(List.of());
    }

    private static WorkflowReport report(int riskScore) {
        return new WorkflowReport(0, 0, 0, 0, 0, 0, riskScore, Map.of(), "summary", "analysis", "");
    }
}
