package com.scanops;

import com.scanops.entity.RunStatus;
import com.scanops.entity.Tool;
import com.scanops.entity.WorkflowObjective;
import com.scanops.entity.WorkflowStatus;
import com.scanops.execution.ExecutionListener;
import com.scanops.execution.SubInvocation;
import com.scanops.execution.ToolExecutionResult;
import com.scanops.execution.ToolOrchestrationService;
import com.scanops.repository.ToolRepository;
import com.scanops.runs.RunLifecycleService;
import com.scanops.runs.RunSubmissionService;
import com.scanops.runs.RunView;
import com.scanops.scope.Caller;
import com.scanops.workflow.CreateWorkflowCommand;
import com.scanops.workflow.WorkflowCreation;
import com.scanops.workflow.WorkflowOrchestrator;
import com.scanops.workflow.WorkflowView;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest
class ScanOpsIntegrationTest extends BaseIntegrationTest {

    private static final long WAIT_MS = 10_000;

    @MockitoBean
    private ToolOrchestrationService toolOrchestrationService;

    @Autowired
    private ToolRepository toolRepository;
    @Autowired
    private RunSubmissionService submissionService;
    @Autowired
    private RunLifecycleService lifecycleService;
    @Autowired
    private WorkflowOrchestrator workflowOrchestrator;

    @Test
    void testRunIsExecutedByWorker() throws InterruptedException {
        toolRepository.save(Tool.builder().slug("nmap-it").name("Nmap").enabled(true).binary("nmap").build());
        when(toolOrchestrationService.execute(any(), any())).thenAnswer(inv -> {
            ExecutionListener listener = inv.getArgument(1);
            listener.onOutput("Starting Nmap\n");
            return new ToolExecutionResult("Open port 22 found",
                    List.of(new SubInvocation("nmap_scan", "{}", "22/tcp open", "", 0, 20)), 3,
                    "22/tcp open ssh", "", "test-model");
        });
        Caller caller = Caller.engineer("it-user");

        UUID runId = submissionService.submit(caller, null, "nmap-it", null, "127.0.0.1", Map.of(), 60).getId();

        RunView view = awaitValue(() -> lifecycleService.findForCaller(runId, caller),
                v -> !v.status().isActive());
        assertEquals(RunStatus.COMPLETED, view.status());
        assertEquals(0, view.exitCode());
        assertNotNull(view.completedAt());
        assertTrue(view.artifacts().stream().anyMatch(a -> a.type().name().equals("STDOUT")));
        assertTrue(view.artifacts().stream().anyMatch(a -> a.type().name().equals("ANALYSIS")));
    }

    @Test
    void testWorkflowRunsToCompletion() throws InterruptedException {
        when(toolOrchestrationService.execute(any(), any()))
                .thenReturn(new ToolExecutionResult("Open port 443. Remediation: close unused ports.",
                        List.of(), 1, "443/tcp open", "", null));
        Caller caller = Caller.engineer("it-workflow");

        WorkflowCreation creation = workflowOrchestrator.create(new CreateWorkflowCommand(caller.userId(), null,
                "127.0.0.1", WorkflowObjective.QUICK, 5));
        UUID sessionId = creation.session().id();

        WorkflowView view = awaitValue(() -> workflowOrchestrator.getStatus(sessionId, caller),
                v -> v.status().isTerminal());
        assertEquals(WorkflowStatus.COMPLETED, view.status());
        assertEquals(100, view.progress());
        assertEquals(6, view.steps().size());
        assertFalse(view.findings().isEmpty());
        assertNotNull(view.report());

        RunView run = lifecycleService.findForCaller(view.runId(), caller);
        assertEquals(RunStatus.COMPLETED, run.status());
        assertEquals(sessionId, run.workflowSessionId());
    }

    private static <T> T awaitValue(Supplier<T> read, Predicate<T> done) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MS;
        T value = read.get();
        while (!done.test(value) && System.currentTimeMillis() < deadline) {
            Thread.sleep(100);
            value = read.get();
        }
        return value;
    }
}
