package com.scanops.api;

import com.scanops.config.ScanOpsProperties;
import com.scanops.entity.WorkflowObjective;
import com.scanops.entity.WorkflowStatus;
import com.scanops.scope.Caller;
import com.scanops.workflow.AdmissionOutcome;
import com.scanops.workflow.CancelOutcome;
import com.scanops.workflow.CreateWorkflowCommand;
import com.scanops.workflow.WorkflowCreation;
import com.scanops.workflow.WorkflowOrchestrator;
import com.scanops.workflow.WorkflowView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WorkflowController.class)
class WorkflowControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WorkflowOrchestrator orchestrator;

    @MockitoBean
    private ScanOpsProperties properties;

    private final UUID sessionId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        when(properties.getWorkflow()).thenReturn(new ScanOpsProperties.WorkflowConfig());
    }

    @Test
    void testCreateQueuedWorkflowUsesDefaults() throws Exception {
        when(orchestrator.create(any())).thenReturn(new WorkflowCreation(view(WorkflowStatus.CREATED),
                AdmissionOutcome.queued(2)));

        mockMvc.perform(post("/api/workflows")
                        .header(RunController.USER_HEADER, "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"scanme.example.org\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.session.id").value(sessionId.toString()))
                .andExpect(jsonPath("$.admission.queuePosition").value(2))
                .andExpect(jsonPath("$.message").value("Workflow queued at position 2"));

        ArgumentCaptor<CreateWorkflowCommand> command = ArgumentCaptor.forClass(CreateWorkflowCommand.class);
        verify(orchestrator).create(command.capture());
        assertEquals(WorkflowObjective.COMPREHENSIVE, command.getValue().objective());
        assertEquals(20, command.getValue().maxSteps());
        assertEquals("scanme.example.org", command.getValue().target());
        assertNull(command.getValue().name());
    }

    @Test
    void testCreateWithObjective() throws Exception {
        when(orchestrator.create(any())).thenReturn(new WorkflowCreation(view(WorkflowStatus.RUNNING),
                AdmissionOutcome.startedNow()));

        mockMvc.perform(post("/api/workflows")
                        .header(RunController.USER_HEADER, "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"10.0.0.1\",\"objective\":\"stealth\",\"maxSteps\":5}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.admission.started").value(true))
                .andExpect(jsonPath("$.message").value("Workflow started"));

        ArgumentCaptor<CreateWorkflowCommand> command = ArgumentCaptor.forClass(CreateWorkflowCommand.class);
        verify(orchestrator).create(command.capture());
        assertEquals(WorkflowObjective.STEALTH, command.getValue().objective());
        assertEquals(5, command.getValue().maxSteps());
    }

    @Test
    void testCreateRejectsOversizedBudget() throws Exception {
        mockMvc.perform(post("/api/workflows")
                        .header(RunController.USER_HEADER, "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"10.0.0.1\",\"maxSteps\":51}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(orchestrator);
    }

    @Test
    void testGetStatus() throws Exception {
        when(orchestrator.getStatus(sessionId, Caller.engineer("u1"))).thenReturn(view(WorkflowStatus.RUNNING));

        mockMvc.perform(get("/api/workflows/{id}", sessionId).header(RunController.USER_HEADER, "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.objective").value("quick"));
    }

    @Test
    void testCounts() throws Exception {
        Map<WorkflowStatus, Long> counts = new EnumMap<>(WorkflowStatus.class);
        counts.put(WorkflowStatus.RUNNING, 1L);
        counts.put(WorkflowStatus.COMPLETED, 3L);
        when(orchestrator.counts(any())).thenReturn(counts);

        mockMvc.perform(get("/api/workflows/counts").header(RunController.USER_HEADER, "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.COMPLETED").value(3));
    }

    @Test
    void testCancelTwiceIsStillOk() throws Exception {
        when(orchestrator.cancel(eq(sessionId), any())).thenReturn(CancelOutcome.alreadyCancelled(sessionId));

        mockMvc.perform(post("/api/workflows/{id}/cancel", sessionId).header(RunController.USER_HEADER, "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alreadyCancelled").value(true));
    }

    @Test
    void testCancelCompletedIsConflict() throws Exception {
        when(orchestrator.cancel(eq(sessionId), any()))
                .thenThrow(new ResponseStatusException(HttpStatus.CONFLICT, "already finished"));

        mockMvc.perform(post("/api/workflows/{id}/cancel", sessionId).header(RunController.USER_HEADER, "u1"))
                .andExpect(status().isConflict());
    }

    @Test
    void testDeleteToolFindings() throws Exception {
        when(orchestrator.deleteToolFindings(eq(sessionId), eq("nmap"), any())).thenReturn(4);

        mockMvc.perform(delete("/api/workflows/{id}/tools/{tool}/findings", sessionId, "nmap")
                        .header(RunController.USER_HEADER, "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tool").value("nmap"))
                .andExpect(jsonPath("$.deleted").value(4));
    }

    @Test
    void testDeleteFinding() throws Exception {
        UUID findingId = UUID.randomUUID();

        mockMvc.perform(delete("/api/workflows/{id}/findings/{findingId}", sessionId, findingId)
                        .header(RunController.USER_HEADER, "u1"))
                .andExpect(status().isNoContent());
        verify(orchestrator).deleteFinding(sessionId, findingId, Caller.engineer("u1"));
    }

    private WorkflowView view(WorkflowStatus status) {
        return new WorkflowView(sessionId, "u1", "Assessment", "10.0.0.1", WorkflowObjective.QUICK, 20, status,
                null, 0, 0, 0, 0, 0, null, null, UUID.randomUUID(), OffsetDateTime.now(), null, null,
                List.of(), List.of());
    }
}
