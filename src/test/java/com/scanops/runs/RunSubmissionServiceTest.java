package com.scanops.runs;

import com.scanops.entity.Run;
import com.scanops.entity.RunStatus;
import com.scanops.entity.Tool;
import com.scanops.repository.ToolRepository;
import com.scanops.scope.Caller;
import com.scanops.scope.ScopeAccessService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class RunSubmissionServiceTest {

    private ToolRepository toolRepository;
    private ScopeAccessService scopeAccessService;
    private RunLifecycleService lifecycleService;
    private RunSubmissionService service;
    private final Caller caller = Caller.engineer("u1");

    @BeforeEach
    void setUp() {
        toolRepository = mock(ToolRepository.class);
        scopeAccessService = mock(ScopeAccessService.class);
        lifecycleService = mock(RunLifecycleService.class);
        service = new RunSubmissionService(toolRepository, scopeAccessService, lifecycleService);
        when(scopeAccessService.checkAccess(any(), any(), any())).thenReturn(Optional.empty());
        when(lifecycleService.create(any())).thenAnswer(inv -> {
            RunCreateCommand command = inv.getArgument(0);
            return Run.builder().id(UUID.randomUUID()).userId(command.userId()).tool(command.tool())
                    .target(command.target()).params(command.params()).status(RunStatus.PENDING).build();
        });
    }

    @Test
    void testSubmitBySlugStoresTimeoutInParams() {
        when(toolRepository.findBySlug("nmap")).thenReturn(Optional.of(tool(true, "nmap")));

        service.submit(caller, null, " nmap ", null, " scanme.example.org ", Map.of("ports", "80"), 120);

        ArgumentCaptor<RunCreateCommand> command = ArgumentCaptor.forClass(RunCreateCommand.class);
        verify(lifecycleService).create(command.capture());
        assertEquals("scanme.example.org", command.getValue().target());
        assertEquals(120, command.getValue().params().get(RunSubmissionService.PARAM_TIMEOUT_SECONDS));
        assertEquals("80", command.getValue().params().get("ports"));
        verify(scopeAccessService).checkAccess(eq(caller), isNull(), eq("scanme.example.org"));
    }

    @Test
    void testUnknownToolIsNotFound() {
        UUID toolId = UUID.randomUUID();
        when(toolRepository.findById(toolId)).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> service.submit(caller, toolId, null, null, "10.0.0.1", null, null));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    void testMissingToolReferenceIsBadRequest() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> service.submit(caller, null, "  ", null, "10.0.0.1", null, null));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void testDisabledToolIsRejected() {
        when(toolRepository.findBySlug("nikto")).thenReturn(Optional.of(tool(false, "nikto")));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> service.submit(caller, null, "nikto", null, "10.0.0.1", null, null));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verifyNoInteractions(lifecycleService);
    }

    @Test
    void testToolWithoutManifestIsRejected() {
        when(toolRepository.findBySlug("nmap")).thenReturn(Optional.of(tool(true, null)));

        assertThrows(ResponseStatusException.class,
                () -> service.submit(caller, null, "nmap", null, "10.0.0.1", null, null));
    }

    @Test
    void testTimeoutOutOfRangeIsRejected() {
        when(toolRepository.findBySlug("nmap")).thenReturn(Optional.of(tool(true, "nmap")));

        assertThrows(ResponseStatusException.class,
                () -> service.submit(caller, null, "nmap", null, "10.0.0.1", null, 29));
        assertThrows(ResponseStatusException.class,
                () -> service.submit(caller, null, "nmap", null, "10.0.0.1", null, 3601));
        verifyNoInteractions(lifecycleService);
    }

    @Test
    void testValidateTarget() {
        assertEquals("https://example.org:8443/app", RunSubmissionService.validateTarget("https://example.org:8443/app"));
        assertThrows(ResponseStatusException.class, () -> RunSubmissionService.validateTarget(null));
        assertThrows(ResponseStatusException.class, () -> RunSubmissionService.validateTarget("   "));
        assertThrows(ResponseStatusException.class, () -> RunSubmissionService.validateTarget("example.org; rm -rf /"));
        assertThrows(ResponseStatusException.class, () -> RunSubmissionService.validateTarget("a".repeat(256)));
    }

    private Tool tool(boolean enabled, String binary) {
        return Tool.builder().id(UUID.randomUUID()).slug("nmap").name("Nmap").enabled(enabled).binary(binary).build();
    }
}
