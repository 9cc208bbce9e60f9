package com.scanops.runs;

import com.scanops.audit.AuditLogService;
import com.scanops.entity.Run;
import com.scanops.entity.RunStatus;
import com.scanops.execution.BackendResetResult;
import com.scanops.execution.ExecutionBackendClient;
import com.scanops.scope.Caller;
import com.scanops.stream.RunEventPublisher;
import com.scanops.workflow.WorkflowPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * Entry point for creating, reading, stopping and deleting runs on behalf of a caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunLifecycleService {

    public static final String CANCELLED_BY_USER = "Run cancelled by user";
    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final RunPersistenceService persistence;
    private final RunWorker worker;
    private final RunEventPublisher runEvents;
    private final ExecutionBackendClient backendClient;
    private final WorkflowPersistenceService workflowPersistence;
    private final ApplicationEventPublisher eventPublisher;
    private final AuditLogService auditLogService;

    public Run create(RunCreateCommand command) {
        Run run = persistence.createPending(command, true);
        log.info("Run {} queued for user {}: tool={}, target={}",
                run.getId(), command.userId(), command.tool().getSlug(), command.target());
        auditLogService.record(command.userId(), "run.create", AuditLogService.RESOURCE_RUN,
                run.getId().toString(), command.tool().getSlug() + " -> " + command.target());
        worker.signal();
        return run;
    }

    public RunView findForCaller(UUID runId, Caller caller) {
        RunView view = persistence.findView(runId).orElseThrow(() -> notFound(runId));
        if (!caller.canAccess(view.userId())) {
            throw forbidden(runId);
        }
        return view;
    }

    public Page<RunView> list(Caller caller, @Nullable RunStatus status, @Nullable Integer limit, @Nullable Integer offset) {
        int pageSize = limit == null ? DEFAULT_LIMIT : limit;
        int skip = offset == null ? 0 : offset;
        if (pageSize < 1 || pageSize > MAX_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be between 1 and " + MAX_LIMIT);
        }
        if (skip < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "offset must not be negative");
        }
        PageRequest page = PageRequest.of(skip / pageSize, pageSize, Sort.by(Sort.Direction.DESC, "createdAt"));
        return persistence.listViews(caller.elevated() ? null : caller.userId(), status, page);
    }

    /**
     * Cancels a pending or running run. A run bound to a workflow session takes the session down
     * with it.
     *
     * @throws ResponseStatusException CONFLICT when the run already finished
     */
    public Run stop(UUID runId, Caller caller) {
        Run current = persistence.find(runId).orElseThrow(() -> notFound(runId));
        if (!caller.canAccess(current.getUserId())) {
            throw forbidden(runId);
        }
        Run cancelled = persistence.cancel(runId, CANCELLED_BY_USER);
        runEvents.emitFailed(runId, CANCELLED_BY_USER);
        log.info("Run {} cancelled by {}", runId, caller.userId());

        if (cancelled.getWorkflowSessionId() != null) {
            eventPublisher.publishEvent(new BoundRunCancelledEvent(cancelled.getWorkflowSessionId(), runId, caller.userId()));
        }
        BackendResetResult reset = backendClient.reset();
        if (!reset.success()) {
            log.warn("Backend reset after stopping run {} failed: {}", runId, reset.message());
        }
        auditLogService.record(caller.userId(), "run.stop", AuditLogService.RESOURCE_RUN, runId.toString(), null);
        return cancelled;
    }

    public void delete(UUID runId, Caller caller) {
        Run current = persistence.find(runId).orElseThrow(() -> notFound(runId));
        if (!caller.canAccess(current.getUserId())) {
            throw forbidden(runId);
        }
        if (current.getStatus().isActive()) {
            try {
                stop(runId, caller);
            } catch (ResponseStatusException ex) {
                // finished between the read and the stop
                log.debug("Run {} was not stoppable before delete: {}", runId, ex.getReason());
            }
        }
        UUID sessionId = current.getWorkflowSessionId();
        if (sessionId != null) {
            workflowPersistence.deleteSessionGraph(sessionId);
        } else {
            persistence.deleteRunGraph(runId);
        }
        auditLogService.record(caller.userId(), "run.delete", AuditLogService.RESOURCE_RUN, runId.toString(),
                sessionId == null ? null : "workflow_session=" + sessionId);
    }

    private static ResponseStatusException notFound(UUID runId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + runId);
    }

    private static ResponseStatusException forbidden(UUID runId) {
        return new ResponseStatusException(HttpStatus.FORBIDDEN, "Not allowed to access run " + runId);
    }
}
