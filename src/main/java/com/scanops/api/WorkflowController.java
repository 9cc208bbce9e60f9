package com.scanops.api;

import com.scanops.config.ScanOpsProperties;
import com.scanops.entity.WorkflowObjective;
import com.scanops.entity.WorkflowStatus;
import com.scanops.scope.Caller;
import com.scanops.workflow.CancelOutcome;
import com.scanops.workflow.CreateWorkflowCommand;
import com.scanops.workflow.WorkflowOrchestrator;
import com.scanops.workflow.WorkflowView;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

import static com.scanops.api.RunController.ROLE_HEADER;
import static com.scanops.api.RunController.USER_HEADER;

@RestController
@RequestMapping("/api/workflows")
public class WorkflowController {

    private final WorkflowOrchestrator orchestrator;
    private final ScanOpsProperties properties;

    public WorkflowController(WorkflowOrchestrator orchestrator, ScanOpsProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public WorkflowCreatedResponse create(@RequestHeader(USER_HEADER) String userId,
                                          @Valid @RequestBody CreateWorkflowRequest request) {
        WorkflowObjective objective = request.objective() == null ? WorkflowObjective.COMPREHENSIVE : request.objective();
        int maxSteps = request.maxSteps() == null ? properties.getWorkflow().getDefaultMaxSteps() : request.maxSteps();
        var creation = orchestrator.create(new CreateWorkflowCommand(userId, request.name(),
                request.target().trim(), objective, maxSteps));
        return WorkflowCreatedResponse.from(creation);
    }

    @GetMapping
    public WorkflowListResponse list(@RequestHeader(USER_HEADER) String userId,
                                     @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role,
                                     @RequestParam(value = "status", required = false) WorkflowStatus status,
                                     @RequestParam(value = "limit", required = false) Integer limit,
                                     @RequestParam(value = "offset", required = false) Integer offset) {
        var page = orchestrator.list(new Caller(userId, role), status, limit, offset);
        return WorkflowListResponse.from(page, offset == null ? 0 : offset);
    }

    @GetMapping("/counts")
    public Map<WorkflowStatus, Long> counts(@RequestHeader(USER_HEADER) String userId,
                                            @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role) {
        return orchestrator.counts(new Caller(userId, role));
    }

    @GetMapping("/{id}")
    public WorkflowView get(@RequestHeader(USER_HEADER) String userId,
                            @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role,
                            @PathVariable("id") UUID id) {
        return orchestrator.getStatus(id, new Caller(userId, role));
    }

    @PostMapping("/{id}/cancel")
    public CancelOutcome cancel(@RequestHeader(USER_HEADER) String userId,
                                @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role,
                                @PathVariable("id") UUID id) {
        return orchestrator.cancel(id, new Caller(userId, role));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@RequestHeader(USER_HEADER) String userId,
                       @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role,
                       @PathVariable("id") UUID id) {
        orchestrator.delete(id, new Caller(userId, role));
    }

    @DeleteMapping("/{id}/findings/{findingId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteFinding(@RequestHeader(USER_HEADER) String userId,
                              @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role,
                              @PathVariable("id") UUID id,
                              @PathVariable("findingId") UUID findingId) {
        orchestrator.deleteFinding(id, findingId, new Caller(userId, role));
    }

    @DeleteMapping("/{id}/tools/{tool}/findings")
    public DeletedFindingsResponse deleteToolFindings(@RequestHeader(USER_HEADER) String userId,
                                                      @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role,
                                                      @PathVariable("id") UUID id,
                                                      @PathVariable("tool") String tool) {
        return new DeletedFindingsResponse(tool, orchestrator.deleteToolFindings(id, tool, new Caller(userId, role)));
    }
}
