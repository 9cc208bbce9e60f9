package com.scanops.api;

import com.scanops.entity.Run;
import com.scanops.entity.RunStatus;
import com.scanops.runs.RunLifecycleService;
import com.scanops.runs.RunSubmissionService;
import com.scanops.runs.RunView;
import com.scanops.scope.Caller;
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

import java.util.UUID;

@RestController
@RequestMapping("/api/runs")
public class RunController {

    static final String USER_HEADER = "X-User-Id";
    static final String ROLE_HEADER = "X-User-Role";

    private final RunSubmissionService submissionService;
    private final RunLifecycleService lifecycleService;

    public RunController(RunSubmissionService submissionService, RunLifecycleService lifecycleService) {
        this.submissionService = submissionService;
        this.lifecycleService = lifecycleService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RunResponse create(@RequestHeader(USER_HEADER) String userId,
                              @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role,
                              @Valid @RequestBody CreateRunRequest request) {
        Run run = submissionService.submit(new Caller(userId, role), request.toolId(), request.toolSlug(),
                request.scopeId(), request.target(), request.params(), request.timeout());
        return RunResponse.from(run);
    }

    @GetMapping
    public RunListResponse list(@RequestHeader(USER_HEADER) String userId,
                                @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role,
                                @RequestParam(value = "status", required = false) RunStatus status,
                                @RequestParam(value = "limit", required = false) Integer limit,
                                @RequestParam(value = "offset", required = false) Integer offset) {
        var page = lifecycleService.list(new Caller(userId, role), status, limit, offset);
        return RunListResponse.from(page, offset == null ? 0 : offset);
    }

    @GetMapping("/{id}")
    public RunView get(@RequestHeader(USER_HEADER) String userId,
                       @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role,
                       @PathVariable("id") UUID id) {
        return lifecycleService.findForCaller(id, new Caller(userId, role));
    }

    @PostMapping("/{id}/stop")
    public StopRunResponse stop(@RequestHeader(USER_HEADER) String userId,
                                @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role,
                                @PathVariable("id") UUID id) {
        return StopRunResponse.from(lifecycleService.stop(id, new Caller(userId, role)));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@RequestHeader(USER_HEADER) String userId,
                       @RequestHeader(value = ROLE_HEADER, defaultValue = Caller.ROLE_ENGINEER) String role,
                       @PathVariable("id") UUID id) {
        lifecycleService.delete(id, new Caller(userId, role));
    }
}
