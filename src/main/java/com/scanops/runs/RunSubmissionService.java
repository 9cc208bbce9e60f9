package com.scanops.runs;

import com.scanops.entity.Run;
import com.scanops.entity.Scope;
import com.scanops.entity.Tool;
import com.scanops.repository.ToolRepository;
import com.scanops.scope.Caller;
import com.scanops.scope.ScopeAccessService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Validates a run request (tool, target, timeout, scope) and hands it to the lifecycle service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunSubmissionService {

    public static final String PARAM_TIMEOUT_SECONDS = "timeoutSeconds";
    public static final int MIN_TIMEOUT_SECONDS = 30;
    public static final int MAX_TIMEOUT_SECONDS = 3600;
    public static final int MAX_TARGET_LENGTH = 255;

    static final Pattern TARGET_PATTERN = Pattern.compile("^[a-zA-Z0-9.\\-_:/]+$");

    private final ToolRepository toolRepository;
    private final ScopeAccessService scopeAccessService;
    private final RunLifecycleService lifecycleService;

    public Run submit(Caller caller, @Nullable UUID toolId, @Nullable String toolSlug, @Nullable UUID scopeId,
                      String target, @Nullable Map<String, Object> params, @Nullable Integer timeoutSeconds) {
        Tool tool = resolveTool(toolId, toolSlug);
        if (!tool.isEnabled()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Tool is disabled: " + tool.getSlug());
        }
        if (!tool.hasManifest()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Tool has no execution manifest: " + tool.getSlug());
        }
        String normalizedTarget = validateTarget(target);

        Map<String, Object> runParams = params == null ? new HashMap<>() : new HashMap<>(params);
        if (timeoutSeconds != null) {
            if (timeoutSeconds < MIN_TIMEOUT_SECONDS || timeoutSeconds > MAX_TIMEOUT_SECONDS) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "timeout must be between " + MIN_TIMEOUT_SECONDS + " and " + MAX_TIMEOUT_SECONDS + " seconds");
            }
            runParams.put(PARAM_TIMEOUT_SECONDS, timeoutSeconds);
        }

        Optional<Scope> scope = scopeAccessService.checkAccess(caller, scopeId, normalizedTarget);
        return lifecycleService.create(new RunCreateCommand(caller.userId(), tool, scope.orElse(null),
                normalizedTarget, runParams));
    }

    private Tool resolveTool(@Nullable UUID toolId, @Nullable String toolSlug) {
        if (toolId != null) {
            return toolRepository.findById(toolId)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Tool not found: " + toolId));
        }
        if (StringUtils.hasText(toolSlug)) {
            return toolRepository.findBySlug(toolSlug.trim())
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Tool not found: " + toolSlug));
        }
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Either toolId or toolSlug is required");
    }

    static String validateTarget(@Nullable String target) {
        if (!StringUtils.hasText(target)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "target is required");
        }
        String trimmed = target.trim();
        if (trimmed.length() > MAX_TARGET_LENGTH) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "target must be at most " + MAX_TARGET_LENGTH + " characters");
        }
        if (!TARGET_PATTERN.matcher(trimmed).matches()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "target contains invalid characters");
        }
        return trimmed;
    }
}
