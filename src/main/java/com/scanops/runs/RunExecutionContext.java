package com.scanops.runs;

import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.UUID;

/**
 * Detached snapshot of what the worker needs to execute a run, read in one transaction.
 */
public record RunExecutionContext(
        UUID runId,
        String userId,
        String toolSlug,
        String toolName,
        @Nullable String binary,
        @Nullable Integer manifestTimeoutSeconds,
        String target,
        Map<String, Object> params
) {
}
