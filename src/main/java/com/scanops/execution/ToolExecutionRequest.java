package com.scanops.execution;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * One unit of work for the tool-orchestration capability.
 *
 * @param label        short name used in logs and progress events, e.g. the tool slug or phase name
 * @param target       host, IP or URL the tools run against
 * @param task         natural-language task description handed to the model
 * @param objective    optional assessment objective
 * @param maxToolCalls budget of backend tool invocations
 * @param timeout      deadline for the whole request
 * @param params       caller supplied parameters, forwarded to the model verbatim
 * @param allowedTools backend tool names the model may call, empty for the configured default set
 */
public record ToolExecutionRequest(
        String label,
        String target,
        String task,
        @Nullable String objective,
        int maxToolCalls,
        Duration timeout,
        Map<String, Object> params,
        List<String> allowedTools
) {
    public ToolExecutionRequest {
        params = params == null ? Map.of() : params;
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        maxToolCalls = Math.max(1, maxToolCalls);
    }
}
