package com.scanops.execution;

import org.springframework.lang.Nullable;

import java.util.List;

public record ToolExecutionResult(
        String analysis,
        List<SubInvocation> subInvocations,
        long tokensUsed,
        String stdout,
        String stderr,
        @Nullable String model
) {
    public ToolExecutionResult {
        analysis = analysis == null ? "" : analysis;
        subInvocations = subInvocations == null ? List.of() : List.copyOf(subInvocations);
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean anyInvocationFailed() {
        return subInvocations.stream().anyMatch(SubInvocation::reportedError);
    }
}
