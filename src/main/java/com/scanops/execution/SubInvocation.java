package com.scanops.execution;

import org.springframework.lang.Nullable;

/**
 * Record of a single backend tool call made while serving a request.
 */
public record SubInvocation(
        String name,
        String params,
        String stdout,
        String stderr,
        @Nullable Integer exitCode,
        long durationMs
) {
    static final String ERROR_MARKER = "Error:";

    public boolean reportedError() {
        return (exitCode != null && exitCode != 0)
                || (stdout != null && stdout.contains(ERROR_MARKER))
                || (stderr != null && stderr.contains(ERROR_MARKER));
    }

    /** Combined textual output, stdout first. */
    public String output() {
        if (stderr == null || stderr.isBlank()) {
            return stdout == null ? "" : stdout;
        }
        return (stdout == null ? "" : stdout) + "\n" + stderr;
    }
}
