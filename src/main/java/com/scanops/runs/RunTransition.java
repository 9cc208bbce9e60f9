package com.scanops.runs;

import org.springframework.lang.Nullable;

/**
 * Optional fields written together with a status change.
 */
public record RunTransition(@Nullable Integer exitCode, @Nullable String error, @Nullable Long durationSeconds) {

    public static RunTransition none() {
        return new RunTransition(null, null, null);
    }

    public static RunTransition completed(int exitCode, long durationSeconds) {
        return new RunTransition(exitCode, null, durationSeconds);
    }

    public static RunTransition failed(String error) {
        return new RunTransition(null, error, null);
    }
}
