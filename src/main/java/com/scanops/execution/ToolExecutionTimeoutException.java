package com.scanops.execution;

import java.time.Duration;

/**
 * The request did not finish within its deadline. Surfaces as the TIMEOUT status.
 */
public class ToolExecutionTimeoutException extends ToolExecutionException {

    public ToolExecutionTimeoutException(String label, Duration timeout) {
        super("Execution of " + label + " timed out after " + timeout.toSeconds() + "s");
    }
}
