package com.scanops.execution;

/**
 * The AI-assisted capability that decides which backend tools to run for a task, runs them and
 * writes an analysis of the outcome.
 */
public interface ToolOrchestrationService {

    /**
     * Executes the request synchronously.
     *
     * @param request  what to do and against which target
     * @param listener receives output chunks and tool lifecycle callbacks while the request runs
     * @return the model's analysis together with every backend invocation it made
     * @throws ToolExecutionTimeoutException if the request exceeds its timeout
     * @throws ToolExecutionException if the model call fails
     */
    ToolExecutionResult execute(ToolExecutionRequest request, ExecutionListener listener);
}
