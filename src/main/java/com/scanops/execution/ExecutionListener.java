package com.scanops.execution;

/**
 * Callbacks fired while a tool-orchestration request is in flight. All methods default to no-ops.
 */
public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() {
    };

    default void onOutput(String chunk) {
    }

    default void onToolStart(String toolName, int toolIndex, int totalTools) {
    }

    default void onToolComplete(String toolName, long durationMs) {
    }

    default void onProgress(int progress, String phase) {
    }
}
