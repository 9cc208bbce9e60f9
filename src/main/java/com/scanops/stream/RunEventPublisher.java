package com.scanops.stream;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Typed emitters for the per-run channel.
 */
@Component
public class RunEventPublisher {

    private final EventChannelHub hub;

    public RunEventPublisher(EventChannelHub hub) {
        this.hub = hub;
    }

    public void emitInit(UUID runId, String tool, String target) {
        hub.emit(runId.toString(), StreamEventType.INIT, payload("tool", tool, "target", target));
    }

    public void emitOutput(UUID runId, String chunk) {
        hub.emit(runId.toString(), StreamEventType.OUTPUT, payload("chunk", chunk));
    }

    public void emitToolStart(UUID runId, String toolName, int toolIndex, int totalTools) {
        hub.emit(runId.toString(), StreamEventType.TOOL_START,
                payload("toolName", toolName, "toolIndex", toolIndex, "totalTools", totalTools));
    }

    public void emitToolComplete(UUID runId, String toolName, long durationMs) {
        hub.emit(runId.toString(), StreamEventType.TOOL_COMPLETE,
                payload("toolName", toolName, "duration", durationMs));
    }

    public void emitProgress(UUID runId, int progress, @Nullable String phase) {
        hub.emit(runId.toString(), StreamEventType.PROGRESS, payload("progress", progress, "phase", phase));
    }

    public void emitCompleted(UUID runId, @Nullable Integer exitCode, @Nullable Long durationSeconds) {
        hub.emit(runId.toString(), StreamEventType.COMPLETED,
                payload("exitCode", exitCode, "duration", durationSeconds));
    }

    public void emitFailed(UUID runId, String error) {
        hub.emit(runId.toString(), StreamEventType.FAILED, payload("error", error));
    }

    static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> data = new HashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value != null) {
                data.put(keyValues[i].toString(), value);
            }
        }
        return data;
    }
}
