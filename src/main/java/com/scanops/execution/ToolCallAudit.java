package com.scanops.execution;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects the backend tool calls of one request, enforces the call budget and relays lifecycle
 * callbacks to the request's listener until it is closed.
 */
@Slf4j
public final class ToolCallAudit {

    private static final int MAX_SNIPPET = 2000;

    private final String label;
    private final int maxCalls;
    private final ExecutionListener listener;
    private final JsonProcessingService jsonProcessingService;
    private final AtomicInteger started = new AtomicInteger();
    private final List<SubInvocation> calls = Collections.synchronizedList(new ArrayList<>());
    private final StringBuilder stdout = new StringBuilder();
    private final StringBuilder stderr = new StringBuilder();
    private volatile boolean closed;

    public ToolCallAudit(String label, int maxCalls, ExecutionListener listener,
                         JsonProcessingService jsonProcessingService) {
        this.label = label;
        this.maxCalls = maxCalls;
        this.listener = listener == null ? ExecutionListener.NONE : listener;
        this.jsonProcessingService = jsonProcessingService;
    }

    /**
     * Reserves a slot for a new call.
     *
     * @return the 1-based call index, or -1 when the budget is spent or the audit was closed
     */
    int begin(String name) {
        if (closed) {
            return -1;
        }
        int index = started.incrementAndGet();
        if (index > maxCalls) {
            log.info("Tool call budget of {} exhausted for {}; refusing {}", maxCalls, label, name);
            return -1;
        }
        listener.onToolStart(name, index, maxCalls);
        return index;
    }

    void recordCall(@Nullable String name, @Nullable String input, @Nullable String output, long durationMs) {
        String safeName = StringUtils.hasText(name) ? name : "unknown";
        SubInvocation invocation = parseInvocation(safeName, input, output, durationMs);
        calls.add(invocation);
        log.info("Tool call: name={}, request={}, durationMs={}, inputSnippet={}",
                safeName, label, durationMs, truncate(input));
        String chunk = "$ " + safeName + "\n" + invocation.output() + "\n";
        synchronized (this) {
            stdout.append(chunk);
            if (StringUtils.hasText(invocation.stderr())) {
                stderr.append("[").append(safeName).append("] ").append(invocation.stderr()).append('\n');
            }
        }
        if (!closed) {
            listener.onOutput(chunk);
            listener.onToolComplete(safeName, durationMs);
            int done = calls.size();
            listener.onProgress(Math.min(95, done * 100 / Math.max(1, maxCalls)), label);
        }
    }

    void recordFailure(@Nullable String name, @Nullable String input, String message, long durationMs) {
        String safeName = StringUtils.hasText(name) ? name : "unknown";
        recordCall(safeName, input, SubInvocation.ERROR_MARKER + " " + message, durationMs);
    }

    int count() {
        return calls.size();
    }

    public List<SubInvocation> snapshot() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    public synchronized String stdout() {
        return stdout.toString();
    }

    public synchronized String stderr() {
        return stderr.toString();
    }

    /**
     * Stops relaying callbacks, e.g. after the request timed out and its owner moved on.
     */
    public void close() {
        closed = true;
    }

    private SubInvocation parseInvocation(String name, @Nullable String input, @Nullable String output, long durationMs) {
        String text = unwrapContent(output);
        JsonNode node = jsonProcessingService.readObject(name, text);
        if (node != null && (node.has("stdout") || node.has("stderr") || node.has("return_code"))) {
            Integer exitCode = null;
            if (node.hasNonNull("return_code")) {
                exitCode = node.get("return_code").asInt();
            } else if (node.hasNonNull("exit_code")) {
                exitCode = node.get("exit_code").asInt();
            }
            return new SubInvocation(name, input == null ? "" : input,
                    node.path("stdout").asText(""), node.path("stderr").asText(""), exitCode, durationMs);
        }
        return new SubInvocation(name, input == null ? "" : input, text, "", null, durationMs);
    }

    /**
     * MCP results arrive as a list of content parts; joins the text parts.
     */
    private String unwrapContent(@Nullable String output) {
        if (!StringUtils.hasText(output)) {
            return "";
        }
        String trimmed = output.trim();
        if (!trimmed.startsWith("[") && !trimmed.startsWith("{\"content\"")) {
            return trimmed;
        }
        JsonNode root = jsonProcessingService.readTree(label, trimmed);
        JsonNode parts = root == null ? null : (root.isArray() ? root : root.get("content"));
        if (parts == null || !parts.isArray()) {
            return trimmed;
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            if (part.hasNonNull("text")) {
                if (text.length() > 0) {
                    text.append('\n');
                }
                text.append(part.get("text").asText());
            }
        }
        return text.length() == 0 ? trimmed : text.toString();
    }

    private String truncate(@Nullable String value) {
        if (!StringUtils.hasText(value)) {
            return "";
        }
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_SNIPPET) {
            return normalized;
        }
        return normalized.substring(0, MAX_SNIPPET) + "...";
    }
}
