package com.scanops.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.tool.metadata.ToolMetadata;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.concurrent.Callable;

/**
 * Wraps a backend tool so every call is timed, recorded in the request's {@link ToolCallAudit} and
 * counted against its budget. Tool failures are reported back to the model as error text instead of
 * aborting the whole request.
 */
@Slf4j
final class AuditedToolCallback implements ToolCallback {

    private final ToolCallback delegate;
    private final ToolCallAudit audit;
    private final ObjectMapper objectMapper = new ObjectMapper();

    AuditedToolCallback(ToolCallback delegate, ToolCallAudit audit) {
        this.delegate = delegate;
        this.audit = audit;
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return delegate.getToolDefinition();
    }

    @Override
    public ToolMetadata getToolMetadata() {
        return delegate.getToolMetadata();
    }

    @Override
    public String call(String input) {
        return executeWithAudit(input, () -> delegate.call(input));
    }

    @Override
    public String call(String input, ToolContext toolContext) {
        return executeWithAudit(input, () -> delegate.call(input, toolContext));
    }

    String resolveToolName() {
        String fromDef = reflectName(delegate.getToolDefinition());
        if (StringUtils.hasText(fromDef)) {
            return fromDef;
        }
        String fromMeta = reflectName(delegate.getToolMetadata());
        if (StringUtils.hasText(fromMeta)) {
            return fromMeta;
        }
        ToolDefinition def = delegate.getToolDefinition();
        return def != null ? def.toString() : "unknown";
    }

    private String executeWithAudit(String input, Callable<String> call) {
        String toolName = resolveToolName();
        if (audit.begin(toolName) < 0) {
            return fallbackJsonResponse(SubInvocation.ERROR_MARKER
                    + " tool call budget exhausted. Summarize the results gathered so far.");
        }
        long started = System.nanoTime();
        try {
            String output = call.call();
            audit.recordCall(toolName, input, output, elapsedMs(started));
            return output;
        } catch (Exception ex) {
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            log.warn("Tool {} failed: {}", toolName, message);
            audit.recordFailure(toolName, input, message, elapsedMs(started));
            return fallbackJsonResponse(SubInvocation.ERROR_MARKER + " " + message);
        }
    }

    private long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private String fallbackJsonResponse(String message) {
        try {
            ObjectNode root = objectMapper.createObjectNode();
            ArrayNode content = root.putArray("content");
            ObjectNode text = content.addObject();
            text.put("type", "text");
            text.put("text", message);
            return objectMapper.writeValueAsString(root);
        } catch (Exception ex) {
            return "{\"content\":[{\"type\":\"text\",\"text\":\"" + message.replace("\"", "\\\"") + "\"}]}";
        }
    }

    static String reflectName(@Nullable Object target) {
        if (target == null) {
            return "";
        }
        for (String method : java.util.List.of("getName", "name", "id")) {
            try {
                java.lang.reflect.Method m = target.getClass().getMethod(method);
                Object value = m.invoke(target);
                if (value instanceof String name && StringUtils.hasText(name)) {
                    return name;
                }
            } catch (Exception ignore) {
                // accessor not present on this implementation
            }
        }
        return "";
    }
}
