package com.scanops.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A ToolCallbackProvider wrapper that filters the delegate provider's callbacks by allowed tool names.
 * Name matching is case-insensitive and tolerates server prefixes such as {@code scan_backend_nmap_scan}
 * or {@code backend.nmap_scan}. If the allowed set is empty, provides no tools.
 */
public class FilteringToolCallbackProvider implements ToolCallbackProvider {

    private static final Logger log = LoggerFactory.getLogger(FilteringToolCallbackProvider.class);
    private final ToolCallbackProvider delegate;
    private final Set<String> allowedNames;

    public FilteringToolCallbackProvider(ToolCallbackProvider delegate, List<String> allowedNames) {
        this.delegate = delegate;
        this.allowedNames = allowedNames == null ? Set.of() : allowedNames.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }

    @Override
    public ToolCallback[] getToolCallbacks() {
        if (delegate == null) return new ToolCallback[0];
        ToolCallback[] callbacks = delegate.getToolCallbacks();
        if (callbacks == null || callbacks.length == 0) return new ToolCallback[0];
        if (allowedNames.isEmpty()) return new ToolCallback[0];
        ToolCallback[] filtered = Arrays.stream(callbacks)
                .filter(this::isAllowed)
                .toArray(ToolCallback[]::new);
        if (filtered.length == 0 && log.isDebugEnabled()) {
            log.debug("Tool filtering removed all callbacks. allowed={}, available={}",
                    allowedNames, describeCallbacks(callbacks));
        }
        return filtered;
    }

    private boolean isAllowed(ToolCallback cb) {
        String name = extractName(cb);
        if (!StringUtils.hasText(name)) return false;
        if (allowedNames.contains(name)) return true;
        for (String allowed : allowedNames) {
            if (name.endsWith("." + allowed) || name.endsWith("/" + allowed)
                    || name.endsWith(":" + allowed) || name.endsWith("_" + allowed)) {
                return true;
            }
        }
        return false;
    }

    private String extractName(ToolCallback cb) {
        if (cb == null) return "";
        String fromDef = AuditedToolCallback.reflectName(cb.getToolDefinition());
        if (!fromDef.isBlank()) return fromDef.trim().toLowerCase(Locale.ROOT);
        String fromMeta = AuditedToolCallback.reflectName(cb.getToolMetadata());
        if (!fromMeta.isBlank()) return fromMeta.trim().toLowerCase(Locale.ROOT);
        String s = cb.toString();
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    private List<String> describeCallbacks(ToolCallback[] callbacks) {
        return Arrays.stream(callbacks)
                .map(this::extractName)
                .filter(name -> !name.isBlank())
                .toList();
    }
}
