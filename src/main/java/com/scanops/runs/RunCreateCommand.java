package com.scanops.runs;

import com.scanops.entity.Scope;
import com.scanops.entity.Tool;
import org.springframework.lang.Nullable;

import java.util.Map;

public record RunCreateCommand(String userId, Tool tool, @Nullable Scope scope, String target, Map<String, Object> params) {
}
