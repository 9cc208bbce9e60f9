package com.scanops.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WorkflowObjective {
    QUICK,
    COMPREHENSIVE,
    STEALTH,
    AGGRESSIVE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowObjective fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return COMPREHENSIVE;
        }
        return WorkflowObjective.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
