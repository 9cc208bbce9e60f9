package com.scanops.stream;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StreamEventType {
    INIT("init"),
    OUTPUT("output"),
    TOOL_START("tool_start"),
    TOOL_COMPLETE("tool_complete"),
    PROGRESS("progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    STEP_UPDATE("step_update"),
    FINDING_ADDED("finding_added"),
    LOG("log");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }
}
