package com.scanops.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ArtifactType {
    STDOUT("stdout", "text/plain"),
    STDERR("stderr", "text/plain"),
    ANALYSIS("analysis", "text/markdown"),
    TOOLS_METADATA("tools_metadata", "application/json");

    private final String wireName;
    private final String mimeType;

    ArtifactType(String wireName, String mimeType) {
        this.wireName = wireName;
        this.mimeType = mimeType;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String mimeType() {
        return mimeType;
    }
}
