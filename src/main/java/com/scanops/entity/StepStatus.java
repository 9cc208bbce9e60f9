package com.scanops.entity;

public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED,
    TIMEOUT;

    public boolean isOpen() {
        return this == PENDING || this == RUNNING;
    }
}
