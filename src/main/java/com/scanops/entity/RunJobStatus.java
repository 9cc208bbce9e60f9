package com.scanops.entity;

public enum RunJobStatus {
    QUEUED,
    ACTIVE,
    DONE,
    FAILED
}
