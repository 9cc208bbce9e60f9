package com.scanops.execution;

public record BackendResetResult(boolean success, String message) {
}
