package com.scanops.api;

import com.scanops.entity.Run;
import com.scanops.entity.RunStatus;

import java.util.UUID;

public record StopRunResponse(
        UUID id,
        RunStatus status,
        String message
) {
    public static StopRunResponse from(Run run) {
        return new StopRunResponse(run.getId(), run.getStatus(), run.getError());
    }
}
