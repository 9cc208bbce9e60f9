package com.scanops.api;

import com.scanops.entity.Run;
import com.scanops.entity.RunStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RunResponse(
        UUID id,
        RunStatus status,
        String tool,
        String target,
        OffsetDateTime createdAt
) {
    public static RunResponse from(Run run) {
        return new RunResponse(run.getId(), run.getStatus(), run.getTool().getSlug(), run.getTarget(), run.getCreatedAt());
    }
}
