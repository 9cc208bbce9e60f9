package com.scanops.runs;

import com.scanops.entity.ArtifactType;
import com.scanops.entity.Run;
import com.scanops.entity.RunArtifact;
import com.scanops.entity.RunStatus;
import org.springframework.lang.Nullable;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Detached read model of a run, built inside a transaction so lazy associations are resolved.
 */
public record RunView(
        UUID id,
        String userId,
        String toolSlug,
        String toolName,
        @Nullable UUID scopeId,
        String target,
        Map<String, Object> params,
        RunStatus status,
        @Nullable Integer exitCode,
        @Nullable Long durationSeconds,
        @Nullable String error,
        @Nullable UUID workflowSessionId,
        OffsetDateTime createdAt,
        @Nullable OffsetDateTime startedAt,
        @Nullable OffsetDateTime completedAt,
        List<ArtifactSummary> artifacts
) {

    public record ArtifactSummary(ArtifactType type, String mimeType, long size) {
    }

    static RunView from(Run run, List<RunArtifact> artifacts) {
        return new RunView(
                run.getId(),
                run.getUserId(),
                run.getTool().getSlug(),
                run.getTool().getName(),
                run.getScope() == null ? null : run.getScope().getId(),
                run.getTarget(),
                run.getParams() == null ? Map.of() : new LinkedHashMap<>(run.getParams()),
                run.getStatus(),
                run.getExitCode(),
                run.getDurationSeconds(),
                run.getError(),
                run.getWorkflowSessionId(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getCompletedAt(),
                artifacts.stream()
                        .map(a -> new ArtifactSummary(a.getType(), a.getMimeType(), a.getSize()))
                        .toList());
    }
}
