package com.scanops.runs;

import java.util.UUID;

/**
 * Published after a run that belongs to a workflow session was stopped directly, so the session can follow.
 */
public record BoundRunCancelledEvent(UUID sessionId, UUID runId, String userId) {
}
