package com.scanops.workflow;

import com.scanops.entity.WorkflowObjective;

import java.util.UUID;

/**
 * What the workflow driver needs about its session, read once before the phase loop.
 */
record DriverContext(UUID sessionId, UUID runId, String userId, String target,
                     WorkflowObjective objective, int maxSteps) {
}
