package com.scanops.workflow;

import java.util.UUID;

public record CancelOutcome(UUID sessionId, boolean alreadyCancelled, String message) {

    public static CancelOutcome cancelled(UUID sessionId) {
        return new CancelOutcome(sessionId, false, "Workflow cancelled");
    }

    public static CancelOutcome alreadyCancelled(UUID sessionId) {
        return new CancelOutcome(sessionId, true, "Workflow already cancelled");
    }
}
