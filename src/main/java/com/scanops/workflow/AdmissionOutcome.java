package com.scanops.workflow;

import org.springframework.lang.Nullable;

/**
 * Result of asking for the workflow slot: started now, or waiting at a 1-based queue position.
 */
public record AdmissionOutcome(boolean started, @Nullable Integer queuePosition) {

    public static AdmissionOutcome startedNow() {
        return new AdmissionOutcome(true, null);
    }

    public static AdmissionOutcome queued(int position) {
        return new AdmissionOutcome(false, position);
    }
}
