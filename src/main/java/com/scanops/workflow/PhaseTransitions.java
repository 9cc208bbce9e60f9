package com.scanops.workflow;

import com.scanops.entity.WorkflowPhase;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Transition table of the workflow phase machine. The final report has no successor.
 */
public final class PhaseTransitions {

    private static final Map<WorkflowPhase, WorkflowPhase> NEXT = new EnumMap<>(WorkflowPhase.class);

    static {
        NEXT.put(WorkflowPhase.INTELLIGENCE_PLANNING, WorkflowPhase.AUTOMATED_SCAN);
        NEXT.put(WorkflowPhase.AUTOMATED_SCAN, WorkflowPhase.DEEP_RECONNAISSANCE);
        NEXT.put(WorkflowPhase.DEEP_RECONNAISSANCE, WorkflowPhase.VULNERABILITY_SCANNING);
        NEXT.put(WorkflowPhase.VULNERABILITY_SCANNING, WorkflowPhase.EXPLOITATION_CHAIN);
        NEXT.put(WorkflowPhase.EXPLOITATION_CHAIN, WorkflowPhase.FINAL_REPORT);
    }

    private PhaseTransitions() {
    }

    public static WorkflowPhase first() {
        return WorkflowPhase.INTELLIGENCE_PLANNING;
    }

    public static Optional<WorkflowPhase> next(WorkflowPhase phase) {
        return Optional.ofNullable(NEXT.get(phase));
    }
}
