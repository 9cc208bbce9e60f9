package com.scanops.workflow;

import com.scanops.entity.StepStatus;
import com.scanops.entity.WorkflowPhase;
import org.springframework.lang.Nullable;

import java.util.Locale;

/**
 * Human readable impact and remediation hints attached to a failed or timed out step.
 */
public final class StepErrorAdvisor {

    private StepErrorAdvisor() {
    }

    public static String impact(WorkflowPhase phase, StepStatus status) {
        String outcome = status == StepStatus.TIMEOUT ? "timed out" : "failed";
        return switch (phase) {
            case INTELLIGENCE_PLANNING -> "Target profiling " + outcome
                    + "; later phases run without a tailored plan.";
            case AUTOMATED_SCAN -> "Port and service discovery " + outcome
                    + "; exposed services may be missing from the report.";
            case DEEP_RECONNAISSANCE -> "Deep reconnaissance " + outcome
                    + "; subdomains and endpoints may be under-reported.";
            case VULNERABILITY_SCANNING -> "Vulnerability assessment " + outcome
                    + "; known vulnerabilities may be missing from the report.";
            case EXPLOITATION_CHAIN -> "Attack chain analysis " + outcome
                    + "; findings are reported without correlation.";
            case FINAL_REPORT -> "Report generation " + outcome + "; the session has no summary.";
        };
    }

    public static String solution(StepStatus status, @Nullable String error) {
        if (status == StepStatus.TIMEOUT) {
            return "Increase the timeout or reduce the tool budget (maxSteps) and run the workflow again.";
        }
        String lower = error == null ? "" : error.toLowerCase(Locale.ROOT);
        if (lower.contains("connection") || lower.contains("refused") || lower.contains("unreachable")) {
            return "Check that the scan backend is running and reachable, then run the workflow again.";
        }
        if (lower.contains("budget")) {
            return "Raise maxSteps so the phase can make more tool calls.";
        }
        if (lower.contains("permission") || lower.contains("denied") || lower.contains("unauthorized")) {
            return "Verify the credentials of the model provider and the scan backend.";
        }
        return "Inspect the step error and the run output, then run the workflow again.";
    }
}
