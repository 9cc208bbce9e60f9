package com.scanops.workflow;

import java.util.Map;

/**
 * Aggregated outcome of a session, computed from its findings by {@link WorkflowReportBuilder}.
 */
public record WorkflowReport(
        int totalVulnerabilities,
        int criticalVulnerabilities,
        int highVulnerabilities,
        int mediumVulnerabilities,
        int lowVulnerabilities,
        int infoFindings,
        int riskScore,
        Map<String, Object> document,
        String stdoutSummary,
        String analysisSummary,
        String observations
) {
}
