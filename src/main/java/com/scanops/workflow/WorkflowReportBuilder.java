package com.scanops.workflow;

import com.scanops.entity.Finding;
import com.scanops.entity.Severity;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class WorkflowReportBuilder {

    public static final int MAX_RISK_SCORE = 100;
    static final int OBSERVATION_COUNT = 10;
    static final int OBSERVATION_DESCRIPTION_LIMIT = 100;

    static final List<String> RECOMMENDATIONS = List.of(
            "Address all critical and high severity vulnerabilities immediately",
            "Implement proper input validation to prevent injection attacks",
            "Regularly update and patch all systems and applications",
            "Conduct regular security assessments and penetration testing");

    private WorkflowReportBuilder() {
    }

    /**
     * Sum of severity weights over all findings, capped at {@value #MAX_RISK_SCORE}.
     */
    public static int riskScore(List<Finding> findings) {
        int score = findings.stream().mapToInt(f -> f.getSeverity().riskWeight()).sum();
        return Math.min(score, MAX_RISK_SCORE);
    }

    public static Map<Severity, Integer> countBySeverity(List<Finding> findings) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0);
        }
        findings.forEach(f -> counts.merge(f.getSeverity(), 1, Integer::sum));
        return counts;
    }

    public static WorkflowReport build(String target, List<Finding> findings,
                                       @Nullable OffsetDateTime startedAt, OffsetDateTime now) {
        Map<Severity, Integer> counts = countBySeverity(findings);
        int riskScore = riskScore(findings);
        long durationMs = startedAt == null ? 0 : Duration.between(startedAt, now).toMillis();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("target", target);
        summary.put("totalVulnerabilities", findings.size());
        summary.put("criticalVulnerabilities", counts.get(Severity.CRITICAL));
        summary.put("highVulnerabilities", counts.get(Severity.HIGH));
        summary.put("mediumVulnerabilities", counts.get(Severity.MEDIUM));
        summary.put("lowVulnerabilities", counts.get(Severity.LOW));
        summary.put("infoFindings", counts.get(Severity.INFO));
        summary.put("riskScore", riskScore);
        summary.put("scanDuration", durationMs);

        List<Map<String, Object>> entries = findings.stream().map(f -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("title", f.getTitle());
            entry.put("severity", f.getSeverity().name());
            entry.put("category", f.getCategory());
            entry.put("description", f.getDescription());
            entry.put("remediation", f.getRemediation());
            return entry;
        }).toList();

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("summary", summary);
        document.put("findings", entries);
        document.put("recommendations", RECOMMENDATIONS);

        String breakdown = "  - Critical: " + counts.get(Severity.CRITICAL) + "\n"
                + "  - High: " + counts.get(Severity.HIGH) + "\n"
                + "  - Medium: " + counts.get(Severity.MEDIUM) + "\n"
                + "  - Low: " + counts.get(Severity.LOW) + "\n"
                + "  - Info: " + counts.get(Severity.INFO) + "\n";
        String stdoutSummary = "\n[Final Report] ============================================\n"
                + "Target: " + target + "\n"
                + "Total Vulnerabilities: " + findings.size() + "\n"
                + breakdown
                + "Risk Score: " + riskScore + "/" + MAX_RISK_SCORE + "\n"
                + "============================================\n";
        String analysisSummary = "Security Assessment for " + target + "\n\n"
                + "Risk Score: " + riskScore + "/" + MAX_RISK_SCORE + "\n\n"
                + "Vulnerabilities Found:\n" + breakdown + "\n"
                + "Total: " + findings.size() + " findings";
        String observations = findings.stream()
                .limit(OBSERVATION_COUNT)
                .map(f -> "[" + f.getSeverity() + "] " + f.getTitle() + ": " + shorten(f.getDescription()))
                .collect(Collectors.joining("\n"));

        return new WorkflowReport(findings.size(), counts.get(Severity.CRITICAL), counts.get(Severity.HIGH),
                counts.get(Severity.MEDIUM), counts.get(Severity.LOW), counts.get(Severity.INFO),
                riskScore, document, stdoutSummary, analysisSummary, observations);
    }

    private static String shorten(@Nullable String description) {
        if (description == null || description.isBlank()) {
            return "No description";
        }
        return description.length() <= OBSERVATION_DESCRIPTION_LIMIT
                ? description
                : description.substring(0, OBSERVATION_DESCRIPTION_LIMIT) + "...";
    }
}
