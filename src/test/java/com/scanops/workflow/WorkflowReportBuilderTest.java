package com.scanops.workflow;

import com.scanops.entity.Finding;
import com.scanops.entity.Severity;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowReportBuilderTest {

    @Test
    void testRiskScoreIsWeightedSum() {
        List<Finding> findings = List.of(finding(Severity.CRITICAL), finding(Severity.HIGH),
                finding(Severity.MEDIUM), finding(Severity.LOW), finding(Severity.INFO));

        assertEquals(22, WorkflowReportBuilder.riskScore(findings));
    }

    @Test
    void testRiskScoreIsCapped() {
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            findings.add(finding(Severity.CRITICAL));
        }
        assertEquals(WorkflowReportBuilder.MAX_RISK_SCORE, WorkflowReportBuilder.riskScore(findings));
        assertEquals(0, WorkflowReportBuilder.riskScore(List.of()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testReportCountsAndDocument() {
        OffsetDateTime started = OffsetDateTime.of(2026, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC);
        List<Finding> findings = List.of(finding(Severity.HIGH), finding(Severity.HIGH), finding(Severity.INFO));

        WorkflowReport report = WorkflowReportBuilder.build("10.0.0.1", findings, started, started.plusSeconds(90));

        assertEquals(3, report.totalVulnerabilities());
        assertEquals(2, report.highVulnerabilities());
        assertEquals(0, report.criticalVulnerabilities());
        assertEquals(1, report.infoFindings());
        assertEquals(14, report.riskScore());
        Map<String, Object> summary = (Map<String, Object>) report.document().get("summary");
        assertEquals(90_000L, summary.get("scanDuration"));
        assertEquals(3, ((List<?>) report.document().get("findings")).size());
        assertEquals(WorkflowReportBuilder.RECOMMENDATIONS, report.document().get("recommendations"));
        assertTrue(report.stdoutSummary().contains("Risk Score: 14/100"));
        assertEquals(3, report.observations().split("\n").length);
    }

    @Test
    void testEmptyReport() {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);

        WorkflowReport report = WorkflowReportBuilder.build("10.0.0.1", List.of(), null, now);

        assertEquals(0, report.totalVulnerabilities());
        assertEquals(0, report.riskScore());
        assertEquals("", report.observations());
        assertEquals(5, WorkflowReportBuilder.countBySeverity(List.of()).size());
    }

    private static Finding finding(Severity severity) {
        return Finding.builder().severity(severity).title(severity + " issue").description("details").build();
    }
}
