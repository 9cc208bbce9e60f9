package com.scanops.workflow;

import com.scanops.entity.Finding;
import com.scanops.entity.Severity;
import com.scanops.entity.WorkflowPhase;
import com.scanops.execution.SubInvocation;
import com.scanops.execution.ToolExecutionResult;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the result of one workflow phase into unsaved findings: one for the phase analysis and one
 * per backend call whose output looks security relevant.
 */
public final class FindingSynthesizer {

    static final int DESCRIPTION_LIMIT = 2000;
    static final int PHASE_EVIDENCE_LIMIT = 5000;
    static final int TOOL_EVIDENCE_LIMIT = 3000;
    static final int MIN_TOOL_OUTPUT = 100;

    private static final Pattern CVE = Pattern.compile("CVE-\\d{4}-\\d{4,}", Pattern.CASE_INSENSITIVE);
    private static final Pattern CWE = Pattern.compile("CWE-\\d+", Pattern.CASE_INSENSITIVE);
    private static final List<String> TOOL_SIGNALS = List.of("vulnerable", "critical", "warning");

    private FindingSynthesizer() {
    }

    public static List<Finding> fromPhase(WorkflowPhase phase, String target, ToolExecutionResult result) {
        List<Finding> findings = new ArrayList<>();
        String analysis = result.analysis();
        if (StringUtils.hasText(analysis)) {
            AnalysisExtraction extraction = AnalysisTextExtractor.extract(analysis);
            String evidenceSource = result.stdout() + "\n" + analysis;
            findings.add(base(phase, target, extraction, evidenceSource)
                    .severity(SeverityClassifier.classify(analysis))
                    .title(phase.title() + " - Security Analysis")
                    .description(truncate(analysis, DESCRIPTION_LIMIT))
                    .evidence(truncate(result.stdout(), PHASE_EVIDENCE_LIMIT))
                    .tool(phase.name().toLowerCase(Locale.ROOT))
                    .build());
        }
        for (SubInvocation invocation : result.subInvocations()) {
            toolFinding(phase, target, invocation).ifPresent(findings::add);
        }
        return findings;
    }

    /**
     * Finding recorded when a phase throws, so the failure stays visible in the report.
     */
    public static Finding fromFailure(WorkflowPhase phase, String target, String error, String solution) {
        return Finding.builder()
                .severity(phase.failureSeverity())
                .title(phase.title() + " - Phase Failed")
                .description("The phase could not complete: " + error)
                .evidence(error)
                .remediation(solution)
                .category(phase.category())
                .tool(phase.name().toLowerCase(Locale.ROOT))
                .target(target)
                .extractionRecognized(false)
                .build();
    }

    static Optional<Finding> toolFinding(WorkflowPhase phase, String target, SubInvocation invocation) {
        String output = invocation.output();
        if (output.length() <= MIN_TOOL_OUTPUT) {
            return Optional.empty();
        }
        String lower = output.toLowerCase(Locale.ROOT);
        if (TOOL_SIGNALS.stream().noneMatch(lower::contains)) {
            return Optional.empty();
        }
        Severity severity = lower.contains("critical") ? Severity.CRITICAL
                : lower.contains("vulnerable") ? Severity.HIGH
                : Severity.MEDIUM;
        AnalysisExtraction extraction = AnalysisTextExtractor.extract(output);
        return Optional.of(base(phase, target, extraction, output)
                .severity(severity)
                .title(invocation.name() + " - Potential Issue Detected")
                .description("Output of " + invocation.name() + " during " + phase.title()
                        + " contains indicators of a security issue.")
                .evidence(truncate(output, TOOL_EVIDENCE_LIMIT))
                .tool(invocation.name())
                .build());
    }

    private static Finding.FindingBuilder base(WorkflowPhase phase, String target,
                                               AnalysisExtraction extraction, String idSource) {
        return Finding.builder()
                .remediation(extraction.remediation())
                .exploitation(extraction.exploitation())
                .verification(extraction.verification())
                .extractionRecognized(extraction.recognized())
                .category(phase.category())
                .target(target)
                .cveId(firstMatch(CVE, idSource))
                .cweId(firstMatch(CWE, idSource));
    }

    @Nullable
    static String firstMatch(Pattern pattern, @Nullable String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group().toUpperCase(Locale.ROOT) : null;
    }

    private static String truncate(@Nullable String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
