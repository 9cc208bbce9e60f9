package com.scanops.workflow;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls remediation, exploitation and verification sections out of a model analysis. A section starts
 * at its first matching label and runs to the next blank line.
 */
public final class AnalysisTextExtractor {

    public static final String FALLBACK_REMEDIATION =
            "Review the findings and apply appropriate security controls based on the analysis.";

    static final int REMEDIATION_LIMIT = 1000;
    static final int EXPLOITATION_LIMIT = 1500;
    static final int VERIFICATION_LIMIT = 1500;

    private static final List<Pattern> REMEDIATION = patterns(
            "remediation", "recommendations?", "fix", "mitigation");
    private static final List<Pattern> EXPLOITATION = patterns(
            "exploitation", "attack vector", "how to exploit", "poc", "proof of concept", "exploit", "impact");
    private static final List<Pattern> VERIFICATION = patterns(
            "verification", "verify", "test commands?", "validation", "check", "confirm");

    private AnalysisTextExtractor() {
    }

    public static AnalysisExtraction extract(@Nullable String analysis) {
        if (!StringUtils.hasText(analysis)) {
            return new AnalysisExtraction.Unparsed(analysis == null ? "" : analysis);
        }
        Optional<String> remediation = section(analysis, REMEDIATION, REMEDIATION_LIMIT);
        Optional<String> exploitation = section(analysis, EXPLOITATION, EXPLOITATION_LIMIT);
        Optional<String> verification = section(analysis, VERIFICATION, VERIFICATION_LIMIT);
        if (remediation.isEmpty() && exploitation.isEmpty() && verification.isEmpty()) {
            return new AnalysisExtraction.Unparsed(analysis);
        }
        return new AnalysisExtraction.Recognized(
                remediation.orElse(FALLBACK_REMEDIATION),
                exploitation.orElse(null),
                verification.orElse(null));
    }

    private static Optional<String> section(String analysis, List<Pattern> labels, int limit) {
        for (Pattern label : labels) {
            Matcher matcher = label.matcher(analysis);
            if (matcher.find()) {
                String body = matcher.group(1).trim();
                if (!body.isEmpty()) {
                    return Optional.of(body.length() > limit ? body.substring(0, limit) : body);
                }
            }
        }
        return Optional.empty();
    }

    // labels are regular expressions
    private static List<Pattern> patterns(String... labels) {
        return Arrays.stream(labels)
                .map(label -> Pattern.compile(label + "[:\\s]*([\\s\\S]*?)(?:\\n\\n|$)",
                        Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
