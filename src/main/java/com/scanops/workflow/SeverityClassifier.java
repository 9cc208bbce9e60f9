package com.scanops.workflow;

import com.scanops.entity.Severity;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Keyword based severity of a free-text analysis. The first matching tier wins, highest first.
 */
public final class SeverityClassifier {

    private static final List<Tier> TIERS = List.of(
            new Tier(Severity.CRITICAL, List.of("critical", "rce", "remote code")),
            new Tier(Severity.HIGH, List.of("high", "sql injection", "xss")),
            new Tier(Severity.MEDIUM, List.of("medium", "open port", "vulnerability")),
            new Tier(Severity.LOW, List.of("low", "information disclosure")));

    private SeverityClassifier() {
    }

    public static Severity classify(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return Severity.INFO;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Tier tier : TIERS) {
            if (tier.keywords().stream().anyMatch(lower::contains)) {
                return tier.severity();
            }
        }
        return Severity.INFO;
    }

    private record Tier(Severity severity, List<String> keywords) {
    }
}
