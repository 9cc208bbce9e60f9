package com.scanops.workflow;

import com.scanops.entity.Finding;
import com.scanops.entity.Severity;
import org.springframework.lang.Nullable;

import java.time.OffsetDateTime;
import java.util.UUID;

public record FindingView(
        UUID id,
        Severity severity,
        String title,
        @Nullable String description,
        @Nullable String evidence,
        @Nullable String remediation,
        @Nullable String exploitation,
        @Nullable String verification,
        @Nullable String category,
        @Nullable String tool,
        @Nullable String target,
        @Nullable String cveId,
        @Nullable String cweId,
        boolean extractionRecognized,
        OffsetDateTime createdAt
) {
    static FindingView from(Finding finding) {
        return new FindingView(finding.getId(), finding.getSeverity(), finding.getTitle(),
                finding.getDescription(), finding.getEvidence(), finding.getRemediation(),
                finding.getExploitation(), finding.getVerification(), finding.getCategory(),
                finding.getTool(), finding.getTarget(), finding.getCveId(), finding.getCweId(),
                finding.isExtractionRecognized(), finding.getCreatedAt());
    }
}
