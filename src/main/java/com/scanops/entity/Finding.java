package com.scanops.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "finding")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Finding {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id")
    private Run run;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id")
    private WorkflowSession session;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", length = 20, nullable = false)
    private Severity severity;

    @Column(name = "title", length = 500, nullable = false)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "evidence", columnDefinition = "TEXT")
    private String evidence;

    @Column(name = "remediation", columnDefinition = "TEXT")
    private String remediation;

    @Column(name = "exploitation", columnDefinition = "TEXT")
    private String exploitation;

    @Column(name = "verification", columnDefinition = "TEXT")
    private String verification;

    @Column(name = "category", length = 50)
    private String category;

    @Column(name = "tool", length = 100)
    private String tool;

    @Column(name = "target", length = 255)
    private String target;

    @Column(name = "cve_id", length = 30)
    private String cveId;

    @Column(name = "cwe_id", length = 30)
    private String cweId;

    @Column(name = "extraction_recognized", nullable = false)
    private boolean extractionRecognized;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
