package com.scanops.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "workflow_session")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkflowSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(name = "name", length = 200)
    private String name;

    @Column(name = "target", length = 255, nullable = false)
    private String target;

    @Enumerated(EnumType.STRING)
    @Column(name = "objective", length = 20, nullable = false)
    private WorkflowObjective objective;

    @Column(name = "max_steps", nullable = false)
    private int maxSteps;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private WorkflowStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_phase", length = 40)
    private WorkflowPhase currentPhase;

    @Column(name = "progress", nullable = false)
    private int progress;

    @Column(name = "risk_score", nullable = false)
    private int riskScore;

    @Column(name = "total_vulnerabilities", nullable = false)
    private int totalVulnerabilities;

    @Column(name = "critical_vulnerabilities", nullable = false)
    private int criticalVulnerabilities;

    @Column(name = "high_vulnerabilities", nullable = false)
    private int highVulnerabilities;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "report")
    private Map<String, Object> report;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", unique = true)
    private Run run;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;
}
