package com.scanops.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "workflow_step",
        uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "step_number"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkflowStep {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false)
    private WorkflowSession session;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", length = 40, nullable = false)
    private WorkflowPhase phase;

    @Column(name = "step_number", nullable = false)
    private int stepNumber;

    @Column(name = "name", length = 200, nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private StepStatus status;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "error_impact", columnDefinition = "TEXT")
    private String errorImpact;

    @Column(name = "error_solution", columnDefinition = "TEXT")
    private String errorSolution;
}
