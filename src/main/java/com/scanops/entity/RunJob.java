package com.scanops.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Durable queue entry for a submitted run. Rows are claimed oldest first by the single worker.
 */
@Entity
@Table(name = "run_job")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private RunJobStatus status;

    @CreationTimestamp
    @Column(name = "enqueued_at", nullable = false, updatable = false)
    private OffsetDateTime enqueuedAt;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "finished_at")
    private OffsetDateTime finishedAt;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;
}
