package com.scanops.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Single row naming the workflow session that currently holds the run slot.
 * A null session id means the slot is free.
 */
@Entity
@Table(name = "active_workflow_marker")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActiveWorkflowMarker {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "id")
    private Integer id;

    @Column(name = "session_id")
    private UUID sessionId;

    @Column(name = "claimed_at")
    private OffsetDateTime claimedAt;
}
