package com.scanops.repository;

import com.scanops.entity.ActiveWorkflowMarker;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Repository for the single-row active workflow marker. Claim and release are conditional updates
 * so only one caller can move the marker from free to taken.
 */
public interface ActiveWorkflowMarkerRepository extends JpaRepository<ActiveWorkflowMarker, Integer> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ActiveWorkflowMarker m set m.sessionId = :sessionId, m.claimedAt = :claimedAt "
            + "where m.id = 1 and m.sessionId is null")
    int claim(@Param("sessionId") UUID sessionId, @Param("claimedAt") OffsetDateTime claimedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ActiveWorkflowMarker m set m.sessionId = null, m.claimedAt = null "
            + "where m.id = 1 and m.sessionId = :sessionId")
    int release(@Param("sessionId") UUID sessionId);
}
