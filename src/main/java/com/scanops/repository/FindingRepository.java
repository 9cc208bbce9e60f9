package com.scanops.repository;

import com.scanops.entity.Finding;
import com.scanops.entity.Run;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link Finding} entities.
 * Findings belong to a run, a workflow session, or both once a session report has been attached to its run.
 */
public interface FindingRepository extends JpaRepository<Finding, UUID> {

    List<Finding> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);

    List<Finding> findByRunIdOrderByCreatedAtAsc(UUID runId);

    long countBySessionId(UUID sessionId);

    long countByRunId(UUID runId);

    @Modifying(flushAutomatically = true)
    @Query("update Finding f set f.run = :run where f.session.id = :sessionId")
    int attachSessionFindingsToRun(@Param("sessionId") UUID sessionId, @Param("run") Run run);

    @Modifying(flushAutomatically = true)
    @Query("delete from Finding f where f.session.id = :sessionId")
    int deleteBySessionId(@Param("sessionId") UUID sessionId);

    @Modifying(flushAutomatically = true)
    @Query("delete from Finding f where f.run.id = :runId")
    int deleteByRunId(@Param("runId") UUID runId);

    @Modifying(flushAutomatically = true)
    @Query("delete from Finding f where f.session.id = :sessionId and f.tool = :tool")
    int deleteBySessionIdAndTool(@Param("sessionId") UUID sessionId, @Param("tool") String tool);
}
