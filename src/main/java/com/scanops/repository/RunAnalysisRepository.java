package com.scanops.repository;

import com.scanops.entity.RunAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link RunAnalysis} entities.
 */
public interface RunAnalysisRepository extends JpaRepository<RunAnalysis, UUID> {

    Optional<RunAnalysis> findByRunId(UUID runId);

    @Modifying(flushAutomatically = true)
    @Query("delete from RunAnalysis a where a.run.id = :runId")
    int deleteByRunId(@Param("runId") UUID runId);
}
