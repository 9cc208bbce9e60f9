package com.scanops.repository;

import com.scanops.entity.ArtifactType;
import com.scanops.entity.RunArtifact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link RunArtifact} entities.
 */
public interface RunArtifactRepository extends JpaRepository<RunArtifact, UUID> {

    Optional<RunArtifact> findByRunIdAndType(UUID runId, ArtifactType type);

    List<RunArtifact> findByRunIdOrderByCreatedAtAsc(UUID runId);

    long countByRunId(UUID runId);

    @Modifying(flushAutomatically = true)
    @Query("delete from RunArtifact a where a.run.id = :runId")
    int deleteByRunId(@Param("runId") UUID runId);
}
