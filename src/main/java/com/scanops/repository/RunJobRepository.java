package com.scanops.repository;

import com.scanops.entity.RunJob;
import com.scanops.entity.RunJobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link RunJob} queue entries.
 */
public interface RunJobRepository extends JpaRepository<RunJob, UUID> {

    Optional<RunJob> findFirstByStatusOrderByEnqueuedAtAsc(RunJobStatus status);

    List<RunJob> findByStatus(RunJobStatus status);

    /**
     * Removes the queued entry of a run if the worker has not claimed it yet.
     *
     * @return the number of removed rows, 0 when the job already started or never existed
     */
    @Modifying(flushAutomatically = true)
    @Query("delete from RunJob j where j.runId = :runId and j.status = com.scanops.entity.RunJobStatus.QUEUED")
    int deleteQueuedByRunId(@Param("runId") UUID runId);

    @Modifying(flushAutomatically = true)
    @Query("delete from RunJob j where j.runId = :runId")
    int deleteByRunId(@Param("runId") UUID runId);
}
