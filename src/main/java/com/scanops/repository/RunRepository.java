package com.scanops.repository;

import com.scanops.entity.Run;
import com.scanops.entity.RunStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link Run} entities.
 */
public interface RunRepository extends JpaRepository<Run, UUID> {

    /**
     * Loads a run holding a row lock so that concurrent status transitions serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Run r where r.id = :id")
    Optional<Run> findForUpdate(@Param("id") UUID id);

    Page<Run> findByUserId(String userId, Pageable pageable);

    Page<Run> findByUserIdAndStatus(String userId, RunStatus status, Pageable pageable);

    Page<Run> findByStatus(RunStatus status, Pageable pageable);

    Optional<Run> findByWorkflowSessionId(UUID workflowSessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Run r where r.id = :id")
    int deleteRun(@Param("id") UUID id);
}
