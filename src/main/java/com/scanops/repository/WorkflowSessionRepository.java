package com.scanops.repository;

import com.scanops.entity.WorkflowSession;
import com.scanops.entity.WorkflowStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link WorkflowSession} entities.
 */
public interface WorkflowSessionRepository extends JpaRepository<WorkflowSession, UUID> {

    /**
     * Loads a session holding a row lock so that step updates and cancellation serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from WorkflowSession s where s.id = :id")
    Optional<WorkflowSession> findForUpdate(@Param("id") UUID id);

    List<WorkflowSession> findByStatus(WorkflowStatus status);

    Optional<WorkflowSession> findFirstByStatusOrderByCreatedAtAsc(WorkflowStatus status);

    /**
     * Counts sessions of the given status created strictly before the given instant; used for queue positions.
     */
    long countByStatusAndCreatedAtBefore(WorkflowStatus status, OffsetDateTime createdAt);

    Page<WorkflowSession> findByUserId(String userId, Pageable pageable);

    Page<WorkflowSession> findByUserIdAndStatusIn(String userId, Collection<WorkflowStatus> statuses, Pageable pageable);

    @Query("select s.status as status, count(s) as total from WorkflowSession s "
            + "where s.userId = :userId group by s.status")
    List<StatusCount> countByStatusForUser(@Param("userId") String userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from WorkflowSession s where s.id = :id")
    int deleteSession(@Param("id") UUID id);

    interface StatusCount {
        WorkflowStatus getStatus();

        long getTotal();
    }
}
