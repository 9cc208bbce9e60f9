package com.scanops.repository;

import com.scanops.entity.WorkflowStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link WorkflowStep} entities.
 */
public interface WorkflowStepRepository extends JpaRepository<WorkflowStep, UUID> {

    List<WorkflowStep> findBySessionIdOrderByStepNumberAsc(UUID sessionId);

    Optional<WorkflowStep> findBySessionIdAndStepNumber(UUID sessionId, int stepNumber);

    long countBySessionId(UUID sessionId);

    @Modifying(flushAutomatically = true)
    @Query("delete from WorkflowStep s where s.session.id = :sessionId")
    int deleteBySessionId(@Param("sessionId") UUID sessionId);
}
