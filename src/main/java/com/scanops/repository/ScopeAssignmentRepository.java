package com.scanops.repository;

import com.scanops.entity.ScopeAssignment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * Repository interface for managing {@link ScopeAssignment} entities.
 */
public interface ScopeAssignmentRepository extends JpaRepository<ScopeAssignment, UUID> {

    boolean existsByUserIdAndScopeId(String userId, UUID scopeId);
}
