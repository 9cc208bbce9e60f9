package com.scanops.repository;

import com.scanops.entity.Scope;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * Repository interface for managing {@link Scope} entities.
 */
public interface ScopeRepository extends JpaRepository<Scope, UUID> {
}
