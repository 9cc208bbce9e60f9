package com.scanops.repository;

import com.scanops.entity.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * Repository interface for managing {@link AuditLog} entities.
 */
public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {
}
