package com.scanops.audit;

import com.scanops.entity.AuditLog;
import com.scanops.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget audit sink. Callers hold no transaction, so each entry commits on its own, and a
 * failed write is logged and never reaches the caller.
 */
@Service
@Slf4j
public class AuditLogService {

    public static final String RESOURCE_RUN = "run";
    public static final String RESOURCE_WORKFLOW = "workflow_session";

    private final AuditLogRepository auditLogRepository;

    public AuditLogService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    public void record(@Nullable String userId, String action, String resourceType,
                       @Nullable Object resourceId, @Nullable String details) {
        try {
            auditLogRepository.save(AuditLog.builder()
                    .userId(userId)
                    .action(action)
                    .resourceType(resourceType)
                    .resourceId(resourceId == null ? null : resourceId.toString())
                    .details(details)
                    .build());
        } catch (Exception ex) {
            log.debug("Failed to write audit entry {} for {} {}: {}", action, resourceType, resourceId, ex.getMessage());
        }
    }
}
