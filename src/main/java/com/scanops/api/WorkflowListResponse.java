package com.scanops.api;

import com.scanops.workflow.WorkflowView;
import org.springframework.data.domain.Page;

import java.util.List;

public record WorkflowListResponse(
        List<WorkflowView> sessions,
        long total,
        int limit,
        int offset
) {
    public static WorkflowListResponse from(Page<WorkflowView> page, int offset) {
        return new WorkflowListResponse(page.getContent(), page.getTotalElements(), page.getSize(), offset);
    }
}
