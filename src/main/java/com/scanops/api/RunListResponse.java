package com.scanops.api;

import com.scanops.runs.RunView;
import org.springframework.data.domain.Page;

import java.util.List;

public record RunListResponse(
        List<RunView> runs,
        long total,
        int limit,
        int offset
) {
    public static RunListResponse from(Page<RunView> page, int offset) {
        return new RunListResponse(page.getContent(), page.getTotalElements(), page.getSize(), offset);
    }
}
