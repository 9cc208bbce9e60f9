package com.scanops.workflow;

import com.scanops.entity.WorkflowObjective;
import org.springframework.lang.Nullable;

public record CreateWorkflowCommand(String userId, @Nullable String name, String target,
                                    WorkflowObjective objective, int maxSteps) {
}
