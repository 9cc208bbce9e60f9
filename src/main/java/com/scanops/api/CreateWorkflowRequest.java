package com.scanops.api;

import com.scanops.entity.WorkflowObjective;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateWorkflowRequest(
        @NotBlank
        @Size(max = 255)
        @Pattern(regexp = "^[a-zA-Z0-9.\\-_:/]+$", message = "target contains invalid characters")
        String target,
        WorkflowObjective objective,
        @Min(1) @Max(50) Integer maxSteps,
        @Size(max = 200) String name
) {
}
