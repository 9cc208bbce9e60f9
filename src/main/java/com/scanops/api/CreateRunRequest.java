package com.scanops.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.Map;
import java.util.UUID;

public record CreateRunRequest(
        UUID toolId,
        String toolSlug,
        UUID scopeId,
        @NotBlank
        @Size(max = 255)
        @Pattern(regexp = "^[a-zA-Z0-9.\\-_:/]+$", message = "target contains invalid characters")
        String target,
        Map<String, Object> params,
        @Min(30) @Max(3600) Integer timeout
) {
}
