package com.scanops.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.scanops.config.ScanOpsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HTTP client for housekeeping calls against the shared scan backend. The backend keeps caches and
 * session state between scans, so it is reset before a workflow starts and after a run is stopped.
 * Failures are reported in the result and never thrown.
 */
@Component
@Slf4j
public class ExecutionBackendClient {

    private final RestClient restClient;

    public ExecutionBackendClient(RestClient.Builder restClientBuilder, ScanOpsProperties properties) {
        this.restClient = restClientBuilder
                .baseUrl(properties.getBackend().getBaseUrl())
                .build();
    }

    public BackendResetResult reset() {
        try {
            restClient.post()
                    .uri("/api/cache/clear")
                    .retrieve()
                    .toBodilessEntity();
            JsonNode health = restClient.get()
                    .uri("/health")
                    .retrieve()
                    .body(JsonNode.class);
            String status = health != null ? health.path("status").asText("unknown") : "unknown";
            int tools = health != null ? health.path("total_tools_available").asInt(0) : 0;
            log.info("Scan backend reset. status={}, toolsAvailable={}", status, tools);
            return new BackendResetResult(true, "Backend ready (" + status + ", " + tools + " tools)");
        } catch (RestClientException ex) {
            log.warn("Scan backend reset failed: {}", ex.getMessage());
            return new BackendResetResult(false, "Backend reset failed: " + ex.getMessage());
        }
    }
}
