package com.scanops.execution;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class ScanMetricsService {

    private final AtomicLong modelRequestCount = new AtomicLong();
    private final AtomicLong toolCallCount = new AtomicLong();
    private final AtomicLong tokenCount = new AtomicLong();
    private final AtomicLong runsFinished = new AtomicLong();
    private final AtomicLong workflowsFinished = new AtomicLong();

    public void recordModelRequest(String label) {
        long count = modelRequestCount.incrementAndGet();
        log.info("Model request #{} sent ({}).", count, label);
    }

    public void recordModelResponse(String label, int toolCalls, long tokens) {
        long totalCalls = toolCallCount.addAndGet(toolCalls);
        long totalTokens = tokenCount.addAndGet(tokens);
        log.info("Model response ({}) used {} tool calls and {} tokens. Totals: toolCalls={}, tokens={}.",
                label, toolCalls, tokens, totalCalls, totalTokens);
    }

    public void recordRunFinished(String status) {
        long total = runsFinished.incrementAndGet();
        log.info("Run finished with status {}. Runs finished so far={}.", status, total);
    }

    public void recordWorkflowFinished(String status) {
        long total = workflowsFinished.incrementAndGet();
        log.info("Workflow finished with status {}. Workflows finished so far={}.", status, total);
    }

    @PreDestroy
    public void logSummary() {
        log.info("Scan stats: modelRequests={}, toolCalls={}, tokens={}, runsFinished={}, workflowsFinished={}.",
                modelRequestCount.get(), toolCallCount.get(), tokenCount.get(), runsFinished.get(), workflowsFinished.get());
    }
}
