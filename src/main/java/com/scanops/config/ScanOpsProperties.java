package com.scanops.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scanops")
public class ScanOpsProperties {

    private WorkerConfig worker = new WorkerConfig();
    private StreamConfig stream = new StreamConfig();
    private WorkflowConfig workflow = new WorkflowConfig();
    private BackendConfig backend = new BackendConfig();
    private AiConfig ai = new AiConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public static class WorkerConfig {
        private Duration defaultToolTimeout = Duration.ofSeconds(600);
        private Duration outputFlushInterval = Duration.ofMillis(500);
        private int outputFlushBytes = 1000;

        public Duration getDefaultToolTimeout() { return defaultToolTimeout; }
        public void setDefaultToolTimeout(Duration defaultToolTimeout) { this.defaultToolTimeout = defaultToolTimeout; }
        public Duration getOutputFlushInterval() { return outputFlushInterval; }
        public void setOutputFlushInterval(Duration outputFlushInterval) { this.outputFlushInterval = outputFlushInterval; }
        public int getOutputFlushBytes() { return outputFlushBytes; }
        public void setOutputFlushBytes(int outputFlushBytes) { this.outputFlushBytes = outputFlushBytes; }
    }

    public static class StreamConfig {
        private int replaySize = 100;
        private Duration closeGrace = Duration.ofSeconds(60);
        private Duration idleTtl = Duration.ofMinutes(30);
        private Duration statusPollInterval = Duration.ofSeconds(2);

        public int getReplaySize() { return replaySize; }
        public void setReplaySize(int replaySize) { this.replaySize = replaySize; }
        public Duration getCloseGrace() { return closeGrace; }
        public void setCloseGrace(Duration closeGrace) { this.closeGrace = closeGrace; }
        public Duration getIdleTtl() { return idleTtl; }
        public void setIdleTtl(Duration idleTtl) { this.idleTtl = idleTtl; }
        public Duration getStatusPollInterval() { return statusPollInterval; }
        public void setStatusPollInterval(Duration statusPollInterval) { this.statusPollInterval = statusPollInterval; }
    }

    public static class WorkflowConfig {
        private String toolSlug = "smart-scan";
        private boolean abortOnPhaseFailure = false;
        private int defaultMaxSteps = 20;

        public String getToolSlug() { return toolSlug; }
        public void setToolSlug(String toolSlug) { this.toolSlug = toolSlug; }
        public boolean isAbortOnPhaseFailure() { return abortOnPhaseFailure; }
        public void setAbortOnPhaseFailure(boolean abortOnPhaseFailure) { this.abortOnPhaseFailure = abortOnPhaseFailure; }
        public int getDefaultMaxSteps() { return defaultMaxSteps; }
        public void setDefaultMaxSteps(int defaultMaxSteps) { this.defaultMaxSteps = defaultMaxSteps; }
    }

    public static class BackendConfig {
        private String baseUrl = "http://localhost:8888";
        private Duration timeout = Duration.ofSeconds(10);
        private List<String> allowedTools = new ArrayList<>();

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public List<String> getAllowedTools() { return allowedTools; }

        public void setAllowedTools(List<String> allowedTools) {
            this.allowedTools = allowedTools == null ? new ArrayList<>() : new ArrayList<>(allowedTools);
        }
    }

    public static class AiConfig {
        private AiProvider provider = AiProvider.GOOGLE;
        private String openaiModel;

        public AiProvider getProvider() { return provider; }
        public void setProvider(AiProvider provider) { this.provider = provider; }
        public String getOpenaiModel() { return openaiModel; }
        public void setOpenaiModel(String openaiModel) { this.openaiModel = openaiModel; }
    }

    public WorkerConfig getWorker() {
        return worker;
    }

    public void setWorker(WorkerConfig worker) {
        this.worker = worker != null ? worker : new WorkerConfig();
    }

    public StreamConfig getStream() {
        return stream;
    }

    public void setStream(StreamConfig stream) {
        this.stream = stream != null ? stream : new StreamConfig();
    }

    public WorkflowConfig getWorkflow() {
        return workflow;
    }

    public void setWorkflow(WorkflowConfig workflow) {
        this.workflow = workflow != null ? workflow : new WorkflowConfig();
    }

    public BackendConfig getBackend() {
        return backend;
    }

    public void setBackend(BackendConfig backend) {
        this.backend = backend != null ? backend : new BackendConfig();
    }

    public AiConfig getAi() {
        return ai;
    }

    public void setAi(AiConfig ai) {
        this.ai = ai != null ? ai : new AiConfig();
    }
}
