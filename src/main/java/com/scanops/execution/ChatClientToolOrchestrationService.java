package com.scanops.execution;

import com.scanops.config.ScanOpsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.scanops.execution.ScanPromptConstants.USER_TEMPLATE;

/**
 * Serves tool-orchestration requests with a Spring AI chat model that can call the scan backend's
 * MCP tools. Each request gets its own audit, so tool calls, their output and the budget are tracked
 * per request.
 */
@Service
@Slf4j
public class ChatClientToolOrchestrationService implements ToolOrchestrationService {

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final ToolCallbackProvider toolCallbackProvider;
    private final ScanOpsProperties properties;
    private final ScanPromptService promptService;
    private final JsonProcessingService jsonProcessingService;
    private final ScanMetricsService metricsService;
    private final ExecutorService toolCallExecutor;

    public ChatClientToolOrchestrationService(ChatClient chatClient,
                                              @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                                              ObjectProvider<ToolCallbackProvider> toolCallbackProvider,
                                              ScanOpsProperties properties,
                                              ScanPromptService promptService,
                                              JsonProcessingService jsonProcessingService,
                                              ScanMetricsService metricsService,
                                              @Qualifier("toolCallExecutor") ExecutorService toolCallExecutor) {
        this.chatClient = chatClient;
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.toolCallbackProvider = toolCallbackProvider.getIfAvailable();
        this.properties = properties;
        this.promptService = promptService;
        this.jsonProcessingService = jsonProcessingService;
        this.metricsService = metricsService;
        this.toolCallExecutor = toolCallExecutor;
    }

    @Override
    public ToolExecutionResult execute(ToolExecutionRequest request, ExecutionListener listener) {
        ToolCallAudit audit = new ToolCallAudit(request.label(), request.maxToolCalls(), listener, jsonProcessingService);
        ChatClient.ChatClientRequestSpec spec = applyTools(getChatRequestSpec(), request, audit)
                .system(promptService.systemPrompt())
                .user(user -> user.text(USER_TEMPLATE)
                        .param("target", request.target())
                        .param("objective", StringUtils.hasText(request.objective()) ? request.objective() : "security assessment")
                        .param("params", jsonProcessingService.toJson(request.params()))
                        .param("budget", String.valueOf(request.maxToolCalls()))
                        .param("task", request.task()));

        metricsService.recordModelRequest(request.label());
        Future<ChatResponse> future = toolCallExecutor.submit(() -> spec.call().chatResponse());
        ChatResponse response;
        try {
            response = future.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            audit.close();
            throw new ToolExecutionTimeoutException(request.label(), request.timeout());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            audit.close();
            throw new ToolExecutionException("Execution of " + request.label() + " was interrupted", ex);
        } catch (ExecutionException ex) {
            audit.close();
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new ToolExecutionException("Model call failed for " + request.label() + ": " + cause.getMessage(), cause);
        }
        audit.close();

        String analysis = extractText(response);
        long tokens = extractTokens(response);
        String model = response != null && response.getMetadata() != null ? response.getMetadata().getModel() : null;
        List<SubInvocation> invocations = audit.snapshot();
        metricsService.recordModelResponse(request.label(), invocations.size(), tokens);
        return new ToolExecutionResult(analysis, invocations, tokens, audit.stdout(), audit.stderr(), model);
    }

    private ChatClient.ChatClientRequestSpec getChatRequestSpec() {
        if (properties.getAi().getProvider() == ScanOpsProperties.AiProvider.OPENAI) {
            if (openAiChatClient == null) {
                throw new IllegalStateException("OpenAI provider is not properly configured. "
                        + "Check that you have a valid API key or a custom Base URL in your configuration.");
            }
            var spec = openAiChatClient.prompt();
            String model = properties.getAi().getOpenaiModel();
            if (StringUtils.hasText(model)) {
                spec = spec.options(OpenAiChatOptions.builder().model(model).build());
            }
            return spec;
        }
        return chatClient.prompt();
    }

    private ChatClient.ChatClientRequestSpec applyTools(ChatClient.ChatClientRequestSpec prompt,
                                                        ToolExecutionRequest request,
                                                        ToolCallAudit audit) {
        if (toolCallbackProvider == null) {
            log.warn("Tool callbacks are not configured. request={}", request.label());
            return prompt;
        }
        List<String> allowed = !request.allowedTools().isEmpty()
                ? request.allowedTools()
                : properties.getBackend().getAllowedTools();
        ToolCallbackProvider effective = allowed.isEmpty()
                ? toolCallbackProvider
                : new FilteringToolCallbackProvider(toolCallbackProvider, allowed);
        ToolCallback[] callbacks = effective.getToolCallbacks();
        if (callbacks == null || callbacks.length == 0) {
            log.warn("No tool callbacks available. request={}, allowed={}", request.label(), allowed);
            return prompt;
        }
        ToolCallback[] wrapped = Arrays.stream(callbacks)
                .map(callback -> new AuditedToolCallback(callback, audit))
                .toArray(ToolCallback[]::new);
        if (log.isDebugEnabled()) {
            log.debug("Tool callbacks available. request={}, tools={}", request.label(),
                    Arrays.stream(wrapped).map(cb -> ((AuditedToolCallback) cb).resolveToolName()).toList());
        }
        return prompt.toolCallbacks(ToolCallbackProvider.from(wrapped));
    }

    private String extractText(@Nullable ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        String text = response.getResult().getOutput().getText();
        return text == null ? "" : text;
    }

    private long extractTokens(@Nullable ChatResponse response) {
        if (response == null || response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return 0L;
        }
        Integer total = response.getMetadata().getUsage().getTotalTokens();
        return total == null ? 0L : total.longValue();
    }
}
