package com.scanops.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class OrchestratorConfig {

    @Bean
    @Primary
    public ChatClient chatClient(GoogleGenAiChatModel googleGenAiChatModel) {
        return ChatClient.builder(googleGenAiChatModel).build();
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        return openAiChatModelProvider.getIfAvailable() != null
                ? ChatClient.builder(openAiChatModelProvider.getIfAvailable()).build()
                : null;
    }

    /**
     * The only thread that talks to the scan backend. Run jobs and workflow drivers share it.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService scanExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "scan-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Hosts the model call of one tool-orchestration request so the caller can wait with a deadline.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService toolCallExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService streamScheduler() {
        return Executors.newScheduledThreadPool(2);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
