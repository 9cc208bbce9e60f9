package com.scanops.config;

import com.scanops.stream.RunStreamWebSocketHandler;
import com.scanops.stream.WorkflowStreamWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RunStreamWebSocketHandler runStreamHandler;
    private final WorkflowStreamWebSocketHandler workflowStreamHandler;

    public WebSocketConfig(RunStreamWebSocketHandler runStreamHandler,
                           WorkflowStreamWebSocketHandler workflowStreamHandler) {
        this.runStreamHandler = runStreamHandler;
        this.workflowStreamHandler = workflowStreamHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(runStreamHandler, "/ws/runs")
                .setAllowedOrigins("*");
        registry.addHandler(workflowStreamHandler, "/ws/workflows")
                .setAllowedOrigins("*");
    }
}
