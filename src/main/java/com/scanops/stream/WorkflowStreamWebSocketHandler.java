package com.scanops.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanops.config.ScanOpsProperties;
import com.scanops.entity.WorkflowStatus;
import com.scanops.repository.WorkflowSessionRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;

@Component
public class WorkflowStreamWebSocketHandler extends ChannelStreamWebSocketHandler {

    private final WorkflowSessionRepository sessionRepository;

    public WorkflowStreamWebSocketHandler(EventChannelHub hub,
                                          ObjectMapper objectMapper,
                                          @Qualifier("streamScheduler") ScheduledExecutorService streamScheduler,
                                          ScanOpsProperties properties,
                                          WorkflowSessionRepository sessionRepository) {
        super(hub, objectMapper, streamScheduler, properties);
        this.sessionRepository = sessionRepository;
    }

    @Override
    protected String channelParameter() {
        return "sessionId";
    }

    @Override
    protected Optional<String> persistedStatus(UUID id) {
        return sessionRepository.findById(id).map(session -> session.getStatus().name());
    }

    @Override
    protected boolean isTerminalStatus(String status) {
        return WorkflowStatus.valueOf(status).isTerminal();
    }
}
