package com.scanops.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanops.config.ScanOpsProperties;
import com.scanops.entity.RunStatus;
import com.scanops.repository.RunRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;

@Component
public class RunStreamWebSocketHandler extends ChannelStreamWebSocketHandler {

    private final RunRepository runRepository;

    public RunStreamWebSocketHandler(EventChannelHub hub,
                                     ObjectMapper objectMapper,
                                     @Qualifier("streamScheduler") ScheduledExecutorService streamScheduler,
                                     ScanOpsProperties properties,
                                     RunRepository runRepository) {
        super(hub, objectMapper, streamScheduler, properties);
        this.runRepository = runRepository;
    }

    @Override
    protected String channelParameter() {
        return "runId";
    }

    @Override
    protected Optional<String> persistedStatus(UUID id) {
        return runRepository.findById(id).map(run -> run.getStatus().name());
    }

    @Override
    protected boolean isTerminalStatus(String status) {
        return RunStatus.valueOf(status).isTerminal();
    }
}
