package com.scanops.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanops.config.ScanOpsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Push transport for one channel kind. Acknowledges the connection, relays channel events and polls the
 * persisted status so the socket closes even if the terminal event was missed.
 */
@Slf4j
public abstract class ChannelStreamWebSocketHandler extends TextWebSocketHandler {

    private static final String ATTR_CHANNEL = "channelId";
    private static final String ATTR_SUBSCRIBER = "subscriber";
    private static final String ATTR_POLL = "statusPoll";

    private final EventChannelHub hub;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService streamScheduler;
    private final long pollIntervalMs;

    protected ChannelStreamWebSocketHandler(EventChannelHub hub,
                                            ObjectMapper objectMapper,
                                            ScheduledExecutorService streamScheduler,
                                            ScanOpsProperties properties) {
        this.hub = hub;
        this.objectMapper = objectMapper;
        this.streamScheduler = streamScheduler;
        this.pollIntervalMs = properties.getStream().getStatusPollInterval().toMillis();
    }

    /** Name of the query parameter carrying the channel id. */
    protected abstract String channelParameter();

    /** Current persisted status name, empty when the record no longer exists. */
    protected abstract Optional<String> persistedStatus(UUID id);

    protected abstract boolean isTerminalStatus(String status);

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        URI uri = session.getUri();
        if (uri == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        UUID id = parseId(parseQueryParams(uri.getQuery()).get(channelParameter()));
        if (id == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        String channelId = id.toString();
        WebSocketStreamSubscriber subscriber = new WebSocketStreamSubscriber(session, objectMapper);
        session.getAttributes().put(ATTR_CHANNEL, channelId);
        session.getAttributes().put(ATTR_SUBSCRIBER, subscriber);
        subscriber.sendControl(Map.of("type", "connected", channelParameter(), channelId));

        if (!hub.subscribe(channelId, subscriber)) {
            subscriber.close(CloseStatus.NORMAL);
            return;
        }
        if (pollIntervalMs > 0 && session.isOpen()) {
            ScheduledFuture<?> poll = streamScheduler.scheduleAtFixedRate(
                    () -> pollStatus(session, id, subscriber), pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
            session.getAttributes().put(ATTR_POLL, poll);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // Server push only.
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Object channelId = session.getAttributes().get(ATTR_CHANNEL);
        Object subscriber = session.getAttributes().get(ATTR_SUBSCRIBER);
        if (channelId != null && subscriber instanceof StreamSubscriber streamSubscriber) {
            hub.unsubscribe(channelId.toString(), streamSubscriber);
        }
        if (session.getAttributes().get(ATTR_POLL) instanceof ScheduledFuture<?> poll) {
            poll.cancel(false);
        }
    }

    void pollStatus(WebSocketSession session, UUID id, WebSocketStreamSubscriber subscriber) {
        if (!session.isOpen()) {
            cancelPoll(session);
            return;
        }
        try {
            Optional<String> status = persistedStatus(id);
            if (status.isEmpty()) {
                subscriber.close(CloseStatus.NORMAL);
                cancelPoll(session);
                return;
            }
            subscriber.sendControl(Map.of("type", "status", "id", id.toString(), "status", status.get()));
            if (isTerminalStatus(status.get())) {
                subscriber.close(CloseStatus.NORMAL);
                cancelPoll(session);
            }
        } catch (RuntimeException ex) {
            log.debug("Status poll for {} failed: {}", id, ex.getMessage());
        }
    }

    private void cancelPoll(WebSocketSession session) {
        if (session.getAttributes().get(ATTR_POLL) instanceof ScheduledFuture<?> poll) {
            poll.cancel(false);
        }
    }

    private UUID parseId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException ex) {
            log.debug("Invalid {} parameter {}", channelParameter(), value);
            return null;
        }
    }

    private Map<String, String> parseQueryParams(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isBlank()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            if (idx <= 0) {
                continue;
            }
            String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
            params.put(key, value);
        }
        return params;
    }
}
