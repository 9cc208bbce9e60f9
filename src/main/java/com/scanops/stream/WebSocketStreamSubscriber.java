package com.scanops.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

/**
 * Relays channel events to one WebSocket connection, one text message per event.
 */
@Slf4j
class WebSocketStreamSubscriber implements StreamSubscriber {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    WebSocketStreamSubscriber(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public void onEvent(StreamEvent event) {
        send(event);
        if (event.type().terminal()) {
            close(CloseStatus.NORMAL);
        }
    }

    @Override
    public void onClose() {
        close(CloseStatus.NORMAL);
    }

    void sendControl(Map<String, Object> message) {
        send(message);
    }

    void close(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException ex) {
            log.debug("Failed to close stream session {}: {}", session.getId(), ex.getMessage());
        }
    }

    private void send(Object payload) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(payload);
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException ex) {
            log.debug("Failed to send stream message to {}: {}", session.getId(), ex.getMessage());
        }
    }
}
