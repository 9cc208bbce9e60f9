package com.scanops.stream;

import java.time.Instant;
import java.util.Map;

public record StreamEvent(long id, String channelId, Instant timestamp, StreamEventType type, Map<String, Object> data) {
}
