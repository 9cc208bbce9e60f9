package com.scanops.runs;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Buffers the live stdout of one run and writes the whole buffer to storage once enough time has
 * passed or enough bytes have arrived since the previous write, whichever happens first.
 */
@Slf4j
public class OutputAccumulator {

    private final UUID runId;
    private final Clock clock;
    private final long flushIntervalMs;
    private final int flushBytes;
    private final Consumer<String> sink;
    private final StringBuilder buffer = new StringBuilder();
    private long pendingBytes;
    private long lastFlushMs;
    private int flushCount;

    public OutputAccumulator(UUID runId, Clock clock, Duration flushInterval, int flushBytes, Consumer<String> sink) {
        this.runId = runId;
        this.clock = clock;
        this.flushIntervalMs = flushInterval.toMillis();
        this.flushBytes = flushBytes;
        this.sink = sink;
        this.lastFlushMs = clock.millis();
    }

    public synchronized void append(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        buffer.append(chunk);
        pendingBytes += chunk.getBytes(StandardCharsets.UTF_8).length;
        if (pendingBytes >= flushBytes || clock.millis() - lastFlushMs >= flushIntervalMs) {
            flush();
        }
    }

    /**
     * Writes the buffer if anything arrived since the last write. Storage failures are logged; the
     * buffer stays intact so the final write still carries everything.
     */
    public synchronized void flush() {
        if (pendingBytes == 0) {
            return;
        }
        try {
            sink.accept(buffer.toString());
            flushCount++;
        } catch (RuntimeException ex) {
            log.warn("Failed to flush output of run {}: {}", runId, ex.getMessage());
        }
        pendingBytes = 0;
        lastFlushMs = clock.millis();
    }

    public synchronized String content() {
        return buffer.toString();
    }

    public synchronized int flushCount() {
        return flushCount;
    }
}
