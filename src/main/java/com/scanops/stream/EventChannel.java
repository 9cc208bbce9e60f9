package com.scanops.stream;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One ordered channel with a bounded replay buffer. Publishing and subscribing share the channel
 * monitor, so a new subscriber sees the backlog followed by live events without gaps or duplicates.
 */
@Slf4j
class EventChannel {
    private final String channelId;
    private final int replaySize;
    private final AtomicLong sequence = new AtomicLong();
    private final Deque<StreamEvent> buffer = new ArrayDeque<>();
    private final List<StreamSubscriber> subscribers = new ArrayList<>();
    private volatile boolean terminated;
    private volatile boolean closed;
    private volatile boolean retired;
    private volatile Instant lastUpdated = Instant.now();

    EventChannel(String channelId, int replaySize) {
        this.channelId = channelId;
        this.replaySize = replaySize;
    }

    String channelId() {
        return channelId;
    }

    /**
     * @return the published event, or null if the channel is already closed
     */
    synchronized StreamEvent publish(StreamEventType type, Map<String, Object> data) {
        if (closed) {
            return null;
        }
        StreamEvent event = new StreamEvent(sequence.incrementAndGet(), channelId, Instant.now(), type, data);
        buffer.addLast(event);
        while (buffer.size() > replaySize) {
            buffer.removeFirst();
        }
        lastUpdated = event.timestamp();
        if (type.terminal()) {
            terminated = true;
        }
        for (StreamSubscriber subscriber : List.copyOf(subscribers)) {
            deliver(subscriber, event);
        }
        return event;
    }

    synchronized boolean subscribe(StreamSubscriber subscriber) {
        if (closed) {
            return false;
        }
        for (StreamEvent event : buffer) {
            deliver(subscriber, event);
        }
        subscribers.add(subscriber);
        return true;
    }

    synchronized void unsubscribe(StreamSubscriber subscriber) {
        subscribers.remove(subscriber);
    }

    /**
     * Closes a channel that nobody listens to and that never carried an event.
     *
     * @return true when the channel was retired and may be dropped from the registry
     */
    synchronized boolean retireIfUnused() {
        if (closed || !subscribers.isEmpty() || !buffer.isEmpty()) {
            return false;
        }
        closed = true;
        retired = true;
        return true;
    }

    /**
     * Closes a channel without subscribers whose last event is older than the cutoff.
     */
    synchronized boolean retireIfIdleSince(Instant cutoff) {
        if (closed || !subscribers.isEmpty() || !lastUpdated.isBefore(cutoff)) {
            return false;
        }
        closed = true;
        retired = true;
        return true;
    }

    /**
     * Marks the channel closed and returns the subscribers that were still attached.
     */
    synchronized List<StreamSubscriber> close() {
        closed = true;
        List<StreamSubscriber> remaining = new ArrayList<>(subscribers);
        subscribers.clear();
        return remaining;
    }

    boolean terminated() {
        return terminated;
    }

    boolean closed() {
        return closed;
    }

    /**
     * A retired channel was dropped for lack of use rather than closed after a terminal event.
     */
    boolean retired() {
        return retired;
    }

    private void deliver(StreamSubscriber subscriber, StreamEvent event) {
        try {
            subscriber.onEvent(event);
        } catch (RuntimeException ex) {
            log.debug("Subscriber on channel {} failed to accept event {}: {}", channelId, event.id(), ex.getMessage());
        }
    }
}
