package com.scanops.stream;

import com.scanops.config.ScanOpsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process-local registry of event channels keyed by run or session id. Channels are created on first
 * use and removed once the grace window after their terminal event has passed. Channels left without
 * subscribers are dropped when they never carried an event, or once they have been idle for the
 * configured TTL. Only valid while a single process hosts the worker.
 */
@Component
@Slf4j
public class EventChannelHub {

    private static final int CLOSED_ID_MEMORY = 1024;

    private final Map<String, EventChannel> channels = new ConcurrentHashMap<>();
    private final Set<String> recentlyClosed = Collections.synchronizedSet(Collections.newSetFromMap(
            new LinkedHashMap<String, Boolean>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > CLOSED_ID_MEMORY;
                }
            }));
    private final ScheduledExecutorService streamScheduler;
    private final int replaySize;
    private final long closeGraceMs;
    private final Duration idleTtl;

    public EventChannelHub(ScanOpsProperties properties,
                           @Qualifier("streamScheduler") ScheduledExecutorService streamScheduler) {
        this.streamScheduler = streamScheduler;
        this.replaySize = Math.max(1, properties.getStream().getReplaySize());
        this.closeGraceMs = properties.getStream().getCloseGrace().toMillis();
        this.idleTtl = properties.getStream().getIdleTtl();
    }

    public Optional<StreamEvent> emit(String channelId, StreamEventType type, Map<String, Object> data) {
        while (true) {
            if (recentlyClosed.contains(channelId)) {
                log.debug("Dropped {} event for closed channel {}", type.wireName(), channelId);
                return Optional.empty();
            }
            EventChannel channel = channels.computeIfAbsent(channelId, id -> new EventChannel(id, replaySize));
            boolean alreadyTerminated = channel.terminated();
            StreamEvent event = channel.publish(type, data);
            if (event != null) {
                if (type.terminal() && !alreadyTerminated) {
                    scheduleClose(channel);
                }
                return Optional.of(event);
            }
            if (!channel.retired()) {
                log.debug("Dropped {} event for closed channel {}", type.wireName(), channelId);
                return Optional.empty();
            }
            // retired concurrently; the next pass opens a fresh channel
            channels.remove(channelId, channel);
        }
    }

    /**
     * Attaches a subscriber, replaying the buffered backlog before live events.
     *
     * @return false when the channel has already been closed
     */
    public boolean subscribe(String channelId, StreamSubscriber subscriber) {
        if (recentlyClosed.contains(channelId)) {
            return false;
        }
        pruneIdle(Instant.now());
        while (true) {
            EventChannel channel = channels.computeIfAbsent(channelId, id -> new EventChannel(id, replaySize));
            if (channel.subscribe(subscriber)) {
                return true;
            }
            if (!channel.retired()) {
                return false;
            }
            channels.remove(channelId, channel);
        }
    }

    public void unsubscribe(String channelId, StreamSubscriber subscriber) {
        EventChannel channel = channels.get(channelId);
        if (channel == null) {
            return;
        }
        channel.unsubscribe(subscriber);
        if (channel.retireIfUnused()) {
            channels.remove(channelId, channel);
        }
    }

    /**
     * Drops channels without subscribers whose last event is older than the idle TTL.
     *
     * @return number of channels dropped
     */
    int pruneIdle(Instant now) {
        Instant cutoff = now.minus(idleTtl);
        int pruned = 0;
        for (EventChannel channel : channels.values()) {
            if (channel.retireIfIdleSince(cutoff) && channels.remove(channel.channelId(), channel)) {
                pruned++;
            }
        }
        if (pruned > 0) {
            log.debug("Pruned {} idle event channels", pruned);
        }
        return pruned;
    }

    public boolean isOpen(String channelId) {
        EventChannel channel = channels.get(channelId);
        return channel != null && !channel.closed();
    }

    int channelCount() {
        return channels.size();
    }

    private void scheduleClose(EventChannel channel) {
        streamScheduler.schedule(() -> close(channel), closeGraceMs, TimeUnit.MILLISECONDS);
    }

    void close(EventChannel channel) {
        List<StreamSubscriber> remaining = channel.close();
        recentlyClosed.add(channel.channelId());
        channels.remove(channel.channelId(), channel);
        for (StreamSubscriber subscriber : remaining) {
            try {
                subscriber.onClose();
            } catch (RuntimeException ex) {
                log.debug("Subscriber close failed on channel {}: {}", channel.channelId(), ex.getMessage());
            }
        }
        log.debug("Closed event channel {}", channel.channelId());
    }
}
