package com.scanops.runs;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OutputAccumulatorTest {

    private final MutableClock clock = new MutableClock();
    private final List<String> writes = new ArrayList<>();
    private final OutputAccumulator accumulator = new OutputAccumulator(UUID.randomUUID(), clock,
            Duration.ofMillis(500), 1000, writes::add);

    @Test
    void testSmallChunksWithinIntervalAreBuffered() {
        accumulator.append("abc");
        accumulator.append("def");

        assertTrue(writes.isEmpty());
        assertEquals("abcdef", accumulator.content());
    }

    @Test
    void testFlushAfterIntervalWritesWholeBuffer() {
        accumulator.append("first ");
        clock.advance(500);
        accumulator.append("second");

        assertEquals(List.of("first second"), writes);
    }

    @Test
    void testFlushAfterByteThreshold() {
        accumulator.append("x".repeat(999));
        assertTrue(writes.isEmpty());

        accumulator.append("y");
        assertEquals(1, writes.size());
        assertEquals(1000, writes.get(0).length());
    }

    @Test
    void testExplicitFlushSkipsWhenNothingNew() {
        accumulator.append("data");
        accumulator.flush();
        accumulator.flush();

        assertEquals(1, accumulator.flushCount());
    }

    @Test
    void testSinkFailureKeepsBuffer() {
        OutputAccumulator failing = new OutputAccumulator(UUID.randomUUID(), clock, Duration.ofMillis(500), 1,
                content -> {
                    throw new IllegalStateException("db down");
                });

        failing.append("keep me");

        assertEquals("keep me", failing.content());
        assertEquals(0, failing.flushCount());
    }

    private static final class MutableClock extends Clock {
        private long millis = 1_000_000L;

        void advance(long delta) {
            millis += delta;
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }
    }
}
