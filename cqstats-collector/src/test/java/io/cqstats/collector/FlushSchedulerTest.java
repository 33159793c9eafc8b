package io.cqstats.collector;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FlushSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration INTERVAL = Duration.ofSeconds(1);

    @Test
    void batchBeforeIntervalStaysPending() {
        var scheduler = new FlushScheduler(INTERVAL, T0);

        assertFalse(scheduler.onBatch(T0.plusMillis(999)));
        assertEquals(FlushScheduler.State.PENDING, scheduler.state());
        assertEquals(T0, scheduler.lastFlush());
    }

    @Test
    void batchAtIntervalFlushes() {
        var scheduler = new FlushScheduler(INTERVAL, T0);

        assertTrue(scheduler.onBatch(T0.plusMillis(1000)));
        assertEquals(FlushScheduler.State.IDLE, scheduler.state());
        assertEquals(T0.plusMillis(1000), scheduler.lastFlush());
    }

    @Test
    void flushesAreAtLeastOneIntervalApart() {
        var scheduler = new FlushScheduler(INTERVAL, T0);

        assertTrue(scheduler.onBatch(T0.plusMillis(1500)));
        assertFalse(scheduler.onBatch(T0.plusMillis(1600)));
        assertFalse(scheduler.onTick(T0.plusMillis(2400)));
        assertTrue(scheduler.onTick(T0.plusMillis(2500)));
    }

    @Test
    void tickNeverFlushesIdleUnit() {
        var scheduler = new FlushScheduler(INTERVAL, T0);

        assertFalse(scheduler.onTick(T0.plusSeconds(60)));
        assertEquals(FlushScheduler.State.IDLE, scheduler.state());
    }

    @Test
    void tickFlushesPendingCountsAfterTrafficStops() {
        var scheduler = new FlushScheduler(INTERVAL, T0);
        scheduler.onBatch(T0.plusMillis(100));

        assertFalse(scheduler.onTick(T0.plusMillis(900)));
        assertTrue(scheduler.onTick(T0.plusMillis(1000)));
        assertFalse(scheduler.onTick(T0.plusMillis(3000)));
    }

    @Test
    void markFlushedRestartsInterval() {
        var scheduler = new FlushScheduler(INTERVAL, T0);
        scheduler.onBatch(T0.plusMillis(100));
        scheduler.markFlushed(T0.plusMillis(200));

        assertEquals(FlushScheduler.State.IDLE, scheduler.state());
        assertFalse(scheduler.onBatch(T0.plusMillis(1100)));
        assertTrue(scheduler.onBatch(T0.plusMillis(1200)));
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> new FlushScheduler(Duration.ZERO, T0));
        assertThrows(IllegalArgumentException.class, () -> new FlushScheduler(Duration.ofMillis(-1), T0));
    }

    @Test
    void clockSteppedBackCountsAsElapsed() {
        var scheduler = new FlushScheduler(INTERVAL, T0);

        assertTrue(scheduler.onBatch(T0.minusSeconds(3600)));
        assertEquals(T0.minusSeconds(3600), scheduler.lastFlush());
        assertFalse(scheduler.onBatch(T0.minusSeconds(3600).plusMillis(10)));
        assertTrue(scheduler.onTick(T0.minusSeconds(3600).plusMillis(1000)));
    }

    @Test
    void deadlineIsArmedOncePerPendingEpoch() {
        var scheduler = new FlushScheduler(INTERVAL, T0);

        assertFalse(scheduler.armDeadline());
        scheduler.onBatch(T0.plusMillis(100));
        assertTrue(scheduler.armDeadline());
        assertFalse(scheduler.armDeadline());
        assertEquals(T0.plusMillis(1000), scheduler.deadline());

        assertFalse(scheduler.onTick(T0.plusMillis(500)));
        assertTrue(scheduler.armDeadline());

        assertTrue(scheduler.onTick(T0.plusMillis(1000)));
        assertFalse(scheduler.armDeadline());
        scheduler.onBatch(T0.plusMillis(1100));
        assertTrue(scheduler.armDeadline());
        assertEquals(T0.plusMillis(2000), scheduler.deadline());
    }
}
