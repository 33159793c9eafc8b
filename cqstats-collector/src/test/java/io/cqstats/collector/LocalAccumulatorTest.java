package io.cqstats.collector;

import io.cqstats.collector.metrics.CollectorMetrics;
import io.cqstats.collector.model.Counters;
import io.cqstats.collector.model.ExecutionUnit;
import io.cqstats.collector.model.ProcStatsKey;
import io.cqstats.collector.model.QueryStatsKey;
import io.cqstats.collector.model.UnitKind;
import io.cqstats.collector.sink.InMemoryStatsSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class LocalAccumulatorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final QueryStatsKey Q_WORKER = new QueryStatsKey("q", UnitKind.WORKER);
    private static final ProcStatsKey PROC = new ProcStatsKey("worker-0");

    private MutableClock clock;
    private InMemoryStatsSink sink;
    private SimpleMeterRegistry meterRegistry;
    private LocalAccumulator accumulator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        sink = new InMemoryStatsSink();
        meterRegistry = new SimpleMeterRegistry();
        accumulator = newAccumulator(clock);
    }

    private LocalAccumulator newAccumulator(Clock c) {
        var unit = new ExecutionUnit("worker-0", UnitKind.WORKER, c.instant());
        return new LocalAccumulator(unit, sink, Duration.ofSeconds(1), c, new CollectorMetrics(meterRegistry));
    }

    private long inputRows(QueryStatsKey key) {
        return sink.queryStats(key).map(Counters::inputRows).orElse(0L);
    }

    @Test
    void batchesWithinIntervalStayLocal() {
        assertFalse(accumulator.recordBatch("q", 1000, 10, 5, false));
        assertFalse(accumulator.recordBatch("q", 1000, 10, 5, false));

        assertTrue(sink.queryStats(Q_WORKER).isEmpty());
        assertEquals(2000, accumulator.pending().inputRows());
        assertEquals(FlushScheduler.State.PENDING, accumulator.state());
    }

    @Test
    void trafficFlushSendsDeltaAndResets() {
        clock.advanceMillis(1000);
        assertTrue(accumulator.recordBatch("q", 1000, 10, 5, false));
        assertFalse(accumulator.recordBatch("q", 500, 10, 5, false));
        clock.advanceMillis(1000);
        assertTrue(accumulator.recordBatch("q", 250, 10, 5, true));

        assertEquals(1750, inputRows(Q_WORKER));
        assertEquals(3, sink.queryStats(Q_WORKER).orElseThrow().executions());
        assertEquals(1, sink.queryStats(Q_WORKER).orElseThrow().errors());
        assertEquals(1750, sink.procStats(PROC).orElseThrow().inputRows());
        assertEquals(Counters.ZERO, accumulator.pending());
        assertEquals(2, meterRegistry.get("cqstats.flush.count").tag("trigger", "traffic").counter().count());
    }

    @Test
    void flushSplitsByQuery() {
        accumulator.recordBatch("a", 100, 1, 1, false);
        accumulator.recordBatch("b", 200, 2, 1, false);
        clock.advanceMillis(1000);

        assertTrue(accumulator.flushIfDue());

        assertEquals(100, inputRows(new QueryStatsKey("a", UnitKind.WORKER)));
        assertEquals(200, inputRows(new QueryStatsKey("b", UnitKind.WORKER)));
        assertEquals(300, sink.procStats(PROC).orElseThrow().inputRows());
    }

    @Test
    void timerDoesNotFlushBeforeInterval() {
        accumulator.recordBatch("q", 100, 1, 1, false);
        clock.advanceMillis(999);

        assertFalse(accumulator.flushIfDue());
        assertEquals(100, accumulator.pending().inputRows());
    }

    @Test
    void closeFlushesResidualAndRejectsBatches() {
        accumulator.recordBatch("q", 100, 1, 1, false);

        var residual = accumulator.close();

        assertEquals(100, residual.inputRows());
        assertEquals(100, inputRows(Q_WORKER));
        assertTrue(accumulator.isClosed());
        assertThrows(IllegalStateException.class, () -> accumulator.recordBatch("q", 1, 1, 1, false));
        assertEquals(Counters.ZERO, accumulator.close());
        assertFalse(accumulator.flushIfDue());
    }

    @Test
    void discardLosesResidual() {
        accumulator.recordBatch("q", 100, 1, 1, false);

        var lost = accumulator.discard();

        assertEquals(100, lost.inputRows());
        assertTrue(sink.queryStats(Q_WORKER).isEmpty());
        assertTrue(accumulator.isClosed());
    }

    @Test
    void discardQueryForgetsOnlyThatQuery() {
        accumulator.recordBatch("a", 100, 1, 1, false);
        accumulator.recordBatch("b", 200, 1, 1, false);

        accumulator.discardQuery("a");

        assertEquals(1, accumulator.pendingByQuery().size());
        assertEquals(200, accumulator.pendingByQuery().get("b").inputRows());
    }

    @Test
    void concurrentTimerNeverLosesOrDoublesCounts() throws Exception {
        var realClockAccumulator = new LocalAccumulator(
                new ExecutionUnit("worker-0", UnitKind.WORKER, Instant.now()),
                sink, Duration.ofMillis(1), Clock.systemUTC(), new CollectorMetrics(meterRegistry));
        int batches = 20_000;
        var done = new AtomicBoolean(false);
        var startGate = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> recorder = executor.submit(() -> {
                startGate.await();
                for (int i = 0; i < batches; i++) {
                    realClockAccumulator.recordBatch("q", 3, 1, 0, false);
                }
                done.set(true);
                return null;
            });
            Future<?> timer = executor.submit(() -> {
                startGate.await();
                while (!done.get()) {
                    realClockAccumulator.flushIfDue();
                }
                return null;
            });
            startGate.countDown();
            recorder.get(30, TimeUnit.SECONDS);
            timer.get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        realClockAccumulator.flush(FlushTrigger.SHUTDOWN);

        var total = sink.queryStats(Q_WORKER).orElseThrow();
        assertEquals(3L * batches, total.inputRows());
        assertEquals(batches, total.executions());
    }
}
