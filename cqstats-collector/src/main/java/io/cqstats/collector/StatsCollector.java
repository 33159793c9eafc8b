package io.cqstats.collector;

import io.cqstats.collector.config.StatsProperties;
import io.cqstats.collector.metrics.CollectorMetrics;
import io.cqstats.collector.metrics.StatsMeterBinder;
import io.cqstats.collector.model.BatchEvent;
import io.cqstats.collector.model.Counters;
import io.cqstats.collector.model.ProcStatsKey;
import io.cqstats.collector.model.StreamCounters;
import io.cqstats.collector.model.UnitKind;
import io.cqstats.collector.sink.InMemoryStatsSink;
import io.cqstats.collector.sink.StatsSink;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for the query engine. Owns the process registry, one {@link LocalAccumulator} per live
 * unit, the shared sink and the flush timer.
 *
 * <pre>
 * StatsProperties props = new StatsConfig().toProperties();
 * try (StatsCollector collector = new StatsCollector(props)) {
 *     collector.start();
 *     collector.onBatchComplete("worker-0", UnitKind.WORKER, "q1", 1000, 1000, 12, false);
 *     collector.views().listQueryStats();
 * }
 * </pre>
 */
public class StatsCollector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StatsCollector.class);

    private final StatsProperties properties;
    private final StatsSink sink;
    private final Clock clock;
    private final ProcessRegistry registry;
    private final StatsViewBuilder views;
    private final CollectorMetrics metrics;
    private final ConcurrentHashMap<String, LocalAccumulator> accumulators = new ConcurrentHashMap<>();

    private final ScheduledExecutorService timer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public StatsCollector(StatsProperties properties) {
        this(properties, new InMemoryStatsSink(), new MonotonicClock(), new SimpleMeterRegistry());
    }

    public StatsCollector(StatsProperties properties, StatsSink sink, Clock clock, MeterRegistry meterRegistry) {
        this.properties = properties.validate();
        this.sink = sink;
        this.clock = clock;
        this.registry = new ProcessRegistry(properties.getNumWorkers(), properties.getNumCombiners(), clock);
        this.views = new StatsViewBuilder(registry, sink);
        this.metrics = new CollectorMetrics(meterRegistry);
        new StatsMeterBinder(sink, registry).bindTo(meterRegistry);

        var executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "cqstats-flush-timer");
            t.setDaemon(true);
            return t;
        });
        // stop() flushes every unit itself, pending deadline flushes are dropped
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        this.timer = executor;
    }

    /**
     * Spawn the configured workers and combiners and start the flush timer. A collector starts once.
     *
     * @throws IllegalStateException if the collector has been stopped
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Stats collector has been stopped and cannot be restarted");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (int i = 0; i < properties.getNumWorkers(); i++) {
            spawn("worker-" + i, UnitKind.WORKER);
        }
        for (int i = 0; i < properties.getNumCombiners(); i++) {
            spawn("combiner-" + i, UnitKind.COMBINER);
        }
        if (properties.isTimerEnabled()) {
            timer.scheduleAtFixedRate(
                    this::flushDue,
                    properties.getTickIntervalMs(),
                    properties.getTickIntervalMs(),
                    TimeUnit.MILLISECONDS);
        }
        log.info("Stats collector started: workers={}, combiners={}, forcedFlushInterval={}ms, tick={}ms, timer={}",
                properties.getNumWorkers(),
                properties.getNumCombiners(),
                properties.getForcedFlushIntervalMs(),
                properties.getTickIntervalMs(),
                properties.isTimerEnabled() ? "on" : "off");
    }

    /**
     * Flush every live unit, then stop the timer. Units stay registered.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            stopped.set(true);
            shutdownScheduler(timer, "flush timer");
            var flushed = Counters.ZERO;
            for (LocalAccumulator accumulator : accumulators.values()) {
                flushed = flushed.plus(accumulator.flush(FlushTrigger.SHUTDOWN));
            }
            log.info("Stats collector stopped: flushed {} input rows from {} units",
                    flushed.inputRows(), accumulators.size());
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Register a new unit. Its process row reads as zero until the first flush.
     *
     * @throws ProcessRegistryException if the id is already registered
     */
    public LocalAccumulator spawn(String unitId, UnitKind kind) {
        var unit = registry.register(unitId, kind);
        var accumulator = new LocalAccumulator(unit, sink, properties.getForcedFlushInterval(), clock, metrics);
        accumulators.put(unitId, accumulator);
        log.info("Spawned {} {}", kind.wireName(), unitId);
        return accumulator;
    }

    /**
     * Flush the unit's residual delta, deregister it and drop its process row.
     *
     * @return the residual delta that was flushed
     * @throws ProcessRegistryException if the unit is not registered
     */
    public Counters retire(String unitId) {
        var accumulator = accumulators.remove(unitId);
        if (accumulator == null) {
            throw ProcessRegistryException.notRegistered(unitId);
        }
        var residual = accumulator.close();
        registry.deregister(unitId);
        sink.evictProc(new ProcStatsKey(unitId));
        log.info("Retired {} {}", accumulator.unit().kind().wireName(), unitId);
        return residual;
    }

    /**
     * The unit crashed: its unflushed delta is lost and it is deregistered.
     *
     * @return the delta that was lost
     * @throws ProcessRegistryException if the unit is not registered
     */
    public Counters abandon(String unitId) {
        var accumulator = accumulators.remove(unitId);
        if (accumulator == null) {
            throw ProcessRegistryException.notRegistered(unitId);
        }
        var lost = accumulator.discard();
        if (!lost.isZero()) {
            metrics.recordDropped(lost);
            log.warn("Abandoned {} {} before flush, lost {} executions, {} input rows, {} output rows",
                    accumulator.unit().kind().wireName(), unitId,
                    lost.executions(), lost.inputRows(), lost.outputRows());
        } else {
            log.info("Abandoned {} {} with nothing pending", accumulator.unit().kind().wireName(), unitId);
        }
        registry.deregister(unitId);
        sink.evictProc(new ProcStatsKey(unitId));
        return lost;
    }

    /**
     * Engine callback after a unit finished one micro-batch of a query.
     *
     * @return true if the batch caused a flush
     * @throws ProcessRegistryException if the unit is not registered or is registered under another kind
     */
    public boolean onBatchComplete(String unitId, UnitKind kind, String queryName,
                                   long inputRows, long outputRows, long elapsedMs, boolean hadError) {
        return onBatchComplete(unitId, kind, BatchEvent.of(queryName, inputRows, outputRows, elapsedMs, hadError));
    }

    public boolean onBatchComplete(String unitId, UnitKind kind, BatchEvent event) {
        var accumulator = lookup(unitId, kind);
        if (accumulator.recordBatch(event)) {
            return true;
        }
        scheduleDeadlineFlush(accumulator);
        return false;
    }

    public void onStreamInsert(String streamName, long rows, long batches, long bytes) {
        sink.mergeStream(streamName, new StreamCounters(rows, batches, bytes));
    }

    /**
     * Forget a dropped query: its rows leave the sink and pending counts are discarded.
     *
     * @return number of sink rows removed
     */
    public int dropQuery(String queryName) {
        accumulators.values().forEach(a -> a.discardQuery(queryName));
        return sink.dropQuery(queryName);
    }

    public void resetStats() {
        sink.reset();
    }

    /**
     * One timer tick: flush every unit whose forced interval has elapsed with counts pending.
     *
     * @return number of units flushed
     */
    public int flushDue() {
        int flushed = 0;
        for (LocalAccumulator accumulator : accumulators.values()) {
            try {
                if (accumulator.flushIfDue()) {
                    flushed++;
                }
            } catch (RuntimeException e) {
                log.error("Timer flush of {} failed", accumulator.unit().unitId(), e);
            }
        }
        return flushed;
    }

    public StatsViewBuilder views() {
        return views;
    }

    public ProcessRegistry registry() {
        return registry;
    }

    public StatsSink sink() {
        return sink;
    }

    public Optional<LocalAccumulator> accumulator(String unitId) {
        return Optional.ofNullable(accumulators.get(unitId));
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Schedules a one-shot flush at the unit's deadline, once per pending epoch. The periodic tick
     * stays as a backstop.
     */
    private void scheduleDeadlineFlush(LocalAccumulator accumulator) {
        if (!running.get() || !properties.isTimerEnabled()) {
            return;
        }
        accumulator.armFlushDeadline().ifPresent(deadline -> {
            long delayNanos = Math.max(0, Duration.between(clock.instant(), deadline).toNanos());
            try {
                timer.schedule(() -> flushAtDeadline(accumulator), delayNanos, TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Deadline flush of {} not scheduled, timer is stopped", accumulator.unit().unitId());
            }
        });
    }

    private void flushAtDeadline(LocalAccumulator accumulator) {
        try {
            if (!accumulator.flushIfDue()) {
                scheduleDeadlineFlush(accumulator);
            }
        } catch (RuntimeException e) {
            log.error("Deadline flush of {} failed", accumulator.unit().unitId(), e);
        }
    }

    private LocalAccumulator lookup(String unitId, UnitKind kind) {
        var accumulator = accumulators.get(unitId);
        if (accumulator == null) {
            throw ProcessRegistryException.notRegistered(unitId);
        }
        var registered = accumulator.unit().kind();
        if (registered != kind) {
            throw ProcessRegistryException.kindMismatch(unitId, registered, kind);
        }
        return accumulator;
    }

    private void shutdownScheduler(ScheduledExecutorService scheduler, String name) {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
                log.warn("{} did not terminate gracefully", name);
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
