package io.cqstats.collector;

import io.cqstats.collector.metrics.CollectorMetrics;
import io.cqstats.collector.model.BatchEvent;
import io.cqstats.collector.model.Counters;
import io.cqstats.collector.model.ExecutionUnit;
import io.cqstats.collector.model.ProcStatsKey;
import io.cqstats.collector.model.QueryStatsKey;
import io.cqstats.collector.sink.StatsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pending statistics of one execution unit, kept per query until the {@link FlushScheduler} lets them
 * go to the {@link StatsSink}. Flushing sends the delta and resets the local counters.
 * <p>
 * Batches are recorded by the unit's own processing thread. The collector's timer thread may flush
 * concurrently, so every read-and-reset happens under the per-unit lock; a batch that lands during a
 * flush is counted in either that flush or the next one, never both. Merges are done while holding the
 * lock so that a retired unit cannot be merged into the sink after its row is evicted.
 */
public class LocalAccumulator {

    private static final Logger log = LoggerFactory.getLogger(LocalAccumulator.class);

    private final ExecutionUnit unit;
    private final ProcStatsKey procKey;
    private final StatsSink sink;
    private final FlushScheduler scheduler;
    private final Clock clock;
    private final CollectorMetrics metrics;

    private final Object lock = new Object();
    private final Map<String, CounterSet> pending = new LinkedHashMap<>();
    private boolean closed;

    public LocalAccumulator(ExecutionUnit unit,
                            StatsSink sink,
                            Duration forcedFlushInterval,
                            Clock clock,
                            CollectorMetrics metrics) {
        this.unit = unit;
        this.procKey = new ProcStatsKey(unit.unitId());
        this.sink = sink;
        this.clock = clock;
        this.metrics = metrics;
        this.scheduler = new FlushScheduler(forcedFlushInterval, unit.startTime());
    }

    /**
     * Record a completed micro-batch.
     *
     * @return true if the batch caused a flush
     */
    public boolean recordBatch(String queryName, long inputRows, long outputRows, long elapsedMs, boolean hadError) {
        return recordBatch(BatchEvent.of(queryName, inputRows, outputRows, elapsedMs, hadError));
    }

    /**
     * @return true if the batch caused a flush
     * @throws IllegalStateException if the unit has been retired or abandoned
     */
    public boolean recordBatch(BatchEvent event) {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Execution unit " + unit.unitId() + " is closed");
            }
            pending.computeIfAbsent(event.queryName(), q -> new CounterSet()).add(event);
            if (!scheduler.onBatch(clock.instant())) {
                return false;
            }
            push(drain(), FlushTrigger.TRAFFIC);
            return true;
        }
    }

    /**
     * Timer path: flush if counts are pending and the forced interval has elapsed.
     *
     * @return true if a flush happened
     */
    public boolean flushIfDue() {
        synchronized (lock) {
            if (closed || !scheduler.onTick(clock.instant())) {
                return false;
            }
            push(drain(), FlushTrigger.TIMER);
            return true;
        }
    }

    /**
     * Claims the deadline of the current pending epoch for a one-shot timer flush.
     *
     * @return the deadline, or empty if nothing is pending or it was already claimed
     */
    public Optional<Instant> armFlushDeadline() {
        synchronized (lock) {
            if (closed || !scheduler.armDeadline()) {
                return Optional.empty();
            }
            return Optional.of(scheduler.deadline());
        }
    }

    /**
     * Flush whatever is pending, regardless of the schedule.
     *
     * @return the total flushed across queries
     */
    public Counters flush(FlushTrigger trigger) {
        synchronized (lock) {
            if (closed) {
                return Counters.ZERO;
            }
            scheduler.markFlushed(clock.instant());
            return push(drain(), trigger);
        }
    }

    /**
     * Flush the residual delta and refuse further batches.
     *
     * @return the residual total that was flushed
     */
    public Counters close() {
        synchronized (lock) {
            if (closed) {
                return Counters.ZERO;
            }
            scheduler.markFlushed(clock.instant());
            var flushed = push(drain(), FlushTrigger.RETIRE);
            closed = true;
            return flushed;
        }
    }

    /**
     * Drop the residual delta without flushing and refuse further batches. Used when the unit crashed.
     *
     * @return the residual total that was lost
     */
    public Counters discard() {
        synchronized (lock) {
            if (closed) {
                return Counters.ZERO;
            }
            var lost = Counters.ZERO;
            for (Counters delta : drain().values()) {
                lost = lost.plus(delta);
            }
            closed = true;
            return lost;
        }
    }

    /**
     * Forget pending counts of a dropped query so they do not recreate its rows.
     */
    public void discardQuery(String queryName) {
        synchronized (lock) {
            pending.remove(queryName);
        }
    }

    /**
     * @return the unflushed total across queries
     */
    public Counters pending() {
        synchronized (lock) {
            var total = Counters.ZERO;
            for (CounterSet counterSet : pending.values()) {
                total = total.plus(counterSet.snapshot());
            }
            return total;
        }
    }

    public Map<String, Counters> pendingByQuery() {
        synchronized (lock) {
            Map<String, Counters> result = new LinkedHashMap<>();
            pending.forEach((query, counterSet) -> result.put(query, counterSet.snapshot()));
            return Collections.unmodifiableMap(result);
        }
    }

    public FlushScheduler.State state() {
        synchronized (lock) {
            return scheduler.state();
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    public ExecutionUnit unit() {
        return unit;
    }

    private Map<String, Counters> drain() {
        Map<String, Counters> deltas = new LinkedHashMap<>();
        for (Map.Entry<String, CounterSet> entry : pending.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                deltas.put(entry.getKey(), entry.getValue().snapshotAndReset());
            }
        }
        pending.clear();
        return deltas;
    }

    private Counters push(Map<String, Counters> deltas, FlushTrigger trigger) {
        var total = Counters.ZERO;
        if (deltas.isEmpty()) {
            return total;
        }
        for (Map.Entry<String, Counters> entry : deltas.entrySet()) {
            var queryKey = new QueryStatsKey(entry.getKey(), unit.kind());
            var delta = entry.getValue();
            metrics.recordMerge(() -> sink.merge(procKey, queryKey, delta));
            total = total.plus(delta);
        }
        metrics.recordFlush(trigger);
        log.debug("Flushed {} {} ({}): {} queries, {} input rows, {} output rows",
                unit.kind().wireName(), unit.unitId(), trigger.tagValue(),
                deltas.size(), total.inputRows(), total.outputRows());
        return total;
    }
}
