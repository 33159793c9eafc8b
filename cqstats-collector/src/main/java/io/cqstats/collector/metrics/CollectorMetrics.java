package io.cqstats.collector.metrics;

import io.cqstats.collector.FlushTrigger;
import io.cqstats.collector.model.Counters;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Map;

public final class CollectorMetrics {

    private final Map<FlushTrigger, Counter> flushes = new EnumMap<>(FlushTrigger.class);
    private final Counter droppedFlushes;
    private final Counter droppedInputRows;
    private final Timer mergeTimer;

    public CollectorMetrics(MeterRegistry registry) {
        for (FlushTrigger trigger : FlushTrigger.values()) {
            flushes.put(trigger, Counter.builder("cqstats.flush.count")
                    .tag("trigger", trigger.tagValue())
                    .register(registry));
        }
        this.droppedFlushes = Counter.builder("cqstats.flush.dropped.count")
                .description("Residual deltas lost because a unit was abandoned before flushing")
                .register(registry);
        this.droppedInputRows = Counter.builder("cqstats.flush.dropped.input_rows")
                .register(registry);
        this.mergeTimer = Timer.builder("cqstats.merge.timer")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);
    }

    public void recordFlush(FlushTrigger trigger) {
        flushes.get(trigger).increment();
    }

    public void recordDropped(Counters lost) {
        droppedFlushes.increment();
        droppedInputRows.increment(lost.inputRows());
    }

    public void recordMerge(Runnable merge) {
        mergeTimer.record(merge);
    }
}
