package io.cqstats.collector.metrics;

import io.cqstats.collector.ProcessRegistry;
import io.cqstats.collector.model.Counters;
import io.cqstats.collector.model.QueryStatsKey;
import io.cqstats.collector.model.UnitKind;
import io.cqstats.collector.sink.StatsSink;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToLongFunction;

/**
 * Publishes the query-level view as Micrometer gauges, one set per (query, kind), and the number of
 * live units per kind. Query gauges read the live sink row and fall to zero after a reset or drop.
 * Rows created after binding are picked up through a {@link io.cqstats.collector.sink.StatsSinkListener}.
 */
public class StatsMeterBinder implements MeterBinder {

    private final StatsSink sink;
    private final ProcessRegistry registry;
    private final Set<QueryStatsKey> bound = ConcurrentHashMap.newKeySet();
    private volatile MeterRegistry meterRegistry;

    public StatsMeterBinder(StatsSink sink, ProcessRegistry registry) {
        this.sink = sink;
        this.registry = registry;
    }

    @Override
    public void bindTo(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (UnitKind kind : UnitKind.values()) {
            Gauge.builder("cqstats.units.live", registry, r -> r.count(kind))
                    .tag("kind", kind.wireName())
                    .register(meterRegistry);
        }
        sink.addListener(this::bindQuery);
        sink.scanQueryStats().keySet().forEach(this::bindQuery);
    }

    private void bindQuery(QueryStatsKey key) {
        var meters = meterRegistry;
        if (meters == null || !bound.add(key)) {
            return;
        }
        gauge(meters, "cqstats.query.input_rows", key, Counters::inputRows);
        gauge(meters, "cqstats.query.output_rows", key, Counters::outputRows);
        gauge(meters, "cqstats.query.updated_rows", key, Counters::updatedRows);
        gauge(meters, "cqstats.query.executions", key, Counters::executions);
        gauge(meters, "cqstats.query.processing_time_ms", key, Counters::processingTimeMs);
        gauge(meters, "cqstats.query.errors", key, Counters::errors);
    }

    private void gauge(MeterRegistry meters, String name, QueryStatsKey key, ToLongFunction<Counters> field) {
        Gauge.builder(name, sink,
                        s -> s.queryStats(key).map(field::applyAsLong).orElse(0L))
                .tag("query", key.queryName())
                .tag("kind", key.kind().wireName())
                .register(meters);
    }
}
