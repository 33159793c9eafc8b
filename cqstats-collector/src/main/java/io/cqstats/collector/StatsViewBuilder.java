package io.cqstats.collector;

import io.cqstats.collector.model.Counters;
import io.cqstats.collector.model.ExecutionUnit;
import io.cqstats.collector.model.ProcStats;
import io.cqstats.collector.model.ProcStatsKey;
import io.cqstats.collector.model.QueryStats;
import io.cqstats.collector.model.QueryStatsKey;
import io.cqstats.collector.model.StreamCounters;
import io.cqstats.collector.model.StreamStats;
import io.cqstats.collector.model.UnitKind;
import io.cqstats.collector.sink.StatsSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the statistics views. Nothing here mutates the sink.
 * <p>
 * The process view is driven by the registry: every live unit has exactly one row, with zero counters
 * until its first flush, and rows of retired units are never returned. The query and stream views list
 * the rows present in the sink.
 */
public class StatsViewBuilder {

    private final ProcessRegistry registry;
    private final StatsSink sink;

    public StatsViewBuilder(ProcessRegistry registry, StatsSink sink) {
        this.registry = registry;
        this.sink = sink;
    }

    public List<ProcStats> listProcStats() {
        List<ProcStats> rows = new ArrayList<>();
        for (ExecutionUnit unit : registry.liveUnits()) {
            rows.add(toProcStats(unit));
        }
        return rows;
    }

    public List<QueryStats> listQueryStats() {
        List<QueryStats> rows = new ArrayList<>();
        sink.scanQueryStats().forEach((key, counters) ->
                rows.add(new QueryStats(key.queryName(), key.kind(), counters)));
        return rows;
    }

    public List<StreamStats> listStreamStats() {
        List<StreamStats> rows = new ArrayList<>();
        sink.scanStreamStats().forEach((stream, counters) -> rows.add(new StreamStats(stream, counters)));
        return rows;
    }

    /**
     * @return empty if the unit is not live
     */
    public Optional<ProcStats> getProcStats(String unitId) {
        return registry.get(unitId).map(this::toProcStats);
    }

    /**
     * Unknown keys read as a zero row.
     */
    public QueryStats getQueryStats(String queryName, UnitKind kind) {
        var key = new QueryStatsKey(queryName, kind);
        return new QueryStats(queryName, kind, sink.queryStats(key).orElse(Counters.ZERO));
    }

    public StreamStats getStreamStats(String streamName) {
        return new StreamStats(streamName, sink.streamStats(streamName).orElse(StreamCounters.ZERO));
    }

    private ProcStats toProcStats(ExecutionUnit unit) {
        var counters = sink.procStats(new ProcStatsKey(unit.unitId())).orElse(Counters.ZERO);
        return new ProcStats(unit.unitId(), unit.kind(), unit.startTime(), counters);
    }
}
