package io.cqstats.collector.sink;

import io.cqstats.collector.model.Counters;
import io.cqstats.collector.model.ProcStatsKey;
import io.cqstats.collector.model.QueryStatsKey;
import io.cqstats.collector.model.StreamCounters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryStatsSink implements StatsSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStatsSink.class);

    private final StatsTable<ProcStatsKey, Counters> procTable;
    private final StatsTable<QueryStatsKey, Counters> queryTable;
    private final StatsTable<String, StreamCounters> streamTable;
    private final List<StatsSinkListener> listeners = new CopyOnWriteArrayList<>();

    public InMemoryStatsSink() {
        this(new InMemoryStatsTable<>(Counters.ZERO, Counters::plus),
                new InMemoryStatsTable<>(Counters.ZERO, Counters::plus),
                new InMemoryStatsTable<>(StreamCounters.ZERO, StreamCounters::plus));
    }

    public InMemoryStatsSink(StatsTable<ProcStatsKey, Counters> procTable,
                             StatsTable<QueryStatsKey, Counters> queryTable,
                             StatsTable<String, StreamCounters> streamTable) {
        this.procTable = procTable;
        this.queryTable = queryTable;
        this.streamTable = streamTable;
    }

    @Override
    public void merge(ProcStatsKey procKey, QueryStatsKey queryKey, Counters delta) {
        procTable.upsert(procKey, delta);
        var result = queryTable.upsert(queryKey, delta);
        if (result.created()) {
            log.debug("Created query stats row {}/{}", queryKey.queryName(), queryKey.kind().wireName());
            notifyNewQueryKey(queryKey);
        }
    }

    @Override
    public void mergeStream(String streamName, StreamCounters delta) {
        streamTable.upsert(streamName, delta);
    }

    @Override
    public Optional<Counters> procStats(ProcStatsKey key) {
        return procTable.get(key);
    }

    @Override
    public Optional<Counters> queryStats(QueryStatsKey key) {
        return queryTable.get(key);
    }

    @Override
    public Optional<StreamCounters> streamStats(String streamName) {
        return streamTable.get(streamName);
    }

    @Override
    public SortedMap<ProcStatsKey, Counters> scanProcStats() {
        return procTable.scan();
    }

    @Override
    public SortedMap<QueryStatsKey, Counters> scanQueryStats() {
        return queryTable.scan();
    }

    @Override
    public SortedMap<String, StreamCounters> scanStreamStats() {
        return streamTable.scan();
    }

    @Override
    public boolean evictProc(ProcStatsKey key) {
        return procTable.remove(key);
    }

    @Override
    public int dropQuery(String queryName) {
        int removed = queryTable.removeIf(key -> key.queryName().equals(queryName));
        log.info("Dropped {} stats rows of query {}", removed, queryName);
        return removed;
    }

    @Override
    public void reset() {
        procTable.clear();
        queryTable.clear();
        streamTable.clear();
        log.info("Statistics reset");
    }

    @Override
    public void addListener(StatsSinkListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(StatsSinkListener listener) {
        listeners.remove(listener);
    }

    private void notifyNewQueryKey(QueryStatsKey key) {
        for (StatsSinkListener listener : listeners) {
            try {
                listener.onNewQueryKey(key);
            } catch (RuntimeException e) {
                log.warn("Stats sink listener failed for {}: {}", key, e.getMessage());
            }
        }
    }
}
