package io.cqstats.collector.sink;

import io.cqstats.collector.model.Counters;
import io.cqstats.collector.model.ProcStatsKey;
import io.cqstats.collector.model.QueryStatsKey;
import io.cqstats.collector.model.StreamCounters;

import java.util.Optional;
import java.util.SortedMap;

/**
 * Shared aggregation target of all execution units. Every merge is an additive upsert, so the final
 * totals do not depend on the order in which concurrent units flush.
 */
public interface StatsSink {

    /**
     * Add a flushed delta to the unit's process row and to the (query, kind) row.
     */
    void merge(ProcStatsKey procKey, QueryStatsKey queryKey, Counters delta);

    void mergeStream(String streamName, StreamCounters delta);

    Optional<Counters> procStats(ProcStatsKey key);

    Optional<Counters> queryStats(QueryStatsKey key);

    Optional<StreamCounters> streamStats(String streamName);

    SortedMap<ProcStatsKey, Counters> scanProcStats();

    SortedMap<QueryStatsKey, Counters> scanQueryStats();

    SortedMap<String, StreamCounters> scanStreamStats();

    /**
     * Drop the process row of a retired unit.
     */
    boolean evictProc(ProcStatsKey key);

    /**
     * Drop every (query, kind) row of a dropped query.
     *
     * @return number of rows removed
     */
    int dropQuery(String queryName);

    void reset();

    void addListener(StatsSinkListener listener);

    void removeListener(StatsSinkListener listener);
}
