package io.cqstats.collector.sink;

import io.cqstats.collector.model.QueryStatsKey;

@FunctionalInterface
public interface StatsSinkListener {

    /**
     * Called once, from the merging thread, when the first flush for a (query, kind) pair creates its row.
     */
    void onNewQueryKey(QueryStatsKey key);
}
