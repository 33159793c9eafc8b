package io.cqstats.collector.model;

/**
 * Row of the query-level view. One per (query, kind) that has received at least one flush.
 */
public record QueryStats(String queryName, UnitKind kind, Counters counters) {

    public QueryStatsKey key() {
        return new QueryStatsKey(queryName, kind);
    }

    public long inputRows() {
        return counters.inputRows();
    }

    public long outputRows() {
        return counters.outputRows();
    }

    public long processingTimeMs() {
        return counters.processingTimeMs();
    }

    public long errors() {
        return counters.errors();
    }
}
