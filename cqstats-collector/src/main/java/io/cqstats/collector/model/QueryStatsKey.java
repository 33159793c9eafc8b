package io.cqstats.collector.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Every unit of the same kind running the same query contributes to one row under this key.
 */
public record QueryStatsKey(String queryName, UnitKind kind) implements Comparable<QueryStatsKey> {

    private static final Comparator<QueryStatsKey> ORDER =
            Comparator.comparing(QueryStatsKey::queryName).thenComparing(QueryStatsKey::kind);

    public QueryStatsKey {
        Objects.requireNonNull(queryName, "queryName");
        Objects.requireNonNull(kind, "kind");
    }

    @Override
    public int compareTo(QueryStatsKey other) {
        return ORDER.compare(this, other);
    }
}
