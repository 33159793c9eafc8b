package io.cqstats.collector.model;

import java.util.Locale;

/**
 * Kind of execution unit. Workers ingest raw input rows, combiners merge worker output into persisted state.
 */
public enum UnitKind {
    WORKER,
    COMBINER;

    /**
     * Name used in the stats views, {@code worker} or {@code combiner}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static UnitKind fromWireName(String name) {
        for (UnitKind kind : values()) {
            if (kind.wireName().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown unit kind: " + name);
    }
}
