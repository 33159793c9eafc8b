package io.cqstats.collector.model;

import java.time.Instant;

/**
 * Row of the process-level view. One per live execution unit.
 */
public record ProcStats(String unitId, UnitKind kind, Instant startTime, Counters counters) {

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
