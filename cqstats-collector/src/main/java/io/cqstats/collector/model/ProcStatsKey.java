package io.cqstats.collector.model;

import java.util.Objects;

public record ProcStatsKey(String unitId) implements Comparable<ProcStatsKey> {
    public ProcStatsKey {
        Objects.requireNonNull(unitId, "unitId");
    }

    @Override
    public int compareTo(ProcStatsKey other) {
        return unitId.compareTo(other.unitId);
    }
}
