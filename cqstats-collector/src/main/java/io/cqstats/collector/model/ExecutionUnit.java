package io.cqstats.collector.model;

import java.time.Instant;
import java.util.Objects;

public record ExecutionUnit(String unitId, UnitKind kind, Instant startTime) {
    public ExecutionUnit {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(startTime, "startTime");
    }
}
