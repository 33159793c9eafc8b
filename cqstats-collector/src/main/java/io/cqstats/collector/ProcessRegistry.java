package io.cqstats.collector;

import io.cqstats.collector.model.ExecutionUnit;
import io.cqstats.collector.model.UnitKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live workers and combiners, and the configured number of each.
 */
public class ProcessRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProcessRegistry.class);

    private final ConcurrentHashMap<String, ExecutionUnit> units = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int configuredWorkers;
    private final int configuredCombiners;

    public ProcessRegistry(int configuredWorkers, int configuredCombiners, Clock clock) {
        if (configuredWorkers < 0 || configuredCombiners < 0) {
            throw new IllegalArgumentException("Unit counts must not be negative");
        }
        this.configuredWorkers = configuredWorkers;
        this.configuredCombiners = configuredCombiners;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws ProcessRegistryException if the id is already registered
     */
    public ExecutionUnit register(String unitId, UnitKind kind) {
        var unit = new ExecutionUnit(unitId, kind, clock.instant());
        var existing = units.putIfAbsent(unitId, unit);
        if (existing != null) {
            throw ProcessRegistryException.alreadyRegistered(unitId, existing.kind());
        }
        log.debug("Registered {} {}", kind.wireName(), unitId);
        return unit;
    }

    /**
     * @throws ProcessRegistryException if the id is not registered
     */
    public ExecutionUnit deregister(String unitId) {
        var removed = units.remove(unitId);
        if (removed == null) {
            throw ProcessRegistryException.notRegistered(unitId);
        }
        log.debug("Deregistered {} {}", removed.kind().wireName(), unitId);
        return removed;
    }

    public long count(UnitKind kind) {
        return units.values().stream().filter(u -> u.kind() == kind).count();
    }

    public long count() {
        return units.size();
    }

    public boolean isLive(String unitId) {
        return units.containsKey(unitId);
    }

    public Optional<ExecutionUnit> get(String unitId) {
        return Optional.ofNullable(units.get(unitId));
    }

    public List<ExecutionUnit> liveUnits() {
        return units.values().stream()
                .sorted(Comparator.comparing(ExecutionUnit::unitId))
                .toList();
    }

    public int configuredWorkers() {
        return configuredWorkers;
    }

    public int configuredCombiners() {
        return configuredCombiners;
    }

    public int configured(UnitKind kind) {
        return kind == UnitKind.WORKER ? configuredWorkers : configuredCombiners;
    }
}
