package io.cqstats.collector;

import io.cqstats.collector.model.UnitKind;

/**
 * A caller broke the registry contract: registered a unit twice, retired or reported for a unit that
 * is not registered, or reported under the wrong kind. Fatal to the caller, the collected stats are unaffected.
 */
public class ProcessRegistryException extends RuntimeException {

    private final String unitId;

    public ProcessRegistryException(String unitId, String message) {
        super(message);
        this.unitId = unitId;
    }

    public String getUnitId() {
        return unitId;
    }

    static ProcessRegistryException alreadyRegistered(String unitId, UnitKind kind) {
        return new ProcessRegistryException(unitId,
                "Execution unit %s is already registered as %s".formatted(unitId, kind.wireName()));
    }

    static ProcessRegistryException notRegistered(String unitId) {
        return new ProcessRegistryException(unitId, "Execution unit %s is not registered".formatted(unitId));
    }

    static ProcessRegistryException kindMismatch(String unitId, UnitKind registered, UnitKind reported) {
        return new ProcessRegistryException(unitId,
                "Execution unit %s is registered as %s but reported as %s"
                        .formatted(unitId, registered.wireName(), reported.wireName()));
    }
}
