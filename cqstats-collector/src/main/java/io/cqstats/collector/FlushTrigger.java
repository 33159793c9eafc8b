package io.cqstats.collector;

import java.util.Locale;

/**
 * What caused a unit's pending counters to be pushed to the sink.
 */
public enum FlushTrigger {
    /** a micro-batch arrived after the forced interval elapsed */
    TRAFFIC,
    /** the periodic timer found unflushed counters older than the forced interval */
    TIMER,
    /** the unit is being retired */
    RETIRE,
    /** the collector is stopping */
    SHUTDOWN;

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
