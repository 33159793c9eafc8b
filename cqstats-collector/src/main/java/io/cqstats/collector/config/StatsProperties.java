package io.cqstats.collector.config;

import java.time.Duration;

import static io.cqstats.common.ConfigConstants.DEFAULT_FORCED_FLUSH_INTERVAL_MS;
import static io.cqstats.common.ConfigConstants.DEFAULT_NUM_COMBINERS;
import static io.cqstats.common.ConfigConstants.DEFAULT_NUM_WORKERS;
import static io.cqstats.common.ConfigConstants.DEFAULT_TICK_INTERVAL_MS;

/**
 * Settings of the statistics collector.
 *
 * <pre>
 * cqstats {
 *     forced-flush-interval-ms = 1000
 *     tick-interval-ms = 100
 *     timer-enabled = true
 *     num-workers = 1
 *     num-combiners = 1
 * }
 * </pre>
 */
public class StatsProperties {

    /**
     * Maximum time a unit's counts stay unflushed, and minimum time between two flushes of a unit.
     */
    private long forcedFlushIntervalMs = DEFAULT_FORCED_FLUSH_INTERVAL_MS;

    /**
     * Period of the shared timer that flushes silent units.
     */
    private long tickIntervalMs = DEFAULT_TICK_INTERVAL_MS;

    /**
     * Run the periodic timer. Tests that drive the clock by hand turn it off.
     */
    private boolean timerEnabled = true;

    private int numWorkers = DEFAULT_NUM_WORKERS;

    private int numCombiners = DEFAULT_NUM_COMBINERS;

    public long getForcedFlushIntervalMs() {
        return forcedFlushIntervalMs;
    }

    public void setForcedFlushIntervalMs(long forcedFlushIntervalMs) {
        this.forcedFlushIntervalMs = forcedFlushIntervalMs;
    }

    public Duration getForcedFlushInterval() {
        return Duration.ofMillis(forcedFlushIntervalMs);
    }

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public void setTickIntervalMs(long tickIntervalMs) {
        this.tickIntervalMs = tickIntervalMs;
    }

    public boolean isTimerEnabled() {
        return timerEnabled;
    }

    public void setTimerEnabled(boolean timerEnabled) {
        this.timerEnabled = timerEnabled;
    }

    public int getNumWorkers() {
        return numWorkers;
    }

    public void setNumWorkers(int numWorkers) {
        this.numWorkers = numWorkers;
    }

    public int getNumCombiners() {
        return numCombiners;
    }

    public void setNumCombiners(int numCombiners) {
        this.numCombiners = numCombiners;
    }

    /**
     * @throws IllegalArgumentException on non-positive intervals or negative unit counts
     */
    public StatsProperties validate() {
        if (forcedFlushIntervalMs <= 0) {
            throw new IllegalArgumentException("forced-flush-interval-ms must be positive: " + forcedFlushIntervalMs);
        }
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException("tick-interval-ms must be positive: " + tickIntervalMs);
        }
        if (numWorkers < 0 || numCombiners < 0) {
            throw new IllegalArgumentException("num-workers and num-combiners must not be negative");
        }
        return this;
    }

    @Override
    public String toString() {
        return "StatsProperties{" +
                "forcedFlushIntervalMs=" + forcedFlushIntervalMs +
                ", tickIntervalMs=" + tickIntervalMs +
                ", timerEnabled=" + timerEnabled +
                ", numWorkers=" + numWorkers +
                ", numCombiners=" + numCombiners +
                '}';
    }
}
