package io.cqstats.collector;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides when a unit's pending counters must be flushed.
 * <p>
 * A batch flushes immediately once {@code forcedInterval} has passed since the last flush; otherwise its
 * counts stay pending. The first pending batch arms a one-shot timer flush at {@link #deadline()}, and the
 * periodic timer flushes pending counts under the same condition, so a unit that stops receiving batches
 * is still flushed. All paths share {@code lastFlush}, which limits every unit to at least one interval
 * between flushes whatever the batch rate.
 * <p>
 * Not thread safe, callers hold the owning accumulator's lock.
 */
public class FlushScheduler {

    public enum State {
        /** nothing recorded since the last flush */
        IDLE,
        /** counts recorded but not yet flushed */
        PENDING
    }

    private final Duration forcedInterval;
    private Instant lastFlush;
    private State state = State.IDLE;
    private boolean deadlineArmed;

    public FlushScheduler(Duration forcedInterval, Instant now) {
        if (forcedInterval.isNegative() || forcedInterval.isZero()) {
            throw new IllegalArgumentException("Forced flush interval must be positive: " + forcedInterval);
        }
        this.forcedInterval = forcedInterval;
        this.lastFlush = Objects.requireNonNull(now, "now");
    }

    /**
     * Traffic-driven check, called after every recorded batch.
     *
     * @return true if the caller must flush now
     */
    public boolean onBatch(Instant now) {
        state = State.PENDING;
        return flushIfElapsed(now);
    }

    /**
     * Timer-driven check. Never flushes an idle unit.
     *
     * @return true if the caller must flush now
     */
    public boolean onTick(Instant now) {
        if (state == State.IDLE) {
            return false;
        }
        if (flushIfElapsed(now)) {
            return true;
        }
        deadlineArmed = false;
        return false;
    }

    /**
     * Claims the one-shot deadline flush for the current pending epoch.
     *
     * @return true if counts are pending and no deadline has been claimed since the last flush or early tick
     */
    public boolean armDeadline() {
        if (state != State.PENDING || deadlineArmed) {
            return false;
        }
        deadlineArmed = true;
        return true;
    }

    /**
     * Earliest instant at which pending counts may be flushed.
     */
    public Instant deadline() {
        return lastFlush.plus(forcedInterval);
    }

    /**
     * Records an unconditional flush, used when a unit is retired or the collector stops.
     */
    public void markFlushed(Instant now) {
        lastFlush = now;
        state = State.IDLE;
        deadlineArmed = false;
    }

    private boolean flushIfElapsed(Instant now) {
        // a clock stepped back behind lastFlush counts as elapsed and re-anchors the interval
        if (now.isBefore(lastFlush) || Duration.between(lastFlush, now).compareTo(forcedInterval) >= 0) {
            markFlushed(now);
            return true;
        }
        return false;
    }

    public State state() {
        return state;
    }

    public Instant lastFlush() {
        return lastFlush;
    }

    public Duration forcedInterval() {
        return forcedInterval;
    }
}
