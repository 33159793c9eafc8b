package io.cqstats.collector;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that reads the wall time once and then advances with {@link System#nanoTime()}, so it never
 * steps backwards when the system clock is corrected.
 */
public class MonotonicClock extends Clock {

    private final Instant anchor;
    private final long anchorNanos;
    private final ZoneId zoneId;

    public MonotonicClock() {
        this(Instant.now(), System.nanoTime(), ZoneOffset.UTC);
    }

    private MonotonicClock(Instant anchor, long anchorNanos, ZoneId zoneId) {
        this.anchor = anchor;
        this.anchorNanos = anchorNanos;
        this.zoneId = zoneId;
    }

    @Override
    public ZoneId getZone() {
        return zoneId;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MonotonicClock(anchor, anchorNanos, zone);
    }

    @Override
    public Instant instant() {
        return anchor.plusNanos(System.nanoTime() - anchorNanos);
    }
}
