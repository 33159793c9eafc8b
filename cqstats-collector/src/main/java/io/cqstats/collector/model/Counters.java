package io.cqstats.collector.model;

/**
 * Immutable counter values. Used both for flushed deltas and for the running totals held by the sink.
 * {@link #plus(Counters)} is a field-wise sum, so merging is commutative and associative.
 */
public record Counters(long inputRows,
                       long outputRows,
                       long updatedRows,
                       long inputBytes,
                       long outputBytes,
                       long executions,
                       long processingTimeMs,
                       long errors) {

    public static final Counters ZERO = new Counters(0, 0, 0, 0, 0, 0, 0, 0);

    public Counters plus(Counters other) {
        return new Counters(
                inputRows + other.inputRows,
                outputRows + other.outputRows,
                updatedRows + other.updatedRows,
                inputBytes + other.inputBytes,
                outputBytes + other.outputBytes,
                executions + other.executions,
                processingTimeMs + other.processingTimeMs,
                errors + other.errors);
    }

    public boolean isZero() {
        return this.equals(ZERO);
    }

    /**
     * Counters for a single batch.
     */
    public static Counters of(BatchEvent event) {
        return new Counters(
                event.inputRows(),
                event.outputRows(),
                event.updatedRows(),
                event.inputBytes(),
                event.outputBytes(),
                1,
                event.elapsedMs(),
                event.error() ? 1 : 0);
    }
}
