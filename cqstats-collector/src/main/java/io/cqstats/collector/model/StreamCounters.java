package io.cqstats.collector.model;

/**
 * Insert statistics of a stream: rows written into it, micro-batches they were routed in, and bytes.
 */
public record StreamCounters(long inputRows, long inputBatches, long inputBytes) {

    public static final StreamCounters ZERO = new StreamCounters(0, 0, 0);

    public StreamCounters {
        if (inputRows < 0 || inputBatches < 0 || inputBytes < 0) {
            throw new IllegalArgumentException("Stream counters must not be negative");
        }
    }

    public StreamCounters plus(StreamCounters other) {
        return new StreamCounters(
                inputRows + other.inputRows,
                inputBatches + other.inputBatches,
                inputBytes + other.inputBytes);
    }
}
