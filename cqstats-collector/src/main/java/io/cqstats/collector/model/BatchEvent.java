package io.cqstats.collector.model;

import java.util.Objects;

/**
 * Accounting for one completed micro-batch of one query on one execution unit.
 *
 * @param queryName   continuous query the batch belongs to
 * @param inputRows   rows consumed
 * @param outputRows  rows produced; for a combiner, rows newly inserted into persisted state
 * @param updatedRows rows of persisted state updated in place (combiners only)
 * @param inputBytes  bytes consumed
 * @param outputBytes bytes produced
 * @param elapsedMs   time spent executing the batch
 * @param error       whether the batch failed
 */
public record BatchEvent(String queryName,
                         long inputRows,
                         long outputRows,
                         long updatedRows,
                         long inputBytes,
                         long outputBytes,
                         long elapsedMs,
                         boolean error) {

    public BatchEvent {
        Objects.requireNonNull(queryName, "queryName");
        requireNonNegative("inputRows", inputRows);
        requireNonNegative("outputRows", outputRows);
        requireNonNegative("updatedRows", updatedRows);
        requireNonNegative("inputBytes", inputBytes);
        requireNonNegative("outputBytes", outputBytes);
        requireNonNegative("elapsedMs", elapsedMs);
    }

    public static BatchEvent of(String queryName, long inputRows, long outputRows, long elapsedMs, boolean error) {
        return new BatchEvent(queryName, inputRows, outputRows, 0, 0, 0, elapsedMs, error);
    }

    private static void requireNonNegative(String name, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
