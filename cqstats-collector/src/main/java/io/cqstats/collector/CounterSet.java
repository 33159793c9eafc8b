package io.cqstats.collector;

import io.cqstats.collector.model.BatchEvent;
import io.cqstats.collector.model.Counters;

/**
 * Mutable accumulators of one execution unit for one query, between two flushes.
 * Not thread safe, the owning {@link LocalAccumulator} guards it.
 */
public class CounterSet {

    private long inputRows;
    private long outputRows;
    private long updatedRows;
    private long inputBytes;
    private long outputBytes;
    private long executions;
    private long processingTimeMs;
    private long errors;

    public void add(BatchEvent event) {
        inputRows += event.inputRows();
        outputRows += event.outputRows();
        updatedRows += event.updatedRows();
        inputBytes += event.inputBytes();
        outputBytes += event.outputBytes();
        executions++;
        processingTimeMs += event.elapsedMs();
        if (event.error()) {
            errors++;
        }
    }

    public Counters snapshot() {
        return new Counters(inputRows, outputRows, updatedRows, inputBytes, outputBytes,
                executions, processingTimeMs, errors);
    }

    /**
     * Returns the accumulated delta and zeroes every counter.
     */
    public Counters snapshotAndReset() {
        Counters delta = snapshot();
        inputRows = 0;
        outputRows = 0;
        updatedRows = 0;
        inputBytes = 0;
        outputBytes = 0;
        executions = 0;
        processingTimeMs = 0;
        errors = 0;
        return delta;
    }

    public boolean isEmpty() {
        return executions == 0;
    }
}
