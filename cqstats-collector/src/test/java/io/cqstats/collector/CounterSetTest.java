package io.cqstats.collector;

import io.cqstats.collector.model.BatchEvent;
import io.cqstats.collector.model.Counters;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CounterSetTest {

    @Test
    void addsBatchesFieldWise() {
        var set = new CounterSet();
        set.add(new BatchEvent("q", 100, 10, 2, 800, 80, 5, false));
        set.add(new BatchEvent("q", 50, 5, 3, 400, 40, 7, true));

        assertEquals(new Counters(150, 15, 5, 1200, 120, 2, 12, 1), set.snapshot());
        assertFalse(set.isEmpty());
    }

    @Test
    void snapshotAndResetReturnsDeltaOnce() {
        var set = new CounterSet();
        set.add(BatchEvent.of("q", 1000, 10, 3, false));

        var delta = set.snapshotAndReset();

        assertEquals(1000, delta.inputRows());
        assertEquals(1, delta.executions());
        assertTrue(set.isEmpty());
        assertEquals(Counters.ZERO, set.snapshot());
        assertEquals(Counters.ZERO, set.snapshotAndReset());
    }

    @Test
    void emptyBatchStillCountsAsExecution() {
        var set = new CounterSet();
        set.add(BatchEvent.of("q", 0, 0, 0, false));

        assertFalse(set.isEmpty());
        assertEquals(1, set.snapshot().executions());
    }
}
