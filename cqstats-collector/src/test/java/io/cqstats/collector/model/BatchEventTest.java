package io.cqstats.collector.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BatchEventTest {

    @Test
    void rejectsNegativeCounts() {
        assertThrows(IllegalArgumentException.class, () -> BatchEvent.of("q", -1, 0, 0, false));
        assertThrows(IllegalArgumentException.class, () -> new BatchEvent("q", 0, 0, -1, 0, 0, 0, false));
        assertThrows(IllegalArgumentException.class, () -> new StreamCounters(0, -1, 0));
    }

    @Test
    void countersOfBatchCountOneExecution() {
        var counters = Counters.of(BatchEvent.of("q", 10, 2, 4, true));

        assertEquals(1, counters.executions());
        assertEquals(1, counters.errors());
        assertEquals(4, counters.processingTimeMs());
        assertEquals(0, counters.updatedRows());
    }

    @Test
    void unitKindWireNames() {
        assertEquals("worker", UnitKind.WORKER.wireName());
        assertEquals(UnitKind.COMBINER, UnitKind.fromWireName("combiner"));
        assertThrows(IllegalArgumentException.class, () -> UnitKind.fromWireName("reader"));
    }
}
