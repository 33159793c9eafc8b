package io.cqstats.collector;

import io.cqstats.collector.model.Counters;
import io.cqstats.collector.model.ProcStats;
import io.cqstats.collector.model.ProcStatsKey;
import io.cqstats.collector.model.QueryStatsKey;
import io.cqstats.collector.model.StreamCounters;
import io.cqstats.collector.model.UnitKind;
import io.cqstats.collector.sink.InMemoryStatsSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class StatsViewBuilderTest {

    private ProcessRegistry registry;
    private InMemoryStatsSink sink;
    private StatsViewBuilder views;

    @BeforeEach
    void setUp() {
        registry = new ProcessRegistry(1, 1, new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
        sink = new InMemoryStatsSink();
        views = new StatsViewBuilder(registry, sink);
    }

    @Test
    void liveUnitsWithoutFlushReadAsZeroRows() {
        registry.register("worker-0", UnitKind.WORKER);
        registry.register("combiner-0", UnitKind.COMBINER);

        var rows = views.listProcStats();

        assertEquals(2, rows.size());
        assertTrue(rows.stream().allMatch(r -> r.counters().isZero()));
        assertEquals(registry.count(UnitKind.WORKER) + registry.count(UnitKind.COMBINER), rows.size());
    }

    @Test
    void procRowsOfDeadUnitsAreHidden() {
        registry.register("worker-0", UnitKind.WORKER);
        sink.merge(new ProcStatsKey("worker-9"), new QueryStatsKey("q", UnitKind.WORKER),
                new Counters(5, 0, 0, 0, 0, 1, 0, 0));

        var rows = views.listProcStats();

        assertEquals(1, rows.size());
        assertEquals("worker-0", rows.get(0).unitId());
        assertTrue(views.getProcStats("worker-9").isEmpty());
    }

    @Test
    void procRowCarriesStartTimeAndCounters() {
        registry.register("worker-0", UnitKind.WORKER);
        sink.merge(new ProcStatsKey("worker-0"), new QueryStatsKey("q", UnitKind.WORKER),
                new Counters(5, 2, 0, 0, 0, 1, 3, 0));

        ProcStats row = views.getProcStats("worker-0").orElseThrow();

        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), row.startTime());
        assertEquals(5, row.inputRows());
        assertEquals(3, row.processingTimeMs());
    }

    @Test
    void unknownQueryAndStreamReadAsZero() {
        assertTrue(views.getQueryStats("missing", UnitKind.WORKER).counters().isZero());
        assertEquals(StreamCounters.ZERO, views.getStreamStats("missing").counters());
        assertTrue(views.listQueryStats().isEmpty());
    }

    @Test
    void listsQueryAndStreamRowsInKeyOrder() {
        var delta = new Counters(1, 1, 0, 0, 0, 1, 0, 0);
        sink.merge(new ProcStatsKey("w"), new QueryStatsKey("b", UnitKind.WORKER), delta);
        sink.merge(new ProcStatsKey("w"), new QueryStatsKey("a", UnitKind.COMBINER), delta);
        sink.merge(new ProcStatsKey("w"), new QueryStatsKey("a", UnitKind.WORKER), delta);
        sink.mergeStream("s", new StreamCounters(10, 1, 40));

        var queries = views.listQueryStats();

        assertEquals(3, queries.size());
        assertEquals(new QueryStatsKey("a", UnitKind.WORKER), queries.get(0).key());
        assertEquals(new QueryStatsKey("a", UnitKind.COMBINER), queries.get(1).key());
        assertEquals(new QueryStatsKey("b", UnitKind.WORKER), queries.get(2).key());
        assertEquals(10, views.getStreamStats("s").counters().inputRows());
        assertEquals(1, views.listStreamStats().size());
    }

    @Test
    void readsWithoutMergeAreIdentical() {
        registry.register("worker-0", UnitKind.WORKER);
        sink.merge(new ProcStatsKey("worker-0"), new QueryStatsKey("q", UnitKind.WORKER),
                new Counters(5, 2, 0, 0, 0, 1, 3, 0));

        assertEquals(views.listProcStats(), views.listProcStats());
        assertEquals(views.listQueryStats(), views.listQueryStats());
    }
}
