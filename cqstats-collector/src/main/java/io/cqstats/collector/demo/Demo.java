package io.cqstats.collector.demo;

import io.cqstats.collector.StatsCollector;
import io.cqstats.collector.model.BatchEvent;
import io.cqstats.collector.model.ExecutionUnit;
import io.cqstats.collector.model.UnitKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Drives a collector with a synthetic workload: rows are inserted into a stream, every micro-batch is
 * processed by one worker per query, and the worker's partial groups are folded in by a combiner.
 * Combiners report groups seen for the first time as output rows and groups already present as
 * updated rows.
 */
public class Demo {

    private static final Logger log = LoggerFactory.getLogger(Demo.class);

    /**
     * A continuous query grouping {@code x % groups}.
     */
    public record GroupingQuery(String name, int groups) {
    }

    private final StatsCollector collector;
    private final List<GroupingQuery> queries;
    private final Random random;
    private final Map<String, Set<Integer>> combinedGroups = new HashMap<>();
    private int nextWorker;
    private int nextCombiner;

    public Demo(StatsCollector collector, List<GroupingQuery> queries, long seed) {
        this.collector = collector;
        this.queries = queries;
        this.random = new Random(seed);
    }

    /**
     * Insert one micro-batch of {@code rows} random values into the stream and run every query on it.
     */
    public void insert(String streamName, int rows) {
        int[] values = new int[rows];
        for (int i = 0; i < rows; i++) {
            values[i] = random.nextInt(1024) + 1;
        }
        collector.onStreamInsert(streamName, rows, 1, rows * (long) Integer.BYTES);

        var worker = pick(UnitKind.WORKER, nextWorker++);
        var combiner = pick(UnitKind.COMBINER, nextCombiner++);
        for (GroupingQuery query : queries) {
            long started = System.nanoTime();
            Set<Integer> partial = new HashSet<>();
            for (int value : values) {
                partial.add(value % query.groups());
            }
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            collector.onBatchComplete(worker.unitId(), UnitKind.WORKER,
                    BatchEvent.of(query.name(), rows, partial.size(), elapsedMs, false));

            var seen = combinedGroups.computeIfAbsent(query.name(), q -> new HashSet<>());
            int inserted = 0;
            for (Integer group : partial) {
                if (seen.add(group)) {
                    inserted++;
                }
            }
            collector.onBatchComplete(combiner.unitId(), UnitKind.COMBINER,
                    new BatchEvent(query.name(), partial.size(), inserted, partial.size() - inserted,
                            0, 0, 0, false));
        }
        log.debug("Inserted {} rows into {} via {} and {}", rows, streamName, worker.unitId(), combiner.unitId());
    }

    public void report() {
        collector.views().listProcStats().forEach(row ->
                log.info("proc {} {} input_rows={} output_rows={} executions={}",
                        row.kind().wireName(), row.unitId(), row.inputRows(), row.outputRows(),
                        row.counters().executions()));
        collector.views().listQueryStats().forEach(row ->
                log.info("query {} {} input_rows={} output_rows={} updated_rows={}",
                        row.queryName(), row.kind().wireName(), row.inputRows(), row.outputRows(),
                        row.counters().updatedRows()));
        collector.views().listStreamStats().forEach(row ->
                log.info("stream {} input_rows={} input_batches={}",
                        row.streamName(), row.counters().inputRows(), row.counters().inputBatches()));
    }

    private ExecutionUnit pick(UnitKind kind, int turn) {
        var units = collector.registry().liveUnits().stream()
                .filter(u -> u.kind() == kind)
                .toList();
        if (units.isEmpty()) {
            throw new IllegalStateException("No live " + kind.wireName() + " units");
        }
        return units.get(turn % units.size());
    }
}
