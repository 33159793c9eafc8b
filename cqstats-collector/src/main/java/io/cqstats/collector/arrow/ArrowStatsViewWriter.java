package io.cqstats.collector.arrow;

import io.cqstats.collector.StatsViewBuilder;
import io.cqstats.collector.model.ProcStats;
import io.cqstats.collector.model.QueryStats;
import io.cqstats.collector.model.StreamStats;
import io.cqstats.common.types.JavaRow;
import io.cqstats.common.types.VectorSchemaRootWriter;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders the statistics views as Arrow record batches for the query layer.
 * Returned roots are owned by the caller and must be closed.
 */
public class ArrowStatsViewWriter {

    private static final Logger log = LoggerFactory.getLogger(ArrowStatsViewWriter.class);

    private static final VectorSchemaRootWriter PROC_WRITER = VectorSchemaRootWriter.of(StatsViewSchemas.PROC_STATS);
    private static final VectorSchemaRootWriter QUERY_WRITER = VectorSchemaRootWriter.of(StatsViewSchemas.QUERY_STATS);
    private static final VectorSchemaRootWriter STREAM_WRITER = VectorSchemaRootWriter.of(StatsViewSchemas.STREAM_STATS);

    private final StatsViewBuilder views;
    private final BufferAllocator allocator;

    public ArrowStatsViewWriter(StatsViewBuilder views, BufferAllocator allocator) {
        this.views = views;
        this.allocator = allocator;
    }

    public VectorSchemaRoot procStats() {
        return write(PROC_WRITER, views.listProcStats().stream().map(ArrowStatsViewWriter::toRow).toList());
    }

    public VectorSchemaRoot queryStats() {
        return write(QUERY_WRITER, views.listQueryStats().stream().map(ArrowStatsViewWriter::toRow).toList());
    }

    public VectorSchemaRoot streamStats() {
        return write(STREAM_WRITER, views.listStreamStats().stream().map(ArrowStatsViewWriter::toRow).toList());
    }

    /**
     * Serialize a root as a single-batch Arrow IPC stream.
     */
    public static byte[] toArrowBytes(VectorSchemaRoot root) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            try (ArrowStreamWriter writer = new ArrowStreamWriter(root, null, out)) {
                writer.start();
                writer.writeBatch();
                writer.end();
            }
            log.debug("Serialized {} rows ({} bytes)", root.getRowCount(), out.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to convert stats view to Arrow format", e);
        }
    }

    private VectorSchemaRoot write(VectorSchemaRootWriter writer, List<JavaRow> rows) {
        Schema schema = writer.getSchema();
        VectorSchemaRoot root = VectorSchemaRoot.create(schema, allocator);
        try {
            return writer.writeToVector(rows.toArray(new JavaRow[0]), root);
        } catch (RuntimeException e) {
            root.close();
            throw e;
        }
    }

    static JavaRow toRow(ProcStats stats) {
        return new JavaRow(new Object[]{
                stats.unitId(),
                stats.kind().wireName(),
                stats.startTime(),
                stats.counters().inputRows(),
                stats.counters().outputRows(),
                stats.counters().updatedRows(),
                stats.counters().executions(),
                stats.counters().processingTimeMs(),
                stats.counters().errors()
        });
    }

    static JavaRow toRow(QueryStats stats) {
        return new JavaRow(new Object[]{
                stats.queryName(),
                stats.kind().wireName(),
                stats.counters().inputRows(),
                stats.counters().outputRows(),
                stats.counters().updatedRows(),
                stats.counters().inputBytes(),
                stats.counters().outputBytes(),
                stats.counters().executions(),
                stats.counters().processingTimeMs(),
                stats.counters().errors()
        });
    }

    static JavaRow toRow(StreamStats stats) {
        return new JavaRow(new Object[]{
                stats.streamName(),
                stats.counters().inputRows(),
                stats.counters().inputBatches(),
                stats.counters().inputBytes()
        });
    }
}
