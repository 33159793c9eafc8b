package io.cqstats.collector.arrow;

import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;

/**
 * Arrow schemas of the statistics views, in column order.
 */
public final class StatsViewSchemas {

    private StatsViewSchemas() {
    }

    public static final Schema PROC_STATS = new Schema(List.of(
            utf8("unit_id"),
            utf8("kind"),
            new Field("start_time", FieldType.notNullable(new ArrowType.Timestamp(TimeUnit.MILLISECOND, "UTC")), null),
            int64("input_rows"),
            int64("output_rows"),
            int64("updated_rows"),
            int64("executions"),
            int64("processing_time_ms"),
            int64("errors")
    ));

    public static final Schema QUERY_STATS = new Schema(List.of(
            utf8("query_name"),
            utf8("kind"),
            int64("input_rows"),
            int64("output_rows"),
            int64("updated_rows"),
            int64("input_bytes"),
            int64("output_bytes"),
            int64("executions"),
            int64("processing_time_ms"),
            int64("errors")
    ));

    public static final Schema STREAM_STATS = new Schema(List.of(
            utf8("stream_name"),
            int64("input_rows"),
            int64("input_batches"),
            int64("input_bytes")
    ));

    private static Field utf8(String name) {
        return new Field(name, FieldType.notNullable(new ArrowType.Utf8()), null);
    }

    private static Field int64(String name) {
        return new Field(name, FieldType.notNullable(new ArrowType.Int(64, true)), null);
    }
}
