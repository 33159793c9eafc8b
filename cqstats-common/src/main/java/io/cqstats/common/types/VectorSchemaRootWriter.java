package io.cqstats.common.types;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.List;


public class VectorSchemaRootWriter {

    @SuppressWarnings("rawtypes")
    private final VectorWriter[] functions;
    private final Schema schema;

    public VectorSchemaRootWriter(Schema schema,
                                  @SuppressWarnings("rawtypes") VectorWriter... functions) {
        this.functions = functions;
        this.schema = schema;
    }

    public Schema getSchema() {
        return schema;
    }

    public VectorSchemaRoot writeToVector(JavaRow[] rows, VectorSchemaRoot root) {
        root.allocateNew();
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].width() != functions.length) {
                throw new IllegalArgumentException("Row %d has %d values, schema has %d fields"
                        .formatted(i, rows[i].width(), functions.length));
            }
            for (int j = 0; j < functions.length; j++) {
                VectorWriter function = functions[j];
                FieldVector vector = root.getVector(j);
                //noinspection unchecked
                function.write(vector, i, rows[i].get(j));
            }
        }
        root.setRowCount(rows.length);
        return root;
    }

    public static VectorSchemaRootWriter of(Schema schema) {
        List<VectorWriter<?>> listOfFunctions = new ArrayList<>();
        for (Field field : schema.getFields()) {
            listOfFunctions.add(createWriter(field));
        }
        return new VectorSchemaRootWriter(schema, listOfFunctions.toArray(new VectorWriter[0]));
    }

    private static VectorWriter<?> createWriter(Field field) {
        ArrowType type = field.getType();
        if (type instanceof ArrowType.Int) {
            ArrowType.Int intType = (ArrowType.Int) type;
            if (intType.getBitWidth() == 32) return new VectorWriter.IntVectorWriter();
            else if (intType.getBitWidth() == 64) return new VectorWriter.BigVectorWriter();
            else throw new UnsupportedOperationException("Unsupported int bit width: " + intType.getBitWidth());
        } else if (type instanceof ArrowType.Utf8) {
            return new VectorWriter.VarCharVectorWriter();
        } else if (type instanceof ArrowType.Timestamp) {
            return new VectorWriter.TimeStampMilliTZVectorWriter();
        } else {
            throw new UnsupportedOperationException("Unsupported ArrowType: " + type);
        }
    }
}
