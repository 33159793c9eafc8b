package io.cqstats.common.types;


import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.TimeStampMilliTZVector;
import org.apache.arrow.vector.VarCharVector;

import java.nio.charset.StandardCharsets;
import java.time.Instant;


public interface VectorWriter<V> {
    void write(V vector, int index, Object value);


    class VarCharVectorWriter implements VectorWriter<VarCharVector> {
        @Override
        public void write(VarCharVector varCharVector, int index, Object value) {
            if (value == null) {
                varCharVector.setNull(index);
                return;
            }
            var v = value.toString();
            varCharVector.setSafe(index, v.getBytes(StandardCharsets.UTF_8));
        }
    }

    class IntVectorWriter implements VectorWriter<IntVector> {
        @Override
        public void write(IntVector intVector, int index, Object value) {
            if (value == null) {
                intVector.setNull(index);
                return;
            }
            var v = ((Number) value).intValue();
            intVector.setSafe(index, v);
        }
    }

    class BigVectorWriter implements VectorWriter<BigIntVector> {
        @Override
        public void write(BigIntVector bigIntVector, int index, Object value) {
            if (value == null) {
                bigIntVector.setNull(index);
                return;
            }
            var v = ((Number) value).longValue();
            bigIntVector.setSafe(index, v);
        }
    }

    /**
     * Accepts either epoch millis or an {@link Instant}.
     */
    class TimeStampMilliTZVectorWriter implements VectorWriter<TimeStampMilliTZVector> {
        @Override
        public void write(TimeStampMilliTZVector timeStampMilliTZVector, int index, Object value) {
            if (value == null) {
                timeStampMilliTZVector.setNull(index);
                return;
            }
            long v = value instanceof Instant instant ? instant.toEpochMilli() : ((Number) value).longValue();
            timeStampMilliTZVector.setSafe(index, v);
        }
    }
}
