/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.internal.reader;

import java.util.Arrays;
import java.util.BitSet;

import dev.datasetsource.schema.ColumnEncoding;

/**
 * Typed values of one column within a {@link ColumnBatch}.
 * <p>
 * There is one record per supported encoding plus {@link UnsupportedColumn}, whose values are
 * always {@code null}. {@link #getValue(int)} returns caller-owned values: arrays are copied,
 * so nothing handed out aliases the batch.
 * </p>
 */
public sealed interface ColumnData {

    ColumnEncoding encoding();

    /** Number of rows covered by this column. */
    int recordCount();

    /** Get the value of the given row, boxing primitives; {@code null} for null slots. */
    Object getValue(int index);

    /** Null flags, or {@code null} if the column holds no nulls. */
    BitSet nulls();

    default boolean isNull(int index) {
        BitSet n = nulls();
        return n != null && n.get(index);
    }

    record LongColumn(long[] values, BitSet nulls, int recordCount) implements ColumnData {
        public long get(int index) {
            return values[index];
        }

        @Override
        public ColumnEncoding encoding() {
            return ColumnEncoding.INT64;
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : get(index);
        }
    }

    record DoubleColumn(double[] values, BitSet nulls, int recordCount) implements ColumnData {
        public double get(int index) {
            return values[index];
        }

        @Override
        public ColumnEncoding encoding() {
            return ColumnEncoding.DOUBLE;
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : get(index);
        }
    }

    record StringColumn(String[] values, BitSet nulls, int recordCount) implements ColumnData {
        public String get(int index) {
            return values[index];
        }

        @Override
        public ColumnEncoding encoding() {
            return ColumnEncoding.STRING;
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : get(index);
        }
    }

    record BinaryColumn(byte[][] values, BitSet nulls, int recordCount) implements ColumnData {
        public byte[] get(int index) {
            return values[index];
        }

        @Override
        public ColumnEncoding encoding() {
            return ColumnEncoding.BINARY;
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : get(index).clone();
        }
    }

    /**
     * List-of-float column. The elements of row {@code i} are
     * {@code values[offsets[i]] .. values[offsets[i + 1] - 1]}; {@code offsets} has
     * {@code recordCount + 1} entries.
     */
    record FloatListColumn(int[] offsets, float[] values, BitSet nulls, int recordCount) implements ColumnData {
        public int start(int index) {
            return offsets[index];
        }

        public int end(int index) {
            return offsets[index + 1];
        }

        @Override
        public ColumnEncoding encoding() {
            return ColumnEncoding.FLOAT_LIST;
        }

        @Override
        public Object getValue(int index) {
            if (isNull(index)) {
                return null;
            }
            return Arrays.copyOfRange(values, start(index), end(index));
        }
    }

    /**
     * Placeholder for columns whose encoding is not materialized.
     */
    record UnsupportedColumn(int recordCount) implements ColumnData {
        @Override
        public ColumnEncoding encoding() {
            return ColumnEncoding.UNSUPPORTED;
        }

        @Override
        public Object getValue(int index) {
            return null;
        }

        @Override
        public BitSet nulls() {
            return null;
        }

        @Override
        public boolean isNull(int index) {
            return true;
        }
    }
}
