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

import org.apache.parquet.column.ColumnReadStore;
import org.apache.parquet.column.ColumnReader;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;

import dev.datasetsource.schema.ColumnSchema;

/**
 * Decodes the values of one column chunk into {@link ColumnData}, a batch at a time.
 * <p>
 * One decoder exists per column and row group. Flat decoders consume exactly one value per
 * row; the list decoder consumes values until the next repetition level of zero.
 * </p>
 */
abstract class ColumnDecoder {

    protected final ColumnSchema column;

    ColumnDecoder(ColumnSchema column) {
        this.column = column;
    }

    /**
     * Decodes the next {@code rowCount} rows of this column.
     */
    abstract ColumnData readBatch(int rowCount);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + column.name() + "]";
    }

    static ColumnDecoder create(ColumnSchema column, MessageType messageType, ColumnReadStore readStore) {
        switch (column.encoding()) {
            case INT64:
                return new LongDecoder(column, readStore.getColumnReader(column.descriptor()));
            case DOUBLE:
                return new DoubleDecoder(column, readStore.getColumnReader(column.descriptor()));
            case STRING:
                return new StringDecoder(column, readStore.getColumnReader(column.descriptor()));
            case BINARY:
                return new BinaryDecoder(column, readStore.getColumnReader(column.descriptor()));
            case FLOAT_LIST:
                return new FloatListDecoder(column, messageType, readStore.getColumnReader(column.descriptor()));
            default:
                return new UnsupportedDecoder(column);
        }
    }

    /**
     * Base for single-valued columns: one value (or null) per row.
     */
    private abstract static class FlatDecoder extends ColumnDecoder {

        protected final ColumnReader reader;
        private final int maxDefinitionLevel;

        FlatDecoder(ColumnSchema column, ColumnReader reader) {
            super(column);
            this.reader = reader;
            this.maxDefinitionLevel = column.maxDefinitionLevel();
        }

        @Override
        final ColumnData readBatch(int rowCount) {
            allocate(rowCount);
            BitSet nulls = null;
            for (int i = 0; i < rowCount; i++) {
                if (reader.getCurrentDefinitionLevel() == maxDefinitionLevel) {
                    readValue(i);
                }
                else {
                    if (nulls == null) {
                        nulls = new BitSet(rowCount);
                    }
                    nulls.set(i);
                }
                reader.consume();
            }
            return build(nulls, rowCount);
        }

        abstract void allocate(int rowCount);

        abstract void readValue(int index);

        abstract ColumnData build(BitSet nulls, int rowCount);
    }

    private static final class LongDecoder extends FlatDecoder {

        private long[] values;

        LongDecoder(ColumnSchema column, ColumnReader reader) {
            super(column, reader);
        }

        @Override
        void allocate(int rowCount) {
            values = new long[rowCount];
        }

        @Override
        void readValue(int index) {
            values[index] = reader.getLong();
        }

        @Override
        ColumnData build(BitSet nulls, int rowCount) {
            return new ColumnData.LongColumn(values, nulls, rowCount);
        }
    }

    private static final class DoubleDecoder extends FlatDecoder {

        private double[] values;

        DoubleDecoder(ColumnSchema column, ColumnReader reader) {
            super(column, reader);
        }

        @Override
        void allocate(int rowCount) {
            values = new double[rowCount];
        }

        @Override
        void readValue(int index) {
            values[index] = reader.getDouble();
        }

        @Override
        ColumnData build(BitSet nulls, int rowCount) {
            return new ColumnData.DoubleColumn(values, nulls, rowCount);
        }
    }

    private static final class StringDecoder extends FlatDecoder {

        private String[] values;

        StringDecoder(ColumnSchema column, ColumnReader reader) {
            super(column, reader);
        }

        @Override
        void allocate(int rowCount) {
            values = new String[rowCount];
        }

        @Override
        void readValue(int index) {
            values[index] = reader.getBinary().toStringUsingUTF8();
        }

        @Override
        ColumnData build(BitSet nulls, int rowCount) {
            return new ColumnData.StringColumn(values, nulls, rowCount);
        }
    }

    private static final class BinaryDecoder extends FlatDecoder {

        private byte[][] values;

        BinaryDecoder(ColumnSchema column, ColumnReader reader) {
            super(column, reader);
        }

        @Override
        void allocate(int rowCount) {
            values = new byte[rowCount][];
        }

        @Override
        void readValue(int index) {
            Binary binary = reader.getBinary();
            byte[] bytes = binary.getBytes();
            // the reader may overwrite reused buffers on the next page
            values[index] = binary.isBackingBytesReused() ? bytes.clone() : bytes;
        }

        @Override
        ColumnData build(BitSet nulls, int rowCount) {
            return new ColumnData.BinaryColumn(values, nulls, rowCount);
        }
    }

    /**
     * Decodes a float leaf with a single repeated ancestor: the standard three-level
     * {@code LIST} layout as well as a bare {@code repeated float} field.
     */
    private static final class FloatListDecoder extends ColumnDecoder {

        private final ColumnReader reader;
        private final long totalValueCount;
        private final int maxDefinitionLevel;
        // below this level the list or one of its enclosing groups is null
        private final int listDefinitionLevel;
        // at or above this level the row holds at least one element
        private final int elementDefinitionLevel;

        private long valuesRead;
        private float[] buffer = new float[64];

        FloatListDecoder(ColumnSchema column, MessageType messageType, ColumnReader reader) {
            super(column);
            this.reader = reader;
            this.totalValueCount = reader.getTotalValueCount();
            this.maxDefinitionLevel = column.maxDefinitionLevel();

            String[] path = column.descriptor().getPath();
            int repeatedIndex = 0;
            for (int i = 0; i < path.length; i++) {
                if (messageType.getType(Arrays.copyOf(path, i + 1)).isRepetition(Type.Repetition.REPEATED)) {
                    repeatedIndex = i;
                    break;
                }
            }
            // level of the group holding the repeated field; a bare repeated field cannot be null
            this.listDefinitionLevel = repeatedIndex > 0
                    ? messageType.getMaxDefinitionLevel(Arrays.copyOf(path, repeatedIndex))
                    : 0;
            this.elementDefinitionLevel = messageType.getMaxDefinitionLevel(Arrays.copyOf(path, repeatedIndex + 1));
        }

        @Override
        ColumnData readBatch(int rowCount) {
            int[] offsets = new int[rowCount + 1];
            BitSet nulls = null;
            int count = 0;

            for (int row = 0; row < rowCount; row++) {
                offsets[row] = count;
                int definitionLevel = reader.getCurrentDefinitionLevel();

                if (definitionLevel < listDefinitionLevel) {
                    if (nulls == null) {
                        nulls = new BitSet(rowCount);
                    }
                    nulls.set(row);
                    consume();
                }
                else if (definitionLevel < elementDefinitionLevel) {
                    consume();
                }
                else {
                    do {
                        if (count == buffer.length) {
                            buffer = Arrays.copyOf(buffer, buffer.length * 2);
                        }
                        buffer[count++] = reader.getCurrentDefinitionLevel() == maxDefinitionLevel
                                ? reader.getFloat()
                                : Float.NaN;
                        consume();
                    } while (valuesRead < totalValueCount && reader.getCurrentRepetitionLevel() > 0);
                }
            }
            offsets[rowCount] = count;

            return new ColumnData.FloatListColumn(offsets, Arrays.copyOf(buffer, count), nulls, rowCount);
        }

        private void consume() {
            reader.consume();
            valuesRead++;
        }
    }

    private static final class UnsupportedDecoder extends ColumnDecoder {

        UnsupportedDecoder(ColumnSchema column) {
            super(column);
        }

        @Override
        ColumnData readBatch(int rowCount) {
            return new ColumnData.UnsupportedColumn(rowCount);
        }
    }
}
