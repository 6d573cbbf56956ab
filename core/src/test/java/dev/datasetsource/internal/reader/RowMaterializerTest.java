/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.internal.reader;

import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowMaterializerTest {

    private static ColumnBatch twoRowBatch() {
        BitSet secondNull = new BitSet();
        secondNull.set(1);

        ColumnData[] columns = {
                new ColumnData.LongColumn(new long[]{ 7L, 8L }, null, 2),
                new ColumnData.DoubleColumn(new double[]{ 0.5d, 0d }, secondNull, 2),
                new ColumnData.StringColumn(new String[]{ "a", "b" }, null, 2),
                new ColumnData.BinaryColumn(new byte[][]{ "x".getBytes(StandardCharsets.UTF_8), new byte[]{ 1, 2 } }, null, 2),
                new ColumnData.FloatListColumn(new int[]{ 0, 2, 2 }, new float[]{ 1.0f, 2.0f }, null, 2),
                new ColumnData.UnsupportedColumn(2)
        };
        return new ColumnBatch(columns, 2);
    }

    @Test
    void testMaterializesOneValuePerColumnInOrder() {
        RowMaterializer materializer = new RowMaterializer(6);
        ColumnBatch batch = twoRowBatch();

        List<Object> row = materializer.materialize(batch, 0);

        assertThat(row).hasSize(6);
        assertThat(row.get(0)).isEqualTo(7L);
        assertThat(row.get(1)).isEqualTo(0.5d);
        assertThat(row.get(2)).isEqualTo("a");
        assertThat((byte[]) row.get(3)).containsExactly((byte) 'x');
        assertThat((float[]) row.get(4)).containsExactly(1.0f, 2.0f);
        assertThat(row.get(5)).isNull();
    }

    @Test
    void testNullSlotsAndEmptyLists() {
        RowMaterializer materializer = new RowMaterializer(6);

        List<Object> row = materializer.materialize(twoRowBatch(), 1);

        assertThat(row.get(0)).isEqualTo(8L);
        assertThat(row.get(1)).isNull();
        assertThat((float[]) row.get(4)).isEmpty();
        assertThat(row.get(5)).isNull();
    }

    @Test
    void testValuesRemainValidAfterRelease() {
        RowMaterializer materializer = new RowMaterializer(6);
        ColumnBatch batch = twoRowBatch();
        ColumnData.FloatListColumn embedding = (ColumnData.FloatListColumn) batch.column(4);
        ColumnData.BinaryColumn payload = (ColumnData.BinaryColumn) batch.column(3);

        List<Object> row = materializer.materialize(batch, 0);
        batch.release();

        // the values must not alias the column buffers
        embedding.values()[0] = 99f;
        payload.get(0)[0] = 0;
        assertThat((float[]) row.get(4)).containsExactly(1.0f, 2.0f);
        assertThat((byte[]) row.get(3)).containsExactly((byte) 'x');
    }

    @Test
    void testRowIsImmutable() {
        List<Object> row = new RowMaterializer(6).materialize(twoRowBatch(), 0);

        assertThatThrownBy(() -> row.set(0, 1L)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testReleasedBatchCannotBeMaterialized() {
        ColumnBatch batch = twoRowBatch();
        batch.release();

        assertThatThrownBy(() -> new RowMaterializer(6).materialize(batch, 0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("released");
        assertThatThrownBy(batch::release).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testRowIndexOutsideBatchFails() {
        assertThatThrownBy(() -> new RowMaterializer(6).materialize(twoRowBatch(), 2))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testColumnCountMismatchFails() {
        assertThatThrownBy(() -> new RowMaterializer(3).materialize(twoRowBatch(), 0))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testBatchRejectsColumnsOfDifferentLength() {
        ColumnData[] columns = {
                new ColumnData.LongColumn(new long[]{ 1L, 2L }, null, 2),
                new ColumnData.UnsupportedColumn(3)
        };

        assertThatThrownBy(() -> new ColumnBatch(columns, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
