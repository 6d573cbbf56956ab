/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.internal.reader;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Assembles a row from one value per column of a held batch.
 * <p>
 * Values are produced by {@link ColumnData#getValue(int)}: {@link Long}, {@link Double},
 * {@link String}, {@code byte[]} and {@code float[]} for the supported encodings, {@code null}
 * for null slots and for columns of unsupported encodings. The returned row does not
 * reference the batch and stays valid after the batch is released.
 * </p>
 */
public final class RowMaterializer {

    private final int columnCount;

    public RowMaterializer(int columnCount) {
        this.columnCount = columnCount;
    }

    public List<Object> materialize(ColumnBatch batch, int rowIndex) {
        if (batch.columnCount() != columnCount) {
            throw new IllegalStateException("Batch has " + batch.columnCount() + " columns, schema has " + columnCount);
        }
        if (rowIndex < 0 || rowIndex >= batch.rowCount()) {
            throw new IndexOutOfBoundsException("Row " + rowIndex + " outside batch of " + batch.rowCount() + " rows");
        }

        Object[] values = new Object[columnCount];
        for (int i = 0; i < columnCount; i++) {
            values[i] = batch.column(i).getValue(rowIndex);
        }
        return Collections.unmodifiableList(Arrays.asList(values));
    }
}
