/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.internal.reader;

/**
 * A block of decoded column data covering a contiguous run of rows, one {@link ColumnData}
 * per schema column in schema order.
 * <p>
 * A batch has exactly one owner at a time: the {@link BatchStream} until it is returned from
 * {@link BatchStream#next()}, then the {@link RowCursor} holding it. The owner must call
 * {@link #release()} exactly once when retiring the batch; afterwards its columns are gone.
 * </p>
 */
public final class ColumnBatch {

    private ColumnData[] columns;
    private final int rowCount;

    public ColumnBatch(ColumnData[] columns, int rowCount) {
        if (rowCount < 0) {
            throw new IllegalArgumentException("Row count must not be negative: " + rowCount);
        }
        for (int i = 0; i < columns.length; i++) {
            if (columns[i].recordCount() != rowCount) {
                throw new IllegalArgumentException("Column " + i + " has " + columns[i].recordCount()
                        + " rows, expected " + rowCount);
            }
        }
        this.columns = columns;
        this.rowCount = rowCount;
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return checkLive().length;
    }

    public ColumnData column(int index) {
        return checkLive()[index];
    }

    public boolean isReleased() {
        return columns == null;
    }

    /**
     * Retires this batch, dropping the references to its column data.
     *
     * @throws IllegalStateException if the batch was released before
     */
    public void release() {
        checkLive();
        columns = null;
    }

    private ColumnData[] checkLive() {
        ColumnData[] current = columns;
        if (current == null) {
            throw new IllegalStateException("Column batch has been released");
        }
        return current;
    }

    @Override
    public String toString() {
        return "ColumnBatch[rows=" + rowCount + (isReleased() ? ", released" : "") + "]";
    }
}
