/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.internal.reader;

import java.io.IOException;

/**
 * Position within the current batch.
 * <p>
 * The cursor is either empty or holds one batch together with the offset of the next unread
 * row. Once the offset reaches the batch's row count the batch is released and the cursor is
 * empty again. Batches are only fetched on request, never ahead of time.
 * </p>
 */
public final class RowCursor {

    private ColumnBatch batch;
    private int offset;

    public boolean isEmpty() {
        return batch == null;
    }

    /**
     * Takes the next batch from the stream. Zero-row batches are released and skipped.
     *
     * @return {@code false} if the stream is exhausted, in which case the cursor stays empty
     * @throws IllegalStateException if a batch is already held
     */
    public boolean fetch(BatchStream stream) throws IOException {
        if (batch != null) {
            throw new IllegalStateException("Cursor already holds a batch");
        }
        while (true) {
            ColumnBatch next = stream.next();
            if (next == null) {
                return false;
            }
            if (next.rowCount() > 0) {
                batch = next;
                offset = 0;
                return true;
            }
            next.release();
        }
    }

    /**
     * The held batch; only valid while the cursor is not empty.
     */
    public ColumnBatch batch() {
        if (batch == null) {
            throw new IllegalStateException("Cursor holds no batch");
        }
        return batch;
    }

    /**
     * Offset of the next unread row within the held batch.
     */
    public int offset() {
        return offset;
    }

    /**
     * Rows not yet consumed from the held batch, zero when empty.
     */
    public int remaining() {
        return batch == null ? 0 : batch.rowCount() - offset;
    }

    /**
     * Moves past {@code rows} rows of the held batch, releasing it when its last row is passed.
     *
     * @throws IllegalArgumentException if {@code rows} is negative or exceeds {@link #remaining()}
     */
    public void advance(int rows) {
        if (rows < 0 || rows > remaining()) {
            throw new IllegalArgumentException("Cannot advance by " + rows + " rows, " + remaining() + " remaining");
        }
        offset += rows;
        if (batch != null && offset == batch.rowCount()) {
            release();
        }
    }

    /**
     * Releases the held batch, if any, and returns to the empty state.
     */
    public void release() {
        ColumnBatch held = batch;
        batch = null;
        offset = 0;
        if (held != null) {
            held.release();
        }
    }
}
