/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.internal.reader;

import java.io.IOException;

import dev.datasetsource.reader.ResetExhaustedException;

/**
 * Keeps a {@link RowCursor} supplied with batches and decides what happens when the
 * {@link BatchStream} runs dry.
 * <p>
 * In linear mode exhaustion is reported to the caller as end of data. In circular mode the
 * exhausted stream is discarded and a fresh one is opened at the first row of the file; if
 * that fresh stream yields no rows either, the file is empty or broken and a
 * {@link ResetExhaustedException} is thrown.
 * </p>
 * Not thread-safe; one instance belongs to exactly one data source.
 */
public final class CircularBatchController implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(CircularBatchController.class.getName());

    private final BatchStreamFactory streamFactory;
    private final boolean circular;
    private final RowCursor cursor = new RowCursor();

    private BatchStream stream;
    private long resetCount;
    private boolean closed;

    public CircularBatchController(BatchStreamFactory streamFactory, boolean circular) throws IOException {
        this.streamFactory = streamFactory;
        this.circular = circular;
        this.stream = streamFactory.open();
    }

    public RowCursor cursor() {
        return cursor;
    }

    public boolean isCircular() {
        return circular;
    }

    /**
     * Number of times the stream has been restarted from the first row.
     */
    public long resetCount() {
        return resetCount;
    }

    /**
     * Makes sure the cursor holds a batch with at least one unread row.
     *
     * @return {@code false} if the data is exhausted in linear mode
     * @throws ResetExhaustedException if a circular restart produces no rows
     */
    public boolean ensureBatch() throws IOException {
        checkOpen();
        if (!cursor.isEmpty()) {
            return true;
        }
        if (cursor.fetch(stream)) {
            return true;
        }
        if (!circular) {
            return false;
        }
        reset();
        if (!cursor.fetch(stream)) {
            throw new ResetExhaustedException("No rows available after restarting from the first row group");
        }
        return true;
    }

    /**
     * Skips the next {@code rowsToSkip} rows, crossing batch boundaries and, in circular mode,
     * wrapping around the end of the file as often as needed. In linear mode, skipping beyond
     * the last row simply leaves nothing to read.
     *
     * @throws IllegalArgumentException if {@code rowsToSkip} is negative
     * @throws ResetExhaustedException if a circular restart produces no rows
     */
    public void skipUntilOffset(long rowsToSkip) throws IOException {
        if (rowsToSkip < 0) {
            throw new IllegalArgumentException("Rows to skip must not be negative: " + rowsToSkip);
        }
        long remaining = rowsToSkip;
        try {
            while (remaining > 0) {
                if (!ensureBatch()) {
                    LOG.log(System.Logger.Level.DEBUG, "Data exhausted with {0} of {1} rows left to skip",
                            remaining, rowsToSkip);
                    return;
                }
                int skipped = (int) Math.min(remaining, cursor.remaining());
                cursor.advance(skipped);
                remaining -= skipped;
            }
        }
        catch (IOException | RuntimeException e) {
            cursor.release();
            throw e;
        }
    }

    /**
     * Discards the current stream and any held batch, then opens a new stream at the first row.
     */
    private void reset() throws IOException {
        cursor.release();
        BatchStream exhausted = stream;
        stream = null;
        closeQuietly(exhausted);
        stream = streamFactory.open();
        resetCount++;
        LOG.log(System.Logger.Level.DEBUG, "Restarted batch stream from the first row (reset #{0})", resetCount);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Batch controller is closed");
        }
        if (stream == null) {
            throw new IllegalStateException("No batch stream available after a failed restart");
        }
    }

    /**
     * Releases the held batch and closes the stream. Idempotent; failures are logged, not thrown.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            cursor.release();
        }
        catch (RuntimeException e) {
            LOG.log(System.Logger.Level.WARNING, "Failed to release column batch", e);
        }
        BatchStream current = stream;
        stream = null;
        closeQuietly(current);
    }

    private static void closeQuietly(BatchStream stream) {
        if (stream == null) {
            return;
        }
        try {
            stream.close();
        }
        catch (RuntimeException e) {
            LOG.log(System.Logger.Level.WARNING, "Failed to close batch stream", e);
        }
    }
}
