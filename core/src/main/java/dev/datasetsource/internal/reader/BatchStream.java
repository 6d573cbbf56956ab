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
 * Forward-only, lazily advancing sequence of column batches.
 * <p>
 * Each call to {@link #next()} decodes at most one batch; nothing is read ahead.
 * Ownership of a returned batch passes to the caller.
 * </p>
 */
public interface BatchStream extends AutoCloseable {

    /**
     * Returns the next batch, or {@code null} once the stream is exhausted.
     * Keeps returning {@code null} after exhaustion.
     */
    ColumnBatch next() throws IOException;

    /**
     * Drops any decoder state held by this stream. Does not close the underlying file.
     */
    @Override
    void close();
}
