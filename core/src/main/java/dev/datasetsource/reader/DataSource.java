/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.reader;

import java.io.IOException;
import java.util.List;

/**
 * A source of rows for workload generators, independent of the underlying storage format.
 * <p>
 * Instances are not thread-safe. Parallel workers must each open their own source.
 * </p>
 */
public interface DataSource extends AutoCloseable {

    /**
     * Returns the column names in row order. The list is immutable and does not change
     * over the lifetime of the source.
     */
    List<String> columnNames();

    /**
     * Returns the next row, one value per column in {@link #columnNames()} order, or
     * {@code null} when all rows have been read. Sources reading circularly never run out.
     *
     * @throws IllegalStateException if the source has been closed
     */
    List<Object> nextRow() throws IOException;

    /**
     * Releases all resources held by this source. Calling it again has no effect.
     */
    @Override
    void close();
}
