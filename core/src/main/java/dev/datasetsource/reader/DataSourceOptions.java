/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.reader;

/**
 * Settings for opening a {@link ParquetFileDataSource}.
 *
 * <p>Usage examples:</p>
 * <pre>{@code
 * // Read from the first row until the end of the file
 * DataSourceOptions.defaults()
 *
 * // Start at row 1000 and wrap around at the end of the file
 * DataSourceOptions.defaults().withStartOffset(1000).withCircular(true)
 * }</pre>
 *
 * <p>The default batch size can be changed with the {@value #BATCH_SIZE_PROPERTY} system property.</p>
 */
public final class DataSourceOptions {

    public static final String BATCH_SIZE_PROPERTY = "datasetsource.batchSize";

    public static final int DEFAULT_BATCH_SIZE = 2048;

    private static final System.Logger LOG = System.getLogger(DataSourceOptions.class.getName());

    private final long startOffset;
    private final boolean circular;
    private final int batchSize;

    private DataSourceOptions(long startOffset, boolean circular, int batchSize) {
        if (startOffset < 0) {
            throw new IllegalArgumentException("Start offset must not be negative: " + startOffset);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.startOffset = startOffset;
        this.circular = circular;
        this.batchSize = batchSize;
    }

    /**
     * Linear reading from the first row with the default batch size.
     */
    public static DataSourceOptions defaults() {
        return new DataSourceOptions(0, false, defaultBatchSize());
    }

    public static DataSourceOptions of(long startOffset, boolean circular) {
        return new DataSourceOptions(startOffset, circular, defaultBatchSize());
    }

    private static int defaultBatchSize() {
        String configured = System.getProperty(BATCH_SIZE_PROPERTY);
        if (configured == null || configured.isBlank()) {
            return DEFAULT_BATCH_SIZE;
        }
        int batchSize;
        try {
            batchSize = Integer.parseInt(configured.trim());
        }
        catch (NumberFormatException e) {
            batchSize = -1;
        }
        if (batchSize > 0) {
            return batchSize;
        }
        LOG.log(System.Logger.Level.WARNING, "Ignoring invalid value ''{0}'' of system property {1}, using {2}",
                configured, BATCH_SIZE_PROPERTY, DEFAULT_BATCH_SIZE);
        return DEFAULT_BATCH_SIZE;
    }

    public DataSourceOptions withStartOffset(long startOffset) {
        return new DataSourceOptions(startOffset, circular, batchSize);
    }

    public DataSourceOptions withCircular(boolean circular) {
        return new DataSourceOptions(startOffset, circular, batchSize);
    }

    /**
     * Maximum number of rows decoded at once. Batches never span row groups, so they can be smaller.
     */
    public DataSourceOptions withBatchSize(int batchSize) {
        return new DataSourceOptions(startOffset, circular, batchSize);
    }

    /**
     * Number of rows skipped before the first row is returned.
     */
    public long getStartOffset() {
        return startOffset;
    }

    /**
     * Whether reading restarts at the first row once the file is exhausted.
     */
    public boolean isCircular() {
        return circular;
    }

    public int getBatchSize() {
        return batchSize;
    }

    @Override
    public String toString() {
        return "DataSourceOptions[startOffset=" + startOffset + ", circular=" + circular + ", batchSize=" + batchSize + "]";
    }
}
