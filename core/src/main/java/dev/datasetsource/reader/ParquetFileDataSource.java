/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.reader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.io.InputFile;

import dev.datasetsource.internal.reader.CircularBatchController;
import dev.datasetsource.internal.reader.ParquetBatchStream;
import dev.datasetsource.internal.reader.RowCursor;
import dev.datasetsource.internal.reader.RowMaterializer;
import dev.datasetsource.schema.FileSchema;

/**
 * {@link DataSource} reading all columns of a Parquet file row by row.
 *
 * <pre>{@code
 * try (ParquetFileDataSource source = ParquetFileDataSource.open(path, 1000, true)) {
 *     List<String> columns = source.columnNames();
 *     List<Object> row = source.nextRow();
 *     // ...
 * }
 * }</pre>
 *
 * <p>Reading starts at the configured start offset. In circular mode the source restarts at the
 * first row whenever the file is exhausted and never reports end of data; otherwise
 * {@link #nextRow()} returns {@code null} once the last row has been read.</p>
 *
 * <p>At most one decoded batch is held at any time. Instances are not thread-safe.</p>
 */
public final class ParquetFileDataSource implements DataSource {

    private static final System.Logger LOG = System.getLogger(ParquetFileDataSource.class.getName());

    private final Path path;
    private final ParquetFileReader fileReader;
    private final FileSchema schema;
    private final CircularBatchController controller;
    private final RowMaterializer materializer;
    private final long totalRowCount;

    private boolean closed;

    private ParquetFileDataSource(Path path, ParquetFileReader fileReader, FileSchema schema,
                                  CircularBatchController controller) {
        this.path = path;
        this.fileReader = fileReader;
        this.schema = schema;
        this.controller = controller;
        this.materializer = new RowMaterializer(schema.getColumnCount());
        this.totalRowCount = fileReader.getRecordCount();
    }

    /**
     * Opens a data source with the default batch size.
     *
     * @param path the Parquet file
     * @param startOffset number of rows to skip before the first row is returned
     * @param circular whether to restart at the first row once the file is exhausted
     */
    public static ParquetFileDataSource open(Path path, long startOffset, boolean circular) throws IOException {
        return open(path, DataSourceOptions.of(startOffset, circular));
    }

    /**
     * Opens a data source and positions it at {@link DataSourceOptions#getStartOffset()}.
     *
     * @throws OpenException if the file or its schema cannot be read
     * @throws ResetExhaustedException if the source is circular, the start offset is positive and the file has no rows
     */
    public static ParquetFileDataSource open(Path path, DataSourceOptions options) throws IOException {
        ParquetFileReader fileReader = openFile(path);
        CircularBatchController controller = null;
        try {
            FileSchema schema = readSchema(path, fileReader);

            LOG.log(System.Logger.Level.DEBUG, "Opened file ''{0}'' with {1} row groups, {2} rows, {3} columns ({4})",
                    path, fileReader.getRowGroups().size(), fileReader.getRecordCount(), schema.getColumnCount(), options);

            controller = new CircularBatchController(
                    ParquetBatchStream.factory(fileReader, schema, options.getBatchSize()), options.isCircular());
            controller.skipUntilOffset(options.getStartOffset());

            return new ParquetFileDataSource(path, fileReader, schema, controller);
        }
        catch (IOException | RuntimeException e) {
            if (controller != null) {
                controller.close();
            }
            try {
                fileReader.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    private static ParquetFileReader openFile(Path path) throws OpenException {
        try {
            InputFile inputFile = HadoopInputFile.fromPath(
                    new org.apache.hadoop.fs.Path(path.toAbsolutePath().toUri()), new Configuration());
            return ParquetFileReader.open(inputFile);
        }
        catch (IOException | RuntimeException e) {
            throw new OpenException("Failed to open Parquet file " + path, e);
        }
    }

    private static FileSchema readSchema(Path path, ParquetFileReader fileReader) throws OpenException {
        try {
            return FileSchema.fromMessageType(fileReader.getFooter().getFileMetaData().getSchema());
        }
        catch (RuntimeException e) {
            throw new OpenException("Failed to read schema of Parquet file " + path, e);
        }
    }

    @Override
    public List<String> columnNames() {
        return schema.getColumnNames();
    }

    public FileSchema schema() {
        return schema;
    }

    @Override
    public List<Object> nextRow() throws IOException {
        checkOpen();
        if (!controller.ensureBatch()) {
            return null;
        }
        RowCursor cursor = controller.cursor();
        List<Object> row = materializer.materialize(cursor.batch(), cursor.offset());
        cursor.advance(1);
        return row;
    }

    /**
     * Skips the next {@code rows} rows. In circular mode skipping wraps around the end of the
     * file; otherwise skipping past the last row leaves the source exhausted.
     */
    public void skipUntilOffset(long rows) throws IOException {
        checkOpen();
        controller.skipUntilOffset(rows);
    }

    /**
     * Total number of rows in the file according to its footer.
     */
    public long totalRowCount() {
        return totalRowCount;
    }

    public boolean isCircular() {
        return controller.isCircular();
    }

    /**
     * Number of times reading wrapped around to the first row.
     */
    public long resetCount() {
        return controller.resetCount();
    }

    public Path getPath() {
        return path;
    }

    public boolean isClosed() {
        return closed;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Data source for " + path + " is closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            controller.close();
        }
        finally {
            try {
                fileReader.close();
            }
            catch (IOException e) {
                LOG.log(System.Logger.Level.WARNING, "Failed to close Parquet file " + path, e);
            }
        }
        LOG.log(System.Logger.Level.DEBUG, "Closed data source for ''{0}''", path);
    }
}
