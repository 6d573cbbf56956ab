/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.internal.reader;

import java.io.IOException;
import java.util.List;

import org.apache.parquet.column.impl.ColumnReadStoreImpl;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.io.api.GroupConverter;

import dev.datasetsource.schema.ColumnSchema;
import dev.datasetsource.schema.FileSchema;

/**
 * {@link BatchStream} over all row groups and all columns of an open Parquet file.
 * <p>
 * Row groups are read in file order. Batches hold at most {@code batchSize} rows and never span
 * two row groups. The file reader is borrowed: closing the stream leaves it open so that a
 * fresh stream can be created over the same file on a circular reset.
 * </p>
 */
public final class ParquetBatchStream implements BatchStream {

    private static final System.Logger LOG = System.getLogger(ParquetBatchStream.class.getName());

    private final ParquetFileReader fileReader;
    private final FileSchema schema;
    private final List<BlockMetaData> rowGroups;
    private final String createdBy;
    private final GroupConverter recordConverter;
    private final int batchSize;

    private int nextRowGroup;
    private long rowsLeftInRowGroup;
    private ColumnDecoder[] decoders;
    private boolean closed;

    public ParquetBatchStream(ParquetFileReader fileReader, FileSchema schema, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.fileReader = fileReader;
        this.schema = schema;
        this.rowGroups = fileReader.getRowGroups();
        this.createdBy = fileReader.getFooter().getFileMetaData().getCreatedBy();
        this.recordConverter = new GroupRecordConverter(schema.getMessageType()).getRootConverter();
        this.batchSize = batchSize;
    }

    /**
     * Returns a factory creating streams over the given file, each starting at its first row group.
     */
    public static BatchStreamFactory factory(ParquetFileReader fileReader, FileSchema schema, int batchSize) {
        return () -> new ParquetBatchStream(fileReader, schema, batchSize);
    }

    @Override
    public ColumnBatch next() throws IOException {
        if (closed) {
            throw new IllegalStateException("Batch stream is closed");
        }

        while (rowsLeftInRowGroup == 0) {
            if (nextRowGroup >= rowGroups.size()) {
                decoders = null;
                return null;
            }
            openRowGroup(nextRowGroup++);
        }

        int rowCount = (int) Math.min(batchSize, rowsLeftInRowGroup);
        ColumnData[] columns = new ColumnData[decoders.length];
        for (int i = 0; i < decoders.length; i++) {
            columns[i] = decoders[i].readBatch(rowCount);
        }
        rowsLeftInRowGroup -= rowCount;

        LOG.log(System.Logger.Level.TRACE, "Decoded batch of {0} rows, {1} rows left in row group {2}",
                rowCount, rowsLeftInRowGroup, nextRowGroup - 1);

        return new ColumnBatch(columns, rowCount);
    }

    private void openRowGroup(int rowGroupIndex) throws IOException {
        PageReadStore pages = fileReader.readRowGroup(rowGroupIndex);
        if (pages == null) {
            throw new IOException("Row group " + rowGroupIndex + " could not be read");
        }

        ColumnReadStoreImpl readStore = new ColumnReadStoreImpl(pages, recordConverter, schema.getMessageType(), createdBy);
        List<ColumnSchema> columns = schema.getColumns();
        decoders = new ColumnDecoder[columns.size()];
        for (int i = 0; i < decoders.length; i++) {
            decoders[i] = ColumnDecoder.create(columns.get(i), schema.getMessageType(), readStore);
        }
        rowsLeftInRowGroup = pages.getRowCount();

        LOG.log(System.Logger.Level.DEBUG, "Opened row group {0} of {1} with {2} rows",
                rowGroupIndex, rowGroups.size(), rowsLeftInRowGroup);
    }

    @Override
    public void close() {
        closed = true;
        decoders = null;
    }
}
