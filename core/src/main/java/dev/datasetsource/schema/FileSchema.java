/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/**
 * Ordered, immutable view of the leaf columns of a Parquet file. Captured once when a
 * data source is opened and shared by every batch stream created over the file afterwards.
 */
public final class FileSchema {

    private final MessageType messageType;
    private final List<ColumnSchema> columns;
    private final List<String> columnNames;
    private final Map<String, Integer> columnNameToIndex;

    private FileSchema(MessageType messageType, List<ColumnSchema> columns) {
        this.messageType = messageType;
        this.columns = Collections.unmodifiableList(columns);

        List<String> names = new ArrayList<>(columns.size());
        this.columnNameToIndex = new HashMap<>();
        for (ColumnSchema column : columns) {
            names.add(column.name());
            columnNameToIndex.put(column.name(), column.columnIndex());
        }
        this.columnNames = Collections.unmodifiableList(names);
    }

    /**
     * Builds the schema from a Parquet message type, classifying every leaf column.
     */
    public static FileSchema fromMessageType(MessageType messageType) {
        List<ColumnDescriptor> descriptors = messageType.getColumns();
        List<ColumnSchema> columns = new ArrayList<>(descriptors.size());
        for (int i = 0; i < descriptors.size(); i++) {
            ColumnDescriptor descriptor = descriptors.get(i);
            String name = String.join(".", descriptor.getPath());
            columns.add(new ColumnSchema(name, i, classify(descriptor), descriptor));
        }
        return new FileSchema(messageType, columns);
    }

    /**
     * Maps a leaf column onto one of the supported encodings.
     */
    static ColumnEncoding classify(ColumnDescriptor descriptor) {
        PrimitiveType type = descriptor.getPrimitiveType();
        PrimitiveTypeName physicalType = type.getPrimitiveTypeName();
        LogicalTypeAnnotation logicalType = type.getLogicalTypeAnnotation();
        int maxRepetitionLevel = descriptor.getMaxRepetitionLevel();

        if (maxRepetitionLevel == 1) {
            return physicalType == PrimitiveTypeName.FLOAT && logicalType == null
                    ? ColumnEncoding.FLOAT_LIST
                    : ColumnEncoding.UNSUPPORTED;
        }
        if (maxRepetitionLevel > 1) {
            return ColumnEncoding.UNSUPPORTED;
        }

        switch (physicalType) {
            case INT64:
                if (logicalType == null) {
                    return ColumnEncoding.INT64;
                }
                if (logicalType instanceof LogicalTypeAnnotation.IntLogicalTypeAnnotation intType
                        && intType.isSigned() && intType.getBitWidth() == 64) {
                    return ColumnEncoding.INT64;
                }
                return ColumnEncoding.UNSUPPORTED;
            case DOUBLE:
                return ColumnEncoding.DOUBLE;
            case BINARY:
                if (logicalType == null) {
                    return ColumnEncoding.BINARY;
                }
                if (logicalType instanceof LogicalTypeAnnotation.StringLogicalTypeAnnotation
                        || logicalType instanceof LogicalTypeAnnotation.EnumLogicalTypeAnnotation
                        || logicalType instanceof LogicalTypeAnnotation.JsonLogicalTypeAnnotation) {
                    return ColumnEncoding.STRING;
                }
                return ColumnEncoding.UNSUPPORTED;
            default:
                return ColumnEncoding.UNSUPPORTED;
        }
    }

    public MessageType getMessageType() {
        return messageType;
    }

    public List<ColumnSchema> getColumns() {
        return columns;
    }

    public ColumnSchema getColumn(int index) {
        return columns.get(index);
    }

    public ColumnSchema getColumn(String name) {
        Integer index = columnNameToIndex.get(name);
        if (index == null) {
            throw new IllegalArgumentException("Column not found: " + name);
        }
        return columns.get(index);
    }

    public int getColumnCount() {
        return columns.size();
    }

    /**
     * Returns the column names in file order. The list is immutable.
     */
    public List<String> getColumnNames() {
        return columnNames;
    }

    @Override
    public String toString() {
        return "FileSchema" + columns;
    }
}
