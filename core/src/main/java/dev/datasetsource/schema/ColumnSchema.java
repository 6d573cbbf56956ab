/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.schema;

import org.apache.parquet.column.ColumnDescriptor;

/**
 * A leaf column of a Parquet file together with the encoding it is materialized as.
 *
 * @param name dotted leaf path, e.g. {@code embedding.list.element}
 * @param columnIndex position of the column in file (and row) order
 * @param encoding the encoding the column's values are decoded to
 * @param descriptor the parquet-java descriptor used to read the column chunk
 */
public record ColumnSchema(
        String name,
        int columnIndex,
        ColumnEncoding encoding,
        ColumnDescriptor descriptor) {

    public int maxDefinitionLevel() {
        return descriptor.getMaxDefinitionLevel();
    }

    public int maxRepetitionLevel() {
        return descriptor.getMaxRepetitionLevel();
    }

    @Override
    public String toString() {
        return name + " (" + encoding.name().toLowerCase() + ")";
    }
}
