/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.schema;

/**
 * The closed set of physical column encodings a data source can materialize.
 * Columns of any other shape are reported as {@link #UNSUPPORTED} and always yield {@code null}.
 */
public enum ColumnEncoding {
    INT64,
    DOUBLE,
    STRING,
    BINARY,
    /** One level of repetition over 32-bit floats, e.g. an embedding vector. */
    FLOAT_LIST,
    UNSUPPORTED;

    public boolean isSupported() {
        return this != UNSUPPORTED;
    }
}
