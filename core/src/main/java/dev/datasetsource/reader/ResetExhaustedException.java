/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.reader;

import java.io.IOException;

/**
 * Thrown when a circular data source restarts from the first row but still finds no rows,
 * which means the file is empty or malformed.
 */
public class ResetExhaustedException extends IOException {

    public ResetExhaustedException(String message) {
        super(message);
    }
}
