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
 * Thrown when a data source cannot be opened because the file or its schema is unreadable.
 */
public class OpenException extends IOException {

    public OpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
