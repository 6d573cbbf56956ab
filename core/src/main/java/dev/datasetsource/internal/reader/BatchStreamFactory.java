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
 * Creates batch streams positioned at the first row of the file.
 * Invoked once when a data source is opened and again on every circular reset.
 */
@FunctionalInterface
public interface BatchStreamFactory {

    BatchStream open() throws IOException;
}
