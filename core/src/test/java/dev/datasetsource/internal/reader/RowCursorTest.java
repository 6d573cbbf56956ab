/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.datasetsource.internal.reader;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowCursorTest {

    @Test
    void testFetchHoldsBatchAtOffsetZero() throws Exception {
        List<ColumnBatch> produced = new ArrayList<>();
        InMemoryBatchStream stream = new InMemoryBatchStream(produced, 3, 2);
        RowCursor cursor = new RowCursor();

        assertThat(cursor.isEmpty()).isTrue();
        assertThat(cursor.fetch(stream)).isTrue();
        assertThat(cursor.isEmpty()).isFalse();
        assertThat(cursor.offset()).isZero();
        assertThat(cursor.remaining()).isEqualTo(3);
        assertThat(cursor.batch()).isSameAs(produced.get(0));
    }

    @Test
    void testAdvanceReleasesBatchOnLastRow() throws Exception {
        List<ColumnBatch> produced = new ArrayList<>();
        InMemoryBatchStream stream = new InMemoryBatchStream(produced, 3);
        RowCursor cursor = new RowCursor();
        cursor.fetch(stream);

        cursor.advance(1);
        cursor.advance(1);
        assertThat(cursor.offset()).isEqualTo(2);
        assertThat(produced.get(0).isReleased()).isFalse();

        cursor.advance(1);
        assertThat(cursor.isEmpty()).isTrue();
        assertThat(cursor.offset()).isZero();
        assertThat(produced.get(0).isReleased()).isTrue();
    }

    @Test
    void testFetchReportsExhaustedStream() throws Exception {
        InMemoryBatchStream stream = new InMemoryBatchStream(new ArrayList<>(), 1);
        RowCursor cursor = new RowCursor();

        assertThat(cursor.fetch(stream)).isTrue();
        cursor.advance(1);
        assertThat(cursor.fetch(stream)).isFalse();
        assertThat(cursor.fetch(stream)).isFalse();
        assertThat(cursor.isEmpty()).isTrue();
    }

    @Test
    void testFetchSkipsEmptyBatches() throws Exception {
        List<ColumnBatch> produced = new ArrayList<>();
        InMemoryBatchStream stream = new InMemoryBatchStream(produced, 0, 0, 2);
        RowCursor cursor = new RowCursor();

        assertThat(cursor.fetch(stream)).isTrue();
        assertThat(cursor.remaining()).isEqualTo(2);
        assertThat(produced.get(0).isReleased()).isTrue();
        assertThat(produced.get(1).isReleased()).isTrue();
        assertThat(produced.get(2).isReleased()).isFalse();
    }

    @Test
    void testFetchWhileHoldingFails() throws Exception {
        InMemoryBatchStream stream = new InMemoryBatchStream(new ArrayList<>(), 2, 2);
        RowCursor cursor = new RowCursor();
        cursor.fetch(stream);

        assertThatThrownBy(() -> cursor.fetch(stream))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already holds");
    }

    @Test
    void testAdvanceBeyondBatchFails() throws Exception {
        InMemoryBatchStream stream = new InMemoryBatchStream(new ArrayList<>(), 2);
        RowCursor cursor = new RowCursor();
        cursor.fetch(stream);

        assertThatThrownBy(() -> cursor.advance(3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cursor.advance(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(cursor.remaining()).isEqualTo(2);
    }

    @Test
    void testReleaseIsIdempotentWhenEmpty() throws Exception {
        List<ColumnBatch> produced = new ArrayList<>();
        InMemoryBatchStream stream = new InMemoryBatchStream(produced, 2);
        RowCursor cursor = new RowCursor();
        cursor.fetch(stream);
        cursor.advance(1);

        cursor.release();
        cursor.release();

        assertThat(cursor.isEmpty()).isTrue();
        assertThat(produced.get(0).isReleased()).isTrue();
        assertThatThrownBy(cursor::batch).isInstanceOf(IllegalStateException.class);
    }
}
