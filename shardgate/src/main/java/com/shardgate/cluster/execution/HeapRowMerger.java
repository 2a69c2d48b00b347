/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.shardgate.cluster.execution;

import com.shardgate.document.Row;

import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Ordered merge that keeps the head rows in a priority queue. Emits the same sequence as
 * {@link MinElementRowMerger}; ties are broken by stream enumeration order.
 */
public class HeapRowMerger implements RowMerger {
    private final List<? extends RowSource> streams;
    private final PriorityQueue<Head> queue;
    // Streams that have neither a queued head nor are exhausted.
    private final BitSet missing = new BitSet();

    public HeapRowMerger(List<? extends RowSource> streams, Comparator<Row> comparator) {
        this.streams = List.copyOf(streams);
        Comparator<Head> headComparator = (a, b) -> {
            int result = comparator.compare(a.row, b.row);
            return result != 0 ? result : Integer.compare(a.index, b.index);
        };
        this.queue = new PriorityQueue<>(Math.max(1, this.streams.size()), headComparator);
        this.missing.set(0, this.streams.size());
    }

    private void fillHeads() {
        for (int i = missing.nextSetBit(0); i >= 0; i = missing.nextSetBit(i + 1)) {
            RowSource stream = streams.get(i);
            Row row = stream.poll();
            if (row != null) {
                queue.add(new Head(row, i));
                missing.clear(i);
            } else if (stream.isExhausted()) {
                missing.clear(i);
            }
        }
    }

    @Override
    public Row poll() {
        fillHeads();
        if (!missing.isEmpty() || queue.isEmpty()) {
            return null;
        }
        Head head = queue.poll();
        missing.set(head.index);
        return head.row;
    }

    @Override
    public boolean isExhausted() {
        if (!queue.isEmpty()) {
            return false;
        }
        for (int i = missing.nextSetBit(0); i >= 0; i = missing.nextSetBit(i + 1)) {
            if (!streams.get(i).isExhausted()) {
                return false;
            }
            missing.clear(i);
        }
        return true;
    }

    private static final class Head {
        private final Row row;
        private final int index;

        private Head(Row row, int index) {
            this.row = row;
            this.index = index;
        }
    }
}
