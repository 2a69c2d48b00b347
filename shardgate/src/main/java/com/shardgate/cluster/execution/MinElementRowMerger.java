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

import java.util.Comparator;
import java.util.List;

/**
 * Ordered merge that keeps one head row per stream and scans all heads for the minimum. A row
 * is only emitted once every stream that is not exhausted has a head.
 */
public class MinElementRowMerger implements RowMerger {
    private final List<? extends RowSource> streams;
    private final Comparator<Row> comparator;
    private final Row[] heads;
    private final boolean[] done;

    public MinElementRowMerger(List<? extends RowSource> streams, Comparator<Row> comparator) {
        this.streams = List.copyOf(streams);
        this.comparator = comparator;
        this.heads = new Row[this.streams.size()];
        this.done = new boolean[this.streams.size()];
    }

    /**
     * @return true if every stream has either a head or is exhausted
     */
    private boolean fillHeads() {
        boolean complete = true;
        for (int i = 0; i < heads.length; i++) {
            if (heads[i] != null || done[i]) {
                continue;
            }
            RowSource stream = streams.get(i);
            Row row = stream.poll();
            if (row != null) {
                heads[i] = row;
            } else if (stream.isExhausted()) {
                done[i] = true;
            } else {
                complete = false;
            }
        }
        return complete;
    }

    @Override
    public Row poll() {
        if (!fillHeads()) {
            return null;
        }
        int min = -1;
        for (int i = 0; i < heads.length; i++) {
            if (heads[i] == null) {
                continue;
            }
            // Strictly less, ties go to the stream enumerated first.
            if (min == -1 || comparator.compare(heads[i], heads[min]) < 0) {
                min = i;
            }
        }
        if (min == -1) {
            return null;
        }
        Row row = heads[min];
        heads[min] = null;
        return row;
    }

    @Override
    public boolean isExhausted() {
        for (int i = 0; i < heads.length; i++) {
            if (heads[i] != null) {
                return false;
            }
            if (!done[i]) {
                if (!streams.get(i).isExhausted()) {
                    return false;
                }
                done[i] = true;
            }
        }
        return true;
    }
}
