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

import java.util.List;

/**
 * Passes rows through in arrival order, visiting the streams round-robin so a busy stream
 * cannot starve the others.
 */
public class UnsortedRowMerger implements RowMerger {
    private final List<? extends RowSource> streams;
    private int cursor;

    public UnsortedRowMerger(List<? extends RowSource> streams) {
        this.streams = List.copyOf(streams);
    }

    @Override
    public Row poll() {
        int size = streams.size();
        for (int i = 0; i < size; i++) {
            int index = (cursor + i) % size;
            Row row = streams.get(index).poll();
            if (row != null) {
                cursor = (index + 1) % size;
                return row;
            }
        }
        return null;
    }

    @Override
    public boolean isExhausted() {
        for (RowSource stream : streams) {
            if (!stream.isExhausted()) {
                return false;
            }
        }
        return true;
    }
}
