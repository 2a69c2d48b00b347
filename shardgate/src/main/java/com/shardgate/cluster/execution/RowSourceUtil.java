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

import com.shardgate.cluster.remote.RemoteCommunicationException;
import com.shardgate.document.Row;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

public final class RowSourceUtil {

    private RowSourceUtil() {
    }

    /**
     * Waits for the next row of {@code source}.
     *
     * @param source  the source to read from
     * @param signal  the signal its underlying streams notify
     * @param timeout how long to wait without any progress
     * @return the next row, or {@code null} once the source is exhausted
     * @throws RemoteCommunicationException if no row arrives in time or the thread is interrupted
     */
    public static Row take(RowSource source, StreamSignal signal, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            // Capture the version before polling so a row offered in between is not missed.
            long seen = signal.version();
            Row row = source.poll();
            if (row != null) {
                return row;
            }
            if (source.isExhausted()) {
                return null;
            }
            try {
                if (!signal.awaitChange(seen, deadline - System.nanoTime(), TimeUnit.NANOSECONDS)) {
                    throw new RemoteCommunicationException("no row has arrived within " + timeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteCommunicationException("interrupted while waiting for rows", e);
            }
        }
    }

    /**
     * Reads {@code source} until it is exhausted.
     */
    public static List<Row> drain(RowSource source, StreamSignal signal, Duration timeout) {
        List<Row> rows = new ArrayList<>();
        Row row;
        while ((row = take(source, signal, timeout)) != null) {
            rows.add(row);
        }
        return rows;
    }
}
