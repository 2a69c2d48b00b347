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
import com.shardgate.common.ShardgateException;
import com.shardgate.document.Row;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * A client stream filled by a producer thread and drained by a consumer. Rows offered before a
 * failure are still delivered, the failure is raised once the buffer runs dry.
 */
public class BufferedRowStream implements RowStream {
    private final String clientId;
    private final StreamSignal signal;
    private final Queue<Row> buffer = new ConcurrentLinkedQueue<>();
    private volatile boolean finished;
    private volatile Throwable failure;

    public BufferedRowStream(String clientId, StreamSignal signal) {
        this.clientId = clientId;
        this.signal = signal;
    }

    @Override
    public String clientId() {
        return clientId;
    }

    public void offer(Row row) {
        if (finished) {
            throw new IllegalStateException("stream " + clientId + " has already been finished");
        }
        buffer.add(row);
        signal.signal();
    }

    /**
     * Marks the end of the stream. Idempotent.
     */
    public void finish() {
        finished = true;
        signal.signal();
    }

    /**
     * Ends the stream with a failure. The first failure wins.
     */
    public void fail(Throwable cause) {
        if (failure == null) {
            failure = cause;
        }
        finished = true;
        signal.signal();
    }

    @Override
    public Row poll() {
        Row row = buffer.poll();
        if (row != null) {
            return row;
        }
        Throwable cause = failure;
        if (cause != null) {
            if (cause instanceof ShardgateException) {
                throw (ShardgateException) cause;
            }
            throw new RemoteCommunicationException("stream " + clientId + " has failed", cause);
        }
        return null;
    }

    @Override
    public boolean isExhausted() {
        // Read the flag first, every offer happens before finish.
        return finished && failure == null && buffer.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("BufferedRowStream {clientId=%s, buffered=%d, finished=%s}", clientId, buffer.size(), finished);
    }
}
