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

import com.shardgate.cluster.plan.FanOutNode;
import com.shardgate.document.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Drives a scatter or distribute node: reads the upstream rows and fills one
 * {@link BufferedRowStream} per client of the node.
 */
public class FanOutDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(FanOutDispatcher.class);
    private final FanOutNode node;
    private final Map<String, BufferedRowStream> streams = new LinkedHashMap<>();

    public FanOutDispatcher(FanOutNode node, StreamSignal signal) {
        this.node = node;
        for (String client : node.clients()) {
            streams.put(client, new BufferedRowStream(client, signal));
        }
    }

    public BufferedRowStream stream(String clientId) {
        BufferedRowStream stream = streams.get(clientId);
        if (stream == null) {
            throw new IllegalArgumentException("unknown client: " + clientId);
        }
        return stream;
    }

    /**
     * @return the client streams in client enumeration order
     */
    public List<BufferedRowStream> streams() {
        return List.copyOf(streams.values());
    }

    /**
     * Dispatches every upstream row and finishes all client streams. If a row cannot be
     * dispatched every stream fails with the same error, which is then rethrown.
     */
    public void run(Iterator<Row> upstream) {
        try {
            while (upstream.hasNext()) {
                node.dispatch(upstream.next(), (client, row) -> stream(client).offer(row));
            }
        } catch (RuntimeException e) {
            LOGGER.error("Failed to dispatch rows to the clients {}", node.clients(), e);
            for (BufferedRowStream stream : streams.values()) {
                stream.fail(e);
            }
            throw e;
        }
        for (BufferedRowStream stream : streams.values()) {
            stream.finish();
        }
    }
}
