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

package com.shardgate.cluster.remote;

import com.shardgate.document.Row;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The shard-local part of a distributed query, as seen by the server that runs it. Several
 * remote nodes of one plan may address the same query; each reads its own part, selected by
 * the node's own name, and all parts share one transaction.
 *
 * @param queryId       id the coordinator addresses the query by
 * @param database      database of the query's transaction
 * @param transactionId id of the leased transaction the query runs in
 * @param parts         result rows of every part, keyed by the own name of the reading node
 */
public record ShardQuery(String queryId, String database, long transactionId, Map<String, Iterator<Row>> parts) {

    public ShardQuery {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("query " + queryId + " has no parts");
        }
        parts = Collections.unmodifiableMap(new LinkedHashMap<>(parts));
    }

    /**
     * Creates a query read by a single remote node.
     */
    public ShardQuery(String queryId, String database, long transactionId, String ownName, Iterator<Row> rows) {
        this(queryId, database, transactionId, Map.of(ownName, rows));
    }

    /**
     * @return rows of the given part, or {@code null} if the query has no such part
     */
    public Iterator<Row> rows(String ownName) {
        return parts.get(ownName);
    }
}
