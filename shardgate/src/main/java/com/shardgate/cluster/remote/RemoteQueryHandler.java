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
import com.shardgate.transaction.LeaseConflictException;
import com.shardgate.transaction.TransactionHandle;
import com.shardgate.transaction.TransactionLeaseRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Server side of the remote protocol. Maps query ids to shard-local queries and borrows the
 * query's transaction from the {@link TransactionLeaseRegistry} for the duration of every
 * request.
 * <p>
 * Requests addressing the same query are served one at a time, whichever part they read.
 * {@link RemoteRequestKind#CANCEL} bypasses the queue so it can kill a running request. A query
 * is finished once every one of its parts has been shut down.
 */
public class RemoteQueryHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteQueryHandler.class);
    private final TransactionLeaseRegistry registry;
    private final Map<String, RegisteredQuery> queries = new ConcurrentHashMap<>();

    public RemoteQueryHandler(TransactionLeaseRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers a query together with the transaction it runs in.
     *
     * @throws LeaseConflictException if the transaction is already registered
     */
    public void register(ShardQuery query, TransactionHandle handle) {
        RegisteredQuery entry = new RegisteredQuery(query);
        if (queries.putIfAbsent(query.queryId(), entry) != null) {
            throw new IllegalStateException("query " + query.queryId() + " has already been registered");
        }
        try {
            registry.insert(query.database(), query.transactionId(), handle);
        } catch (LeaseConflictException e) {
            queries.remove(query.queryId(), entry);
            throw e;
        }
    }

    public boolean isRegistered(String queryId) {
        return queries.containsKey(queryId);
    }

    public RemoteResponse handle(RemoteRequest request) {
        RegisteredQuery entry = queries.get(request.queryId());
        if (entry == null) {
            if (request.kind() == RemoteRequestKind.CANCEL) {
                return RemoteResponse.ok();
            }
            return queryNotFound(request.queryId());
        }

        if (request.kind() == RemoteRequestKind.CANCEL) {
            return dispatch(entry, request);
        }
        entry.lock.lock();
        try {
            if (queries.get(request.queryId()) != entry) {
                // Finished or cancelled while this request was waiting.
                return queryNotFound(request.queryId());
            }
            if (!entry.openParts.contains(request.ownName())) {
                return RemoteResponse.error(
                        RemoteResponse.QUERY_NOT_FOUND,
                        String.format("part %s of query %s is not found", request.ownName(), request.queryId())
                );
            }
            return dispatch(entry, request);
        } finally {
            entry.lock.unlock();
        }
    }

    private RemoteResponse dispatch(RegisteredQuery entry, RemoteRequest request) {
        try {
            switch (request.kind()) {
                case INITIALIZE_CURSOR:
                    return initializeCursor(entry.query);
                case GET_SOME:
                    return getSome(entry, request.ownName(), request.atMost());
                case SHUTDOWN:
                    return shutdown(entry, request.ownName(), request.errorCode());
                case CANCEL:
                    return cancel(entry, request.errorCode());
                default:
                    return RemoteResponse.error(RemoteResponse.INTERNAL_ERROR, "unknown request kind: " + request.kind());
            }
        } catch (LeaseConflictException e) {
            if (e.getReason() == LeaseConflictException.Reason.NOT_FOUND) {
                // The transaction has expired or been destroyed, the query cannot run anymore.
                LOGGER.debug("Transaction of query {} is gone, removing the query", request.queryId());
                queries.remove(request.queryId(), entry);
                return queryNotFound(request.queryId());
            }
            return RemoteResponse.error(RemoteResponse.LEASE_CONFLICT, e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("Failed to handle {} request of query {}", request.kind(), request.queryId(), e);
            return RemoteResponse.error(RemoteResponse.INTERNAL_ERROR, e.getMessage());
        }
    }

    private RemoteResponse initializeCursor(ShardQuery query) {
        registry.open(query.database(), query.transactionId());
        registry.close(query.database(), query.transactionId());
        return RemoteResponse.ok();
    }

    private RemoteResponse getSome(RegisteredQuery entry, String ownName, int atMost) {
        ShardQuery query = entry.query;
        Iterator<Row> part = query.rows(ownName);
        TransactionHandle handle = registry.open(query.database(), query.transactionId());
        try {
            List<Row> rows = new ArrayList<>();
            while (rows.size() < atMost && part.hasNext() && !handle.isKilled()) {
                rows.add(part.next());
            }
            if (handle.isKilled()) {
                queries.remove(query.queryId(), entry);
                return RemoteResponse.error(RemoteResponse.QUERY_KILLED, "query " + query.queryId() + " has been killed");
            }
            return RemoteResponse.ok(rows, !part.hasNext());
        } finally {
            registry.close(query.database(), query.transactionId());
        }
    }

    private RemoteResponse shutdown(RegisteredQuery entry, String ownName, int errorCode) {
        ShardQuery query = entry.query;
        entry.openParts.remove(ownName);
        if (errorCode != RemoteResponse.NO_ERROR && entry.errorCode == RemoteResponse.NO_ERROR) {
            entry.errorCode = errorCode;
        }
        if (!entry.openParts.isEmpty()) {
            LOGGER.debug("Part {} of query {} has been shut down, {} parts left", ownName, query.queryId(), entry.openParts.size());
            return RemoteResponse.ok();
        }

        try {
            registry.open(query.database(), query.transactionId());
            if (entry.errorCode == RemoteResponse.NO_ERROR) {
                registry.closeCommit(query.database(), query.transactionId());
            } else {
                registry.closeAbort(query.database(), query.transactionId());
            }
        } finally {
            registry.destroy(query.database(), query.transactionId(), entry.errorCode);
            queries.remove(query.queryId(), entry);
        }
        return RemoteResponse.ok();
    }

    private RemoteResponse cancel(RegisteredQuery entry, int errorCode) {
        LOGGER.debug("Cancelling query {}", entry.query.queryId());
        queries.remove(entry.query.queryId(), entry);
        registry.destroy(entry.query.database(), entry.query.transactionId(), errorCode);
        return RemoteResponse.ok();
    }

    private static RemoteResponse queryNotFound(String queryId) {
        return RemoteResponse.error(RemoteResponse.QUERY_NOT_FOUND, "query " + queryId + " is not found");
    }

    private static final class RegisteredQuery {
        private final ShardQuery query;
        private final ReentrantLock lock = new ReentrantLock();
        // openParts and errorCode are guarded by lock.
        private final Set<String> openParts;
        private int errorCode = RemoteResponse.NO_ERROR;

        private RegisteredQuery(ShardQuery query) {
            this.query = query;
            this.openParts = new HashSet<>(query.parts().keySet());
        }
    }
}
