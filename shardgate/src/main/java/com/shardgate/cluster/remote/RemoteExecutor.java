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

import com.shardgate.cluster.execution.BufferedRowStream;
import com.shardgate.cluster.plan.RemoteTarget;
import com.shardgate.document.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Coordinator side of a remote sub-plan. Every call blocks the calling thread until the reply
 * arrives or the request timeout elapses. A failed or cancelled call sends a
 * {@link RemoteRequestKind#CANCEL} request, so the remote side releases the query's lease.
 */
public class RemoteExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteExecutor.class);
    private final RemoteTransport transport;
    private final String database;
    private final RemoteTarget target;
    private final boolean responsibleForInitializeCursor;
    private final Duration requestTimeout;
    private volatile CompletableFuture<RemoteResponse> inFlight;
    private volatile boolean done;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public RemoteExecutor(
            RemoteTransport transport,
            String database,
            RemoteTarget target,
            boolean responsibleForInitializeCursor,
            Duration requestTimeout
    ) {
        this.transport = transport;
        this.database = database;
        this.target = target;
        this.responsibleForInitializeCursor = responsibleForInitializeCursor;
        this.requestTimeout = requestTimeout;
    }

    public RemoteTarget target() {
        return target;
    }

    /**
     * Initializes the remote cursor. Only the executor responsible for it contacts the remote
     * side, the others return immediately.
     */
    public void initializeCursor() {
        if (!responsibleForInitializeCursor) {
            return;
        }
        exchange(RemoteRequest.initializeCursor(database, target));
    }

    /**
     * Fetches at most {@code atMost} rows.
     */
    public List<Row> getSome(int atMost) {
        if (done) {
            return List.of();
        }
        RemoteResponse response = exchange(RemoteRequest.getSome(database, target, atMost));
        if (response.done()) {
            done = true;
        }
        return response.rows();
    }

    public boolean isDone() {
        return done;
    }

    /**
     * Finishes the remote query, committing its transaction if {@code errorCode} is
     * {@link RemoteResponse#NO_ERROR} and aborting it otherwise.
     */
    public void shutdown(int errorCode) {
        exchange(RemoteRequest.shutdown(database, target, errorCode));
    }

    /**
     * Cancels the in-flight call, if any, and asks the remote side to destroy the query's lease.
     * Idempotent.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        CompletableFuture<RemoteResponse> future = inFlight;
        if (future != null) {
            future.cancel(true);
        }
        try {
            transport.send(target.server(), RemoteRequest.cancel(database, target))
                    .get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while cancelling query {} on {}", target.queryId(), target.server());
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Failed to cancel query {} on {}", target.queryId(), target.server(), e);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Reads every row of the remote query into {@code stream} on the given executor, then shuts
     * the remote query down. On failure the stream fails and the remote query is cancelled.
     */
    public CompletableFuture<Void> streamInto(BufferedRowStream stream, int batchSize, ExecutorService executor) {
        return CompletableFuture.runAsync(() -> {
            try {
                initializeCursor();
                while (!done) {
                    for (Row row : getSome(batchSize)) {
                        stream.offer(row);
                    }
                }
                shutdown(RemoteResponse.NO_ERROR);
                stream.finish();
            } catch (RuntimeException e) {
                LOGGER.error("Failed to read rows of query {} from {}", target.queryId(), target.server(), e);
                stream.fail(e);
                cancel();
                throw e;
            }
        }, executor);
    }

    private RemoteResponse exchange(RemoteRequest request) {
        if (cancelled.get()) {
            throw new RemoteCommunicationException("query " + target.queryId() + " has been cancelled");
        }
        CompletableFuture<RemoteResponse> future = transport.send(target.server(), request);
        inFlight = future;
        RemoteResponse response;
        try {
            response = future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancel();
            throw new RemoteCommunicationException(
                    String.format("%s request of query %s to %s timed out after %s", request.kind(), target.queryId(), target.server(), requestTimeout), e
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw new RemoteCommunicationException("interrupted while waiting for " + target.server(), e);
        } catch (CancellationException e) {
            throw new RemoteCommunicationException("query " + target.queryId() + " has been cancelled", e);
        } catch (ExecutionException e) {
            cancel();
            throw new RemoteCommunicationException(
                    String.format("%s request of query %s to %s failed", request.kind(), target.queryId(), target.server()), e.getCause()
            );
        } finally {
            inFlight = null;
        }

        if (response.isError()) {
            throw new RemoteCommunicationException(
                    String.format("%s request of query %s failed on %s: %s", request.kind(), target.queryId(), target.server(), response.errorMessage()),
                    response.errorCode()
            );
        }
        return response;
    }
}
