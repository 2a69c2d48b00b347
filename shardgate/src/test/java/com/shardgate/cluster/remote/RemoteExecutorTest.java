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
import com.shardgate.cluster.execution.RowSourceUtil;
import com.shardgate.cluster.execution.StreamSignal;
import com.shardgate.cluster.plan.RemoteNode;
import com.shardgate.cluster.plan.RemoteTarget;
import com.shardgate.document.Row;
import com.shardgate.transaction.RecordingTransactionHandle;
import com.shardgate.transaction.TransactionLeaseRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class RemoteExecutorTest {
    private static final String DATABASE = "db";
    private static final String SERVER = "server-1";
    private final RemoteTarget target = new RemoteTarget(SERVER, "coordinator", "q1");
    private TransactionLeaseRegistry registry;
    private RemoteQueryHandler handler;
    private InProcessRemoteTransport transport;

    @BeforeEach
    public void setup() {
        registry = new TransactionLeaseRegistry(System::currentTimeMillis, Duration.ofSeconds(60));
        handler = new RemoteQueryHandler(registry);
        transport = new InProcessRemoteTransport();
        transport.addServer(SERVER, handler);
    }

    @AfterEach
    public void tearDown() {
        transport.shutdown();
    }

    private static List<Row> rows(int count) {
        List<Row> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(Row.of("value", i));
        }
        return rows;
    }

    private RemoteExecutor newExecutor(boolean responsibleForInitializeCursor, Duration timeout) {
        return new RemoteNode(1, DATABASE, target, responsibleForInitializeCursor).createExecutor(transport, timeout);
    }

    private RecordingTransactionHandle registerQuery(Iterator<Row> rows) {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        handler.register(new ShardQuery(target.queryId(), DATABASE, 1, target.ownName(), rows), handle);
        return handle;
    }

    @Test
    public void test_getSome_in_batches_then_shutdown() {
        RecordingTransactionHandle handle = registerQuery(rows(5).iterator());
        RemoteExecutor executor = newExecutor(true, Duration.ofSeconds(5));

        executor.initializeCursor();
        assertThat(executor.getSome(2)).hasSize(2);
        assertThat(executor.getSome(2)).hasSize(2);
        assertThat(executor.isDone()).isFalse();
        assertThat(executor.getSome(2)).containsExactly(Row.of("value", 4));
        assertThat(executor.isDone()).isTrue();
        assertThat(executor.getSome(2)).isEmpty();

        executor.shutdown(RemoteResponse.NO_ERROR);

        assertThat(handle.commits()).isEqualTo(1);
        assertThat(handle.releases()).isEqualTo(1);
        assertThat(registry.numberRegisteredTransactions()).isZero();
        assertThat(handler.isRegistered(target.queryId())).isFalse();
    }

    @Test
    public void test_shutdown_with_error_aborts() {
        RecordingTransactionHandle handle = registerQuery(rows(1).iterator());

        newExecutor(true, Duration.ofSeconds(5)).shutdown(RemoteResponse.INTERNAL_ERROR);

        assertThat(handle.aborts()).isEqualTo(1);
        assertThat(handle.commits()).isZero();
        assertThat(handle.releases()).isEqualTo(1);
    }

    @Test
    public void test_only_responsible_executor_initializes_cursor() {
        registerQuery(rows(1).iterator());

        newExecutor(false, Duration.ofSeconds(5)).initializeCursor();
        assertThat(transport.requests()).isEmpty();

        newExecutor(true, Duration.ofSeconds(5)).initializeCursor();
        assertThat(transport.requests()).extracting(RemoteRequest::kind).containsExactly(RemoteRequestKind.INITIALIZE_CURSOR);
    }

    @Test
    public void test_cancel_destroys_remote_lease() {
        RecordingTransactionHandle handle = registerQuery(rows(10).iterator());
        RemoteExecutor executor = newExecutor(true, Duration.ofSeconds(5));
        executor.getSome(1);

        executor.cancel();

        assertThat(handle.releases()).isEqualTo(1);
        assertThat(registry.numberRegisteredTransactions()).isZero();
        assertThat(executor.isCancelled()).isTrue();
        assertThatThrownBy(() -> executor.getSome(1)).isInstanceOf(RemoteCommunicationException.class);
    }

    @Test
    public void test_timeout_before_request_is_handled() {
        RecordingTransactionHandle handle = registerQuery(rows(10).iterator());
        CountDownLatch latch = new CountDownLatch(1);
        transport.setInterceptor((request) -> {
            if (request.kind() == RemoteRequestKind.GET_SOME) {
                try {
                    latch.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        RemoteExecutor executor = newExecutor(true, Duration.ofMillis(200));

        try {
            assertThatThrownBy(() -> executor.getSome(5)).isInstanceOf(RemoteCommunicationException.class);
        } finally {
            latch.countDown();
        }

        await().atMost(5, TimeUnit.SECONDS).until(() -> registry.numberRegisteredTransactions() == 0);
        assertThat(handle.releases()).isEqualTo(1);
        assertThat(transport.requests()).extracting(RemoteRequest::kind).contains(RemoteRequestKind.CANCEL);
    }

    @Test
    public void test_timeout_while_lease_is_open() {
        CountDownLatch latch = new CountDownLatch(1);
        Iterator<Row> slowRows = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Row next() {
                try {
                    latch.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Row.of("value", 1);
            }
        };
        RecordingTransactionHandle handle = registerQuery(slowRows);
        RemoteExecutor executor = newExecutor(true, Duration.ofMillis(200));

        assertThatThrownBy(() -> executor.getSome(5)).isInstanceOf(RemoteCommunicationException.class);

        // The borrower is still reading, the lease is killed but not released.
        await().atMost(5, TimeUnit.SECONDS).until(handle::isKilled);
        assertThat(handle.releases()).isZero();
        assertThat(registry.numberRegisteredTransactions()).isEqualTo(1);

        latch.countDown();
        await().atMost(5, TimeUnit.SECONDS).until(() -> registry.numberRegisteredTransactions() == 0);
        assertThat(handle.releases()).isEqualTo(1);
    }

    @Test
    public void test_lease_conflict_is_reported() {
        registerQuery(rows(3).iterator());
        registry.open(DATABASE, 1);

        assertThatThrownBy(() -> newExecutor(true, Duration.ofSeconds(5)).getSome(1))
                .isInstanceOf(RemoteCommunicationException.class)
                .satisfies((e) -> assertThat(((RemoteCommunicationException) e).getRemoteErrorCode()).isEqualTo(RemoteResponse.LEASE_CONFLICT));
    }

    @Test
    public void test_unknown_query() {
        assertThatThrownBy(() -> newExecutor(true, Duration.ofSeconds(5)).getSome(1))
                .isInstanceOf(RemoteCommunicationException.class)
                .satisfies((e) -> assertThat(((RemoteCommunicationException) e).getRemoteErrorCode()).isEqualTo(RemoteResponse.QUERY_NOT_FOUND));
    }

    @Test
    public void test_unknown_server() {
        RemoteExecutor executor = new RemoteNode(1, DATABASE, new RemoteTarget("unknown", "coordinator", "q1"), true)
                .createExecutor(transport, Duration.ofSeconds(5));

        assertThatThrownBy(() -> executor.getSome(1))
                .isInstanceOf(RemoteCommunicationException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    public void test_streamInto() throws Exception {
        RecordingTransactionHandle handle = registerQuery(rows(7).iterator());
        StreamSignal signal = new StreamSignal();
        BufferedRowStream stream = new BufferedRowStream(SERVER, signal);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<Void> future = newExecutor(true, Duration.ofSeconds(5)).streamInto(stream, 3, pool);

            assertThat(RowSourceUtil.drain(stream, signal, Duration.ofSeconds(5))).containsExactlyElementsOf(rows(7));
            future.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertThat(handle.commits()).isEqualTo(1);
        assertThat(handle.releases()).isEqualTo(1);
    }

    @Test
    public void test_streamInto_fails_the_stream() {
        StreamSignal signal = new StreamSignal();
        BufferedRowStream stream = new BufferedRowStream(SERVER, signal);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<Void> future = newExecutor(true, Duration.ofSeconds(5)).streamInto(stream, 3, pool);

            assertThatThrownBy(() -> RowSourceUtil.drain(stream, signal, Duration.ofSeconds(5)))
                    .isInstanceOf(RemoteCommunicationException.class);
            assertThat(future).failsWithin(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void test_sibling_remote_nodes_share_one_query() {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        handler.register(new ShardQuery("q1", DATABASE, 1, Map.of(
                "shard-A", rows(4).iterator(),
                "shard-B", List.of(Row.of("value", 10), Row.of("value", 11)).iterator()
        )), handle);
        RemoteExecutor first = new RemoteNode(1, DATABASE, new RemoteTarget(SERVER, "shard-A", "q1"), true)
                .createExecutor(transport, Duration.ofSeconds(5));
        RemoteExecutor second = new RemoteNode(2, DATABASE, new RemoteTarget(SERVER, "shard-B", "q1"), false)
                .createExecutor(transport, Duration.ofSeconds(5));

        first.initializeCursor();
        second.initializeCursor();
        List<Row> fromFirst = new ArrayList<>();
        while (!first.isDone()) {
            fromFirst.addAll(first.getSome(3));
        }
        first.shutdown(RemoteResponse.NO_ERROR);

        List<Row> fromSecond = new ArrayList<>();
        while (!second.isDone()) {
            fromSecond.addAll(second.getSome(3));
        }
        second.shutdown(RemoteResponse.NO_ERROR);

        assertThat(fromFirst).isEqualTo(rows(4));
        assertThat(fromSecond).containsExactly(Row.of("value", 10), Row.of("value", 11));
        assertThat(transport.requests())
                .filteredOn((request) -> request.kind() == RemoteRequestKind.INITIALIZE_CURSOR)
                .hasSize(1);
        assertThat(handle.commits()).isEqualTo(1);
        assertThat(handle.releases()).isEqualTo(1);
        assertThat(handler.isRegistered("q1")).isFalse();
    }

    @Test
    public void test_concurrent_cancel_sends_one_request() throws Exception {
        registerQuery(rows(1).iterator());
        RemoteExecutor executor = newExecutor(true, Duration.ofSeconds(5));
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    executor.cancel();
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(executor.isCancelled()).isTrue();
        assertThat(transport.requests())
                .filteredOn((request) -> request.kind() == RemoteRequestKind.CANCEL)
                .hasSize(1);
    }
}
