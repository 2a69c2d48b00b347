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

package com.shardgate.transaction;

import com.shardgate.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionLeaseRegistryTest {
    private static final String DATABASE = "db";
    private ManualClock clock;
    private TransactionLeaseRegistry registry;

    @BeforeEach
    public void setup() {
        clock = new ManualClock(0);
        registry = new TransactionLeaseRegistry(clock, Duration.ofSeconds(60));
    }

    private static LeaseConflictException.Reason reasonOf(Throwable throwable) {
        return ((LeaseConflictException) throwable).getReason();
    }

    @Test
    public void test_insert_then_open() {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        registry.insert(DATABASE, 1, handle);

        assertThat(registry.open(DATABASE, 1)).isSameAs(handle);
        assertThat(registry.isOpen(DATABASE, 1)).isTrue();
        assertThat(registry.numberRegisteredTransactions()).isEqualTo(1);
    }

    @Test
    public void test_second_open_fails() {
        registry.insert(DATABASE, 1, new RecordingTransactionHandle());
        registry.open(DATABASE, 1);

        assertThatThrownBy(() -> registry.open(DATABASE, 1))
                .isInstanceOf(LeaseConflictException.class)
                .satisfies((e) -> assertThat(reasonOf(e)).isEqualTo(LeaseConflictException.Reason.ALREADY_OPEN));
        assertThat(registry.isOpen(DATABASE, 1)).isTrue();
    }

    @Test
    public void test_open_after_close() {
        registry.insert(DATABASE, 1, new RecordingTransactionHandle());
        registry.open(DATABASE, 1);
        registry.close(DATABASE, 1);

        assertThat(registry.isOpen(DATABASE, 1)).isFalse();
        registry.open(DATABASE, 1);
        assertThat(registry.isOpen(DATABASE, 1)).isTrue();
    }

    @Test
    public void test_open_unknown_transaction() {
        assertThatThrownBy(() -> registry.open(DATABASE, 42))
                .isInstanceOf(LeaseConflictException.class)
                .satisfies((e) -> assertThat(reasonOf(e)).isEqualTo(LeaseConflictException.Reason.NOT_FOUND));
    }

    @Test
    public void test_close_when_not_open() {
        registry.insert(DATABASE, 1, new RecordingTransactionHandle());

        assertThatThrownBy(() -> registry.close(DATABASE, 1))
                .isInstanceOf(LeaseConflictException.class)
                .satisfies((e) -> assertThat(reasonOf(e)).isEqualTo(LeaseConflictException.Reason.NOT_OPEN));
        assertThatThrownBy(() -> registry.closeCommit(DATABASE, 1))
                .isInstanceOf(LeaseConflictException.class);
        assertThatThrownBy(() -> registry.closeAbort(DATABASE, 2))
                .isInstanceOf(LeaseConflictException.class)
                .satisfies((e) -> assertThat(reasonOf(e)).isEqualTo(LeaseConflictException.Reason.NOT_FOUND));
    }

    @Test
    public void test_insert_duplicate() {
        registry.insert(DATABASE, 1, new RecordingTransactionHandle());

        assertThatThrownBy(() -> registry.insert(DATABASE, 1, new RecordingTransactionHandle()))
                .isInstanceOf(LeaseConflictException.class)
                .satisfies((e) -> assertThat(reasonOf(e)).isEqualTo(LeaseConflictException.Reason.DUPLICATE));
        assertThat(registry.numberRegisteredTransactions()).isEqualTo(1);
    }

    @Test
    public void test_same_id_in_different_databases() {
        registry.insert("db-1", 1, new RecordingTransactionHandle());
        registry.insert("db-2", 1, new RecordingTransactionHandle());
        registry.open("db-1", 1);

        assertThat(registry.isOpen("db-2", 1)).isFalse();
        assertThat(registry.numberRegisteredTransactions()).isEqualTo(2);
    }

    @Test
    public void test_close_with_ttl_then_sweep() {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        registry.insert(DATABASE, 1, handle, Duration.ofSeconds(10));
        registry.open(DATABASE, 1);
        clock.set(5_000);
        registry.close(DATABASE, 1, Duration.ofSeconds(1));

        clock.set(5_999);
        assertThat(registry.expireTransactions()).isZero();
        assertThat(registry.isRegistered(DATABASE, 1)).isTrue();

        clock.set(6_000);
        assertThat(registry.expireTransactions()).isEqualTo(1);
        assertThat(registry.isRegistered(DATABASE, 1)).isFalse();
        assertThat(handle.releases()).isEqualTo(1);
    }

    @Test
    public void test_close_retains_previous_ttl() {
        registry.insert(DATABASE, 1, new RecordingTransactionHandle(), Duration.ofMillis(1_000));
        registry.open(DATABASE, 1);
        clock.set(500);
        registry.close(DATABASE, 1);

        clock.set(1_499);
        assertThat(registry.expireTransactions()).isZero();
        clock.set(1_500);
        assertThat(registry.expireTransactions()).isEqualTo(1);
    }

    @Test
    public void test_insert_uses_default_ttl() {
        registry.insert(DATABASE, 1, new RecordingTransactionHandle());

        clock.set(59_999);
        assertThat(registry.expireTransactions()).isZero();
        clock.set(60_000);
        assertThat(registry.expireTransactions()).isEqualTo(1);
    }

    @Test
    public void test_open_transaction_never_expires() {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        registry.insert(DATABASE, 1, handle, Duration.ZERO);
        registry.open(DATABASE, 1);

        clock.set(Long.MAX_VALUE / 2);
        assertThat(registry.expireTransactions()).isZero();
        assertThat(handle.releases()).isZero();
        assertThat(registry.isOpen(DATABASE, 1)).isTrue();
    }

    @Test
    public void test_destroy_while_open_defers_release() {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        registry.insert(DATABASE, 1, handle);
        registry.open(DATABASE, 1);

        registry.destroy(DATABASE, 1, 3);

        assertThat(handle.isKilled()).isTrue();
        assertThat(handle.releases()).isZero();
        assertThat(registry.numberRegisteredTransactions()).isEqualTo(1);

        registry.close(DATABASE, 1);
        assertThat(handle.releases()).isEqualTo(1);
        assertThat(registry.numberRegisteredTransactions()).isZero();
    }

    @Test
    public void test_destroy_while_closed_releases_immediately() {
        RecordingTransactionHandle first = new RecordingTransactionHandle();
        RecordingTransactionHandle second = new RecordingTransactionHandle();
        registry.insert(DATABASE, 1, first);
        registry.insert(DATABASE, 2, second);

        registry.destroy(DATABASE, 1, 0);

        assertThat(first.releases()).isEqualTo(1);
        assertThat(first.isKilled()).isFalse();
        assertThat(second.releases()).isZero();
        assertThat(registry.numberRegisteredTransactions()).isEqualTo(1);
    }

    @Test
    public void test_destroy_is_idempotent() {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        registry.insert(DATABASE, 1, handle);

        registry.destroy(DATABASE, 1, 0);
        registry.destroy(DATABASE, 1, 0);
        registry.destroy("unknown", 7, 0);

        assertThat(handle.releases()).isEqualTo(1);
    }

    @Test
    public void test_closeCommit() {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        registry.insert(DATABASE, 1, handle);
        registry.open(DATABASE, 1);

        registry.closeCommit(DATABASE, 1);

        assertThat(handle.commits()).isEqualTo(1);
        assertThat(handle.aborts()).isZero();
        assertThat(registry.isOpen(DATABASE, 1)).isFalse();
        assertThat(registry.isRegistered(DATABASE, 1)).isTrue();
    }

    @Test
    public void test_closeAbort() {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        registry.insert(DATABASE, 1, handle);
        registry.open(DATABASE, 1);

        registry.closeAbort(DATABASE, 1);

        assertThat(handle.aborts()).isEqualTo(1);
        assertThat(handle.commits()).isZero();
        assertThat(registry.isOpen(DATABASE, 1)).isFalse();
    }

    @Test
    public void test_closeCommit_aborts_killed_transaction() {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        registry.insert(DATABASE, 1, handle);
        registry.open(DATABASE, 1);
        registry.destroy(DATABASE, 1, 3);

        registry.closeCommit(DATABASE, 1);

        assertThat(handle.commits()).isZero();
        assertThat(handle.aborts()).isEqualTo(1);
        assertThat(handle.releases()).isEqualTo(1);
        assertThat(registry.isRegistered(DATABASE, 1)).isFalse();
    }

    @Test
    public void test_closeCommit_returns_lease_when_commit_fails() {
        TransactionHandle handle = new RecordingTransactionHandle() {
            @Override
            public void commit() {
                throw new IllegalStateException("commit failed");
            }
        };
        registry.insert(DATABASE, 1, handle);
        registry.open(DATABASE, 1);

        assertThatThrownBy(() -> registry.closeCommit(DATABASE, 1)).isInstanceOf(IllegalStateException.class);
        assertThat(registry.isOpen(DATABASE, 1)).isFalse();
    }

    @Test
    public void test_registry_is_usable_while_commit_runs() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            TransactionHandle handle = new RecordingTransactionHandle() {
                @Override
                public void commit() {
                    Future<?> future = executor.submit(() -> registry.insert(DATABASE, 2, new RecordingTransactionHandle()));
                    try {
                        future.get(5, TimeUnit.SECONDS);
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                }
            };
            registry.insert(DATABASE, 1, handle);
            registry.open(DATABASE, 1);

            registry.closeCommit(DATABASE, 1);

            assertThat(registry.numberRegisteredTransactions()).isEqualTo(2);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void test_destroyAll() {
        RecordingTransactionHandle closed = new RecordingTransactionHandle();
        RecordingTransactionHandle open = new RecordingTransactionHandle();
        registry.insert("db-1", 1, closed);
        registry.insert("db-2", 2, open);
        registry.open("db-2", 2);

        registry.destroyAll(3);

        assertThat(closed.releases()).isEqualTo(1);
        assertThat(open.isKilled()).isTrue();
        assertThat(open.releases()).isZero();
        assertThat(registry.numberRegisteredTransactions()).isEqualTo(1);

        registry.close("db-2", 2);
        assertThat(registry.numberRegisteredTransactions()).isZero();
    }

    @Test
    public void test_concurrent_open_only_one_wins() throws Exception {
        registry.insert(DATABASE, 1, new RecordingTransactionHandle());
        int numberOfThreads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(numberOfThreads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger conflicted = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < numberOfThreads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        registry.open(DATABASE, 1);
                        succeeded.incrementAndGet();
                    } catch (LeaseConflictException e) {
                        conflicted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(succeeded.get()).isEqualTo(1);
        assertThat(conflicted.get()).isEqualTo(numberOfThreads - 1);
    }

    @Test
    public void test_closeCommit_with_ttl_recomputes_expiry() {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        registry.insert(DATABASE, 1, handle);
        clock.advance(1000);
        registry.open(DATABASE, 1);

        registry.closeCommit(DATABASE, 1, Duration.ofSeconds(5));

        assertThat(handle.commits()).isEqualTo(1);
        clock.advance(4999);
        assertThat(registry.expireTransactions()).isZero();
        clock.advance(1);
        assertThat(registry.expireTransactions()).isEqualTo(1);
        assertThat(handle.releases()).isEqualTo(1);
    }

    @Test
    public void test_closeAbort_with_ttl_recomputes_expiry() {
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        registry.insert(DATABASE, 1, handle);
        registry.open(DATABASE, 1);

        registry.closeAbort(DATABASE, 1, Duration.ofSeconds(2));

        assertThat(handle.aborts()).isEqualTo(1);
        clock.advance(1999);
        assertThat(registry.expireTransactions()).isZero();
        clock.advance(1);
        assertThat(registry.expireTransactions()).isEqualTo(1);
    }

    @Test
    public void test_closeCommit_with_ttl_is_kept_by_later_close() {
        registry.insert(DATABASE, 1, new RecordingTransactionHandle());
        registry.open(DATABASE, 1);
        registry.closeCommit(DATABASE, 1, Duration.ofSeconds(3));

        clock.advance(1000);
        registry.open(DATABASE, 1);
        registry.close(DATABASE, 1);

        clock.advance(2999);
        assertThat(registry.expireTransactions()).isZero();
        clock.advance(1);
        assertThat(registry.expireTransactions()).isEqualTo(1);
    }
}
