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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Leases transaction handles to remote operations, keyed by database and transaction id.
 * <p>
 * A registered transaction is either closed, waiting for its next borrower, or open, borrowed by
 * exactly one operation. Closed transactions expire once their TTL has passed since the last
 * close and are reclaimed by {@link #expireTransactions()}. The lock guards the lease table only;
 * commit, abort, kill and release run outside of it.
 */
public class TransactionLeaseRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionLeaseRegistry.class);
    private final LongSupplier currentTimeMillis;
    private final Duration defaultTtl;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Map<Long, Lease>> transactions = new HashMap<>();

    /**
     * @param currentTimeMillis clock used to compute and check expiry times
     * @param defaultTtl        TTL of transactions inserted without an explicit one
     */
    public TransactionLeaseRegistry(LongSupplier currentTimeMillis, Duration defaultTtl) {
        if (defaultTtl.isNegative()) {
            throw new IllegalArgumentException("default TTL cannot be negative: " + defaultTtl);
        }
        this.currentTimeMillis = currentTimeMillis;
        this.defaultTtl = defaultTtl;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void insert(String database, long id, TransactionHandle handle) {
        insert(database, id, handle, defaultTtl);
    }

    /**
     * Registers a transaction in closed state.
     *
     * @throws LeaseConflictException if the transaction is already registered
     */
    public void insert(String database, long id, TransactionHandle handle, Duration ttl) {
        lock.lock();
        try {
            Map<Long, Lease> leases = transactions.computeIfAbsent(database, (k) -> new HashMap<>());
            if (leases.containsKey(id)) {
                throw new LeaseConflictException(
                        LeaseConflictException.Reason.DUPLICATE,
                        String.format("transaction %d is already registered in database %s", id, database)
                );
            }
            long ttlMillis = ttl.toMillis();
            leases.put(id, new Lease(handle, ttlMillis, currentTimeMillis.getAsLong() + ttlMillis));
        } finally {
            lock.unlock();
        }
        LOGGER.debug("Transaction {} has been registered in database {}", id, database);
    }

    /**
     * Borrows a transaction. A transaction can be borrowed by one operation at a time, a second
     * open fails instead of waiting.
     *
     * @throws LeaseConflictException if the transaction is not registered or already open
     */
    public TransactionHandle open(String database, long id) {
        lock.lock();
        try {
            Lease lease = findLease(database, id);
            if (lease.open) {
                throw new LeaseConflictException(
                        LeaseConflictException.Reason.ALREADY_OPEN,
                        String.format("transaction %d in database %s is already open", id, database)
                );
            }
            lease.open = true;
            return lease.handle;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gives a borrowed transaction back, keeping its previous TTL.
     */
    public void close(String database, long id) {
        finish(database, id, null, null);
    }

    /**
     * Gives a borrowed transaction back with a new TTL.
     */
    public void close(String database, long id, Duration ttl) {
        finish(database, id, ttl, null);
    }

    /**
     * Commits a borrowed transaction and gives it back. A killed transaction is aborted instead.
     */
    public void closeCommit(String database, long id) {
        finish(database, id, null, TransactionHandle::commit);
    }

    /**
     * Commits a borrowed transaction and gives it back with a new TTL. A killed transaction is
     * aborted instead.
     */
    public void closeCommit(String database, long id, Duration ttl) {
        finish(database, id, ttl, TransactionHandle::commit);
    }

    /**
     * Aborts a borrowed transaction and gives it back.
     */
    public void closeAbort(String database, long id) {
        finish(database, id, null, TransactionHandle::abort);
    }

    /**
     * Aborts a borrowed transaction and gives it back with a new TTL.
     */
    public void closeAbort(String database, long id, Duration ttl) {
        finish(database, id, ttl, TransactionHandle::abort);
    }

    private void finish(String database, long id, Duration ttl, Consumer<TransactionHandle> action) {
        Lease lease;
        boolean killed;
        lock.lock();
        try {
            lease = findLease(database, id);
            if (!lease.open) {
                throw new LeaseConflictException(
                        LeaseConflictException.Reason.NOT_OPEN,
                        String.format("transaction %d in database %s is not open", id, database)
                );
            }
            killed = lease.killed;
        } finally {
            lock.unlock();
        }

        boolean release = false;
        try {
            if (action != null) {
                if (killed) {
                    LOGGER.warn("Transaction {} in database {} has been killed, aborting it", id, database);
                    lease.handle.abort();
                } else {
                    action.accept(lease.handle);
                }
            }
        } finally {
            lock.lock();
            try {
                lease.open = false;
                if (ttl != null) {
                    lease.ttlMillis = ttl.toMillis();
                }
                lease.expires = currentTimeMillis.getAsLong() + lease.ttlMillis;
                if (lease.killed) {
                    removeLease(database, id);
                    release = true;
                }
            } finally {
                lock.unlock();
            }
            if (release) {
                LOGGER.debug("Killed transaction {} in database {} has been closed, releasing it", id, database);
                lease.handle.release();
            }
        }
    }

    /**
     * Destroys a transaction. An open transaction is killed and released by its borrower's
     * close; a closed one is released and removed right away. Unknown transactions are ignored.
     */
    public void destroy(String database, long id, int errorCode) {
        Lease lease;
        boolean open;
        lock.lock();
        try {
            Map<Long, Lease> leases = transactions.get(database);
            lease = leases == null ? null : leases.get(id);
            if (lease == null) {
                return;
            }
            open = lease.open;
            if (open) {
                lease.killed = true;
            } else {
                removeLease(database, id);
            }
        } finally {
            lock.unlock();
        }

        if (open) {
            LOGGER.debug("Killing open transaction {} in database {}, errorCode={}", id, database, errorCode);
            lease.handle.kill();
        } else {
            LOGGER.debug("Destroying transaction {} in database {}, errorCode={}", id, database, errorCode);
            lease.handle.release();
        }
    }

    /**
     * Reclaims every closed transaction whose expiry time has been reached.
     *
     * @return number of reclaimed transactions
     */
    public int expireTransactions() {
        List<Lease> expired = new ArrayList<>();
        lock.lock();
        try {
            long now = currentTimeMillis.getAsLong();
            Iterator<Map<Long, Lease>> databases = transactions.values().iterator();
            while (databases.hasNext()) {
                Map<Long, Lease> leases = databases.next();
                Iterator<Lease> iterator = leases.values().iterator();
                while (iterator.hasNext()) {
                    Lease lease = iterator.next();
                    if (!lease.open && now >= lease.expires) {
                        iterator.remove();
                        expired.add(lease);
                    }
                }
                if (leases.isEmpty()) {
                    databases.remove();
                }
            }
        } finally {
            lock.unlock();
        }

        for (Lease lease : expired) {
            try {
                lease.handle.release();
            } catch (Exception e) {
                LOGGER.error("Failed to release an expired transaction", e);
            }
        }
        if (!expired.isEmpty()) {
            LOGGER.debug("{} expired transactions have been reclaimed", expired.size());
        }
        return expired.size();
    }

    /**
     * Destroys every registered transaction.
     */
    public void destroyAll(int errorCode) {
        Map<String, List<Long>> ids = new HashMap<>();
        lock.lock();
        try {
            for (Map.Entry<String, Map<Long, Lease>> entry : transactions.entrySet()) {
                ids.put(entry.getKey(), new ArrayList<>(entry.getValue().keySet()));
            }
        } finally {
            lock.unlock();
        }
        for (Map.Entry<String, List<Long>> entry : ids.entrySet()) {
            for (long id : entry.getValue()) {
                destroy(entry.getKey(), id, errorCode);
            }
        }
    }

    public int numberRegisteredTransactions() {
        lock.lock();
        try {
            int total = 0;
            for (Map<Long, Lease> leases : transactions.values()) {
                total += leases.size();
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRegistered(String database, long id) {
        lock.lock();
        try {
            Map<Long, Lease> leases = transactions.get(database);
            return leases != null && leases.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpen(String database, long id) {
        lock.lock();
        try {
            Map<Long, Lease> leases = transactions.get(database);
            Lease lease = leases == null ? null : leases.get(id);
            return lease != null && lease.open;
        } finally {
            lock.unlock();
        }
    }

    // Callers must hold the lock.
    private Lease findLease(String database, long id) {
        Map<Long, Lease> leases = transactions.get(database);
        Lease lease = leases == null ? null : leases.get(id);
        if (lease == null) {
            throw new LeaseConflictException(
                    LeaseConflictException.Reason.NOT_FOUND,
                    String.format("transaction %d is not registered in database %s", id, database)
            );
        }
        return lease;
    }

    // Callers must hold the lock.
    private void removeLease(String database, long id) {
        Map<Long, Lease> leases = transactions.get(database);
        if (leases == null) {
            return;
        }
        leases.remove(id);
        if (leases.isEmpty()) {
            transactions.remove(database);
        }
    }

    private static final class Lease {
        private final TransactionHandle handle;
        private boolean open;
        private boolean killed;
        private long ttlMillis;
        private long expires;

        private Lease(TransactionHandle handle, long ttlMillis, long expires) {
            this.handle = handle;
            this.ttlMillis = ttlMillis;
            this.expires = expires;
        }
    }
}
