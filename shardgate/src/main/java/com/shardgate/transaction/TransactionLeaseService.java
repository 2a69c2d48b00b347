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

import com.shardgate.BaseShardgateService;
import com.shardgate.CachedTimeService;
import com.shardgate.Context;
import com.shardgate.ShardgateService;
import com.shardgate.internal.ShardgateExecutors;
import com.shardgate.cluster.remote.RemoteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns the process-wide {@link TransactionLeaseRegistry} and periodically reclaims expired
 * leases. Every remaining lease is destroyed on shutdown.
 */
public class TransactionLeaseService extends BaseShardgateService implements ShardgateService {
    public static final String NAME = "TransactionLease";
    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionLeaseService.class);
    private final TransactionLeaseRegistry registry;
    private final Duration expiryInterval;
    private final ScheduledExecutorService scheduler;

    public TransactionLeaseService(Context context) {
        super(context, NAME);
        CachedTimeService cachedTimeService = context.getService(CachedTimeService.NAME);
        if (cachedTimeService == null) {
            throw new IllegalStateException(CachedTimeService.NAME + " service must be registered before " + NAME);
        }
        Duration defaultTtl = context.getConfig().getDuration("transactions.default_ttl");
        this.expiryInterval = context.getConfig().getDuration("transactions.expiry_interval");
        if (expiryInterval.isZero() || expiryInterval.isNegative()) {
            throw new IllegalArgumentException("transactions.expiry_interval must be positive: " + expiryInterval);
        }
        this.registry = new TransactionLeaseRegistry(cachedTimeService, defaultTtl);
        this.scheduler = ShardgateExecutors.newSingleThreadScheduler("sg-transaction-expiry-%d");
    }

    public void start() {
        long interval = expiryInterval.toMillis();
        scheduler.scheduleWithFixedDelay(this::expire, interval, interval, TimeUnit.MILLISECONDS);
        LOGGER.debug("Expired transactions will be reclaimed every {}", expiryInterval);
    }

    private void expire() {
        try {
            registry.expireTransactions();
        } catch (Exception e) {
            // An exception would cancel all subsequent runs.
            LOGGER.error("Failed to reclaim expired transactions", e);
        }
    }

    public TransactionLeaseRegistry getRegistry() {
        return registry;
    }

    @Override
    public void shutdown() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(6, TimeUnit.SECONDS)) {
                LOGGER.warn("{} service cannot be stopped gracefully", NAME);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int remaining = registry.numberRegisteredTransactions();
        registry.destroyAll(RemoteResponse.QUERY_KILLED);
        if (remaining > 0) {
            LOGGER.info("{} registered transactions have been destroyed", remaining);
        }
    }
}
