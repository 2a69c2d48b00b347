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

package com.shardgate;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.locks.LockSupport;
import java.util.function.LongSupplier;

/**
 * Millisecond clock of the transaction lease registry.
 * <p>
 * Lease expiry is checked on every open, close and sweep, so the time is cached and refreshed
 * approximately every millisecond by a low-priority daemon thread. Readers may observe a value
 * up to 1ms behind the system clock. The cached value never moves backwards, a wall-clock step
 * back holds it until the system clock catches up, so a closed lease cannot regain lifetime.
 */
public class CachedTimeService extends BaseShardgateService implements ShardgateService, LongSupplier {
    public static final String NAME = "CachedTime";
    private final LongSupplier systemClock;
    private final Thread updater;
    private volatile long currentTimeInMilliseconds;
    private volatile boolean shutdown;

    public CachedTimeService(Context context) {
        this(context, System::currentTimeMillis);
    }

    CachedTimeService(Context context, LongSupplier systemClock) {
        super(context, NAME);
        this.systemClock = systemClock;
        // Readers must never see zero, even before the updater thread is scheduled.
        update();
        updater = new ThreadFactoryBuilder()
                .setNameFormat("sg-cached-time-service")
                .setDaemon(true)
                .setPriority(Thread.MIN_PRIORITY)
                .build()
                .newThread(() -> {
                    while (!shutdown) {
                        update();
                        LockSupport.parkNanos(1_000_000); // 1ms
                    }
                });
    }

    // Only the updater thread writes after construction.
    void update() {
        long now = systemClock.getAsLong();
        if (now > currentTimeInMilliseconds) {
            currentTimeInMilliseconds = now;
        }
    }

    /**
     * Starts the background updater thread. Must be called once.
     */
    public void start() {
        updater.start();
    }

    /**
     * @return the cached current time in milliseconds since January 1, 1970 UTC
     */
    @Override
    public long getAsLong() {
        return currentTimeInMilliseconds;
    }

    @Override
    public void shutdown() {
        shutdown = true;
        if (updater.isAlive()) {
            updater.interrupt();
        }
    }
}
