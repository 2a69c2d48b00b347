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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts the calls the registry makes on a transaction.
 */
public class RecordingTransactionHandle implements TransactionHandle {
    private final AtomicInteger commits = new AtomicInteger();
    private final AtomicInteger aborts = new AtomicInteger();
    private final AtomicInteger releases = new AtomicInteger();
    private final AtomicBoolean killed = new AtomicBoolean();

    @Override
    public void commit() {
        commits.incrementAndGet();
    }

    @Override
    public void abort() {
        aborts.incrementAndGet();
    }

    @Override
    public void kill() {
        killed.set(true);
    }

    @Override
    public boolean isKilled() {
        return killed.get();
    }

    @Override
    public void release() {
        releases.incrementAndGet();
    }

    public int commits() {
        return commits.get();
    }

    public int aborts() {
        return aborts.get();
    }

    public int releases() {
        return releases.get();
    }
}
