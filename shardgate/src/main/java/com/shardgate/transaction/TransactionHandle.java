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

/**
 * A server-side transaction context leased through the {@link TransactionLeaseRegistry}.
 */
public interface TransactionHandle {
    void commit();

    void abort();

    /**
     * Flags the transaction as killed while it is borrowed. The borrower is expected to notice
     * the flag and give the lease back.
     */
    void kill();

    boolean isKilled();

    /**
     * Frees the resources of the transaction, aborting it first if it is still running. Called
     * once, after the lease has left the registry.
     */
    void release();
}
