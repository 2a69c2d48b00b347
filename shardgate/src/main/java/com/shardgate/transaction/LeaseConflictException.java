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

import com.shardgate.common.ShardgateException;

/**
 * Thrown when a lease operation does not fit the current state of the lease. The registry is
 * left unchanged.
 */
public class LeaseConflictException extends ShardgateException {
    private final Reason reason;

    public LeaseConflictException(Reason reason, String message) {
        super("LEASE", message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        NOT_FOUND,
        ALREADY_OPEN,
        NOT_OPEN,
        DUPLICATE
    }
}
