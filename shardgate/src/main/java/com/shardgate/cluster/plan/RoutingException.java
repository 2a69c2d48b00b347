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

package com.shardgate.cluster.plan;

import com.shardgate.common.ShardgateException;

/**
 * Thrown when a {@link DistributeNode} cannot route a row to a client stream.
 */
public class RoutingException extends ShardgateException {
    private final Reason reason;

    public RoutingException(Reason reason, String message) {
        super("ROUTING", message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        MISSING_KEY,
        INVALID_DOCUMENT_TYPE,
        UNKNOWN_SHARD
    }
}
