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

package com.shardgate.common;

/**
 * Base class of every error raised by Shardgate. An exception carries a short, upper-case
 * prefix (for example {@code ROUTING} or {@code LEASE}) that callers use to classify
 * failures without inspecting the concrete type.
 */
public class ShardgateException extends RuntimeException {
    public static final String DEFAULT_PREFIX = "ERR";

    private final String prefix;

    public ShardgateException(String message) {
        this(DEFAULT_PREFIX, message);
    }

    public ShardgateException(String prefix, String message) {
        super(message);
        this.prefix = prefix;
    }

    public ShardgateException(String prefix, String message, Throwable cause) {
        super(message, cause);
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public String toString() {
        return String.format("%s %s", prefix, getMessage());
    }
}
