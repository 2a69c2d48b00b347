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

import java.util.Optional;

public enum SortMode {
    /**
     * No sort criterion, rows are passed through in arrival order.
     */
    UNSET("unset"),
    /**
     * Linear scan over the buffered heads.
     */
    MIN_ELEMENT("minelement"),
    /**
     * Buffered heads kept in a priority queue.
     */
    HEAP("heap");

    private final String value;

    SortMode(String value) {
        this.value = value;
    }

    public static Optional<SortMode> fromValue(String value) {
        for (SortMode mode : values()) {
            if (mode.value.equals(value)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    public String value() {
        return value;
    }
}
