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

package com.shardgate.cluster.execution;

import com.shardgate.document.Row;

/**
 * A non-blocking source of rows.
 */
public interface RowSource {
    /**
     * Returns the next available row without waiting.
     *
     * @return the next row, or {@code null} if no row is available right now
     */
    Row poll();

    /**
     * Returns true if this source will never produce another row.
     */
    boolean isExhausted();
}
