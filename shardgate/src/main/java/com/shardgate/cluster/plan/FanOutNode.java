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

import com.shardgate.document.Row;

import java.util.function.BiConsumer;

/**
 * A plan node that fans upstream rows out to the client streams of its {@link ClientSet}.
 */
public interface FanOutNode {
    ClientSet clients();

    /**
     * Hands {@code row} to the client streams it belongs to. The consumer receives the client id
     * and the row to deliver to it.
     */
    void dispatch(Row row, BiConsumer<String, Row> consumer);
}
