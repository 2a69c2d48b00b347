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

import com.shardgate.cluster.plan.*;
import com.shardgate.cluster.sharding.HashSlotShardedCollection;
import com.shardgate.document.Row;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FanOutDispatcherTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final List<String> SHARDS = List.of("s1", "s2", "s3", "s4");

    private static List<Row> documents(int count) {
        List<Row> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(Row.of("doc", Map.of("_key", "key-" + i)));
        }
        return rows;
    }

    @Test
    public void test_scatter() {
        StreamSignal signal = new StreamSignal();
        FanOutDispatcher dispatcher = new FanOutDispatcher(new ScatterNode(1, ClientSet.of(SHARDS)), signal);
        List<Row> rows = documents(10);

        dispatcher.run(rows.iterator());

        assertThat(dispatcher.streams()).hasSize(4);
        for (BufferedRowStream stream : dispatcher.streams()) {
            assertThat(RowSourceUtil.drain(stream, signal, TIMEOUT)).containsExactlyElementsOf(rows);
        }
    }

    @Test
    public void test_distribute_partitions_rows() {
        StreamSignal signal = new StreamSignal();
        Variable doc = new Variable(1, "doc");
        DistributeNode distribute = new DistributeNode(
                1, ClientSet.of(SHARDS), HashSlotShardedCollection.byKey("users", SHARDS), doc, doc, false, false
        );
        FanOutDispatcher dispatcher = new FanOutDispatcher(distribute, signal);
        List<Row> rows = documents(100);

        dispatcher.run(rows.iterator());

        List<Row> received = new ArrayList<>();
        for (BufferedRowStream stream : dispatcher.streams()) {
            List<Row> streamRows = RowSourceUtil.drain(stream, signal, TIMEOUT);
            for (Row row : streamRows) {
                assertThat(distribute.route(row).clientId()).isEqualTo(stream.clientId());
            }
            received.addAll(streamRows);
        }
        assertThat(received).containsExactlyInAnyOrderElementsOf(rows);
    }

    @Test
    public void test_routing_failure_fails_every_stream() {
        StreamSignal signal = new StreamSignal();
        Variable doc = new Variable(1, "doc");
        DistributeNode distribute = new DistributeNode(
                1, ClientSet.of(SHARDS), HashSlotShardedCollection.byKey("users", SHARDS), doc, doc, false, false
        );
        FanOutDispatcher dispatcher = new FanOutDispatcher(distribute, signal);
        List<Row> rows = new ArrayList<>(documents(3));
        rows.add(Row.of("other", 1));

        assertThatThrownBy(() -> dispatcher.run(rows.iterator())).isInstanceOf(RoutingException.class);
        for (BufferedRowStream stream : dispatcher.streams()) {
            assertThatThrownBy(() -> RowSourceUtil.drain(stream, signal, TIMEOUT)).isInstanceOf(RoutingException.class);
        }
    }
}
