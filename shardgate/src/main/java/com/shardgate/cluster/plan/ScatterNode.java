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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardgate.document.Row;

import java.util.function.BiConsumer;

/**
 * Broadcasts every upstream row to every client stream, so each client sees a full copy of
 * the upstream sequence.
 */
public class ScatterNode extends PlanNode implements FanOutNode {
    private final ClientSet clients;

    public ScatterNode(int id, ClientSet clients) {
        super(id);
        this.clients = clients;
    }

    static ScatterNode fromJson(JsonNode base) {
        return new ScatterNode(readId(base), ClientSet.fromJson(base));
    }

    @Override
    public NodeType type() {
        return NodeType.SCATTER;
    }

    @Override
    public ClientSet clients() {
        return clients;
    }

    @Override
    public void dispatch(Row row, BiConsumer<String, Row> consumer) {
        for (String client : clients) {
            consumer.accept(client, row);
        }
    }

    /**
     * Every upstream row is processed once per client.
     */
    @Override
    public CostEstimate estimateCost() {
        return singleDependencyCost()
                .map(dependency -> new CostEstimate(dependency.cost() + (double) dependency.rows() * clients.size(), dependency.rows()))
                .orElse(CostEstimate.FALLBACK);
    }

    @Override
    protected void writeFields(ObjectNode node) {
        clients.writeTo(node);
    }
}
