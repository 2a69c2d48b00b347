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

/**
 * The root of every dependency chain, produces exactly one empty row.
 */
public class SingletonNode extends PlanNode {
    private static final CostEstimate ESTIMATE = new CostEstimate(1.0, 1);

    public SingletonNode(int id) {
        super(id);
    }

    static SingletonNode fromJson(JsonNode base) {
        return new SingletonNode(readId(base));
    }

    @Override
    public NodeType type() {
        return NodeType.SINGLETON;
    }

    @Override
    public CostEstimate estimateCost() {
        return ESTIMATE;
    }

    @Override
    protected void writeFields(ObjectNode node) {
    }
}
