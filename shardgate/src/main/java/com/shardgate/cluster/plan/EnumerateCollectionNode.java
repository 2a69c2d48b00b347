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
import com.shardgate.cluster.sharding.ShardedCollection;

/**
 * Reads every document of a collection into {@code outVariable}.
 */
public class EnumerateCollectionNode extends PlanNode {
    private final ShardedCollection collection;
    private final Variable outVariable;

    public EnumerateCollectionNode(int id, ShardedCollection collection, Variable outVariable) {
        super(id);
        this.collection = collection;
        this.outVariable = outVariable;
    }

    static EnumerateCollectionNode fromJson(JsonNode base, PlanContext context) {
        Variable outVariable = Variable.fromJson(base.get("outVariable"));
        context.registerVariable(outVariable);
        return new EnumerateCollectionNode(readId(base), context.collection(requiredString(base, "collection")), outVariable);
    }

    @Override
    public NodeType type() {
        return NodeType.ENUMERATE_COLLECTION;
    }

    public ShardedCollection collection() {
        return collection;
    }

    public Variable outVariable() {
        return outVariable;
    }

    /**
     * The whole collection is read once per incoming row.
     */
    @Override
    public CostEstimate estimateCost() {
        PlanNode dependency = firstDependency();
        CostEstimate incoming = dependency == null ? new CostEstimate(0.0, 1) : dependency.estimateCost();
        long rows = incoming.rows() * collection.estimatedDocumentCount();
        return new CostEstimate(incoming.cost() + rows, rows);
    }

    @Override
    protected void writeFields(ObjectNode node) {
        node.put("collection", collection.name());
        node.set("outVariable", outVariable.toJson());
    }
}
