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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardgate.JSONUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Base class of all plan nodes. A node has a plan-unique id and an ordered list of upstream
 * dependencies. The graph is wired once by the planning layer and must not change while the
 * plan executes.
 */
public abstract class PlanNode {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlanNode.class);
    private final int id;
    private final List<PlanNode> dependencies = new ArrayList<>();

    protected PlanNode(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public abstract NodeType type();

    public List<PlanNode> dependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    /**
     * @return the first dependency, or {@code null} for a leaf node
     */
    public PlanNode firstDependency() {
        if (dependencies.isEmpty()) {
            return null;
        }
        return dependencies.get(0);
    }

    /**
     * Appends an upstream dependency. Only the planning layer and plan deserialization wire nodes.
     */
    public void addDependency(PlanNode node) {
        if (node == this) {
            throw new IllegalArgumentException("a node cannot depend on itself, id=" + id);
        }
        if (dependencies.contains(node)) {
            throw new IllegalStateException("dependency " + node.id() + " has already been added to node " + id);
        }
        dependencies.add(node);
    }

    /**
     * Estimates the cost of this node including all of its dependencies.
     */
    public abstract CostEstimate estimateCost();

    /**
     * Returns the estimate of the single dependency that distribution nodes expect to have.
     * Any other dependency count is a plan construction bug; it is logged and an empty result
     * is returned, so callers fall back to {@link CostEstimate#FALLBACK} instead of failing.
     */
    protected Optional<CostEstimate> singleDependencyCost() {
        if (dependencies.size() != 1) {
            LOGGER.warn(
                    "Degenerate topology: {} id={} has {} dependencies, expected exactly one. Using a conservative cost estimate",
                    type().typeName(), id, dependencies.size()
            );
            return Optional.empty();
        }
        return Optional.of(dependencies.get(0).estimateCost());
    }

    /**
     * Serializes this node into its interchange form.
     */
    public ObjectNode toJson() {
        ObjectNode node = JSONUtil.createObjectNode();
        node.put("type", type().typeName());
        node.put("id", id);
        ArrayNode deps = node.putArray("dependencies");
        for (PlanNode dependency : dependencies) {
            deps.add(dependency.id());
        }
        CostEstimate estimate = estimateCost();
        node.put("estimatedCost", estimate.cost());
        node.put("estimatedNrItems", estimate.rows());
        writeFields(node);
        return node;
    }

    /**
     * Writes the node specific attributes.
     */
    protected abstract void writeFields(ObjectNode node);

    @Override
    public String toString() {
        return String.format("%s {id=%d}", type().typeName(), id);
    }

    static int readId(JsonNode base) {
        JsonNode id = base.get("id");
        if (id == null || !id.canConvertToInt()) {
            throw new PlanConstructionException("plan node has no valid 'id' attribute: " + base);
        }
        return id.asInt();
    }

    static String requiredString(JsonNode base, String field) {
        JsonNode value = base.get(field);
        if (value == null || !value.isTextual()) {
            throw new PlanConstructionException(
                    String.format("invalid serialized %s definition, '%s' attribute is expected to be a string", base.path("type").asText(), field)
            );
        }
        return value.asText();
    }

    static boolean requiredBoolean(JsonNode base, String field) {
        JsonNode value = base.get(field);
        if (value == null || !value.isBoolean()) {
            throw new PlanConstructionException(
                    String.format("invalid serialized %s definition, '%s' attribute is expected to be a boolean", base.path("type").asText(), field)
            );
        }
        return value.asBoolean();
    }

    static boolean booleanOrDefault(JsonNode base, String field, boolean defaultValue) {
        JsonNode value = base.get(field);
        if (value == null || !value.isBoolean()) {
            LOGGER.error(
                    "invalid serialized {} definition, '{}' attribute is expected to be a boolean, using {}",
                    base.path("type").asText(), field, defaultValue
            );
            return defaultValue;
        }
        return value.asBoolean();
    }
}
