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

import java.util.ArrayList;
import java.util.List;

/**
 * One sort criterion of a gather: the variable to read, the direction and an optional path
 * into the variable's document.
 */
public record SortElement(Variable variable, boolean ascending, List<String> attributePath) {

    public SortElement {
        attributePath = attributePath == null ? List.of() : List.copyOf(attributePath);
    }

    public static SortElement ascending(Variable variable) {
        return new SortElement(variable, true, List.of());
    }

    public static SortElement descending(Variable variable) {
        return new SortElement(variable, false, List.of());
    }

    static SortElement fromJson(JsonNode node, PlanContext context) {
        if (node == null || !node.isObject()) {
            throw new PlanConstructionException("sort element is expected to be an object");
        }
        Variable variable = Variable.fromJson(node.get("inVariable"));
        context.registerVariable(variable);
        JsonNode ascending = node.get("ascending");
        if (ascending == null || !ascending.isBoolean()) {
            throw new PlanConstructionException("sort element requires a boolean 'ascending' attribute");
        }
        List<String> path = new ArrayList<>();
        JsonNode pathNode = node.get("path");
        if (pathNode != null) {
            if (!pathNode.isArray()) {
                throw new PlanConstructionException("sort element 'path' is expected to be an array of string");
            }
            for (JsonNode attribute : pathNode) {
                if (!attribute.isTextual()) {
                    throw new PlanConstructionException("sort element 'path' is expected to be an array of string");
                }
                path.add(attribute.asText());
            }
        }
        return new SortElement(variable, ascending.asBoolean(), path);
    }

    ObjectNode toJson() {
        ObjectNode node = JSONUtil.createObjectNode();
        node.set("inVariable", variable.toJson());
        node.put("ascending", ascending);
        if (!attributePath.isEmpty()) {
            ArrayNode path = node.putArray("path");
            attributePath.forEach(path::add);
        }
        return node;
    }
}
