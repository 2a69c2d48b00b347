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
import com.shardgate.JSONUtil;

/**
 * Opaque reference to a value produced by the expression layer. Rows carry values keyed by
 * the variable name.
 *
 * @param id   numeric id, unique within a plan
 * @param name variable name
 */
public record Variable(int id, String name) {

    public static Variable fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new PlanConstructionException("variable definition is expected to be an object");
        }
        JsonNode id = node.get("id");
        JsonNode name = node.get("name");
        if (id == null || !id.canConvertToInt() || name == null || !name.isTextual()) {
            throw new PlanConstructionException("variable definition requires 'id' and 'name' attributes: " + node);
        }
        return new Variable(id.asInt(), name.asText());
    }

    public ObjectNode toJson() {
        ObjectNode node = JSONUtil.createObjectNode();
        node.put("id", id);
        node.put("name", name);
        return node;
    }
}
