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

import java.util.*;

/**
 * A plan graph addressed by node id. The root is the node whose result is the result of the
 * whole plan.
 */
public class ExecutionPlan {
    private final Map<Integer, PlanNode> nodes = new LinkedHashMap<>();
    private final Set<Variable> variables = new LinkedHashSet<>();
    private PlanNode root;

    /**
     * Loads a plan from its interchange form {@code {"nodes": [...], "variables": [...]}}. Nodes
     * are expected dependencies-first and the last node becomes the root.
     *
     * @throws PlanConstructionException if the payload cannot be turned into a plan
     */
    public static ExecutionPlan fromJson(JsonNode base, PlanContext context) {
        if (base == null || !base.isObject()) {
            throw new PlanConstructionException("plan is expected to be an object");
        }
        JsonNode variablesNode = base.get("variables");
        if (variablesNode != null && variablesNode.isArray()) {
            for (JsonNode variable : variablesNode) {
                context.registerVariable(Variable.fromJson(variable));
            }
        }

        JsonNode nodesNode = base.get("nodes");
        if (nodesNode == null || !nodesNode.isArray() || nodesNode.isEmpty()) {
            throw new PlanConstructionException("plan requires a non-empty 'nodes' array");
        }

        ExecutionPlan plan = new ExecutionPlan();
        // First pass creates the nodes, the second one wires the dependencies.
        for (JsonNode node : nodesNode) {
            plan.register(createNode(node, context));
        }
        Set<Integer> wired = new HashSet<>();
        for (JsonNode node : nodesNode) {
            PlanNode planNode = plan.getNode(readIdOf(node));
            JsonNode dependencies = node.get("dependencies");
            wired.add(planNode.id());
            if (dependencies == null) {
                continue;
            }
            if (!dependencies.isArray()) {
                throw new PlanConstructionException("'dependencies' attribute of node " + planNode.id() + " is expected to be an array");
            }
            for (JsonNode dependency : dependencies) {
                if (!dependency.canConvertToInt()) {
                    throw new PlanConstructionException("invalid dependency id of node " + planNode.id() + ": " + dependency);
                }
                if (!wired.contains(dependency.asInt()) || dependency.asInt() == planNode.id()) {
                    throw new PlanConstructionException(
                            String.format("node %d depends on node %d which is not listed before it", planNode.id(), dependency.asInt())
                    );
                }
                planNode.addDependency(plan.getNode(dependency.asInt()));
            }
        }
        plan.variables.addAll(context.variables());
        plan.setRoot(plan.getNode(readIdOf(nodesNode.get(nodesNode.size() - 1))));
        return plan;
    }

    private static int readIdOf(JsonNode node) {
        return PlanNode.readId(node);
    }

    static PlanNode createNode(JsonNode node, PlanContext context) {
        if (node == null || !node.isObject()) {
            throw new PlanConstructionException("plan node is expected to be an object");
        }
        String typeName = PlanNode.requiredString(node, "type");
        NodeType type = NodeType.fromTypeName(typeName).orElseThrow(
                () -> new PlanConstructionException("unknown plan node type: " + typeName)
        );
        switch (type) {
            case SINGLETON:
                return SingletonNode.fromJson(node);
            case ENUMERATE_COLLECTION:
                return EnumerateCollectionNode.fromJson(node, context);
            case SCATTER:
                return ScatterNode.fromJson(node);
            case DISTRIBUTE:
                return DistributeNode.fromJson(node, context);
            case GATHER:
                return GatherNode.fromJson(node, context);
            case REMOTE:
                return RemoteNode.fromJson(node, context);
            case REMOTE_SINGLE:
                return SingleRemoteOperationNode.fromJson(node, context);
            default:
                throw new PlanConstructionException("unsupported plan node type: " + typeName);
        }
    }

    /**
     * Adds a node to the plan. Ids are unique within a plan.
     */
    public <T extends PlanNode> T register(T node) {
        if (nodes.putIfAbsent(node.id(), node) != null) {
            throw new PlanConstructionException("duplicate plan node id: " + node.id());
        }
        return node;
    }

    public void addVariable(Variable variable) {
        variables.add(variable);
    }

    /**
     * @return an id that no node of this plan uses yet
     */
    public int nextId() {
        int max = 0;
        for (int id : nodes.keySet()) {
            max = Math.max(max, id);
        }
        return max + 1;
    }

    public PlanNode getNode(int id) {
        PlanNode node = nodes.get(id);
        if (node == null) {
            throw new PlanConstructionException("unknown plan node id: " + id);
        }
        return node;
    }

    public Collection<PlanNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public PlanNode root() {
        return root;
    }

    public void setRoot(PlanNode root) {
        if (nodes.get(root.id()) != root) {
            throw new PlanConstructionException("root node " + root.id() + " is not registered in the plan");
        }
        this.root = root;
    }

    /**
     * Serializes the nodes reachable from the root, every node after its dependencies.
     */
    public ObjectNode toJson() {
        if (root == null) {
            throw new PlanConstructionException("plan has no root node");
        }
        ObjectNode result = JSONUtil.createObjectNode();
        ArrayNode nodesNode = result.putArray("nodes");
        collect(root, new HashSet<>(), nodesNode);
        ArrayNode variablesNode = result.putArray("variables");
        for (Variable variable : variables) {
            variablesNode.add(variable.toJson());
        }
        return result;
    }

    private void collect(PlanNode node, Set<Integer> visited, ArrayNode output) {
        if (!visited.add(node.id())) {
            return;
        }
        for (PlanNode dependency : node.dependencies()) {
            collect(dependency, visited, output);
        }
        output.add(node.toJson());
    }
}
