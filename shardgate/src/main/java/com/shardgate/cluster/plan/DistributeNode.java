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
import com.shardgate.document.BSONUtil;
import com.shardgate.document.Row;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Routes every upstream row to exactly one client stream, the one named after the shard that
 * is responsible for the row's document.
 * <p>
 * The document is read from {@code variable}, or from {@code alternativeVariable} when the
 * former is missing or null. With {@code allowKeyConversionToObject} a bare key is turned into
 * a {@code {"_key": value}} document, and with {@code createKeys} documents without a key get
 * one from the target collection's key generator. The routed row carries the rewritten document
 * in the variable it was read from.
 */
public class DistributeNode extends PlanNode implements FanOutNode {
    private final ClientSet clients;
    private final ShardedCollection collection;
    private final Variable variable;
    private final Variable alternativeVariable;
    private final boolean createKeys;
    private final boolean allowKeyConversionToObject;

    public DistributeNode(
            int id,
            ClientSet clients,
            ShardedCollection collection,
            Variable variable,
            Variable alternativeVariable,
            boolean createKeys,
            boolean allowKeyConversionToObject
    ) {
        super(id);
        this.clients = clients;
        this.collection = collection;
        this.variable = variable;
        this.alternativeVariable = alternativeVariable == null ? variable : alternativeVariable;
        this.createKeys = createKeys;
        this.allowKeyConversionToObject = allowKeyConversionToObject;
    }

    static DistributeNode fromJson(JsonNode base, PlanContext context) {
        Variable variable = readVariable(base, "variable", "varId", context);
        Variable alternativeVariable = variable;
        if (base.has("alternativeVariable") || base.has("alternativeVarId")) {
            alternativeVariable = readVariable(base, "alternativeVariable", "alternativeVarId", context);
        }
        return new DistributeNode(
                readId(base),
                ClientSet.fromJson(base),
                context.collection(requiredString(base, "collection")),
                variable,
                alternativeVariable,
                booleanOrDefault(base, "createKeys", false),
                booleanOrDefault(base, "allowKeyConversionToObject", false)
        );
    }

    private static Variable readVariable(JsonNode base, String field, String legacyField, PlanContext context) {
        JsonNode node = base.get(field);
        if (node != null && !node.isNull()) {
            Variable variable = Variable.fromJson(node);
            context.registerVariable(variable);
            return variable;
        }
        JsonNode legacy = base.get(legacyField);
        if (legacy != null && legacy.canConvertToInt()) {
            return context.variable(legacy.asInt());
        }
        throw new PlanConstructionException(
                String.format("invalid serialized DistributeNode definition, neither '%s' nor '%s' is present", field, legacyField)
        );
    }

    @Override
    public NodeType type() {
        return NodeType.DISTRIBUTE;
    }

    @Override
    public ClientSet clients() {
        return clients;
    }

    public ShardedCollection collection() {
        return collection;
    }

    public Variable variable() {
        return variable;
    }

    public Variable alternativeVariable() {
        return alternativeVariable;
    }

    public boolean createKeys() {
        return createKeys;
    }

    public boolean allowKeyConversionToObject() {
        return allowKeyConversionToObject;
    }

    /**
     * Whether user supplied keys are accepted while keys are being created. Always false, routing
     * does not consult it.
     */
    public boolean allowSpecifiedKeys() {
        return false;
    }

    /**
     * @return the variables routing reads from
     */
    public List<Variable> variablesUsedHere() {
        if (alternativeVariable.equals(variable)) {
            return List.of(variable);
        }
        return List.of(variable, alternativeVariable);
    }

    /**
     * Determines the client stream of {@code row}.
     *
     * @throws RoutingException if the row cannot be placed on any shard of the client set
     */
    public RoutedRow route(Row row) {
        Variable source = variable;
        BsonValue value = row.get(variable);
        if (BSONUtil.isNullOrMissing(value) && !BSONUtil.isNullOrMissing(row.get(alternativeVariable))) {
            source = alternativeVariable;
            value = row.get(alternativeVariable);
        }

        boolean rewritten = false;
        BsonDocument document;
        if (BSONUtil.isNullOrMissing(value)) {
            if (!createKeys) {
                throw new RoutingException(
                        RoutingException.Reason.MISSING_KEY,
                        String.format("neither '%s' nor '%s' holds a document", variable.name(), alternativeVariable.name())
                );
            }
            document = new BsonDocument();
            rewritten = true;
        } else if (value.isDocument()) {
            document = value.asDocument();
        } else {
            document = new BsonDocument(ShardedCollection.KEY_ATTRIBUTE, convertToKey(value));
            rewritten = true;
        }

        if (!document.containsKey(ShardedCollection.KEY_ATTRIBUTE)) {
            if (createKeys) {
                document = document.clone();
                document.put(ShardedCollection.KEY_ATTRIBUTE, new BsonString(collection.createKey()));
                rewritten = true;
            } else if (collection.usesKeySharding()) {
                throw new RoutingException(
                        RoutingException.Reason.MISSING_KEY,
                        String.format("document has no '%s' attribute but collection '%s' is sharded by it", ShardedCollection.KEY_ATTRIBUTE, collection.name())
                );
            }
        }

        String shard = collection.responsibleShard(document);
        if (!clients.contains(shard)) {
            throw new RoutingException(
                    RoutingException.Reason.UNKNOWN_SHARD,
                    String.format("shard '%s' of collection '%s' is not one of the clients %s", shard, collection.name(), clients)
            );
        }
        return new RoutedRow(shard, rewritten ? row.with(source, document) : row);
    }

    private BsonString convertToKey(BsonValue value) {
        if (allowKeyConversionToObject) {
            if (value.isString()) {
                return value.asString();
            }
            if (value.isInt32() || value.isInt64()) {
                return new BsonString(Long.toString(value.asNumber().longValue()));
            }
        }
        throw new RoutingException(
                RoutingException.Reason.INVALID_DOCUMENT_TYPE,
                String.format("expected a document in '%s' but got %s", variable.name(), value.getBsonType())
        );
    }

    @Override
    public void dispatch(Row row, BiConsumer<String, Row> consumer) {
        RoutedRow routed = route(row);
        consumer.accept(routed.clientId(), routed.row());
    }

    /**
     * Every upstream row is processed once.
     */
    @Override
    public CostEstimate estimateCost() {
        return singleDependencyCost()
                .map(dependency -> new CostEstimate(dependency.cost() + dependency.rows(), dependency.rows()))
                .orElse(CostEstimate.FALLBACK);
    }

    @Override
    protected void writeFields(ObjectNode node) {
        clients.writeTo(node);
        node.put("createKeys", createKeys);
        node.put("allowKeyConversionToObject", allowKeyConversionToObject);
        node.set("variable", variable.toJson());
        node.set("alternativeVariable", alternativeVariable.toJson());
        node.put("varId", variable.id());
        node.put("alternativeVarId", alternativeVariable.id());
        node.put("collection", collection.name());
    }
}
