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
import com.shardgate.cluster.remote.RemoteExecutor;
import com.shardgate.cluster.remote.RemoteTransport;

import java.time.Duration;

/**
 * Base class of the nodes that forward execution of their sub-plan to a remote server.
 */
public abstract class AbstractRemoteNode extends PlanNode {
    private final String database;
    private final RemoteTarget target;
    private final boolean responsibleForInitializeCursor;

    protected AbstractRemoteNode(int id, String database, RemoteTarget target, boolean responsibleForInitializeCursor) {
        super(id);
        this.database = database;
        this.target = target;
        this.responsibleForInitializeCursor = responsibleForInitializeCursor;
    }

    static String readDatabase(JsonNode base, PlanContext context) {
        JsonNode database = base.get("database");
        if (database == null || !database.isTextual()) {
            return context.database();
        }
        return database.asText();
    }

    static RemoteTarget readTarget(JsonNode base) {
        return new RemoteTarget(
                requiredString(base, "server"),
                requiredString(base, "ownName"),
                requiredString(base, "queryId")
        );
    }

    public String database() {
        return database;
    }

    public RemoteTarget target() {
        return target;
    }

    public boolean isResponsibleForInitializeCursor() {
        return responsibleForInitializeCursor;
    }

    /**
     * Creates an executor that forwards the requests of this node to its target.
     *
     * @param transport      used to reach the remote server
     * @param requestTimeout deadline of every single remote call
     */
    public RemoteExecutor createExecutor(RemoteTransport transport, Duration requestTimeout) {
        return new RemoteExecutor(transport, database, target, responsibleForInitializeCursor, requestTimeout);
    }

    @Override
    public CostEstimate estimateCost() {
        return singleDependencyCost()
                .map(dependency -> new CostEstimate(dependency.cost() + dependency.rows(), dependency.rows()))
                .orElse(CostEstimate.FALLBACK);
    }

    @Override
    protected void writeFields(ObjectNode node) {
        node.put("database", database);
        node.put("server", target.server());
        node.put("ownName", target.ownName());
        node.put("queryId", target.queryId());
        node.put("isResponsibleForInitializeCursor", responsibleForInitializeCursor);
    }
}
