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

/**
 * Forwards the execution of its sub-plan to a remote server and query.
 */
public class RemoteNode extends AbstractRemoteNode {

    public RemoteNode(int id, String database, RemoteTarget target, boolean responsibleForInitializeCursor) {
        super(id, database, target, responsibleForInitializeCursor);
    }

    static RemoteNode fromJson(JsonNode base, PlanContext context) {
        return new RemoteNode(
                readId(base),
                readDatabase(base, context),
                readTarget(base),
                booleanOrDefault(base, "isResponsibleForInitializeCursor", true)
        );
    }

    @Override
    public NodeType type() {
        return NodeType.REMOTE;
    }
}
