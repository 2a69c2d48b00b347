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

import java.util.Optional;

/**
 * Tag of every plan node kind. The type name is written to the {@code type} attribute of the
 * serialized node.
 */
public enum NodeType {
    SINGLETON("SingletonNode"),
    ENUMERATE_COLLECTION("EnumerateCollectionNode"),
    SCATTER("ScatterNode"),
    DISTRIBUTE("DistributeNode"),
    GATHER("GatherNode"),
    REMOTE("RemoteNode"),
    REMOTE_SINGLE("SingleRemoteOperationNode");

    private final String typeName;

    NodeType(String typeName) {
        this.typeName = typeName;
    }

    public static Optional<NodeType> fromTypeName(String typeName) {
        for (NodeType type : values()) {
            if (type.typeName.equals(typeName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String typeName() {
        return typeName;
    }
}
