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

package com.shardgate.cluster.sharding;

import org.bson.BsonDocument;

import java.util.List;

/**
 * A collection handle exposed by the storage layer. Implementations map a document to the
 * single shard responsible for it.
 */
public interface ShardedCollection {
    String KEY_ATTRIBUTE = "_key";

    String name();

    /**
     * @return attribute names whose values determine the responsible shard
     */
    List<String> shardKeys();

    /**
     * @return names of the shards of this collection, in placement order
     */
    List<String> shards();

    /**
     * Returns the name of the shard responsible for the given document. The returned name is
     * always one of {@link #shards()}.
     */
    String responsibleShard(BsonDocument document);

    /**
     * Generates a new, collection-unique document key.
     */
    String createKey();

    long estimatedDocumentCount();

    /**
     * Returns true if the document key takes part in shard selection, so a document without
     * a key cannot be placed.
     */
    default boolean usesKeySharding() {
        return shardKeys().contains(KEY_ATTRIBUTE);
    }
}
