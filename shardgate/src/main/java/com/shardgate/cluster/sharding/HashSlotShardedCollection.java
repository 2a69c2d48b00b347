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

import com.shardgate.document.BSONUtil;
import io.lettuce.core.cluster.SlotHash;
import org.bson.BsonDocument;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shards a collection the way a Redis cluster shards its keyspace. The canonical forms of the
 * shard-key values are joined and hashed into one of {@link #NUM_HASH_SLOTS} slots, and the slot
 * table is split into contiguous ranges, one per shard.
 */
public class HashSlotShardedCollection implements ShardedCollection {
    public static final int NUM_HASH_SLOTS = SlotHash.SLOT_COUNT;
    private static final char SEPARATOR = '\u0000';

    private final String name;
    private final List<String> shardKeys;
    private final List<String> shards;
    private final long estimatedDocumentCount;
    private final String[] hashSlots;
    private final AtomicLong keyGenerator = new AtomicLong();

    public HashSlotShardedCollection(String name, List<String> shardKeys, List<String> shards, long estimatedDocumentCount) {
        if (shardKeys.isEmpty()) {
            throw new IllegalArgumentException("at least one shard key is required");
        }
        if (shards.isEmpty() || shards.size() > NUM_HASH_SLOTS) {
            throw new IllegalArgumentException(
                    String.format("number of shards must be between 1 and %d, got %d", NUM_HASH_SLOTS, shards.size())
            );
        }
        if (new HashSet<>(shards).size() != shards.size()) {
            throw new IllegalArgumentException("shard names must be distinct: " + shards);
        }
        this.name = name;
        this.shardKeys = List.copyOf(shardKeys);
        this.shards = List.copyOf(shards);
        this.estimatedDocumentCount = estimatedDocumentCount;
        this.hashSlots = distributeHashSlots(this.shards);
    }

    /**
     * Creates a collection sharded by the document key.
     */
    public static HashSlotShardedCollection byKey(String name, List<String> shards) {
        return new HashSlotShardedCollection(name, List.of(KEY_ATTRIBUTE), shards, 0);
    }

    private static String[] distributeHashSlots(List<String> shards) {
        String[] result = new String[NUM_HASH_SLOTS];
        int numberOfShards = shards.size();
        for (int hashSlot = 0; hashSlot < NUM_HASH_SLOTS; hashSlot++) {
            int shardIndex = (int) ((long) hashSlot * numberOfShards / NUM_HASH_SLOTS);
            result[hashSlot] = shards.get(shardIndex);
        }
        return result;
    }

    /**
     * Calculates the hash slot of a document from its shard-key values.
     */
    public int hashSlot(BsonDocument document) {
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < shardKeys.size(); i++) {
            if (i > 0) {
                key.append(SEPARATOR);
            }
            key.append(BSONUtil.toCanonicalString(document.get(shardKeys.get(i))));
        }
        return SlotHash.getSlot(key.toString().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> shardKeys() {
        return shardKeys;
    }

    @Override
    public List<String> shards() {
        return shards;
    }

    @Override
    public String responsibleShard(BsonDocument document) {
        return hashSlots[hashSlot(document)];
    }

    @Override
    public String createKey() {
        return Long.toString(keyGenerator.incrementAndGet());
    }

    @Override
    public long estimatedDocumentCount() {
        return estimatedDocumentCount;
    }

    @Override
    public String toString() {
        return String.format("HashSlotShardedCollection {name=%s, shardKeys=%s, shards=%s}", name, shardKeys, shards);
    }
}
