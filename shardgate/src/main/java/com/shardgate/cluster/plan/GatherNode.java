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
import com.shardgate.cluster.execution.*;
import com.shardgate.cluster.sharding.ShardedCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Merges the rows of the client streams back into one stream. Without sort elements the merge
 * is unordered; otherwise the configured {@link SortMode} selects between a linear scan and a
 * priority queue, both emitting the same sequence.
 */
public class GatherNode extends PlanNode {
    private static final Logger LOGGER = LoggerFactory.getLogger(GatherNode.class);
    private final List<SortElement> elements;
    private final SortMode sortMode;

    public GatherNode(int id) {
        this(id, List.of(), SortMode.UNSET);
    }

    public GatherNode(int id, List<SortElement> elements, SortMode sortMode) {
        super(id);
        this.elements = List.copyOf(elements);
        if (this.elements.isEmpty()) {
            this.sortMode = SortMode.UNSET;
        } else if (sortMode == SortMode.UNSET) {
            this.sortMode = SortMode.MIN_ELEMENT;
        } else {
            this.sortMode = sortMode;
        }
    }

    static GatherNode fromJson(JsonNode base, PlanContext context) {
        List<SortElement> elements = new ArrayList<>();
        JsonNode elementsNode = base.get("elements");
        if (elementsNode != null) {
            if (!elementsNode.isArray()) {
                throw new PlanConstructionException("invalid serialized GatherNode definition, 'elements' attribute is expected to be an array");
            }
            for (JsonNode element : elementsNode) {
                elements.add(SortElement.fromJson(element, context));
            }
        }

        if (elements.isEmpty()) {
            return new GatherNode(readId(base), elements, SortMode.UNSET);
        }
        // The sort mode only matters for a sorted gather.
        JsonNode sortModeNode = base.get("sortmode");
        String value = sortModeNode == null ? null : sortModeNode.asText();
        SortMode sortMode = SortMode.fromValue(value).orElseGet(() -> {
            LOGGER.error("invalid sort mode detected while creating GatherNode from json: {}, using minelement", value);
            return SortMode.MIN_ELEMENT;
        });
        return new GatherNode(readId(base), elements, sortMode);
    }

    @Override
    public NodeType type() {
        return NodeType.GATHER;
    }

    public List<SortElement> elements() {
        return elements;
    }

    public SortMode sortMode() {
        return sortMode;
    }

    public boolean isSorted() {
        return !elements.isEmpty();
    }

    /**
     * Creates the merger for the given client streams, in client enumeration order.
     */
    public RowMerger createMerger(List<? extends RowStream> streams) {
        switch (sortMode) {
            case HEAP:
                return new HeapRowMerger(streams, new RowComparator(elements));
            case MIN_ELEMENT:
                return new MinElementRowMerger(streams, new RowComparator(elements));
            default:
                return new UnsortedRowMerger(streams);
        }
    }

    /**
     * Walks the first dependencies down to the node that reads from a collection. The walk stops
     * at a scatter, which belongs to a different part of the query.
     */
    public Optional<ShardedCollection> findCollection() {
        PlanNode node = firstDependency();
        while (node != null) {
            if (node.type() == NodeType.ENUMERATE_COLLECTION) {
                return Optional.of(((EnumerateCollectionNode) node).collection());
            }
            if (node.type() == NodeType.SCATTER) {
                return Optional.empty();
            }
            node = node.firstDependency();
        }
        return Optional.empty();
    }

    @Override
    public CostEstimate estimateCost() {
        return singleDependencyCost()
                .map(dependency -> new CostEstimate(dependency.cost() + dependency.rows(), dependency.rows()))
                .orElse(CostEstimate.FALLBACK);
    }

    @Override
    protected void writeFields(ObjectNode node) {
        node.put("sortmode", sortMode.value());
        ArrayNode array = node.putArray("elements");
        for (SortElement element : elements) {
            array.add(element.toJson());
        }
    }
}
