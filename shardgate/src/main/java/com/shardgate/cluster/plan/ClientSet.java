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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A distinct, insertion-ordered set of client stream ids. Scatter and Distribute nodes own one
 * client set each; a client's position in the set is its enumeration order.
 */
public final class ClientSet implements Iterable<String> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClientSet.class);
    private static final ClientSet EMPTY = new ClientSet(List.of());

    private final List<String> clients;
    private final Map<String, Integer> positions;

    private ClientSet(List<String> clients) {
        this.clients = List.copyOf(clients);
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < this.clients.size(); i++) {
            positions.put(this.clients.get(i), i);
        }
        this.positions = Collections.unmodifiableMap(positions);
    }

    /**
     * Creates a client set from the given ids. Duplicates are dropped, the first occurrence wins.
     */
    public static ClientSet of(Collection<String> clients) {
        return new ClientSet(new ArrayList<>(new LinkedHashSet<>(clients)));
    }

    public static ClientSet of(String... clients) {
        return of(Arrays.asList(clients));
    }

    public static ClientSet empty() {
        return EMPTY;
    }

    /**
     * Reads the {@code clients} attribute of a serialized node. A payload that is not an array
     * of strings is logged and yields an empty set, it never fails the plan load.
     */
    static ClientSet fromJson(JsonNode base) {
        JsonNode clientsNode = base.get("clients");
        if (clientsNode == null || !clientsNode.isArray()) {
            LOGGER.error("invalid serialized {} definition, 'clients' attribute is expected to be an array of string", base.path("type").asText());
            return EMPTY;
        }

        List<String> clients = new ArrayList<>();
        int pos = 0;
        for (JsonNode clientNode : clientsNode) {
            if (!clientNode.isTextual()) {
                LOGGER.error(
                        "invalid serialized {} definition, 'clients' attribute is expected to be an array of string but got not a string at position {}",
                        base.path("type").asText(), pos
                );
                return EMPTY;
            }
            clients.add(clientNode.asText());
            pos++;
        }
        return of(clients);
    }

    void writeTo(ObjectNode node) {
        ArrayNode array = node.putArray("clients");
        for (String client : clients) {
            array.add(client);
        }
    }

    public int size() {
        return clients.size();
    }

    public boolean isEmpty() {
        return clients.isEmpty();
    }

    public String get(int index) {
        return clients.get(index);
    }

    /**
     * @return the enumeration position of the client, or -1 if it is not a member
     */
    public int indexOf(String client) {
        Integer position = positions.get(client);
        return position == null ? -1 : position;
    }

    public boolean contains(String client) {
        return positions.containsKey(client);
    }

    public List<String> asList() {
        return clients;
    }

    @Override
    public Iterator<String> iterator() {
        return clients.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClientSet)) return false;
        return clients.equals(((ClientSet) o).clients);
    }

    @Override
    public int hashCode() {
        return clients.hashCode();
    }

    @Override
    public String toString() {
        return clients.toString();
    }
}
