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

import com.shardgate.cluster.sharding.CollectionResolver;
import com.shardgate.cluster.sharding.ShardedCollection;

import java.util.*;

/**
 * State shared by the nodes of a plan while it is loaded from its interchange form: the
 * default database, the declared variables and the collection lookup.
 */
public class PlanContext {
    private final String database;
    private final CollectionResolver collectionResolver;
    private final Map<Integer, Variable> variables = new LinkedHashMap<>();

    public PlanContext(String database, CollectionResolver collectionResolver) {
        this.database = database;
        this.collectionResolver = collectionResolver;
    }

    public String database() {
        return database;
    }

    /**
     * Declares a variable. Declaring the same id twice with a different name is an error.
     */
    public void registerVariable(Variable variable) {
        Variable previous = variables.putIfAbsent(variable.id(), variable);
        if (previous != null && !previous.equals(variable)) {
            throw new PlanConstructionException(
                    String.format("variable id %d is declared as both '%s' and '%s'", variable.id(), previous.name(), variable.name())
            );
        }
    }

    public Variable variable(int id) {
        Variable variable = variables.get(id);
        if (variable == null) {
            throw new PlanConstructionException("unknown variable id: " + id);
        }
        return variable;
    }

    public Collection<Variable> variables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public ShardedCollection collection(String name) {
        return collectionResolver.resolve(name).orElseThrow(
                () -> new PlanConstructionException("unknown collection: " + name)
        );
    }
}
