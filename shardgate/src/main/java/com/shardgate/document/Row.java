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

package com.shardgate.document;

import com.shardgate.cluster.plan.Variable;
import org.bson.BsonDocument;
import org.bson.BsonValue;

import java.util.Objects;

/**
 * An immutable row flowing between plan nodes. A row maps variable names to BSON values;
 * a variable the row does not carry reads as {@code null}.
 */
public final class Row {
    private final BsonDocument values;

    private Row(BsonDocument values) {
        this.values = values;
    }

    public static Row of(String name, Object value) {
        return builder().put(name, value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public BsonValue get(Variable variable) {
        return get(variable.name());
    }

    public BsonValue get(String name) {
        return values.get(name);
    }

    public boolean contains(Variable variable) {
        return values.containsKey(variable.name());
    }

    /**
     * Returns a copy of this row in which the given variable holds {@code value}.
     */
    public Row with(Variable variable, BsonValue value) {
        BsonDocument copy = values.clone();
        copy.put(variable.name(), value);
        return new Row(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "Row " + values.toJson();
    }

    public static class Builder {
        private final BsonDocument values = new BsonDocument();

        private Builder() {
        }

        public Builder put(String name, Object value) {
            values.put(name, BSONUtil.toBsonValue(value));
            return this;
        }

        public Row build() {
            return new Row(values.clone());
        }
    }
}
