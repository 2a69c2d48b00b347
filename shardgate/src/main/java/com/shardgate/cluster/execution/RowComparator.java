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

package com.shardgate.cluster.execution;

import com.shardgate.cluster.plan.SortElement;
import com.shardgate.document.BSONUtil;
import com.shardgate.document.Row;
import org.bson.BsonValue;

import java.util.Comparator;
import java.util.List;

/**
 * Orders rows lexicographically by the given sort elements.
 */
public class RowComparator implements Comparator<Row> {
    private final List<SortElement> elements;

    public RowComparator(List<SortElement> elements) {
        this.elements = List.copyOf(elements);
    }

    @Override
    public int compare(Row a, Row b) {
        for (SortElement element : elements) {
            BsonValue left = BSONUtil.resolvePath(a.get(element.variable()), element.attributePath());
            BsonValue right = BSONUtil.resolvePath(b.get(element.variable()), element.attributePath());
            int result = BSONUtil.compare(left, right);
            if (result != 0) {
                return element.ascending() ? result : -result;
            }
        }
        return 0;
    }
}
