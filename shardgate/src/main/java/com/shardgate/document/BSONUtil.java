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

import org.bson.*;
import org.bson.types.Decimal128;

import java.math.BigDecimal;
import java.util.*;

/**
 * Utility methods for the BSON values carried by rows: conversion from plain Java objects,
 * nested attribute lookup, a total order across all BSON types, and a canonical textual
 * form used when hashing shard keys.
 */
public class BSONUtil {

    /**
     * Converts a Java object to its equivalent BSON value representation.
     *
     * @param value the Java object to convert to BsonValue
     * @return the equivalent BsonValue representation
     * @throws IllegalArgumentException if the value type is not supported for BSON conversion
     */
    public static BsonValue toBsonValue(Object value) {
        if (value == null) {
            return BsonNull.VALUE;
        }
        if (value instanceof BsonValue bsonVal) {
            return bsonVal;
        }
        if (value instanceof String str) {
            return new BsonString(str);
        }
        if (value instanceof Integer intVal) {
            return new BsonInt32(intVal);
        }
        if (value instanceof Long longVal) {
            return new BsonInt64(longVal);
        }
        if (value instanceof Double doubleVal) {
            return new BsonDouble(doubleVal);
        }
        if (value instanceof Boolean boolVal) {
            return new BsonBoolean(boolVal);
        }
        if (value instanceof Date dateVal) {
            return new BsonDateTime(dateVal.getTime());
        }
        if (value instanceof BigDecimal decimalVal) {
            return new BsonDecimal128(new Decimal128(decimalVal));
        }
        if (value instanceof byte[] binaryVal) {
            return new BsonBinary(binaryVal);
        }
        if (value instanceof Document docVal) {
            return docVal.toBsonDocument();
        }
        if (value instanceof Map<?, ?> map) {
            BsonDocument document = new BsonDocument();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                document.put(String.valueOf(entry.getKey()), toBsonValue(entry.getValue()));
            }
            return document;
        }
        if (value instanceof Collection<?> collection) {
            // Convert arrays/lists like [2, 3, 4] to BsonArray with BsonValue elements
            BsonArray bsonArray = new BsonArray();
            for (Object element : collection) {
                bsonArray.add(toBsonValue(element));
            }
            return bsonArray;
        }
        throw new IllegalArgumentException("Unsupported value type for BSON conversion: " + value.getClass().getSimpleName());
    }

    /**
     * Returns true if the value is absent or an explicit BSON null/undefined.
     */
    public static boolean isNullOrMissing(BsonValue value) {
        return value == null || value.isNull() || value.getBsonType() == BsonType.UNDEFINED;
    }

    /**
     * Follows an attribute path into nested documents.
     *
     * @param value the starting value
     * @param path  attribute names, outermost first; an empty path returns {@code value}
     * @return the nested value, or {@code null} if any step is missing or not a document
     */
    public static BsonValue resolvePath(BsonValue value, List<String> path) {
        BsonValue current = value;
        for (String attribute : path) {
            if (current == null || !current.isDocument()) {
                return null;
            }
            current = current.asDocument().get(attribute);
        }
        return current;
    }

    /**
     * Compares two BSON values under a total order that spans every BSON type. Values of
     * different types are ordered by type weight:
     * <pre>
     * missing/null &lt; boolean &lt; number &lt; string &lt; binary &lt; date &lt; timestamp &lt; objectId &lt; array &lt; document
     * </pre>
     * Numbers compare exactly by numeric value regardless of their BSON representation;
     * infinities sort at the ends of the number range and NaN sorts above every number.
     * Arrays compare element-wise, a shorter prefix first. Documents compare attribute by attribute over the
     * sorted union of their attribute names.
     *
     * @param a the first value, {@code null} means missing
     * @param b the second value, {@code null} means missing
     * @return a negative integer, zero, or a positive integer as {@code a} is less than, equal to,
     * or greater than {@code b}
     */
    public static int compare(BsonValue a, BsonValue b) {
        int weightA = typeWeight(a);
        int weightB = typeWeight(b);
        if (weightA != weightB) {
            return Integer.compare(weightA, weightB);
        }
        switch (weightA) {
            case 0:
                return 0;
            case 1:
                return Boolean.compare(a.asBoolean().getValue(), b.asBoolean().getValue());
            case 2:
                return compareNumbers(a, b);
            case 3:
                return a.asString().getValue().compareTo(b.asString().getValue());
            case 4:
                return Arrays.compare(a.asBinary().getData(), b.asBinary().getData());
            case 5:
                return a.asDateTime().compareTo(b.asDateTime());
            case 6:
                return a.asTimestamp().compareTo(b.asTimestamp());
            case 7:
                return a.asObjectId().getValue().compareTo(b.asObjectId().getValue());
            case 8:
                return compareArrays(a.asArray(), b.asArray());
            case 9:
                return compareDocuments(a.asDocument(), b.asDocument());
            default:
                return a.toString().compareTo(b.toString());
        }
    }

    /**
     * Renders a value as a canonical string. Values that compare equal under
     * {@link #compare(BsonValue, BsonValue)} render to the same string for scalars, so
     * {@code 1}, {@code 1L} and {@code 1.0} all render as {@code "1"}.
     */
    public static String toCanonicalString(BsonValue value) {
        if (isNullOrMissing(value)) {
            return "null";
        }
        switch (value.getBsonType()) {
            case STRING:
                return value.asString().getValue();
            case BOOLEAN:
                return Boolean.toString(value.asBoolean().getValue());
            case INT32:
            case INT64:
            case DOUBLE:
            case DECIMAL128:
                if (!isFinite(value)) {
                    return value.toString();
                }
                BigDecimal decimal = toBigDecimal(value);
                return decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
            case DOCUMENT:
                return value.asDocument().toJson();
            default:
                return value.toString();
        }
    }

    private static int typeWeight(BsonValue value) {
        if (isNullOrMissing(value)) {
            return 0;
        }
        switch (value.getBsonType()) {
            case BOOLEAN:
                return 1;
            case INT32:
            case INT64:
            case DOUBLE:
            case DECIMAL128:
                return 2;
            case STRING:
            case SYMBOL:
                return 3;
            case BINARY:
                return 4;
            case DATE_TIME:
                return 5;
            case TIMESTAMP:
                return 6;
            case OBJECT_ID:
                return 7;
            case ARRAY:
                return 8;
            case DOCUMENT:
                return 9;
            default:
                return 10;
        }
    }

    private static int compareNumbers(BsonValue a, BsonValue b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.asNumber().longValue(), b.asNumber().longValue());
        }
        int rankA = nonFiniteRank(a);
        int rankB = nonFiniteRank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        if (rankA != 0) {
            return 0;
        }
        // Exact, so a long beyond 2^53 never collapses onto a neighbouring double.
        return toExactBigDecimal(a).compareTo(toExactBigDecimal(b));
    }

    // -infinity < finite < +infinity < NaN
    private static int nonFiniteRank(BsonValue value) {
        if (value.isDouble()) {
            double number = value.asDouble().getValue();
            if (Double.isNaN(number)) {
                return 2;
            }
            if (Double.isInfinite(number)) {
                return number > 0 ? 1 : -1;
            }
            return 0;
        }
        if (value.isDecimal128()) {
            Decimal128 decimal = value.asDecimal128().getValue();
            if (decimal.isNaN()) {
                return 2;
            }
            if (decimal.isInfinite()) {
                return decimal.isNegative() ? -1 : 1;
            }
        }
        return 0;
    }

    private static BigDecimal toExactBigDecimal(BsonValue value) {
        if (value.isDouble()) {
            return new BigDecimal(value.asDouble().getValue());
        }
        return toBigDecimal(value);
    }

    private static boolean isFinite(BsonValue value) {
        if (value.isDouble()) {
            double number = value.asDouble().getValue();
            return !Double.isNaN(number) && !Double.isInfinite(number);
        }
        if (value.isDecimal128()) {
            return value.asDecimal128().getValue().isFinite();
        }
        return true;
    }

    private static boolean isIntegral(BsonValue value) {
        return value.isInt32() || value.isInt64();
    }

    private static BigDecimal toBigDecimal(BsonValue value) {
        switch (value.getBsonType()) {
            case INT32:
                return BigDecimal.valueOf(value.asInt32().getValue());
            case INT64:
                return BigDecimal.valueOf(value.asInt64().getValue());
            case DECIMAL128:
                // bigDecimalValue() rejects negative zero
                return new BigDecimal(value.asDecimal128().getValue().toString());
            default:
                return BigDecimal.valueOf(value.asDouble().getValue());
        }
    }

    private static int compareArrays(BsonArray a, BsonArray b) {
        int length = Math.min(a.size(), b.size());
        for (int i = 0; i < length; i++) {
            int result = compare(a.get(i), b.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private static int compareDocuments(BsonDocument a, BsonDocument b) {
        TreeSet<String> keys = new TreeSet<>(a.keySet());
        keys.addAll(b.keySet());
        for (String key : keys) {
            int result = compare(a.get(key), b.get(key));
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }
}
