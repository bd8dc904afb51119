/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.document;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import io.pgcodec.annotation.Immutable;

/**
 * A self-describing value: a string, boolean, number, nested {@link Array} or null. Values are what a decoder produces
 * when the caller does not know the shape of a literal ahead of time.
 */
@Immutable
public interface Value extends Comparable<Value> {

    enum Type {
        NULL,
        STRING,
        BOOLEAN,
        INTEGER,
        LONG,
        DOUBLE,
        BIG_INTEGER,
        DECIMAL,
        ARRAY;
    }

    static boolean isNull(Value value) {
        return value == null || value.isNull();
    }

    static boolean isValid(Object value) {
        return value == null || value instanceof Value ||
                value instanceof String || value instanceof Boolean ||
                value instanceof Integer || value instanceof Long ||
                value instanceof Double ||
                value instanceof Array ||
                value instanceof BigInteger || value instanceof BigDecimal;
    }

    /**
     * Compare two {@link Value} objects, which may or may not be null.
     *
     * @param value1 the first value object, may be null
     * @param value2 the second value object, which may be null
     * @return a negative integer if the first value is less than the second, zero if the values are equivalent (including if both
     *         are null), or a positive integer if the first value is greater than the second
     */
    static int compareTo(Value value1, Value value2) {
        if (value1 == null) {
            return isNull(value2) ? 0 : -1;
        }
        return value1.compareTo(value2);
    }

    static Value create(Object value) {
        if (value instanceof Value) {
            return (Value) value;
        }
        if (!isValid(value)) {
            throw new IllegalArgumentException("Unexpected value '" + value + "' of type " + value.getClass());
        }
        if (value == null) {
            return NullValue.INSTANCE;
        }
        return new ComparableValue((Comparable<?>) value);
    }

    static Value create(boolean value) {
        return new ComparableValue(Boolean.valueOf(value));
    }

    static Value create(long value) {
        return new ComparableValue(Long.valueOf(value));
    }

    static Value create(double value) {
        return new ComparableValue(Double.valueOf(value));
    }

    static Value create(String value) {
        return value == null ? NullValue.INSTANCE : new ComparableValue(value);
    }

    static Value create(BigDecimal value) {
        return value == null ? NullValue.INSTANCE : new ComparableValue(value);
    }

    static Value create(Array value) {
        return value == null ? NullValue.INSTANCE : new ComparableValue(value);
    }

    static Value nullValue() {
        return NullValue.INSTANCE;
    }

    default Type getType() {
        return ComparableValue.typeForValue(this);
    }

    /**
     * Get the raw value.
     *
     * @return the raw value; may be null
     */
    Object asObject();

    String asString();

    Boolean asBoolean();

    Number asNumber();

    Double asDouble();

    BigDecimal asBigDecimal();

    Array asArray();

    boolean isNull();

    default boolean isNotNull() {
        return !isNull();
    }

    boolean isString();

    boolean isBoolean();

    boolean isNumber();

    boolean isArray();

    /**
     * Convert this value into plain Java objects: arrays become {@link List}s of converted elements, the null value becomes
     * {@code null}, and every other value becomes its {@link #asObject() raw value}.
     *
     * @return the plain Java form of this value; may be null
     */
    default Object asJavaObject() {
        if (isNull()) {
            return null;
        }
        if (isArray()) {
            Array array = asArray();
            List<Object> result = new ArrayList<>(array.size());
            array.forEach(element -> result.add(element.asJavaObject()));
            return result;
        }
        return asObject();
    }
}
