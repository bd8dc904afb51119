/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.document;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

import io.pgcodec.annotation.Immutable;

/**
 * A {@link Value} that wraps a non-null {@link Comparable} Java object.
 */
@Immutable
final class ComparableValue implements Value {

    private static final Map<Class<?>, Type> TYPES_BY_CLASS;

    static {
        Map<Class<?>, Type> types = new HashMap<>();
        types.put(String.class, Type.STRING);
        types.put(Boolean.class, Type.BOOLEAN);
        types.put(Integer.class, Type.INTEGER);
        types.put(Long.class, Type.LONG);
        types.put(Double.class, Type.DOUBLE);
        types.put(BigInteger.class, Type.BIG_INTEGER);
        types.put(BigDecimal.class, Type.DECIMAL);
        types.put(BasicArray.class, Type.ARRAY);
        TYPES_BY_CLASS = types;
    }

    static Type typeForValue(Value value) {
        if (value.isNull()) {
            return Type.NULL;
        }
        Type type = TYPES_BY_CLASS.get(value.asObject().getClass());
        if (type != null) {
            return type;
        }
        if (value.isArray()) {
            return Type.ARRAY;
        }
        throw new IllegalStateException("Unknown type of value " + value);
    }

    private final Comparable<?> value;

    ComparableValue(Comparable<?> value) {
        assert value != null;
        this.value = value;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Value) {
            Value that = (Value) obj;
            if (that.isNull()) {
                return false;
            }
            return this.value.equals(that.asObject());
        }
        return false;
    }

    @Override
    public String toString() {
        return value.toString();
    }

    @Override
    @SuppressWarnings("unchecked")
    public int compareTo(Value that) {
        if (Value.isNull(that)) {
            return 1;
        }
        if (this.isNumber() && that.isNumber()) {
            return compareNumbers(this.asNumber(), that.asNumber());
        }
        Object other = that.asObject();
        if (value.getClass().isInstance(other)) {
            return ((Comparable<Object>) value).compareTo(other);
        }
        return getType().compareTo(that.getType());
    }

    private static int compareNumbers(Number first, Number second) {
        if (isNonFinite(first) || isNonFinite(second)) {
            return Double.compare(first.doubleValue(), second.doubleValue());
        }
        return new BigDecimal(first.toString()).compareTo(new BigDecimal(second.toString()));
    }

    private static boolean isNonFinite(Number number) {
        return number instanceof Double && !Double.isFinite(number.doubleValue());
    }

    @Override
    public Object asObject() {
        return value;
    }

    @Override
    public String asString() {
        return isString() ? (String) value : null;
    }

    @Override
    public Boolean asBoolean() {
        return isBoolean() ? (Boolean) value : null;
    }

    @Override
    public Number asNumber() {
        return isNumber() ? (Number) value : null;
    }

    @Override
    public Double asDouble() {
        return isNumber() ? Double.valueOf(((Number) value).doubleValue()) : null;
    }

    @Override
    public BigDecimal asBigDecimal() {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (isNumber() && !isNonFinite((Number) value)) {
            return new BigDecimal(value.toString());
        }
        return null;
    }

    @Override
    public Array asArray() {
        return isArray() ? (Array) value : null;
    }

    @Override
    public boolean isNull() {
        return false;
    }

    @Override
    public boolean isString() {
        return value instanceof String;
    }

    @Override
    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    @Override
    public boolean isNumber() {
        return value instanceof Number;
    }

    @Override
    public boolean isArray() {
        return value instanceof Array;
    }
}
