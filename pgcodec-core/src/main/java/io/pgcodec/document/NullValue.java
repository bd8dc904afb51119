/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.document;

import java.math.BigDecimal;

import io.pgcodec.annotation.Immutable;

/**
 * The SQL null, as a {@link Value}.
 */
@Immutable
final class NullValue implements Value {

    public static final Value INSTANCE = new NullValue();

    private NullValue() {
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public String toString() {
        return "null";
    }

    @Override
    public int compareTo(Value that) {
        if (this == that) {
            return 0;
        }
        return -1;
    }

    @Override
    public Type getType() {
        return Type.NULL;
    }

    @Override
    public Object asObject() {
        return null;
    }

    @Override
    public String asString() {
        return null;
    }

    @Override
    public Boolean asBoolean() {
        return null;
    }

    @Override
    public Number asNumber() {
        return null;
    }

    @Override
    public Double asDouble() {
        return null;
    }

    @Override
    public BigDecimal asBigDecimal() {
        return null;
    }

    @Override
    public Array asArray() {
        return null;
    }

    @Override
    public boolean isNull() {
        return true;
    }

    @Override
    public boolean isString() {
        return false;
    }

    @Override
    public boolean isBoolean() {
        return false;
    }

    @Override
    public boolean isNumber() {
        return false;
    }

    @Override
    public boolean isArray() {
        return false;
    }
}
