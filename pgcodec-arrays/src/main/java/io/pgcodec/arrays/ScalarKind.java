/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * The scalar Java types a literal can be decoded into, each with the value an element takes when it is created
 * before its literal is decoded.
 */
public enum ScalarKind {
    BOOLEAN(Boolean.FALSE),
    STRING(""),
    BYTE((byte) 0),
    SHORT((short) 0),
    INTEGER(0),
    LONG(0L),
    FLOAT(0.0f),
    DOUBLE(0.0d),
    BIG_INTEGER(BigInteger.ZERO),
    BIG_DECIMAL(BigDecimal.ZERO),
    /** Opaque bytes, the only scalar that can hold the SQL null. */
    BINARY(null);

    private final Object zeroValue;

    ScalarKind(Object zeroValue) {
        this.zeroValue = zeroValue;
    }

    public Object zeroValue() {
        return zeroValue;
    }

    public boolean isNumeric() {
        return this != BOOLEAN && this != STRING && this != BINARY;
    }
}
