/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.lang.reflect.Type;

/**
 * A well-formed literal cannot be represented by the destination it was decoded into. Decoding continues with the
 * remaining elements after a type mismatch.
 */
public class TypeMismatchException extends ArrayDecodeException {

    private static final long serialVersionUID = -2394466315931585377L;

    private final String value;
    private final transient Type targetType;
    private final long offset;

    public TypeMismatchException(String value, Type targetType, long offset) {
        this(value, targetType, offset, null);
    }

    public TypeMismatchException(String value, Type targetType, long offset, Throwable cause) {
        super(String.format("cannot decode %s into value of type %s at offset %d", value, targetType.getTypeName(), offset), cause);
        this.value = value;
        this.targetType = targetType;
        this.offset = offset;
    }

    /**
     * Get a description of the literal, such as {@code "array"} or {@code "number 300"}.
     *
     * @return the description; never null
     */
    public String getValue() {
        return value;
    }

    public Type getTargetType() {
        return targetType;
    }

    public long getOffset() {
        return offset;
    }
}
