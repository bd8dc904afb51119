/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.lang.reflect.Type;

import com.fasterxml.jackson.core.type.TypeReference;

import io.pgcodec.annotation.NotThreadSafe;

/**
 * A writable reference that an {@link ArrayDecoder} populates. The declared type determines how literals are decoded;
 * generic types such as {@code List<Integer>} are declared with a {@link TypeReference}:
 *
 * <pre>
 * Destination&lt;List&lt;Integer&gt;&gt; ints = Destination.of(new TypeReference&lt;List&lt;Integer&gt;&gt;() {
 * });
 * decoder.decode(bytes, ints);
 * </pre>
 *
 * A destination may start out holding a value. An existing Java array is then filled in place up to its length, and an
 * existing list is overwritten and resized.
 *
 * @param <T> the declared type
 */
@NotThreadSafe
public final class Destination<T> {

    private final Type type;
    private Object value;

    private Destination(Type type, Object initialValue) {
        this.type = type;
        this.value = initialValue;
    }

    public static <T> Destination<T> of(Class<T> type) {
        return new Destination<>(type, null);
    }

    public static <T> Destination<T> of(Class<T> type, T initialValue) {
        return new Destination<>(type, initialValue);
    }

    public static <T> Destination<T> of(TypeReference<T> type) {
        return new Destination<>(type.getType(), null);
    }

    public static <T> Destination<T> of(TypeReference<T> type, T initialValue) {
        return new Destination<>(type.getType(), initialValue);
    }

    /**
     * Get the declared type of this destination.
     *
     * @return the type; never null
     */
    public Type type() {
        return type;
    }

    /**
     * Get the current value.
     *
     * @return the value; may be null if nothing has been decoded, or the SQL null was decoded
     */
    @SuppressWarnings("unchecked")
    public T get() {
        return (T) value;
    }

    Slot slot() {
        return new Slot() {
            @Override
            public Object get() {
                return value;
            }

            @Override
            public void set(Object newValue) {
                value = newValue;
            }
        };
    }

    @Override
    public String toString() {
        return "Destination[" + type.getTypeName() + "]";
    }
}
