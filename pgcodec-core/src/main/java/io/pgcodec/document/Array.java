/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.document;

import java.util.List;
import java.util.stream.Stream;

import io.pgcodec.annotation.NotThreadSafe;

/**
 * An ordered sequence of {@link Value}s, possibly containing nulls and nested arrays.
 */
@NotThreadSafe
public interface Array extends Iterable<Value>, Comparable<Array> {

    static Array create() {
        return new BasicArray();
    }

    /**
     * Create an array from the given Java objects, each of which must be {@link Value#isValid(Object) a valid value}.
     *
     * @param values the values; may be null or empty
     * @return the new array; never null
     */
    static Array create(Object... values) {
        BasicArray array = new BasicArray();
        if (values != null) {
            for (Object value : values) {
                array.add(Value.create(value));
            }
        }
        return array;
    }

    static Array create(List<Value> values) {
        BasicArray array = new BasicArray();
        values.forEach(array::add);
        return array;
    }

    /**
     * Return the number of elements.
     *
     * @return the number of elements; never negative
     */
    int size();

    boolean isEmpty();

    /**
     * Get the value at the given index.
     *
     * @param index the index
     * @return the value; never null, since SQL nulls are represented by {@link Value#nullValue()}
     * @throws IndexOutOfBoundsException if the index is not within the array
     */
    Value get(int index);

    /**
     * Append a value, replacing a Java {@code null} with {@link Value#nullValue()}.
     *
     * @param value the value; may be null
     * @return this array, for chaining; never null
     */
    Array add(Value value);

    default Array addNull() {
        return add(Value.nullValue());
    }

    default Array add(String value) {
        return add(Value.create(value));
    }

    default Array add(boolean value) {
        return add(Value.create(value));
    }

    default Array add(Array value) {
        return add(Value.create(value));
    }

    Stream<Value> streamValues();
}
