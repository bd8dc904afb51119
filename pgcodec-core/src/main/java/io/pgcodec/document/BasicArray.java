/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.document;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import io.pgcodec.annotation.NotThreadSafe;

/**
 * Package-level implementation of {@link Array}.
 */
@NotThreadSafe
final class BasicArray implements Array {

    private final List<Value> values = new ArrayList<>();

    BasicArray() {
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public Value get(int index) {
        return values.get(index);
    }

    @Override
    public Array add(Value value) {
        values.add(value != null ? value : Value.nullValue());
        return this;
    }

    @Override
    public Iterator<Value> iterator() {
        return values.iterator();
    }

    @Override
    public Stream<Value> streamValues() {
        return values.stream();
    }

    @Override
    public int compareTo(Array that) {
        if (that == null) {
            return 1;
        }
        int size = this.size();
        for (int i = 0; i != Math.min(size, that.size()); ++i) {
            int diff = Value.compareTo(this.get(i), that.get(i));
            if (diff != 0) {
                return diff;
            }
        }
        return Integer.compare(size, that.size());
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof BasicArray) {
            BasicArray that = (BasicArray) obj;
            return this.values.equals(that.values);
        }
        return false;
    }

    @Override
    public String toString() {
        return values.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
