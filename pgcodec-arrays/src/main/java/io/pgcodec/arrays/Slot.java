/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.util.List;
import java.util.Optional;

/**
 * A writable location that receives one decoded value: the destination itself, an element of an array or list, or the
 * content of an {@link Optional}.
 */
interface Slot {

    Object get();

    void set(Object value);

    static Slot arrayElement(Object array, int index) {
        return new ArrayElement(array, index);
    }

    static Slot listElement(List<Object> list, int index) {
        return new ListElement(list, index);
    }

    static Slot optionalContent(Slot optional) {
        return new OptionalContent(optional);
    }

    final class ArrayElement implements Slot {
        private final Object array;
        private final int index;

        ArrayElement(Object array, int index) {
            this.array = array;
            this.index = index;
        }

        @Override
        public Object get() {
            return java.lang.reflect.Array.get(array, index);
        }

        @Override
        public void set(Object value) {
            java.lang.reflect.Array.set(array, index, value);
        }
    }

    final class ListElement implements Slot {
        private final List<Object> list;
        private final int index;

        ListElement(List<Object> list, int index) {
            this.list = list;
            this.index = index;
        }

        @Override
        public Object get() {
            return list.get(index);
        }

        @Override
        public void set(Object value) {
            list.set(index, value);
        }
    }

    final class OptionalContent implements Slot {
        private final Slot optional;

        OptionalContent(Slot optional) {
            this.optional = optional;
        }

        @Override
        public Object get() {
            Object current = optional.get();
            return current instanceof Optional ? ((Optional<?>) current).orElse(null) : null;
        }

        @Override
        public void set(Object value) {
            optional.set(Optional.ofNullable(value));
        }
    }
}
