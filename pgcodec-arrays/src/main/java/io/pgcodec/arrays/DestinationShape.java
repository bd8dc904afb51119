/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import io.pgcodec.annotation.Immutable;
import io.pgcodec.document.Value;

/**
 * How a decoder writes into a destination of a given Java type. The subclasses nested here are the only ones.
 *
 * @see ShapeInspector
 */
@Immutable
public abstract class DestinationShape {

    public enum Kind {
        /**
         * A Java array. An existing instance has a fixed length: extra elements are dropped and missing ones are set to
         * the element's zero value. A missing instance is grown to fit the elements.
         */
        ARRAY,
        /** A {@link List}, grown or truncated to the number of elements. */
        SEQUENCE,
        /** {@link Value} or {@link Object}, whose content is chosen by each literal's own form. */
        DYNAMIC,
        /** An {@link Optional}, the nullable wrapper around another shape. */
        OPTIONAL,
        SCALAR,
        /** A type that no literal can be decoded into. */
        UNSUPPORTED
    }

    private final Type type;
    private final Kind kind;

    private DestinationShape(Type type, Kind kind) {
        this.type = type;
        this.kind = kind;
    }

    public Type type() {
        return type;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Get the value a new element of this shape starts with, which is also what the SQL null stores into a nullable shape.
     *
     * @return the zero value; may be null
     */
    public Object zeroValue() {
        return null;
    }

    /**
     * Determine whether the SQL null can be stored. A null literal leaves a non-nullable destination untouched.
     *
     * @return true if a null literal is stored as the {@link #zeroValue() zero value}
     */
    public boolean isNullable() {
        return true;
    }

    @Override
    public String toString() {
        return kind + " " + type.getTypeName();
    }

    public static final class ArrayShape extends DestinationShape {
        private final Class<?> componentClass;
        private final DestinationShape element;

        ArrayShape(Type type, Class<?> componentClass, DestinationShape element) {
            super(type, Kind.ARRAY);
            this.componentClass = componentClass;
            this.element = element;
        }

        public DestinationShape element() {
            return element;
        }

        Object newInstance(int length) {
            return java.lang.reflect.Array.newInstance(componentClass, length);
        }
    }

    public static final class SequenceShape extends DestinationShape {
        private final DestinationShape element;
        private final Supplier<List<Object>> factory;

        SequenceShape(Type type, DestinationShape element, Supplier<List<Object>> factory) {
            super(type, Kind.SEQUENCE);
            this.element = element;
            this.factory = factory;
        }

        public DestinationShape element() {
            return element;
        }

        List<Object> newList() {
            return factory.get();
        }
    }

    public static final class DynamicShape extends DestinationShape {
        private final boolean valueTree;

        DynamicShape(Type type, boolean valueTree) {
            super(type, Kind.DYNAMIC);
            this.valueTree = valueTree;
        }

        /**
         * Determine whether values are stored as {@link Value}s, or else as plain Java lists, booleans, numbers and strings.
         *
         * @return true for a {@link Value} destination
         */
        public boolean isValueTree() {
            return valueTree;
        }

        @Override
        public Object zeroValue() {
            return valueTree ? Value.nullValue() : null;
        }

        Object store(Value value) {
            return valueTree ? value : value.asJavaObject();
        }
    }

    public static final class OptionalShape extends DestinationShape {
        private final DestinationShape element;

        OptionalShape(Type type, DestinationShape element) {
            super(type, Kind.OPTIONAL);
            this.element = element;
        }

        public DestinationShape element() {
            return element;
        }

        @Override
        public Object zeroValue() {
            return Optional.empty();
        }
    }

    public static final class ScalarShape extends DestinationShape {
        private final ScalarKind scalarKind;

        ScalarShape(Type type, ScalarKind scalarKind) {
            super(type, Kind.SCALAR);
            this.scalarKind = scalarKind;
        }

        public ScalarKind scalarKind() {
            return scalarKind;
        }

        @Override
        public Object zeroValue() {
            return scalarKind.zeroValue();
        }

        @Override
        public boolean isNullable() {
            return scalarKind == ScalarKind.BINARY;
        }
    }

    public static final class UnsupportedShape extends DestinationShape {

        UnsupportedShape(Type type) {
            super(type, Kind.UNSUPPORTED);
        }

        @Override
        public boolean isNullable() {
            return false;
        }
    }
}
