/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

import io.pgcodec.annotation.ThreadSafe;
import io.pgcodec.arrays.DestinationShape.ArrayShape;
import io.pgcodec.arrays.DestinationShape.DynamicShape;
import io.pgcodec.arrays.DestinationShape.OptionalShape;
import io.pgcodec.arrays.DestinationShape.ScalarShape;
import io.pgcodec.arrays.DestinationShape.SequenceShape;
import io.pgcodec.arrays.DestinationShape.UnsupportedShape;
import io.pgcodec.document.Value;

/**
 * Maps Java types onto {@link DestinationShape}s. Shapes are immutable, so they are computed once per type and shared.
 */
@ThreadSafe
public final class ShapeInspector {

    private static final Map<Class<?>, ScalarKind> SCALAR_KINDS;
    private static final Map<Class<?>, Supplier<List<Object>>> LIST_FACTORIES;

    static {
        Map<Class<?>, ScalarKind> kinds = new HashMap<>();
        kinds.put(boolean.class, ScalarKind.BOOLEAN);
        kinds.put(Boolean.class, ScalarKind.BOOLEAN);
        kinds.put(String.class, ScalarKind.STRING);
        kinds.put(byte.class, ScalarKind.BYTE);
        kinds.put(Byte.class, ScalarKind.BYTE);
        kinds.put(short.class, ScalarKind.SHORT);
        kinds.put(Short.class, ScalarKind.SHORT);
        kinds.put(int.class, ScalarKind.INTEGER);
        kinds.put(Integer.class, ScalarKind.INTEGER);
        kinds.put(long.class, ScalarKind.LONG);
        kinds.put(Long.class, ScalarKind.LONG);
        kinds.put(float.class, ScalarKind.FLOAT);
        kinds.put(Float.class, ScalarKind.FLOAT);
        kinds.put(double.class, ScalarKind.DOUBLE);
        kinds.put(Double.class, ScalarKind.DOUBLE);
        kinds.put(BigInteger.class, ScalarKind.BIG_INTEGER);
        kinds.put(BigDecimal.class, ScalarKind.BIG_DECIMAL);
        kinds.put(byte[].class, ScalarKind.BINARY);
        SCALAR_KINDS = kinds;

        Map<Class<?>, Supplier<List<Object>>> factories = new HashMap<>();
        factories.put(List.class, ArrayList::new);
        factories.put(Collection.class, ArrayList::new);
        factories.put(ArrayList.class, ArrayList::new);
        factories.put(LinkedList.class, LinkedList::new);
        LIST_FACTORIES = factories;
    }

    private static final ConcurrentMap<Type, DestinationShape> SHAPES = new ConcurrentHashMap<>();

    private ShapeInspector() {
    }

    /**
     * Get the shape of the given type.
     *
     * @param type the declared type of a destination; may not be null
     * @return the shape; never null
     * @throws InvalidDestinationException if the type, or a type it is composed of, is a type variable that was never
     *             resolved to a concrete type
     */
    public static DestinationShape shapeOf(Type type) {
        DestinationShape shape = SHAPES.get(type);
        if (shape == null) {
            shape = inspect(type);
            DestinationShape existing = SHAPES.putIfAbsent(type, shape);
            if (existing != null) {
                shape = existing;
            }
        }
        return shape;
    }

    private static DestinationShape inspect(Type type) {
        if (type instanceof Class) {
            return inspectClass((Class<?>) type);
        }
        if (type instanceof ParameterizedType) {
            ParameterizedType parameterized = (ParameterizedType) type;
            Class<?> raw = (Class<?>) parameterized.getRawType();
            Type argument = parameterized.getActualTypeArguments()[0];
            if (raw == Optional.class) {
                return new OptionalShape(type, shapeOf(argument));
            }
            Supplier<List<Object>> factory = LIST_FACTORIES.get(raw);
            if (factory != null) {
                return new SequenceShape(type, shapeOf(argument), factory);
            }
            return new UnsupportedShape(type);
        }
        if (type instanceof GenericArrayType) {
            Type component = ((GenericArrayType) type).getGenericComponentType();
            return new ArrayShape(type, rawClass(component), shapeOf(component));
        }
        if (type instanceof WildcardType) {
            return shapeOf(((WildcardType) type).getUpperBounds()[0]);
        }
        if (type instanceof TypeVariable) {
            throw new InvalidDestinationException("Cannot decode into unresolved type variable " + type.getTypeName()
                    + "; capture the concrete type with a TypeReference");
        }
        throw new InvalidDestinationException("Cannot decode into type " + type.getTypeName());
    }

    private static DestinationShape inspectClass(Class<?> clazz) {
        ScalarKind kind = SCALAR_KINDS.get(clazz);
        if (kind != null) {
            return new ScalarShape(clazz, kind);
        }
        if (clazz.isArray()) {
            return new ArrayShape(clazz, clazz.getComponentType(), shapeOf(clazz.getComponentType()));
        }
        if (clazz == Object.class) {
            return new DynamicShape(clazz, false);
        }
        if (clazz == Value.class) {
            return new DynamicShape(clazz, true);
        }
        if (clazz == Optional.class) {
            return new OptionalShape(clazz, shapeOf(Object.class));
        }
        Supplier<List<Object>> factory = LIST_FACTORIES.get(clazz);
        if (factory != null) {
            return new SequenceShape(clazz, shapeOf(Object.class), factory);
        }
        return new UnsupportedShape(clazz);
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class) {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }
        if (type instanceof GenericArrayType) {
            return java.lang.reflect.Array.newInstance(rawClass(((GenericArrayType) type).getGenericComponentType()), 0).getClass();
        }
        if (type instanceof WildcardType) {
            return rawClass(((WildcardType) type).getUpperBounds()[0]);
        }
        throw new InvalidDestinationException("Cannot decode into unresolved type variable " + type.getTypeName()
                + "; capture the concrete type with a TypeReference");
    }
}
