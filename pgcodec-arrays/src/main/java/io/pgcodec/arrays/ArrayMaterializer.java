/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgcodec.annotation.NotThreadSafe;
import io.pgcodec.arrays.DestinationShape.ArrayShape;
import io.pgcodec.arrays.DestinationShape.DynamicShape;
import io.pgcodec.arrays.DestinationShape.Kind;
import io.pgcodec.arrays.DestinationShape.OptionalShape;
import io.pgcodec.arrays.DestinationShape.ScalarShape;
import io.pgcodec.arrays.DestinationShape.SequenceShape;
import io.pgcodec.document.Array;
import io.pgcodec.document.Value;

/**
 * Walks one array literal and writes what it finds into a destination. An instance decodes exactly one literal.
 * <p>
 * Every step returns whether the walk may go on. A syntax error or an internal inconsistency is fatal: it is recorded
 * and the walk unwinds at once. A literal that does not fit its destination is a type mismatch: it is reported, the
 * element is skipped, and decoding carries on with the next one.
 */
@NotThreadSafe
final class ArrayMaterializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArrayMaterializer.class);

    // some JVMs reserve header words in arrays
    static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private static final DynamicShape VALUE_ELEMENT = (DynamicShape) ShapeInspector.shapeOf(Value.class);

    private final byte[] data;
    private final LiteralConverter converter;
    private final Consumer<ArrayDecodeException> problems;
    private final ArrayScanner scanner;
    private ScanCursor cursor;
    private ArrayDecodeException fatalError;
    private ArrayDecodeException firstMismatch;

    ArrayMaterializer(byte[] data, ArrayCodecConfig config, LiteralConverter converter, Consumer<ArrayDecodeException> problems) {
        this.data = data;
        this.converter = converter;
        this.problems = problems;
        this.scanner = new ArrayScanner(config.delimiter());
    }

    /**
     * Decode the whole input into the given slot.
     *
     * @return the fatal error if there was one, otherwise the first type mismatch, or null if decoding succeeded
     */
    ArrayDecodeException materialize(Slot slot, DestinationShape shape) {
        int start = skipDimensions();
        if (start >= 0) {
            cursor = new ScanCursor(data, start, scanner);
            if (value(slot, shape)) {
                Opcode op = cursor.scanToEnd();
                if (op == Opcode.ERROR) {
                    fail(cursor.syntaxError());
                }
                else if (op != Opcode.END) {
                    fail(new DecoderOutOfSyncException(op, cursor.offset()));
                }
            }
        }
        return fatalError != null ? fatalError : firstMismatch;
    }

    /**
     * Skip the bounds PostgreSQL prints before arrays whose lower bound is not 1, as in {@code [0:2]={1,2,3}}.
     *
     * @return the offset of the array itself, or -1 if the bounds are not terminated
     */
    private int skipDimensions() {
        int start = 0;
        while (start != data.length && data[start] == ' ') {
            ++start;
        }
        if (start == data.length || data[start] != '[') {
            return 0;
        }
        for (int i = start; i != data.length; ++i) {
            if (data[i] == '=') {
                return i + 1;
            }
        }
        fail(new ArraySyntaxException("unterminated array dimensions", data.length, "in array dimensions", -1));
        return -1;
    }

    private boolean value(Slot slot, DestinationShape shape) {
        Opcode op = cursor.scanWhile(Opcode.SKIP_SPACE);
        switch (op) {
            case BEGIN_ARRAY:
                return array(slot, shape);
            case BEGIN_LITERAL:
                return literal(slot, shape);
            case ERROR:
                return fail(cursor.syntaxError());
            default:
                return fail(new DecoderOutOfSyncException(op, cursor.offset()));
        }
    }

    private boolean array(Slot slot, DestinationShape shape) {
        if (shape == null) {
            return elements(Elements.DISCARD);
        }
        switch (shape.kind()) {
            case OPTIONAL:
                return array(Slot.optionalContent(slot), ((OptionalShape) shape).element());
            case ARRAY:
                ArrayShape arrayShape = (ArrayShape) shape;
                Object existing = slot.get();
                return elements(existing != null ? new FixedArrayElements(existing, arrayShape) : new GrowingArrayElements(slot, arrayShape));
            case SEQUENCE:
                return sequence(slot, (SequenceShape) shape);
            case DYNAMIC:
                return elements(new DynamicElements(slot, (DynamicShape) shape));
            default:
                mismatch(new TypeMismatchException("array", shape.type(), cursor.offset() - 1));
                return elements(Elements.DISCARD);
        }
    }

    @SuppressWarnings("unchecked")
    private boolean sequence(Slot slot, SequenceShape shape) {
        Object existing = slot.get();
        if (existing != null && !(existing instanceof List)) {
            return fail(new InvalidDestinationException("Cannot decode into a " + existing.getClass().getName()
                    + " held by a destination of type " + shape.type().getTypeName() + "; only lists can be overwritten"));
        }
        List<Object> list = (List<Object>) existing;
        if (list == null) {
            list = shape.newList();
            slot.set(list);
        }
        try {
            return elements(new ListElements(list, shape.element()));
        }
        catch (UnsupportedOperationException e) {
            return fail(new InvalidDestinationException("Cannot modify the " + list.getClass().getName()
                    + " held by a destination of type " + shape.type().getTypeName(), e));
        }
    }

    private boolean elements(Elements target) {
        int i = 0;
        while (true) {
            Opcode op = cursor.scanWhile(Opcode.SKIP_SPACE);
            if (op == Opcode.END_ARRAY) {
                break;
            }
            if (op == Opcode.ERROR) {
                return fail(cursor.syntaxError());
            }
            cursor.unread(op);

            Slot slot = target.slot(i);
            if (!value(slot, slot != null ? target.elementShape() : null)) {
                return false;
            }
            i++;

            op = cursor.scanWhile(Opcode.SKIP_SPACE);
            if (op == Opcode.END_ARRAY) {
                break;
            }
            if (op == Opcode.ERROR) {
                return fail(cursor.syntaxError());
            }
            if (op != Opcode.ARRAY_VALUE) {
                return fail(new DecoderOutOfSyncException(op, cursor.offset()));
            }
        }
        target.finish(i);
        return true;
    }

    private boolean literal(Slot slot, DestinationShape shape) {
        int start = cursor.offset() - 1;
        Opcode op = cursor.scanWhile(Opcode.CONTINUE);
        if (op == Opcode.ERROR) {
            return fail(cursor.syntaxError());
        }
        cursor.unread(op);
        if (shape == null) {
            return true;
        }
        return store(new LiteralBytes(data, start, cursor.offset() - start), slot, shape, start);
    }

    private boolean store(LiteralBytes item, Slot slot, DestinationShape shape, int offset) {
        if (item.startsWith((byte) '"')) {
            LiteralBytes text = QuotedLiterals.unquote(item);
            if (text == null) {
                return fail(new ArraySyntaxException("malformed quoted literal " + item, offset, "in quoted literal", '"'));
            }
            while (shape.kind() == Kind.OPTIONAL) {
                slot = Slot.optionalContent(slot);
                shape = ((OptionalShape) shape).element();
            }
            storeQuoted(text, slot, shape, offset);
            return true;
        }

        LiteralBytes bare = item.trimTrailingSpaces();
        if (converter.isNull(bare)) {
            if (shape.isNullable()) {
                slot.set(shape.zeroValue());
            }
            return true;
        }
        while (shape.kind() == Kind.OPTIONAL) {
            slot = Slot.optionalContent(slot);
            shape = ((OptionalShape) shape).element();
        }
        if (bare.length() == 1 && (bare.byteAt(0) == 't' || bare.byteAt(0) == 'f')) {
            storeBoolean(bare.byteAt(0) == 't', slot, shape, offset);
        }
        else {
            storeBare(bare, slot, shape, offset);
        }
        return true;
    }

    private void storeBoolean(boolean value, Slot slot, DestinationShape shape, int offset) {
        if (shape.kind() == Kind.DYNAMIC) {
            slot.set(((DynamicShape) shape).store(Value.create(value)));
            return;
        }
        if (shape.kind() == Kind.SCALAR) {
            ScalarKind kind = ((ScalarShape) shape).scalarKind();
            if (kind == ScalarKind.BOOLEAN) {
                slot.set(value);
                return;
            }
            if (kind == ScalarKind.STRING) {
                slot.set(value ? "t" : "f");
                return;
            }
        }
        mismatch(new TypeMismatchException("bool", shape.type(), offset));
    }

    private void storeQuoted(LiteralBytes text, Slot slot, DestinationShape shape, int offset) {
        if (shape.kind() == Kind.DYNAMIC) {
            slot.set(((DynamicShape) shape).store(Value.create(text.toString())));
            return;
        }
        if (shape.kind() == Kind.SCALAR) {
            ScalarKind kind = ((ScalarShape) shape).scalarKind();
            if (kind == ScalarKind.STRING) {
                slot.set(text.toString());
                return;
            }
            if (kind == ScalarKind.BINARY) {
                storeBinary(text, slot, shape, offset);
                return;
            }
        }
        mismatch(new TypeMismatchException("string", shape.type(), offset));
    }

    private void storeBare(LiteralBytes bare, Slot slot, DestinationShape shape, int offset) {
        String text = bare.toString();
        if (shape.kind() == Kind.DYNAMIC) {
            try {
                slot.set(((DynamicShape) shape).store(converter.toDynamicNumber(text)));
            }
            catch (NumberFormatException e) {
                slot.set(shape.zeroValue());
                mismatch(new TypeMismatchException("number " + text, shape.type(), offset, e));
            }
            return;
        }
        if (shape.kind() == Kind.SCALAR) {
            ScalarKind kind = ((ScalarShape) shape).scalarKind();
            if (kind == ScalarKind.STRING) {
                slot.set(text);
                return;
            }
            if (kind == ScalarKind.BINARY) {
                storeBinary(bare, slot, shape, offset);
                return;
            }
            if (kind.isNumeric()) {
                try {
                    slot.set(converter.toNumber(text, kind));
                }
                catch (NumberFormatException e) {
                    mismatch(new TypeMismatchException("number " + text, shape.type(), offset, e));
                }
                return;
            }
        }
        mismatch(new TypeMismatchException("literal " + text, shape.type(), offset));
    }

    private void storeBinary(LiteralBytes text, Slot slot, DestinationShape shape, int offset) {
        try {
            slot.set(converter.toBinary(text));
        }
        catch (IllegalArgumentException e) {
            mismatch(new TypeMismatchException("binary " + text, shape.type(), offset, e));
        }
    }

    private boolean fail(ArrayDecodeException error) {
        fatalError = error;
        problems.accept(error);
        return false;
    }

    private void mismatch(ArrayDecodeException error) {
        if (firstMismatch == null) {
            firstMismatch = error;
        }
        problems.accept(error);
    }

    /**
     * Compute the capacity to grow an array to once it is full: one and a half times the current capacity, and at
     * least 4.
     *
     * @param capacity the current capacity
     * @return the new capacity; always greater than {@code capacity}, and at most {@link #MAX_CAPACITY}
     * @throws IllegalStateException if the capacity has already reached {@link #MAX_CAPACITY}
     */
    static int nextCapacity(int capacity) {
        if (capacity >= MAX_CAPACITY) {
            throw new IllegalStateException("Cannot grow an array beyond " + MAX_CAPACITY + " elements");
        }
        long grown = (long) capacity + capacity / 2;
        return (int) Math.max(4, Math.min(grown, MAX_CAPACITY));
    }

    /**
     * Where the elements of one array go.
     */
    private interface Elements {

        Elements DISCARD = new Elements() {
            @Override
            public Slot slot(int index) {
                return null;
            }

            @Override
            public DestinationShape elementShape() {
                return null;
            }

            @Override
            public void finish(int count) {
            }
        };

        /**
         * Get the slot for the element at the given index, creating it if necessary.
         *
         * @return the slot, or null if the element is to be discarded
         */
        Slot slot(int index);

        DestinationShape elementShape();

        /**
         * Complete the array once all of its elements have been decoded.
         *
         * @param count the number of elements in the literal
         */
        void finish(int count);
    }

    /**
     * An existing Java array, filled in place. Elements beyond its length are discarded.
     */
    private static final class FixedArrayElements implements Elements {
        private final Object array;
        private final int length;
        private final ArrayShape shape;

        FixedArrayElements(Object array, ArrayShape shape) {
            this.array = array;
            this.length = java.lang.reflect.Array.getLength(array);
            this.shape = shape;
        }

        @Override
        public Slot slot(int index) {
            if (index < length) {
                return Slot.arrayElement(array, index);
            }
            if (index == length) {
                LOGGER.trace("Discarding elements beyond the {} elements of the {} destination", length, shape.type().getTypeName());
            }
            return null;
        }

        @Override
        public DestinationShape elementShape() {
            return shape.element();
        }

        @Override
        public void finish(int count) {
            Object zero = shape.element().zeroValue();
            for (int i = count; i < length; ++i) {
                java.lang.reflect.Array.set(array, i, zero);
            }
        }
    }

    /**
     * A Java array created to fit the elements, grown as they are decoded and trimmed to size at the end.
     */
    private static final class GrowingArrayElements implements Elements {
        private final Slot target;
        private final ArrayShape shape;
        private Object buffer;
        private int capacity;

        GrowingArrayElements(Slot target, ArrayShape shape) {
            this.target = target;
            this.shape = shape;
            this.buffer = shape.newInstance(0);
        }

        @Override
        public Slot slot(int index) {
            if (index >= capacity) {
                int newCapacity = nextCapacity(capacity);
                Object grown = shape.newInstance(newCapacity);
                System.arraycopy(buffer, 0, grown, 0, capacity);
                buffer = grown;
                capacity = newCapacity;
            }
            Object zero = shape.element().zeroValue();
            if (zero != null) {
                java.lang.reflect.Array.set(buffer, index, zero);
            }
            return Slot.arrayElement(buffer, index);
        }

        @Override
        public DestinationShape elementShape() {
            return shape.element();
        }

        @Override
        public void finish(int count) {
            Object result = buffer;
            if (count != capacity) {
                result = shape.newInstance(count);
                System.arraycopy(buffer, 0, result, 0, count);
            }
            target.set(result);
        }
    }

    /**
     * A list, overwritten from the start, extended as needed and truncated to the number of elements.
     */
    private static final class ListElements implements Elements {
        private final List<Object> list;
        private final DestinationShape elementShape;

        ListElements(List<Object> list, DestinationShape elementShape) {
            this.list = list;
            this.elementShape = elementShape;
        }

        @Override
        public Slot slot(int index) {
            if (index >= list.size()) {
                list.add(elementShape.zeroValue());
            }
            return Slot.listElement(list, index);
        }

        @Override
        public DestinationShape elementShape() {
            return elementShape;
        }

        @Override
        public void finish(int count) {
            if (list.size() > count) {
                list.subList(count, list.size()).clear();
            }
        }
    }

    /**
     * A destination of unknown type, which receives a new {@link Array} of {@link Value}s.
     */
    private static final class DynamicElements implements Elements {
        private final Slot target;
        private final DynamicShape shape;
        private final List<Object> values = new ArrayList<>();

        DynamicElements(Slot target, DynamicShape shape) {
            this.target = target;
            this.shape = shape;
        }

        @Override
        public Slot slot(int index) {
            values.add(Value.nullValue());
            return Slot.listElement(values, index);
        }

        @Override
        public DestinationShape elementShape() {
            return VALUE_ELEMENT;
        }

        @Override
        public void finish(int count) {
            Array array = Array.create();
            values.forEach(value -> array.add((Value) value));
            target.set(shape.store(Value.create(array)));
        }
    }
}
