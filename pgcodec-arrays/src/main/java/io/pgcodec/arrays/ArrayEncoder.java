/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

import io.pgcodec.annotation.ThreadSafe;
import io.pgcodec.document.Array;
import io.pgcodec.document.Value;
import io.pgcodec.util.HexConverter;

/**
 * Writes Java values in the text form of PostgreSQL arrays, which {@link ArrayDecoder} reads back.
 * <p>
 * Strings are always quoted, so that no text is ever mistaken for {@code NULL}, a boolean or a structural character.
 * Booleans are written as {@code t} and {@code f}, numbers in their canonical Java form, and {@code null} as
 * {@code NULL}.
 */
@ThreadSafe
public class ArrayEncoder {

    private final ArrayCodecConfig config;

    public ArrayEncoder() {
        this(ArrayCodecConfig.defaults());
    }

    public ArrayEncoder(ArrayCodecConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Encode a value.
     *
     * @param value a list, collection, Java array, {@link Array} or {@link Value}, nested to any depth, or a single
     *            scalar; may be null
     * @return the array literal; never null
     * @throws IllegalArgumentException if a binary value is not valid UTF-8 and the binary handling mode is
     *             {@code bytes}
     */
    public String encode(Object value) {
        StringBuilder sb = new StringBuilder();
        append(sb, value);
        return sb.toString();
    }

    private void append(StringBuilder sb, Object value) {
        if (value instanceof Optional) {
            value = ((Optional<?>) value).orElse(null);
        }
        if (value instanceof Value) {
            Value v = (Value) value;
            value = v.isArray() ? v.asArray() : v.asObject();
        }
        if (value == null) {
            sb.append("NULL");
        }
        else if (value instanceof Iterable) {
            appendElements(sb, ((Iterable<?>) value).iterator());
        }
        else if (value instanceof byte[]) {
            appendQuoted(sb, encodeBinary((byte[]) value));
        }
        else if (value.getClass().isArray()) {
            int length = java.lang.reflect.Array.getLength(value);
            Object array = value;
            appendElements(sb, new Iterator<Object>() {
                private int index;

                @Override
                public boolean hasNext() {
                    return index < length;
                }

                @Override
                public Object next() {
                    return java.lang.reflect.Array.get(array, index++);
                }
            });
        }
        else if (value instanceof Boolean) {
            sb.append((Boolean) value ? 't' : 'f');
        }
        else if (value instanceof Number) {
            sb.append(value);
        }
        else {
            appendQuoted(sb, value.toString());
        }
    }

    private void appendElements(StringBuilder sb, Iterator<?> elements) {
        sb.append('{');
        boolean first = true;
        while (elements.hasNext()) {
            if (!first) {
                sb.append((char) config.delimiter());
            }
            first = false;
            append(sb, elements.next());
        }
        sb.append('}');
    }

    private String encodeBinary(byte[] bytes) {
        switch (config.binaryHandlingMode()) {
            case BASE64_URL_SAFE:
                return Base64.getUrlEncoder().encodeToString(bytes);
            case HEX:
                return "\\x" + HexConverter.convertToHexString(bytes);
            case BYTES:
                try {
                    return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
                }
                catch (CharacterCodingException e) {
                    throw new IllegalArgumentException("Binary values must be valid UTF-8 when written as raw bytes; use the base64 or hex binary handling mode", e);
                }
            case BASE64:
            default:
                return Base64.getEncoder().encodeToString(bytes);
        }
    }

    private static void appendQuoted(StringBuilder sb, String text) {
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x20) {
                // control characters are not allowed inside a literal
                sb.append(String.format("\\u%04x", (int) c));
                continue;
            }
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('"');
    }
}
