/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import io.pgcodec.annotation.Immutable;

/**
 * A range of bytes holding one literal, viewed in place within a larger buffer. The bytes must not be modified while
 * the view is in use.
 */
@Immutable
public final class LiteralBytes {

    private final byte[] data;
    private final int offset;
    private final int length;

    public LiteralBytes(byte[] data, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IndexOutOfBoundsException("Range [" + offset + ", " + (offset + length) + ") is outside a buffer of " + data.length + " bytes");
        }
        this.data = data;
        this.offset = offset;
        this.length = length;
    }

    public static LiteralBytes of(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return new LiteralBytes(bytes, 0, bytes.length);
    }

    public int length() {
        return length;
    }

    public byte byteAt(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index " + index + " is outside a literal of " + length + " bytes");
        }
        return data[offset + index];
    }

    /**
     * Get a view of part of this literal.
     *
     * @param from the index of the first byte, inclusive
     * @param to the index of the last byte, exclusive
     * @return the view; never null
     */
    public LiteralBytes slice(int from, int to) {
        if (from < 0 || to > length || from > to) {
            throw new IndexOutOfBoundsException("Range [" + from + ", " + to + ") is outside a literal of " + length + " bytes");
        }
        return new LiteralBytes(data, offset + from, to - from);
    }

    /**
     * Get a view of this literal without any trailing spaces.
     *
     * @return the view, or this literal if it does not end with a space; never null
     */
    public LiteralBytes trimTrailingSpaces() {
        int to = length;
        while (to > 0 && data[offset + to - 1] == ' ') {
            to--;
        }
        return to == length ? this : new LiteralBytes(data, offset, to);
    }

    public boolean startsWith(byte b) {
        return length > 0 && data[offset] == b;
    }

    /**
     * Determine whether this literal spells the given ASCII text, ignoring the case of letters.
     *
     * @param text the ASCII text
     * @return true if the bytes match
     */
    public boolean equalsIgnoreCase(String text) {
        if (text.length() != length) {
            return false;
        }
        for (int i = 0; i != length; ++i) {
            int c = data[offset + i];
            int t = text.charAt(i);
            if (c != t && Character.toLowerCase(c) != Character.toLowerCase(t)) {
                return false;
            }
        }
        return true;
    }

    public byte[] toByteArray() {
        return Arrays.copyOfRange(data, offset, offset + length);
    }

    /**
     * Decode the bytes as UTF-8 text.
     */
    @Override
    public String toString() {
        return new String(data, offset, length, StandardCharsets.UTF_8);
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = offset; i != offset + length; ++i) {
            result = 31 * result + data[i];
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof LiteralBytes) {
            LiteralBytes that = (LiteralBytes) obj;
            return Arrays.equals(this.data, this.offset, this.offset + this.length, that.data, that.offset, that.offset + that.length);
        }
        return false;
    }
}
