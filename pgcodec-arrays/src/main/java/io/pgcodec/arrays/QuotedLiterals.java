/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.util.Arrays;

import io.pgcodec.util.HexConverter;

/**
 * Removes the quotes and backslash escapes from a double-quoted array element.
 * <p>
 * A backslash followed by {@code u} and four hex digits stands for a UTF-16 code unit, and two such escapes may form a
 * surrogate pair. A backslash followed by any other byte stands for that byte, which is how quotes, backslashes and
 * braces appear inside an element. All other bytes, including multi-byte UTF-8 sequences, are copied unchanged.
 */
public final class QuotedLiterals {

    private static final int REPLACEMENT_CHARACTER = 0xFFFD;

    private QuotedLiterals() {
    }

    /**
     * Unquote a double-quoted literal.
     *
     * @param quoted the literal, including its surrounding quotes
     * @return the unescaped content, or null if the literal is not well-formed; when the content has nothing to unescape
     *         the result is a view over the input rather than a copy
     */
    public static LiteralBytes unquote(LiteralBytes quoted) {
        int length = quoted.length();
        if (length < 2 || quoted.byteAt(0) != '"' || quoted.byteAt(length - 1) != '"') {
            return null;
        }
        LiteralBytes content = quoted.slice(1, length - 1);
        int n = content.length();

        int r = 0;
        while (r < n) {
            byte c = content.byteAt(r);
            if (c == '\\' || c == '"' || c < 0x20) {
                break;
            }
            r++;
        }
        if (r == n) {
            return content;
        }

        byte[] out = new byte[n + 8];
        for (int i = 0; i != r; ++i) {
            out[i] = content.byteAt(i);
        }
        int w = r;
        while (r < n) {
            // room for the longest UTF-8 sequence
            if (w + 4 > out.length) {
                out = Arrays.copyOf(out, out.length * 2);
            }
            byte c = content.byteAt(r);
            if (c == '\\') {
                r++;
                if (r == n) {
                    return null;
                }
                if (content.byteAt(r) != 'u') {
                    out[w++] = content.byteAt(r++);
                    continue;
                }
                int unit = codeUnit(content, r - 1);
                if (unit < 0) {
                    return null;
                }
                r += 5;
                int codePoint = unit;
                if (Character.isSurrogate((char) unit)) {
                    int low = codeUnit(content, r);
                    if (Character.isHighSurrogate((char) unit) && low >= 0 && Character.isLowSurrogate((char) low)) {
                        codePoint = Character.toCodePoint((char) unit, (char) low);
                        r += 6;
                    }
                    else {
                        codePoint = REPLACEMENT_CHARACTER;
                    }
                }
                w = appendUtf8(out, w, codePoint);
            }
            else if (c == '"' || (c >= 0 && c < 0x20)) {
                return null;
            }
            else {
                out[w++] = c;
                r++;
            }
        }
        return new LiteralBytes(out, 0, w);
    }

    /**
     * Read a {@code \\uXXXX} escape.
     *
     * @return the code unit, or -1 if there is no well-formed escape at the given index
     */
    private static int codeUnit(LiteralBytes s, int index) {
        if (index + 6 > s.length() || s.byteAt(index) != '\\' || s.byteAt(index + 1) != 'u') {
            return -1;
        }
        int unit = 0;
        for (int i = index + 2; i != index + 6; ++i) {
            int digit = HexConverter.digit(s.byteAt(i));
            if (digit < 0) {
                return -1;
            }
            unit = unit << 4 | digit;
        }
        return unit;
    }

    private static int appendUtf8(byte[] out, int w, int codePoint) {
        if (codePoint < 0x80) {
            out[w++] = (byte) codePoint;
        }
        else if (codePoint < 0x800) {
            out[w++] = (byte) (0xC0 | codePoint >> 6);
            out[w++] = (byte) (0x80 | codePoint & 0x3F);
        }
        else if (codePoint < 0x10000) {
            out[w++] = (byte) (0xE0 | codePoint >> 12);
            out[w++] = (byte) (0x80 | codePoint >> 6 & 0x3F);
            out[w++] = (byte) (0x80 | codePoint & 0x3F);
        }
        else {
            out[w++] = (byte) (0xF0 | codePoint >> 18);
            out[w++] = (byte) (0x80 | codePoint >> 12 & 0x3F);
            out[w++] = (byte) (0x80 | codePoint >> 6 & 0x3F);
            out[w++] = (byte) (0x80 | codePoint & 0x3F);
        }
        return w;
    }
}
