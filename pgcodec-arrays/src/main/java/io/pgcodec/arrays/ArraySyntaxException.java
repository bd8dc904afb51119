/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

/**
 * The input is not a well-formed array literal. A syntax error ends the decode call immediately.
 */
public class ArraySyntaxException extends ArrayDecodeException {

    private static final long serialVersionUID = 6652370163186935003L;

    private final long offset;
    private final String context;
    private final int offendingByte;

    public ArraySyntaxException(String message, long offset, String context, int offendingByte) {
        super(String.format("%s at offset %d", message, offset));
        this.offset = offset;
        this.context = context;
        this.offendingByte = offendingByte;
    }

    /**
     * Create the exception reported for an unexpected byte.
     *
     * @param c the offending byte
     * @param context where in the grammar the byte appeared, such as {@code "after array element"}
     * @param offset the position of the byte in the input
     * @return the exception; never null
     */
    static ArraySyntaxException invalidCharacter(byte c, String context, long offset) {
        return new ArraySyntaxException("invalid character " + quote(c) + " " + context, offset, context, c & 0xFF);
    }

    static ArraySyntaxException unexpectedEnd(long offset) {
        return new ArraySyntaxException("unexpected end of input", offset, "at end of input", -1);
    }

    /**
     * Get the position in the input where the error was detected.
     *
     * @return the byte offset; never negative
     */
    public long getOffset() {
        return offset;
    }

    /**
     * Get a short description of where in the grammar the error was detected.
     *
     * @return the context; never null
     */
    public String getContext() {
        return context;
    }

    /**
     * Get the byte that could not be accepted.
     *
     * @return the unsigned byte value, or -1 if the input ended too early
     */
    public int getOffendingByte() {
        return offendingByte;
    }

    static String quote(byte c) {
        if (c == '\'') {
            return "'\\''";
        }
        if (c == '"') {
            return "'\"'";
        }
        if (c >= 0x20 && c < 0x7f) {
            return "'" + (char) c + "'";
        }
        return String.format("0x%02x", c & 0xFF);
    }
}
