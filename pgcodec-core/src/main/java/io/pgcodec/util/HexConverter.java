/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.util;

import java.nio.charset.StandardCharsets;

/**
 * Maps between byte arrays and their hex representation, as used by PostgreSQL's {@code bytea} text form.
 */
public final class HexConverter {

    private static final char[] HEX_CHARS = new char[]{ '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f' };

    private HexConverter() {
    }

    /**
     * Take the supplied byte array and convert it to a lower-case hex encoded String.
     *
     * @param toBeConverted the bytes to be converted
     * @return the hex encoded String
     */
    public static String convertToHexString(byte[] toBeConverted) {
        if (toBeConverted == null) {
            throw new NullPointerException("Parameter to be converted can not be null");
        }

        char[] converted = new char[toBeConverted.length * 2];
        for (int i = 0; i < toBeConverted.length; i++) {
            byte b = toBeConverted[i];
            converted[i * 2] = HEX_CHARS[b >> 4 & 0x0F];
            converted[i * 2 + 1] = HEX_CHARS[b & 0x0F];
        }

        return String.valueOf(converted);
    }

    /**
     * Convert a range of ASCII hex digits to the raw byte values. The digits are processed in pairs, each pair giving
     * one byte; both cases are accepted.
     *
     * @param toConvert the buffer holding the hex digits
     * @param offset the index of the first digit
     * @param length the number of digits, which must be even
     * @return the raw byte array
     * @throws IllegalArgumentException if the length is odd or a byte is not a hex digit
     */
    public static byte[] convertFromHex(byte[] toConvert, int offset, int length) {
        if (length % 2 != 0) {
            throw new IllegalArgumentException("The supplied range must contain an even number of hex digits.");
        }

        byte[] response = new byte[length / 2];
        for (int i = 0; i < response.length; i++) {
            int pos = offset + i * 2;
            response[i] = (byte) (toNibble(toConvert, pos) << 4 | toNibble(toConvert, pos + 1));
        }
        return response;
    }

    /**
     * Take the incoming String of hex encoded data and convert to the raw byte values.
     *
     * @param toConvert the hex encoded String to convert
     * @return the raw byte array
     * @throws IllegalArgumentException if the length is odd or a character is not a hex digit
     */
    public static byte[] convertFromHex(String toConvert) {
        byte[] digits = toConvert.getBytes(StandardCharsets.UTF_8);
        return convertFromHex(digits, 0, digits.length);
    }

    /**
     * Get the value of a single ASCII hex digit.
     *
     * @param b the byte
     * @return the digit's value in the range 0-15, or -1 if the byte is not a hex digit
     */
    public static int digit(byte b) {
        if (b >= '0' && b <= '9') {
            return b - '0';
        }
        if (b >= 'a' && b <= 'f') {
            return b - 'a' + 10;
        }
        if (b >= 'A' && b <= 'F') {
            return b - 'A' + 10;
        }
        return -1;
    }

    private static int toNibble(byte[] toConvert, int pos) {
        int response = digit(toConvert[pos]);
        if (response < 0) {
            throw new IllegalArgumentException("Non-hex character '" + (char) (toConvert[pos] & 0xFF) + "' at index=" + pos);
        }
        return response;
    }
}
