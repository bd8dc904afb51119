/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Base64;
import java.util.regex.Pattern;

import io.pgcodec.annotation.Immutable;
import io.pgcodec.arrays.ArrayCodecConfig.DecimalHandlingMode;
import io.pgcodec.arrays.ArrayCodecConfig.NullLiteralMode;
import io.pgcodec.document.Value;
import io.pgcodec.util.HexConverter;

/**
 * Converts the text of a single literal into Java scalars, following the configured modes.
 */
@Immutable
final class LiteralConverter {

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");
    private static final Pattern NON_FINITE = Pattern.compile("NaN|[+-]?Infinity");

    private final ArrayCodecConfig config;

    LiteralConverter(ArrayCodecConfig config) {
        this.config = config;
    }

    /**
     * Determine whether a bare literal is the SQL null.
     *
     * @param bare the literal, without trailing spaces
     * @return true if the literal denotes null under the configured {@link NullLiteralMode}
     */
    boolean isNull(LiteralBytes bare) {
        if (config.nullLiteralMode() == NullLiteralMode.PREFIX) {
            return bare.startsWith((byte) 'N');
        }
        return bare.equalsIgnoreCase("NULL");
    }

    /**
     * Parse a number into the given numeric kind, checking that it fits.
     *
     * @param text the literal text
     * @param kind a numeric kind
     * @return the boxed number; never null
     * @throws NumberFormatException if the text is not a number or is out of range for the kind
     */
    Object toNumber(String text, ScalarKind kind) {
        switch (kind) {
            case BYTE:
                return Byte.valueOf(Byte.parseByte(checkInteger(text)));
            case SHORT:
                return Short.valueOf(Short.parseShort(checkInteger(text)));
            case INTEGER:
                return Integer.valueOf(Integer.parseInt(checkInteger(text)));
            case LONG:
                return Long.valueOf(Long.parseLong(checkInteger(text)));
            case BIG_INTEGER:
                return new BigInteger(checkInteger(text));
            case FLOAT:
                float f = Float.parseFloat(checkFloating(text));
                if (Float.isInfinite(f) && !NON_FINITE.matcher(text).matches()) {
                    throw new NumberFormatException("Value out of range for float: " + text);
                }
                return Float.valueOf(f);
            case DOUBLE:
                return Double.valueOf(parseDouble(text));
            case BIG_DECIMAL:
                if (!DECIMAL.matcher(text).matches()) {
                    throw new NumberFormatException("Not a decimal number: " + text);
                }
                return new BigDecimal(text);
            default:
                throw new IllegalArgumentException("Not a numeric kind: " + kind);
        }
    }

    /**
     * Parse a number for a destination whose type is not known in advance.
     *
     * @param text the literal text
     * @return the number as a {@link Value}; never null
     * @throws NumberFormatException if the text is not a number
     */
    Value toDynamicNumber(String text) {
        if (config.decimalHandlingMode() == DecimalHandlingMode.PRECISE && DECIMAL.matcher(text).matches()) {
            return Value.create(new BigDecimal(text));
        }
        return Value.create(parseDouble(text));
    }

    /**
     * Decode the text of a binary value according to the configured binary handling mode.
     *
     * @param text the unquoted literal
     * @return the bytes; never null
     * @throws IllegalArgumentException if the text is not valid in the configured encoding
     */
    byte[] toBinary(LiteralBytes text) {
        switch (config.binaryHandlingMode()) {
            case BASE64_URL_SAFE:
                return Base64.getUrlDecoder().decode(text.toByteArray());
            case HEX:
                byte[] digits = text.toByteArray();
                int start = digits.length >= 2 && digits[0] == '\\' && digits[1] == 'x' ? 2 : 0;
                return HexConverter.convertFromHex(digits, start, digits.length - start);
            case BYTES:
                return text.toByteArray();
            case BASE64:
            default:
                return Base64.getDecoder().decode(text.toByteArray());
        }
    }

    private static double parseDouble(String text) {
        double d = Double.parseDouble(checkFloating(text));
        if (Double.isInfinite(d) && !NON_FINITE.matcher(text).matches()) {
            throw new NumberFormatException("Value out of range for double: " + text);
        }
        return d;
    }

    private static String checkInteger(String text) {
        if (!INTEGER.matcher(text).matches()) {
            throw new NumberFormatException("Not an integer: " + text);
        }
        return text;
    }

    private static String checkFloating(String text) {
        if (!DECIMAL.matcher(text).matches() && !NON_FINITE.matcher(text).matches()) {
            throw new NumberFormatException("Not a floating-point number: " + text);
        }
        return text;
    }
}
