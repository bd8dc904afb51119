/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgcodec.PgCodecException;
import io.pgcodec.annotation.Immutable;
import io.pgcodec.config.Configuration;
import io.pgcodec.config.EnumeratedValue;
import io.pgcodec.config.Field;
import io.pgcodec.config.Field.ValidationOutput;

/**
 * The settings shared by {@link ArrayDecoder} and {@link ArrayEncoder}.
 */
@Immutable
public class ArrayCodecConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArrayCodecConfig.class);

    /**
     * The set of predefined NullLiteralMode options or aliases.
     */
    public enum NullLiteralMode implements EnumeratedValue {
        /**
         * Only a bare {@code NULL}, in any letter case, is the SQL null.
         */
        STRICT("strict"),

        /**
         * Any bare literal starting with {@code N} is the SQL null.
         */
        PREFIX("prefix");

        private final String value;

        NullLiteralMode(String value) {
            this.value = value;
        }

        @Override
        public String getValue() {
            return value;
        }

        /**
         * Determine if the supplied value is one of the predefined options.
         *
         * @param value the configuration property value; may be null
         * @return the matching option, or null if no match is found
         */
        public static NullLiteralMode parse(String value) {
            if (value == null) {
                return null;
            }
            value = value.trim();
            for (NullLiteralMode option : NullLiteralMode.values()) {
                if (option.getValue().equalsIgnoreCase(value)) {
                    return option;
                }
            }
            return null;
        }
    }

    /**
     * The set of predefined BinaryHandlingMode options or aliases.
     */
    public enum BinaryHandlingMode implements EnumeratedValue {
        /**
         * Binary values are base64-encoded text.
         */
        BASE64("base64"),

        /**
         * Binary values are base64-encoded text using the URL and file name safe alphabet.
         */
        BASE64_URL_SAFE("base64-url-safe"),

        /**
         * Binary values are hex digits, optionally preceded by the {@code \x} marker of PostgreSQL's {@code bytea} output.
         */
        HEX("hex"),

        /**
         * Binary values are the literal's own bytes.
         */
        BYTES("bytes");

        private final String value;

        BinaryHandlingMode(String value) {
            this.value = value;
        }

        @Override
        public String getValue() {
            return value;
        }

        /**
         * Determine if the supplied value is one of the predefined options.
         *
         * @param value the configuration property value; may be null
         * @return the matching option, or null if no match is found
         */
        public static BinaryHandlingMode parse(String value) {
            if (value == null) {
                return null;
            }
            value = value.trim();
            for (BinaryHandlingMode option : BinaryHandlingMode.values()) {
                if (option.getValue().equalsIgnoreCase(value)) {
                    return option;
                }
            }
            return null;
        }
    }

    /**
     * The set of predefined DecimalHandlingMode options or aliases.
     */
    public enum DecimalHandlingMode implements EnumeratedValue {
        /**
         * Numbers in a dynamic destination are {@link Double}s.
         */
        DOUBLE("double"),

        /**
         * Numbers in a dynamic destination are {@link java.math.BigDecimal}s, except for {@code NaN} and the infinities.
         */
        PRECISE("precise");

        private final String value;

        DecimalHandlingMode(String value) {
            this.value = value;
        }

        @Override
        public String getValue() {
            return value;
        }

        /**
         * Determine if the supplied value is one of the predefined options.
         *
         * @param value the configuration property value; may be null
         * @return the matching option, or null if no match is found
         */
        public static DecimalHandlingMode parse(String value) {
            if (value == null) {
                return null;
            }
            value = value.trim();
            for (DecimalHandlingMode option : DecimalHandlingMode.values()) {
                if (option.getValue().equalsIgnoreCase(value)) {
                    return option;
                }
            }
            return null;
        }
    }

    public static final Field NULL_LITERAL_MODE = Field.create("null.literal.mode")
            .withDisplayName("Null literal mode")
            .withEnum(NullLiteralMode.class, NullLiteralMode.STRICT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("Specify which bare literals denote the SQL null: "
                    + "'strict' (the default) accepts only NULL in any letter case; "
                    + "'prefix' accepts any bare literal starting with N.");

    public static final Field BINARY_HANDLING_MODE = Field.create("binary.handling.mode")
            .withDisplayName("Binary Handling")
            .withEnum(BinaryHandlingMode.class, BinaryHandlingMode.BASE64)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.LOW)
            .withDescription("Specify how binary (byte[]) values are represented in array literals: "
                    + "'base64' (the default) as base64-encoded text; "
                    + "'base64-url-safe' as base64 text with the URL safe alphabet; "
                    + "'hex' as hex digits with an optional \\x prefix; "
                    + "'bytes' as the literal's raw bytes.");

    public static final Field DECIMAL_HANDLING_MODE = Field.create("decimal.handling.mode")
            .withDisplayName("Decimal Handling")
            .withEnum(DecimalHandlingMode.class, DecimalHandlingMode.DOUBLE)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDescription("Specify how numbers are represented when the destination's type is not known in advance: "
                    + "'double' (the default) as Double, which may lose precision; "
                    + "'precise' as BigDecimal.");

    public static final Field ARRAY_DELIMITER = Field.create("array.delimiter")
            .withDisplayName("Array element delimiter")
            .withType(Type.STRING)
            .withDefault(String.valueOf((char) ArrayScanner.DEFAULT_DELIMITER))
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withValidation(ArrayCodecConfig::validateDelimiter)
            .withDescription("The character separating array elements. PostgreSQL uses ',' for every built-in type except box, "
                    + "whose arrays are separated by ';'.");

    public static final Field.Set ALL_FIELDS = Field.setOf(NULL_LITERAL_MODE, BINARY_HANDLING_MODE, DECIMAL_HANDLING_MODE, ARRAY_DELIMITER);

    private static final ArrayCodecConfig DEFAULTS = new ArrayCodecConfig(Configuration.empty());

    private final NullLiteralMode nullLiteralMode;
    private final BinaryHandlingMode binaryHandlingMode;
    private final DecimalHandlingMode decimalHandlingMode;
    private final byte delimiter;

    /**
     * Create the settings from a configuration, validating every field.
     *
     * @param config the configuration; may not be null
     * @throws PgCodecException if any field is invalid; the problems are logged
     */
    public ArrayCodecConfig(Configuration config) {
        if (!config.validateAndRecord(ALL_FIELDS, LOGGER::error)) {
            throw new PgCodecException("Error configuring an instance of " + getClass().getSimpleName() + "; check the logs for details");
        }
        this.nullLiteralMode = NullLiteralMode.parse(config.getString(NULL_LITERAL_MODE));
        this.binaryHandlingMode = BinaryHandlingMode.parse(config.getString(BINARY_HANDLING_MODE));
        this.decimalHandlingMode = DecimalHandlingMode.parse(config.getString(DECIMAL_HANDLING_MODE));
        this.delimiter = (byte) config.getString(ARRAY_DELIMITER).charAt(0);
    }

    public static ArrayCodecConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Get the definition of every setting, for tools that describe or validate configurations.
     *
     * @return a new definition; never null
     */
    public static ConfigDef configDef() {
        return Field.group(new ConfigDef(), "Array literals", ALL_FIELDS.asArray());
    }

    public NullLiteralMode nullLiteralMode() {
        return nullLiteralMode;
    }

    public BinaryHandlingMode binaryHandlingMode() {
        return binaryHandlingMode;
    }

    public DecimalHandlingMode decimalHandlingMode() {
        return decimalHandlingMode;
    }

    public byte delimiter() {
        return delimiter;
    }

    private static int validateDelimiter(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null || value.length() != 1) {
            problems.accept(field, value, "A single character is expected");
            return 1;
        }
        char c = value.charAt(0);
        if (c <= ' ' || c >= 0x7f || c == '"' || c == '\\' || c == '{' || c == '}') {
            problems.accept(field, value, "The delimiter must be a printable ASCII character other than a quote, backslash or brace");
            return 1;
        }
        return 0;
    }
}
