/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.config;

/**
 * An enum whose constants are spelled differently in configuration than in Java, such as {@code base64-url-safe}.
 * Enums used with {@link Field#withEnum(Class, Enum)} implement this so their configured spelling is validated and
 * recommended instead of the constant name.
 */
public interface EnumeratedValue {

    /**
     * Returns the configuration spelling of this value.
     * @return the value as it appears in a configuration; never null
     */
    String getValue();
}
