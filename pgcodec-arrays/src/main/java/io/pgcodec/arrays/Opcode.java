/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

/**
 * The events an {@link ArrayScanner} reports for each byte it consumes.
 */
public enum Opcode {
    /** The byte was consumed and no boundary was crossed. */
    CONTINUE,
    /** The byte is the first of a quoted or bare literal. */
    BEGIN_LITERAL,
    /** The byte opened a nested array. */
    BEGIN_ARRAY,
    /** The byte is a delimiter that completed the previous element. */
    ARRAY_VALUE,
    /** The byte closed the current array, completing any open element. */
    END_ARRAY,
    /** The byte is whitespace outside any literal. */
    SKIP_SPACE,
    /**
     * The top-level value completed before the byte just observed. A bare literal's end is only known once the following
     * byte has been seen.
     */
    END,
    /** The input is not a well-formed array literal. */
    ERROR
}
