/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import io.pgcodec.PgCodecException;

/**
 * Base of the exceptions reported while decoding an array literal.
 */
public class ArrayDecodeException extends PgCodecException {

    private static final long serialVersionUID = -4519270375604182953L;

    public ArrayDecodeException(String message) {
        super(message);
    }

    public ArrayDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
