/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

/**
 * The destination handed to the decoder cannot receive a value at all, for example because it is null or its type
 * contains an unresolved type variable, or because the collection it already holds cannot be overwritten.
 */
public class InvalidDestinationException extends ArrayDecodeException {

    private static final long serialVersionUID = 2297816154460951264L;

    public InvalidDestinationException(String message) {
        super(message);
    }

    public InvalidDestinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
