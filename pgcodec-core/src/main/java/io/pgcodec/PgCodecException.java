/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec;

/**
 * Base of every exception thrown by the PgCodec libraries. All of them are unchecked, since a caller decoding a
 * value returned by the server has no sensible way to recover other than reporting the failure.
 */
public class PgCodecException extends RuntimeException {

    private static final long serialVersionUID = 3107496225938745517L;

    public PgCodecException() {
    }

    public PgCodecException(String message) {
        super(message);
    }

    public PgCodecException(Throwable cause) {
        super(cause);
    }

    public PgCodecException(String message, Throwable cause) {
        super(message, cause);
    }

    public PgCodecException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
