/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

/**
 * The decoder and the scanner disagree about the position in the input. This signals a defect rather than bad input.
 */
public class DecoderOutOfSyncException extends ArrayDecodeException {

    private static final long serialVersionUID = -6813022385001468395L;

    public DecoderOutOfSyncException(Opcode unexpected, long offset) {
        super(String.format("decoder out of sync: unexpected %s at offset %d", unexpected, offset));
    }
}
