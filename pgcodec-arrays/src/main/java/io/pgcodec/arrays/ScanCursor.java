/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import io.pgcodec.annotation.NotThreadSafe;

/**
 * Feeds a byte buffer through an {@link ArrayScanner}, keeping the read position in step with the scanner. A caller
 * may {@link #unread(Opcode) give back} the last byte so that the next read reports it again; at most one byte can be
 * given back at a time.
 */
@NotThreadSafe
final class ScanCursor {

    private final byte[] data;
    private final int end;
    private final ArrayScanner scanner;
    private int offset;
    private boolean unreadPending;

    ScanCursor(byte[] data, int start, ArrayScanner scanner) {
        this.data = data;
        this.end = data.length;
        this.scanner = scanner;
        this.offset = start;
        scanner.reset(start);
    }

    /**
     * Get the position of the next byte to be read. Once the input is exhausted this is one past the end of the buffer,
     * so that giving back the end-of-input event lands exactly on the end.
     *
     * @return the offset
     */
    int offset() {
        return offset;
    }

    /**
     * Read one byte, or signal the end of the input when there are no bytes left.
     *
     * @return the scanner's event; never null
     */
    Opcode next() {
        unreadPending = false;
        if (offset >= end) {
            offset = end + 1;
            return scanner.endOfInput();
        }
        return scanner.step(data[offset++]);
    }

    /**
     * Read bytes for as long as the scanner reports the given opcode.
     *
     * @param opcode the opcode to skip over
     * @return the first different opcode, or the end-of-input event; never null
     */
    Opcode scanWhile(Opcode opcode) {
        while (true) {
            boolean exhausted = offset >= end;
            Opcode next = next();
            if (next != opcode || exhausted) {
                return next;
            }
        }
    }

    /**
     * Give back the last byte read, so that the next read reports {@code opcode} again without consuming new input.
     *
     * @param opcode the opcode the last read returned
     * @throws IllegalStateException if a byte has already been given back and not read again
     */
    void unread(Opcode opcode) {
        if (unreadPending) {
            throw new IllegalStateException("A byte has already been given back at offset " + offset);
        }
        unreadPending = true;
        offset--;
        scanner.undo(opcode);
    }

    /**
     * Read the rest of the input after the top-level value, which may only contain spaces.
     *
     * @return {@link Opcode#END} if the input ended cleanly, {@link Opcode#ERROR} for trailing data, or any other
     *         opcode if the decoder stopped before the top-level value was complete
     */
    Opcode scanToEnd() {
        while (true) {
            boolean exhausted = offset >= end;
            Opcode next = next();
            if (exhausted || next != Opcode.END) {
                return next;
            }
        }
    }

    ArraySyntaxException syntaxError() {
        return scanner.syntaxError();
    }
}
