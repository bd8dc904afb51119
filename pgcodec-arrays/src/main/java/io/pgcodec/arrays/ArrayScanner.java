/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import io.pgcodec.annotation.NotThreadSafe;

/**
 * A byte-at-a-time state machine recognizing the text form of PostgreSQL arrays, such as
 * <code>{1,2,{"a b",NULL}}</code>. The scanner only finds the structure and the literal boundaries; it knows nothing
 * about the values being decoded.
 * <p>
 * Each call to {@link #step(byte)} consumes one byte and reports an {@link Opcode}. The end of a bare literal is only
 * discovered on the delimiter that follows it, so a caller that needs to look at that delimiter again can push the
 * opcode back with {@link #undo(Opcode)}; the next step then reports it a second time.
 */
@NotThreadSafe
public final class ArrayScanner {

    public static final byte DEFAULT_DELIMITER = ',';

    private static final byte SPACE = ' ';
    private static final byte QUOTE = '"';
    private static final byte BACKSLASH = '\\';
    private static final byte OPEN = '{';
    private static final byte CLOSE = '}';

    /**
     * The transition functions. The states carry no data of their own, so they are shared by every scanner.
     */
    private enum State {
        BEGIN_VALUE_OR_EMPTY {
            @Override
            Opcode step(ArrayScanner s, byte c) {
                if (c == SPACE) {
                    return Opcode.SKIP_SPACE;
                }
                if (c == CLOSE) {
                    return END_VALUE.step(s, c);
                }
                return BEGIN_VALUE.step(s, c);
            }
        },
        BEGIN_VALUE {
            @Override
            Opcode step(ArrayScanner s, byte c) {
                if (c == SPACE) {
                    return Opcode.SKIP_SPACE;
                }
                if (c == OPEN) {
                    s.depth++;
                    s.state = BEGIN_VALUE_OR_EMPTY;
                    return Opcode.BEGIN_ARRAY;
                }
                if (c == QUOTE) {
                    s.state = IN_QUOTED_STRING;
                    return Opcode.BEGIN_LITERAL;
                }
                if (c == s.delimiter || c == CLOSE || isControl(c)) {
                    return s.error(c, "looking for beginning of value");
                }
                s.state = IN_BARE_LITERAL;
                return Opcode.BEGIN_LITERAL;
            }
        },
        END_VALUE {
            @Override
            Opcode step(ArrayScanner s, byte c) {
                if (s.depth == 0) {
                    s.state = END_TOP;
                    s.endTop = true;
                    return END_TOP.step(s, c);
                }
                if (c == SPACE) {
                    return Opcode.SKIP_SPACE;
                }
                if (c == s.delimiter) {
                    s.state = BEGIN_VALUE;
                    return Opcode.ARRAY_VALUE;
                }
                if (c == CLOSE) {
                    s.depth--;
                    if (s.depth == 0) {
                        s.state = END_TOP;
                        s.endTop = true;
                    }
                    else {
                        s.state = END_VALUE;
                    }
                    return Opcode.END_ARRAY;
                }
                return s.error(c, "after array element");
            }
        },
        END_TOP {
            @Override
            Opcode step(ArrayScanner s, byte c) {
                if (c != SPACE) {
                    return s.error(c, "after top-level value");
                }
                return Opcode.END;
            }
        },
        IN_QUOTED_STRING {
            @Override
            Opcode step(ArrayScanner s, byte c) {
                if (c == QUOTE) {
                    s.state = END_VALUE;
                    return Opcode.CONTINUE;
                }
                if (c == BACKSLASH) {
                    s.state = IN_QUOTED_STRING_ESCAPE;
                    return Opcode.CONTINUE;
                }
                if (isControl(c)) {
                    return s.error(c, "in string literal");
                }
                return Opcode.CONTINUE;
            }
        },
        IN_QUOTED_STRING_ESCAPE {
            @Override
            Opcode step(ArrayScanner s, byte c) {
                // the escaped byte is taken verbatim, its meaning is resolved when the literal is unquoted
                s.state = IN_QUOTED_STRING;
                return Opcode.CONTINUE;
            }
        },
        IN_BARE_LITERAL {
            @Override
            Opcode step(ArrayScanner s, byte c) {
                if (c == s.delimiter || c == CLOSE) {
                    return END_VALUE.step(s, c);
                }
                if (isControl(c)) {
                    return s.error(c, "in bare literal");
                }
                return Opcode.CONTINUE;
            }
        },
        ERROR {
            @Override
            Opcode step(ArrayScanner s, byte c) {
                return Opcode.ERROR;
            }
        },
        REDO {
            @Override
            Opcode step(ArrayScanner s, byte c) {
                s.redo = false;
                s.state = s.redoState;
                return s.redoOpcode;
            }
        };

        abstract Opcode step(ArrayScanner s, byte c);
    }

    private final byte delimiter;

    private State state;
    private int depth;
    private boolean endTop;
    private ArraySyntaxException error;
    private long bytes;

    private boolean redo;
    private Opcode redoOpcode;
    private State redoState;

    public ArrayScanner() {
        this(DEFAULT_DELIMITER);
    }

    /**
     * Create a scanner for arrays whose elements are separated by the given delimiter.
     *
     * @param delimiter the element delimiter; PostgreSQL uses {@code ','} for every built-in type except {@code box}
     */
    public ArrayScanner(byte delimiter) {
        this.delimiter = delimiter;
        reset(0);
    }

    /**
     * Prepare the scanner for a new top-level value.
     *
     * @param startOffset the position in the input of the first byte that will be stepped, used in error messages
     */
    public void reset(long startOffset) {
        state = State.BEGIN_VALUE;
        depth = 0;
        endTop = false;
        error = null;
        bytes = startOffset;
        redo = false;
        redoOpcode = null;
        redoState = null;
    }

    /**
     * Consume the next byte of input.
     *
     * @param c the byte
     * @return the event the byte produced; never null
     */
    public Opcode step(byte c) {
        if (state == State.REDO) {
            return state.step(this, c);
        }
        bytes++;
        return state.step(this, c);
    }

    /**
     * Signal that there is no more input. A bare literal at the top level is complete at this point; anything else still
     * open is a syntax error.
     *
     * @return {@link Opcode#END} if the top-level value is complete, or {@link Opcode#ERROR} otherwise
     */
    public Opcode endOfInput() {
        if (state == State.REDO) {
            redo = false;
            state = redoState;
        }
        if (error != null) {
            return Opcode.ERROR;
        }
        if (endTop) {
            return Opcode.END;
        }
        if (state == State.IN_BARE_LITERAL && depth == 0) {
            state = State.END_TOP;
            endTop = true;
            return Opcode.END;
        }
        state.step(this, SPACE);
        if (endTop) {
            return Opcode.END;
        }
        if (error == null) {
            error = ArraySyntaxException.unexpectedEnd(bytes);
            state = State.ERROR;
        }
        return Opcode.ERROR;
    }

    /**
     * Push back the opcode of the last step, so that the next step reports it again. Only one step can be pushed back.
     *
     * @param opcode the opcode returned by the last step
     * @throws IllegalStateException if an earlier opcode has been pushed back and not yet replayed
     */
    public void undo(Opcode opcode) {
        if (redo) {
            throw new IllegalStateException("Invalid use of scanner: undo of " + opcode + " while " + redoOpcode + " is still pending");
        }
        redo = true;
        redoOpcode = opcode;
        redoState = state;
        state = State.REDO;
    }

    /**
     * Get the current nesting depth, which is the number of arrays that have been opened and not yet closed.
     *
     * @return the depth; never negative
     */
    public int depth() {
        return depth;
    }

    /**
     * Get the syntax error that put the scanner in its error state.
     *
     * @return the error, or null if the input has been well-formed so far
     */
    public ArraySyntaxException syntaxError() {
        return error;
    }

    private Opcode error(byte c, String context) {
        state = State.ERROR;
        error = ArraySyntaxException.invalidCharacter(c, context, bytes - 1);
        return Opcode.ERROR;
    }

    private static boolean isControl(byte c) {
        return c >= 0 && c < 0x20;
    }
}
