/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class ArrayScannerTest {

    private ArrayScanner scanner;

    @Before
    public void beforeEach() {
        scanner = new ArrayScanner();
    }

    @Test
    public void shouldReportEventsForFlatArray() {
        assertThat(scan("{1,ab}")).containsExactly(
                Opcode.BEGIN_ARRAY,
                Opcode.BEGIN_LITERAL,
                Opcode.ARRAY_VALUE,
                Opcode.BEGIN_LITERAL, Opcode.CONTINUE,
                Opcode.END_ARRAY,
                Opcode.END);
        assertThat(scanner.depth()).isZero();
        assertThat(scanner.syntaxError()).isNull();
    }

    @Test
    public void shouldReportEventsForEmptyArray() {
        assertThat(scan("{}")).containsExactly(Opcode.BEGIN_ARRAY, Opcode.END_ARRAY, Opcode.END);
    }

    @Test
    public void shouldTrackNestingDepth() {
        scanner.step((byte) '{');
        scanner.step((byte) '{');
        assertThat(scanner.depth()).isEqualTo(2);
        scanner.step((byte) '}');
        assertThat(scanner.depth()).isEqualTo(1);
        assertThat(scanner.step((byte) '}')).isEqualTo(Opcode.END_ARRAY);
        assertThat(scanner.depth()).isZero();
        assertThat(scanner.endOfInput()).isEqualTo(Opcode.END);
    }

    @Test
    public void shouldSkipSpacesAroundElements() {
        assertThat(scan(" { x , y } ")).containsExactly(
                Opcode.SKIP_SPACE,
                Opcode.BEGIN_ARRAY,
                Opcode.SKIP_SPACE,
                Opcode.BEGIN_LITERAL, Opcode.CONTINUE,
                Opcode.ARRAY_VALUE,
                Opcode.SKIP_SPACE,
                Opcode.BEGIN_LITERAL, Opcode.CONTINUE,
                Opcode.END_ARRAY,
                Opcode.END,
                Opcode.END);
    }

    @Test
    public void shouldConsumeEscapedBytesInsideQuotes() {
        assertThat(scan("{\"a\\\"}\"}")).containsExactly(
                Opcode.BEGIN_ARRAY,
                Opcode.BEGIN_LITERAL,
                Opcode.CONTINUE, Opcode.CONTINUE, Opcode.CONTINUE, Opcode.CONTINUE, Opcode.CONTINUE,
                Opcode.END_ARRAY,
                Opcode.END);
    }

    @Test
    public void shouldCompleteTopLevelBareLiteralAtEndOfInput() {
        assertThat(scan("123")).containsExactly(Opcode.BEGIN_LITERAL, Opcode.CONTINUE, Opcode.CONTINUE, Opcode.END);
    }

    @Test
    public void shouldCompleteTopLevelQuotedLiteralAtEndOfInput() {
        assertThat(scan("\"a\"")).containsExactly(Opcode.BEGIN_LITERAL, Opcode.CONTINUE, Opcode.CONTINUE, Opcode.END);
    }

    @Test
    public void shouldUseConfiguredDelimiter() {
        scanner = new ArrayScanner((byte) ';');
        assertThat(scan("{a;b,c}")).containsExactly(
                Opcode.BEGIN_ARRAY,
                Opcode.BEGIN_LITERAL,
                Opcode.ARRAY_VALUE,
                Opcode.BEGIN_LITERAL, Opcode.CONTINUE, Opcode.CONTINUE,
                Opcode.END_ARRAY,
                Opcode.END);
    }

    @Test
    public void shouldRejectMissingElement() {
        assertThat(scan("{1,}")).endsWith(Opcode.ERROR);
        ArraySyntaxException error = scanner.syntaxError();
        assertThat(error.getOffset()).isEqualTo(3);
        assertThat(error.getOffendingByte()).isEqualTo('}');
        assertThat(error.getContext()).isEqualTo("looking for beginning of value");
        assertThat(error.getMessage()).isEqualTo("invalid character '}' looking for beginning of value at offset 3");
    }

    @Test
    public void shouldRejectLeadingDelimiter() {
        assertThat(scan("{,1}")).endsWith(Opcode.ERROR);
        assertThat(scanner.syntaxError().getOffset()).isEqualTo(1);
    }

    @Test
    public void shouldRejectGarbageAfterElement() {
        assertThat(scan("{\"a\"b}")).endsWith(Opcode.ERROR);
        assertThat(scanner.syntaxError().getContext()).isEqualTo("after array element");
        assertThat(scanner.syntaxError().getOffendingByte()).isEqualTo('b');
    }

    @Test
    public void shouldRejectTrailingData() {
        assertThat(scan("{1} x")).endsWith(Opcode.ERROR);
        assertThat(scanner.syntaxError().getContext()).isEqualTo("after top-level value");
        assertThat(scanner.syntaxError().getOffset()).isEqualTo(4);
    }

    @Test
    public void shouldRejectControlCharacters() {
        assertThat(scan("{\"a\nb\"}")).endsWith(Opcode.ERROR);
        assertThat(scanner.syntaxError().getContext()).isEqualTo("in string literal");
        assertThat(scanner.syntaxError().getMessage()).startsWith("invalid character 0x0a");

        scanner.reset(0);
        assertThat(scan("{a\tb}")).endsWith(Opcode.ERROR);
        assertThat(scanner.syntaxError().getContext()).isEqualTo("in bare literal");
    }

    @Test
    public void shouldRejectUnterminatedInput() {
        assertThat(scan("{1,{2}")).endsWith(Opcode.ERROR);
        assertThat(scanner.syntaxError().getMessage()).isEqualTo("unexpected end of input at offset 6");
        assertThat(scanner.syntaxError().getOffendingByte()).isEqualTo(-1);

        scanner.reset(0);
        assertThat(scan("{\"abc")).endsWith(Opcode.ERROR);

        scanner.reset(0);
        assertThat(scan("")).containsExactly(Opcode.ERROR);
    }

    @Test
    public void shouldStayInErrorState() {
        scanner.step((byte) '}');
        assertThat(scanner.step((byte) '{')).isEqualTo(Opcode.ERROR);
        assertThat(scanner.endOfInput()).isEqualTo(Opcode.ERROR);
        assertThat(scanner.syntaxError().getOffset()).isZero();
    }

    @Test
    public void shouldReplayUndoneOpcode() {
        scanner.step((byte) '{');
        scanner.step((byte) 'a');
        Opcode op = scanner.step((byte) ',');
        assertThat(op).isEqualTo(Opcode.ARRAY_VALUE);
        scanner.undo(op);
        assertThat(scanner.step((byte) ',')).isEqualTo(Opcode.ARRAY_VALUE);
        assertThat(scanner.step((byte) 'b')).isEqualTo(Opcode.BEGIN_LITERAL);
    }

    @Test
    public void shouldNotCountReplayedBytes() {
        scanner.step((byte) '{');
        Opcode op = scanner.step((byte) 'a');
        scanner.undo(op);
        scanner.step((byte) 'a');
        assertThat(scanner.step((byte) '\n')).isEqualTo(Opcode.ERROR);
        assertThat(scanner.syntaxError().getOffset()).isEqualTo(2);
    }

    @Test
    public void shouldRejectSecondPendingUndo() {
        scanner.step((byte) '{');
        scanner.undo(Opcode.BEGIN_ARRAY);
        assertThatThrownBy(() -> scanner.undo(Opcode.BEGIN_ARRAY)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldReportOffsetsRelativeToStartOffset() {
        scanner.reset(10);
        scanner.step((byte) '{');
        scanner.step((byte) '}');
        assertThat(scanner.step((byte) '}')).isEqualTo(Opcode.ERROR);
        assertThat(scanner.syntaxError().getOffset()).isEqualTo(12);
    }

    @Test
    public void shouldBeReusableAfterReset() {
        assertThat(scan("{")).endsWith(Opcode.ERROR);
        scanner.reset(0);
        assertThat(scan("{}")).containsExactly(Opcode.BEGIN_ARRAY, Opcode.END_ARRAY, Opcode.END);
        assertThat(scanner.syntaxError()).isNull();
    }

    private List<Opcode> scan(String text) {
        List<Opcode> opcodes = new ArrayList<>();
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            Opcode op = scanner.step(b);
            opcodes.add(op);
            if (op == Opcode.ERROR) {
                return opcodes;
            }
        }
        opcodes.add(scanner.endOfInput());
        return opcodes;
    }
}
