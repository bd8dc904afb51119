/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;

import org.junit.Test;

public class QuotedLiteralsTest {

    @Test
    public void shouldReturnPlainContent() {
        assertThat(unquote("\"hello world\"")).isEqualTo("hello world");
        assertThat(unquote("\"\"")).isEmpty();
    }

    @Test
    public void shouldReturnViewOfPlainContent() {
        byte[] data = "{\"abc\"}".getBytes(StandardCharsets.UTF_8);
        LiteralBytes content = QuotedLiterals.unquote(new LiteralBytes(data, 1, 5));
        assertThat(content).isEqualTo(LiteralBytes.of("abc"));
        data[2] = 'x';
        assertThat(content.toString()).isEqualTo("xbc");
    }

    @Test
    public void shouldRemoveEscapingBackslashes() {
        assertThat(unquote("\"hello\\\\world\"")).isEqualTo("hello\\world");
        assertThat(unquote("\"hello\\{world\"")).isEqualTo("hello{world");
        assertThat(unquote("\"hello\\}world\"")).isEqualTo("hello}world");
        assertThat(unquote("\"say \\\"hi\\\"\"")).isEqualTo("say \"hi\"");
        assertThat(unquote("\"\\n\"")).isEqualTo("n");
    }

    @Test
    public void shouldDecodeUnicodeEscapes() {
        assertThat(unquote("\"caf\\u00e9\"")).isEqualTo("caf\u00e9");
        assertThat(unquote("\"\\u20AC1\"")).isEqualTo("\u20ac1");
        assertThat(unquote("\"\\u000a\"")).isEqualTo("\n");
    }

    @Test
    public void shouldCombineSurrogatePairs() {
        assertThat(unquote("\"\\ud83d\\ude00\"")).isEqualTo("\ud83d\ude00");
    }

    @Test
    public void shouldReplaceLoneSurrogates() {
        assertThat(unquote("\"a\\ud83db\"")).isEqualTo("a\ufffdb");
        assertThat(unquote("\"\\ude00\"")).isEqualTo("\ufffd");
        assertThat(unquote("\"\\ud83d\\u0041\"")).isEqualTo("\ufffdA");
    }

    @Test
    public void shouldCopyNonAsciiBytesVerbatim() {
        assertThat(unquote("\"gr\u00fc\u00dfe \\\"x\\\"\"")).isEqualTo("gr\u00fc\u00dfe \"x\"");
        assertThat(unquote("\"\u65e5\u672c\"")).isEqualTo("\u65e5\u672c");
    }

    @Test
    public void shouldRejectMalformedLiterals() {
        assertThat(QuotedLiterals.unquote(LiteralBytes.of("abc"))).isNull();
        assertThat(QuotedLiterals.unquote(LiteralBytes.of("\""))).isNull();
        assertThat(QuotedLiterals.unquote(LiteralBytes.of("\"abc"))).isNull();
        assertThat(QuotedLiterals.unquote(LiteralBytes.of("\"a\"b\""))).isNull();
        assertThat(QuotedLiterals.unquote(LiteralBytes.of("\"a\nb\""))).isNull();
        assertThat(QuotedLiterals.unquote(LiteralBytes.of("\"a\\\""))).isNull();
        assertThat(QuotedLiterals.unquote(LiteralBytes.of("\"\\u12g4\""))).isNull();
        assertThat(QuotedLiterals.unquote(LiteralBytes.of("\"\\u12\""))).isNull();
    }

    private static String unquote(String quoted) {
        LiteralBytes content = QuotedLiterals.unquote(LiteralBytes.of(quoted));
        assertThat(content).isNotNull();
        return content.toString();
    }
}
