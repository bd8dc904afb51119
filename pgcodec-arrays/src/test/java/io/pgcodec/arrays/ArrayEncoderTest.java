/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.fasterxml.jackson.core.type.TypeReference;

import io.pgcodec.arrays.ArrayCodecConfig.BinaryHandlingMode;
import io.pgcodec.config.Configuration;
import io.pgcodec.document.Array;
import io.pgcodec.document.Value;

public class ArrayEncoderTest {

    private final ArrayEncoder encoder = new ArrayEncoder();
    private final ArrayDecoder decoder = new ArrayDecoder();

    @Test
    public void shouldEncodeScalars() {
        assertThat(encoder.encode(null)).isEqualTo("NULL");
        assertThat(encoder.encode(true)).isEqualTo("t");
        assertThat(encoder.encode(false)).isEqualTo("f");
        assertThat(encoder.encode(-12)).isEqualTo("-12");
        assertThat(encoder.encode(new BigDecimal("1.50"))).isEqualTo("1.50");
        assertThat(encoder.encode("a b")).isEqualTo("\"a b\"");
    }

    @Test
    public void shouldEscapeQuotesAndBackslashes() {
        assertThat(encoder.encode(Arrays.asList("say \"hi\"", "C:\\dir"))).isEqualTo("{\"say \\\"hi\\\"\",\"C:\\\\dir\"}");
    }

    @Test
    public void shouldEscapeControlCharacters() {
        assertThat(encoder.encode("a\nb")).isEqualTo("\"a\\u000ab\"");
    }

    @Test
    public void shouldEncodeNestedContainers() {
        assertThat(encoder.encode(new int[][]{ { 1, 2 }, {} })).isEqualTo("{{1,2},{}}");
        assertThat(encoder.encode(Arrays.asList(Optional.of(1), Optional.empty(), null))).isEqualTo("{1,NULL,NULL}");
        assertThat(encoder.encode(Collections.emptySet())).isEqualTo("{}");
        assertThat(encoder.encode(Array.create("a", true, null))).isEqualTo("{\"a\",t,NULL}");
        assertThat(encoder.encode(Value.create(Array.create().add(Array.create(1L))))).isEqualTo("{{1}}");
    }

    @Test
    public void shouldQuoteTextThatLooksLikeKeywords() {
        assertThat(encoder.encode(Arrays.asList("NULL", "t", "{}", ","))).isEqualTo("{\"NULL\",\"t\",\"{}\",\",\"}");
    }

    @Test
    public void shouldEncodeBinaryPerHandlingMode() {
        byte[] bytes = { 1, 2, -1 };
        assertThat(encoder.encode(Collections.singletonList(bytes))).isEqualTo("{\"AQL/\"}");

        ArrayEncoder hex = new ArrayEncoder(new ArrayCodecConfig(Configuration.create()
                .with(ArrayCodecConfig.BINARY_HANDLING_MODE, BinaryHandlingMode.HEX)
                .build()));
        assertThat(hex.encode(Collections.singletonList(bytes))).isEqualTo("{\"\\\\x0102ff\"}");

        ArrayEncoder urlSafe = new ArrayEncoder(new ArrayCodecConfig(Configuration.create()
                .with(ArrayCodecConfig.BINARY_HANDLING_MODE, BinaryHandlingMode.BASE64_URL_SAFE)
                .build()));
        assertThat(urlSafe.encode(Collections.singletonList(bytes))).isEqualTo("{\"AQL_\"}");
    }

    @Test
    public void shouldRoundTripUtf8BinaryAsRawBytes() {
        ArrayCodecConfig config = new ArrayCodecConfig(Configuration.create()
                .with(ArrayCodecConfig.BINARY_HANDLING_MODE, BinaryHandlingMode.BYTES)
                .build());
        byte[] bytes = "é A".getBytes(StandardCharsets.UTF_8);
        String encoded = new ArrayEncoder(config).encode(Collections.singletonList(bytes));
        assertThat(encoded).isEqualTo("{\"é A\"}");
        assertThat(new ArrayDecoder(config).decode(encoded, byte[][].class)).isDeepEqualTo(new byte[][]{ bytes });
    }

    @Test
    public void shouldRejectRawBytesThatAreNotUtf8() {
        ArrayEncoder raw = new ArrayEncoder(new ArrayCodecConfig(Configuration.create()
                .with(ArrayCodecConfig.BINARY_HANDLING_MODE, BinaryHandlingMode.BYTES)
                .build()));
        byte[] bytes = { (byte) 0xFF, 0x00, 0x41 };
        assertThatThrownBy(() -> raw.encode(Collections.singletonList(bytes)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasCauseInstanceOf(CharacterCodingException.class);
    }

    @Test
    public void shouldUseConfiguredDelimiter() {
        ArrayEncoder encoder = new ArrayEncoder(new ArrayCodecConfig(Configuration.create()
                .with(ArrayCodecConfig.ARRAY_DELIMITER, ';')
                .build()));
        assertThat(encoder.encode(Arrays.asList(1, 2))).isEqualTo("{1;2}");
    }

    @Test
    public void shouldRoundTripThroughDynamicDestination() {
        for (String literal : Arrays.asList("{}", "{1,2.5,-3}", "{t,f,NULL}", "{{1,2},{3,4}}", "{\"a b\",\"\\\"\",\"\\\\\",\"{}\"}",
                "{{},{{}},{NULL}}", "{\"\u00e9\",\"NULL\"}")) {
            Value value = decoder.decode(literal, Value.class);
            String encoded = encoder.encode(value);
            assertThat(decoder.decode(encoded, Value.class)).as(literal).isEqualTo(value);
        }
    }

    @Test
    public void shouldRoundTripTypedValues() {
        List<List<String>> strings = Arrays.asList(Arrays.asList("x", "", "a\\b\"c"), Collections.emptyList());
        assertThat(decoder.decode(encoder.encode(strings), new TypeReference<List<List<String>>>() {
        })).isEqualTo(strings);

        byte[][] binary = { { 0, 1 }, { -128, 127 } };
        assertThat(decoder.decode(encoder.encode(binary), byte[][].class)).isDeepEqualTo(binary);

        double[] doubles = { 0.1, -1e300, Double.NaN, Double.NEGATIVE_INFINITY };
        assertThat(decoder.decode(encoder.encode(doubles), double[].class)).containsExactly(doubles);
    }
}
