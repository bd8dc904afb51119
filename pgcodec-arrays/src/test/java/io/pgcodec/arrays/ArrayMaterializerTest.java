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

import org.junit.Test;

import ch.qos.logback.classic.Level;

import io.pgcodec.junit.logging.LogInterceptor;

public class ArrayMaterializerTest {

    @Test
    public void shouldGrowByHalfWithMinimumOfFour() {
        assertThat(ArrayMaterializer.nextCapacity(0)).isEqualTo(4);
        assertThat(ArrayMaterializer.nextCapacity(1)).isEqualTo(4);
        assertThat(ArrayMaterializer.nextCapacity(4)).isEqualTo(6);
        assertThat(ArrayMaterializer.nextCapacity(6)).isEqualTo(9);
        assertThat(ArrayMaterializer.nextCapacity(1000)).isEqualTo(1500);
    }

    @Test
    public void shouldClampGrowthToMaximumCapacity() {
        assertThat(ArrayMaterializer.nextCapacity(1_000_000_000)).isEqualTo(1_500_000_000);
        assertThat(ArrayMaterializer.nextCapacity(1_500_000_000)).isEqualTo(ArrayMaterializer.MAX_CAPACITY);
        assertThat(ArrayMaterializer.nextCapacity(ArrayMaterializer.MAX_CAPACITY - 1)).isEqualTo(ArrayMaterializer.MAX_CAPACITY);
        assertThatThrownBy(() -> ArrayMaterializer.nextCapacity(ArrayMaterializer.MAX_CAPACITY))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldReallocateLogarithmicallyOften() {
        for (int n : new int[]{ 1, 10, 1000, 1_000_000 }) {
            int capacity = 0;
            int reallocations = 0;
            for (int i = 0; i != n; ++i) {
                if (i >= capacity) {
                    capacity = ArrayMaterializer.nextCapacity(capacity);
                    reallocations++;
                }
            }
            assertThat(capacity).isGreaterThanOrEqualTo(n);
            assertThat(reallocations).isLessThanOrEqualTo(1 + (int) (2 * Math.log(n) / Math.log(1.5)));
        }
    }

    @Test
    public void shouldReportFatalErrorBeforeTypeMismatch() {
        List<ArrayDecodeException> problems = new ArrayList<>();
        Destination<int[]> destination = Destination.of(int[].class);
        ArrayMaterializer materializer = new ArrayMaterializer(bytes("{a,2"), ArrayCodecConfig.defaults(),
                new LiteralConverter(ArrayCodecConfig.defaults()), problems::add);

        ArrayDecodeException failure = materializer.materialize(destination.slot(), ShapeInspector.shapeOf(int[].class));

        assertThat(failure).isInstanceOf(ArraySyntaxException.class).hasMessage("unexpected end of input at offset 4");
        assertThat(problems).hasSize(2);
        assertThat(problems.get(1)).isSameAs(failure);
    }

    @Test
    public void shouldReturnFirstTypeMismatch() {
        List<ArrayDecodeException> problems = new ArrayList<>();
        Destination<long[]> destination = Destination.of(long[].class);
        ArrayMaterializer materializer = new ArrayMaterializer(bytes("{a,b}"), ArrayCodecConfig.defaults(),
                new LiteralConverter(ArrayCodecConfig.defaults()), problems::add);

        ArrayDecodeException failure = materializer.materialize(destination.slot(), ShapeInspector.shapeOf(long[].class));

        assertThat(failure).isSameAs(problems.get(0));
        assertThat(((TypeMismatchException) failure).getOffset()).isEqualTo(1);
        assertThat(destination.get()).containsExactly(0L, 0L);
    }

    @Test
    public void shouldTraceDiscardedElements() {
        LogInterceptor logInterceptor = new LogInterceptor(ArrayMaterializer.class);
        Level previous = logInterceptor.setLoggerLevel(ArrayMaterializer.class, Level.TRACE);
        try {
            Destination<String[]> destination = Destination.of(String[].class, new String[1]);
            new ArrayDecoder().decode(bytes("{a,b,c}"), destination);
            assertThat(destination.get()).containsExactly("a");
            assertThat(logInterceptor.containsMessage("Discarding elements beyond the 1 elements of the java.lang.String[] destination")).isTrue();
            assertThat(logInterceptor.countOccurrences("Discarding elements")).isEqualTo(1);
        }
        finally {
            logInterceptor.setLoggerLevel(ArrayMaterializer.class, previous);
        }
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
