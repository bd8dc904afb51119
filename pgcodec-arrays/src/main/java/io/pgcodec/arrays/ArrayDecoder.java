/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.arrays;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;

import io.pgcodec.annotation.ThreadSafe;

/**
 * Decodes the text form of PostgreSQL arrays, such as {@code {1,2,3}} or {@code {{"a b",NULL},{c,d}}}, into Java
 * arrays, lists, {@link io.pgcodec.document.Value value trees} and scalars.
 * <p>
 * The Java type of the {@link Destination} decides how each literal is read: {@code 12} is a number for an
 * {@code int[]} and text for a {@code List<String>}. A decode always reads the whole input. A literal that does not fit
 * its destination is reported and skipped, while malformed input stops the decode at once; either way the
 * destination may be partially populated afterwards.
 * <p>
 * Instances hold only their configuration, and can be shared by any number of threads.
 */
@ThreadSafe
public class ArrayDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArrayDecoder.class);

    private final ArrayCodecConfig config;
    private final LiteralConverter converter;

    public ArrayDecoder() {
        this(ArrayCodecConfig.defaults());
    }

    public ArrayDecoder(ArrayCodecConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.converter = new LiteralConverter(config);
    }

    public ArrayCodecConfig config() {
        return config;
    }

    /**
     * Decode one array literal into the destination.
     *
     * @param data the UTF-8 text of exactly one array literal, optionally surrounded by spaces; may not be null
     * @param destination the destination; may not be null
     * @throws ArraySyntaxException if the input is malformed
     * @throws TypeMismatchException if a literal could not be stored in its destination; this is the first such
     *             literal, and every other element has still been decoded
     * @throws InvalidDestinationException if the destination is null or its type cannot be decoded into
     * @throws DecoderOutOfSyncException if the decoder lost track of the input
     */
    public void decode(byte[] data, Destination<?> destination) {
        ArrayDecodeException failure = run(data, destination, problem -> LOGGER.trace("Decoding problem: {}", problem.getMessage()));
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Decode one array literal into the destination, reporting every problem instead of throwing.
     *
     * @param data the UTF-8 text of exactly one array literal, optionally surrounded by spaces; may not be null
     * @param destination the destination; may not be null
     * @param problems receives each type mismatch as it is found, and the fatal error if decoding stops early
     * @return true if the input was decoded without any problem, or false otherwise
     * @throws InvalidDestinationException if the destination is null or its type cannot be decoded into
     */
    public boolean decode(byte[] data, Destination<?> destination, Consumer<ArrayDecodeException> problems) {
        Objects.requireNonNull(problems, "problems");
        return run(data, destination, problems) == null;
    }

    /**
     * Decode an array literal into a new value of the given type.
     *
     * @param text the array literal; may not be null
     * @param type the type of the result
     * @return the decoded value; null if the literal was the SQL null or the type does not hold anything for it
     * @see #decode(byte[], Destination)
     */
    public <T> T decode(String text, Class<T> type) {
        Destination<T> destination = Destination.of(type);
        decode(text.getBytes(StandardCharsets.UTF_8), destination);
        return destination.get();
    }

    /**
     * Decode an array literal into a new value of a generic type, such as {@code List<List<Integer>>}.
     *
     * @param text the array literal; may not be null
     * @param type the captured type of the result
     * @return the decoded value; null if the literal was the SQL null or the type does not hold anything for it
     * @see #decode(byte[], Destination)
     */
    public <T> T decode(String text, TypeReference<T> type) {
        Destination<T> destination = Destination.of(type);
        decode(text.getBytes(StandardCharsets.UTF_8), destination);
        return destination.get();
    }

    private ArrayDecodeException run(byte[] data, Destination<?> destination, Consumer<ArrayDecodeException> problems) {
        if (destination == null) {
            throw new InvalidDestinationException("Cannot decode into a null destination");
        }
        Objects.requireNonNull(data, "data");
        DestinationShape shape = ShapeInspector.shapeOf(destination.type());

        ArrayMaterializer materializer = new ArrayMaterializer(data, config, converter, problems);
        ArrayDecodeException failure = materializer.materialize(destination.slot(), shape);
        if (failure != null && LOGGER.isDebugEnabled()) {
            LOGGER.debug("Failed to decode {} bytes into {}: {}", data.length, destination, failure.getMessage());
        }
        return failure;
    }
}
