/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.config;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import io.pgcodec.annotation.Immutable;
import io.pgcodec.config.Field.ValidationOutput;

/**
 * An immutable set of codec settings. A {@link Configuration} instance can be obtained {@link #from(Properties) from
 * Properties} or a {@link #from(Map) map}, or built by first {@link #create() creating a builder}.
 * <p>
 * Values are always held as strings. The typed getters that accept a {@link Field} fall back to the field's default
 * value when the configuration has no value for it.
 */
@Immutable
public interface Configuration {

    /**
     * A builder of Configuration objects.
     */
    class Builder {
        private final Properties props = new Properties();

        protected Builder() {
        }

        public Builder with(String key, String value) {
            if (value == null) {
                props.remove(key);
            }
            else {
                props.setProperty(key, value);
            }
            return this;
        }

        public Builder with(Field field, String value) {
            return with(field.name(), value);
        }

        public Builder with(Field field, EnumeratedValue value) {
            return with(field.name(), value != null ? value.getValue() : null);
        }

        public Builder with(Field field, char value) {
            return with(field.name(), String.valueOf(value));
        }

        public Builder with(Field field, int value) {
            return with(field.name(), Integer.toString(value));
        }

        public Builder with(Field field, boolean value) {
            return with(field.name(), Boolean.toString(value));
        }

        public Configuration build() {
            return Configuration.from(props);
        }
    }

    /**
     * Create a new {@link Builder configuration builder}.
     *
     * @return the configuration builder
     */
    static Builder create() {
        return new Builder();
    }

    /**
     * Obtain an empty configuration.
     *
     * @return an empty configuration; never null
     */
    static Configuration empty() {
        return new Configuration() {
            @Override
            public Set<String> keys() {
                return Collections.emptySet();
            }

            @Override
            public String getString(String key) {
                return null;
            }

            @Override
            public String toString() {
                return "{}";
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied Properties object. The supplied {@link Properties} object is
     * copied so that the resulting Configuration cannot be modified.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Properties properties) {
        Properties props = new Properties();
        if (properties != null) {
            props.putAll(properties);
        }
        return new Configuration() {
            @Override
            public String getString(String key) {
                return props.getProperty(key);
            }

            @Override
            public Set<String> keys() {
                return props.stringPropertyNames();
            }

            @Override
            public String toString() {
                return props.toString();
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied map of string keys and object values. Collection values are
     * joined with commas.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Map<String, ?> properties) {
        Properties props = new Properties();
        if (properties != null) {
            properties.forEach((key, value) -> {
                if (value instanceof Collection<?>) {
                    props.setProperty(key, ((Collection<?>) value).stream().map(String::valueOf).collect(Collectors.joining(",")));
                }
                else if (value != null) {
                    props.setProperty(key, value.toString());
                }
            });
        }
        return from(props);
    }

    /**
     * Get the set of keys in this configuration.
     *
     * @return the set of keys; never null but possibly empty
     */
    Set<String> keys();

    /**
     * Get the string value associated with the given key.
     *
     * @param key the key for the configuration property
     * @return the value, or null if the key is null or there is no such key-value pair in the configuration
     */
    String getString(String key);

    /**
     * Determine whether this configuration contains a non-null value for the given field.
     *
     * @param field the field; may not be null
     * @return true if the configuration contains the key, or false otherwise
     */
    default boolean hasKey(Field field) {
        return getString(field.name()) != null;
    }

    /**
     * Get the string value associated with the given field, returning the field's default value if there is no such key-value
     * pair in this configuration.
     *
     * @param field the field; may not be null
     * @return the configuration's value for the field, or the field's {@link Field#defaultValue() default value} if there is no
     *         such key-value pair in the configuration
     */
    default String getString(Field field) {
        String value = getString(field.name());
        return value != null ? value : field.defaultValueAsString();
    }

    /**
     * Get the integer value associated with the given field, returning the field's default value if there is no such
     * key-value pair.
     *
     * @param field the field
     * @return the integer value
     * @throws NumberFormatException if the value cannot be parsed, or there is no value and the field has no default value
     */
    default int getInteger(Field field) {
        return Integer.parseInt(getString(field).trim());
    }

    /**
     * Get the boolean value associated with the given field, returning the field's default value if there is no such
     * key-value pair.
     *
     * @param field the field
     * @return the boolean value; {@code false} if there is neither a value nor a default
     */
    default boolean getBoolean(Field field) {
        String value = getString(field);
        return value != null && Boolean.parseBoolean(value.trim());
    }

    /**
     * Determine if this configuration is empty and has no properties.
     *
     * @return {@code true} if empty, or {@code false} otherwise
     */
    default boolean isEmpty() {
        return keys().isEmpty();
    }

    /**
     * Validate the supplied fields in this configuration. Extra fields not described by the supplied {@code fields} parameter
     * are not validated.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validate(Iterable<Field> fields, ValidationOutput problems) {
        boolean valid = true;
        for (Field field : fields) {
            if (!field.validate(this, problems)) {
                valid = false;
            }
        }
        return valid;
    }

    /**
     * Validate the supplied fields in this configuration, describing each problem as a single message.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem message; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        return validate(fields, (f, v, problem) -> {
            if (v == null) {
                problems.accept(Field.validationOutput(f, problem));
            }
            else {
                problems.accept("The '" + f.name() + "' value '" + v + "' is invalid: " + problem);
            }
        });
    }
}
