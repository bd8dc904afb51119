/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.pgcodec.annotation.Immutable;

/**
 * An immutable definition of a field that may appear within a {@link Configuration} instance.
 */
@Immutable
public final class Field {

    /**
     * Create a set of fields.
     * @param fields the fields to include
     * @return the field set; never null
     */
    public static Set setOf(Field... fields) {
        return new Set(Arrays.asList(fields));
    }

    /**
     * A set of fields, kept in the order in which they were supplied.
     */
    @Immutable
    public static final class Set implements Iterable<Field> {
        private final Map<String, Field> fieldsByName;

        private Set(Iterable<Field> fields) {
            Map<String, Field> byName = new LinkedHashMap<>();
            fields.forEach(field -> {
                if (field != null) {
                    byName.put(field.name(), field);
                }
            });
            this.fieldsByName = Collections.unmodifiableMap(byName);
        }

        /**
         * Get the field with the given name.
         * @param name the name of the field
         * @return the field, or {@code null} if there is no field with the given name
         */
        public Field fieldWithName(String name) {
            return fieldsByName.get(name);
        }

        @Override
        public Iterator<Field> iterator() {
            return fieldsByName.values().iterator();
        }

        /**
         * Get the fields in this set as an array.
         * @return the array of fields; never null
         */
        public Field[] asArray() {
            return fieldsByName.values().toArray(new Field[0]);
        }

        /**
         * Get a new set that contains the fields in this set and those supplied.
         * @param fields the additional fields
         * @return the new set; never null
         */
        public Set with(Field... fields) {
            List<Field> all = new ArrayList<>(fieldsByName.values());
            all.addAll(Arrays.asList(fields));
            return new Set(all);
        }

        public java.util.Set<String> allFieldNames() {
            return fieldsByName.keySet();
        }
    }

    /**
     * A functional interface that accepts validation results.
     */
    @FunctionalInterface
    public interface ValidationOutput {
        /**
         * Accept a problem with the given value for the field.
         * @param field the field with the value; may not be null
         * @param value the value that is not valid
         * @param problemMessage the message describing the problem; may not be null
         */
        void accept(Field field, Object value, String problemMessage);
    }

    /**
     * A functional interface that can be used to validate field values.
     */
    @FunctionalInterface
    public interface Validator {

        /**
         * Validate the supplied value for the field, and report any problems to the designated consumer.
         *
         * @param config the configuration containing the field to be validated; may not be null
         * @param field the {@link Field} being validated; never null
         * @param problems the consumer to be called with each problem; never null
         * @return the number of problems that were found, or 0 if the value is valid
         */
        int validate(Configuration config, Field field, ValidationOutput problems);

        /**
         * Obtain a new {@link Validator} object that validates using this validator and the supplied validator.
         *
         * @param other the validation function to call after this
         * @return the new validator, or this validator if {@code other} is {@code null} or equal to {@code this}
         */
        default Validator and(Validator other) {
            if (other == null || other == this) {
                return this;
            }
            return (config, field, problems) -> validate(config, field, problems) + other.validate(config, field, problems);
        }
    }

    /**
     * Create an immutable {@link Field} instance with the given property name.
     * @param name the name of the field; may not be null
     * @return the field; never null
     */
    public static Field create(String name) {
        return new Field(name, null, null, null, null, null, null, null, Collections.emptySet());
    }

    /**
     * Create an immutable {@link Field} instance with the given property name, display name and description.
     * @param name the name of the field; may not be null
     * @param displayName the display name of the field; may be null
     * @param description the description; may be null
     * @return the field; never null
     */
    public static Field create(String name, String displayName, String description) {
        return create(name).withDisplayName(displayName).withDescription(description);
    }

    /**
     * Add the given fields to a configuration definition as one group.
     * @param configDef the definition of the configuration; may be null if none of the fields are to be added
     * @param groupName the name of the group; may be null
     * @param fields the fields to be added as a group to the definition of the configuration
     * @return the updated configuration; may be null only if {@code configDef} was null
     */
    public static ConfigDef group(ConfigDef configDef, String groupName, Field... fields) {
        if (configDef != null) {
            for (int i = 0; i != fields.length; ++i) {
                Field f = fields[i];
                ConfigDef.Validator validator = f.allowedValues().isEmpty() ? null
                        : ConfigDef.ValidString.in(f.allowedValues().toArray(new String[0]));
                configDef.define(f.name(), f.type(), f.defaultValue(), validator, f.importance(), f.description(),
                        groupName, groupName != null ? i + 1 : 1, f.width(), f.displayName(), Collections.emptyList(), null);
            }
        }
        return configDef;
    }

    private final String name;
    private final String displayName;
    private final String desc;
    private final Supplier<Object> defaultValueGenerator;
    private final Validator validator;
    private final Width width;
    private final Type type;
    private final Importance importance;
    private final java.util.Set<String> allowedValues;

    private Field(String name, String displayName, Type type, Width width, String description, Importance importance,
                  Supplier<Object> defaultValueGenerator, Validator validator, java.util.Set<String> allowedValues) {
        Objects.requireNonNull(name, "The field name is required");
        this.name = name;
        this.displayName = displayName;
        this.desc = description;
        this.defaultValueGenerator = defaultValueGenerator != null ? defaultValueGenerator : () -> null;
        this.validator = validator;
        this.type = type != null ? type : Type.STRING;
        this.width = width != null ? width : Width.NONE;
        this.importance = importance != null ? importance : Importance.MEDIUM;
        this.allowedValues = allowedValues;
    }

    /**
     * Get the name of the field.
     * @return the name; never null
     */
    public String name() {
        return name;
    }

    /**
     * Get the default value of the field.
     * @return the default value, or {@code null} if there is no default value
     */
    public Object defaultValue() {
        return defaultValueGenerator.get();
    }

    /**
     * Get the string representation of the default value of the field.
     * @return the default value, or {@code null} if there is no default value
     */
    public String defaultValueAsString() {
        Object defaultValue = defaultValue();
        return defaultValue != null ? defaultValue.toString() : null;
    }

    public String description() {
        return desc;
    }

    public String displayName() {
        return displayName;
    }

    public Width width() {
        return width;
    }

    public Type type() {
        return type;
    }

    public Importance importance() {
        return importance;
    }

    /**
     * Get the validator for this field.
     * @return the validator; may be null if there is no validator
     */
    public Validator validator() {
        return validator;
    }

    /**
     * Get the allowed values for this field.
     * @return the allowed values in lower case; never null but empty if any value is allowed
     */
    public java.util.Set<String> allowedValues() {
        return allowedValues;
    }

    /**
     * Validate the supplied value for this field, and report any problems to the designated consumer.
     * @param config the field values keyed by their name; may not be null
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    public boolean validate(Configuration config, ValidationOutput problems) {
        Validator typeValidator = validatorForType(type);
        int errors = 0;
        if (typeValidator != null) {
            errors += typeValidator.validate(config, this, problems);
        }
        if (validator != null) {
            errors += validator.validate(config, this, problems);
        }
        return errors == 0;
    }

    public Field withDescription(String description) {
        return new Field(name, displayName, type, width, description, importance, defaultValueGenerator, validator, allowedValues);
    }

    public Field withDisplayName(String displayName) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator, allowedValues);
    }

    public Field withWidth(Width width) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator, allowedValues);
    }

    public Field withType(Type type) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator, allowedValues);
    }

    public Field withImportance(Importance importance) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator, allowedValues);
    }

    /**
     * Create and return a new Field instance that is a copy of this field but with the given default value.
     * @param defaultValue the new default value for the new field
     * @return the new field; never null
     */
    public Field withDefault(String defaultValue) {
        return new Field(name, displayName, type, width, desc, importance, () -> defaultValue, validator, allowedValues);
    }

    /**
     * Create and return a new Field instance that is a copy of this field but with the given default value.
     * @param defaultValue the new default value for the new field
     * @return the new field; never null
     */
    public Field withDefault(int defaultValue) {
        return new Field(name, displayName, type, width, desc, importance, () -> defaultValue, validator, allowedValues);
    }

    /**
     * Create and return a new Field instance that is a copy of this field but with the given default value.
     * @param defaultValue the new default value for the new field
     * @return the new field; never null
     */
    public Field withDefault(boolean defaultValue) {
        return new Field(name, displayName, type, width, desc, importance, () -> defaultValue, validator, allowedValues);
    }

    /**
     * Create and return a new Field instance that is a copy of this field but has a {@link #withType(Type) type} of
     * {@link Type#STRING}, a validator that only accepts the {@link EnumeratedValue#getValue() configured spelling}
     * of the enumeration's constants, and the given default.
     * @param enumType the enumeration type for the field
     * @param defaultOption the default enumeration value; may be null
     * @return the new field; never null
     */
    public <T extends Enum<T> & EnumeratedValue> Field withEnum(Class<T> enumType, T defaultOption) {
        EnumValidator<T> enumValidator = new EnumValidator<>(enumType);
        Field result = new Field(name, displayName, Type.STRING, width, desc, importance, defaultValueGenerator,
                validator, enumValidator.literals()).withValidation(enumValidator);
        if (defaultOption != null) {
            result = result.withDefault(defaultOption.getValue());
        }
        return result;
    }

    /**
     * Create and return a new Field instance that is a copy of this field but that in addition to {@link #validator() existing
     * validation} the supplied validation function(s) are also used.
     *
     * @param validators the additional validation function(s); may be null
     * @return the new field; never null
     */
    public Field withValidation(Validator... validators) {
        Validator actualValidator = validator;
        for (Validator validator : validators) {
            if (validator != null) {
                actualValidator = validator.and(actualValidator);
            }
        }
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, actualValidator, allowedValues);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Field) {
            Field that = (Field) obj;
            return this.name().equals(that.name());
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }

    /**
     * Validates that a value is the configured spelling of one of an enumeration's constants, ignoring case and
     * surrounding whitespace.
     */
    public static class EnumValidator<T extends Enum<T> & EnumeratedValue> implements Validator {

        private final java.util.Set<String> literals;
        private final String literalsStr;

        public EnumValidator(Class<T> enumType) {
            java.util.Set<String> values = Arrays.stream(enumType.getEnumConstants())
                    .map(EnumeratedValue::getValue)
                    .map(String::toLowerCase)
                    .collect(Collectors.toCollection(java.util.LinkedHashSet::new));
            this.literals = Collections.unmodifiableSet(values);
            this.literalsStr = String.join(", ", literals);
        }

        public java.util.Set<String> literals() {
            return literals;
        }

        @Override
        public int validate(Configuration config, Field field, ValidationOutput problems) {
            String value = config.getString(field);
            if (value == null || !literals.contains(value.trim().toLowerCase())) {
                problems.accept(field, value, "Value must be one of " + literalsStr);
                return 1;
            }
            return 0;
        }
    }

    public static Validator validatorForType(Type type) {
        switch (type) {
            case BOOLEAN:
                return Field::isBoolean;
            case INT:
                return Field::isInteger;
            default:
                break;
        }
        return null;
    }

    public static int isBoolean(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null ||
                value.trim().equalsIgnoreCase(Boolean.TRUE.toString()) ||
                value.trim().equalsIgnoreCase(Boolean.FALSE.toString())) {
            return 0;
        }
        problems.accept(field, value, "Either 'true' or 'false' is expected");
        return 1;
    }

    public static int isInteger(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            problems.accept(field, value, "An integer is expected");
            return 1;
        }
        return 0;
    }

    public static String validationOutput(Field field, String problem) {
        return String.format("The '%s' value is invalid: %s", field.name(), problem);
    }
}
