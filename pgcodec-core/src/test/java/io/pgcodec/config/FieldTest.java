/*
 * Copyright PgCodec Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgcodec.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;
import org.junit.Test;

public class FieldTest {

    private enum Flavor implements EnumeratedValue {
        SWEET("sweet"),
        SOUR("sour");

        private final String value;

        Flavor(String value) {
            this.value = value;
        }

        @Override
        public String getValue() {
            return value;
        }
    }

    private static final Field FLAVOR = Field.create("flavor")
            .withDisplayName("Flavor")
            .withEnum(Flavor.class, Flavor.SWEET)
            .withImportance(Importance.LOW)
            .withDescription("a description");

    private static final Field SIZE = Field.create("size", "Size", "the size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withDefault(3);

    @Test
    public void shouldHaveDescriptionAndDefault() {
        Field field = Field.create("new.field")
                .withDescription("a description")
                .withDefault("default");

        assertThat(field.description()).isEqualTo("a description");
        assertThat(field.defaultValue()).isEqualTo("default");
        assertThat(field.type()).isEqualTo(Type.STRING);
        assertThat(field.importance()).isEqualTo(Importance.MEDIUM);
    }

    @Test
    public void shouldUseEnumeratedValuesAsAllowedValues() {
        assertThat(FLAVOR.allowedValues()).containsExactly("sweet", "sour");
        assertThat(FLAVOR.defaultValueAsString()).isEqualTo("sweet");
        assertThat(FLAVOR.type()).isEqualTo(Type.STRING);
    }

    @Test
    public void shouldAcceptEnumeratedValueIgnoringCase() {
        Configuration config = Configuration.create().with(FLAVOR, " SOUR ").build();
        assertThat(FLAVOR.validate(config, (field, value, problem) -> {
            throw new AssertionError(problem);
        })).isTrue();
    }

    @Test
    public void shouldRejectUnknownEnumeratedValue() {
        Configuration config = Configuration.create().with(FLAVOR, "bitter").build();
        List<String> problems = new ArrayList<>();
        assertThat(FLAVOR.validate(config, (field, value, problem) -> problems.add(problem))).isFalse();
        assertThat(problems).containsExactly("Value must be one of sweet, sour");
    }

    @Test
    public void shouldValidateIntegerType() {
        assertThat(Configuration.create().with(SIZE, "12").build().validate(Field.setOf(SIZE), (f, v, p) -> {
        })).isTrue();

        List<String> problems = new ArrayList<>();
        Configuration config = Configuration.create().with("size", "twelve").build();
        assertThat(config.validateAndRecord(Field.setOf(SIZE), problems::add)).isFalse();
        assertThat(problems).containsExactly("The 'size' value 'twelve' is invalid: An integer is expected");
    }

    @Test
    public void shouldCombineValidators() {
        Field field = Field.create("even")
                .withType(Type.INT)
                .withValidation((config, f, problems) -> {
                    if (config.getInteger(f) % 2 != 0) {
                        problems.accept(f, config.getString(f), "An even number is expected");
                        return 1;
                    }
                    return 0;
                });
        List<String> problems = new ArrayList<>();
        assertThat(field.validate(Configuration.create().with(field, 3).build(), (f, v, p) -> problems.add(p))).isFalse();
        assertThat(problems).containsExactly("An even number is expected");
    }

    @Test
    public void shouldDefineGroupInConfigDef() {
        ConfigDef configDef = Field.group(new ConfigDef(), "Things", FLAVOR, SIZE);

        assertThat(configDef.names()).containsOnly("flavor", "size");
        ConfigDef.ConfigKey flavor = configDef.configKeys().get("flavor");
        assertThat(flavor.group).isEqualTo("Things");
        assertThat(flavor.orderInGroup).isEqualTo(1);
        assertThat(flavor.defaultValue).isEqualTo("sweet");
        assertThat(flavor.displayName).isEqualTo("Flavor");
        ConfigDef.ConfigKey size = configDef.configKeys().get("size");
        assertThat(size.orderInGroup).isEqualTo(2);
        assertThat(size.type).isEqualTo(Type.INT);
        assertThat(size.defaultValue).isEqualTo(3);
    }

    @Test
    public void shouldFindFieldsInSet() {
        Field.Set fields = Field.setOf(FLAVOR).with(SIZE);
        assertThat(fields.fieldWithName("size")).isSameAs(SIZE);
        assertThat(fields.fieldWithName("colour")).isNull();
        assertThat(fields.allFieldNames()).containsOnly("flavor", "size");
        assertThat(fields.asArray()).containsExactly(FLAVOR, SIZE);
    }
}
