/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.config;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongPredicate;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.walcapture.annotation.Immutable;

/**
 * The definition of one configuration key: its name, default, type and validation, plus the display attributes
 * exported to a Kafka {@link ConfigDef}. Every {@code with} method returns a modified copy.
 */
@Immutable
public final class Field {

    /**
     * @return the fields in the given order, the last one winning for a repeated name; null entries are skipped
     */
    public static Set setOf(Field... fields) {
        final Map<String, Field> byName = new LinkedHashMap<>();
        for (Field field : fields) {
            if (field != null) {
                byName.put(field.name, field);
            }
        }
        return new Set(byName);
    }

    /**
     * Fields in definition order, unique by name.
     */
    @Immutable
    public static final class Set implements Iterable<Field> {
        private final Map<String, Field> byName;

        private Set(Map<String, Field> byName) {
            this.byName = Collections.unmodifiableMap(byName);
        }

        @Override
        public Iterator<Field> iterator() {
            return byName.values().iterator();
        }

        public Field[] asArray() {
            return byName.values().toArray(new Field[0]);
        }
    }

    /**
     * Receives the problems found while validating.
     */
    @FunctionalInterface
    public interface ValidationOutput {
        void accept(Field field, Object value, String problemMessage);
    }

    /**
     * Checks the value of a field within a configuration.
     */
    @FunctionalInterface
    public interface Validator {

        /**
         * @return the number of problems reported to {@code problems}, 0 for a valid value
         */
        int validate(Configuration config, Field field, ValidationOutput problems);
    }

    public static Field create(String name) {
        return new Field(name, name, null, Type.STRING, Width.NONE, Importance.MEDIUM, null, null);
    }

    /**
     * Defines the fields in the given group of the Kafka definition, numbered in argument order.
     *
     * @return the definition, for chaining
     */
    public static ConfigDef group(ConfigDef configDef, String groupName, Field... fields) {
        int order = 0;
        for (Field f : fields) {
            configDef.define(f.name, f.type, f.defaultValue, null, f.importance, f.description, groupName, ++order, f.width,
                    f.displayName);
        }
        return configDef;
    }

    private final String name;
    private final String displayName;
    private final String description;
    private final Type type;
    private final Width width;
    private final Importance importance;
    private final Object defaultValue;
    private final Validator validator;

    private Field(String name, String displayName, String description, Type type, Width width, Importance importance,
                  Object defaultValue, Validator validator) {
        this.name = Objects.requireNonNull(name, "The field name is required");
        this.displayName = displayName;
        this.description = description;
        this.type = type;
        this.width = width;
        this.importance = importance;
        this.defaultValue = defaultValue;
        this.validator = validator;
    }

    public String name() {
        return name;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    /**
     * @return the default value as text, or null if there is none
     */
    public String defaultValueAsString() {
        return defaultValue != null ? defaultValue.toString() : null;
    }

    /**
     * Checks the value against the field type and then the field's own validation, reporting every problem.
     *
     * @return true if the value is valid
     */
    public boolean validate(Configuration config, ValidationOutput problems) {
        int errors = checkType(config, problems);
        if (validator != null) {
            errors += validator.validate(config, this, problems);
        }
        return errors == 0;
    }

    public Field withDisplayName(String displayName) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withDescription(String description) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withType(Type type) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withWidth(Width width) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withImportance(Importance importance) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withDefault(String defaultValue) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withDefault(int defaultValue) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withDefault(long defaultValue) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    /**
     * @return a copy that also runs the given check, after any check this field already has
     */
    public Field withValidation(Validator check) {
        final Validator combined = validator == null ? check
                : (config, field, problems) -> validator.validate(config, field, problems) + check.validate(config, field, problems);
        return new Field(name, displayName, description, type, width, importance, defaultValue, combined);
    }

    /**
     * @return a copy of high importance that rejects a missing or blank value
     */
    public Field required() {
        return withValidation(Field::isRequired).withImportance(Importance.HIGH);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || obj instanceof Field && name.equals(((Field) obj).name);
    }

    @Override
    public String toString() {
        return name;
    }

    private int checkType(Configuration config, ValidationOutput problems) {
        switch (type) {
            case BOOLEAN:
                final String value = config.getString(this);
                if (value == null || "true".equalsIgnoreCase(value.trim()) || "false".equalsIgnoreCase(value.trim())) {
                    return 0;
                }
                problems.accept(this, value, "Either 'true' or 'false' is expected");
                return 1;
            case INT:
                return checkNumber(config, this, problems, n -> n == (int) n, "An integer is expected");
            case LONG:
                return checkNumber(config, this, problems, n -> true, "A long value is expected");
            default:
                return 0;
        }
    }

    private static int isRequired(Configuration config, Field field, ValidationOutput problems) {
        final String value = config.getString(field);
        if (value != null && !value.trim().isEmpty()) {
            return 0;
        }
        problems.accept(field, value, "A value is required");
        return 1;
    }

    public static int isPositiveInteger(Configuration config, Field field, ValidationOutput problems) {
        return checkNumber(config, field, problems, n -> n == (int) n && n > 0, "A positive, non-zero integer value is expected");
    }

    public static int isNonNegativeLong(Configuration config, Field field, ValidationOutput problems) {
        return checkNumber(config, field, problems, n -> n >= 0, "A non-negative long value is expected");
    }

    /**
     * Accepts a missing value, rejects one that is not a number or fails the condition.
     */
    private static int checkNumber(Configuration config, Field field, ValidationOutput problems, LongPredicate condition, String message) {
        final String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        final Long number = config.parseNumber(field.name());
        if (number != null && condition.test(number)) {
            return 0;
        }
        problems.accept(field, value, message);
        return 1;
    }
}
