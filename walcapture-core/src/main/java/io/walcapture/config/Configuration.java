/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.temporal.TemporalUnit;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walcapture.annotation.Immutable;

/**
 * Immutable string key/value settings of a capture run. Typed getters take a {@link Field} and use its default
 * when the key is missing or does not parse.
 */
@Immutable
public interface Configuration {

    Logger CONFIGURATION_LOGGER = LoggerFactory.getLogger(Configuration.class);

    Pattern PASSWORD_PATTERN = Pattern.compile(".*password$", Pattern.CASE_INSENSITIVE);

    String MASK = "********";

    /**
     * Collects settings; a null value removes the key.
     */
    class Builder {
        private final Properties props = new Properties();

        protected Builder(Properties initial) {
            props.putAll(initial);
        }

        public Builder with(String key, Object value) {
            if (value == null) {
                props.remove(key);
            }
            else {
                props.setProperty(key, value.toString());
            }
            return this;
        }

        public Builder with(Field field, Object value) {
            return with(field.name(), value);
        }

        /**
         * Sets the value only if the key has none yet.
         */
        public Builder withDefault(String key, String value) {
            props.putIfAbsent(key, value);
            return this;
        }

        public Configuration build() {
            return from(props);
        }
    }

    static Builder create() {
        return new Builder(new Properties());
    }

    static Builder copy(Configuration config) {
        return new Builder(config.asProperties());
    }

    static Configuration empty() {
        return from(new Properties());
    }

    /**
     * @param properties the settings, copied so later changes are not seen; may be null
     * @return the configuration; never null
     */
    static Configuration from(Properties properties) {
        final Properties props = new Properties();
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
                return withMaskedPasswords().toString();
            }
        };
    }

    /**
     * Reads properties from the stream and closes it.
     *
     * @param stream the properties text; may not be null
     * @return the configuration; never null
     * @throws IOException if the stream cannot be read
     */
    static Configuration load(InputStream stream) throws IOException {
        try (InputStream in = stream) {
            final Properties properties = new Properties();
            properties.load(in);
            return from(properties);
        }
    }

    /**
     * Reads properties from a classpath resource.
     *
     * @param path the resource path; may not be null
     * @param classLoader the loader to search, or null for this interface's loader
     * @return the configuration; empty if there is no such resource
     * @throws IOException if the resource cannot be read
     */
    static Configuration load(String path, ClassLoader classLoader) throws IOException {
        final ClassLoader loader = classLoader != null ? classLoader : Configuration.class.getClassLoader();
        final InputStream stream = loader.getResourceAsStream(path);
        if (stream == null) {
            CONFIGURATION_LOGGER.debug("No configuration resource found at '{}'", path);
            return empty();
        }
        return load(stream);
    }

    Set<String> keys();

    /**
     * @return the value of the key, or null if there is none
     */
    String getString(String key);

    default Builder edit() {
        return copy(this);
    }

    default String getString(String key, Supplier<String> defaultValue) {
        final String value = getString(key);
        return value != null ? value : defaultValue.get();
    }

    default String getString(Field field) {
        return getString(field.name(), field::defaultValueAsString);
    }

    default Integer getInteger(String key, Supplier<Integer> defaultValue) {
        final Long value = parseNumber(key);
        return value != null && value == value.intValue() ? Integer.valueOf(value.intValue()) : defaultValue.get();
    }

    default int getInteger(Field field) {
        return getInteger(field.name(), () -> Integer.valueOf(field.defaultValueAsString()));
    }

    default long getLong(Field field) {
        final Long value = parseNumber(field.name());
        return value != null ? value : Long.parseLong(field.defaultValueAsString());
    }

    /**
     * @return the numeric value of the field in the given unit
     */
    default Duration getDuration(Field field, TemporalUnit unit) {
        return Duration.of(getLong(field), unit);
    }

    /**
     * @return the value of the key as a number, or null if it is missing or not a number
     */
    default Long parseNumber(String key) {
        final String value = getString(key);
        if (value == null) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        }
        catch (NumberFormatException e) {
            CONFIGURATION_LOGGER.warn("Ignoring non-numeric value '{}' of '{}'", value, key);
            return null;
        }
    }

    /**
     * @param prefix the prefix of the keys to keep
     * @param removePrefix whether the kept keys lose the prefix
     * @return the settings whose key starts with the prefix
     */
    default Configuration subset(String prefix, boolean removePrefix) {
        final Properties props = new Properties();
        for (String key : keys()) {
            if (key.startsWith(prefix)) {
                props.setProperty(removePrefix ? key.substring(prefix.length()) : key, getString(key));
            }
        }
        return from(props);
    }

    /**
     * @return the settings sorted by key, with the value of every password key masked
     */
    default Map<String, String> withMaskedPasswords() {
        final Map<String, String> masked = new TreeMap<>();
        keys().forEach(key -> masked.put(key, PASSWORD_PATTERN.matcher(key).matches() ? MASK : getString(key)));
        return Collections.unmodifiableMap(masked);
    }

    default Properties asProperties() {
        final Properties props = new Properties();
        keys().forEach(key -> props.setProperty(key, getString(key)));
        return props;
    }

    /**
     * Validates the given fields, reporting every problem as a readable message. Keys without a field are not checked.
     *
     * @param fields the fields to check
     * @param problems receives one message per problem
     * @return true if no problem was found
     */
    default boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        boolean valid = true;
        for (Field field : fields) {
            valid &= field.validate(this, (f, value, problem) -> {
                if (value == null) {
                    problems.accept("The '" + f.name() + "' value is invalid: " + problem);
                }
                else {
                    final String shown = PASSWORD_PATTERN.matcher(f.name()).matches() ? MASK : "'" + value + "'";
                    problems.accept("The '" + f.name() + "' value " + shown + " is invalid: " + problem);
                }
            });
        }
        return valid;
    }
}
