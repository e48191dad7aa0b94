/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.config;

/**
 * A configuration option with a fixed set of possible values, i.e. an enum, whose configuration value differs from the
 * enum constant's name.
 */
public interface EnumeratedValue {

    /**
     * Returns the string representation of this value, as it appears in the configuration.
     * @return The string representation of this value
     */
    String getValue();
}
