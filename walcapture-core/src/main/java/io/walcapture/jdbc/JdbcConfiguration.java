/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.jdbc;

import java.util.Set;

import io.walcapture.config.Configuration;
import io.walcapture.config.Field;

/**
 * Connection settings keyed by the JDBC URL variables and driver property names, without the {@code database.}
 * prefix of the capture configuration.
 */
public interface JdbcConfiguration extends Configuration {

    Field HOSTNAME = Field.create("hostname");

    Field PORT = Field.create("port");

    Field DATABASE = Field.create("dbname");

    Field USER = Field.create("user");

    Field PASSWORD = Field.create("password");

    /**
     * @return the given configuration viewed as connection settings
     */
    static JdbcConfiguration adapt(Configuration config) {
        if (config instanceof JdbcConfiguration) {
            return (JdbcConfiguration) config;
        }
        return new JdbcConfiguration() {
            @Override
            public Set<String> keys() {
                return config.keys();
            }

            @Override
            public String getString(String key) {
                return config.getString(key);
            }

            @Override
            public String toString() {
                return config.toString();
            }
        };
    }
}
