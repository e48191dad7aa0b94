/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walcapture.config.Configuration;
import io.walcapture.config.EnumeratedValue;
import io.walcapture.config.Field;
import io.walcapture.config.InvalidConfigurationException;
import io.walcapture.jdbc.JdbcConfiguration;
import io.walcapture.relational.TableId;
import io.walcapture.util.Strings;

/**
 * The configuration properties of a capture run against one Postgres database and one replication slot.
 */
public class PostgresConnectorConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresConnectorConfig.class);

    public static final String DATABASE_CONFIG_PREFIX = "database.";
    public static final int DEFAULT_PORT = 5432;
    public static final int DEFAULT_SNAPSHOT_FETCH_SIZE = 10_240;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 16;
    public static final int MAX_QUEUE_SIZE_LIMIT = 100;

    /**
     * The set of predefined SecureConnectionMode options or aliases.
     */
    public enum SecureConnectionMode implements EnumeratedValue {

        /**
         * Establish an unencrypted connection
         *
         * see the {@code sslmode} Postgres JDBC driver option
         */
        DISABLED("disable"),

        /**
         * Establish an unencrypted connection first.
         * Establish a secure connection next if an unencrypted connection cannot be established
         */
        ALLOW("allow"),

        /**
         * Establish a secure connection first.
         * Establish an unencrypted connection next if a secure connection cannot be established
         */
        PREFER("prefer"),

        /**
         * Establish a secure connection if the server supports secure connections.
         * The connection attempt fails if a secure connection cannot be established
         */
        REQUIRED("require"),

        /**
         * Like REQUIRED, but additionally verify the server TLS certificate against the configured Certificate Authority
         * (CA) certificates.
         */
        VERIFY_CA("verify-ca"),

        /**
         * Like VERIFY_CA, but additionally verify that the server certificate matches the host to which the connection is
         * attempted.
         */
        VERIFY_FULL("verify-full");

        private final String value;

        SecureConnectionMode(String value) {
            this.value = value;
        }

        @Override
        public String getValue() {
            return value;
        }

        /**
         * Determine if the supplied value is one of the predefined options.
         *
         * @param value the configuration property value; may be null
         * @return the matching option, or null if the match is not found
         */
        public static SecureConnectionMode parse(String value) {
            if (value == null) {
                return null;
            }
            value = value.trim();
            for (SecureConnectionMode option : SecureConnectionMode.values()) {
                if (option.getValue().equalsIgnoreCase(value)) {
                    return option;
                }
            }
            return null;
        }
    }

    public static final Field HOSTNAME = Field.create(DATABASE_CONFIG_PREFIX + JdbcConfiguration.HOSTNAME.name())
            .withDisplayName("Hostname")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withDescription("Resolvable hostname or IP address of the database server.")
            .required();

    public static final Field PORT = Field.create(DATABASE_CONFIG_PREFIX + JdbcConfiguration.PORT.name())
            .withDisplayName("Port")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withDefault(DEFAULT_PORT)
            .withImportance(Importance.HIGH)
            .withDescription("Port of the database server.")
            .withValidation(Field::isPositiveInteger);

    public static final Field USER = Field.create(DATABASE_CONFIG_PREFIX + JdbcConfiguration.USER.name())
            .withDisplayName("User")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withDescription("Name of the database user to be used when connecting to the database.")
            .required();

    public static final Field PASSWORD = Field.create(DATABASE_CONFIG_PREFIX + JdbcConfiguration.PASSWORD.name())
            .withDisplayName("Password")
            .withType(Type.PASSWORD)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDescription("Password of the database user to be used when connecting to the database.");

    public static final Field DATABASE_NAME = Field.create(DATABASE_CONFIG_PREFIX + JdbcConfiguration.DATABASE.name())
            .withDisplayName("Database")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withDescription("The name of the database from which changes are captured.")
            .required();

    public static final Field SSL_MODE = Field.create(DATABASE_CONFIG_PREFIX + "sslmode")
            .withDisplayName("SSL mode")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withDefault(SecureConnectionMode.DISABLED.getValue())
            .withValidation(PostgresConnectorConfig::validateSslMode)
            .withDescription("Whether to use an encrypted connection to Postgres. Options include: "
                    + "'disable' (the default) to use an unencrypted connection; "
                    + "'allow' to try an unencrypted connection first and, failing that, a secure (encrypted) connection; "
                    + "'prefer' to try a secure (encrypted) connection first and, failing that, an unencrypted connection; "
                    + "'require' to use a secure (encrypted) connection, and fail if one cannot be established; "
                    + "'verify-ca' like 'require' but additionally verify the server TLS certificate against the configured "
                    + "Certificate Authority (CA) certificates; or "
                    + "'verify-full' like 'verify-ca' but additionally verify that the server certificate matches the host.");

    public static final Field SLOT_NAME = Field.create("slot.name")
            .withDisplayName("Slot")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withValidation(PostgresConnectorConfig::validateReplicationSlotName)
            .withDescription("The name of an existing Postgres logical decoding slot using the wal2json plugin. "
                    + "The slot is never created by the engine.")
            .required();

    public static final Field TABLE_INCLUDE_LIST = Field.create("table.include.list")
            .withDisplayName("Include tables")
            .withType(Type.LIST)
            .withWidth(Width.LONG)
            .withValidation(PostgresConnectorConfig::validateTableList)
            .withDescription("A comma-separated list of 'schema.table' identifiers whose changes are captured. "
                    + "Changes of any other table flowing through the slot are dropped.")
            .required();

    public static final Field SNAPSHOT_INCLUDE_LIST = Field.create("snapshot.include.list")
            .withDisplayName("Snapshot tables")
            .withType(Type.LIST)
            .withWidth(Width.LONG)
            .withImportance(Importance.MEDIUM)
            .withValidation(PostgresConnectorConfig::validateSnapshotList)
            .withDescription("A comma-separated list of 'schema.table' identifiers whose existing rows are exported "
                    + "before streaming starts. Every entry must also be listed in '" + TABLE_INCLUDE_LIST.name() + "'.");

    public static final Field INITIAL_WAIT_MS = Field.create("initial.wait.ms")
            .withDisplayName("Initial wait (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withDefault(0L)
            .withImportance(Importance.LOW)
            .withValidation(Field::isNonNegativeLong)
            .withDescription("How long to wait for the first change before closing cleanly, in milliseconds. "
                    + "Once a change has been received the wait no longer applies. 0 (the default) waits forever.");

    public static final Field STATUS_UPDATE_INTERVAL_MS = Field.create("status.update.interval.ms")
            .withDisplayName("Status update interval (ms)")
            .withType(Type.INT) // Postgres doesn't accept long for this value
            .withDefault(10_000)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDescription("Frequency for sending replication connection status updates to the server, given in milliseconds. "
                    + "Defaults to 10 seconds (10,000 ms).")
            .withValidation(Field::isPositiveInteger);

    public static final Field SNAPSHOT_FETCH_SIZE = Field.create("snapshot.fetch.size")
            .withDisplayName("Snapshot fetch size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withDefault(DEFAULT_SNAPSHOT_FETCH_SIZE)
            .withImportance(Importance.MEDIUM)
            .withDescription("The maximum number of records that should be loaded into memory while performing a snapshot.")
            .withValidation(Field::isPositiveInteger);

    public static final Field MAX_QUEUE_SIZE = Field.create("max.queue.size")
            .withDisplayName("Change event buffer size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withDefault(DEFAULT_MAX_QUEUE_SIZE)
            .withImportance(Importance.MEDIUM)
            .withDescription("Maximum number of change events handed from the reader to the handler without being consumed. "
                    + "The reader blocks while the buffer is full. Must be between 1 and " + MAX_QUEUE_SIZE_LIMIT + ".")
            .withValidation(PostgresConnectorConfig::validateMaxQueueSize);

    public static final Field POLL_INTERVAL_MS = Field.create("poll.interval.ms")
            .withDisplayName("Poll interval (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withDefault(500L)
            .withImportance(Importance.LOW)
            .withDescription("Time to wait for new change events to appear after receiving no events, given in milliseconds. "
                    + "Defaults to 500 ms.")
            .withValidation(Field::isPositiveInteger);

    public static final Field OFFSET_STORAGE_FILE_FILENAME = Field.create("offset.storage.file.filename")
            .withDisplayName("Offset file")
            .withType(Type.STRING)
            .withWidth(Width.LONG)
            .withImportance(Importance.MEDIUM)
            .withDescription("Path of the file holding the replication state between runs. "
                    + "When absent the state is kept in memory only.");

    public static final Field.Set ALL_FIELDS = Field.setOf(HOSTNAME, PORT, USER, PASSWORD, DATABASE_NAME, SSL_MODE,
            SLOT_NAME, TABLE_INCLUDE_LIST, SNAPSHOT_INCLUDE_LIST, INITIAL_WAIT_MS, STATUS_UPDATE_INTERVAL_MS,
            SNAPSHOT_FETCH_SIZE, MAX_QUEUE_SIZE, POLL_INTERVAL_MS, OFFSET_STORAGE_FILE_FILENAME);

    public static ConfigDef configDef() {
        ConfigDef config = new ConfigDef();
        Field.group(config, "Postgres", HOSTNAME, PORT, USER, PASSWORD, DATABASE_NAME, SSL_MODE);
        Field.group(config, "Replication", SLOT_NAME, STATUS_UPDATE_INTERVAL_MS, INITIAL_WAIT_MS);
        Field.group(config, "Tables", TABLE_INCLUDE_LIST, SNAPSHOT_INCLUDE_LIST, SNAPSHOT_FETCH_SIZE);
        Field.group(config, "Engine", MAX_QUEUE_SIZE, POLL_INTERVAL_MS, OFFSET_STORAGE_FILE_FILENAME);
        return config;
    }

    private final Configuration config;

    public PostgresConnectorConfig(Configuration config) {
        this.config = config;
    }

    /**
     * Validate every field, reporting all problems at once.
     *
     * @return this configuration, for chaining
     * @throws InvalidConfigurationException if any of the values is invalid
     */
    public PostgresConnectorConfig validate() {
        final List<String> problems = new ArrayList<>();
        if (!config.validateAndRecord(ALL_FIELDS, problems::add)) {
            problems.forEach(problem -> LOGGER.error("{}", problem));
            throw new InvalidConfigurationException("Invalid capture configuration", problems);
        }
        return this;
    }

    public Configuration getConfig() {
        return config;
    }

    /**
     * The connection settings without the {@value #DATABASE_CONFIG_PREFIX} prefix, with the defaults applied.
     *
     * @return the JDBC configuration; never null
     */
    public JdbcConfiguration getJdbcConfig() {
        return JdbcConfiguration.adapt(config.subset(DATABASE_CONFIG_PREFIX, true)
                .edit()
                .withDefault(JdbcConfiguration.PORT.name(), String.valueOf(DEFAULT_PORT))
                .withDefault("sslmode", SecureConnectionMode.DISABLED.getValue())
                .build());
    }

    public String hostname() {
        return config.getString(HOSTNAME);
    }

    public int port() {
        return config.getInteger(PORT);
    }

    public String databaseName() {
        return config.getString(DATABASE_NAME);
    }

    public SecureConnectionMode sslMode() {
        return SecureConnectionMode.parse(config.getString(SSL_MODE));
    }

    public String slotName() {
        return config.getString(SLOT_NAME);
    }

    /**
     * @return the tables whose changes are captured, in configuration order
     */
    public Set<TableId> tableIds() {
        return Collections.unmodifiableSet(Strings.setOfTrimmed(config.getString(TABLE_INCLUDE_LIST), TableId::parse));
    }

    /**
     * @return the tables to be exported before streaming, in configuration order
     */
    public Set<TableId> snapshotTableIds() {
        return Collections.unmodifiableSet(Strings.setOfTrimmed(config.getString(SNAPSHOT_INCLUDE_LIST), TableId::parse));
    }

    public Duration initialWait() {
        return config.getDuration(INITIAL_WAIT_MS, ChronoUnit.MILLIS);
    }

    public Duration statusUpdateInterval() {
        return config.getDuration(STATUS_UPDATE_INTERVAL_MS, ChronoUnit.MILLIS);
    }

    public int snapshotFetchSize() {
        return config.getInteger(SNAPSHOT_FETCH_SIZE);
    }

    public int maxQueueSize() {
        return config.getInteger(MAX_QUEUE_SIZE);
    }

    public Duration pollInterval() {
        return config.getDuration(POLL_INTERVAL_MS, ChronoUnit.MILLIS);
    }

    public Optional<Path> offsetStorageFile() {
        final String fileName = config.getString(OFFSET_STORAGE_FILE_FILENAME);
        return Strings.isNullOrBlank(fileName) ? Optional.empty() : Optional.of(Paths.get(fileName.trim()));
    }

    private static int validateReplicationSlotName(Configuration config, Field field, Field.ValidationOutput problems) {
        final String name = config.getString(field);
        int errors = 0;
        if (name != null) {
            if (!name.matches("[a-z0-9_]{1,63}")) {
                problems.accept(field, name, "Valid replication slot name must contain only digits, lowercase characters and underscores with length <= 63");
                ++errors;
            }
        }
        return errors;
    }

    private static int validateSslMode(Configuration config, Field field, Field.ValidationOutput problems) {
        final String mode = config.getString(field);
        if (mode != null && SecureConnectionMode.parse(mode) == null) {
            problems.accept(field, mode, "Value must be one of disable, allow, prefer, require, verify-ca, verify-full");
            return 1;
        }
        return 0;
    }

    private static int validateTableList(Configuration config, Field field, Field.ValidationOutput problems) {
        final String value = config.getString(field);
        int errors = 0;
        for (String item : Strings.listOfTrimmed(value, Function.identity())) {
            if (TableId.parse(item) == null) {
                problems.accept(field, value, "'" + item + "' is not of the form 'schema.table'");
                ++errors;
            }
        }
        return errors;
    }

    private static int validateSnapshotList(Configuration config, Field field, Field.ValidationOutput problems) {
        int errors = validateTableList(config, field, problems);
        if (errors > 0) {
            return errors;
        }
        final Set<TableId> tables = Strings.setOfTrimmed(config.getString(TABLE_INCLUDE_LIST), TableId::parse);
        for (TableId snapshotTable : Strings.setOfTrimmed(config.getString(field), TableId::parse)) {
            if (!tables.contains(snapshotTable)) {
                problems.accept(field, config.getString(field),
                        "Table '" + snapshotTable + "' must also be listed in '" + TABLE_INCLUDE_LIST.name() + "'");
                ++errors;
            }
        }
        return errors;
    }

    private static int validateMaxQueueSize(Configuration config, Field field, Field.ValidationOutput problems) {
        final String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            final int size = Integer.parseInt(value.trim());
            if (size >= 1 && size <= MAX_QUEUE_SIZE_LIMIT) {
                return 0;
            }
        }
        catch (NumberFormatException e) {
            LOGGER.debug("Non-numeric queue size '{}'", value);
        }
        problems.accept(field, value, "A value between 1 and " + MAX_QUEUE_SIZE_LIMIT + " is expected");
        return 1;
    }

    @Override
    public String toString() {
        return config.toString();
    }
}
