/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walcapture.config.Configuration;
import io.walcapture.jdbc.JdbcConfiguration;
import io.walcapture.jdbc.JdbcConnection;
import io.walcapture.util.Clock;

/**
 * Implementation of a {@link ReplicationConnection} for Postgres. The underlying JDBC connection is opened in
 * logical replication mode, so only the replication command set and simple queries are available on it.
 */
public class PostgresReplicationConnection extends JdbcConnection implements ReplicationConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresReplicationConnection.class);

    public static final String PLUGIN_NAME = "wal2json";
    static final String MIN_SERVER_VERSION = "9.4";
    static final String SLOT_STATE_QUERY = "SELECT confirmed_flush_lsn, restart_lsn, plugin, active FROM pg_replication_slots WHERE slot_name = ?";

    private final String slotName;
    private final Duration statusUpdateInterval;
    private final Clock clock;

    /**
     * Creates a replication connection for the given slot.
     *
     * @param config the connection settings, without the connector prefix; may not be null
     * @param slotName the name of an existing logical replication slot; may not be null
     * @param statusUpdateInterval the interval at which the driver sends status updates on its own; may not be null
     * @param clock the clock used for read timeouts; may not be null
     */
    public PostgresReplicationConnection(JdbcConfiguration config, String slotName, Duration statusUpdateInterval, Clock clock) {
        this(config, slotName, statusUpdateInterval, clock, PostgresConnection.FACTORY);
    }

    protected PostgresReplicationConnection(JdbcConfiguration config, String slotName, Duration statusUpdateInterval, Clock clock,
                                            ConnectionFactory factory) {
        super(addReplicationProperties(config), factory);
        this.slotName = slotName;
        this.statusUpdateInterval = statusUpdateInterval;
        this.clock = clock;
    }

    private static JdbcConfiguration addReplicationProperties(JdbcConfiguration config) {
        return JdbcConfiguration.adapt(Configuration.copy(config)
                .with(PGProperty.REPLICATION.getName(), "database")
                .with(PGProperty.PREFER_QUERY_MODE.getName(), "simple")
                .with(PGProperty.ASSUME_MIN_SERVER_VERSION.getName(), MIN_SERVER_VERSION)
                .build());
    }

    @Override
    public void identifySystem() throws SQLException {
        queryAndMap("IDENTIFY_SYSTEM", rs -> {
            if (rs.next()) {
                LOGGER.info("Connected to system '{}' on timeline {}, current log position {}, database '{}'",
                        rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4));
            }
            else {
                LOGGER.warn("IDENTIFY_SYSTEM returned no result");
            }
            return null;
        });
    }

    @Override
    public Optional<SlotState> readSlotState() throws SQLException {
        return prepareQueryAndMap(SLOT_STATE_QUERY, statement -> statement.setString(1, slotName), rs -> {
            if (!rs.next()) {
                return Optional.empty();
            }
            final SlotState state = new SlotState(parseLsn(rs.getString(1)), parseLsn(rs.getString(2)), rs.getString(3),
                    rs.getBoolean(4));
            LOGGER.debug("Slot '{}' has state {}", slotName, state);
            return Optional.of(state);
        });
    }

    private static Lsn parseLsn(String value) {
        return value == null ? null : Lsn.valueOf(value);
    }

    @Override
    public ReplicationStream startStreaming(Lsn offset) throws SQLException {
        LOGGER.info("Starting replication from slot '{}' at {}", slotName, offset.asString());
        final PGReplicationStream stream = connection().unwrap(PGConnection.class)
                .getReplicationAPI()
                .replicationStream()
                .logical()
                .withSlotName(slotName)
                .withStartPosition(LogSequenceNumber.valueOf(offset.asLong()))
                .withSlotOption("format-version", 1)
                .withSlotOption("include-lsn", true)
                .withSlotOption("include-timestamp", true)
                .withStatusInterval((int) statusUpdateInterval.toMillis(), TimeUnit.MILLISECONDS)
                .start();
        return new PostgresReplicationStream(stream, offset, clock);
    }

    @Override
    public String slotName() {
        return slotName;
    }

    @Override
    public synchronized void close() throws SQLException {
        LOGGER.debug("Closing replication connection for slot '{}'", slotName);
        super.close();
    }
}
