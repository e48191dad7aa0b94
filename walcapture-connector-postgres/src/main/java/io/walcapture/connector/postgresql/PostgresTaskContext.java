/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import io.walcapture.annotation.ThreadSafe;
import io.walcapture.connector.postgresql.connection.ChangeFilter;
import io.walcapture.connector.postgresql.connection.PostgresConnection;
import io.walcapture.connector.postgresql.connection.PostgresReplicationConnection;
import io.walcapture.connector.postgresql.connection.ReplicationConnection;
import io.walcapture.connector.postgresql.connection.Wal2JsonChangeFilter;
import io.walcapture.util.Clock;

/**
 * The context of a {@link WalCaptureEngine} run. This deals with reading the configuration options and creating the
 * connections and other objects from them.
 */
@ThreadSafe
public class PostgresTaskContext {

    private final PostgresConnectorConfig config;
    private final Clock clock;

    public PostgresTaskContext(PostgresConnectorConfig config) {
        this(config, Clock.SYSTEM);
    }

    public PostgresTaskContext(PostgresConnectorConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public PostgresConnectorConfig config() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * @return a new, not yet opened, plain SQL connection
     */
    protected PostgresConnection createConnection() {
        return new PostgresConnection(config.getJdbcConfig());
    }

    /**
     * @return a new, not yet opened, replication connection for the configured slot
     */
    protected ReplicationConnection createReplicationConnection() {
        return new PostgresReplicationConnection(config.getJdbcConfig(), config.slotName(), config.statusUpdateInterval(), clock);
    }

    protected ChangeFilter createChangeFilter() {
        return new Wal2JsonChangeFilter(config.tableIds());
    }
}
