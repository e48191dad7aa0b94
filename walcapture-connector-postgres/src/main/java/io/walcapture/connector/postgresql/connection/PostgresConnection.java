/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;

import io.walcapture.jdbc.JdbcConfiguration;
import io.walcapture.jdbc.JdbcConnection;
import io.walcapture.relational.TableId;

/**
 * A plain SQL connection to a Postgres server, used for snapshots and table reads. It is never shared with the
 * replication connection.
 */
public class PostgresConnection extends JdbcConnection {

    public static final String URL_PATTERN = "jdbc:postgresql://${hostname}:${port}/${dbname}";

    protected static final ConnectionFactory FACTORY = JdbcConnection.patternBasedFactory(URL_PATTERN);

    /**
     * Creates a Postgres connection using the supplied configuration.
     *
     * @param config the connection settings, without the connector prefix; may not be null
     */
    public PostgresConnection(JdbcConfiguration config) {
        this(config, FACTORY);
    }

    public PostgresConnection(JdbcConfiguration config, ConnectionFactory connectionFactory) {
        super(config, connectionFactory);
    }

    /**
     * Starts a read-only transaction whose view of the data stays fixed until it ends.
     *
     * @return this connection
     * @throws SQLException if the transaction cannot be started
     */
    public PostgresConnection beginRepeatableReadTransaction() throws SQLException {
        setAutoCommit(false);
        executeWithoutCommitting("SET TRANSACTION ISOLATION LEVEL REPEATABLE READ, READ ONLY");
        return this;
    }

    /**
     * @return the product version reported by the server
     * @throws SQLException if the metadata cannot be read
     */
    public String serverVersion() throws SQLException {
        return connection().getMetaData().getDatabaseProductVersion();
    }

    public boolean tableExists(TableId tableId) throws SQLException {
        final DatabaseMetaData metadata = connection().getMetaData();
        try (ResultSet rs = metadata.getTables(null, tableId.schema(), tableId.table(), null)) {
            return rs.next();
        }
    }
}
