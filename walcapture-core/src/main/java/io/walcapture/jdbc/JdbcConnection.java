/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.jdbc;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walcapture.WalCaptureException;
import io.walcapture.annotation.NotThreadSafe;
import io.walcapture.annotation.ThreadSafe;
import io.walcapture.relational.TableId;

/**
 * A lazily opened JDBC connection with helpers that run a query and hand its result set to a callback, closing the
 * statement and result set afterwards.
 */
@NotThreadSafe
public class JdbcConnection implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcConnection.class);

    /**
     * Opens JDBC connections for a configuration.
     */
    @FunctionalInterface
    @ThreadSafe
    public interface ConnectionFactory {
        Connection connect(JdbcConfiguration config) throws SQLException;
    }

    @FunctionalInterface
    public interface ResultSetMapper<T> {
        T apply(ResultSet rs) throws SQLException;
    }

    /**
     * Consumes a result set and may block, e.g. on a full queue.
     */
    @FunctionalInterface
    public interface BlockingResultSetConsumer {
        void accept(ResultSet rs) throws SQLException, InterruptedException;
    }

    @FunctionalInterface
    public interface StatementPreparer {
        void accept(PreparedStatement statement) throws SQLException;
    }

    /**
     * Creates the statement of a query, e.g. to set a fetch size.
     */
    @FunctionalInterface
    public interface StatementFactory {
        Statement createStatement(Connection connection) throws SQLException;
    }

    /**
     * Creates a factory that fills every {@code ${key}} of the URL pattern with the value of that key. Keys used in the
     * URL are not passed on to the driver as properties; all other keys are.
     *
     * @param urlPattern the JDBC URL with variables; may not be null
     * @return the factory
     */
    public static ConnectionFactory patternBasedFactory(String urlPattern) {
        return config -> {
            final Properties props = config.asProperties();
            String url = urlPattern;
            for (String key : config.keys()) {
                final String variable = "${" + key + "}";
                if (url.contains(variable)) {
                    url = url.replace(variable, props.getProperty(key));
                    props.remove(key);
                }
            }
            final Connection connection = DriverManager.getConnection(url, props);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Connected to {} with {}", url, withMaskedPassword(props));
            }
            return connection;
        };
    }

    private static Properties withMaskedPassword(Properties props) {
        final Properties masked = new Properties();
        masked.putAll(props);
        masked.computeIfPresent(JdbcConfiguration.PASSWORD.name(), (key, value) -> "***");
        return masked;
    }

    private final JdbcConfiguration config;
    private final ConnectionFactory factory;
    private volatile Connection conn;

    /**
     * @param config the connection settings; may not be null
     * @param connectionFactory opens the connection on first use; may not be null
     */
    public JdbcConnection(JdbcConfiguration config, ConnectionFactory connectionFactory) {
        this.config = Objects.requireNonNull(config);
        this.factory = Objects.requireNonNull(connectionFactory);
    }

    public JdbcConnection setAutoCommit(boolean autoCommit) throws SQLException {
        connection().setAutoCommit(autoCommit);
        return this;
    }

    public JdbcConnection commit() throws SQLException {
        final Connection connection = connection();
        if (!connection.getAutoCommit()) {
            connection.commit();
        }
        return this;
    }

    /**
     * Rolls back the open transaction, if any; does nothing when not connected.
     */
    public synchronized JdbcConnection rollback() throws SQLException {
        if (isConnected() && !conn.getAutoCommit()) {
            conn.rollback();
        }
        return this;
    }

    public JdbcConnection connect() throws SQLException {
        connection();
        return this;
    }

    /**
     * Runs the statements within the current transaction.
     *
     * @throws WalCaptureException if the connection is in auto-commit mode
     * @throws SQLException if a statement fails
     */
    public JdbcConnection executeWithoutCommitting(String... statements) throws SQLException {
        final Connection connection = connection();
        if (connection.getAutoCommit()) {
            throw new WalCaptureException("Cannot execute without committing because auto-commit is enabled");
        }
        try (Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                LOGGER.trace("Executing '{}'", sql);
                statement.execute(sql);
            }
        }
        return this;
    }

    public <T> T queryAndMap(String query, ResultSetMapper<T> mapper) throws SQLException {
        try (Statement statement = connection().createStatement();
                ResultSet rs = statement.executeQuery(query)) {
            LOGGER.trace("Ran '{}'", query);
            return mapper.apply(rs);
        }
    }

    public JdbcConnection queryWithBlockingConsumer(String query, StatementFactory statementFactory, BlockingResultSetConsumer consumer)
            throws SQLException, InterruptedException {
        try (Statement statement = statementFactory.createStatement(connection());
                ResultSet rs = statement.executeQuery(query)) {
            LOGGER.trace("Ran '{}'", query);
            consumer.accept(rs);
        }
        return this;
    }

    public <T> T prepareQueryAndMap(String query, StatementPreparer preparer, ResultSetMapper<T> mapper) throws SQLException {
        try (PreparedStatement statement = connection().prepareStatement(query)) {
            preparer.accept(statement);
            try (ResultSet rs = statement.executeQuery()) {
                LOGGER.trace("Ran '{}'", query);
                return mapper.apply(rs);
            }
        }
    }

    public JdbcConnection prepareQueryWithBlockingConsumer(String query, StatementPreparer preparer, BlockingResultSetConsumer consumer)
            throws SQLException, InterruptedException {
        try (PreparedStatement statement = connection().prepareStatement(query)) {
            preparer.accept(statement);
            try (ResultSet rs = statement.executeQuery()) {
                LOGGER.trace("Ran '{}'", query);
                consumer.accept(rs);
            }
        }
        return this;
    }

    /**
     * @return the primary key columns of the table in key order; empty if it has no primary key
     * @throws SQLException if the metadata cannot be read
     */
    public List<String> readPrimaryKeyNames(DatabaseMetaData metadata, TableId id) throws SQLException {
        final SortedMap<Integer, String> columnsBySequence = new TreeMap<>();
        try (ResultSet rs = metadata.getPrimaryKeys(null, id.schema(), id.table())) {
            while (rs.next()) {
                columnsBySequence.put(rs.getInt(5), rs.getString(4));
            }
        }
        return new ArrayList<>(columnsBySequence.values());
    }

    public synchronized boolean isConnected() throws SQLException {
        return conn != null && !conn.isClosed();
    }

    /**
     * @return the open connection, connecting first if needed
     * @throws SQLException if no connection can be opened
     */
    public synchronized Connection connection() throws SQLException {
        if (!isConnected()) {
            conn = factory.connect(config);
            if (!isConnected()) {
                throw new SQLException("Unable to obtain a JDBC connection");
            }
        }
        return conn;
    }

    @Override
    public synchronized void close() throws SQLException {
        final Connection connection = conn;
        conn = null;
        if (connection != null) {
            LOGGER.trace("Closing database connection");
            connection.close();
        }
    }
}
