/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import io.walcapture.WalCaptureException;
import io.walcapture.annotation.ThreadSafe;
import io.walcapture.connector.postgresql.connection.PostgresConnection;
import io.walcapture.function.BlockingConsumer;
import io.walcapture.relational.TableId;
import io.walcapture.util.Strings;

/**
 * Producer of {@link ChangeEvent}s from a consistent export of the current content of tables. Each table is read in
 * its own repeatable read transaction on a dedicated connection, ordered by its primary key, and every row becomes an
 * insert without a log position.
 */
@ThreadSafe
public class RecordsSnapshotProducer extends RecordsProducer {

    private final List<TableId> tableIds;
    private volatile PostgresConnection activeConnection;
    private volatile boolean stopped;

    public RecordsSnapshotProducer(PostgresTaskContext taskContext, Collection<TableId> tableIds) {
        super(taskContext);
        this.tableIds = Collections.unmodifiableList(new ArrayList<>(tableIds));
    }

    public List<TableId> tableIds() {
        return tableIds;
    }

    /**
     * Exports every table in turn.
     *
     * @param eventConsumer receives one insert per row
     * @throws SnapshotException if the export of any table fails; the remaining tables are not exported
     * @throws InterruptedException if the thread was interrupted
     */
    @Override
    protected void produce(BlockingConsumer<ChangeEvent> eventConsumer) throws InterruptedException {
        final long snapshotStart = clock().currentTimeInMillis();
        logger.info("Taking initial snapshot of {} table(s): {}", tableIds.size(), tableIds);
        for (TableId tableId : tableIds) {
            if (stopped) {
                logger.info("Snapshot stopped before exporting '{}'", tableId);
                return;
            }
            snapshotTable(tableId, eventConsumer);
        }
        logger.info("Snapshot completed in '{}'", Strings.duration(clock().currentTimeInMillis() - snapshotStart));
    }

    /**
     * Exports the content of a single table.
     *
     * @param tableId the table
     * @param consumer receives one insert per row
     * @throws SnapshotException if the table cannot be read
     * @throws InterruptedException if the thread was interrupted
     */
    public void snapshotTable(TableId tableId, BlockingConsumer<ChangeEvent> consumer) throws InterruptedException {
        final long exportStart = clock().currentTimeInMillis();
        final PostgresConnection connection = taskContext.createConnection();
        activeConnection = connection;
        Exception failure = null;
        try {
            logger.info("Step 0: disabling autocommit and starting a repeatable read transaction for '{}'", tableId);
            connection.beginRepeatableReadTransaction();

            logger.info("Step 1: reading the primary key of '{}'", tableId);
            final List<String> primaryKey = connection.readPrimaryKeyNames(connection.connection().getMetaData(), tableId);
            if (primaryKey.isEmpty()) {
                logger.warn("Table '{}' has no primary key, its rows are exported in no particular order", tableId);
            }

            final String select = selectStatement(tableId, primaryKey);
            logger.info("Step 2: exporting the rows of '{}' using '{}'", tableId, select);
            final AtomicLong rows = new AtomicLong();
            connection.queryWithBlockingConsumer(select, this::readTableStatement, rs -> readTable(tableId, rs, consumer, rows));

            logger.info("Step 3: committing transaction");
            connection.commit();
            if (logger.isInfoEnabled()) {
                logger.info("\t finished exporting '{}' records for '{}'; total duration '{}'", rows.get(), tableId,
                        Strings.duration(clock().currentTimeInMillis() - exportStart));
            }
        }
        catch (SQLException | RuntimeException e) {
            failure = e;
            rollbackTransaction(connection, e);
            throw new SnapshotException(tableId, e);
        }
        catch (InterruptedException e) {
            failure = e;
            rollbackTransaction(connection, e);
            if (logger.isWarnEnabled()) {
                logger.warn("Snapshot of '{}' aborted after '{}'", tableId, Strings.duration(clock().currentTimeInMillis() - exportStart));
            }
            throw e;
        }
        finally {
            activeConnection = null;
            closeConnection(connection, tableId, failure);
        }
    }

    static String selectStatement(TableId tableId, List<String> primaryKey) {
        final StringBuilder select = new StringBuilder("SELECT * FROM ").append(tableId.toDoubleQuotedString());
        if (!primaryKey.isEmpty()) {
            select.append(" ORDER BY ").append(Strings.join(", ", primaryKey, TableId::quote));
        }
        return select.toString();
    }

    private void readTable(TableId tableId, ResultSet rs, BlockingConsumer<ChangeEvent> consumer, AtomicLong rows)
            throws SQLException, InterruptedException {
        final ResultSetMetaData metaData = rs.getMetaData();
        while (rs.next()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted while exporting '" + tableId + "'");
            }
            consumer.accept(ChangeEvent.read(tableId, PostgresValueConverter.rowValues(rs, metaData)));
            if (rows.incrementAndGet() % 10_000 == 0 && logger.isDebugEnabled()) {
                logger.debug("\t exported {} records for '{}'", rows.get(), tableId);
            }
        }
    }

    private Statement readTableStatement(Connection conn) throws SQLException {
        int fetchSize = taskContext.config().snapshotFetchSize();
        Statement statement = conn.createStatement(); // the default cursor is FORWARD_ONLY
        statement.setFetchSize(fetchSize);
        return statement;
    }

    private void rollbackTransaction(PostgresConnection connection, Exception cause) {
        try {
            connection.rollback();
        }
        catch (SQLException se) {
            logger.error("Cannot rollback snapshot transaction", se);
            cause.addSuppressed(se);
        }
    }

    private void closeConnection(PostgresConnection connection, TableId tableId, Exception failure) {
        try {
            connection.close();
        }
        catch (SQLException e) {
            if (failure != null) {
                failure.addSuppressed(e);
            }
            else {
                throw new SnapshotException(tableId, e);
            }
        }
    }

    @Override
    protected void stop() {
        stopped = true;
        final PostgresConnection connection = activeConnection;
        if (connection != null) {
            logger.debug("Closing snapshot connection");
            try {
                connection.close();
            }
            catch (SQLException e) {
                throw new WalCaptureException("Unable to close the snapshot connection", e);
            }
        }
    }
}
