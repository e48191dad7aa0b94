/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walcapture.annotation.NotThreadSafe;
import io.walcapture.connector.base.ChangeEventQueue;
import io.walcapture.connector.postgresql.connection.PostgresConnection;
import io.walcapture.relational.TableId;

/**
 * Reads a table page by page for the sync modes that do not use the replication stream. Each row becomes an insert
 * without a log position, the same shape the snapshot produces, and is offered to the queue. A closed queue ends the
 * read without an error.
 */
@NotThreadSafe
public class PostgresTableReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresTableReader.class);

    public static final int DEFAULT_BATCH_SIZE = 10_000;

    private final PostgresConnection connection;
    private final TableId tableId;
    private final int batchSize;

    public PostgresTableReader(PostgresConnection connection, TableId tableId) {
        this(connection, tableId, DEFAULT_BATCH_SIZE);
    }

    public PostgresTableReader(PostgresConnection connection, TableId tableId, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive but was " + batchSize);
        }
        this.connection = connection;
        this.tableId = tableId;
        this.batchSize = batchSize;
    }

    /**
     * Reads every row of the table, ordered by its primary key so that pages neither overlap nor skip rows. A table
     * without a primary key is ordered by its physical row location.
     *
     * @param queue receives the rows
     * @throws ReadTableException if a page cannot be read
     * @throws InterruptedException if the thread was interrupted while the queue was full
     */
    public void readFullRefresh(ChangeEventQueue<ChangeEvent> queue) throws InterruptedException {
        final String select = fullRefreshStatement();
        long page = 0;
        while (true) {
            final String statement = String.format("%s OFFSET %d LIMIT %d", select, page * batchSize, batchSize);
            final PageResult result = readPage(statement, null, null, queue);
            if (result.rows == 0 || result.queueClosed) {
                LOGGER.info("Finished full refresh of '{}' after {} page(s)", tableId, page);
                return;
            }
            page++;
        }
    }

    /**
     * Reads the rows whose cursor column is at or after the given state, in cursor order.
     *
     * @param cursorColumn the column tracking progress
     * @param state the largest cursor value seen by a previous read, or null to read the whole table
     * @param queue receives the rows
     * @return the largest non-null cursor value seen so far, empty if there is none
     * @throws ReadTableException if a page cannot be read
     * @throws InterruptedException if the thread was interrupted while the queue was full
     */
    public Optional<Object> readIncremental(String cursorColumn, Object state, ChangeEventQueue<ChangeEvent> queue) throws InterruptedException {
        final String cursor = TableId.quote(cursorColumn);
        Object maximum = state;
        long page = 0;
        while (true) {
            final String statement;
            if (state != null) {
                statement = String.format("SELECT * FROM %s WHERE %s >= ? ORDER BY %s ASC NULLS FIRST OFFSET %d LIMIT %d",
                        tableId.toDoubleQuotedString(), cursor, cursor, page * batchSize, batchSize);
            }
            else {
                statement = String.format("SELECT * FROM %s ORDER BY %s ASC NULLS FIRST OFFSET %d LIMIT %d",
                        tableId.toDoubleQuotedString(), cursor, page * batchSize, batchSize);
            }
            final PageResult result = readPage(statement, state, cursorColumn, queue);
            maximum = maximum(maximum, result.maximumCursor);
            if (result.rows == 0 || result.queueClosed) {
                LOGGER.info("Finished incremental read of '{}' after {} page(s), cursor '{}' is at '{}'", tableId, page,
                        cursorColumn, maximum);
                return Optional.ofNullable(maximum);
            }
            page++;
        }
    }

    private String fullRefreshStatement() {
        final List<String> primaryKey;
        try {
            primaryKey = connection.readPrimaryKeyNames(connection.connection().getMetaData(), tableId);
        }
        catch (SQLException e) {
            throw new ReadTableException(tableId.schema(), tableId.table(), "SELECT * FROM " + tableId.toDoubleQuotedString(), e);
        }
        if (primaryKey.isEmpty()) {
            LOGGER.warn("Table '{}' has no primary key, its pages are ordered by row location", tableId);
            return "SELECT * FROM " + tableId.toDoubleQuotedString() + " ORDER BY ctid";
        }
        return RecordsSnapshotProducer.selectStatement(tableId, primaryKey);
    }

    private PageResult readPage(String statement, Object state, String cursorColumn, ChangeEventQueue<ChangeEvent> queue)
            throws InterruptedException {
        final PageResult result = new PageResult();
        try {
            connection.prepareQueryWithBlockingConsumer(statement, ps -> {
                if (state != null) {
                    ps.setObject(1, state);
                }
            }, rs -> consumePage(rs, cursorColumn, queue, result));
        }
        catch (SQLException e) {
            throw new ReadTableException(tableId.schema(), tableId.table(), statement, e);
        }
        return result;
    }

    private void consumePage(ResultSet rs, String cursorColumn, ChangeEventQueue<ChangeEvent> queue, PageResult result)
            throws SQLException, InterruptedException {
        final ResultSetMetaData metaData = rs.getMetaData();
        while (rs.next()) {
            final Map<String, Object> values = PostgresValueConverter.rowValues(rs, metaData);
            result.rows++;
            if (cursorColumn != null) {
                result.maximumCursor = maximum(result.maximumCursor, values.get(cursorColumn));
            }
            if (!queue.enqueue(ChangeEvent.read(tableId, values))) {
                LOGGER.debug("Queue closed while reading '{}'", tableId);
                result.queueClosed = true;
                return;
            }
        }
    }

    /**
     * @return the larger of both values, ignoring nulls
     */
    @SuppressWarnings("unchecked")
    static Object maximum(Object current, Object candidate) {
        if (candidate == null) {
            return current;
        }
        if (current == null) {
            return candidate;
        }
        if (current instanceof Number && candidate instanceof Number && current.getClass() != candidate.getClass()) {
            return new BigDecimal(current.toString()).compareTo(new BigDecimal(candidate.toString())) >= 0 ? current : candidate;
        }
        if (current instanceof Comparable && current.getClass().isInstance(candidate)) {
            return ((Comparable<Object>) current).compareTo(candidate) >= 0 ? current : candidate;
        }
        return current.toString().compareTo(candidate.toString()) >= 0 ? current : candidate;
    }

    private static final class PageResult {
        private long rows;
        private Object maximumCursor;
        private boolean queueClosed;
    }
}
