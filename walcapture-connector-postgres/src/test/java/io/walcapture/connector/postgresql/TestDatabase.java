/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.walcapture.connector.postgresql.connection.PostgresConnection;
import io.walcapture.jdbc.JdbcConfiguration;
import io.walcapture.relational.TableId;

/**
 * An in-memory stand-in for a Postgres server reachable over plain JDBC, built from Mockito mocks. Queries are
 * answered from the registered tables; {@code OFFSET} and {@code LIMIT} clauses are honoured.
 */
public class TestDatabase {

    private static final Pattern OFFSET_LIMIT = Pattern.compile("OFFSET (\\d+) LIMIT (\\d+)");

    /**
     * The content of a table.
     */
    public static final class Table {
        private final List<String> columnNames;
        private final List<String> columnTypes;
        private final List<String> primaryKey = new ArrayList<>();
        private final List<Object[]> rows = new ArrayList<>();

        private Table(List<String> columnNames, List<String> columnTypes) {
            this.columnNames = columnNames;
            this.columnTypes = columnTypes;
        }

        public Table primaryKey(String... columns) {
            primaryKey.addAll(Arrays.asList(columns));
            return this;
        }

        public Table row(Object... values) {
            rows.add(values);
            return this;
        }
    }

    /**
     * What happened on one connection.
     */
    public static final class Session {
        private final AtomicBoolean closed = new AtomicBoolean();
        private final AtomicBoolean autoCommit = new AtomicBoolean(true);
        private final AtomicInteger commits = new AtomicInteger();
        private final AtomicInteger rollbacks = new AtomicInteger();
        private final List<String> statements = new CopyOnWriteArrayList<>();
        private final List<List<Object>> parameters = new CopyOnWriteArrayList<>();

        public boolean isClosed() {
            return closed.get();
        }

        public int commits() {
            return commits.get();
        }

        public int rollbacks() {
            return rollbacks.get();
        }

        public List<String> statements() {
            return statements;
        }

        public List<List<Object>> parameters() {
            return parameters;
        }
    }

    private final Map<TableId, Table> tables = new LinkedHashMap<>();
    private final List<Session> sessions = new CopyOnWriteArrayList<>();
    private volatile SQLException queryFailure;
    private volatile String version = "12.4";

    public Table table(TableId tableId, List<String> columnNames, List<String> columnTypes) {
        final Table table = new Table(columnNames, columnTypes);
        tables.put(tableId, table);
        return table;
    }

    /**
     * Makes every following query fail with the given exception.
     */
    public TestDatabase failQueriesWith(SQLException failure) {
        this.queryFailure = failure;
        return this;
    }

    public List<Session> sessions() {
        return Collections.unmodifiableList(sessions);
    }

    public Session lastSession() {
        return sessions.get(sessions.size() - 1);
    }

    public PostgresConnection newConnection(JdbcConfiguration config) {
        return new PostgresConnection(config, c -> connect());
    }

    public Connection connect() throws SQLException {
        final Session session = new Session();
        sessions.add(session);
        final Connection connection = mock(Connection.class);

        when(connection.isClosed()).thenAnswer(invocation -> session.closed.get());
        doAnswer(invocation -> {
            session.closed.set(true);
            return null;
        }).when(connection).close();
        when(connection.getAutoCommit()).thenAnswer(invocation -> session.autoCommit.get());
        doAnswer(invocation -> {
            session.autoCommit.set(invocation.getArgument(0));
            return null;
        }).when(connection).setAutoCommit(anyBoolean());
        doAnswer(invocation -> {
            session.commits.incrementAndGet();
            return null;
        }).when(connection).commit();
        doAnswer(invocation -> {
            session.rollbacks.incrementAndGet();
            return null;
        }).when(connection).rollback();

        final DatabaseMetaData metaData = mock(DatabaseMetaData.class);
        when(metaData.getDatabaseProductVersion()).thenAnswer(invocation -> version);
        when(metaData.getTables(isNull(), anyString(), anyString(), isNull())).thenAnswer(invocation -> {
            final TableId tableId = new TableId(invocation.getArgument(1), invocation.getArgument(2));
            return tables.containsKey(tableId) ? resultSet(Arrays.asList("TABLE_NAME"), Arrays.asList("text"),
                    Collections.singletonList(new Object[]{ tableId.table() })) : emptyResultSet();
        });
        when(metaData.getPrimaryKeys(isNull(), anyString(), anyString())).thenAnswer(invocation -> {
            final Table table = tables.get(new TableId(invocation.getArgument(1), invocation.getArgument(2)));
            final List<Object[]> rows = new ArrayList<>();
            if (table != null) {
                for (int i = 0; i < table.primaryKey.size(); i++) {
                    rows.add(new Object[]{ null, null, null, table.primaryKey.get(i), i + 1 });
                }
            }
            return resultSet(Arrays.asList("TABLE_CAT", "TABLE_SCHEM", "TABLE_NAME", "COLUMN_NAME", "KEY_SEQ"),
                    Arrays.asList("text", "text", "text", "text", "int2"), rows);
        });
        when(connection.getMetaData()).thenReturn(metaData);

        when(connection.createStatement()).thenAnswer(invocation -> {
            final Statement statement = mock(Statement.class);
            when(statement.execute(anyString())).thenAnswer(call -> {
                session.statements.add(call.getArgument(0));
                return false;
            });
            when(statement.executeQuery(anyString())).thenAnswer(call -> {
                final String sql = call.getArgument(0);
                session.statements.add(sql);
                return query(sql);
            });
            return statement;
        });
        when(connection.prepareStatement(anyString())).thenAnswer(invocation -> {
            final String sql = invocation.getArgument(0);
            final List<Object> bound = new ArrayList<>();
            final PreparedStatement statement = mock(PreparedStatement.class);
            doAnswer(call -> {
                bound.add(call.getArgument(1));
                return null;
            }).when(statement).setObject(anyInt(), any());
            when(statement.executeQuery()).thenAnswer(call -> {
                session.statements.add(sql);
                session.parameters.add(bound);
                return query(sql);
            });
            return statement;
        });
        return connection;
    }

    private ResultSet query(String sql) throws SQLException {
        if (queryFailure != null) {
            throw queryFailure;
        }
        for (Map.Entry<TableId, Table> entry : tables.entrySet()) {
            if (sql.contains(" FROM " + entry.getKey().toDoubleQuotedString())) {
                final Table table = entry.getValue();
                List<Object[]> rows = table.rows;
                final Matcher matcher = OFFSET_LIMIT.matcher(sql);
                if (matcher.find()) {
                    final int offset = Integer.parseInt(matcher.group(1));
                    final int limit = Integer.parseInt(matcher.group(2));
                    rows = offset >= rows.size() ? Collections.emptyList() : rows.subList(offset, Math.min(rows.size(), offset + limit));
                }
                return resultSet(table.columnNames, table.columnTypes, rows);
            }
        }
        throw new SQLException("relation does not exist: " + sql, "42P01");
    }

    private static ResultSet emptyResultSet() throws SQLException {
        return resultSet(Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
    }

    /**
     * A forward-only result set over the given rows.
     */
    public static ResultSet resultSet(List<String> columnNames, List<String> columnTypes, List<Object[]> rows) throws SQLException {
        final ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(metaData.getColumnCount()).thenReturn(columnNames.size());
        when(metaData.getColumnName(anyInt())).thenAnswer(invocation -> columnNames.get((int) invocation.getArgument(0) - 1));
        when(metaData.getColumnTypeName(anyInt())).thenAnswer(invocation -> columnTypes.get((int) invocation.getArgument(0) - 1));

        final AtomicInteger index = new AtomicInteger(-1);
        final AtomicBoolean wasNull = new AtomicBoolean();
        final ResultSet rs = mock(ResultSet.class);
        when(rs.getMetaData()).thenReturn(metaData);
        when(rs.next()).thenAnswer(invocation -> index.incrementAndGet() < rows.size());
        when(rs.getObject(anyInt())).thenAnswer(invocation -> {
            final Object value = rows.get(index.get())[(int) invocation.getArgument(0) - 1];
            wasNull.set(value == null);
            return value;
        });
        when(rs.getString(anyInt())).thenAnswer(invocation -> {
            final Object value = rows.get(index.get())[(int) invocation.getArgument(0) - 1];
            wasNull.set(value == null);
            return value == null ? null : value.toString();
        });
        when(rs.getInt(anyInt())).thenAnswer(invocation -> {
            final Object value = rows.get(index.get())[(int) invocation.getArgument(0) - 1];
            wasNull.set(value == null);
            return value == null ? 0 : ((Number) value).intValue();
        });
        when(rs.getDouble(anyInt())).thenAnswer(invocation -> {
            final Object value = rows.get(index.get())[(int) invocation.getArgument(0) - 1];
            wasNull.set(value == null);
            return value == null ? 0d : ((Number) value).doubleValue();
        });
        when(rs.wasNull()).thenAnswer(invocation -> wasNull.get());
        return rs;
    }

    public TestDatabase version(String version) {
        this.version = version;
        return this;
    }
}
