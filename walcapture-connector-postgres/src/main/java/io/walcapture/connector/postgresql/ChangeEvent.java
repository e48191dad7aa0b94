/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.walcapture.annotation.Immutable;
import io.walcapture.connector.postgresql.connection.Lsn;
import io.walcapture.relational.TableId;

/**
 * One captured row change. Changes read from the replication stream carry the log position of the chunk that
 * contained them; rows exported by a snapshot or a table read have no position.
 */
@Immutable
public final class ChangeEvent {

    public enum Operation {
        INSERT("insert"),
        UPDATE("update"),
        DELETE("delete");

        private final String kind;

        Operation(String kind) {
            this.kind = kind;
        }

        public String kind() {
            return kind;
        }

        /**
         * @param kind the change kind as reported by the decoding plugin, e.g. {@code insert}
         * @return the matching operation, or null for any other kind
         */
        public static Operation parse(String kind) {
            if (kind == null) {
                return null;
            }
            for (Operation operation : values()) {
                if (operation.kind.equalsIgnoreCase(kind.trim())) {
                    return operation;
                }
            }
            return null;
        }
    }

    private final Operation operation;
    private final TableId tableId;
    private final Map<String, Object> values;
    private final Map<String, Object> keys;
    private final Lsn position;
    private final String commitTime;

    public ChangeEvent(Operation operation, TableId tableId, Map<String, Object> values, Map<String, Object> keys,
                       Lsn position, String commitTime) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.tableId = Objects.requireNonNull(tableId, "table");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.keys = keys == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(keys));
        this.position = position;
        this.commitTime = commitTime;
    }

    /**
     * Creates the insert emitted for an existing row read outside of the replication stream.
     *
     * @param tableId the table the row belongs to
     * @param values the column values in table order
     * @return the change; never null
     */
    public static ChangeEvent read(TableId tableId, Map<String, Object> values) {
        return new ChangeEvent(Operation.INSERT, tableId, values, null, null, null);
    }

    public Operation operation() {
        return operation;
    }

    public TableId tableId() {
        return tableId;
    }

    /**
     * @return the column values by column name in column order; values may be null
     */
    public Map<String, Object> values() {
        return values;
    }

    /**
     * @return the identity of the previous row version for updates and deletes; empty for inserts
     */
    public Map<String, Object> keys() {
        return keys;
    }

    public Optional<Lsn> position() {
        return Optional.ofNullable(position);
    }

    public Optional<String> commitTime() {
        return Optional.ofNullable(commitTime);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ChangeEvent)) {
            return false;
        }
        final ChangeEvent other = (ChangeEvent) obj;
        return operation == other.operation
                && tableId.equals(other.tableId)
                && values.equals(other.values)
                && keys.equals(other.keys)
                && Objects.equals(position, other.position)
                && Objects.equals(commitTime, other.commitTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, tableId, values, keys, position);
    }

    @Override
    public String toString() {
        return "ChangeEvent [operation=" + operation + ", table=" + tableId + ", values=" + values + ", keys=" + keys
                + ", position=" + position + ", commitTime=" + commitTime + "]";
    }
}
