/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.relational;

import java.util.Objects;

import io.walcapture.annotation.Immutable;

/**
 * Unique identifier for a database table, made of its schema and table name.
 */
@Immutable
public final class TableId implements Comparable<TableId> {

    /**
     * Parse the supplied {@code schema.table} string into a TableId.
     *
     * @param str the string representation of the table identifier; may be null
     * @return the table ID, or null if it could not be parsed
     */
    public static TableId parse(String str) {
        if (str == null) {
            return null;
        }
        final String trimmed = str.trim();
        final int dot = trimmed.indexOf('.');
        if (dot <= 0 || dot == trimmed.length() - 1 || trimmed.indexOf('.', dot + 1) >= 0) {
            return null;
        }
        return new TableId(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    private final String schemaName;
    private final String tableName;
    private final String id;

    /**
     * Create a new table identifier.
     *
     * @param schemaName the name of the schema; may not be null
     * @param tableName the name of the table; may not be null
     */
    public TableId(String schemaName, String tableName) {
        this.schemaName = Objects.requireNonNull(schemaName, "schema name");
        this.tableName = Objects.requireNonNull(tableName, "table name");
        this.id = schemaName + "." + tableName;
    }

    public String schema() {
        return schemaName;
    }

    public String table() {
        return tableName;
    }

    /**
     * Get the {@code schema.table} form of this identifier, as used in configuration and persisted state.
     *
     * @return the identifier; never null
     */
    public String identifier() {
        return id;
    }

    /**
     * Returns a SQL-ready representation of this identifier with both parts in double quotes.
     *
     * @return the quoted identifier, e.g. {@code "public"."orders"}
     */
    public String toDoubleQuotedString() {
        return quote(schemaName) + "." + quote(tableName);
    }

    /**
     * Quote a single identifier part, doubling any embedded quote characters.
     *
     * @param identifierPart the schema, table or column name
     * @return the quoted name
     */
    public static String quote(String identifierPart) {
        return "\"" + identifierPart.replace("\"", "\"\"") + "\"";
    }

    @Override
    public int compareTo(TableId that) {
        if (this == that) {
            return 0;
        }
        return this.id.compareTo(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof TableId) {
            return this.compareTo((TableId) obj) == 0;
        }
        return false;
    }

    @Override
    public String toString() {
        return identifier();
    }
}
