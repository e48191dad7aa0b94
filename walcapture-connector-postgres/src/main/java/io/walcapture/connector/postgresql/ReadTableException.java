/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import io.walcapture.WalCaptureException;

/**
 * Raised by {@link PostgresTableReader} when a page of a table cannot be read.
 */
public class ReadTableException extends WalCaptureException {

    private static final long serialVersionUID = 1L;

    private final String schema;
    private final String table;
    private final String statement;

    public ReadTableException(String schema, String table, String statement, Throwable cause) {
        super("Failed to read table '" + schema + "." + table + "' with '" + statement + "': " + cause.getMessage(), cause);
        this.schema = schema;
        this.table = table;
        this.statement = statement;
    }

    public String schema() {
        return schema;
    }

    public String table() {
        return table;
    }

    public String statement() {
        return statement;
    }
}
