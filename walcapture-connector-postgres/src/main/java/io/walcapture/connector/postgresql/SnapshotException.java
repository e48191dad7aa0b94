/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import io.walcapture.WalCaptureException;
import io.walcapture.relational.TableId;

/**
 * Raised when the initial export of a table fails. The run is aborted, no partial export is reported as complete.
 */
public class SnapshotException extends WalCaptureException {

    private static final long serialVersionUID = 1L;

    private final TableId tableId;

    public SnapshotException(TableId tableId, Throwable cause) {
        super("Snapshot of table '" + tableId + "' failed: " + cause.getMessage(), cause);
        this.tableId = tableId;
    }

    public TableId tableId() {
        return tableId;
    }
}
