/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import io.walcapture.WalCaptureException;

/**
 * Raised for a malformed frame or payload, an error response from the server, an unexpected frame type or a stream
 * that ends while replication is running. Always fatal for the replication session.
 */
public class ReplicationProtocolException extends WalCaptureException {

    private static final long serialVersionUID = 1L;

    public ReplicationProtocolException(String message) {
        super(message);
    }

    public ReplicationProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
