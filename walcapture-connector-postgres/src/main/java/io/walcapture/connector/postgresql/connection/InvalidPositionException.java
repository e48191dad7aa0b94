/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import io.walcapture.WalCaptureException;

/**
 * Raised when a log position cannot be parsed.
 */
public class InvalidPositionException extends WalCaptureException {

    private static final long serialVersionUID = 1L;

    public InvalidPositionException(String message) {
        super(message);
    }
}
