/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import io.walcapture.WalCaptureException;
import io.walcapture.connector.postgresql.connection.Lsn;

/**
 * Raised when a position could not be acknowledged to the server or could not be stored afterwards.
 */
public class AcknowledgementException extends WalCaptureException {

    private static final long serialVersionUID = 1L;

    private final Lsn position;

    public AcknowledgementException(Lsn position, Throwable cause) {
        super("Failed to acknowledge position " + position.asString() + ": " + cause.getMessage(), cause);
        this.position = position;
    }

    public Lsn position() {
        return position;
    }
}
