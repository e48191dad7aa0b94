/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import io.walcapture.WalCaptureException;
import io.walcapture.connector.postgresql.connection.Lsn;

/**
 * Raised when the persisted position is ahead of the position the server confirms for the slot.
 */
public class ReplicationStateMismatchException extends WalCaptureException {

    private static final long serialVersionUID = 1L;

    private final Lsn persisted;
    private final Lsn confirmed;

    public ReplicationStateMismatchException(String slotName, Lsn persisted, Lsn confirmed) {
        super("Persisted position " + persisted.asString() + " is ahead of the confirmed flush position "
                + confirmed.asString() + " of slot '" + slotName + "'; the slot and the stored state have drifted apart");
        this.persisted = persisted;
        this.confirmed = confirmed;
    }

    public Lsn persisted() {
        return persisted;
    }

    public Lsn confirmed() {
        return confirmed;
    }
}
