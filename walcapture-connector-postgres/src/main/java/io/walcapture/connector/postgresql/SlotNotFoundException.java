/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import io.walcapture.WalCaptureException;

/**
 * Raised when the configured replication slot does not exist, or exists without a position to resume from.
 * Slots are provisioned outside of the engine.
 */
public class SlotNotFoundException extends WalCaptureException {

    private static final long serialVersionUID = 1L;

    private final String slotName;

    public SlotNotFoundException(String slotName, String message) {
        super(message);
        this.slotName = slotName;
    }

    public String slotName() {
        return slotName;
    }
}
