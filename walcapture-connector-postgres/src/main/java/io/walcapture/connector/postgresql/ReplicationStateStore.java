/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

/**
 * The durable holder of the {@link ReplicationState}. It is read once at startup and written after every successful
 * acknowledgment, always from the same thread.
 */
public interface ReplicationStateStore {

    /**
     * @return the stored state, or {@link ReplicationState#empty()} if nothing was stored yet
     * @throws io.walcapture.WalCaptureException if the state cannot be read
     */
    ReplicationState load();

    /**
     * @param state the state to store; never null
     * @throws io.walcapture.WalCaptureException if the state cannot be written
     */
    void store(ReplicationState state);
}
