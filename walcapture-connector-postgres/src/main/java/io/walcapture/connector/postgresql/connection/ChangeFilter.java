/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import io.walcapture.connector.postgresql.ChangeEvent;
import io.walcapture.function.BlockingConsumer;

/**
 * Decodes the payload of one replication chunk into change events, keeping only changes of the tables of interest.
 */
@FunctionalInterface
public interface ChangeFilter {

    /**
     * Decodes the payload and hands every change of an included table to the consumer, in payload order.
     *
     * @param position the position of the chunk, carried on every produced change
     * @param payload the raw output of the decoding plugin
     * @param consumer receives the decoded changes; may block
     * @throws InterruptedException if the consumer was interrupted while blocked
     * @throws ReplicationProtocolException if the payload cannot be decoded
     */
    void filterChanges(Lsn position, byte[] payload, BlockingConsumer<ChangeEvent> consumer) throws InterruptedException;
}
