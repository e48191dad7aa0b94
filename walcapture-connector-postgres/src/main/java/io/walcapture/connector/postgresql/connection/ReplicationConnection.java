/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import java.sql.SQLException;
import java.util.Optional;

import io.walcapture.annotation.NotThreadSafe;

/**
 * A Postgres logical streaming replication connection bound to one existing replication slot. The slot is never
 * created or dropped through this connection.
 */
@NotThreadSafe
public interface ReplicationConnection extends AutoCloseable {

    /**
     * Runs {@code IDENTIFY_SYSTEM} and logs what the server reports.
     *
     * @throws SQLException if the command fails
     */
    void identifySystem() throws SQLException;

    /**
     * Looks up the slot in the server's replication slot catalog.
     *
     * @return the slot state, or empty if no slot of that name exists
     * @throws SQLException if the catalog cannot be queried
     */
    Optional<SlotState> readSlotState() throws SQLException;

    /**
     * Opens a stream that starts at the given position, i.e. the server sends changes committed after it.
     *
     * @param offset the position to resume from; may not be null
     * @return the open stream; never null
     * @throws SQLException if the replication command fails
     */
    ReplicationStream startStreaming(Lsn offset) throws SQLException;

    /**
     * @return the name of the slot this connection streams from
     */
    String slotName();

    /**
     * Closes the connection, which also ends any stream opened through it.
     */
    @Override
    void close() throws SQLException;
}
