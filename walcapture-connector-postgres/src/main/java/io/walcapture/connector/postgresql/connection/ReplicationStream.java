/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

import io.walcapture.annotation.NotThreadSafe;

/**
 * A stream from which messages sent by a logical decoding plugin can be consumed over a Postgres replication
 * connection, and through which the client reports its progress back to the server.
 */
@NotThreadSafe
public interface ReplicationStream {

    /**
     * Blocks until the next chunk arrives or the timeout expires. Keepalive messages of the server are answered while
     * waiting and never returned.
     *
     * @param timeout how long to wait for a chunk
     * @return the chunk, or empty if none arrived in time
     * @throws SQLException if anything unexpected fails on the connection
     * @throws InterruptedException if the calling thread was interrupted while waiting
     * @throws ReplicationProtocolException if the server ended the stream
     */
    Optional<WalChunk> read(Duration timeout) throws SQLException, InterruptedException;

    /**
     * Reports the given position as flushed and applied and sends a status update at once. The server may recycle
     * the log before a flushed position.
     *
     * @param position the position processed durably
     * @throws SQLException if the update cannot be sent
     */
    void flushLsn(Lsn position) throws SQLException;

    /**
     * Sends a status update at once, repeating the positions reported so far.
     *
     * @throws SQLException if the update cannot be sent
     */
    void sendStatusUpdate() throws SQLException;

    /**
     * @return the start position of the last chunk received, or the start position if none was received yet
     */
    Lsn lastReceivedLsn();

    /**
     * @return the position the stream was started from; never null
     */
    Lsn startPosition();
}
