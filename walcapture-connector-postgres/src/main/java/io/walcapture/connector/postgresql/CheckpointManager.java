/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walcapture.annotation.NotThreadSafe;
import io.walcapture.annotation.SingleThreadAccess;
import io.walcapture.connector.postgresql.connection.Lsn;
import io.walcapture.connector.postgresql.connection.ReplicationStream;
import io.walcapture.relational.TableId;

/**
 * Reports progress to the server and keeps the {@link ReplicationState} in line with what the server was told.
 * The state only advances once the status update confirming a position has been sent, and it is stored right after.
 */
@NotThreadSafe
public class CheckpointManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(CheckpointManager.class);

    private final ReplicationStateStore store;
    private final Set<TableId> streamedTables;
    private final Lsn resumePosition;
    @SingleThreadAccess("streaming thread")
    private ReplicationState state;

    /**
     * @param store the store receiving every acknowledged state
     * @param initialState the state the run started from
     * @param resumePosition the position streaming started from
     * @param streamedTables the tables being streamed, recorded as snapshotted on acknowledgment
     */
    public CheckpointManager(ReplicationStateStore store, ReplicationState initialState, Lsn resumePosition, Set<TableId> streamedTables) {
        this.store = store;
        this.state = initialState;
        this.resumePosition = resumePosition;
        this.streamedTables = Collections.unmodifiableSet(new LinkedHashSet<>(streamedTables));
    }

    /**
     * Confirms to the server that everything before the given position has been processed and stores the new state.
     *
     * @param stream the open replication stream
     * @param position the position to confirm
     * @throws AcknowledgementException if the status update or the store fails; the state is left unchanged
     */
    public void acknowledge(ReplicationStream stream, Lsn position) {
        try {
            stream.flushLsn(position);
        }
        catch (SQLException e) {
            throw new AcknowledgementException(position, e);
        }
        final ReplicationState next = state.acknowledged(position, streamedTables);
        try {
            store.store(next);
        }
        catch (RuntimeException e) {
            throw new AcknowledgementException(position, e);
        }
        state = next;
        LOGGER.debug("Acknowledged position {}", position.asString());
    }

    /**
     * Sends a status update that repeats the last acknowledged position as flushed, keeping the connection alive
     * without confirming anything new.
     *
     * @param stream the open replication stream
     * @throws SQLException if the update cannot be sent
     */
    public void keepalive(ReplicationStream stream) throws SQLException {
        stream.sendStatusUpdate();
    }

    /**
     * @return the last position confirmed to the server, or the resume position if none was confirmed in this run
     */
    public Lsn lastAcknowledged() {
        return state.lsn().filter(lsn -> lsn.compareTo(resumePosition) >= 0).orElse(resumePosition);
    }

    /**
     * @return true if the stored state does not yet list every streamed table
     */
    public boolean hasUnrecordedTables() {
        return !state.streams().containsAll(streamedTables);
    }

    public ReplicationState state() {
        return state;
    }
}
