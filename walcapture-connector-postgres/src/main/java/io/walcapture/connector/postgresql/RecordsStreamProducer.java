/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

import io.walcapture.WalCaptureException;
import io.walcapture.annotation.ThreadSafe;
import io.walcapture.connector.postgresql.connection.ChangeFilter;
import io.walcapture.connector.postgresql.connection.Lsn;
import io.walcapture.connector.postgresql.connection.ReplicationConnection;
import io.walcapture.connector.postgresql.connection.ReplicationProtocolException;
import io.walcapture.connector.postgresql.connection.ReplicationStream;
import io.walcapture.connector.postgresql.connection.WalChunk;
import io.walcapture.function.BlockingConsumer;
import io.walcapture.util.Threads;
import io.walcapture.util.Threads.Timer;

/**
 * A {@link RecordsProducer} which creates {@link ChangeEvent}s from a Postgres streaming replication connection.
 * <p>
 * The loop is driven by a status update deadline and by the chunks the server sends. Once the deadline expires the
 * position following the last chunk whose changes have all been delivered to the handler is acknowledged; with
 * nothing new to acknowledge a plain keepalive repeating the last acknowledged position is sent instead. Keepalives
 * of the server asking for a reply are answered by the driver while the loop waits for chunks.
 */
@ThreadSafe
public class RecordsStreamProducer extends RecordsProducer {

    private final ReplicationConnection replicationConnection;
    private final CheckpointManager checkpointManager;
    private final DeliveryTracker deliveryTracker;
    private final ChangeFilter changeFilter;
    private final Duration statusUpdateInterval;

    /**
     * Creates new producer instance for the given task context.
     *
     * @param taskContext a {@link PostgresTaskContext}, never null
     * @param replicationConnection the connection to stream from, owned by this producer from now on
     * @param checkpointManager tracks and acknowledges the processed position
     * @param deliveryTracker tells which chunks have been delivered completely
     * @param changeFilter decodes the chunks of the stream
     */
    public RecordsStreamProducer(PostgresTaskContext taskContext, ReplicationConnection replicationConnection,
                                 CheckpointManager checkpointManager, DeliveryTracker deliveryTracker, ChangeFilter changeFilter) {
        super(taskContext);
        this.replicationConnection = replicationConnection;
        this.checkpointManager = checkpointManager;
        this.deliveryTracker = deliveryTracker;
        this.changeFilter = changeFilter;
        this.statusUpdateInterval = taskContext.config().statusUpdateInterval();
    }

    @Override
    protected void produce(BlockingConsumer<ChangeEvent> eventConsumer) throws InterruptedException {
        final Lsn startPosition = checkpointManager.lastAcknowledged();
        final ReplicationStream stream;
        try {
            stream = replicationConnection.startStreaming(startPosition);
        }
        catch (SQLException e) {
            throw new ReplicationProtocolException("Unable to start replication from slot '" + replicationConnection.slotName()
                    + "' at " + startPosition.asString() + ": " + e.getMessage(), e);
        }
        streamChanges(stream, eventConsumer);
    }

    /**
     * Runs the main loop until the thread is interrupted or a fatal error occurs.
     *
     * @param stream the open stream
     * @param consumer receives the decoded changes in commit order
     * @throws InterruptedException if the thread was interrupted while waiting
     */
    void streamChanges(ReplicationStream stream, BlockingConsumer<ChangeEvent> consumer) throws InterruptedException {
        Timer deadline = Threads.timer(clock(), statusUpdateInterval);
        // run while we haven't been requested to stop
        while (!Thread.currentThread().isInterrupted()) {
            if (deadline.expired()) {
                commitProcessedPosition(stream);
                deadline = Threads.timer(clock(), statusUpdateInterval);
                continue;
            }

            final Optional<WalChunk> chunk = read(stream, deadline.remaining());
            if (!chunk.isPresent()) {
                continue;
            }
            final Lsn position = chunk.get().nextPosition();
            if (logger.isDebugEnabled()) {
                logger.debug("received new message at position {}", position.asString());
            }
            changeFilter.filterChanges(position, chunk.get().data(), consumer);
            deliveryTracker.chunkCompleted(position);
        }
        logger.info("Streaming from slot '{}' interrupted", replicationConnection.slotName());
    }

    private void commitProcessedPosition(ReplicationStream stream) {
        final Lsn lastAcknowledged = checkpointManager.lastAcknowledged();
        final Optional<Lsn> processed = deliveryTracker.processedPosition();
        if (processed.isPresent() && processed.get().isAfter(lastAcknowledged)) {
            checkpointManager.acknowledge(stream, processed.get());
        }
        else if (checkpointManager.hasUnrecordedTables() && deliveryTracker.isDrained()) {
            // records the completed snapshots even while the slot is idle
            checkpointManager.acknowledge(stream, lastAcknowledged);
        }
        else {
            sendKeepalive(stream);
        }
    }

    private Optional<WalChunk> read(ReplicationStream stream, Duration timeout) throws InterruptedException {
        try {
            return stream.read(timeout);
        }
        catch (SQLException e) {
            throw new ReplicationProtocolException("Failed to read from slot '" + replicationConnection.slotName() + "': " + e.getMessage(), e);
        }
    }

    private void sendKeepalive(ReplicationStream stream) {
        try {
            checkpointManager.keepalive(stream);
        }
        catch (SQLException e) {
            throw new ReplicationProtocolException("Failed to send status update to slot '" + replicationConnection.slotName() + "': "
                    + e.getMessage(), e);
        }
    }

    /**
     * Closes the replication connection, which also ends a stream blocked in a read.
     */
    @Override
    protected synchronized void stop() {
        try {
            logger.debug("stopping streaming...");
            // closing the connection also disconnects the current stream even if it's blocking
            replicationConnection.close();
        }
        catch (SQLException e) {
            throw new WalCaptureException("Unable to close the replication connection", e);
        }
    }
}
