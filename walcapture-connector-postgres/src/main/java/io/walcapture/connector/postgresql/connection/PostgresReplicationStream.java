/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import java.nio.ByteBuffer;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walcapture.annotation.NotThreadSafe;
import io.walcapture.util.Clock;
import io.walcapture.util.Metronome;
import io.walcapture.util.Threads;
import io.walcapture.util.Threads.Timer;

/**
 * A {@link ReplicationStream} on top of the pgjdbc {@link PGReplicationStream}. The driver decodes the XLogData and
 * keepalive messages and replies to keepalives asking for an answer; this class polls it without blocking until a
 * chunk arrives or the timeout expires.
 */
@NotThreadSafe
public class PostgresReplicationStream implements ReplicationStream {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresReplicationStream.class);

    static final Duration PAUSE_BETWEEN_READS = Duration.ofMillis(10);

    private final PGReplicationStream stream;
    private final Lsn startPosition;
    private final Clock clock;

    public PostgresReplicationStream(PGReplicationStream stream, Lsn startPosition, Clock clock) {
        this.stream = stream;
        this.startPosition = startPosition;
        this.clock = clock;
        // the start position is already confirmed, so reporting it never moves the slot
        final LogSequenceNumber start = LogSequenceNumber.valueOf(startPosition.asLong());
        stream.setFlushedLSN(start);
        stream.setAppliedLSN(start);
    }

    @Override
    public Optional<WalChunk> read(Duration timeout) throws SQLException, InterruptedException {
        final Timer timer = Threads.timer(clock, timeout);
        final Metronome metronome = Metronome.parker(PAUSE_BETWEEN_READS, clock);
        while (true) {
            final ByteBuffer buffer;
            try {
                buffer = stream.readPending();
            }
            catch (SQLException e) {
                throw new ReplicationProtocolException("Failed to read from the replication stream: " + e.getMessage(), e);
            }
            if (buffer != null) {
                final byte[] data = new byte[buffer.remaining()];
                buffer.get(data);
                final WalChunk chunk = new WalChunk(lastReceivedLsn(), data);
                if (LOGGER.isTraceEnabled()) {
                    LOGGER.trace("Received {}", chunk);
                }
                return Optional.of(chunk);
            }
            if (stream.isClosed()) {
                throw new ReplicationProtocolException("The server ended the replication stream");
            }
            if (timer.expired()) {
                return Optional.empty();
            }
            metronome.pause();
        }
    }

    @Override
    public void flushLsn(Lsn position) throws SQLException {
        final LogSequenceNumber lsn = LogSequenceNumber.valueOf(position.asLong());
        stream.setFlushedLSN(lsn);
        stream.setAppliedLSN(lsn);
        stream.forceUpdateStatus();
        LOGGER.debug("Flushed position {}", position.asString());
    }

    @Override
    public void sendStatusUpdate() throws SQLException {
        stream.forceUpdateStatus();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Sent status update received={} flushed={}", stream.getLastReceiveLSN().asString(),
                    stream.getLastFlushedLSN().asString());
        }
    }

    @Override
    public Lsn lastReceivedLsn() {
        final LogSequenceNumber lsn = stream.getLastReceiveLSN();
        return lsn == null ? startPosition : Lsn.valueOf(lsn.asLong());
    }

    @Override
    public Lsn startPosition() {
        return startPosition;
    }
}
