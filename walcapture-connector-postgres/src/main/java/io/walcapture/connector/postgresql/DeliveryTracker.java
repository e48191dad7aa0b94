/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import io.walcapture.annotation.ThreadSafe;
import io.walcapture.connector.postgresql.connection.Lsn;

/**
 * Tracks which changes handed to the queue have been delivered to the handler, so that only positions whose changes
 * have all been delivered are acknowledged. The producer counts every change it enqueues and marks the end of every
 * chunk; the consumer counts every change it delivered.
 */
@ThreadSafe
public class DeliveryTracker {

    private static final class ChunkEnd {
        private final long enqueued;
        private Lsn position;

        private ChunkEnd(long enqueued, Lsn position) {
            this.enqueued = enqueued;
            this.position = position;
        }
    }

    private final Deque<ChunkEnd> chunkEnds = new ArrayDeque<>();
    private long enqueued;
    private long delivered;
    private Lsn processedPosition;

    /**
     * Called by the producer before a change is put into the queue.
     */
    public synchronized void enqueued() {
        enqueued++;
    }

    /**
     * Called by the producer once every change of the chunk ending at the given position has been put into the queue,
     * including chunks without any captured change.
     *
     * @param position the position following the chunk
     */
    public synchronized void chunkCompleted(Lsn position) {
        final ChunkEnd last = chunkEnds.peekLast();
        if (last != null && last.enqueued == enqueued) {
            // nothing was enqueued since, only the later position matters
            last.position = position;
        }
        else {
            chunkEnds.addLast(new ChunkEnd(enqueued, position));
        }
    }

    /**
     * Called by the consumer once the handler returned for a change.
     */
    public synchronized void delivered() {
        delivered++;
    }

    /**
     * @return the position following the last chunk whose changes have all been delivered, empty if there is none
     */
    public synchronized Optional<Lsn> processedPosition() {
        while (!chunkEnds.isEmpty() && chunkEnds.peekFirst().enqueued <= delivered) {
            processedPosition = chunkEnds.pollFirst().position;
        }
        return Optional.ofNullable(processedPosition);
    }

    /**
     * @return true if every enqueued change has been delivered
     */
    public synchronized boolean isDrained() {
        return delivered >= enqueued;
    }
}
