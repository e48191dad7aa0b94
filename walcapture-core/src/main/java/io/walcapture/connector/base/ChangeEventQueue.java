/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.base;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walcapture.annotation.ThreadSafe;
import io.walcapture.util.Clock;
import io.walcapture.util.Threads;
import io.walcapture.util.Threads.Timer;

/**
 * A queue which serves as handover point between a producer thread (the snapshot and replication stream readers) and
 * the consuming thread that invokes the caller's handler.
 * <p>
 * The queue is bounded and applies back-pressure semantics, i.e. if it holds the maximum number of elements,
 * subsequent calls to {@link #enqueue(Object)} will block until elements have been removed from the queue or the
 * queue has been {@link #close() closed}. Nothing is ever dropped.
 * <p>
 * If an exception occurs on the producer side, the producer should make that exception known by calling
 * {@link #producerException(RuntimeException)} before stopping its operation. Once the elements enqueued before the
 * failure have been drained, the next call to {@link #poll()} raises that exception.
 *
 * @param <T> the type of events in this queue
 */
@ThreadSafe
public class ChangeEventQueue<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeEventQueue.class);

    private final Duration pollInterval;
    private final int maxBatchSize;
    private final int maxQueueSize;
    private final Clock clock;

    private final Lock lock;
    private final Condition isNotEmpty;
    private final Condition isNotFull;

    private final Queue<T> queue;

    private volatile RuntimeException producerException;
    private volatile boolean closed;

    private ChangeEventQueue(Duration pollInterval, int maxQueueSize, int maxBatchSize, Clock clock) {
        this.pollInterval = pollInterval;
        this.maxBatchSize = maxBatchSize;
        this.maxQueueSize = maxQueueSize;
        this.clock = clock;

        this.lock = new ReentrantLock();
        this.isNotEmpty = lock.newCondition();
        this.isNotFull = lock.newCondition();

        this.queue = new ArrayDeque<>(maxQueueSize);
    }

    public static class Builder<T> {

        private Duration pollInterval = Duration.ofMillis(500);
        private int maxQueueSize = 16;
        private int maxBatchSize = 16;
        private Clock clock = Clock.SYSTEM;

        public Builder<T> pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder<T> maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder<T> maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder<T> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ChangeEventQueue<T> build() {
            if (maxQueueSize < 1) {
                throw new IllegalArgumentException("Queue size must be positive but was " + maxQueueSize);
            }
            return new ChangeEventQueue<T>(pollInterval, maxQueueSize, Math.max(1, maxBatchSize), clock);
        }
    }

    /**
     * Enqueues a record so that it can be obtained via {@link #poll()}. This method will block while the queue is full.
     *
     * @param record the record to be enqueued
     * @return {@code true} if the record was enqueued, or {@code false} if the queue has been closed
     * @throws InterruptedException if this thread has been interrupted
     */
    public boolean enqueue(T record) throws InterruptedException {
        if (record == null) {
            return !closed;
        }

        // The calling thread has been interrupted, let's abort
        if (Thread.interrupted()) {
            throw new InterruptedException();
        }

        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Enqueuing change event '{}'", record);
        }

        lock.lockInterruptibly();
        try {
            while (!closed && queue.size() >= maxQueueSize) {
                isNotFull.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            }
            if (closed) {
                LOGGER.debug("Queue closed, discarding change event");
                return false;
            }
            queue.add(record);
            isNotEmpty.signalAll();
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Returns the next batch of elements from this queue. May be empty in case no elements have arrived in the
     * poll interval or the queue has been closed.
     *
     * @return the drained elements in enqueue order; never null
     * @throws InterruptedException if this thread has been interrupted while waiting for more elements to arrive
     */
    public List<T> poll() throws InterruptedException {
        final Timer timeout = Threads.timer(clock, pollInterval);
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !closed && !timeout.expired()) {
                throwProducerExceptionIfPresent();
                long remainingTimeoutMills = timeout.remaining().toMillis();
                if (remainingTimeoutMills > 0) {
                    isNotEmpty.await(remainingTimeoutMills, TimeUnit.MILLISECONDS);
                }
            }
            if (queue.isEmpty()) {
                throwProducerExceptionIfPresent();
            }
            final List<T> records = new ArrayList<>(Math.min(maxBatchSize, queue.size()));
            while (records.size() < maxBatchSize && !queue.isEmpty()) {
                records.add(queue.poll());
            }
            isNotFull.signalAll();
            return records;
        }
        finally {
            lock.unlock();
        }
    }

    public void producerException(final RuntimeException producerException) {
        this.producerException = producerException;
        signalAll();
    }

    private void throwProducerExceptionIfPresent() {
        if (producerException != null) {
            throw producerException;
        }
    }

    /**
     * Closes this queue, releasing any producer blocked in {@link #enqueue(Object)}. Elements still held are discarded.
     */
    public void close() {
        closed = true;
        lock.lock();
        try {
            queue.clear();
            isNotFull.signalAll();
            isNotEmpty.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void signalAll() {
        lock.lock();
        try {
            isNotEmpty.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    public int totalCapacity() {
        return maxQueueSize;
    }

    public int remainingCapacity() {
        lock.lock();
        try {
            return maxQueueSize - queue.size();
        }
        finally {
            lock.unlock();
        }
    }
}
