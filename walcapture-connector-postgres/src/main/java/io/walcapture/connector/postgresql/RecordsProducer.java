/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walcapture.function.BlockingConsumer;
import io.walcapture.util.Clock;

/**
 * Base of the components that turn database content into {@link ChangeEvent}s.
 */
public abstract class RecordsProducer {

    protected final Logger logger = LoggerFactory.getLogger(getClass());
    protected final PostgresTaskContext taskContext;

    protected RecordsProducer(PostgresTaskContext taskContext) {
        assert taskContext != null;
        this.taskContext = taskContext;
    }

    /**
     * Produces change events on the calling thread until done, stopped or failed.
     *
     * @param eventConsumer a consumer of {@link ChangeEvent} instances, may not be null
     * @throws InterruptedException if the thread was interrupted, usually because the producer is being stopped
     */
    protected abstract void produce(BlockingConsumer<ChangeEvent> eventConsumer) throws InterruptedException;

    /**
     * Requests that this producer be stopped, closing the connection it reads from. May be called from any thread.
     */
    protected abstract void stop();

    protected Clock clock() {
        return taskContext.getClock();
    }
}
