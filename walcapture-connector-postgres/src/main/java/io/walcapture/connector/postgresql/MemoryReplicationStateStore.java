/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import io.walcapture.annotation.ThreadSafe;

/**
 * Keeps the state in memory only, for callers that persist it themselves.
 */
@ThreadSafe
public class MemoryReplicationStateStore implements ReplicationStateStore {

    private volatile ReplicationState state;

    public MemoryReplicationStateStore() {
        this(ReplicationState.empty());
    }

    public MemoryReplicationStateStore(ReplicationState initial) {
        this.state = initial;
    }

    @Override
    public ReplicationState load() {
        return state;
    }

    @Override
    public void store(ReplicationState state) {
        this.state = state;
    }
}
