/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import io.walcapture.annotation.Immutable;

/**
 * A simple data container that holds the state of a replication slot as reported by {@code pg_replication_slots}.
 */
@Immutable
public class SlotState {
    private final Lsn confirmedFlushLsn;
    private final Lsn restartLsn;
    private final String plugin;
    private final boolean active;

    public SlotState(Lsn confirmedFlushLsn, Lsn restartLsn, String plugin, boolean active) {
        this.confirmedFlushLsn = confirmedFlushLsn;
        this.restartLsn = restartLsn;
        this.plugin = plugin;
        this.active = active;
    }

    /**
     * @return the slot's {@code confirmed_flush_lsn} value, or null if the slot has never been consumed from
     */
    public Lsn confirmedFlushLsn() {
        return confirmedFlushLsn;
    }

    /**
     * @return the slot's {@code restart_lsn} value; may be null
     */
    public Lsn restartLsn() {
        return restartLsn;
    }

    /**
     * @return the output plugin of the slot, null for physical slots
     */
    public String plugin() {
        return plugin;
    }

    /**
     * @return if another connection is currently streaming from the slot
     */
    public boolean isActive() {
        return active;
    }

    @Override
    public String toString() {
        return "SlotState [confirmedFlushLsn=" + confirmedFlushLsn + ", restartLsn=" + restartLsn + ", plugin=" + plugin
                + ", active=" + active + "]";
    }
}
