/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import static io.walcapture.connector.postgresql.TestHelper.CUSTOMERS;
import static io.walcapture.connector.postgresql.TestHelper.ORDERS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import io.walcapture.WalCaptureException;
import io.walcapture.connector.postgresql.connection.FakeReplicationStream;
import io.walcapture.connector.postgresql.connection.FakeReplicationStream.StatusUpdate;
import io.walcapture.connector.postgresql.connection.Lsn;
import io.walcapture.relational.TableId;

public class CheckpointManagerTest {

    private static final Lsn RESUME = Lsn.valueOf("0/100");

    private final Set<TableId> tables = new LinkedHashSet<>(Arrays.asList(ORDERS, CUSTOMERS));
    private MemoryReplicationStateStore store;
    private FakeReplicationStream stream;
    private CheckpointManager checkpointManager;

    @Before
    public void beforeEach() {
        store = new MemoryReplicationStateStore();
        stream = new FakeReplicationStream();
        stream.startAt(RESUME);
        checkpointManager = new CheckpointManager(store, ReplicationState.empty(), RESUME, tables);
    }

    @Test
    public void shouldStartFromResumePosition() {
        assertThat(checkpointManager.lastAcknowledged()).isEqualTo(RESUME);
        assertThat(checkpointManager.hasUnrecordedTables()).isTrue();
    }

    @Test
    public void shouldSendAndStoreAcknowledgedPosition() {
        checkpointManager.acknowledge(stream, Lsn.valueOf("0/180"));

        assertThat(stream.statusUpdates()).containsExactly(new StatusUpdate(RESUME, Lsn.valueOf("0/180")));
        assertThat(store.load().lsn()).contains(Lsn.valueOf("0/180"));
        assertThat(store.load().streams()).containsExactlyInAnyOrder(ORDERS, CUSTOMERS);
        assertThat(checkpointManager.lastAcknowledged()).isEqualTo(Lsn.valueOf("0/180"));
        assertThat(checkpointManager.hasUnrecordedTables()).isFalse();
    }

    @Test
    public void shouldKeepStateWhenStatusUpdateFails() {
        stream.failSendsWith(new SQLException("connection reset"));

        assertThatThrownBy(() -> checkpointManager.acknowledge(stream, Lsn.valueOf("0/180")))
                .isInstanceOfSatisfying(AcknowledgementException.class,
                        e -> assertThat(e.position()).isEqualTo(Lsn.valueOf("0/180")))
                .hasCauseInstanceOf(SQLException.class);

        assertThat(store.load()).isEqualTo(ReplicationState.empty());
        assertThat(checkpointManager.state()).isEqualTo(ReplicationState.empty());
        assertThat(checkpointManager.lastAcknowledged()).isEqualTo(RESUME);
    }

    @Test
    public void shouldKeepStateWhenStoreFails() {
        checkpointManager = new CheckpointManager(new ReplicationStateStore() {
            @Override
            public ReplicationState load() {
                return ReplicationState.empty();
            }

            @Override
            public void store(ReplicationState state) {
                throw new WalCaptureException("disk full");
            }
        }, ReplicationState.empty(), RESUME, tables);

        assertThatThrownBy(() -> checkpointManager.acknowledge(stream, Lsn.valueOf("0/180")))
                .isInstanceOf(AcknowledgementException.class)
                .hasCauseInstanceOf(WalCaptureException.class);
        assertThat(checkpointManager.state()).isEqualTo(ReplicationState.empty());
    }

    @Test
    public void shouldRepeatLastAcknowledgedPositionInKeepalive() throws Exception {
        checkpointManager.keepalive(stream);
        checkpointManager.acknowledge(stream, Lsn.valueOf("0/180"));
        checkpointManager.keepalive(stream);

        assertThat(stream.statusUpdates()).containsExactly(
                new StatusUpdate(RESUME, RESUME),
                new StatusUpdate(RESUME, Lsn.valueOf("0/180")),
                new StatusUpdate(RESUME, Lsn.valueOf("0/180")));
    }

    @Test
    public void shouldIgnoreStoredPositionBehindResumePosition() {
        checkpointManager = new CheckpointManager(store, ReplicationState.of(Lsn.valueOf("0/80"), Collections.singleton(ORDERS)),
                RESUME, tables);

        assertThat(checkpointManager.lastAcknowledged()).isEqualTo(RESUME);
        assertThat(checkpointManager.hasUnrecordedTables()).isTrue();
    }
}
