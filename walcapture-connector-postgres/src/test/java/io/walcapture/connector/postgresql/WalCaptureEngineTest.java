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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.awaitility.Awaitility;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import io.walcapture.WalCaptureException;
import io.walcapture.config.Configuration;
import io.walcapture.config.InvalidConfigurationException;
import io.walcapture.connector.postgresql.ChangeEvent.Operation;
import io.walcapture.connector.postgresql.connection.FakeReplicationConnection;
import io.walcapture.connector.postgresql.connection.FakeReplicationStream;
import io.walcapture.connector.postgresql.connection.Lsn;
import io.walcapture.connector.postgresql.connection.PostgresConnection;
import io.walcapture.connector.postgresql.connection.ReplicationConnection;
import io.walcapture.connector.postgresql.connection.ReplicationProtocolException;
import io.walcapture.connector.postgresql.connection.SlotState;

public class WalCaptureEngineTest {

    private static final Lsn SLOT_POSITION = Lsn.valueOf("0/100");

    private TestDatabase database;
    private FakeReplicationStream stream;
    private FakeReplicationConnection replication;
    private MemoryReplicationStateStore store;
    private List<ChangeEvent> changes;
    private ExecutorService executor;

    @Before
    public void beforeEach() {
        database = new TestDatabase();
        database.table(ORDERS, Arrays.asList("id", "total"), Arrays.asList("int4", "numeric"))
                .primaryKey("id")
                .row(1, "10.00")
                .row(2, "20.00")
                .row(3, "30.00");
        database.table(CUSTOMERS, Arrays.asList("id", "name"), Arrays.asList("int4", "text"))
                .primaryKey("id");
        stream = new FakeReplicationStream();
        replication = FakeReplicationConnection.withSlotAt(TestHelper.SLOT_NAME, SLOT_POSITION, stream);
        store = new MemoryReplicationStateStore();
        changes = new CopyOnWriteArrayList<>();
        executor = Executors.newSingleThreadExecutor();
    }

    @After
    public void afterEach() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private PostgresTaskContext taskContext(Configuration config, ReplicationConnection replicationConnection) {
        return new PostgresTaskContext(new PostgresConnectorConfig(config)) {
            @Override
            protected PostgresConnection createConnection() {
                return database.newConnection(config().getJdbcConfig());
            }

            @Override
            protected ReplicationConnection createReplicationConnection() {
                return replicationConnection;
            }
        };
    }

    private WalCaptureEngine engine(Configuration config) {
        return new WalCaptureEngine(taskContext(config, replication), store);
    }

    private WalCaptureEngine engine() {
        return engine(TestHelper.defaultConfig().build());
    }

    private void assertEverythingClosed() {
        assertThat(replication.isClosed()).isTrue();
        assertThat(stream.isClosed()).isTrue();
        assertThat(database.sessions()).allMatch(TestDatabase.Session::isClosed);
    }

    @Test
    public void shouldDeliverSnapshotBeforeLiveChanges() throws Exception {
        stream.addChunk(Lsn.valueOf("0/200"), TestHelper.insertOrder(4, "40.00"));
        WalCaptureEngine engine = engine();
        assertThat(replication.isIdentified()).isTrue();
        assertThat(engine.resumePosition()).isEqualTo(SLOT_POSITION);
        assertThat(engine.snapshotTables()).containsExactly(ORDERS);

        engine.run(change -> {
            changes.add(change);
            return changes.size() == 4 ? ChangeHandler.Signal.STOP : ChangeHandler.Signal.CONTINUE;
        });

        assertThat(changes).hasSize(4);
        assertThat(changes).extracting(change -> change.values().get("id")).containsExactly(1, 2, 3, 4);
        assertThat(changes.subList(0, 3)).allMatch(change -> change.operation() == Operation.INSERT && !change.position().isPresent());
        assertThat(changes.get(3).position()).isPresent();
        assertThat(stream.startPosition()).isEqualTo(SLOT_POSITION);
        assertThat(engine.isStopped()).isTrue();
        assertEverythingClosed();
    }

    @Test
    public void shouldResumeWithoutSnapshotAfterRestart() throws Exception {
        final String chunk = TestHelper.insertOrder(4, "40.00");
        final Lsn chunkEnd = Lsn.valueOf("0/200").advance(chunk.getBytes(StandardCharsets.UTF_8).length);
        stream.addChunk(Lsn.valueOf("0/200"), chunk);
        WalCaptureEngine first = engine();

        Future<?> running = executor.submit(() -> {
            first.run(change -> {
                changes.add(change);
                return ChangeHandler.Signal.CONTINUE;
            });
            return null;
        });
        Awaitility.await().atMost(5, TimeUnit.SECONDS)
                .until(() -> changes.size() == 4 && store.load().lsn().equals(Optional.of(chunkEnd)));
        first.stop();
        running.get(5, TimeUnit.SECONDS);
        assertThat(changes).hasSize(4);
        assertThat(store.load().streams()).containsExactlyInAnyOrder(ORDERS, CUSTOMERS);

        stream = new FakeReplicationStream();
        replication = FakeReplicationConnection.withSlotAt(TestHelper.SLOT_NAME, chunkEnd, stream);
        WalCaptureEngine second = engine();

        assertThat(second.resumePosition()).isEqualTo(chunkEnd);
        assertThat(second.snapshotTables()).isEmpty();
        second.close();
        assertEverythingClosed();
    }

    private static Lsn endOf(Lsn walStart, String chunk) {
        return walStart.advance(chunk.getBytes(StandardCharsets.UTF_8).length);
    }

    private static Configuration streamingOnly() {
        return TestHelper.defaultConfig().with(PostgresConnectorConfig.SNAPSHOT_INCLUDE_LIST, null).build();
    }

    @Test
    public void shouldNotAcknowledgeBeyondDeliveredChangesWhenHandlerStops() throws Exception {
        final String first = TestHelper.insertOrder(4, "40.00");
        final Lsn firstEnd = endOf(Lsn.valueOf("0/200"), first);
        stream.addChunk(Lsn.valueOf("0/200"), first)
                .addChunk(Lsn.valueOf("0/300"), TestHelper.insertOrder(5, "50.00"))
                .addChunk(Lsn.valueOf("0/400"), TestHelper.insertOrder(6, "60.00"));
        WalCaptureEngine engine = engine(streamingOnly());

        engine.run(change -> {
            changes.add(change);
            return ChangeHandler.Signal.STOP;
        });

        assertThat(changes).extracting(change -> change.values().get("id")).containsExactly(4);
        store.load().lsn().ifPresent(saved -> assertThat(saved.compareTo(firstEnd)).isLessThanOrEqualTo(0));
        assertThat(stream.statusUpdates()).allSatisfy(update -> assertThat(update.flushed.compareTo(firstEnd)).isLessThanOrEqualTo(0));
        assertEverythingClosed();
    }

    @Test
    public void shouldReplayASuffixOfTheChangesAfterRestart() throws Exception {
        final List<Lsn> starts = Arrays.asList(Lsn.valueOf("0/200"), Lsn.valueOf("0/300"), Lsn.valueOf("0/400"));
        final List<String> chunks = Arrays.asList(TestHelper.insertOrder(4, "40.00"), TestHelper.insertOrder(5, "50.00"),
                TestHelper.insertOrder(6, "60.00"));
        for (int i = 0; i < chunks.size(); i++) {
            stream.addChunk(starts.get(i), chunks.get(i));
        }
        final Lsn firstEnd = endOf(starts.get(0), chunks.get(0));
        WalCaptureEngine first = engine(streamingOnly());

        // the second change is held until the first one has been acknowledged, then the run stops
        first.run(change -> {
            changes.add(change);
            if (changes.size() == 1) {
                return ChangeHandler.Signal.CONTINUE;
            }
            Awaitility.await().atMost(5, TimeUnit.SECONDS).until(() -> store.load().lsn().equals(Optional.of(firstEnd)));
            return ChangeHandler.Signal.STOP;
        });
        final Lsn saved = store.load().lsn().get();
        assertThat(saved.compareTo(firstEnd)).isGreaterThanOrEqualTo(0);
        assertThat(saved.compareTo(endOf(starts.get(1), chunks.get(1)))).isLessThanOrEqualTo(0);
        final List<ChangeEvent> delivered = new CopyOnWriteArrayList<>(changes);

        // the slot replays every transaction ending after the confirmed position
        stream = new FakeReplicationStream();
        for (int i = 0; i < chunks.size(); i++) {
            if (endOf(starts.get(i), chunks.get(i)).isAfter(saved)) {
                stream.addChunk(starts.get(i), chunks.get(i));
            }
        }
        replication = FakeReplicationConnection.withSlotAt(TestHelper.SLOT_NAME, saved, stream);
        changes.clear();
        WalCaptureEngine second = engine(streamingOnly());
        assertThat(second.resumePosition()).isEqualTo(saved);

        second.run(change -> {
            changes.add(change);
            return Integer.valueOf(6).equals(change.values().get("id")) ? ChangeHandler.Signal.STOP : ChangeHandler.Signal.CONTINUE;
        });

        final List<Object> all = Arrays.asList(4, 5, 6);
        final List<Object> replayed = new ArrayList<>();
        changes.forEach(change -> replayed.add(change.values().get("id")));
        assertThat(replayed).isNotEmpty();
        assertThat(replayed).isEqualTo(all.subList(all.size() - replayed.size(), all.size()));
        assertThat(delivered).extracting(change -> change.values().get("id")).containsExactly(4, 5);
        // nothing between the two runs is lost
        assertThat(delivered.size() + replayed.size()).isGreaterThanOrEqualTo(all.size());
        assertEverythingClosed();
    }

    @Test
    public void shouldFailWithoutSlot() {
        replication = new FakeReplicationConnection(TestHelper.SLOT_NAME, Optional.empty(), stream);

        assertThatThrownBy(this::engine)
                .isInstanceOfSatisfying(SlotNotFoundException.class, e -> assertThat(e.slotName()).isEqualTo(TestHelper.SLOT_NAME));

        assertThat(replication.isStreaming()).isFalse();
        assertEverythingClosed();
    }

    @Test
    public void shouldFailWhenStoredPositionIsAheadOfSlot() {
        store = new MemoryReplicationStateStore(ReplicationState.of(Lsn.valueOf("0/500"), Collections.singleton(ORDERS)));

        assertThatThrownBy(this::engine).isInstanceOf(ReplicationStateMismatchException.class);

        assertEverythingClosed();
    }

    @Test
    public void shouldNotConnectWithInvalidConfiguration() {
        assertThatThrownBy(() -> engine(TestHelper.defaultConfig().with(PostgresConnectorConfig.SLOT_NAME, null).build()))
                .isInstanceOf(InvalidConfigurationException.class);

        assertThat(database.sessions()).isEmpty();
        assertThat(replication.isIdentified()).isFalse();
    }

    @Test
    public void shouldStopWhenNothingArrivesWithinInitialWait() throws Exception {
        WalCaptureEngine engine = engine(TestHelper.defaultConfig()
                .with(PostgresConnectorConfig.SNAPSHOT_INCLUDE_LIST, null)
                .with(PostgresConnectorConfig.INITIAL_WAIT_MS, 100)
                .build());

        engine.run(change -> {
            changes.add(change);
            return ChangeHandler.Signal.CONTINUE;
        });

        assertThat(changes).isEmpty();
        assertEverythingClosed();
    }

    @Test
    public void shouldWrapHandlerFailure() {
        WalCaptureEngine engine = engine();

        assertThatThrownBy(() -> engine.run(change -> {
            throw new IOException("downstream unavailable");
        })).isInstanceOf(WalCaptureException.class)
                .hasCauseInstanceOf(IOException.class);

        assertEverythingClosed();
    }

    @Test
    public void shouldReportProducerFailure() {
        stream.addChunk(Lsn.valueOf("0/200"), "{\"change\":[{\"kind\":\"insert\"}]}");
        WalCaptureEngine engine = engine(TestHelper.defaultConfig().with(PostgresConnectorConfig.SNAPSHOT_INCLUDE_LIST, null).build());

        assertThatThrownBy(() -> engine.run(change -> ChangeHandler.Signal.CONTINUE))
                .isInstanceOf(ReplicationProtocolException.class);

        assertEverythingClosed();
    }

    @Test
    public void shouldEndRunWhenStoppedFromAnotherThread() throws Exception {
        WalCaptureEngine engine = engine();
        Future<?> running = executor.submit(() -> {
            engine.run(change -> {
                changes.add(change);
                return ChangeHandler.Signal.CONTINUE;
            });
            return null;
        });
        Awaitility.await().atMost(5, TimeUnit.SECONDS).until(() -> replication.isStreaming() && changes.size() == 3);

        engine.stop();
        engine.stop();

        running.get(5, TimeUnit.SECONDS);
        assertThat(changes).hasSize(3);
        assertEverythingClosed();
    }

    @Test
    public void shouldRunOnlyOnce() throws Exception {
        WalCaptureEngine engine = engine();
        engine.stop();
        engine.run(change -> ChangeHandler.Signal.CONTINUE);

        assertThatThrownBy(() -> engine.run(change -> ChangeHandler.Signal.CONTINUE)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldResumeFromSlotPosition() {
        Optional<SlotState> slot = Optional.of(new SlotState(Lsn.valueOf("0/200"), Lsn.valueOf("0/180"), "wal2json", false));

        assertThat(WalCaptureEngine.resumePosition("s", slot, ReplicationState.empty())).isEqualTo(Lsn.valueOf("0/200"));
        assertThat(WalCaptureEngine.resumePosition("s", slot, ReplicationState.of(Lsn.valueOf("0/150"), Collections.emptySet())))
                .isEqualTo(Lsn.valueOf("0/200"));
        assertThat(WalCaptureEngine.resumePosition("s", slot, ReplicationState.of(Lsn.valueOf("0/200"), Collections.emptySet())))
                .isEqualTo(Lsn.valueOf("0/200"));
    }

    @Test
    public void shouldFallBackToStoredPositionWhenSlotHasNone() {
        Optional<SlotState> slot = Optional.of(new SlotState(null, Lsn.valueOf("0/180"), "wal2json", false));

        assertThat(WalCaptureEngine.resumePosition("s", slot, ReplicationState.of(Lsn.valueOf("0/150"), Collections.emptySet())))
                .isEqualTo(Lsn.valueOf("0/150"));
        assertThatThrownBy(() -> WalCaptureEngine.resumePosition("s", slot, ReplicationState.empty()))
                .isInstanceOf(SlotNotFoundException.class);
    }
}
