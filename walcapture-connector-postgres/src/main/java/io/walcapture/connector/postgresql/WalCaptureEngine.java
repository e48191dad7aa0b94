/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walcapture.WalCaptureException;
import io.walcapture.annotation.ThreadSafe;
import io.walcapture.config.Configuration;
import io.walcapture.connector.base.ChangeEventQueue;
import io.walcapture.connector.postgresql.connection.Lsn;
import io.walcapture.connector.postgresql.connection.PostgresConnection;
import io.walcapture.connector.postgresql.connection.PostgresReplicationConnection;
import io.walcapture.connector.postgresql.connection.ReplicationConnection;
import io.walcapture.connector.postgresql.connection.SlotState;
import io.walcapture.relational.TableId;
import io.walcapture.util.Threads;
import io.walcapture.util.Threads.Timer;

/**
 * Captures the changes of a set of tables from one logical replication slot.
 * <p>
 * Creating an engine validates the configuration, opens a plain SQL connection and a replication connection and
 * determines the position to resume from. {@link #run(ChangeHandler)} then exports the tables that still need a
 * snapshot and streams live changes afterwards. Both happen on a producer thread that hands the changes over a small
 * bounded queue to the thread calling {@code run}, which invokes the handler. A slow handler therefore slows the
 * producer down; nothing is dropped.
 * <p>
 * A position is acknowledged to the server once the handler returned for every change up to it. Changes still waiting
 * in the queue when the capture stops are delivered again by the next run, as are the changes since the last stored
 * position after a crash.
 */
@ThreadSafe
public final class WalCaptureEngine implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WalCaptureEngine.class);

    private static final String CONTEXT_NAME = "capture-producer";
    static final Duration PRODUCER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final PostgresTaskContext taskContext;
    private final PostgresConnectorConfig config;
    private final PostgresConnection connection;
    private final ReplicationConnection replicationConnection;
    private final Lsn resumePosition;
    private final Set<TableId> snapshotTables;
    private final CheckpointManager checkpointManager;
    private final DeliveryTracker deliveryTracker = new DeliveryTracker();
    private final RecordsSnapshotProducer snapshotProducer;
    private final RecordsStreamProducer streamProducer;
    private final ChangeEventQueue<ChangeEvent> queue;
    private final ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean stopRequested = new AtomicBoolean();

    /**
     * Creates an engine for the given configuration, keeping the state in the file named by
     * {@link PostgresConnectorConfig#OFFSET_STORAGE_FILE_FILENAME} or in memory when no file is configured.
     *
     * @param config the configuration
     * @return the connected engine; never null
     */
    public static WalCaptureEngine create(Configuration config) {
        final PostgresConnectorConfig connectorConfig = new PostgresConnectorConfig(config).validate();
        final ReplicationStateStore store = connectorConfig.offsetStorageFile()
                .<ReplicationStateStore> map(FileReplicationStateStore::new)
                .orElseGet(MemoryReplicationStateStore::new);
        return new WalCaptureEngine(new PostgresTaskContext(connectorConfig), store);
    }

    /**
     * Connects to the server and verifies the slot.
     *
     * @param taskContext the context providing the configuration and the connections
     * @param stateStore holds the state of previous runs and receives every acknowledged state
     * @throws io.walcapture.config.InvalidConfigurationException if the configuration is invalid; nothing is opened then
     * @throws SlotNotFoundException if the slot does not exist
     * @throws ReplicationStateMismatchException if the stored position is ahead of the slot
     * @throws WalCaptureException if the server cannot be reached
     */
    public WalCaptureEngine(PostgresTaskContext taskContext, ReplicationStateStore stateStore) {
        this.taskContext = taskContext;
        this.config = taskContext.config().validate();

        final ReplicationState state = stateStore.load();
        this.connection = taskContext.createConnection();
        ReplicationConnection replication = null;
        try {
            // Connecting
            connection.connect();
            LOGGER.info("Connected to Postgres {} at {}:{}/{}", connection.serverVersion(), config.hostname(), config.port(),
                    config.databaseName());
            for (TableId tableId : config.tableIds()) {
                if (!connection.tableExists(tableId)) {
                    LOGGER.warn("Table '{}' does not exist (yet), its changes are captured once it is created", tableId);
                }
            }
            replication = taskContext.createReplicationConnection();
            replication.identifySystem();

            // SlotVerified
            this.resumePosition = resumePosition(config.slotName(), replication.readSlotState(), state);
        }
        catch (SQLException | RuntimeException e) {
            closeAfterFailure(connection, replication, e);
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new WalCaptureException("Unable to connect to " + config.hostname() + ":" + config.port() + ": " + e.getMessage(), e);
        }
        this.replicationConnection = replication;

        this.snapshotTables = new LinkedHashSet<>();
        for (TableId tableId : config.snapshotTableIds()) {
            if (!state.isSnapshotted(tableId)) {
                snapshotTables.add(tableId);
            }
        }
        this.checkpointManager = new CheckpointManager(stateStore, state, resumePosition, config.tableIds());
        this.snapshotProducer = new RecordsSnapshotProducer(taskContext, snapshotTables);
        this.streamProducer = new RecordsStreamProducer(taskContext, replicationConnection, checkpointManager, deliveryTracker,
                taskContext.createChangeFilter());
        this.queue = new ChangeEventQueue.Builder<ChangeEvent>()
                .pollInterval(config.pollInterval())
                .maxQueueSize(config.maxQueueSize())
                .maxBatchSize(config.maxQueueSize())
                .clock(taskContext.getClock())
                .build();
        this.executorService = Threads.newSingleThreadExecutor(WalCaptureEngine.class, config.slotName(), CONTEXT_NAME);
        LOGGER.info("Resuming slot '{}' at {}, tables to snapshot: {}", config.slotName(), resumePosition.asString(), snapshotTables);
    }

    /**
     * Reconciles the slot's confirmed position with the stored one.
     *
     * @return the greater of both positions
     * @throws SlotNotFoundException if the slot does not exist, or has no position while none is stored either
     * @throws ReplicationStateMismatchException if the stored position is ahead of the slot
     */
    static Lsn resumePosition(String slotName, Optional<SlotState> slotState, ReplicationState state) {
        if (!slotState.isPresent()) {
            throw new SlotNotFoundException(slotName, "Replication slot '" + slotName + "' does not exist; it must be created with the '"
                    + PostgresReplicationConnection.PLUGIN_NAME + "' plugin before capturing");
        }
        final SlotState slot = slotState.get();
        LOGGER.info("Found replication slot '{}': {}", slotName, slot);
        if (slot.plugin() != null && !PostgresReplicationConnection.PLUGIN_NAME.equals(slot.plugin())) {
            LOGGER.warn("Slot '{}' uses plugin '{}' but its changes are decoded as '{}' output", slotName, slot.plugin(),
                    PostgresReplicationConnection.PLUGIN_NAME);
        }
        if (slot.isActive()) {
            LOGGER.warn("Slot '{}' is in use by another connection, starting replication will fail", slotName);
        }
        final Lsn confirmed = slot.confirmedFlushLsn();
        final Optional<Lsn> persisted = state.lsn();
        if (confirmed == null || !confirmed.isValid()) {
            return persisted.orElseThrow(() -> new SlotNotFoundException(slotName,
                    "Replication slot '" + slotName + "' has no confirmed flush position and no position was stored"));
        }
        if (persisted.isPresent() && persisted.get().isAfter(confirmed)) {
            throw new ReplicationStateMismatchException(slotName, persisted.get(), confirmed);
        }
        return confirmed;
    }

    /**
     * Delivers the captured changes to the handler on the calling thread until the handler returns
     * {@link ChangeHandler.Signal#STOP}, {@link #stop()} is called, the initial wait expires without any change or a
     * fatal error occurs. Both connections are closed when this method returns.
     *
     * @param handler receives the changes in commit order; snapshot rows come first
     * @throws WalCaptureException if the capture or the handler failed
     * @throws InterruptedException if the calling thread was interrupted
     */
    public void run(ChangeHandler handler) throws InterruptedException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("The engine can only be run once");
        }
        if (stopRequested.get()) {
            LOGGER.info("Capture will not start, stop already requested");
            return;
        }
        executorService.submit(this::produce);

        final Duration initialWait = config.initialWait();
        final Timer initialWaitTimer = initialWait.isZero() ? null : Threads.timer(taskContext.getClock(), initialWait);
        boolean received = false;
        RuntimeException failure = null;
        try {
            while (!stopRequested.get()) {
                final List<ChangeEvent> events;
                try {
                    events = queue.poll();
                }
                catch (RuntimeException e) {
                    if (stopRequested.get()) {
                        LOGGER.debug("Producer ended after stop was requested: {}", e.getMessage());
                        return;
                    }
                    throw e;
                }
                if (events.isEmpty()) {
                    if (!received && initialWaitTimer != null && initialWaitTimer.expired()) {
                        LOGGER.info("No change received within {} ms, stopping", initialWait.toMillis());
                        return;
                    }
                    continue;
                }
                received = true;
                for (ChangeEvent event : events) {
                    final ChangeHandler.Signal signal = deliver(handler, event);
                    deliveryTracker.delivered();
                    if (signal == ChangeHandler.Signal.STOP) {
                        LOGGER.info("Handler requested to stop after {}", event);
                        return;
                    }
                }
            }
        }
        catch (RuntimeException e) {
            failure = e;
            throw e;
        }
        finally {
            stop(failure);
            awaitProducer();
        }
    }

    private ChangeHandler.Signal deliver(ChangeHandler handler, ChangeEvent event) {
        try {
            final ChangeHandler.Signal signal = handler.handle(event);
            return signal != null ? signal : ChangeHandler.Signal.CONTINUE;
        }
        catch (Exception e) {
            throw new WalCaptureException("Change handler failed on " + event + ": " + e.getMessage(), e);
        }
    }

    private void produce() {
        try {
            if (!snapshotTables.isEmpty()) {
                snapshotProducer.produce(this::enqueue);
            }
            if (!stopRequested.get()) {
                streamProducer.produce(this::enqueue);
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.debug("Producer interrupted");
        }
        catch (RuntimeException e) {
            if (!stopRequested.get()) {
                LOGGER.error("Unexpected exception while capturing changes", e);
            }
            queue.producerException(e);
        }
    }

    private void enqueue(ChangeEvent event) throws InterruptedException {
        deliveryTracker.enqueued();
        if (!queue.enqueue(event)) {
            throw new InterruptedException("Change queue closed before " + event + " could be enqueued");
        }
    }

    /**
     * Stops the capture: releases a blocked producer and closes both connections. Can be called from any thread, any
     * number of times.
     *
     * @throws WalCaptureException if a connection could not be closed
     */
    public void stop() {
        stop(null);
    }

    private void stop(RuntimeException failure) {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("Stopping capture from slot '{}'", config.slotName());
        queue.close();
        executorService.shutdownNow();
        try {
            closeConnections();
        }
        catch (WalCaptureException e) {
            if (failure == null) {
                throw e;
            }
            failure.addSuppressed(e);
        }
    }

    private void closeConnections() {
        WalCaptureException closingException = null;
        for (Runnable closer : closers()) {
            try {
                closer.run();
            }
            catch (RuntimeException e) {
                if (closingException == null) {
                    closingException = new WalCaptureException("Failed to close the connections of slot '" + config.slotName() + "'", e);
                }
                else {
                    closingException.addSuppressed(e);
                }
            }
        }
        if (closingException != null) {
            throw closingException;
        }
    }

    private List<Runnable> closers() {
        final List<Runnable> closers = new ArrayList<>();
        closers.add(snapshotProducer::stop);
        closers.add(streamProducer::stop);
        closers.add(() -> {
            try {
                connection.close();
            }
            catch (SQLException e) {
                throw new WalCaptureException("Unable to close the database connection", e);
            }
        });
        return closers;
    }

    private void awaitProducer() throws InterruptedException {
        if (!executorService.awaitTermination(PRODUCER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
            LOGGER.warn("Producer thread did not end within {} ms", PRODUCER_SHUTDOWN_TIMEOUT.toMillis());
        }
    }

    private static void closeAfterFailure(PostgresConnection connection, ReplicationConnection replication, Exception failure) {
        try {
            connection.close();
        }
        catch (SQLException e) {
            failure.addSuppressed(e);
        }
        if (replication != null) {
            try {
                replication.close();
            }
            catch (SQLException e) {
                failure.addSuppressed(e);
            }
        }
    }

    /**
     * @return the position streaming starts from
     */
    public Lsn resumePosition() {
        return resumePosition;
    }

    /**
     * @return the tables exported before streaming, those configured for a snapshot that have not completed one yet
     */
    public Set<TableId> snapshotTables() {
        return snapshotTables;
    }

    /**
     * @return the last acknowledged state
     */
    public ReplicationState state() {
        return checkpointManager.state();
    }

    public boolean isStopped() {
        return stopRequested.get();
    }

    @Override
    public void close() {
        stop();
    }
}
