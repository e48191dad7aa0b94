/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Before;
import org.junit.Test;

import io.walcapture.connector.postgresql.connection.Lsn;

public class DeliveryTrackerTest {

    private DeliveryTracker tracker;

    @Before
    public void beforeEach() {
        tracker = new DeliveryTracker();
    }

    @Test
    public void shouldHaveNoPositionBeforeAnyChunk() {
        assertThat(tracker.processedPosition()).isEmpty();
        assertThat(tracker.isDrained()).isTrue();
    }

    @Test
    public void shouldOnlyReportChunksWhoseChangesWereAllDelivered() {
        tracker.enqueued();
        tracker.enqueued();
        tracker.chunkCompleted(Lsn.valueOf("0/200"));
        tracker.enqueued();
        tracker.chunkCompleted(Lsn.valueOf("0/300"));

        tracker.delivered();
        assertThat(tracker.processedPosition()).isEmpty();

        tracker.delivered();
        assertThat(tracker.processedPosition()).contains(Lsn.valueOf("0/200"));
        assertThat(tracker.isDrained()).isFalse();

        tracker.delivered();
        assertThat(tracker.processedPosition()).contains(Lsn.valueOf("0/300"));
        assertThat(tracker.isDrained()).isTrue();
    }

    @Test
    public void shouldAdvanceOverChunksWithoutChanges() {
        tracker.enqueued();
        tracker.chunkCompleted(Lsn.valueOf("0/200"));
        tracker.delivered();
        tracker.chunkCompleted(Lsn.valueOf("0/300"));
        tracker.chunkCompleted(Lsn.valueOf("0/400"));

        assertThat(tracker.processedPosition()).contains(Lsn.valueOf("0/400"));
    }

    @Test
    public void shouldKeepTheLastPositionWhileLaterChangesAreQueued() {
        tracker.chunkCompleted(Lsn.valueOf("0/200"));
        assertThat(tracker.processedPosition()).contains(Lsn.valueOf("0/200"));

        tracker.enqueued();
        tracker.chunkCompleted(Lsn.valueOf("0/300"));

        assertThat(tracker.processedPosition()).contains(Lsn.valueOf("0/200"));
        assertThat(tracker.isDrained()).isFalse();
    }

    @Test
    public void shouldNotMarkSnapshotRowsAsChunks() {
        // snapshot rows are counted but end no chunk
        tracker.enqueued();
        tracker.enqueued();
        tracker.chunkCompleted(Lsn.valueOf("0/200"));

        tracker.delivered();
        assertThat(tracker.processedPosition()).isEmpty();
        tracker.delivered();
        assertThat(tracker.processedPosition()).contains(Lsn.valueOf("0/200"));
    }
}
