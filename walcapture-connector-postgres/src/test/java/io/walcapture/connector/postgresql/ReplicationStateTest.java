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

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import io.walcapture.connector.postgresql.connection.InvalidPositionException;
import io.walcapture.connector.postgresql.connection.Lsn;

public class ReplicationStateTest {

    @Test
    public void shouldWriteStreamsInSortedOrder() {
        ReplicationState state = ReplicationState.of(Lsn.valueOf("0/16B3748"), Arrays.asList(ORDERS, CUSTOMERS));

        assertThat(state.toJson()).isEqualTo("{\"lsn\":\"0/16B3748\",\"streams\":[\"public.customers\",\"public.orders\"]}");
    }

    @Test
    public void shouldWriteEmptyPositionWhenNoneIsKnown() {
        assertThat(ReplicationState.empty().toJson()).isEqualTo("{\"lsn\":\"\",\"streams\":[]}");
    }

    @Test
    public void shouldReadWrittenState() {
        ReplicationState state = ReplicationState.of(Lsn.valueOf("1A/2B"), Collections.singleton(ORDERS));

        ReplicationState read = ReplicationState.fromJson(state.toJson());

        assertThat(read).isEqualTo(state);
        assertThat(read.lsn()).contains(Lsn.valueOf("1A/2B"));
        assertThat(read.isSnapshotted(ORDERS)).isTrue();
        assertThat(read.isSnapshotted(CUSTOMERS)).isFalse();
    }

    @Test
    public void shouldTreatMissingOrBlankDocumentAsEmpty() {
        assertThat(ReplicationState.fromJson(null)).isEqualTo(ReplicationState.empty());
        assertThat(ReplicationState.fromJson("  ")).isEqualTo(ReplicationState.empty());
        assertThat(ReplicationState.fromJson("{}").lsn()).isEmpty();
        assertThat(ReplicationState.fromJson("{\"lsn\":\"\",\"streams\":[\"public.orders\"]}").lsn()).isEmpty();
    }

    @Test
    public void shouldRejectMalformedDocuments() {
        assertThatThrownBy(() -> ReplicationState.fromJson("{\"lsn\":")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReplicationState.fromJson("[]")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReplicationState.fromJson("{\"streams\":[\"orders\"]}")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReplicationState.fromJson("{\"lsn\":\"16B3748\"}")).isInstanceOf(InvalidPositionException.class);
    }

    @Test
    public void shouldAccumulateStreamsWhenAcknowledged() {
        ReplicationState state = ReplicationState.of(Lsn.valueOf("0/10"), Collections.singleton(ORDERS));

        ReplicationState next = state.acknowledged(Lsn.valueOf("0/20"), Collections.singleton(CUSTOMERS));

        assertThat(next.lsn()).contains(Lsn.valueOf("0/20"));
        assertThat(next.streams()).containsExactly(CUSTOMERS, ORDERS);
        assertThat(state.lsn()).contains(Lsn.valueOf("0/10"));
        assertThat(state.streams()).containsExactly(ORDERS);
    }
}
