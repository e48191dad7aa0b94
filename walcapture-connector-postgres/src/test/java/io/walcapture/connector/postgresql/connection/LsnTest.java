/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

public class LsnTest {

    @Test
    public void shouldParseTextualForm() {
        Lsn lsn = Lsn.valueOf("16/3002D50");
        assertThat(lsn.asLong()).isEqualTo(0x16_0300_2D50L);
        assertThat(lsn.asString()).isEqualTo("16/3002D50");
        assertThat(Lsn.valueOf("0/0")).isSameAs(Lsn.INVALID_LSN);
        assertThat(Lsn.valueOf(" 0/16b3748 ").asString()).isEqualTo("0/16B3748");
    }

    @Test
    public void shouldRejectMalformedPositions() {
        assertThatThrownBy(() -> Lsn.valueOf("16-3002D50")).isInstanceOf(InvalidPositionException.class);
        assertThatThrownBy(() -> Lsn.valueOf("1/123456789")).isInstanceOf(InvalidPositionException.class);
        assertThatThrownBy(() -> Lsn.valueOf("")).isInstanceOf(InvalidPositionException.class);
        assertThatThrownBy(() -> Lsn.valueOf((String) null)).isInstanceOf(InvalidPositionException.class);
    }

    @Test
    public void shouldOrderAsUnsignedValues() {
        Lsn low = Lsn.valueOf("0/FFFFFFFF");
        Lsn high = Lsn.valueOf("1/0");
        Lsn top = Lsn.valueOf("FFFFFFFF/0");

        assertThat(high.isAfter(low)).isTrue();
        assertThat(top.isAfter(high)).isTrue();
        assertThat(top.asLong()).isNegative();
        assertThat(low.compareTo(Lsn.valueOf("0/FFFFFFFF"))).isZero();
    }

    @Test
    public void shouldAdvanceAcrossSegmentBoundary() {
        assertThat(Lsn.valueOf("0/FFFFFFF0").advance(0x20)).isEqualTo(Lsn.valueOf("1/10"));
        assertThatThrownBy(() -> Lsn.valueOf("0/10").advance(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
