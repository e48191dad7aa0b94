/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import java.util.Arrays;

import io.walcapture.annotation.Immutable;

/**
 * The output of the logical decoding plugin carried by one XLogData message, together with the log position it
 * starts at.
 */
@Immutable
public final class WalChunk {

    private final Lsn walStart;
    private final byte[] data;

    public WalChunk(Lsn walStart, byte[] data) {
        this.walStart = walStart;
        this.data = Arrays.copyOf(data, data.length);
    }

    public Lsn walStart() {
        return walStart;
    }

    public byte[] data() {
        return Arrays.copyOf(data, data.length);
    }

    public int length() {
        return data.length;
    }

    /**
     * The position just past this chunk, i.e. the start of the chunk advanced by the payload length.
     *
     * @return the position to acknowledge once the payload has been processed
     */
    public Lsn nextPosition() {
        return walStart.advance(data.length);
    }

    @Override
    public String toString() {
        return "WalChunk [walStart=" + walStart.asString() + ", length=" + data.length + "]";
    }
}
