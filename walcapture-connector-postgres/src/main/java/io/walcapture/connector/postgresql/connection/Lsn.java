/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.walcapture.annotation.Immutable;

/**
 * A position in the Postgres write-ahead log. The textual form is two hexadecimal numbers of up to 8 digits each,
 * separated by a slash, e.g. {@code 16/3002D50}; on the wire it is an unsigned 64-bit integer.
 */
@Immutable
public final class Lsn implements Comparable<Lsn> {

    private static final Pattern LSN_PATTERN = Pattern.compile("([0-9A-Fa-f]{1,8})/([0-9A-Fa-f]{1,8})");

    /**
     * Zero is used to indicate an invalid pointer, no WAL record can begin there.
     */
    public static final Lsn INVALID_LSN = new Lsn(0);

    private final long value;

    private Lsn(long value) {
        this.value = value;
    }

    /**
     * @param value numeric position in the write-ahead log stream
     * @return the LSN instance; never null
     */
    public static Lsn valueOf(long value) {
        if (value == 0) {
            return INVALID_LSN;
        }
        return new Lsn(value);
    }

    /**
     * Parse the textual form of a log position.
     *
     * @param strValue the position, e.g. {@code 0/15D68C50}
     * @return the LSN instance; never null
     * @throws InvalidPositionException if the value is null or not of the form {@code X/Y}
     */
    public static Lsn valueOf(String strValue) {
        if (strValue == null) {
            throw new InvalidPositionException("Log position must not be null");
        }
        final Matcher matcher = LSN_PATTERN.matcher(strValue.trim());
        if (!matcher.matches()) {
            throw new InvalidPositionException("Invalid log position '" + strValue + "'");
        }
        final long logicalXlog = Long.parseLong(matcher.group(1), 16);
        final long segment = Long.parseLong(matcher.group(2), 16);
        return valueOf((logicalXlog << 32) | segment);
    }

    /**
     * @return the position in the write-ahead log stream as an unsigned 64-bit value
     */
    public long asLong() {
        return value;
    }

    /**
     * @return the position as two hexadecimal numbers separated by a slash
     */
    public String asString() {
        return String.format("%X/%X", value >>> 32, value & 0xFFFFFFFFL);
    }

    /**
     * @return true if this is not {@link #INVALID_LSN}
     */
    public boolean isValid() {
        return value != 0;
    }

    /**
     * Computes the position the given number of bytes past this one.
     *
     * @param delta the number of bytes; must not be negative
     * @return the advanced position; never null
     */
    public Lsn advance(long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("Cannot move a log position backwards by " + delta + " bytes");
        }
        return valueOf(value + delta);
    }

    public boolean isAfter(Lsn other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Lsn o) {
        return Long.compareUnsigned(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((Lsn) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "LSN{" + asString() + '}';
    }
}
