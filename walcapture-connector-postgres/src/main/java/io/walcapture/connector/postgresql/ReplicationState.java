/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.walcapture.annotation.Immutable;
import io.walcapture.connector.postgresql.connection.InvalidPositionException;
import io.walcapture.connector.postgresql.connection.Lsn;
import io.walcapture.relational.TableId;
import io.walcapture.util.Strings;

/**
 * The checkpoint of a capture run: the last acknowledged log position and the tables whose initial snapshot has
 * completed. Serialized as {@code {"lsn": "0/16D3A48", "streams": ["public.orders"]}}.
 */
@Immutable
public final class ReplicationState {

    static final String LSN_FIELD = "lsn";
    static final String STREAMS_FIELD = "streams";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ReplicationState EMPTY = new ReplicationState(null, Collections.emptySet());

    private final Lsn lsn;
    private final Set<TableId> streams;

    private ReplicationState(Lsn lsn, Set<TableId> streams) {
        this.lsn = lsn;
        this.streams = Collections.unmodifiableSet(new TreeSet<>(streams));
    }

    /**
     * @return the state of an engine that never ran
     */
    public static ReplicationState empty() {
        return EMPTY;
    }

    public static ReplicationState of(Lsn lsn, Collection<TableId> streams) {
        return new ReplicationState(Objects.requireNonNull(lsn, "lsn"), new TreeSet<>(streams));
    }

    /**
     * Parses the JSON form of the state.
     *
     * @param json the serialized state; may be null or blank for an empty state
     * @return the state; never null
     * @throws InvalidPositionException if the stored position cannot be parsed
     * @throws IllegalArgumentException if the text is not a state object
     */
    public static ReplicationState fromJson(String json) {
        if (Strings.isNullOrBlank(json)) {
            return EMPTY;
        }
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Replication state is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Replication state must be a JSON object");
        }
        final JsonNode lsnNode = root.get(LSN_FIELD);
        final String lsnText = lsnNode == null || lsnNode.isNull() ? null : lsnNode.asText();
        final Lsn lsn = Strings.isNullOrBlank(lsnText) ? null : Lsn.valueOf(lsnText);

        final Set<TableId> streams = new TreeSet<>();
        final JsonNode streamsNode = root.get(STREAMS_FIELD);
        if (streamsNode != null && streamsNode.isArray()) {
            for (JsonNode stream : streamsNode) {
                final TableId tableId = TableId.parse(stream.asText());
                if (tableId == null) {
                    throw new IllegalArgumentException("Invalid stream '" + stream.asText() + "' in replication state");
                }
                streams.add(tableId);
            }
        }
        return new ReplicationState(lsn, streams);
    }

    public String toJson() {
        final ObjectNode root = MAPPER.createObjectNode();
        root.put(LSN_FIELD, lsn != null ? lsn.asString() : "");
        final ArrayNode array = root.putArray(STREAMS_FIELD);
        streams.forEach(stream -> array.add(stream.identifier()));
        return root.toString();
    }

    /**
     * @return the last acknowledged position, empty if nothing was ever acknowledged
     */
    public Optional<Lsn> lsn() {
        return Optional.ofNullable(lsn);
    }

    /**
     * @return the tables whose snapshot has completed, in identifier order
     */
    public Set<TableId> streams() {
        return streams;
    }

    public boolean isSnapshotted(TableId tableId) {
        return streams.contains(tableId);
    }

    /**
     * Derives the state after a successful acknowledgment.
     *
     * @param position the acknowledged position
     * @param streamedTables the tables being streamed; they no longer need a snapshot
     * @return the new state; never null
     */
    public ReplicationState acknowledged(Lsn position, Collection<TableId> streamedTables) {
        final Set<TableId> newStreams = new TreeSet<>(streams);
        newStreams.addAll(streamedTables);
        return new ReplicationState(Objects.requireNonNull(position, "position"), newStreams);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof ReplicationState) {
            final ReplicationState other = (ReplicationState) obj;
            return Objects.equals(lsn, other.lsn) && streams.equals(other.streams);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lsn, streams);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
