/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql.connection;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import io.walcapture.annotation.ThreadSafe;
import io.walcapture.connector.postgresql.ChangeEvent;
import io.walcapture.connector.postgresql.ChangeEvent.Operation;
import io.walcapture.function.BlockingConsumer;
import io.walcapture.relational.TableId;

/**
 * A {@link ChangeFilter} for the version 1 output format of the wal2json decoding plugin, where every chunk holds one
 * transaction:
 *
 * <pre>
 * {"xid": 1074, "nextlsn": "0/16D3A48", "timestamp": "2018-03-27 12:58:25.470298+02", "change": [
 *   {"kind": "insert", "schema": "public", "table": "orders",
 *    "columnnames": ["id", "total"], "columntypes": ["integer", "numeric(10,2)"], "columnvalues": [1, 12.50]},
 *   {"kind": "delete", "schema": "public", "table": "orders",
 *    "oldkeys": {"keynames": ["id"], "keytypes": ["integer"], "keyvalues": [1]}}
 * ]}
 * </pre>
 */
@ThreadSafe
public class Wal2JsonChangeFilter implements ChangeFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(Wal2JsonChangeFilter.class);

    // numeric values keep their scale, 12.50 stays 12.50
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false)
            .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));

    private static final Pattern TYPE_MODIFIER = Pattern.compile("\\([^)]*\\)");

    private final Set<TableId> includedTables;

    /**
     * @param includedTables the tables whose changes are kept; changes of any other table are dropped
     */
    public Wal2JsonChangeFilter(Set<TableId> includedTables) {
        this.includedTables = Collections.unmodifiableSet(new LinkedHashSet<>(includedTables));
    }

    @Override
    public void filterChanges(Lsn position, byte[] payload, BlockingConsumer<ChangeEvent> consumer) throws InterruptedException {
        final JsonNode transaction;
        try {
            transaction = MAPPER.readTree(payload);
        }
        catch (IOException e) {
            throw new ReplicationProtocolException("Unable to parse wal2json payload at " + position + ": " + e.getMessage(), e);
        }
        if (transaction == null || !transaction.isObject()) {
            throw new ReplicationProtocolException("Expected a wal2json object at " + position);
        }
        final JsonNode changes = transaction.get("change");
        if (changes == null || !changes.isArray()) {
            throw new ReplicationProtocolException("wal2json payload at " + position + " has no 'change' array");
        }
        final String commitTime = textOrNull(transaction.get("timestamp"));

        for (JsonNode change : changes) {
            final String kind = requiredText(change, "kind", position);
            final Operation operation = Operation.parse(kind);
            if (operation == null) {
                LOGGER.debug("Skipping change of kind '{}' at {}", kind, position);
                continue;
            }
            final TableId tableId = new TableId(requiredText(change, "schema", position), requiredText(change, "table", position));
            if (!includedTables.contains(tableId)) {
                LOGGER.debug("Dropping {} change of table '{}' which is not included", kind, tableId);
                continue;
            }

            final Map<String, Object> keys = operation == Operation.INSERT ? Collections.emptyMap()
                    : columns(change.get("oldkeys"), "keynames", "keytypes", "keyvalues", position);
            final Map<String, Object> values = operation == Operation.DELETE ? keys
                    : columns(change, "columnnames", "columntypes", "columnvalues", position);

            final ChangeEvent event = new ChangeEvent(operation, tableId, values, keys, position, commitTime);
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("Decoded {}", event);
            }
            consumer.accept(event);
        }
    }

    private static Map<String, Object> columns(JsonNode parent, String namesField, String typesField, String valuesField, Lsn position) {
        if (parent == null || parent.isNull()) {
            return Collections.emptyMap();
        }
        final JsonNode names = parent.get(namesField);
        final JsonNode types = parent.get(typesField);
        final JsonNode values = parent.get(valuesField);
        if (names == null || values == null || !names.isArray() || !values.isArray()) {
            throw new ReplicationProtocolException("Change at " + position + " lacks '" + namesField + "' or '" + valuesField + "'");
        }
        if (names.size() != values.size() || (types != null && types.size() != names.size())) {
            throw new ReplicationProtocolException("Change at " + position + " has " + names.size() + " column names but "
                    + values.size() + " values");
        }
        final Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i != names.size(); ++i) {
            final String type = types != null ? types.get(i).asText() : null;
            result.put(names.get(i).asText(), valueOf(type, values.get(i)));
        }
        return result;
    }

    /**
     * Converts a JSON value into the Java representation of the given column type.
     *
     * @param columnType the Postgres type name as reported by the plugin; may be null
     * @param value the JSON value; may be null
     * @return the converted value, null for SQL NULL
     */
    static Object valueOf(String columnType, JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        final String type = normalizeType(columnType);
        if (type.endsWith("[]")) {
            return asText(value);
        }
        switch (type) {
            case "smallint":
            case "int2":
            case "integer":
            case "int":
            case "int4":
                return value.isIntegralNumber() && value.canConvertToInt() ? (Object) value.intValue() : asText(value);
            case "bigint":
            case "int8":
                return value.isIntegralNumber() && value.canConvertToLong() ? (Object) value.longValue() : asText(value);
            case "numeric":
            case "decimal":
                // NaN arrives as a string
                return value.isNumber() ? value.decimalValue() : asText(value);
            case "real":
            case "float4":
            case "double precision":
            case "float8":
                return value.isNumber() ? (Object) value.doubleValue() : asText(value);
            case "boolean":
            case "bool":
                return value.isBoolean() ? (Object) value.booleanValue() : asText(value);
            default:
                return asText(value);
        }
    }

    static String normalizeType(String columnType) {
        if (columnType == null) {
            return "";
        }
        return TYPE_MODIFIER.matcher(columnType).replaceAll("").trim().toLowerCase(Locale.ROOT);
    }

    private static String asText(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static String requiredText(JsonNode change, String field, Lsn position) {
        final String value = textOrNull(change.get(field));
        if (value == null) {
            throw new ReplicationProtocolException("Change at " + position + " has no '" + field + "'");
        }
        return value;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    public Set<TableId> includedTables() {
        return includedTables;
    }
}
