/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads column values of rows fetched over a plain SQL connection so that they match the values decoded from the
 * replication stream for the same column types: integers, numerics, floating point numbers and booleans are typed,
 * every other value, temporal ones included, is read as its text form.
 */
public final class PostgresValueConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresValueConverter.class);

    private PostgresValueConverter() {
    }

    /**
     * Reads the current row into a map of column name to value, in column order.
     *
     * @param rs the result set positioned on a row
     * @param metaData the metadata of the result set
     * @return the row values; never null
     * @throws SQLException if a value cannot be read
     */
    public static Map<String, Object> rowValues(ResultSet rs, ResultSetMetaData metaData) throws SQLException {
        final int columnCount = metaData.getColumnCount();
        final Map<String, Object> values = new LinkedHashMap<>(columnCount * 2);
        for (int i = 1; i <= columnCount; i++) {
            values.put(metaData.getColumnName(i), valueForColumn(rs, i, metaData));
        }
        return values;
    }

    public static Object valueForColumn(ResultSet rs, int colIdx, ResultSetMetaData metaData) throws SQLException {
        final String columnTypeName = metaData.getColumnTypeName(colIdx);
        final String type = columnTypeName == null ? "" : columnTypeName.toLowerCase(Locale.ROOT);
        LOGGER.trace("ColumnTypeName is: {}", columnTypeName);

        // array type names start with an underscore
        if (type.startsWith("_")) {
            return rs.getString(colIdx);
        }
        switch (type) {
            case "int2": {
                final int value = rs.getInt(colIdx);
                return rs.wasNull() ? null : (Object) value;
            }
            case "float4": {
                final double value = rs.getDouble(colIdx);
                return rs.wasNull() ? null : (Object) value;
            }
            case "numeric": {
                final String s = rs.getString(colIdx);
                if (s == null) {
                    return null;
                }
                // NaN and infinities have no BigDecimal form
                return isSpecialNumeric(s) ? s : (Object) new BigDecimal(s);
            }
            case "int4":
            case "int8":
            case "float8":
            case "bool": {
                final Object x = rs.getObject(colIdx);
                if (x != null && LOGGER.isTraceEnabled()) {
                    LOGGER.trace("rs getObject returns class: {}; rs getObject value is: {}", x.getClass(), x);
                }
                return x;
            }
            default:
                // timestamps, dates, time with 24:00:00, money, bit strings, json, uuid and the like
                return rs.getString(colIdx);
        }
    }

    private static boolean isSpecialNumeric(String value) {
        final String lower = value.trim().toLowerCase(Locale.ROOT);
        return lower.equals("nan") || lower.endsWith("infinity");
    }
}
