package de.bsommerfeld.assetledger.db;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversion between Java values and what the store actually keeps.
 *
 * <p>
 * Values are normalized before binding so that the audit trail records
 * exactly what was written: booleans become {@code 1/0}, small integer types
 * widen to {@code Long}, dates and times become text (instants in UTC), enums their name.
 */
final class SqlValues {

    private SqlValues() {
    }

    static Object normalize(Object value) {
        if (value == null)
            return null;
        if (value instanceof Boolean)
            return ((Boolean) value) ? 1L : 0L;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte)
            return ((Number) value).longValue();
        if (value instanceof Float)
            return ((Float) value).doubleValue();
        if (value instanceof BigInteger)
            return new BigDecimal((BigInteger) value);
        if (value instanceof LocalDateTime)
            return Timestamps.format((LocalDateTime) value);
        if (value instanceof Instant)
            return Timestamps.format(LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
        if (value instanceof LocalDate)
            return value.toString();
        if (value instanceof Enum)
            return ((Enum<?>) value).name();
        if (value instanceof Character)
            return value.toString();
        return value;
    }

    static Map<String, Object> normalize(Map<String, ?> values) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : values.entrySet()) {
            result.put(e.getKey(), normalize(e.getValue()));
        }
        return result;
    }

    static void bind(PreparedStatement ps, Object... params) throws SQLException {
        if (params == null)
            return;
        for (int i = 0; i < params.length; i++) {
            Object value = normalize(params[i]);
            if (value instanceof BigDecimal) {
                ps.setBigDecimal(i + 1, (BigDecimal) value);
            } else {
                ps.setObject(i + 1, value);
            }
        }
    }

    /** Reads the current row; integers always come back as {@code Long}. */
    static Record readRow(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= md.getColumnCount(); i++) {
            Object value = rs.getObject(i);
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                value = ((Number) value).longValue();
            }
            row.put(md.getColumnLabel(i), value);
        }
        return new Record(row);
    }

    /** Parameter list for log output. */
    static String describe(Object... params) {
        return params == null ? "[]" : Arrays.deepToString(params);
    }
}
