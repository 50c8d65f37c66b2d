package de.bsommerfeld.assetledger.db;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One row as returned by the store: column name to value, in select order.
 *
 * <p>
 * Values keep the types the store hands out: {@code Long} for integers,
 * {@code Double} for reals, {@code String} for text, {@code byte[]} for blobs
 * and {@code null}. The typed accessors convert leniently because SQLite's
 * column affinity means a declared type is only a hint.
 *
 * <p>
 * Instances are immutable.
 */
public final class Record {

    private final Map<String, Object> values;

    public Record(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public String getString(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    public Long getLong(String column) {
        Object value = values.get(column);
        if (value == null)
            return null;
        if (value instanceof Number)
            return ((Number) value).longValue();
        return Long.parseLong(value.toString().trim());
    }

    public Double getDouble(String column) {
        Object value = values.get(column);
        if (value == null)
            return null;
        if (value instanceof Number)
            return ((Number) value).doubleValue();
        return Double.parseDouble(value.toString().trim());
    }

    /**
     * Reads a 0/1 flag column. {@code null} and {@code 0} are {@code false}.
     */
    public boolean getBoolean(String column) {
        Object value = values.get(column);
        if (value == null)
            return false;
        if (value instanceof Boolean)
            return (Boolean) value;
        if (value instanceof Number)
            return ((Number) value).longValue() != 0;
        String text = value.toString().trim();
        return text.equals("1") || text.equalsIgnoreCase("true");
    }

    public Set<String> columns() {
        return values.keySet();
    }

    /** Read-only view of all values. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Record))
            return false;
        return values.equals(((Record) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "Record" + values;
    }
}
