package org.tims.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of a metadata table, keyed by column name.
 * <p>
 * Missing columns are a source fault; {@code null} cells read as {@code NaN}
 * through {@link #getDouble(String)}.
 */
public final class TableRow {
    private final String table;
    private final Map<String, Object> values;

    public TableRow(String table, Map<String, ?> values) {
        this.table = table;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Object get(String column) {
        if (!values.containsKey(column)) {
            throw new AcquisitionSourceException("Column " + column + " not found in " + table);
        }
        return values.get(column);
    }

    public double getDouble(String column) {
        Object value = get(column);
        if (value == null) return Double.NaN;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new AcquisitionSourceException(table + "." + column + " is not numeric: " + value, e);
        }
    }

    public int getInt(String column) {
        return (int) getLong(column);
    }

    public long getLong(String column) {
        Object value = get(column);
        if (value instanceof Number) return ((Number) value).longValue();
        if (value == null) {
            throw new AcquisitionSourceException(table + "." + column + " is null");
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new AcquisitionSourceException(table + "." + column + " is not an integer: " + value, e);
        }
    }

    public String getString(String column) {
        Object value = get(column);
        return value == null ? null : value.toString();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return table + values;
    }
}
