package org.dbsync.extract;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One catalog result row as a name-keyed record. Column labels are matched case-insensitively,
 * since drivers differ in how they report {@code INFORMATION_SCHEMA} labels.
 */
public final class MetadataRow {
    private final Map<String, Object> values;

    public MetadataRow(Map<String, ?> values) {
        TreeMap<String, Object> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Convenience factory taking alternating label/value pairs.
     */
    public static MetadataRow of(Object... labelsAndValues) {
        if (labelsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("labels and values must come in pairs");
        }
        TreeMap<String, Object> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 0; i < labelsAndValues.length; i += 2) {
            map.put(String.valueOf(labelsAndValues[i]), labelsAndValues[i + 1]);
        }
        return new MetadataRow(map);
    }

    public boolean has(String label) {
        return values.containsKey(label);
    }

    public String getString(String label) {
        Object v = values.get(label);
        return v == null ? null : v.toString();
    }

    public String getString(String label, String fallback) {
        String v = getString(label);
        return v == null ? fallback : v;
    }

    public long getLong(String label, long fallback) {
        Object v = values.get(label);
        if (v == null) return fallback;
        if (v instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(v.toString().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
