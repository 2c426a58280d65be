package com.lexicon.enrichment.graph;

import java.util.List;
import java.util.Map;

/**
 * Typed accessors for result rows. The driver returns numbers as {@code Long} or {@code Double}
 * and lists as {@code List<Object>}.
 */
public final class GraphRows {

    private GraphRows() {
    }

    public static String string(Map<String, Object> row, String key) {
        Object value = row.get(key);
        return value != null ? value.toString() : null;
    }

    public static int integer(Map<String, Object> row, String key, int defaultValue) {
        Object value = row.get(key);
        return value instanceof Number n ? n.intValue() : defaultValue;
    }

    public static long longValue(Map<String, Object> row, String key, long defaultValue) {
        Object value = row.get(key);
        return value instanceof Number n ? n.longValue() : defaultValue;
    }

    public static double decimal(Map<String, Object> row, String key, double defaultValue) {
        Object value = row.get(key);
        return value instanceof Number n ? n.doubleValue() : defaultValue;
    }

    public static List<String> strings(Map<String, Object> row, String key) {
        Object value = row.get(key);
        if (value instanceof List<?> list) {
            return list.stream().filter(v -> v != null).map(Object::toString).toList();
        }
        return List.of();
    }

    /**
     * Reads a single count column from the first row, or 0 when there is none.
     */
    public static long count(List<Map<String, Object>> rows, String key) {
        if (rows.isEmpty()) {
            return 0;
        }
        return longValue(rows.get(0), key, 0);
    }
}
