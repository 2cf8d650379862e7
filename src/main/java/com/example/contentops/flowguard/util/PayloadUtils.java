package com.example.contentops.flowguard.util;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for the loosely typed stage payloads (nested maps and lists) that flow through a session.
 */
public final class PayloadUtils {

    private PayloadUtils() {
    }

    /** Deep copy of a payload map, unmodifiable at the top level. Null becomes an empty map. */
    public static Map<String, Object> immutableCopy(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(deepCopy(source, Set.of()));
    }

    /**
     * Deep copy of a payload map. Keys in {@code excludedKeys} and binary values are dropped at every
     * nesting level.
     */
    public static Map<String, Object> deepCopy(Map<String, ?> source, Set<String> excludedKeys) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source == null) {
            return copy;
        }
        source.forEach((key, value) -> {
            if (excludedKeys.contains(key) || isBinary(value)) {
                return;
            }
            copy.put(key, copyValue(value, excludedKeys));
        });
        return copy;
    }

    private static Object copyValue(Object value, Set<String> excludedKeys) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                String key = String.valueOf(k);
                if (!excludedKeys.contains(key) && !isBinary(v)) {
                    nested.put(key, copyValue(v, excludedKeys));
                }
            });
            return nested;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object item : collection) {
                if (!isBinary(item)) {
                    list.add(copyValue(item, excludedKeys));
                }
            }
            return list;
        }
        if (value instanceof Object[] array) {
            List<Object> list = new ArrayList<>(array.length);
            for (Object item : array) {
                if (!isBinary(item)) {
                    list.add(copyValue(item, excludedKeys));
                }
            }
            return list;
        }
        return value;
    }

    public static boolean isBinary(Object value) {
        return value instanceof byte[] || value instanceof ByteBuffer;
    }

    /** Recursive key search through nested maps and sequences. */
    public static boolean containsKeyDeep(Object data, String field) {
        if (data instanceof Map<?, ?> map) {
            if (map.containsKey(field)) {
                return true;
            }
            for (Object value : map.values()) {
                if (containsKeyDeep(value, field)) {
                    return true;
                }
            }
            return false;
        }
        if (data instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (containsKeyDeep(item, field)) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Value of the first occurrence of {@code field} in a depth-first search, or null. */
    public static Object findDeep(Object data, String field) {
        if (data instanceof Map<?, ?> map) {
            if (map.containsKey(field)) {
                return map.get(field);
            }
            for (Object value : map.values()) {
                Object found = findDeep(value, field);
                if (found != null) {
                    return found;
                }
            }
        } else if (data instanceof Collection<?> collection) {
            for (Object item : collection) {
                Object found = findDeep(item, field);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    /** First non-blank string value among {@code keys}, or an empty string. */
    public static String text(Map<String, ?> payload, String... keys) {
        if (payload == null) {
            return "";
        }
        for (String key : keys) {
            Object value = payload.get(key);
            if (value instanceof String s && !s.isBlank()) {
                return s;
            }
        }
        return "";
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    public static boolean isEmptyValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isBlank();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return false;
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    public static Number number(Map<String, ?> payload, String key) {
        Object value = payload == null ? null : payload.get(key);
        return value instanceof Number n ? n : null;
    }
}
