package com.all2md.core.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Copy helpers for node metadata maps.
 *
 * <p>Metadata keeps insertion order and permits null values, so {@link Map#copyOf} is not
 * usable. Nested maps and collections are copied recursively into unmodifiable structures.
 *
 * <p>Numbers are stored in the form JSON reads them back as: {@code byte}, {@code short},
 * {@code int} and {@code long} values become {@link Long}, {@code float} becomes
 * {@link Double}. Other numbers are kept as given.
 */
public final class Metadata {

    private Metadata() {
    }

    /**
     * Deep, unmodifiable copy of a metadata map.
     *
     * @param source map to copy, may be null
     * @return ordered unmodifiable copy, never null
     */
    public static Map<String, Object> copyOf(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "metadata keys must not be null");
            copy.put(entry.getKey(), copyValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a copy of {@code source} with {@code key} set to {@code value}.
     *
     * @param source existing metadata
     * @param key key to set
     * @param value new value
     * @return updated copy
     */
    public static Map<String, Object> with(Map<String, ?> source, String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            copy.putAll(source);
        }
        copy.put(key, value);
        return copyOf(copy);
    }

    /**
     * Reads a string value, falling back when absent or not a string.
     *
     * @param metadata metadata to read
     * @param key key to look up
     * @param fallback value returned when the key is missing
     * @return string value or fallback
     */
    public static String getString(Map<String, ?> metadata, String key, String fallback) {
        Object value = metadata.get(key);
        return value instanceof String s ? s : fallback;
    }

    static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(copyValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Object[] array) {
            List<Object> copy = new ArrayList<>(array.length);
            for (Object item : array) {
                copy.add(copyValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }
}
