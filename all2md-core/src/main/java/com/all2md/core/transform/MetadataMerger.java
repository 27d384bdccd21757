package com.all2md.core.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strategy for combining document metadata in {@link Transforms#mergeDocuments}.
 */
@FunctionalInterface
public interface MetadataMerger {

    /**
     * Merges metadata of the next document into the accumulated metadata.
     *
     * @param accumulated metadata merged so far
     * @param incoming metadata of the next document
     * @return merged metadata
     */
    Map<String, Object> merge(Map<String, Object> accumulated, Map<String, Object> incoming);

    /**
     * Later documents win for keys they set to a non-null value; absent or null values
     * never erase an earlier value.
     *
     * @return the default merger
     */
    static MetadataMerger lastWriteWins() {
        return (accumulated, incoming) -> {
            Map<String, Object> result = new LinkedHashMap<>(accumulated);
            incoming.forEach((key, value) -> {
                if (value != null || !result.containsKey(key)) {
                    result.put(key, value);
                }
            });
            return result;
        };
    }

    /**
     * Earlier documents win; later documents only fill keys that are absent or null.
     *
     * @return first-write-wins merger
     */
    static MetadataMerger firstWriteWins() {
        return (accumulated, incoming) -> {
            Map<String, Object> result = new LinkedHashMap<>(accumulated);
            incoming.forEach((key, value) -> {
                if (result.get(key) == null) {
                    result.put(key, value);
                }
            });
            return result;
        };
    }

    /**
     * Concatenates list values present in both maps; other keys follow {@link #lastWriteWins()}.
     *
     * @return list-concatenating merger
     */
    static MetadataMerger mergeLists() {
        MetadataMerger fallback = lastWriteWins();
        return (accumulated, incoming) -> {
            Map<String, Object> result = fallback.merge(accumulated, incoming);
            incoming.forEach((key, value) -> {
                if (accumulated.get(key) instanceof List<?> existing && value instanceof List<?> added) {
                    List<Object> combined = new ArrayList<>(existing);
                    combined.addAll(added);
                    result.put(key, combined);
                }
            });
            return result;
        };
    }
}
