package com.depintel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured output of one analyzer run.
 *
 * <p>{@code summary} and {@code details} hold only maps, lists, strings, numbers, booleans
 * and nulls, so the document serializes to JSON unchanged. Both are frozen on construction;
 * nested collections are unmodifiable too.
 *
 * @param type analysis that produced the document
 * @param summary aggregated figures
 * @param details per-dependency and per-group findings
 * @param warnings non-fatal notes (degraded inputs, skipped dependencies)
 */
public record AnalysisResult(
    AnalysisType type,
    Map<String, Object> summary,
    Map<String, Object> details,
    List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        Objects.requireNonNull(type, "type must not be null");
        summary = freezeMap(summary);
        details = freezeMap(details);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Returns a summary value.
     *
     * @param key summary key
     * @return value, or {@code null} when absent
     */
    public Object summaryValue(String key) {
        return summary.get(key);
    }

    /**
     * Returns a detail section that holds a list of entries.
     *
     * @param key detail key
     * @return entries, empty when the section is absent
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> detailEntries(String key) {
        Object value = details.get(key);
        if (value instanceof List<?> list) {
            return (List<Map<String, Object>>) list;
        }
        return List.of();
    }

    /**
     * Returns a detail section that holds a map.
     *
     * @param key detail key
     * @return section, empty when absent
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> detailSection(String key) {
        Object value = details.get(key);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    private static Map<String, Object> freezeMap(Map<String, Object> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
