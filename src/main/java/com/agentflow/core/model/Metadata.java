package com.agentflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class Metadata {

    private Metadata() {}

    /** Unmodifiable, insertion-ordered copy that tolerates null values. */
    static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    static Map<String, Object> with(Map<String, Object> source, String key, Object value) {
        var copy = new LinkedHashMap<String, Object>(source == null ? Map.of() : source);
        copy.put(key, value);
        return Collections.unmodifiableMap(copy);
    }
}
