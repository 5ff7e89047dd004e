package com.codeforge.orchestrator.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deep, read-only copies of the JSON-shaped payloads a job carries
 * (input context, step outputs, result, checkpoint).
 *
 * Maps, lists and sets are copied level by level; scalars are shared.
 * Order and null entries are preserved.
 */
public final class Payloads {

    private Payloads() {}

    public static Map<String, Object> freeze(Map<String, Object> payload) {
        if (payload == null) return null;
        Map<String, Object> copy = new LinkedHashMap<>();
        payload.forEach((key, value) -> copy.put(key, freezeValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    public static Object freezeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, freezeValue(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(v -> copy.add(freezeValue(v)));
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            items.forEach(v -> copy.add(freezeValue(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
