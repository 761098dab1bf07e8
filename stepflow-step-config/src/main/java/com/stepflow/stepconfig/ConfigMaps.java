package com.stepflow.stepconfig;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Map helpers for configuration values. Copies keep insertion order and allow null values,
 * unlike {@link Map#copyOf}.
 */
public final class ConfigMaps {

    private ConfigMaps() {
    }

    /** Unmodifiable ordered copy; nested maps, lists and sets are copied too. Null input yields an empty map. */
    public static <V> Map<String, V> copy(Map<String, ? extends V> source) {
        if (source == null || source.isEmpty()) return Collections.emptyMap();
        Map<String, V> out = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends V> e : source.entrySet()) {
            out.put(e.getKey(), copyValue(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Recursive update: keys of {@code update} win, except that when both sides hold a map for
     * the same key the two maps are merged the same way.
     */
    public static Map<String, Object> recursiveUpdate(Map<String, ?> base, Map<String, ?> update) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (base != null) out.putAll(base);
        if (update != null) {
            for (Map.Entry<String, ?> e : update.entrySet()) {
                Object existing = out.get(e.getKey());
                Object incoming = e.getValue();
                if (existing instanceof Map && incoming instanceof Map) {
                    out.put(e.getKey(), recursiveUpdate(asStringMap(existing), asStringMap(incoming)));
                } else {
                    out.put(e.getKey(), incoming);
                }
            }
        }
        return copy(out);
    }

    @SuppressWarnings("unchecked")
    private static <V> V copyValue(V value) {
        if (value instanceof Map) {
            return (V) copy(asStringMap(value));
        }
        if (value instanceof Set) {
            Set<Object> out = new LinkedHashSet<>();
            for (Object item : (Set<?>) value) {
                out.add(copyValue(item));
            }
            return (V) Collections.unmodifiableSet(out);
        }
        if (value instanceof Collection) {
            List<Object> out = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                out.add(copyValue(item));
            }
            return (V) Collections.unmodifiableList(out);
        }
        return value;
    }

    private static Map<String, Object> asStringMap(Object value) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
            out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }
}
