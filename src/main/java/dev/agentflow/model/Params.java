package dev.agentflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the key/value parameter bags carried by flows, nodes and inputs.
 */
public final class Params {

    private Params() {}

    /**
     * Unmodifiable, insertion-ordered copy. Null values are kept, a null bag becomes empty.
     */
    public static Map<String, Object> freeze(Map<String, ?> bag) {
        if (bag == null || bag.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(bag));
    }

    /**
     * Layer several bags into one. Bags are applied in argument order, so on a key
     * collision the later bag wins.
     */
    @SafeVarargs
    public static Map<String, Object> layer(Map<String, ?>... bags) {
        var merged = new LinkedHashMap<String, Object>();
        for (Map<String, ?> bag : bags) {
            if (bag != null) {
                merged.putAll(bag);
            }
        }
        return Collections.unmodifiableMap(merged);
    }
}
