package com.edustream.studio.scenario;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ground truth computed by a template's solve function.
 */
public final class Solution {

    private final Map<String, Object> values;

    private Solution(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /** Alternating key/value pairs. */
    public static Solution of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Solution needs key/value pairs");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new Solution(values);
    }

    public double num(String key) {
        return ((Number) get(key)).doubleValue();
    }

    public String text(String key) {
        return (String) get(key);
    }

    public boolean flag(String key) {
        return (Boolean) get(key);
    }

    private Object get(String key) {
        Object value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown solution value: " + key);
        }
        return value;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
