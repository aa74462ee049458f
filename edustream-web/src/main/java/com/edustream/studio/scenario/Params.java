package com.edustream.studio.scenario;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sampled parameter values of one template run.
 */
public final class Params {

    private final Map<String, Double> values;

    public Params(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public double num(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown parameter: " + name);
        }
        return value;
    }

    public int integer(String name) {
        return (int) num(name);
    }

    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
