package com.edustream.studio.scenario;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Continuous range discretized by {@code step}: values are {@code min + k * step} for
 * {@code k} in {@code [0, floor((max - min) / step)]}.
 */
public record RangeParam(double min, double max, double step) implements ParamSpec {

    public RangeParam {
        if (step <= 0 || max < min) {
            throw new IllegalArgumentException("Invalid range " + min + ".." + max + " step " + step);
        }
    }

    public static RangeParam of(double min, double max, double step) {
        return new RangeParam(min, max, step);
    }

    int steps() {
        // tolerance for ranges like 0.1..0.5 step 0.05
        return (int) Math.floor((max - min) / step + 1e-9);
    }

    @Override
    public double sample(Random random) {
        return valueAt(random.nextInt(steps() + 1));
    }

    @Override
    public List<Double> values() {
        List<Double> values = new ArrayList<>(steps() + 1);
        for (int k = 0; k <= steps(); k++) {
            values.add(valueAt(k));
        }
        return values;
    }

    private double valueAt(int k) {
        return Values.round(min + k * step, 6);
    }
}
