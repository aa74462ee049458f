package com.edustream.studio.scenario;

import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

public record ChoiceParam(List<Double> choices) implements ParamSpec {

    public ChoiceParam {
        if (choices.isEmpty()) {
            throw new IllegalArgumentException("Choice parameter needs at least one choice");
        }
        choices = List.copyOf(choices);
    }

    /** Choice over the indices {@code 0..count-1} of a lookup table. */
    public static ChoiceParam indices(int count) {
        return new ChoiceParam(IntStream.range(0, count).mapToObj(i -> (double) i).toList());
    }

    @Override
    public double sample(Random random) {
        return choices.get(random.nextInt(choices.size()));
    }

    @Override
    public List<Double> values() {
        return choices;
    }
}
