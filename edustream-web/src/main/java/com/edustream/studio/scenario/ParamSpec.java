package com.edustream.studio.scenario;

import java.util.List;
import java.util.Random;

/**
 * Declared domain of one template parameter.
 */
public sealed interface ParamSpec permits RangeParam, ChoiceParam {

    double sample(Random random);

    /** Every value {@link #sample} can return, in ascending order for ranges. */
    List<Double> values();
}
