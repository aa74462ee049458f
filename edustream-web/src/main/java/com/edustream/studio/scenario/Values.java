package com.edustream.studio.scenario;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal rounding and fixed-point formatting shared by the templates. Both round half up on
 * the decimal representation of the value, so a number and its formatted text always agree.
 */
public final class Values {

    private Values() {
    }

    public static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static String fmt(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }

    public static String plural(int count, String noun) {
        return count + " " + noun + (count > 1 ? "s" : "");
    }
}
