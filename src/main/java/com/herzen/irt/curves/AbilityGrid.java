package com.herzen.irt.curves;

import com.herzen.irt.domain.Rounding;

import java.util.Arrays;
import java.util.List;

/**
 * The fixed ability grid shared by every curve: 101 evenly spaced points on [-4, 4].
 */
public final class AbilityGrid {
    public static final double MIN = -4.0;
    public static final double MAX = 4.0;
    public static final int POINTS = 101;

    private static final double[] THETA = build();
    private static final List<Double> ROUNDED = Arrays.stream(THETA).map(t -> Rounding.round(t, 6)).boxed().toList();

    private AbilityGrid() {
    }

    public static double[] values() {
        return THETA.clone();
    }

    public static List<Double> rounded() {
        return ROUNDED;
    }

    private static double[] build() {
        double[] theta = new double[POINTS];
        double step = (MAX - MIN) / (POINTS - 1);
        for (int i = 0; i < POINTS; i++) {
            theta[i] = MIN + i * step;
        }
        theta[POINTS - 1] = MAX;
        return theta;
    }
}
