package com.herzen.irt.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Rounding {
    private Rounding() {
    }

    public static double round(double value, int places) {
        if (!Double.isFinite(value)) return value;
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    /** Rounded value, or {@code null} when the input is not a finite number. */
    public static Double roundOrNull(double value, int places) {
        return Double.isFinite(value) ? round(value, places) : null;
    }
}
