package com.herzen.irt.curves;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class CurveModels {
    /** Ability values with one output per value; {@code null} marks a value that could not be computed. */
    public record Curve(List<Double> theta, List<Double> values) {
        public static Curve placeholder() {
            return new Curve(AbilityGrid.rounded(), Collections.nCopies(AbilityGrid.POINTS, null));
        }

        public boolean complete() {
            return values.stream().allMatch(Objects::nonNull);
        }
    }

    /** Curve of a single item, or the placeholder curve and the reason it could not be computed. */
    public record ItemCurveResult(String itemId, Curve curve, String error) {
        public static ItemCurveResult success(String itemId, Curve curve) {
            return new ItemCurveResult(itemId, curve, null);
        }

        public static ItemCurveResult failure(String itemId, String error) {
            return new ItemCurveResult(itemId, Curve.placeholder(), error);
        }

        public boolean failed() {
            return error != null;
        }
    }
}
