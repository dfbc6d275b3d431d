package com.depintel.core.util;

/**
 * Numeric helpers for scores.
 */
public final class Scores {

    private Scores() {
        // Utility class
    }

    /**
     * Clamps a value into [0, 1].
     *
     * @param value raw value
     * @return clamped value
     */
    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Rounds to four decimals so repeated runs produce identical documents.
     *
     * @param value raw value
     * @return rounded value
     */
    public static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    /**
     * Rounds to the given number of decimals.
     *
     * @param value raw value
     * @param decimals decimals to keep
     * @return rounded value
     */
    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    /**
     * Returns {@code value} or {@code fallback} when {@code value} is unknown.
     *
     * @param value possibly unknown value
     * @param fallback neutral replacement
     * @return value to use in a composite
     */
    public static double orNeutral(Double value, double fallback) {
        return value == null ? fallback : value;
    }
}
