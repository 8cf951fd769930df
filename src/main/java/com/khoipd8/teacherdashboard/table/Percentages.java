package com.khoipd8.teacherdashboard.table;

public final class Percentages {

    private Percentages() {
    }

    /**
     * {@code round(100 * numerator / denominator)}, rounding halves up; {@code whenEmpty} when the
     * denominator is zero.
     */
    public static int of(long numerator, long denominator, int whenEmpty) {
        if (denominator <= 0) {
            return whenEmpty;
        }
        return (int) Math.round(100.0 * numerator / denominator);
    }

    public static int roundedMean(double total, int count) {
        return (int) Math.round(total / count);
    }
}
