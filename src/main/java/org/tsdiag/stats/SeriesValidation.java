package org.tsdiag.stats;

import java.util.List;

/**
 * Argument checks applied at the entry point of every test. All failures are {@link IllegalArgumentException}.
 */
public class SeriesValidation {

    /**
     * A series whose range is at most this fraction of its largest absolute value is constant.
     */
    public static final double CONSTANT_TOLERANCE = 1e-10;

    private SeriesValidation() {
    }

    /**
     * Checks that {@code data} is non-null, holds at least {@code minimum} finite values and is not constant.
     */
    public static void requireSeries(double[] data, String name, int minimum) {
        requireFinite(data, name, minimum);
        if (isConstant(data)) {
            throw new IllegalArgumentException(name + " has no variation (constant series)");
        }
    }

    /**
     * True when the range of {@code data} is negligible relative to its magnitude. The check does not depend on the
     * scale of the values.
     */
    public static boolean isConstant(double[] data) {
        double largest = 0;
        for (double value : data) {
            largest = Math.max(largest, Math.abs(value));
        }
        return StatsUtils.range(data) <= CONSTANT_TOLERANCE * largest;
    }

    /**
     * Same as {@link #requireSeries} without the constant check.
     */
    public static void requireFinite(double[] data, String name, int minimum) {
        if (data == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (data.length == 0) {
            throw new IllegalArgumentException(name + " cannot be empty");
        }
        if (data.length < minimum) {
            throw new IllegalArgumentException(name + " must have at least " + minimum + " observations (got " + data.length + ")");
        }
        for (int i = 0; i < data.length; i++) {
            if (Double.isNaN(data[i]) || Double.isInfinite(data[i])) {
                throw new IllegalArgumentException(name + " contains a non-finite value at index " + i);
            }
        }
    }

    public static void requireSameLength(double[] first, double[] second) {
        if (first == null || second == null) {
            throw new IllegalArgumentException("time series cannot be null");
        }
        if (first.length != second.length) {
            throw new IllegalArgumentException("time series must have the same length (got " + first.length + " and " + second.length + ")");
        }
    }

    public static void requireSameLength(List<double[]> series) {
        int expected = series.get(0) == null ? -1 : series.get(0).length;
        for (int i = 0; i < series.size(); i++) {
            double[] values = series.get(i);
            if (values == null) {
                throw new IllegalArgumentException("series " + i + " cannot be null");
            }
            if (values.length != expected) {
                throw new IllegalArgumentException("all series must have the same length (series 0 has " + expected + ", series " + i + " has " + values.length + ")");
            }
        }
    }

    public static void requireAlpha(double alpha) {
        if (!(alpha > 0 && alpha < 1)) {
            throw new IllegalArgumentException("significance level must be in (0, 1) (got " + alpha + ")");
        }
    }
}
