package org.tsdiag.stats;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Finite-sample critical values tabulated at a few sample sizes.
 *
 * Lookups interpolate linearly in 1/n between breakpoints; the asymptotic row sits at 1/n = 0.
 * Sample sizes below the first breakpoint use the first row.
 */
public final class CriticalValueTable {
    public static final double ASYMPTOTIC = Double.POSITIVE_INFINITY;

    private final double smallestSize;
    private final PolynomialSplineFunction onePercent;
    private final PolynomialSplineFunction fivePercent;
    private final PolynomialSplineFunction tenPercent;

    /**
     * @param sampleSizes breakpoints in ascending order, the last one may be {@link #ASYMPTOTIC}
     * @param rows one {1%, 5%, 10%} triple per breakpoint
     */
    public CriticalValueTable(double[] sampleSizes, double[][] rows) {
        if (sampleSizes.length < 2 || sampleSizes.length != rows.length) {
            throw new IllegalArgumentException("critical value table needs at least two rows, one per sample size");
        }
        int count = sampleSizes.length;
        double[] inverseSizes = new double[count];
        double[][] columns = new double[3][count];
        // interpolators need ascending abscissae, 1/n reverses the order
        for (int i = 0; i < count; i++) {
            int source = count - 1 - i;
            inverseSizes[i] = 1. / sampleSizes[source];
            for (int level = 0; level < 3; level++) {
                columns[level][i] = rows[source][level];
            }
        }
        LinearInterpolator interpolator = new LinearInterpolator();
        this.smallestSize = sampleSizes[0];
        this.onePercent = interpolator.interpolate(inverseSizes, columns[0]);
        this.fivePercent = interpolator.interpolate(inverseSizes, columns[1]);
        this.tenPercent = interpolator.interpolate(inverseSizes, columns[2]);
    }

    public CriticalValues lookup(int sampleSize) {
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sample size must be positive (got " + sampleSize + ")");
        }
        double x = 1. / Math.max(sampleSize, smallestSize);
        return new CriticalValues(onePercent.value(x), fivePercent.value(x), tenPercent.value(x));
    }
}
