package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.FDistribution;
import org.tsdiag.stats.DegenerateSeriesException;
import org.tsdiag.stats.OrdinaryLeastSquares;
import org.tsdiag.stats.SeriesValidation;

import java.util.Arrays;

/**
 * Chow test for a structural break at a known observation.
 *
 * The regression is fitted on the full sample and separately on [0, b) and [b, n);
 * F = ((RSS - RSS_1 - RSS_2) / k) / ((RSS_1 + RSS_2) / (n - 2k)) with k regressors.
 */
@Slf4j
public class Chow {
    private static final double DENOMINATOR_TOLERANCE = 1e-10;

    private Chow() {
    }

    /**
     * @param y response
     * @param x design matrix, one row per observation; include an intercept column if wanted
     * @param breakPoint first observation of the second regime, k &lt; breakPoint &lt; n - k
     */
    public static ChowResult test(double[] y, double[][] x, int breakPoint) {
        if (y == null || x == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        int n = y.length;
        if (x.length != n) {
            throw new IllegalArgumentException("X and y must have the same number of observations (got " + x.length + " and " + n + ")");
        }
        if (n == 0 || x[0] == null || x[0].length == 0) {
            throw new IllegalArgumentException("design matrix cannot be empty");
        }
        int k = x[0].length;
        for (int row = 0; row < n; row++) {
            if (x[row] == null || x[row].length != k) {
                throw new IllegalArgumentException("design matrix row " + row + " does not have " + k + " columns");
            }
            SeriesValidation.requireFinite(x[row], "design matrix row " + row, k);
        }
        SeriesValidation.requireFinite(y, "y", 1);
        if (breakPoint <= k) {
            throw new IllegalArgumentException("Break point must be > " + k + " (number of parameters) for valid test (got " + breakPoint + ")");
        }
        if (breakPoint >= n - k) {
            throw new IllegalArgumentException("Break point must be < " + (n - k) + " (n - k) for valid test (got " + breakPoint + ")");
        }

        double rssFull = OrdinaryLeastSquares.fit(y, x).getResidualSumOfSquares();
        double rss1 = OrdinaryLeastSquares.fit(Arrays.copyOfRange(y, 0, breakPoint),
                Arrays.copyOfRange(x, 0, breakPoint)).getResidualSumOfSquares();
        double rss2 = OrdinaryLeastSquares.fit(Arrays.copyOfRange(y, breakPoint, n),
                Arrays.copyOfRange(x, breakPoint, n)).getResidualSumOfSquares();

        int df1 = k;
        int df2 = n - 2 * k;
        double denominator = (rss1 + rss2) / df2;
        if (denominator < DENOMINATOR_TOLERANCE) {
            throw new DegenerateSeriesException("Denominator too small, sub-models fit perfectly");
        }
        double statistic = Math.max(0., (rssFull - (rss1 + rss2)) / df1 / denominator);
        double pValue = 1. - new FDistribution(df1, df2).cumulativeProbability(statistic);
        pValue = Math.max(0., Math.min(1., pValue));
        log.debug("chow at {} on {} observations, {} regressors: F {}, p {}", breakPoint, n, k, statistic, pValue);
        return new ChowResult(statistic, pValue, df1, df2, breakPoint, rssFull, rss1, rss2, n, k);
    }
}
