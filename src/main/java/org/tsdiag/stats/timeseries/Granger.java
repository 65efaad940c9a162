package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.FDistribution;
import org.tsdiag.stats.DegenerateSeriesException;
import org.tsdiag.stats.DesignMatrix;
import org.tsdiag.stats.NumericColumnSource;
import org.tsdiag.stats.OrdinaryLeastSquares;
import org.tsdiag.stats.SeriesValidation;
import org.tsdiag.stats.StatsUtils;

/**
 * Granger causality: does the past of x improve the prediction of y beyond y's own past?
 *
 * Restricted model y_t ~ 1 + y_{t-1..t-p}, unrestricted model adds x_{t-1..t-p}; both fitted over the same n - p
 * observations. F = ((RSS_r - RSS_u) / p) / (RSS_u / (n - p - 2p - 1)).
 */
@Slf4j
public class Granger {
    public static final int MIN_OBSERVATIONS = 10;
    public static final int MAX_AUTO_LAG = 10;

    private static final double RSS_TOLERANCE = 1e-12;

    private Granger() {
    }

    public static GrangerResult test(double[] x, double[] y) {
        return test(x, y, GrangerOptions.defaults());
    }

    /**
     * @param x candidate cause
     * @param y series being predicted
     * @param lag lag order, {@code null} for automatic selection
     */
    public static GrangerResult test(double[] x, double[] y, Integer lag) {
        return test(x, y, GrangerOptions.of(lag));
    }

    public static GrangerResult test(NumericColumnSource source, String xColumn, String yColumn, Integer lag) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return test(source.column(xColumn), source.column(yColumn), GrangerOptions.of(lag));
    }

    public static GrangerResult test(double[] x, double[] y, GrangerOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (x == null || y == null) {
            throw new IllegalArgumentException("x and y cannot be null");
        }
        SeriesValidation.requireSameLength(x, y);
        SeriesValidation.requireSeries(x, "x", MIN_OBSERVATIONS);
        SeriesValidation.requireSeries(y, "y", MIN_OBSERVATIONS);
        int n = y.length;
        int maxLag = maxLag(n);
        int p;
        if (options.isAutoLag()) {
            p = Math.min(autoLag(n), maxLag);
        } else {
            p = options.getLag();
            if (p > maxLag) {
                throw new IllegalArgumentException("lag " + p + " too large for " + n + " observations (maximum " + maxLag + ")");
            }
        }
        int rows = n - p;
        int df1 = p;
        int df2 = rows - 2 * p - 1;

        DesignMatrix restricted = new DesignMatrix(rows).intercept();
        for (int j = 1; j <= p; j++) {
            restricted.slice(y, p - j);
        }
        DesignMatrix unrestricted = new DesignMatrix(rows).intercept();
        for (int j = 1; j <= p; j++) {
            unrestricted.slice(y, p - j);
        }
        for (int j = 1; j <= p; j++) {
            unrestricted.slice(x, p - j);
        }
        double[] response = new double[rows];
        System.arraycopy(y, p, response, 0, rows);

        double rssRestricted = OrdinaryLeastSquares.fit(response, restricted.build()).getResidualSumOfSquares();
        double rssUnrestricted = OrdinaryLeastSquares.fit(response, unrestricted.build()).getResidualSumOfSquares();
        // nested models, rounding must not make the larger one fit worse
        rssRestricted = Math.max(rssRestricted, rssUnrestricted);
        if (rssUnrestricted <= RSS_TOLERANCE * StatsUtils.sumOfSquares(response)) {
            throw new DegenerateSeriesException("unrestricted model fits perfectly, F statistic is undefined");
        }
        double statistic = Math.max(0., ((rssRestricted - rssUnrestricted) / df1) / (rssUnrestricted / df2));
        double pValue = 1. - new FDistribution(df1, df2).cumulativeProbability(statistic);
        pValue = Math.max(0., Math.min(1., pValue));
        log.debug("granger with lag {} on {} observations: F {}, p {}", p, n, statistic, pValue);
        return new GrangerResult(statistic, pValue, p, df1, df2, rssRestricted, rssUnrestricted, n, rows);
    }

    /**
     * Largest lag leaving at least one denominator degree of freedom: n - 3p - 1 ≥ 1.
     */
    static int maxLag(int n) {
        return (n - 2) / 3;
    }

    static int autoLag(int n) {
        int lag = (int) Math.floor(Math.cbrt(n - 1) + 1e-9);
        return Math.max(1, Math.min(MAX_AUTO_LAG, lag));
    }
}
