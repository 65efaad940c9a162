package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.stat.StatUtils;
import org.tsdiag.stats.DegenerateSeriesException;
import org.tsdiag.stats.DesignMatrix;
import org.tsdiag.stats.OrdinaryLeastSquares;
import org.tsdiag.stats.SeriesValidation;

/**
 * Kwiatkowski-Phillips-Schmidt-Shin stationarity test.
 *
 * Residuals of the series on a constant (level) or on constant and trend are accumulated into partial sums S_t;
 * the statistic is Σ S_t² / (n² σ²) where σ² is the Newey-West long-run variance with Bartlett weights.
 * The default truncation lag is trunc(4 (n/100)^(1/4)).
 */
@Slf4j
public class Kpss {
    public static final int MIN_OBSERVATIONS = 10;

    private static final double[] P_LEVELS = {0.10, 0.05, 0.025, 0.01};
    private static final double[] LEVEL_CRITICAL_VALUES = {0.347, 0.463, 0.574, 0.739};
    private static final double[] TREND_CRITICAL_VALUES = {0.119, 0.146, 0.176, 0.216};

    private static final PolynomialSplineFunction LEVEL_P_VALUE = new LinearInterpolator().interpolate(LEVEL_CRITICAL_VALUES, P_LEVELS);
    private static final PolynomialSplineFunction TREND_P_VALUE = new LinearInterpolator().interpolate(TREND_CRITICAL_VALUES, P_LEVELS);

    private Kpss() {
    }

    public static KpssResult test(double[] data) {
        return test(data, KpssType.LEVEL, null);
    }

    public static KpssResult test(double[] data, String type) {
        return test(data, KpssType.parse(type), null);
    }

    public static KpssResult test(double[] data, String type, Integer lags) {
        return test(data, KpssType.parse(type), lags);
    }

    /**
     * @param lags Bartlett truncation lag, {@code null} for the default
     */
    public static KpssResult test(double[] data, KpssType type, Integer lags) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        SeriesValidation.requireSeries(data, "data", MIN_OBSERVATIONS);
        int n = data.length;
        int lag = lags == null ? defaultLag(n) : lags;
        if (lag < 0 || lag >= n) {
            throw new IllegalArgumentException("lags must be in [0, " + (n - 1) + "] (got " + lag + ")");
        }

        DesignMatrix design = new DesignMatrix(n).intercept();
        if (type == KpssType.TREND) {
            design.trend(1.);
        }
        double[] residuals = OrdinaryLeastSquares.fit(data, design.build()).getResiduals();

        double partialSum = 0;
        double eta = 0;
        for (double residual : residuals) {
            partialSum += residual;
            eta += partialSum * partialSum;
        }
        eta /= (double) n * n;

        double longRunVariance = longRunVariance(residuals, lag);
        if (!(longRunVariance > SeriesValidation.CONSTANT_TOLERANCE * StatUtils.populationVariance(data))) {
            throw new DegenerateSeriesException("long-run variance of the residuals is zero, the series is exactly " + type);
        }
        double statistic = eta / longRunVariance;
        double[] criticalValues = type == KpssType.LEVEL ? LEVEL_CRITICAL_VALUES : TREND_CRITICAL_VALUES;
        double pValue = pValue(statistic, type);
        log.debug("kpss ({}, lag {}) on {} observations: statistic {}, p-value {}", type, lag, n, statistic, pValue);
        return new KpssResult(statistic, type, lag, n, longRunVariance, pValue, criticalValues);
    }

    static int defaultLag(int n) {
        return (int) (4 * Math.pow(n / 100.0, 0.25));
    }

    /**
     * Newey-West estimate with Bartlett weights 1 - s/(lag + 1).
     */
    static double longRunVariance(double[] errors, int lag) {
        int n = errors.length;
        double variance = 0;
        for (double error : errors) {
            variance += error * error;
        }
        for (int s = 1; s <= lag; s++) {
            double covariance = 0;
            for (int t = s; t < n; t++) {
                covariance += errors[t] * errors[t - s];
            }
            variance += 2 * (1 - s / (lag + 1.0)) * covariance;
        }
        return variance / n;
    }

    /**
     * Linear interpolation in the critical value table, truncated to the tabulated range [0.01, 0.10].
     */
    static double pValue(double statistic, KpssType type) {
        double[] criticalValues = type == KpssType.LEVEL ? LEVEL_CRITICAL_VALUES : TREND_CRITICAL_VALUES;
        if (statistic <= criticalValues[0]) {
            return P_LEVELS[0];
        }
        if (statistic >= criticalValues[criticalValues.length - 1]) {
            return P_LEVELS[P_LEVELS.length - 1];
        }
        return (type == KpssType.LEVEL ? LEVEL_P_VALUE : TREND_P_VALUE).value(statistic);
    }
}
