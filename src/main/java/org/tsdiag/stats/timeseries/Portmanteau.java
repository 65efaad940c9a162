package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.tsdiag.stats.SeriesValidation;

/**
 * Portmanteau tests for joint autocorrelation up to lag h.
 *
 * Ljung-Box: Q = n(n+2) Σ ρ̂_k²/(n-k). Box-Pierce: Q = n Σ ρ̂_k².
 * Q is referred to a χ² distribution with h - fitdf degrees of freedom.
 */
@Slf4j
public class Portmanteau {
    public static final int MIN_OBSERVATIONS = 10;
    public static final int MAX_AUTO_LAGS = 10;

    public enum Method {
        LJUNG_BOX("Ljung-Box"),
        BOX_PIERCE("Box-Pierce");

        private final String label;

        Method(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private Portmanteau() {
    }

    public static PortmanteauResult ljungBox(double[] data) {
        return test(data, Method.LJUNG_BOX, PortmanteauOptions.defaults());
    }

    public static PortmanteauResult ljungBox(double[] data, Integer lags) {
        return test(data, Method.LJUNG_BOX, PortmanteauOptions.of(lags, 0));
    }

    public static PortmanteauResult ljungBox(double[] data, Integer lags, int fitdf) {
        return test(data, Method.LJUNG_BOX, PortmanteauOptions.of(lags, fitdf));
    }

    public static PortmanteauResult ljungBox(double[] data, PortmanteauOptions options) {
        return test(data, Method.LJUNG_BOX, options);
    }

    public static PortmanteauResult boxPierce(double[] data) {
        return test(data, Method.BOX_PIERCE, PortmanteauOptions.defaults());
    }

    public static PortmanteauResult boxPierce(double[] data, Integer lags, int fitdf) {
        return test(data, Method.BOX_PIERCE, PortmanteauOptions.of(lags, fitdf));
    }

    public static PortmanteauResult test(double[] data, Method method, PortmanteauOptions options) {
        if (method == null || options == null) {
            throw new IllegalArgumentException("method and options cannot be null");
        }
        SeriesValidation.requireSeries(data, "data", MIN_OBSERVATIONS);
        int n = data.length;
        int lags = options.getLags() == null ? autoLags(n) : options.getLags();
        if (lags >= n) {
            throw new IllegalArgumentException("lags must be less than the number of observations " + n + " (got " + lags + ")");
        }
        int fitdf = options.getFitdf();
        if (fitdf >= lags) {
            throw new IllegalArgumentException("fitdf (" + fitdf + ") must be less than lags (" + lags + ")");
        }

        double[] rho = autocorrelations(data, lags);
        double sum = 0;
        for (int k = 1; k <= lags; k++) {
            double r = rho[k - 1];
            sum += method == Method.LJUNG_BOX ? r * r / (n - k) : r * r;
        }
        double statistic = method == Method.LJUNG_BOX ? n * (n + 2.0) * sum : n * sum;
        int degreesOfFreedom = lags - fitdf;
        double pValue = 1 - new ChiSquaredDistribution(degreesOfFreedom).cumulativeProbability(statistic);
        pValue = Math.max(0, Math.min(1, pValue));
        log.debug("{} with {} lags on {} observations: Q {}, p-value {}", method, lags, n, statistic, pValue);
        return new PortmanteauResult(method, statistic, pValue, lags, fitdf, n, rho);
    }

    static int autoLags(int n) {
        return Math.max(1, Math.min(MAX_AUTO_LAGS, n / 5));
    }

    /**
     * Sample autocorrelations ρ̂_1 ... ρ̂_h around the sample mean.
     */
    static double[] autocorrelations(double[] data, int lags) {
        int n = data.length;
        double mean = StatUtils.mean(data);
        double denominator = 0;
        for (double value : data) {
            denominator += (value - mean) * (value - mean);
        }
        double[] rho = new double[lags];
        for (int k = 1; k <= lags; k++) {
            double numerator = 0;
            for (int t = k; t < n; t++) {
                numerator += (data[t] - mean) * (data[t - k] - mean);
            }
            rho[k - 1] = numerator / denominator;
        }
        return rho;
    }
}
