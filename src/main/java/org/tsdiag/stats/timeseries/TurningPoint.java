package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.tsdiag.stats.SeriesValidation;

/**
 * Turning point test for randomness.
 *
 * Counts interior points that are strict local maxima or minima. For an i.i.d. sequence of length n the count has
 * mean 2(n-2)/3 and variance (16n-29)/90; the standardised count is compared to a standard normal, two-sided.
 */
@Slf4j
public class TurningPoint {
    public static final int MIN_OBSERVATIONS = 3;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    private TurningPoint() {
    }

    public static TurningPointResult test(double[] data) {
        SeriesValidation.requireSeries(data, "data", MIN_OBSERVATIONS);
        int n = data.length;
        int peaks = 0;
        int troughs = 0;
        for (int t = 1; t < n - 1; t++) {
            if (data[t] > data[t - 1] && data[t] > data[t + 1]) {
                peaks++;
            } else if (data[t] < data[t - 1] && data[t] < data[t + 1]) {
                troughs++;
            }
        }
        int turningPoints = peaks + troughs;
        double expected = expectedTurningPoints(n);
        double variance = variance(n);
        double statistic = (turningPoints - expected) / Math.sqrt(variance);
        double pValue = 2 * (1 - STANDARD_NORMAL.cumulativeProbability(Math.abs(statistic)));
        pValue = Math.max(0, Math.min(1, pValue));
        log.debug("turning point on {} observations: {} turning points, Z {}", n, turningPoints, statistic);
        return new TurningPointResult(n, turningPoints, peaks, troughs, expected, variance, statistic, pValue);
    }

    static double expectedTurningPoints(int n) {
        return 2.0 * (n - 2) / 3.0;
    }

    static double variance(int n) {
        return (16.0 * n - 29) / 90.0;
    }
}
