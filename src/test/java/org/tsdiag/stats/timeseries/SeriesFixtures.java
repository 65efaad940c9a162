package org.tsdiag.stats.timeseries;

import java.util.Random;

/**
 * Reproducible series for the timeseries tests.
 */
final class SeriesFixtures {

    private SeriesFixtures() {
    }

    /**
     * First differences of white noise: mean reverting with bounded partial sums.
     */
    static double[] stationary(int n, long seed) {
        Random random = new Random(seed);
        double[] values = new double[n];
        double previous = random.nextGaussian();
        for (int t = 0; t < n; t++) {
            double current = random.nextGaussian();
            values[t] = current - previous;
            previous = current;
        }
        return values;
    }

    /**
     * y_t = 1.05 y_{t-1} + e_t starting from 50.
     */
    static double[] explosive(int n, long seed) {
        Random random = new Random(seed);
        double[] values = new double[n];
        values[0] = 50.;
        for (int t = 1; t < n; t++) {
            values[t] = 1.05 * values[t - 1] + random.nextGaussian();
        }
        return values;
    }

    static double[] randomWalk(int n, long seed) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int t = 1; t < n; t++) {
            values[t] = values[t - 1] + random.nextGaussian();
        }
        return values;
    }

    static double[] whiteNoise(int n, long seed) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int t = 0; t < n; t++) {
            values[t] = random.nextGaussian();
        }
        return values;
    }

    /**
     * t plus alternating ±0.5.
     */
    static double[] trendWithAlternation(int n) {
        double[] values = new double[n];
        for (int t = 0; t < n; t++) {
            values[t] = t + (t % 2 == 0 ? 0.5 : -0.5);
        }
        return values;
    }
}
