package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.tsdiag.stats.SeriesValidation;

/**
 * Durbin-Watson test for first order autocorrelation in regression residuals.
 *
 * DW = Σ(e_t - e_{t-1})² / Σe_t², between 0 and 4, about 2 when the residuals are uncorrelated.
 * The p-value uses the large-sample approximation √n ρ̂ ~ N(0, 1) with ρ̂ = 1 - DW/2.
 */
@Slf4j
public class DurbinWatson {
    public static final int MIN_OBSERVATIONS = 3;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    private DurbinWatson() {
    }

    public static DurbinWatsonResult test(double[] residuals) {
        return test(residuals, Alternative.TWO_SIDED);
    }

    public static DurbinWatsonResult test(double[] residuals, String alternative) {
        return test(residuals, Alternative.parse(alternative));
    }

    public static DurbinWatsonResult test(double[] residuals, Alternative alternative) {
        if (alternative == null) {
            throw new IllegalArgumentException("alternative cannot be null");
        }
        SeriesValidation.requireSeries(residuals, "residuals", MIN_OBSERVATIONS);
        int n = residuals.length;

        double numerator = 0;
        for (int t = 1; t < n; t++) {
            double diff = residuals[t] - residuals[t - 1];
            numerator += diff * diff;
        }
        double denominator = 0;
        for (double residual : residuals) {
            denominator += residual * residual;
        }
        double statistic = numerator / denominator;
        double autocorrelation = 1 - statistic / 2;
        double pValue = pValue(autocorrelation, n, alternative);
        log.debug("durbin-watson on {} residuals: statistic {}, rho {}", n, statistic, autocorrelation);
        return new DurbinWatsonResult(statistic, autocorrelation, n, alternative, pValue);
    }

    static double pValue(double autocorrelation, int n, Alternative alternative) {
        double z = Math.sqrt(n) * autocorrelation;
        double lower = STANDARD_NORMAL.cumulativeProbability(z);
        switch (alternative) {
            case GREATER:
                return 1 - lower;
            case LESS:
                return lower;
            default:
                return Math.min(1, 2 * Math.min(lower, 1 - lower));
        }
    }
}
