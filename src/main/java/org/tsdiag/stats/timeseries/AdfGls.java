package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.tsdiag.stats.CriticalValues;
import org.tsdiag.stats.DesignMatrix;
import org.tsdiag.stats.OrdinaryLeastSquares;
import org.tsdiag.stats.RegressionFit;
import org.tsdiag.stats.SeriesValidation;
import org.tsdiag.stats.Specification;

/**
 * Elliott-Rothenberg-Stock DF-GLS test.
 *
 * The deterministic terms are estimated by GLS on quasi-differenced data with ᾱ = 1 + c̄/n
 * (c̄ = -7 with an intercept, -13.5 with intercept and trend) and removed from the series. The detrended
 * series then goes through the augmented Dickey-Fuller regression without deterministic terms.
 * With {@link Specification#NONE} the raw series is used.
 * <p>
 * Critical values come from the ERS table for {@link Specification#TREND} and from the Dickey-Fuller table without
 * deterministic terms otherwise. They are therefore less negative than the plain ADF values for the same
 * specification: the detrended regression carries no deterministic terms.
 */
@Slf4j
public class AdfGls {
    public static final int MIN_OBSERVATIONS = 15;
    public static final double C_BAR_DRIFT = -7.0;
    public static final double C_BAR_TREND = -13.5;

    private AdfGls() {
    }

    public static AdfGlsResult test(double[] data) {
        return test(data, AdfOptions.defaults());
    }

    public static AdfGlsResult test(double[] data, Integer lag, String type) {
        return test(data, AdfOptions.of(type, lag));
    }

    public static AdfGlsResult test(double[] data, AdfOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        SeriesValidation.requireSeries(data, "data", MIN_OBSERVATIONS);
        Specification specification = options.getSpecification();
        int n = data.length;
        int lag = AdfRegression.resolveLag(n, options.getLag(), Specification.NONE);

        double alphaBar = alphaBar(specification, n);
        double[] detrended = specification == Specification.NONE ? data.clone() : glsDetrend(data, specification, alphaBar);
        AdfRegression regression = AdfRegression.run(detrended, lag, Specification.NONE);
        double statistic = regression.statistic();
        CriticalValues criticalValues = UnitRootTables.glsDetrended(specification).lookup(n - lag - 1);
        log.debug("adf-gls ({}, lag {}) on {} observations: statistic {}", specification, lag, n, statistic);
        return new AdfGlsResult(statistic, regression.gamma(), regression.standardError(), n, lag, alphaBar,
                specification, criticalValues);
    }

    static double alphaBar(Specification specification, int n) {
        switch (specification) {
            case DRIFT:
                return 1 + C_BAR_DRIFT / n;
            case TREND:
                return 1 + C_BAR_TREND / n;
            default:
                return 1.;
        }
    }

    /**
     * y - zβ where β is the OLS fit of the quasi-differenced series on the quasi-differenced deterministic terms.
     */
    static double[] glsDetrend(double[] data, Specification specification, double alphaBar) {
        int n = data.length;
        double[][] z = new DesignMatrix(n).deterministic(specification).build();
        int terms = z[0].length;
        double[][] zQuasi = new double[n][terms];
        for (int t = 0; t < n; t++) {
            for (int j = 0; j < terms; j++) {
                zQuasi[t][j] = t == 0 ? z[t][j] : z[t][j] - alphaBar * z[t - 1][j];
            }
        }
        RegressionFit fit = OrdinaryLeastSquares.fit(quasiDifference(data, alphaBar), zQuasi);
        double[] beta = fit.getCoefficients();
        double[] detrended = new double[n];
        for (int t = 0; t < n; t++) {
            double trend = 0;
            for (int j = 0; j < terms; j++) {
                trend += z[t][j] * beta[j];
            }
            detrended[t] = data[t] - trend;
        }
        return detrended;
    }

    static double[] quasiDifference(double[] values, double alphaBar) {
        double[] output = new double[values.length];
        output[0] = values[0];
        for (int t = 1; t < values.length; t++) {
            output[t] = values[t] - alphaBar * values[t - 1];
        }
        return output;
    }
}
