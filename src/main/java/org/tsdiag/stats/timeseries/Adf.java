package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.tsdiag.stats.CriticalValues;
import org.tsdiag.stats.SeriesValidation;
import org.tsdiag.stats.Specification;

/**
 * Augmented Dickey-Fuller test: the Dickey-Fuller regression extended with lagged differences
 * Δy_{t-1} ... Δy_{t-p} to absorb serial correlation in the errors.
 *
 * When no lag is given it is chosen as min(10, floor((n - 1)^(1/3))), reduced if needed to keep a residual
 * degree of freedom. Explicit lags must lie in [0, n/3].
 */
@Slf4j
public class Adf {
    public static final int MIN_OBSERVATIONS = 10;

    private Adf() {
    }

    public static AdfResult test(double[] data) {
        return test(data, AdfOptions.defaults());
    }

    public static AdfResult test(double[] data, Integer lag, String type) {
        return test(data, AdfOptions.of(type, lag));
    }

    public static AdfResult test(double[] data, Integer lag, Specification specification) {
        return test(data, AdfOptions.of(specification, lag));
    }

    public static AdfResult test(double[] data, AdfOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        SeriesValidation.requireSeries(data, "data", MIN_OBSERVATIONS);
        Specification specification = options.getSpecification();
        int n = data.length;
        int lag = AdfRegression.resolveLag(n, options.getLag(), specification);

        AdfRegression regression = AdfRegression.run(data, lag, specification);
        double statistic = regression.statistic();
        CriticalValues criticalValues = UnitRootTables.dickeyFuller(specification).lookup(n - lag - 1);
        log.debug("adf ({}, lag {}) on {} observations: statistic {}", specification, lag, n, statistic);
        return new AdfResult(statistic, regression.gamma(), regression.standardError(), n, lag, options.isAutoLag(),
                specification, criticalValues);
    }
}
