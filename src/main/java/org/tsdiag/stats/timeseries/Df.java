package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.tsdiag.stats.CriticalValues;
import org.tsdiag.stats.SeriesValidation;
import org.tsdiag.stats.Specification;

/**
 * Dickey-Fuller unit-root test without augmentation.
 *
 * Regresses Δy_t on y_{t-1} plus the deterministic terms of the specification and reports the t-ratio of the
 * lagged-level coefficient. H0: unit root (γ = 0), H1: stationary (γ &lt; 0).
 */
@Slf4j
public class Df {
    public static final int MIN_OBSERVATIONS = 10;

    private Df() {
    }

    public static DfResult test(double[] data) {
        return test(data, Specification.DRIFT);
    }

    public static DfResult test(double[] data, String type) {
        return test(data, Specification.parse(type));
    }

    public static DfResult test(double[] data, Specification specification) {
        if (specification == null) {
            throw new IllegalArgumentException("specification cannot be null");
        }
        SeriesValidation.requireSeries(data, "data", MIN_OBSERVATIONS);

        AdfRegression regression = AdfRegression.run(data, 0, specification);
        double statistic = regression.statistic();
        CriticalValues criticalValues = UnitRootTables.dickeyFuller(specification).lookup(data.length - 1);
        log.debug("dickey-fuller ({}) on {} observations: statistic {}", specification, data.length, statistic);
        return new DfResult(statistic, regression.gamma(), regression.standardError(), data.length, specification, criticalValues);
    }
}
