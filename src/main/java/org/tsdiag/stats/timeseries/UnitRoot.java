package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.tsdiag.stats.NumericColumnSource;
import org.tsdiag.stats.SeriesValidation;
import org.tsdiag.stats.Specification;

/**
 * Runs Dickey-Fuller, augmented Dickey-Fuller, ADF-GLS and KPSS on one series.
 *
 * The first three have a unit root as null hypothesis, KPSS has stationarity; the result weighs both sides.
 */
@Slf4j
public class UnitRoot {
    public static final int MIN_OBSERVATIONS = AdfGls.MIN_OBSERVATIONS;

    private UnitRoot() {
    }

    public static UnitRootResult test(double[] data) {
        return test(data, AdfOptions.DEFAULT_SPECIFICATION, null);
    }

    public static UnitRootResult test(double[] data, String type, Integer lag) {
        return test(data, Specification.parse(type), lag);
    }

    public static UnitRootResult test(NumericColumnSource source, String column, String type, Integer lag) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return test(source.column(column), type, lag);
    }

    /**
     * @param lag lagged differences of the ADF regressions, {@code null} for automatic selection
     */
    public static UnitRootResult test(double[] data, Specification specification, Integer lag) {
        if (specification == null) {
            throw new IllegalArgumentException("specification cannot be null");
        }
        SeriesValidation.requireSeries(data, "data", MIN_OBSERVATIONS);
        AdfOptions options = AdfOptions.of(specification, lag);
        DfResult df = Df.test(data, specification);
        AdfResult adf = Adf.test(data, options);
        AdfGlsResult adfGls = AdfGls.test(data, options);
        KpssResult kpss = Kpss.test(data, KpssType.of(specification), null);
        UnitRootResult result = new UnitRootResult(df, adf, adfGls, kpss, data.length, specification);
        log.debug("unit root battery ({}) on {} observations: {}", specification, data.length, result.verdict(0.05));
        return result;
    }
}
