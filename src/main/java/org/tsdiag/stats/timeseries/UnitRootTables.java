package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.CriticalValueTable;
import org.tsdiag.stats.Specification;

import static org.tsdiag.stats.CriticalValueTable.ASYMPTOTIC;

/**
 * Dickey-Fuller and Elliott-Rothenberg-Stock critical values (Fuller 1976, MacKinnon 1996, ERS 1996 table 1).
 */
final class UnitRootTables {

    private static final double[] DF_SIZES = {25, 50, 100, 250, 500, ASYMPTOTIC};

    static final CriticalValueTable DF_NONE = new CriticalValueTable(DF_SIZES, new double[][]{
            {-2.66, -1.95, -1.60},
            {-2.62, -1.95, -1.61},
            {-2.60, -1.95, -1.61},
            {-2.58, -1.95, -1.62},
            {-2.58, -1.95, -1.62},
            {-2.58, -1.95, -1.62},
    });

    static final CriticalValueTable DF_DRIFT = new CriticalValueTable(DF_SIZES, new double[][]{
            {-3.75, -3.00, -2.63},
            {-3.58, -2.93, -2.60},
            {-3.51, -2.89, -2.58},
            {-3.46, -2.88, -2.57},
            {-3.44, -2.87, -2.57},
            {-3.43, -2.86, -2.57},
    });

    static final CriticalValueTable DF_TREND = new CriticalValueTable(DF_SIZES, new double[][]{
            {-4.38, -3.60, -3.24},
            {-4.15, -3.50, -3.18},
            {-4.04, -3.45, -3.15},
            {-3.99, -3.43, -3.13},
            {-3.98, -3.42, -3.13},
            {-3.96, -3.41, -3.12},
    });

    // GLS detrended with linear trend
    static final CriticalValueTable ERS_TREND = new CriticalValueTable(new double[]{50, 100, 200, ASYMPTOTIC}, new double[][]{
            {-3.77, -3.19, -2.89},
            {-3.58, -3.03, -2.74},
            {-3.46, -2.93, -2.64},
            {-3.48, -2.89, -2.57},
    });

    private UnitRootTables() {
    }

    static CriticalValueTable dickeyFuller(Specification specification) {
        switch (specification) {
            case NONE:
                return DF_NONE;
            case DRIFT:
                return DF_DRIFT;
            default:
                return DF_TREND;
        }
    }

    /**
     * After GLS demeaning the ADF regression carries no deterministic terms, so only the trend case needs its own table.
     */
    static CriticalValueTable glsDetrended(Specification specification) {
        return specification == Specification.TREND ? ERS_TREND : DF_NONE;
    }
}
