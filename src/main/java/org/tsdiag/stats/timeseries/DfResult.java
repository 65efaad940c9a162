package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.CriticalValues;
import org.tsdiag.stats.Specification;

public final class DfResult extends UnitRootTestResult {

    DfResult(double statistic, double gamma, double standardError, int sampleSize,
             Specification specification, CriticalValues criticalValues) {
        super(statistic, gamma, standardError, sampleSize, 0, specification, criticalValues);
    }

    @Override
    protected String statisticLabel() {
        return "DF";
    }

    @Override
    public String getTestName() {
        return "Dickey-Fuller Test";
    }
}
