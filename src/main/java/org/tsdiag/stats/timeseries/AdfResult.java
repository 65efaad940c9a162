package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.CriticalValues;
import org.tsdiag.stats.Specification;

public final class AdfResult extends UnitRootTestResult {
    private final boolean autoLag;

    AdfResult(double statistic, double gamma, double standardError, int sampleSize, int lag, boolean autoLag,
              Specification specification, CriticalValues criticalValues) {
        super(statistic, gamma, standardError, sampleSize, lag, specification, criticalValues);
        this.autoLag = autoLag;
    }

    /**
     * Whether the lag was selected automatically rather than supplied.
     */
    public boolean isAutoLag() {
        return autoLag;
    }

    @Override
    protected String statisticLabel() {
        return "ADF";
    }

    @Override
    public String getTestName() {
        return "Augmented Dickey-Fuller Test";
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && autoLag == ((AdfResult) o).autoLag;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + (autoLag ? 1 : 0);
    }
}
