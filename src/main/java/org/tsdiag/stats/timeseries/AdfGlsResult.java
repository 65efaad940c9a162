package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.CriticalValues;
import org.tsdiag.stats.Specification;

public final class AdfGlsResult extends UnitRootTestResult {
    private final double alphaBar;

    AdfGlsResult(double statistic, double gamma, double standardError, int sampleSize, int lag, double alphaBar,
                 Specification specification, CriticalValues criticalValues) {
        super(statistic, gamma, standardError, sampleSize, lag, specification, criticalValues);
        this.alphaBar = alphaBar;
    }

    /**
     * Quasi-differencing parameter 1 + c/n used for the GLS detrending, 1 when no detrending took place.
     */
    public double getAlphaBar() {
        return alphaBar;
    }

    @Override
    protected String statisticLabel() {
        return "ADF-GLS";
    }

    @Override
    public String getTestName() {
        return "ADF-GLS Test (Elliott-Rothenberg-Stock)";
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Double.compare(alphaBar, ((AdfGlsResult) o).alphaBar) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Double.hashCode(alphaBar);
    }
}
