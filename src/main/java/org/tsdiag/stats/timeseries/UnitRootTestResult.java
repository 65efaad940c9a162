package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.CriticalValues;
import org.tsdiag.stats.SeriesValidation;
import org.tsdiag.stats.Specification;

import java.util.Objects;

/**
 * Common shape of the Dickey-Fuller family: a t-ratio on the lagged level compared against left-tail critical values.
 * H0 is a unit root, rejected when the statistic falls below the critical value.
 */
public abstract class UnitRootTestResult {
    private final double statistic;
    private final double gamma;
    private final double standardError;
    private final int sampleSize;
    private final int lag;
    private final Specification specification;
    private final CriticalValues criticalValues;

    protected UnitRootTestResult(double statistic, double gamma, double standardError, int sampleSize, int lag,
                                 Specification specification, CriticalValues criticalValues) {
        this.statistic = statistic;
        this.gamma = gamma;
        this.standardError = standardError;
        this.sampleSize = sampleSize;
        this.lag = lag;
        this.specification = specification;
        this.criticalValues = criticalValues;
    }

    /**
     * Short label used in one-line interpretations, e.g. "DF".
     */
    protected abstract String statisticLabel();

    public abstract String getTestName();

    public double getStatistic() {
        return statistic;
    }

    /**
     * Estimated coefficient on the lagged level.
     */
    public double getGamma() {
        return gamma;
    }

    public double getStandardError() {
        return standardError;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getLag() {
        return lag;
    }

    /**
     * Observations entering the regression, n - lag - 1.
     */
    public int getEffectiveSampleSize() {
        return sampleSize - lag - 1;
    }

    public Specification getSpecification() {
        return specification;
    }

    public CriticalValues getCriticalValues() {
        return criticalValues;
    }

    public double getCriticalValue(double alpha) {
        return criticalValues.forAlpha(alpha);
    }

    public boolean rejectsUnitRoot(double alpha) {
        return statistic < getCriticalValue(alpha);
    }

    public String interpret() {
        return interpret(0.05);
    }

    public String interpret(double alpha) {
        SeriesValidation.requireAlpha(alpha);
        double cv = getCriticalValue(alpha);
        String numbers = String.format("(%s = %.4f, CV = %.4f)", statisticLabel(), statistic, cv);
        if (statistic < cv) {
            return "Reject H0: series appears stationary " + numbers;
        }
        return "Fail to reject H0: unit root likely present, series appears non-stationary " + numbers;
    }

    public String evaluate() {
        String conclusion = rejectsUnitRoot(0.05) ? "stationary" : "non-stationary (unit root present)";
        return String.format("%s:%n"
                        + "Test type: %s%n"
                        + "Lags: %d%n"
                        + "%s statistic: %.4f%n"
                        + "Critical values: %s%n"
                        + "Sample size: %d (effective %d)%n"
                        + "Conclusion: series appears %s at 5%% significance level",
                getTestName(), specification, lag, statisticLabel(), statistic, criticalValues,
                sampleSize, getEffectiveSampleSize(), conclusion);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getTestName()).append(String.format("%n"));
        sb.append(String.format("  Type: %s%n", specification));
        sb.append(String.format("  Sample size: %d%n", sampleSize));
        sb.append(String.format("  Lags: %d%n", lag));
        sb.append(String.format("  %s statistic: %.4f%n", statisticLabel(), statistic));
        sb.append(String.format("  γ coefficient: %.6f%n", gamma));
        sb.append(String.format("  Standard error: %.6f%n", standardError));
        sb.append(String.format("  Critical values:%n"));
        sb.append(String.format("    1%%: %.4f%n", criticalValues.getOnePercent()));
        sb.append(String.format("    5%%: %.4f%n", criticalValues.getFivePercent()));
        sb.append(String.format("   10%%: %.4f%n", criticalValues.getTenPercent()));
        sb.append(String.format("%n  %s", interpret()));
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnitRootTestResult that = (UnitRootTestResult) o;
        return Double.compare(that.statistic, statistic) == 0
                && Double.compare(that.gamma, gamma) == 0
                && Double.compare(that.standardError, standardError) == 0
                && sampleSize == that.sampleSize
                && lag == that.lag
                && specification == that.specification
                && criticalValues.equals(that.criticalValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statistic, gamma, standardError, sampleSize, lag, specification, criticalValues);
    }
}
