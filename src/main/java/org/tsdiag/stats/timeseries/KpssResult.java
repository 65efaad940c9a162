package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.SeriesValidation;

import java.util.Arrays;
import java.util.Objects;

/**
 * KPSS outcome. H0 is stationarity, rejected when the statistic exceeds the critical value (right tail).
 */
public final class KpssResult {
    private final double statistic;
    private final KpssType type;
    private final int lags;
    private final int sampleSize;
    private final double longRunVariance;
    private final double pValue;
    private final double[] criticalValues;

    KpssResult(double statistic, KpssType type, int lags, int sampleSize, double longRunVariance, double pValue,
               double[] criticalValues) {
        this.statistic = statistic;
        this.type = type;
        this.lags = lags;
        this.sampleSize = sampleSize;
        this.longRunVariance = longRunVariance;
        this.pValue = pValue;
        this.criticalValues = criticalValues.clone();
    }

    public double getStatistic() {
        return statistic;
    }

    public KpssType getType() {
        return type;
    }

    /**
     * Bartlett window truncation lag of the long-run variance.
     */
    public int getLags() {
        return lags;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public double getLongRunVariance() {
        return longRunVariance;
    }

    /**
     * Interpolated from the critical value table, so bounded to [0.01, 0.10].
     */
    public double getPValue() {
        return pValue;
    }

    /**
     * Critical values at the 10%, 5%, 2.5% and 1% levels.
     */
    public double[] getCriticalValues() {
        return criticalValues.clone();
    }

    /**
     * The 5% critical value.
     */
    public double getCriticalValue() {
        return criticalValues[1];
    }

    public double getCriticalValue(double alpha) {
        SeriesValidation.requireAlpha(alpha);
        if (alpha <= 0.01) {
            return criticalValues[3];
        } else if (alpha <= 0.025) {
            return criticalValues[2];
        } else if (alpha <= 0.05) {
            return criticalValues[1];
        }
        return criticalValues[0];
    }

    public boolean rejectsStationarity(double alpha) {
        return statistic > getCriticalValue(alpha);
    }

    public String interpret() {
        return interpret(0.05);
    }

    public String interpret(double alpha) {
        double cv = getCriticalValue(alpha);
        String numbers = String.format("(KPSS = %.4f, CV = %.4f, p = %.4f)", statistic, cv, pValue);
        if (statistic > cv) {
            return "Reject H0: series is not " + type + " stationary " + numbers;
        }
        return "Fail to reject H0: series appears " + type + " stationary " + numbers;
    }

    public String evaluate() {
        String conclusion = rejectsStationarity(0.05) ? "non-stationary (unit root likely)" : type + " stationary";
        return String.format("KPSS test (%s):%n"
                        + "KPSS statistic: %.4f%n"
                        + "p-value: %.4f%n"
                        + "Critical values: 10%% = %.3f, 5%% = %.3f, 2.5%% = %.3f, 1%% = %.3f%n"
                        + "Truncation lag: %d%n"
                        + "Conclusion: series appears %s at 5%% significance level",
                type, statistic, pValue, criticalValues[0], criticalValues[1], criticalValues[2], criticalValues[3],
                lags, conclusion);
    }

    @Override
    public String toString() {
        return String.format("KPSS Stationarity Test%n"
                        + "  Type: %s%n"
                        + "  Sample size: %d%n"
                        + "  Truncation lag: %d%n"
                        + "  KPSS statistic: %.4f%n"
                        + "  p-value: %.4f%n"
                        + "  Critical value (5%%): %.3f%n%n"
                        + "  %s",
                type, sampleSize, lags, statistic, pValue, getCriticalValue(), interpret());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KpssResult that = (KpssResult) o;
        return Double.compare(that.statistic, statistic) == 0
                && lags == that.lags
                && sampleSize == that.sampleSize
                && Double.compare(that.longRunVariance, longRunVariance) == 0
                && Double.compare(that.pValue, pValue) == 0
                && type == that.type
                && Arrays.equals(criticalValues, that.criticalValues);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(statistic, type, lags, sampleSize, longRunVariance, pValue);
        return 31 * result + Arrays.hashCode(criticalValues);
    }
}
