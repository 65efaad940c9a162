package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.SeriesValidation;

import java.util.Objects;

/**
 * H0: x does not Granger-cause y.
 */
public final class GrangerResult {
    private final double statistic;
    private final double pValue;
    private final int lags;
    private final int df1;
    private final int df2;
    private final double rssRestricted;
    private final double rssUnrestricted;
    private final int sampleSize;
    private final int effectiveSampleSize;

    GrangerResult(double statistic, double pValue, int lags, int df1, int df2, double rssRestricted,
                  double rssUnrestricted, int sampleSize, int effectiveSampleSize) {
        this.statistic = statistic;
        this.pValue = pValue;
        this.lags = lags;
        this.df1 = df1;
        this.df2 = df2;
        this.rssRestricted = rssRestricted;
        this.rssUnrestricted = rssUnrestricted;
        this.sampleSize = sampleSize;
        this.effectiveSampleSize = effectiveSampleSize;
    }

    public double getStatistic() {
        return statistic;
    }

    public double getPValue() {
        return pValue;
    }

    public int getLags() {
        return lags;
    }

    public int getDf1() {
        return df1;
    }

    public int getDf2() {
        return df2;
    }

    public double getRssRestricted() {
        return rssRestricted;
    }

    public double getRssUnrestricted() {
        return rssUnrestricted;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getEffectiveSampleSize() {
        return effectiveSampleSize;
    }

    public boolean causes(double alpha) {
        SeriesValidation.requireAlpha(alpha);
        return pValue < alpha;
    }

    public String interpret() {
        return interpret(0.05);
    }

    public String interpret(double alpha) {
        String numbers = String.format("(F = %.4f, p = %.4f)", statistic, pValue);
        if (causes(alpha)) {
            return "Reject H0: x Granger-causes y " + numbers;
        }
        return "Fail to reject H0: no evidence that x Granger-causes y " + numbers;
    }

    public String evaluate() {
        String conclusion = pValue < 0.05 ? "x Granger-causes y" : "no Granger causality detected";
        return String.format("Granger causality test:%n"
                        + "Lags: %d%n"
                        + "F-statistic: %.4f%n"
                        + "p-value: %.4f%n"
                        + "Degrees of freedom: (%d, %d)%n"
                        + "RSS restricted: %.4f%n"
                        + "RSS unrestricted: %.4f%n"
                        + "Sample size: %d (effective %d)%n"
                        + "Conclusion: %s at 5%% significance level",
                lags, statistic, pValue, df1, df2, rssRestricted, rssUnrestricted, sampleSize, effectiveSampleSize,
                conclusion);
    }

    @Override
    public String toString() {
        return String.format("Granger Causality Test%n"
                        + "  Lags: %d%n"
                        + "  Sample size: %d%n"
                        + "  Effective sample size: %d%n"
                        + "  F-statistic: %.4f%n"
                        + "  p-value: %.4f%n"
                        + "  Degrees of freedom: (%d, %d)%n%n"
                        + "  %s",
                lags, sampleSize, effectiveSampleSize, statistic, pValue, df1, df2, interpret());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GrangerResult that = (GrangerResult) o;
        return lags == that.lags
                && df1 == that.df1
                && df2 == that.df2
                && sampleSize == that.sampleSize
                && effectiveSampleSize == that.effectiveSampleSize
                && Double.compare(that.statistic, statistic) == 0
                && Double.compare(that.pValue, pValue) == 0
                && Double.compare(that.rssRestricted, rssRestricted) == 0
                && Double.compare(that.rssUnrestricted, rssUnrestricted) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(statistic, pValue, lags, df1, df2, rssRestricted, rssUnrestricted, sampleSize, effectiveSampleSize);
    }
}
