package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.SeriesValidation;

import java.util.Objects;

/**
 * H0: the regression coefficients are equal on both sides of the break point.
 */
public final class ChowResult {
    private final double statistic;
    private final double pValue;
    private final int df1;
    private final int df2;
    private final int breakPoint;
    private final double rssFull;
    private final double rss1;
    private final double rss2;
    private final int sampleSize;
    private final int numParameters;

    ChowResult(double statistic, double pValue, int df1, int df2, int breakPoint, double rssFull, double rss1,
               double rss2, int sampleSize, int numParameters) {
        this.statistic = statistic;
        this.pValue = pValue;
        this.df1 = df1;
        this.df2 = df2;
        this.breakPoint = breakPoint;
        this.rssFull = rssFull;
        this.rss1 = rss1;
        this.rss2 = rss2;
        this.sampleSize = sampleSize;
        this.numParameters = numParameters;
    }

    public double getStatistic() {
        return statistic;
    }

    public double getPValue() {
        return pValue;
    }

    public int getDf1() {
        return df1;
    }

    public int getDf2() {
        return df2;
    }

    public int getBreakPoint() {
        return breakPoint;
    }

    public double getRssFull() {
        return rssFull;
    }

    public double getRss1() {
        return rss1;
    }

    public double getRss2() {
        return rss2;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getNumParameters() {
        return numParameters;
    }

    public String interpret() {
        return interpret(0.05);
    }

    public String interpret(double alpha) {
        SeriesValidation.requireAlpha(alpha);
        String numbers = String.format("(F = %.4f, p = %.4f)", statistic, pValue);
        if (pValue < alpha) {
            return "Reject H0: structural break detected at observation " + breakPoint + " " + numbers;
        }
        return "Fail to reject H0: no evidence of structural break at observation " + breakPoint + " " + numbers;
    }

    public String evaluate() {
        String conclusion = pValue < 0.05 ? "structural break present" : "no structural break detected";
        return String.format("Chow test:%n"
                        + "Break point: %d%n"
                        + "F-statistic: %.4f%n"
                        + "p-value: %.4f%n"
                        + "Degrees of freedom: (%d, %d)%n"
                        + "RSS full model: %.4f%n"
                        + "RSS sub-models: %.4f + %.4f = %.4f%n"
                        + "Sample size: %d%n"
                        + "Number of parameters: %d%n"
                        + "Conclusion: %s at 5%% significance level",
                breakPoint, statistic, pValue, df1, df2, rssFull, rss1, rss2, rss1 + rss2, sampleSize, numParameters,
                conclusion);
    }

    @Override
    public String toString() {
        return String.format("Chow Test for Structural Break%n"
                        + "  Break point: %d%n"
                        + "  Sample size: %d%n"
                        + "  Parameters: %d%n"
                        + "  F-statistic: %.4f%n"
                        + "  p-value: %.4f%n"
                        + "  Degrees of freedom: (%d, %d)%n%n"
                        + "  %s",
                breakPoint, sampleSize, numParameters, statistic, pValue, df1, df2, interpret());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChowResult that = (ChowResult) o;
        return df1 == that.df1
                && df2 == that.df2
                && breakPoint == that.breakPoint
                && sampleSize == that.sampleSize
                && numParameters == that.numParameters
                && Double.compare(that.statistic, statistic) == 0
                && Double.compare(that.pValue, pValue) == 0
                && Double.compare(that.rssFull, rssFull) == 0
                && Double.compare(that.rss1, rss1) == 0
                && Double.compare(that.rss2, rss2) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(statistic, pValue, df1, df2, breakPoint, rssFull, rss1, rss2, sampleSize, numParameters);
    }
}
