package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.SeriesValidation;

import java.util.Arrays;
import java.util.Objects;

/**
 * H0: no autocorrelation up to the tested lag.
 */
public final class PortmanteauResult {
    private final Portmanteau.Method method;
    private final double statistic;
    private final double pValue;
    private final int lags;
    private final int fitdf;
    private final int sampleSize;
    private final double[] autocorrelations;

    PortmanteauResult(Portmanteau.Method method, double statistic, double pValue, int lags, int fitdf, int sampleSize,
                      double[] autocorrelations) {
        this.method = method;
        this.statistic = statistic;
        this.pValue = pValue;
        this.lags = lags;
        this.fitdf = fitdf;
        this.sampleSize = sampleSize;
        this.autocorrelations = autocorrelations.clone();
    }

    public Portmanteau.Method getMethod() {
        return method;
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

    public int getFitdf() {
        return fitdf;
    }

    public int getDegreesOfFreedom() {
        return lags - fitdf;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    /**
     * ρ̂_1 ... ρ̂_h, index 0 holds lag 1.
     */
    public double[] getAutocorrelations() {
        return autocorrelations.clone();
    }

    public double getAutocorrelation(int lag) {
        if (lag < 1 || lag > lags) {
            throw new IllegalArgumentException("lag must be between 1 and " + lags + " (got " + lag + ")");
        }
        return autocorrelations[lag - 1];
    }

    public String interpret() {
        return interpret(0.05);
    }

    public String interpret(double alpha) {
        SeriesValidation.requireAlpha(alpha);
        String numbers = String.format("(Q = %.4f, df = %d, p = %.4f)", statistic, getDegreesOfFreedom(), pValue);
        if (pValue < alpha) {
            return "Reject H0: significant autocorrelation up to lag " + lags + " " + numbers;
        }
        return "Fail to reject H0: no significant autocorrelation up to lag " + lags + " " + numbers;
    }

    public String evaluate() {
        String conclusion = pValue < 0.05 ? "autocorrelated" : "consistent with white noise";
        return String.format("%s test:%n"
                        + "Q statistic: %.4f%n"
                        + "Degrees of freedom: %d%n"
                        + "p-value: %.4f%n"
                        + "Conclusion: residuals appear %s at 5%% significance level",
                method, statistic, getDegreesOfFreedom(), pValue, conclusion);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s Test for Autocorrelation%n", method));
        sb.append(String.format("  Sample size: %d%n", sampleSize));
        sb.append(String.format("  Lags tested: %d%n", lags));
        sb.append(String.format("  Fitted parameters: %d%n", fitdf));
        sb.append(String.format("  Q statistic: %.4f%n", statistic));
        sb.append(String.format("  Degrees of freedom: %d%n", getDegreesOfFreedom()));
        sb.append(String.format("  p-value: %.4f%n", pValue));
        sb.append(String.format("  Autocorrelations:%n"));
        for (int k = 1; k <= lags; k++) {
            sb.append(String.format("    Lag %2d: %8.4f%n", k, autocorrelations[k - 1]));
        }
        sb.append(String.format("%n  %s", interpret()));
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PortmanteauResult that = (PortmanteauResult) o;
        return Double.compare(that.statistic, statistic) == 0
                && Double.compare(that.pValue, pValue) == 0
                && lags == that.lags
                && fitdf == that.fitdf
                && sampleSize == that.sampleSize
                && method == that.method
                && Arrays.equals(autocorrelations, that.autocorrelations);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(method, statistic, pValue, lags, fitdf, sampleSize);
        return 31 * result + Arrays.hashCode(autocorrelations);
    }
}
