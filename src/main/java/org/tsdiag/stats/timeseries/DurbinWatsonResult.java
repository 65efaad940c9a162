package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.SeriesValidation;

import java.util.Objects;

public final class DurbinWatsonResult {
    private final double statistic;
    private final double autocorrelation;
    private final int sampleSize;
    private final Alternative alternative;
    private final double pValue;

    DurbinWatsonResult(double statistic, double autocorrelation, int sampleSize, Alternative alternative, double pValue) {
        this.statistic = statistic;
        this.autocorrelation = autocorrelation;
        this.sampleSize = sampleSize;
        this.alternative = alternative;
        this.pValue = pValue;
    }

    public double getStatistic() {
        return statistic;
    }

    /**
     * First order autocorrelation estimate 1 - DW/2.
     */
    public double getAutocorrelation() {
        return autocorrelation;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public Alternative getAlternative() {
        return alternative;
    }

    public double getPValue() {
        return pValue;
    }

    /**
     * Rule-of-thumb reading of the statistic.
     */
    public String interpret() {
        if (statistic < 1.5) {
            return "Strong positive autocorrelation (DW < 1.5)";
        } else if (statistic < 1.8) {
            return "Moderate positive autocorrelation (1.5 ≤ DW < 1.8)";
        } else if (statistic <= 2.2) {
            return "No significant autocorrelation (1.8 ≤ DW ≤ 2.2)";
        } else if (statistic <= 2.5) {
            return "Moderate negative autocorrelation (2.2 < DW ≤ 2.5)";
        }
        return "Strong negative autocorrelation (DW > 2.5)";
    }

    public String interpret(double alpha) {
        SeriesValidation.requireAlpha(alpha);
        String numbers = String.format("(DW = %.4f, p = %.4f)", statistic, pValue);
        if (pValue < alpha) {
            return "Reject H0: residuals show " + describeAlternative() + " " + numbers;
        }
        return "Fail to reject H0: no evidence of " + describeAlternative() + " " + numbers;
    }

    private String describeAlternative() {
        switch (alternative) {
            case GREATER:
                return "positive autocorrelation";
            case LESS:
                return "negative autocorrelation";
            default:
                return "first order autocorrelation";
        }
    }

    public String evaluate() {
        String direction;
        if (autocorrelation > 0.3) {
            direction = "positive";
        } else if (autocorrelation < -0.3) {
            direction = "negative";
        } else {
            direction = "negligible";
        }
        return String.format("Durbin-Watson statistic: %.4f (ρ ≈ %.4f, %s autocorrelation)%n%s",
                statistic, autocorrelation, direction, interpret());
    }

    @Override
    public String toString() {
        return String.format("Durbin-Watson Test%n"
                        + "  Sample size: %d%n"
                        + "  Test statistic (DW): %.4f%n"
                        + "  Autocorrelation (ρ): %.4f%n"
                        + "  Alternative: %s%n"
                        + "  p-value: %.4f%n%n"
                        + "  %s%n"
                        + "  %s",
                sampleSize, statistic, autocorrelation, alternative, pValue, interpret(), interpret(0.05));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DurbinWatsonResult that = (DurbinWatsonResult) o;
        return Double.compare(that.statistic, statistic) == 0
                && Double.compare(that.autocorrelation, autocorrelation) == 0
                && sampleSize == that.sampleSize
                && Double.compare(that.pValue, pValue) == 0
                && alternative == that.alternative;
    }

    @Override
    public int hashCode() {
        return Objects.hash(statistic, autocorrelation, sampleSize, alternative, pValue);
    }
}
