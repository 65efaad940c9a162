package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.SeriesValidation;

import java.util.Objects;

/**
 * H0: the sequence is i.i.d. Too few turning points suggest a trend, too many an oscillation.
 */
public final class TurningPointResult {
    private final int sampleSize;
    private final int turningPoints;
    private final int peaks;
    private final int troughs;
    private final double expectedTurningPoints;
    private final double variance;
    private final double statistic;
    private final double pValue;

    TurningPointResult(int sampleSize, int turningPoints, int peaks, int troughs, double expectedTurningPoints,
                       double variance, double statistic, double pValue) {
        this.sampleSize = sampleSize;
        this.turningPoints = turningPoints;
        this.peaks = peaks;
        this.troughs = troughs;
        this.expectedTurningPoints = expectedTurningPoints;
        this.variance = variance;
        this.statistic = statistic;
        this.pValue = pValue;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getPossibleTurningPoints() {
        return sampleSize - 2;
    }

    public int getTurningPoints() {
        return turningPoints;
    }

    public int getPeaks() {
        return peaks;
    }

    public int getTroughs() {
        return troughs;
    }

    public double getExpectedTurningPoints() {
        return expectedTurningPoints;
    }

    public double getVariance() {
        return variance;
    }

    /**
     * Standardised count (T - E[T]) / sqrt(Var[T]).
     */
    public double getStatistic() {
        return statistic;
    }

    public double getPValue() {
        return pValue;
    }

    public String interpret() {
        return interpret(0.05);
    }

    public String interpret(double alpha) {
        SeriesValidation.requireAlpha(alpha);
        String numbers = String.format("(Z = %.4f, p = %.4f)", statistic, pValue);
        if (pValue >= alpha) {
            return "Fail to reject H0: series appears random " + numbers;
        }
        if (statistic < 0) {
            return "Reject H0: too few turning points, series suggests a trend " + numbers;
        }
        return "Reject H0: too many turning points, series suggests rapid oscillation " + numbers;
    }

    public String evaluate() {
        String conclusion = pValue < 0.05 ? "non-random" : "random";
        return String.format("Turning Point test:%n"
                        + "Sample size: %d%n"
                        + "Turning points: %d (peaks %d, troughs %d) of %d possible%n"
                        + "Expected: %.4f, variance: %.4f%n"
                        + "Z-statistic: %.4f%n"
                        + "p-value: %.4f%n"
                        + "Conclusion: series appears %s at 5%% significance level",
                sampleSize, turningPoints, peaks, troughs, getPossibleTurningPoints(), expectedTurningPoints, variance,
                statistic, pValue, conclusion);
    }

    @Override
    public String toString() {
        return String.format("Turning Point Test for Randomness%n"
                        + "  Sample size: %d%n"
                        + "  Turning points: %d (peaks: %d, troughs: %d)%n"
                        + "  Expected: %.4f%n"
                        + "  Variance: %.4f%n"
                        + "  Z-statistic: %.4f%n"
                        + "  p-value: %.4f%n%n"
                        + "  %s",
                sampleSize, turningPoints, peaks, troughs, expectedTurningPoints, variance, statistic, pValue, interpret());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TurningPointResult that = (TurningPointResult) o;
        return sampleSize == that.sampleSize
                && turningPoints == that.turningPoints
                && peaks == that.peaks
                && troughs == that.troughs
                && Double.compare(that.expectedTurningPoints, expectedTurningPoints) == 0
                && Double.compare(that.variance, variance) == 0
                && Double.compare(that.statistic, statistic) == 0
                && Double.compare(that.pValue, pValue) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sampleSize, turningPoints, peaks, troughs, expectedTurningPoints, variance, statistic, pValue);
    }
}
