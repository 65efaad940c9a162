package org.tsdiag.stats;

import java.util.Objects;

/**
 * Critical values of a statistic at the 1%, 5% and 10% levels.
 */
public final class CriticalValues {
    private final double onePercent;
    private final double fivePercent;
    private final double tenPercent;

    public CriticalValues(double onePercent, double fivePercent, double tenPercent) {
        this.onePercent = onePercent;
        this.fivePercent = fivePercent;
        this.tenPercent = tenPercent;
    }

    public double getOnePercent() {
        return onePercent;
    }

    public double getFivePercent() {
        return fivePercent;
    }

    public double getTenPercent() {
        return tenPercent;
    }

    /**
     * Value for the closest tabulated level at or above {@code alpha}: 1% up to 0.01, 5% up to 0.05, 10% beyond.
     */
    public double forAlpha(double alpha) {
        SeriesValidation.requireAlpha(alpha);
        if (alpha <= 0.01) {
            return onePercent;
        } else if (alpha <= 0.05) {
            return fivePercent;
        }
        return tenPercent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CriticalValues that = (CriticalValues) o;
        return Double.compare(that.onePercent, onePercent) == 0
                && Double.compare(that.fivePercent, fivePercent) == 0
                && Double.compare(that.tenPercent, tenPercent) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(onePercent, fivePercent, tenPercent);
    }

    @Override
    public String toString() {
        return String.format("1%% = %.4f, 5%% = %.4f, 10%% = %.4f", onePercent, fivePercent, tenPercent);
    }
}
