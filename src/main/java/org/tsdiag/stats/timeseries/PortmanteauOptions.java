package org.tsdiag.stats.timeseries;

import java.util.Objects;

/**
 * Lag count and fitted-parameter correction of a portmanteau test. A {@code null} lag count means min(10, n/5).
 */
public final class PortmanteauOptions {
    private final Integer lags;
    private final int fitdf;

    private PortmanteauOptions(Integer lags, int fitdf) {
        if (lags != null && lags < 1) {
            throw new IllegalArgumentException("lags must be positive (got " + lags + ")");
        }
        if (fitdf < 0) {
            throw new IllegalArgumentException("fitdf must be non-negative (got " + fitdf + ")");
        }
        if (lags != null && fitdf >= lags) {
            throw new IllegalArgumentException("fitdf (" + fitdf + ") must be less than lags (" + lags + ")");
        }
        this.lags = lags;
        this.fitdf = fitdf;
    }

    public static PortmanteauOptions defaults() {
        return new PortmanteauOptions(null, 0);
    }

    public static PortmanteauOptions of(Integer lags, int fitdf) {
        return new PortmanteauOptions(lags, fitdf);
    }

    public Integer getLags() {
        return lags;
    }

    /**
     * Number of parameters of the model that produced the residuals, subtracted from the degrees of freedom.
     */
    public int getFitdf() {
        return fitdf;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PortmanteauOptions that = (PortmanteauOptions) o;
        return fitdf == that.fitdf && Objects.equals(lags, that.lags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lags, fitdf);
    }

    @Override
    public String toString() {
        return "PortmanteauOptions{lags=" + (lags == null ? "auto" : lags) + ", fitdf=" + fitdf + '}';
    }
}
