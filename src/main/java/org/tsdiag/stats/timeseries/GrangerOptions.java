package org.tsdiag.stats.timeseries;

import java.util.Objects;

/**
 * Lag order of a Granger test. A {@code null} lag is chosen from the sample size.
 */
public final class GrangerOptions {
    private final Integer lag;

    private GrangerOptions(Integer lag) {
        if (lag != null && lag < 1) {
            throw new IllegalArgumentException("lag must be at least 1 (got " + lag + ")");
        }
        this.lag = lag;
    }

    public static GrangerOptions defaults() {
        return new GrangerOptions(null);
    }

    public static GrangerOptions of(Integer lag) {
        return new GrangerOptions(lag);
    }

    public Integer getLag() {
        return lag;
    }

    public boolean isAutoLag() {
        return lag == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GrangerOptions that = (GrangerOptions) o;
        return Objects.equals(lag, that.lag);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(lag);
    }

    @Override
    public String toString() {
        return "GrangerOptions{lag=" + (lag == null ? "auto" : lag) + '}';
    }
}
