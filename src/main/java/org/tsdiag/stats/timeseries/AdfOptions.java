package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.Specification;

import java.util.Objects;

/**
 * Parameters of the augmented Dickey-Fuller tests. A {@code null} lag selects the lag automatically.
 */
public final class AdfOptions {
    public static final Specification DEFAULT_SPECIFICATION = Specification.DRIFT;

    private final Specification specification;
    private final Integer lag;

    private AdfOptions(Specification specification, Integer lag) {
        if (specification == null) {
            throw new IllegalArgumentException("specification cannot be null");
        }
        if (lag != null && lag < 0) {
            throw new IllegalArgumentException("lag must be non-negative (got " + lag + ")");
        }
        this.specification = specification;
        this.lag = lag;
    }

    public static AdfOptions defaults() {
        return new AdfOptions(DEFAULT_SPECIFICATION, null);
    }

    public static AdfOptions of(Specification specification, Integer lag) {
        return new AdfOptions(specification, lag);
    }

    public static AdfOptions of(String type, Integer lag) {
        return new AdfOptions(Specification.parse(type), lag);
    }

    public AdfOptions withLag(Integer lag) {
        return new AdfOptions(specification, lag);
    }

    public AdfOptions withSpecification(Specification specification) {
        return new AdfOptions(specification, lag);
    }

    public Specification getSpecification() {
        return specification;
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
        AdfOptions that = (AdfOptions) o;
        return specification == that.specification && Objects.equals(lag, that.lag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(specification, lag);
    }

    @Override
    public String toString() {
        return "AdfOptions{specification=" + specification + ", lag=" + (lag == null ? "auto" : lag) + '}';
    }
}
