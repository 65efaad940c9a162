package org.tsdiag.stats.timeseries;

import java.util.Objects;

/**
 * VAR order in levels and deterministic terms for the Johansen test.
 */
public final class JohansenOptions {
    public static final int DEFAULT_LAG = 1;
    public static final CointegrationSpecification DEFAULT_SPECIFICATION = CointegrationSpecification.CONST;

    private final int lag;
    private final CointegrationSpecification specification;

    private JohansenOptions(int lag, CointegrationSpecification specification) {
        if (lag < 1) {
            throw new IllegalArgumentException("lag must be at least 1 (got " + lag + ")");
        }
        if (specification == null) {
            throw new IllegalArgumentException("specification cannot be null");
        }
        this.lag = lag;
        this.specification = specification;
    }

    public static JohansenOptions defaults() {
        return new JohansenOptions(DEFAULT_LAG, DEFAULT_SPECIFICATION);
    }

    public static JohansenOptions of(int lag, CointegrationSpecification specification) {
        return new JohansenOptions(lag, specification);
    }

    public static JohansenOptions of(int lag, String type) {
        return new JohansenOptions(lag, CointegrationSpecification.parse(type));
    }

    public int getLag() {
        return lag;
    }

    public CointegrationSpecification getSpecification() {
        return specification;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JohansenOptions that = (JohansenOptions) o;
        return lag == that.lag && specification == that.specification;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lag, specification);
    }

    @Override
    public String toString() {
        return "JohansenOptions{lag=" + lag + ", specification=" + specification + '}';
    }
}
