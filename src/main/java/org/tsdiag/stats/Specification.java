package org.tsdiag.stats;

/**
 * Deterministic terms included in a unit-root regression.
 */
public enum Specification {
    /** no deterministic terms */
    NONE("none"),
    /** intercept only */
    DRIFT("drift"),
    /** intercept and linear trend */
    TREND("trend");

    private final String label;

    Specification(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean hasIntercept() {
        return this != NONE;
    }

    public boolean hasTrend() {
        return this == TREND;
    }

    /**
     * Number of deterministic columns this specification adds to a design matrix.
     */
    public int deterministicColumns() {
        return ordinal();
    }

    public static Specification parse(String label) {
        for (Specification specification : values()) {
            if (specification.label.equals(label)) {
                return specification;
            }
        }
        throw new IllegalArgumentException("type must be 'none', 'drift', or 'trend' (got '" + label + "')");
    }

    @Override
    public String toString() {
        return label;
    }
}
