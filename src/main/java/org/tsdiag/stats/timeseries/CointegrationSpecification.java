package org.tsdiag.stats.timeseries;

/**
 * Deterministic terms of the Johansen error correction model.
 */
public enum CointegrationSpecification {
    /** no deterministic part */
    NONE("none"),
    /** unrestricted constant */
    CONST("const"),
    /** constant plus linear trend */
    TREND("trend");

    private final String label;

    CointegrationSpecification(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static CointegrationSpecification parse(String label) {
        for (CointegrationSpecification specification : values()) {
            if (specification.label.equals(label)) {
                return specification;
            }
        }
        throw new IllegalArgumentException("type must be 'none', 'const', or 'trend' (got '" + label + "')");
    }

    @Override
    public String toString() {
        return label;
    }
}
