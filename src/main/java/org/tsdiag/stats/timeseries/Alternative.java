package org.tsdiag.stats.timeseries;

/**
 * Alternative hypothesis of the Durbin-Watson test, following lmtest::dwtest:
 * {@code greater} is true autocorrelation above zero (positive), {@code less} below zero (negative).
 */
public enum Alternative {
    TWO_SIDED("two.sided"),
    GREATER("greater"),
    LESS("less");

    private final String label;

    Alternative(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Alternative parse(String label) {
        for (Alternative alternative : values()) {
            if (alternative.label.equals(label)) {
                return alternative;
            }
        }
        throw new IllegalArgumentException("alternative must be 'two.sided', 'greater', or 'less' (got '" + label + "')");
    }

    @Override
    public String toString() {
        return label;
    }
}
