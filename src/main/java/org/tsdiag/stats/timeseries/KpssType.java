package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.Specification;

/**
 * Stationarity hypothesis tested by KPSS: around a level or around a linear trend.
 */
public enum KpssType {
    LEVEL("level"),
    TREND("trend");

    private final String label;

    KpssType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static KpssType parse(String label) {
        for (KpssType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("type must be 'level' or 'trend' (got '" + label + "')");
    }

    /**
     * Level stationarity for none/drift, trend stationarity for trend.
     */
    public static KpssType of(Specification specification) {
        return specification == Specification.TREND ? TREND : LEVEL;
    }

    @Override
    public String toString() {
        return label;
    }
}
