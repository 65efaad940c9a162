package org.tsdiag.stats.timeseries;

/**
 * Consensus of the unit-root battery.
 */
public enum Verdict {
    STATIONARY,
    UNIT_ROOT,
    INCONCLUSIVE
}
