package org.tsdiag.stats.timeseries;

import org.junit.Test;
import org.tsdiag.stats.CriticalValueTable;
import org.tsdiag.stats.CriticalValues;
import org.tsdiag.stats.Specification;

import static org.junit.Assert.assertTrue;

public class UnitRootTablesTest {

    private static final int[] SIZES = {10, 25, 60, 100, 400, 1000, 100000};

    @Test
    public void levelsAreOrdered() {
        for (Specification specification : Specification.values()) {
            assertOrdered(UnitRootTables.dickeyFuller(specification));
            assertOrdered(UnitRootTables.glsDetrended(specification));
        }
    }

    @Test
    public void deterministicTermsShiftCriticalValuesDown() {
        for (int n : SIZES) {
            double none = UnitRootTables.DF_NONE.lookup(n).getFivePercent();
            double drift = UnitRootTables.DF_DRIFT.lookup(n).getFivePercent();
            double trend = UnitRootTables.DF_TREND.lookup(n).getFivePercent();
            assertTrue(trend < drift);
            assertTrue(drift < none);
        }
    }

    private static void assertOrdered(CriticalValueTable table) {
        for (int n : SIZES) {
            CriticalValues values = table.lookup(n);
            assertTrue(values.getOnePercent() < values.getFivePercent());
            assertTrue(values.getFivePercent() < values.getTenPercent());
        }
    }
}
