package org.tsdiag.stats;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class CriticalValueTableTest {

    private static final CriticalValueTable TABLE = new CriticalValueTable(
            new double[]{25, 100, CriticalValueTable.ASYMPTOTIC},
            new double[][]{
                    {-3.0, -2.0, -1.0},
                    {-2.5, -1.5, -0.5},
                    {-2.0, -1.0, 0.0}});

    @Test
    public void tabulatedSizes() {
        CriticalValues first = TABLE.lookup(25);
        assertEquals(-3.0, first.getOnePercent(), 1e-12);
        assertEquals(-2.0, first.getFivePercent(), 1e-12);
        assertEquals(-1.0, first.getTenPercent(), 1e-12);
        assertEquals(-1.5, TABLE.lookup(100).getFivePercent(), 1e-12);
    }

    @Test
    public void interpolatesInInverseSampleSize() {
        // 1/40 sits halfway between 1/25 and 1/100
        CriticalValues values = TABLE.lookup(40);
        assertEquals(-2.75, values.getOnePercent(), 1e-9);
        assertEquals(-1.75, values.getFivePercent(), 1e-9);
        assertEquals(-0.75, values.getTenPercent(), 1e-9);
        assertEquals(-1.0, TABLE.lookup(Integer.MAX_VALUE).getFivePercent(), 1e-6);
    }

    @Test
    public void smallSamplesUseFirstRow() {
        assertEquals(TABLE.lookup(25).getOnePercent(), TABLE.lookup(10).getOnePercent(), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonPositiveSampleSize() {
        TABLE.lookup(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void singleRowTable() {
        new CriticalValueTable(new double[]{25}, new double[][]{{-3.0, -2.0, -1.0}});
    }

    @Test
    public void forAlpha() {
        CriticalValues values = new CriticalValues(-3.43, -2.86, -2.57);
        assertEquals(-3.43, values.forAlpha(0.01), 0.);
        assertEquals(-2.86, values.forAlpha(0.05), 0.);
        assertEquals(-2.86, values.forAlpha(0.025), 0.);
        assertEquals(-2.57, values.forAlpha(0.10), 0.);
        assertEquals(new CriticalValues(-3.43, -2.86, -2.57), values);
        assertNotEquals(new CriticalValues(-3.43, -2.86, -2.58), values);
        assertEquals("1% = -3.4300, 5% = -2.8600, 10% = -2.5700", values.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void forAlphaOutOfRange() {
        new CriticalValues(-3.43, -2.86, -2.57).forAlpha(1.0);
    }
}
