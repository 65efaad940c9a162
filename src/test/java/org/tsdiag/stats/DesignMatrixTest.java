package org.tsdiag.stats;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class DesignMatrixTest {

    @Test
    public void buildsColumnsInOrder() {
        double[] source = {10., 11., 12., 13., 14.};
        double[][] design = new DesignMatrix(3).intercept().trend(5.).slice(source, 2).build();
        assertArrayEquals(new double[]{1., 5., 12.}, design[0], 0.);
        assertArrayEquals(new double[]{1., 6., 13.}, design[1], 0.);
        assertArrayEquals(new double[]{1., 7., 14.}, design[2], 0.);
    }

    @Test
    public void deterministicColumns() {
        for (Specification specification : Specification.values()) {
            DesignMatrix matrix = new DesignMatrix(4).deterministic(specification);
            assertEquals(specification.deterministicColumns(), matrix.columnCount());
        }
        double[][] trend = new DesignMatrix(2).deterministic(Specification.TREND).build();
        assertArrayEquals(new double[]{1., 1.}, trend[0], 0.);
        assertArrayEquals(new double[]{1., 2.}, trend[1], 0.);
    }

    @Test
    public void columnIsCopied() {
        double[] values = {1., 2.};
        DesignMatrix matrix = new DesignMatrix(2).column(values);
        values[0] = 99.;
        assertEquals(1., matrix.build()[0][0], 0.);
    }

    @Test(expected = IllegalArgumentException.class)
    public void wrongColumnLength() {
        new DesignMatrix(3).column(new double[]{1., 2.});
    }

    @Test
    public void specificationLabels() {
        assertEquals(Specification.NONE, Specification.parse("none"));
        assertEquals(Specification.DRIFT, Specification.parse("drift"));
        assertEquals(Specification.TREND, Specification.parse("trend"));
        assertEquals("trend", Specification.TREND.toString());
        assertFalse(Specification.NONE.hasIntercept());
        assertTrue(Specification.TREND.hasTrend());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownSpecification() {
        Specification.parse("quadratic");
    }
}
