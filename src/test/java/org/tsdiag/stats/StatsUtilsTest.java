package org.tsdiag.stats;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class StatsUtilsTest {
    private static Logger logger = LoggerFactory.getLogger(StatsUtilsTest.class);

    private static final double[][] LEVELS = {
            {0., 10., 20.},
            {1., 12., 18.},
            {2., 15., 16.},
            {3., 19., 14.},
            {4., 24., 12.},
            {5., 30., 10.},
    };

    @Test
    public void testDetrend() throws Exception {
        double[][] data = {
                {0., 10., 20.},
                {1., 11., 21.},
                {2., 12., 22.},
                {3., 13., 23.},
                {4., 14., 24.},
        };
        RealMatrix matrix = MatrixUtils.createRealMatrix(data);
        double[][] expectedColumns = {
                {-2.0, -2.0, -2.0},
                {-1.0, -1.0, -1.0},
                {0.0, 0.0, 0.0},
                {1.0, 1.0, 1.0},
                {2.0, 2.0, 2.0}};
        assertEquals(MatrixUtils.createRealMatrix(expectedColumns), StatsUtils.constantDetrendColumns(matrix));
        assertArrayEquals(new double[]{2., 12., 22.}, StatsUtils.columnMeans(matrix), 1e-12);
    }

    @Test
    public void testRowDiff() throws Exception {
        double[][] expectedRows = {
                {1.0, 2.0, -2.0},
                {1.0, 3.0, -2.0},
                {1.0, 4.0, -2.0},
                {1.0, 5.0, -2.0},
                {1.0, 6.0, -2.0}};
        RealMatrix diffMatrix = StatsUtils.diffRows(MatrixUtils.createRealMatrix(LEVELS));
        assertEquals(MatrixUtils.createRealMatrix(expectedRows), diffMatrix);
    }

    @Test
    public void testShiftDown() throws Exception {
        double[][] expectedRows = {
                {0., 0., 0.},
                {0., 0., 0.},
                {0., 10., 20.},
                {1., 12., 18.},
                {2., 15., 16.},
                {3., 19., 14.}
        };
        RealMatrix matrix = MatrixUtils.createRealMatrix(LEVELS);
        assertEquals(MatrixUtils.createRealMatrix(expectedRows), StatsUtils.shiftDown(matrix, 2));
        assertEquals(matrix, StatsUtils.shiftDown(matrix, 0));
    }

    @Test
    public void testTruncate() throws Exception {
        RealMatrix matrix = MatrixUtils.createRealMatrix(LEVELS);
        double[][] expectedRows = {
                {4., 24., 12.},
                {5., 30., 10.}
        };
        assertEquals(MatrixUtils.createRealMatrix(expectedRows), StatsUtils.truncateTop(matrix, 4));
        assertEquals(matrix, StatsUtils.truncateTop(matrix, 0));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testTruncateOverflow() throws Exception {
        StatsUtils.truncateTop(MatrixUtils.createRealMatrix(LEVELS), 6);
    }

    @Test
    public void testResidualizeOnConstant() throws Exception {
        RealMatrix matrix = MatrixUtils.createRealMatrix(LEVELS);
        RealMatrix residuals = StatsUtils.residualize(matrix, StatsUtils.ones(LEVELS.length, 1));
        RealMatrix demeaned = StatsUtils.constantDetrendColumns(matrix);
        logger.info("residuals:\n" + residuals);
        for (int row = 0; row < LEVELS.length; row++) {
            assertArrayEquals(demeaned.getRow(row), residuals.getRow(row), 1e-9);
        }
    }

    @Test
    public void testResidualizeWithoutRegressors() throws Exception {
        RealMatrix matrix = MatrixUtils.createRealMatrix(LEVELS);
        assertEquals(matrix, StatsUtils.residualize(matrix, null));
    }

    @Test
    public void testInverse() throws Exception {
        RealMatrix matrix = MatrixUtils.createRealMatrix(new double[][]{{4., 7.}, {2., 6.}});
        RealMatrix identity = matrix.multiply(StatsUtils.inverse(matrix));
        assertEquals(1., identity.getEntry(0, 0), 1e-12);
        assertEquals(0., identity.getEntry(0, 1), 1e-12);
        assertEquals(0., identity.getEntry(1, 0), 1e-12);
        assertEquals(1., identity.getEntry(1, 1), 1e-12);
    }

    @Test(expected = DegenerateSeriesException.class)
    public void testInverseSingular() throws Exception {
        StatsUtils.inverse(MatrixUtils.createRealMatrix(new double[][]{{1., 2.}, {2., 4.}}));
    }

    @Test
    public void testSeriesHelpers() throws Exception {
        double[] values = {3., 1., 4., 1., 5.};
        assertArrayEquals(new double[]{-2., 3., -3., 4.}, StatsUtils.diff(values), 0.);
        assertEquals(52., StatsUtils.sumOfSquares(values), 0.);
        assertEquals(4., StatsUtils.range(values), 0.);
        RealMatrix columns = StatsUtils.columnsOf(new double[]{1., 2.}, new double[]{3., 4.});
        assertEquals(MatrixUtils.createRealMatrix(new double[][]{{1., 3.}, {2., 4.}}), columns);
    }
}
