package org.tsdiag.stats.timeseries;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsdiag.stats.DegenerateSeriesException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ChowTest {
    private static Logger logger = LoggerFactory.getLogger(ChowTest.class);

    private static final int N = 40;

    private static double[][] design() {
        double[][] x = new double[N][];
        for (int i = 0; i < N; i++) {
            x[i] = new double[]{1., i};
        }
        return x;
    }

    private static double noise(int i) {
        return i % 2 == 0 ? 0.05 : -0.05;
    }

    @Test
    public void stableRegression() {
        double[] y = new double[N];
        for (int i = 0; i < N; i++) {
            y[i] = 1. + 2. * i + noise(i);
        }
        ChowResult result = Chow.test(y, design(), 20);
        logger.info("stable:\n" + result);
        assertEquals(2, result.getDf1());
        assertEquals(36, result.getDf2());
        assertEquals(20, result.getBreakPoint());
        assertEquals(N, result.getSampleSize());
        assertEquals(2, result.getNumParameters());
        assertTrue(result.getRssFull() >= result.getRss1() + result.getRss2() - 1e-12);
        assertTrue(result.getStatistic() < 1.);
        assertTrue(result.getPValue() > 0.5);
        assertTrue(result.interpret().startsWith("Fail to reject H0: no evidence of structural break at observation 20"));
        assertTrue(result.toString().startsWith("Chow Test for Structural Break"));
    }

    @Test
    public void shiftedRegression() {
        double[] y = new double[N];
        for (int i = 0; i < N; i++) {
            y[i] = (i < 20 ? 1. + 2. * i : 5. + i) + noise(i);
        }
        ChowResult result = Chow.test(y, design(), 20);
        assertTrue(result.getPValue() < 0.001);
        assertTrue(result.interpret().startsWith("Reject H0: structural break detected at observation 20"));
        assertTrue(result.evaluate().contains("structural break present"));
    }

    @Test(expected = DegenerateSeriesException.class)
    public void exactFit() {
        double[] y = new double[N];
        for (int i = 0; i < N; i++) {
            y[i] = 1. + 2. * i;
        }
        Chow.test(y, design(), 20);
    }

    @Test(expected = IllegalArgumentException.class)
    public void breakPointTooEarly() {
        Chow.test(new double[N], design(), 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void breakPointTooLate() {
        Chow.test(new double[N], design(), 38);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullData() {
        Chow.test(null, design(), 20);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rowMismatch() {
        Chow.test(new double[N - 1], design(), 20);
    }

    @Test(expected = IllegalArgumentException.class)
    public void raggedDesign() {
        double[][] x = design();
        x[5] = new double[]{1.};
        Chow.test(new double[N], x, 20);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonFiniteResponse() {
        double[] y = new double[N];
        y[3] = Double.POSITIVE_INFINITY;
        Chow.test(y, design(), 20);
    }
}
