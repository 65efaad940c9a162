package org.tsdiag.stats.timeseries;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PortmanteauTest {
    private static Logger logger = LoggerFactory.getLogger(PortmanteauTest.class);

    private static double[] alternating(int n) {
        double[] values = new double[n];
        for (int t = 0; t < n; t++) {
            values[t] = t % 2 == 0 ? 1. : -1.;
        }
        return values;
    }

    @Test
    public void defaultLags() {
        PortmanteauResult result = Portmanteau.ljungBox(SeriesFixtures.whiteNoise(100, 3));
        logger.info("white noise:\n" + result);
        assertEquals(Portmanteau.Method.LJUNG_BOX, result.getMethod());
        assertEquals(10, result.getLags());
        assertEquals(0, result.getFitdf());
        assertEquals(10, result.getDegreesOfFreedom());
        assertEquals(100, result.getSampleSize());
        assertEquals(10, result.getAutocorrelations().length);
        assertTrue(result.getPValue() >= 0 && result.getPValue() <= 1);
        assertTrue(result.toString().startsWith("Ljung-Box Test for Autocorrelation"));
        assertTrue(result.toString().contains("Q statistic"));
    }

    @Test
    public void alternatingSeriesIsAutocorrelated() {
        PortmanteauResult result = Portmanteau.ljungBox(alternating(20));
        assertEquals(4, result.getLags());
        assertEquals(-0.95, result.getAutocorrelation(1), 1e-12);
        assertTrue(result.getPValue() < 0.001);
        assertTrue(result.interpret().startsWith("Reject H0: significant autocorrelation up to lag 4"));
        assertTrue(result.evaluate().contains("autocorrelated"));
    }

    @Test
    public void boxPierceBelowLjungBox() {
        double[] data = SeriesFixtures.whiteNoise(60, 9);
        PortmanteauResult ljungBox = Portmanteau.ljungBox(data, 6, 0);
        PortmanteauResult boxPierce = Portmanteau.boxPierce(data, 6, 0);
        assertTrue(boxPierce.getStatistic() < ljungBox.getStatistic());
        assertTrue(boxPierce.getPValue() > ljungBox.getPValue());
        assertArrayEquals(ljungBox.getAutocorrelations(), boxPierce.getAutocorrelations(), 0.);
        assertTrue(boxPierce.toString().startsWith("Box-Pierce Test for Autocorrelation"));
    }

    @Test
    public void fittedParametersReduceDegreesOfFreedom() {
        PortmanteauResult result = Portmanteau.test(SeriesFixtures.whiteNoise(60, 9), Portmanteau.Method.LJUNG_BOX,
                PortmanteauOptions.of(10, 2));
        assertEquals(8, result.getDegreesOfFreedom());
    }

    @Test
    public void autocorrelations() {
        double[] rho = Portmanteau.autocorrelations(new double[]{1., 2., 3., 4., 5.}, 2);
        assertEquals(0.4, rho[0], 1e-12);
        assertEquals(-0.1, rho[1], 1e-12);
        assertEquals(1, Portmanteau.autoLags(3));
        assertEquals(4, Portmanteau.autoLags(20));
        assertEquals(10, Portmanteau.autoLags(500));
    }

    @Test(expected = IllegalArgumentException.class)
    public void lagsNotBelowSampleSize() {
        Portmanteau.ljungBox(SeriesFixtures.whiteNoise(50, 1), 50);
    }

    @Test(expected = IllegalArgumentException.class)
    public void fitdfNotBelowLags() {
        PortmanteauOptions.of(3, 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void autocorrelationLagOutOfRange() {
        Portmanteau.ljungBox(SeriesFixtures.whiteNoise(50, 1)).getAutocorrelation(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooShort() {
        Portmanteau.ljungBox(new double[]{1., 2., 3., 4., 5.});
    }

    @Test(expected = IllegalArgumentException.class)
    public void constant() {
        double[] data = new double[40];
        Arrays.fill(data, 1.5);
        Portmanteau.ljungBox(data);
    }
}
