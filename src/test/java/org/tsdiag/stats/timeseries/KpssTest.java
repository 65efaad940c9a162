package org.tsdiag.stats.timeseries;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsdiag.stats.DegenerateSeriesException;
import org.tsdiag.stats.Specification;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class KpssTest {
    private static Logger logger = LoggerFactory.getLogger(KpssTest.class);

    @Test
    public void stationarySeries() {
        KpssResult result = Kpss.test(SeriesFixtures.stationary(200, 1));
        logger.info("stationary:\n" + result);
        assertEquals(KpssType.LEVEL, result.getType());
        assertEquals(4, result.getLags());
        assertEquals(200, result.getSampleSize());
        assertTrue(result.getLongRunVariance() > 0);
        assertTrue(result.getStatistic() < 0.347);
        assertEquals(0.10, result.getPValue(), 0.);
        assertFalse(result.rejectsStationarity(0.10));
        assertTrue(result.interpret().startsWith("Fail to reject H0: series appears level stationary"));
        assertTrue(result.toString().startsWith("KPSS Stationarity Test"));
    }

    @Test
    public void trendIsOnlyStationaryAroundTrend() {
        double[] data = SeriesFixtures.trendWithAlternation(100);
        KpssResult level = Kpss.test(data, "level");
        KpssResult trend = Kpss.test(data, "trend");
        logger.info("level: {}, trend: {}", level.getStatistic(), trend.getStatistic());
        assertTrue(level.rejectsStationarity(0.01));
        assertEquals(0.01, level.getPValue(), 0.);
        assertTrue(level.interpret().startsWith("Reject H0: series is not level stationary"));
        assertFalse(trend.rejectsStationarity(0.10));
        assertEquals(0.10, trend.getPValue(), 0.);
    }

    @Test
    public void criticalValues() {
        KpssResult level = Kpss.test(SeriesFixtures.whiteNoise(50, 2), "level", 0);
        assertEquals(0, level.getLags());
        assertArrayEquals(new double[]{0.347, 0.463, 0.574, 0.739}, level.getCriticalValues(), 0.);
        assertEquals(0.463, level.getCriticalValue(), 0.);
        assertEquals(0.574, level.getCriticalValue(0.025), 0.);
        assertEquals(0.739, level.getCriticalValue(0.01), 0.);
        KpssResult trend = Kpss.test(SeriesFixtures.whiteNoise(50, 2), KpssType.TREND, null);
        assertArrayEquals(new double[]{0.119, 0.146, 0.176, 0.216}, trend.getCriticalValues(), 0.);
    }

    @Test
    public void pValueInterpolation() {
        assertEquals(0.05, Kpss.pValue(0.463, KpssType.LEVEL), 1e-12);
        assertEquals(0.075, Kpss.pValue(0.405, KpssType.LEVEL), 1e-9);
        assertEquals(0.10, Kpss.pValue(0.05, KpssType.LEVEL), 0.);
        assertEquals(0.01, Kpss.pValue(2.0, KpssType.TREND), 0.);
    }

    @Test
    public void bandwidth() {
        assertEquals(3, Kpss.defaultLag(50));
        assertEquals(4, Kpss.defaultLag(100));
        assertEquals(4, Kpss.defaultLag(200));
        assertEquals(1., Kpss.longRunVariance(new double[]{1., -1., 1., -1.}, 0), 1e-12);
        assertEquals(0.25, Kpss.longRunVariance(new double[]{1., -1., 1., -1.}, 1), 1e-12);
    }

    @Test
    public void typeFollowsSpecification() {
        assertEquals(KpssType.LEVEL, KpssType.of(Specification.NONE));
        assertEquals(KpssType.LEVEL, KpssType.of(Specification.DRIFT));
        assertEquals(KpssType.TREND, KpssType.of(Specification.TREND));
    }

    @Test(expected = IllegalArgumentException.class)
    public void lagsTooLarge() {
        Kpss.test(SeriesFixtures.whiteNoise(20, 2), "level", 20);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownType() {
        Kpss.test(SeriesFixtures.whiteNoise(20, 2), "drift");
    }

    @Test(expected = DegenerateSeriesException.class)
    public void exactTrend() {
        double[] data = new double[30];
        for (int t = 0; t < data.length; t++) {
            data[t] = 1. + 0.25 * t;
        }
        Kpss.test(data, "trend");
    }

    @Test(expected = IllegalArgumentException.class)
    public void constant() {
        double[] data = new double[40];
        Arrays.fill(data, 0.75);
        Kpss.test(data);
    }
}
