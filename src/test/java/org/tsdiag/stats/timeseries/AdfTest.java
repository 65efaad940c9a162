package org.tsdiag.stats.timeseries;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsdiag.stats.Specification;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class AdfTest {
    private static Logger logger = LoggerFactory.getLogger(AdfTest.class);

    @Test
    public void automaticLag() {
        AdfResult result = Adf.test(SeriesFixtures.stationary(200, 1));
        logger.info("auto lag:\n" + result);
        assertTrue(result.isAutoLag());
        assertEquals(5, result.getLag());
        assertEquals(194, result.getEffectiveSampleSize());
        assertTrue(result.rejectsUnitRoot(0.05));
        assertTrue(result.toString().startsWith("Augmented Dickey-Fuller Test"));
    }

    @Test
    public void explicitLag() {
        AdfResult result = Adf.test(SeriesFixtures.stationary(120, 2), 2, "trend");
        assertFalse(result.isAutoLag());
        assertEquals(2, result.getLag());
        assertEquals(Specification.TREND, result.getSpecification());
        assertTrue(result.rejectsUnitRoot(0.05));
    }

    @Test
    public void lagZeroMatchesDickeyFuller() {
        double[] data = SeriesFixtures.randomWalk(60, 4);
        AdfResult adf = Adf.test(data, 0, Specification.DRIFT);
        DfResult df = Df.test(data, Specification.DRIFT);
        assertEquals(df.getStatistic(), adf.getStatistic(), 1e-12);
        assertEquals(df.getGamma(), adf.getGamma(), 1e-12);
    }

    @Test
    public void explosiveSeriesKeepsUnitRoot() {
        AdfResult result = Adf.test(SeriesFixtures.explosive(100, 7));
        assertEquals(4, result.getLag());
        assertFalse(result.rejectsUnitRoot(0.10));
    }

    @Test(expected = IllegalArgumentException.class)
    public void lagAboveThirdOfSample() {
        Adf.test(SeriesFixtures.whiteNoise(30, 8), 11, "drift");
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeLag() {
        Adf.test(SeriesFixtures.whiteNoise(30, 8), -1, "drift");
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullOptions() {
        Adf.test(SeriesFixtures.whiteNoise(30, 8), (AdfOptions) null);
    }

    @Test
    public void lagRules() {
        assertEquals(2, AdfRegression.autoLag(9));
        assertEquals(4, AdfRegression.autoLag(100));
        assertEquals(5, AdfRegression.autoLag(200));
        assertEquals(10, AdfRegression.autoLag(5000));
        assertEquals(10, AdfRegression.maxLag(30));
        assertEquals(3, AdfRegression.resolveLag(10, 3, Specification.NONE));
        assertEquals(2, AdfRegression.resolveLag(10, null, Specification.TREND));
    }

    @Test(expected = IllegalArgumentException.class)
    public void lagWithoutResidualDegreesOfFreedom() {
        AdfRegression.checkLag(10, 3, Specification.TREND);
    }

    @Test
    public void options() {
        AdfOptions defaults = AdfOptions.defaults();
        assertEquals(Specification.DRIFT, defaults.getSpecification());
        assertTrue(defaults.isAutoLag());
        assertEquals(AdfOptions.of("trend", 3), defaults.withLag(3).withSpecification(Specification.TREND));
        assertNotEquals(AdfOptions.of("trend", 3), AdfOptions.of("trend", null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void constant() {
        double[] data = new double[30];
        Arrays.fill(data, 7.);
        Adf.test(data);
    }
}
