package org.tsdiag.stats.timeseries;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsdiag.stats.NumericColumnSource;
import org.tsdiag.stats.Specification;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class UnitRootTest {
    private static Logger logger = LoggerFactory.getLogger(UnitRootTest.class);

    @Test
    public void stationarySeries() {
        UnitRootResult result = UnitRoot.test(SeriesFixtures.stationary(200, 1));
        logger.info(result.summary());
        assertEquals(200, result.getSampleSize());
        assertEquals(Specification.DRIFT, result.getSpecification());
        assertEquals(KpssType.LEVEL, result.getKpssResult().getType());
        assertEquals(3, result.unitRootRejections(0.05));
        assertEquals(Verdict.STATIONARY, result.verdict(0.05));
        assertTrue(result.isStationary());
        assertFalse(result.hasUnitRoot());
        assertTrue(result.getConsensus().startsWith("Strong evidence of STATIONARITY"));
        assertTrue(result.interpret().startsWith("Series appears stationary"));
        assertTrue(result.evaluate().contains("Conclusion: STATIONARY"));
    }

    @Test
    public void explosiveSeries() {
        UnitRootResult result = UnitRoot.test(SeriesFixtures.explosive(100, 7), "none", null);
        logger.info(result.summary());
        assertEquals(0, result.unitRootRejections(0.05));
        assertTrue(result.getKpssResult().rejectsStationarity(0.05));
        assertEquals(Verdict.UNIT_ROOT, result.verdict(0.05));
        assertTrue(result.hasUnitRoot());
        assertTrue(result.getConsensus().startsWith("Strong evidence of UNIT ROOT"));
        assertTrue(result.interpret().startsWith("Series appears to have a unit root"));
    }

    @Test
    public void summarySections() {
        String summary = UnitRoot.test(SeriesFixtures.stationary(120, 5)).summary(0.05);
        assertTrue(summary.startsWith("Unit Root Test Summary"));
        assertTrue(summary.contains("1. Dickey-Fuller Test:"));
        assertTrue(summary.contains("2. Augmented Dickey-Fuller Test:"));
        assertTrue(summary.contains("3. ADF-GLS Test (Elliott-Rothenberg-Stock):"));
        assertTrue(summary.contains("4. KPSS Test (tests stationarity, opposite null):"));
        assertTrue(summary.contains("Overall Assessment:"));
    }

    @Test
    public void optionsReachEveryTest() {
        UnitRootResult result = UnitRoot.test(SeriesFixtures.stationary(120, 5), "trend", 2);
        assertEquals(Specification.TREND, result.getSpecification());
        assertEquals(Specification.TREND, result.getDfResult().getSpecification());
        assertEquals(0, result.getDfResult().getLag());
        assertEquals(2, result.getAdfResult().getLag());
        assertEquals(2, result.getAdfGlsResult().getLag());
        assertEquals(KpssType.TREND, result.getKpssResult().getType());
        assertEquals(result.summary(), result.toString());
    }

    @Test
    public void columnSource() {
        double[] data = SeriesFixtures.stationary(80, 2);
        NumericColumnSource source = name -> data;
        assertEquals(UnitRoot.test(data, "drift", null), UnitRoot.test(source, "close", "drift", null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooShort() {
        UnitRoot.test(SeriesFixtures.whiteNoise(14, 3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownType() {
        UnitRoot.test(SeriesFixtures.whiteNoise(40, 3), "level", null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void constant() {
        double[] data = new double[50];
        Arrays.fill(data, 4.);
        UnitRoot.test(data);
    }
}
