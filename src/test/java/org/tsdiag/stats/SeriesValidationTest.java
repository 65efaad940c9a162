package org.tsdiag.stats;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SeriesValidationTest {

    @Test
    public void acceptsVaryingSeries() {
        SeriesValidation.requireSeries(new double[]{1., 2., 1.5}, "data", 3);
        SeriesValidation.requireFinite(new double[]{4., 4., 4.}, "data", 3);
        SeriesValidation.requireSameLength(new double[]{1., 2.}, new double[]{3., 4.});
        SeriesValidation.requireSameLength(Arrays.asList(new double[]{1., 2.}, new double[]{3., 4.}, new double[]{5., 6.}));
        SeriesValidation.requireAlpha(0.05);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullSeries() {
        SeriesValidation.requireSeries(null, "data", 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptySeries() {
        SeriesValidation.requireSeries(new double[0], "data", 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooShort() {
        SeriesValidation.requireSeries(new double[]{1., 2.}, "data", 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void notANumber() {
        SeriesValidation.requireSeries(new double[]{1., Double.NaN, 2.}, "data", 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void infinite() {
        SeriesValidation.requireFinite(new double[]{1., Double.NEGATIVE_INFINITY, 2.}, "data", 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void constant() {
        SeriesValidation.requireSeries(new double[]{3., 3., 3., 3.}, "data", 3);
    }

    @Test
    public void constancyIsRelativeToMagnitude() {
        SeriesValidation.requireSeries(new double[]{1e-11, 3e-11, 2e-11}, "data", 3);
        assertTrue(SeriesValidation.isConstant(new double[]{0., 0., 0.}));
        assertTrue(SeriesValidation.isConstant(new double[]{1e12, 1e12 + 1e-3, 1e12}));
        assertFalse(SeriesValidation.isConstant(new double[]{1e-20, 0., 2e-20}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void differentLengths() {
        SeriesValidation.requireSameLength(new double[]{1., 2.}, new double[]{3.});
    }

    @Test(expected = IllegalArgumentException.class)
    public void differentLengthsInList() {
        SeriesValidation.requireSameLength(Arrays.asList(new double[]{1., 2.}, new double[]{3., 4.}, new double[]{5.}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void alphaZero() {
        SeriesValidation.requireAlpha(0.);
    }

    @Test(expected = IllegalArgumentException.class)
    public void alphaNaN() {
        SeriesValidation.requireAlpha(Double.NaN);
    }
}
