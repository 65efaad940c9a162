package org.tsdiag.stats;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Least-squares core used by every regression-based test.
 *
 * The design matrix is taken as given: no intercept is added, callers include intercept and trend columns
 * themselves (see {@link DesignMatrix}). The fit is QR based; a pivot of R smaller than {@link #SINGULARITY_TOLERANCE}
 * times the largest column norm is treated as rank deficiency.
 */
@Slf4j
public class OrdinaryLeastSquares {

    public static final double SINGULARITY_TOLERANCE = 1e-10;

    private OrdinaryLeastSquares() {
    }

    /**
     * @param y response, one entry per observation
     * @param x design matrix, one row per observation
     * @throws DegenerateSeriesException when the design is rank deficient or has no residual degrees of freedom
     */
    public static RegressionFit fit(double[] y, double[][] x) {
        if (y == null || x == null) {
            throw new IllegalArgumentException("response and design matrix cannot be null");
        }
        if (x.length != y.length) {
            throw new IllegalArgumentException("design matrix has " + x.length + " rows for " + y.length + " observations");
        }
        if (x.length == 0 || x[0].length == 0) {
            throw new IllegalArgumentException("design matrix cannot be empty");
        }
        int regressors = x[0].length;
        if (y.length <= regressors) {
            throw new DegenerateSeriesException("regression needs more observations (" + y.length + ") than regressors (" + regressors + ")");
        }
        double threshold = SINGULARITY_TOLERANCE * largestColumnNorm(x);
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression(threshold);
        regression.setNoIntercept(true);
        try {
            regression.newSampleData(y, x);
            double[] beta = regression.estimateRegressionParameters();
            double[] standardErrors = regression.estimateRegressionParametersStandardErrors();
            double[] residuals = regression.estimateResiduals();
            double rss = regression.calculateResidualSumOfSquares();
            return new RegressionFit(beta, standardErrors, residuals, rss, StatsUtils.sumOfSquares(y));
        } catch (MathIllegalArgumentException e) {
            log.debug("rank deficient design matrix ({} x {}): {}", x.length, regressors, e.getMessage());
            throw new DegenerateSeriesException("design matrix is rank deficient", e);
        }
    }

    private static double largestColumnNorm(double[][] x) {
        RealMatrix design = MatrixUtils.createRealMatrix(x);
        double largest = 0;
        for (int column = 0; column < design.getColumnDimension(); column++) {
            largest = Math.max(largest, design.getColumnVector(column).getNorm());
        }
        return largest;
    }
}
