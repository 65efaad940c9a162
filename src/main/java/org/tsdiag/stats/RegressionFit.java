package org.tsdiag.stats;

/**
 * Outcome of a single least-squares fit. Instances are created by {@link OrdinaryLeastSquares} and never shared.
 */
public class RegressionFit {
    /**
     * A residual sum of squares at or below this fraction of the response sum of squares is a perfect fit.
     */
    public static final double PERFECT_FIT_TOLERANCE = 1e-20;

    private final double[] coefficients;
    private final double[] standardErrors;
    private final double[] residuals;
    private final double residualSumOfSquares;
    private final double responseSumOfSquares;
    private final int degreesOfFreedom;

    public RegressionFit(double[] coefficients, double[] standardErrors, double[] residuals, double residualSumOfSquares,
                         double responseSumOfSquares) {
        this.coefficients = coefficients.clone();
        this.standardErrors = standardErrors.clone();
        this.residuals = residuals.clone();
        this.residualSumOfSquares = residualSumOfSquares;
        this.responseSumOfSquares = responseSumOfSquares;
        this.degreesOfFreedom = residuals.length - coefficients.length;
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double[] getStandardErrors() {
        return standardErrors.clone();
    }

    public double[] getResiduals() {
        return residuals.clone();
    }

    public double getResidualSumOfSquares() {
        return residualSumOfSquares;
    }

    /**
     * Residual degrees of freedom, observations minus regressors.
     */
    public int getDegreesOfFreedom() {
        return degreesOfFreedom;
    }

    /**
     * True when the residuals vanish relative to the response, as for a deterministic linear series.
     */
    public boolean isPerfectFit() {
        return residualSumOfSquares <= PERFECT_FIT_TOLERANCE * responseSumOfSquares;
    }

    public int getObservations() {
        return residuals.length;
    }

    public double coefficient(int index) {
        return coefficients[index];
    }

    public double standardError(int index) {
        return standardErrors[index];
    }

    /**
     * t-ratio of a coefficient.
     *
     * @throws DegenerateSeriesException when the standard error is zero or not finite (perfect fit)
     */
    public double tStatistic(int index) {
        if (isPerfectFit()) {
            throw new DegenerateSeriesException("residual sum of squares " + residualSumOfSquares + " is negligible, the regression fits perfectly");
        }
        double se = standardErrors[index];
        if (!(se > 0) || Double.isInfinite(se)) {
            throw new DegenerateSeriesException("standard error of coefficient " + index + " is degenerate (" + se + "), the regression fits perfectly");
        }
        double statistic = coefficients[index] / se;
        if (Double.isNaN(statistic) || Double.isInfinite(statistic)) {
            throw new DegenerateSeriesException("t-statistic of coefficient " + index + " is not finite");
        }
        return statistic;
    }
}
