package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.tsdiag.stats.CriticalValues;
import org.tsdiag.stats.DegenerateSeriesException;
import org.tsdiag.stats.SeriesValidation;
import org.tsdiag.stats.StatsUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Johansen cointegration rank test.
 *
 * The VAR of order p in levels is written as the error correction model
 * Δy_t = Π y_{t-1} + Γ_1 Δy_{t-1} + ... + Γ_{p-1} Δy_{t-p+1} + deterministic terms + ε_t.
 * Δy_t and y_{t-1} are regressed on the lagged differences (and deterministic terms), and the residual
 * moment matrices give the eigenproblem |λ S11 - S10 S00⁻¹ S01| = 0, solved in symmetric form through
 * the Cholesky factor of S11.
 */
@Slf4j
public class Johansen {
    public static final int MIN_EFFECTIVE_OBSERVATIONS = 20;

    private static final double EIGENVALUE_TOLERANCE = 1e-10;

    private Johansen() {
    }

    public static JohansenResult test(List<double[]> series) {
        return test(series, JohansenOptions.defaults());
    }

    public static JohansenResult test(List<double[]> series, int lag) {
        return test(series, JohansenOptions.of(lag, JohansenOptions.DEFAULT_SPECIFICATION));
    }

    public static JohansenResult test(List<double[]> series, int lag, String type) {
        return test(series, JohansenOptions.of(lag, type));
    }

    public static JohansenResult test(List<double[]> series, JohansenOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (series == null || series.size() < 2) {
            throw new IllegalArgumentException("Johansen test needs at least 2 series (got " + (series == null ? 0 : series.size()) + ")");
        }
        int k = series.size();
        if (k > JohansenTables.MAX_DIMENSION) {
            throw new IllegalArgumentException("critical values are tabulated for at most " + JohansenTables.MAX_DIMENSION + " series (got " + k + ")");
        }
        SeriesValidation.requireSameLength(series);
        for (int i = 0; i < k; i++) {
            SeriesValidation.requireSeries(series.get(i), "series " + i, 1);
        }
        int n = series.get(0).length;
        int p = options.getLag();
        int effective = n - p;
        if (effective < MIN_EFFECTIVE_OBSERVATIONS) {
            throw new IllegalArgumentException("need at least " + MIN_EFFECTIVE_OBSERVATIONS + " observations after lagging (n - lag = " + effective + ")");
        }
        if (effective <= k * p + 2) {
            throw new IllegalArgumentException("lag " + p + " leaves too few observations (" + effective + ") for " + k + " series");
        }
        CointegrationSpecification specification = options.getSpecification();

        RealMatrix levels = StatsUtils.columnsOf(series.toArray(new double[0][]));
        RealMatrix dx = StatsUtils.diffRows(levels);
        RealMatrix z0 = StatsUtils.truncateTop(dx, p - 1);
        RealMatrix z1 = levels.getSubMatrix(p - 1, n - 2, 0, k - 1);
        RealMatrix z2 = laggedDifferences(dx, p, effective, k);

        if (specification == CointegrationSpecification.CONST) {
            z0 = StatsUtils.constantDetrendColumns(z0);
            z1 = StatsUtils.constantDetrendColumns(z1);
            z2 = z2 == null ? null : StatsUtils.constantDetrendColumns(z2);
        } else if (specification == CointegrationSpecification.TREND) {
            z2 = appendTrend(z2, effective);
        }
        RealMatrix r0t = StatsUtils.residualize(z0, z2);
        RealMatrix rkt = StatsUtils.residualize(z1, z2);

        RealMatrix s00 = r0t.transpose().multiply(r0t).scalarMultiply(1. / effective);
        RealMatrix s11 = rkt.transpose().multiply(rkt).scalarMultiply(1. / effective);
        RealMatrix s01 = r0t.transpose().multiply(rkt).scalarMultiply(1. / effective);

        RealMatrix lInverse = StatsUtils.inverse(choleskyFactor(s11));
        RealMatrix canonical = lInverse.multiply(s01.transpose()).multiply(StatsUtils.inverse(s00))
                .multiply(s01).multiply(lInverse.transpose());
        canonical = canonical.add(canonical.transpose()).scalarMultiply(0.5);

        List<Pair<Double, RealVector>> pairs = sortedEigenpairs(new EigenDecomposition(canonical));
        double[] eigenvalues = new double[k];
        double[][] eigenvectors = new double[k][k];
        for (int i = 0; i < k; i++) {
            eigenvalues[i] = checkEigenvalue(pairs.get(i).getLeft());
            // normalised so that β' S11 β = I
            RealVector beta = lInverse.transpose().operate(pairs.get(i).getRight());
            for (int row = 0; row < k; row++) {
                eigenvectors[row][i] = beta.getEntry(row);
            }
        }

        double[] maxEigenStatistics = new double[k];
        double[] traceStatistics = new double[k];
        CriticalValues[] traceCriticalValues = new CriticalValues[k];
        CriticalValues[] maxEigenCriticalValues = new CriticalValues[k];
        double cumulative = 0;
        for (int r = k - 1; r >= 0; r--) {
            maxEigenStatistics[r] = -effective * Math.log(1. - eigenvalues[r]);
            cumulative += maxEigenStatistics[r];
            traceStatistics[r] = cumulative;
            traceCriticalValues[r] = JohansenTables.trace(k - r, specification);
            maxEigenCriticalValues[r] = JohansenTables.maxEigenvalue(k - r, specification);
        }
        log.debug("johansen ({}, lag {}) on {} series of {} observations: eigenvalues {}, trace {}",
                specification, p, k, n, Arrays.toString(eigenvalues), Arrays.toString(traceStatistics));
        return new JohansenResult(k, p, specification, n, effective, eigenvalues, eigenvectors,
                traceStatistics, maxEigenStatistics, traceCriticalValues, maxEigenCriticalValues);
    }

    private static RealMatrix laggedDifferences(RealMatrix dx, int p, int rows, int k) {
        if (p == 1) {
            return null;
        }
        RealMatrix block = StatsUtils.zeros(rows, k * (p - 1));
        for (int i = 1; i < p; i++) {
            block.setSubMatrix(StatsUtils.truncateTop(StatsUtils.shiftDown(dx, i), p - 1).getData(), 0, k * (i - 1));
        }
        return block;
    }

    private static RealMatrix appendTrend(RealMatrix regressors, int rows) {
        int existing = regressors == null ? 0 : regressors.getColumnDimension();
        RealMatrix block = StatsUtils.ones(rows, existing + 2);
        if (regressors != null) {
            block.setSubMatrix(regressors.getData(), 0, 0);
        }
        block.setColumn(existing + 1, StatsUtils.fillValues(rows, 1, (row, column) -> row + 1.).getColumn(0));
        return block;
    }

    private static RealMatrix choleskyFactor(RealMatrix s11) {
        double largestDiagonal = 0;
        for (int i = 0; i < s11.getRowDimension(); i++) {
            largestDiagonal = Math.max(largestDiagonal, s11.getEntry(i, i));
        }
        try {
            return new CholeskyDecomposition(s11, 1e-10, 1e-12 * largestDiagonal).getL();
        } catch (MathIllegalArgumentException e) {
            log.debug("lagged level moment matrix is not positive definite: {}", e.getMessage());
            throw new DegenerateSeriesException("series are collinear, lagged level moment matrix is singular", e);
        }
    }

    private static List<Pair<Double, RealVector>> sortedEigenpairs(EigenDecomposition decomposition) {
        double[] values = decomposition.getRealEigenvalues();
        List<Pair<Double, RealVector>> pairs = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            pairs.add(new ImmutablePair<>(values[i], decomposition.getEigenvector(i)));
        }
        pairs.sort((first, second) -> Double.compare(second.getLeft(), first.getLeft()));
        return pairs;
    }

    private static double checkEigenvalue(double value) {
        if (value < 0) {
            if (value < -EIGENVALUE_TOLERANCE) {
                throw new DegenerateSeriesException("negative eigenvalue " + value);
            }
            return 0.;
        }
        if (value >= 1.) {
            throw new DegenerateSeriesException("eigenvalue " + value + " is not below 1, residuals are perfectly correlated");
        }
        return value;
    }
}
