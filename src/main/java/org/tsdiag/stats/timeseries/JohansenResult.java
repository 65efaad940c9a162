package org.tsdiag.stats.timeseries;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealMatrixFormat;
import org.tsdiag.stats.CriticalValues;
import org.tsdiag.stats.SeriesValidation;

import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of the Johansen procedure. Index r of the statistic arrays tests H0: rank ≤ r.
 */
public final class JohansenResult {
    private final int numVariables;
    private final int lag;
    private final CointegrationSpecification specification;
    private final int sampleSize;
    private final int effectiveSampleSize;
    private final double[] eigenvalues;
    private final double[][] eigenvectors;
    private final double[] traceStatistics;
    private final double[] maxEigenStatistics;
    private final CriticalValues[] traceCriticalValues;
    private final CriticalValues[] maxEigenCriticalValues;

    JohansenResult(int numVariables, int lag, CointegrationSpecification specification, int sampleSize,
                   int effectiveSampleSize, double[] eigenvalues, double[][] eigenvectors,
                   double[] traceStatistics, double[] maxEigenStatistics,
                   CriticalValues[] traceCriticalValues, CriticalValues[] maxEigenCriticalValues) {
        this.numVariables = numVariables;
        this.lag = lag;
        this.specification = specification;
        this.sampleSize = sampleSize;
        this.effectiveSampleSize = effectiveSampleSize;
        this.eigenvalues = eigenvalues.clone();
        this.eigenvectors = new double[eigenvectors.length][];
        for (int i = 0; i < eigenvectors.length; i++) {
            this.eigenvectors[i] = eigenvectors[i].clone();
        }
        this.traceStatistics = traceStatistics.clone();
        this.maxEigenStatistics = maxEigenStatistics.clone();
        this.traceCriticalValues = traceCriticalValues.clone();
        this.maxEigenCriticalValues = maxEigenCriticalValues.clone();
    }

    public int getNumVariables() {
        return numVariables;
    }

    public int getLag() {
        return lag;
    }

    public CointegrationSpecification getSpecification() {
        return specification;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getEffectiveSampleSize() {
        return effectiveSampleSize;
    }

    /**
     * Squared canonical correlations, sorted descending.
     */
    public double[] getEigenvalues() {
        return eigenvalues.clone();
    }

    /**
     * Cointegrating vectors in columns, in eigenvalue order.
     */
    public RealMatrix getEigenvectors() {
        return MatrixUtils.createRealMatrix(eigenvectors);
    }

    public double[] getTraceStatistics() {
        return traceStatistics.clone();
    }

    public double[] getMaxEigenStatistics() {
        return maxEigenStatistics.clone();
    }

    public double getTraceStatistic(int rank) {
        checkRank(rank);
        return traceStatistics[rank];
    }

    public double getMaxEigenStatistic(int rank) {
        checkRank(rank);
        return maxEigenStatistics[rank];
    }

    public CriticalValues getTraceCriticalValues(int rank) {
        checkRank(rank);
        return traceCriticalValues[rank];
    }

    public CriticalValues getMaxEigenCriticalValues(int rank) {
        checkRank(rank);
        return maxEigenCriticalValues[rank];
    }

    /**
     * Sequential trace test: the first r whose null is not rejected, or k when all are rejected.
     */
    public int rank(double alpha) {
        SeriesValidation.requireAlpha(alpha);
        for (int r = 0; r < numVariables; r++) {
            if (traceStatistics[r] <= traceCriticalValues[r].forAlpha(alpha)) {
                return r;
            }
        }
        return numVariables;
    }

    /**
     * Same sequence using the maximum eigenvalue statistic.
     */
    public int maxEigenRank(double alpha) {
        SeriesValidation.requireAlpha(alpha);
        for (int r = 0; r < numVariables; r++) {
            if (maxEigenStatistics[r] <= maxEigenCriticalValues[r].forAlpha(alpha)) {
                return r;
            }
        }
        return numVariables;
    }

    public boolean isCointegrated(double alpha) {
        return rank(alpha) > 0;
    }

    public String interpret() {
        return interpret(0.05);
    }

    public String interpret(double alpha) {
        int rank = rank(alpha);
        String level = String.format("%.0f%%", alpha * 100);
        if (rank == 0) {
            return String.format("Fail to reject H0 (r = 0): no cointegration at %s level (trace = %.4f, CV = %.4f)",
                    level, traceStatistics[0], traceCriticalValues[0].forAlpha(alpha));
        }
        if (rank == numVariables) {
            return String.format("Reject H0 for every r < %d at %s level: all series appear stationary in levels",
                    numVariables, level);
        }
        return String.format("Reject H0 (r = 0): cointegration rank %d at %s level (trace = %.4f, CV = %.4f)",
                rank, level, traceStatistics[rank], traceCriticalValues[rank].forAlpha(alpha));
    }

    public String evaluate() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Johansen cointegration test (%s, lag %d)%n", specification, lag));
        sb.append(String.format("Series: %d, sample size: %d, effective sample size: %d%n",
                numVariables, sampleSize, effectiveSampleSize));
        sb.append(String.format("%-8s %-12s %-12s %-12s %-12s %-12s%n", "H0", "eigenvalue", "trace", "5% CV", "max-eigen", "5% CV"));
        for (int r = 0; r < numVariables; r++) {
            sb.append(String.format("r <= %-3d %-12.4f %-12.4f %-12.4f %-12.4f %-12.4f%n", r, eigenvalues[r],
                    traceStatistics[r], traceCriticalValues[r].getFivePercent(),
                    maxEigenStatistics[r], maxEigenCriticalValues[r].getFivePercent()));
        }
        sb.append(String.format("Conclusion: cointegration rank %d at 5%% significance level", rank(0.05)));
        return sb.toString();
    }

    private void checkRank(int rank) {
        if (rank < 0 || rank >= numVariables) {
            throw new IllegalArgumentException("rank must be between 0 and " + (numVariables - 1) + " (got " + rank + ")");
        }
    }

    @Override
    public String toString() {
        Map<String, String> entries = new LinkedHashMap<>();
        RealMatrixFormat toOctave = MatrixUtils.OCTAVE_FORMAT;
        entries.put("specification", specification.toString());
        entries.put("lag", Integer.toString(lag));
        entries.put("observations", Integer.toString(effectiveSampleSize));
        entries.put("eigenvalues", Arrays.toString(eigenvalues));
        entries.put("eigenvectors", toOctave.format(getEigenvectors()));
        entries.put("trace", Arrays.toString(traceStatistics));
        entries.put("maxEigen", Arrays.toString(maxEigenStatistics));
        entries.put("cvt", Arrays.toString(traceCriticalValues));
        entries.put("cvm", Arrays.toString(maxEigenCriticalValues));

        StringBuilder sb = new StringBuilder("Johansen Cointegration Test\n");
        Iterator<String> iter = entries.keySet().iterator();
        while (iter.hasNext()) {
            String key = iter.next();
            sb.append(key).append('=').append('"').append(entries.get(key)).append('"');
            if (iter.hasNext()) {
                sb.append(',').append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JohansenResult that = (JohansenResult) o;
        return numVariables == that.numVariables
                && lag == that.lag
                && sampleSize == that.sampleSize
                && effectiveSampleSize == that.effectiveSampleSize
                && specification == that.specification
                && Arrays.equals(eigenvalues, that.eigenvalues)
                && Arrays.deepEquals(eigenvectors, that.eigenvectors)
                && Arrays.equals(traceStatistics, that.traceStatistics)
                && Arrays.equals(maxEigenStatistics, that.maxEigenStatistics);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(numVariables, lag, specification, sampleSize, effectiveSampleSize);
        result = 31 * result + Arrays.hashCode(eigenvalues);
        result = 31 * result + Arrays.hashCode(traceStatistics);
        return result;
    }
}
