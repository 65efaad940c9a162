package org.tsdiag.stats.timeseries;

import org.tsdiag.stats.DesignMatrix;
import org.tsdiag.stats.OrdinaryLeastSquares;
import org.tsdiag.stats.RegressionFit;
import org.tsdiag.stats.Specification;
import org.tsdiag.stats.StatsUtils;

/**
 * The Dickey-Fuller regression shared by the unit-root family:
 * Δy_t on [deterministic terms, y_{t-1}, Δy_{t-1} ... Δy_{t-lag}].
 */
final class AdfRegression {
    static final int MAX_AUTO_LAG = 10;

    private final RegressionFit fit;
    private final int levelIndex;

    private AdfRegression(RegressionFit fit, int levelIndex) {
        this.fit = fit;
        this.levelIndex = levelIndex;
    }

    static AdfRegression run(double[] data, int lag, Specification specification) {
        double[] dy = StatsUtils.diff(data);
        int rows = dy.length - lag;
        DesignMatrix design = new DesignMatrix(rows).deterministic(specification);
        int levelIndex = design.columnCount();
        design.slice(data, lag);
        for (int i = 1; i <= lag; i++) {
            design.slice(dy, lag - i);
        }
        double[] response = slice(dy, lag, rows);
        return new AdfRegression(OrdinaryLeastSquares.fit(response, design.build()), levelIndex);
    }

    private static double[] slice(double[] source, int offset, int length) {
        double[] output = new double[length];
        System.arraycopy(source, offset, output, 0, length);
        return output;
    }

    /**
     * min(10, floor((n - 1)^(1/3))), the rule used by R's tseries adf.test.
     */
    static int autoLag(int n) {
        int lag = (int) Math.floor(Math.cbrt(n - 1) + 1e-9);
        return Math.min(MAX_AUTO_LAG, lag);
    }

    static int maxLag(int n) {
        return n / 3;
    }

    /**
     * Validates an explicit lag and leaves at least one residual degree of freedom.
     */
    static void checkLag(int n, int lag, Specification specification) {
        if (lag < 0) {
            throw new IllegalArgumentException("lag must be non-negative (got " + lag + ")");
        }
        if (lag > maxLag(n)) {
            throw new IllegalArgumentException("lag must be at most n/3 = " + maxLag(n) + " (got " + lag + ")");
        }
        int rows = n - 1 - lag;
        int regressors = specification.deterministicColumns() + 1 + lag;
        if (rows - regressors < 1) {
            throw new IllegalArgumentException("lag " + lag + " leaves no residual degrees of freedom for " + n + " observations");
        }
    }

    /**
     * Largest admissible lag not above the automatic choice.
     */
    static int resolveLag(int n, Integer lag, Specification specification) {
        if (lag != null) {
            checkLag(n, lag, specification);
            return lag;
        }
        int candidate = Math.min(autoLag(n), maxLag(n));
        while (candidate > 0 && (n - 1 - candidate) - (specification.deterministicColumns() + 1 + candidate) < 1) {
            candidate--;
        }
        return candidate;
    }

    double gamma() {
        return fit.coefficient(levelIndex);
    }

    double standardError() {
        return fit.standardError(levelIndex);
    }

    double statistic() {
        return fit.tStatistic(levelIndex);
    }
}
