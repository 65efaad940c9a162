package org.tsdiag.stats;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.StatUtils;

import java.util.Arrays;

/**
 * Matrix and series helpers shared by the diagnostic tests.
 */
public class StatsUtils {

    private StatsUtils() {
    }

    public static RealMatrix zeros(int rowDimension, int columnDimension) {
        return MatrixUtils.createRealMatrix(rowDimension, columnDimension);
    }

    public static RealMatrix ones(int rowDimension, int columnDimension) {
        return fillValues(rowDimension, columnDimension, (row, column) -> 1.);
    }

    public static RealMatrix fillValues(int rowDimension, int columnDimension, MatrixElementOperator operator) {
        RealMatrix matrix = MatrixUtils.createRealMatrix(rowDimension, columnDimension);
        for (int row = 0; row < rowDimension; row++) {
            for (int column = 0; column < columnDimension; column++) {
                matrix.setEntry(row, column, operator.compute(row, column));
            }
        }
        return matrix;
    }

    public static double[] columnMeans(RealMatrix matrix) {
        RealMatrix ones = StatsUtils.ones(1, matrix.getRowDimension());
        RealMatrix sums = ones.multiply(matrix);
        return sums.scalarMultiply(1. / matrix.getRowDimension()).getRow(0);
    }

    public static RealMatrix constantDetrendColumns(RealMatrix matrix) {
        RealMatrix output = matrix.copy();
        double[] means = columnMeans(matrix);
        for (int row = 0; row < output.getRowDimension(); row++) {
            for (int column = 0; column < output.getColumnDimension(); column++) {
                output.setEntry(row, column, output.getEntry(row, column) - means[column]);
            }
        }
        return output;
    }

    /**
     * Removes the least-squares fit of the columns of {@code regressors} from every column of {@code matrix}.
     * An empty regressor block leaves the matrix unchanged.
     */
    public static RealMatrix residualize(RealMatrix matrix, RealMatrix regressors) {
        if (regressors == null || regressors.getColumnDimension() == 0) {
            return matrix.copy();
        }
        RealMatrix output = matrix.copy();
        for (int column = 0; column < matrix.getColumnDimension(); column++) {
            RegressionFit fit = OrdinaryLeastSquares.fit(matrix.getColumn(column), regressors.getData());
            output.setColumn(column, fit.getResiduals());
        }
        return output;
    }

    /**
     * Row differences: output row i is {@code matrix[i + 1] - matrix[i]}, one row shorter than the input.
     */
    public static RealMatrix diffRows(RealMatrix matrix) {
        RealMatrix upper = truncateTop(matrix, 1);
        RealMatrix lower = matrix.getSubMatrix(0, matrix.getRowDimension() - 2, 0, matrix.getColumnDimension() - 1);
        return upper.subtract(lower);
    }

    public static RealMatrix truncateTop(RealMatrix matrix, int count) {
        if (count >= matrix.getRowDimension() || count < 0) {
            throw new IndexOutOfBoundsException("position " + count + " not allowed for number of rows: " + matrix.getRowDimension());
        }
        double[][] data = matrix.getData();
        return MatrixUtils.createRealMatrix(Arrays.copyOfRange(data, count, data.length));
    }

    public static RealMatrix shiftDown(RealMatrix matrix, int lag) {
        double[][] data = matrix.getData();
        double[][] output = new double[data.length][];
        for (int row = lag; row < output.length; row++) {
            output[row] = data[row - lag];
        }
        for (int row = 0; row < lag; row++) {
            output[row] = new double[matrix.getColumnDimension()];
        }
        return MatrixUtils.createRealMatrix(output);
    }

    /**
     * @throws DegenerateSeriesException when the matrix is singular
     */
    public static RealMatrix inverse(RealMatrix matrix) {
        try {
            LUDecomposition decomposition = new LUDecomposition(matrix);
            DecompositionSolver solver = decomposition.getSolver();
            return solver.getInverse();
        } catch (SingularMatrixException e) {
            throw new DegenerateSeriesException("matrix is singular", e);
        }
    }

    public static RealMatrix columnsOf(double[]... columns) {
        RealMatrix matrix = zeros(columns[0].length, columns.length);
        for (int column = 0; column < columns.length; column++) {
            matrix.setColumn(column, columns[column]);
        }
        return matrix;
    }

    public static double[] diff(double[] values) {
        double[] output = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            output[i - 1] = values[i] - values[i - 1];
        }
        return output;
    }

    public static double sumOfSquares(double[] values) {
        return StatUtils.sumSq(values);
    }

    public static double range(double[] values) {
        return StatUtils.max(values) - StatUtils.min(values);
    }
}
