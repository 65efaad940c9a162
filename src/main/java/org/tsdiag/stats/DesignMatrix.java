package org.tsdiag.stats;

import java.util.ArrayList;
import java.util.List;

/**
 * Column-wise builder for regression design matrices.
 */
public class DesignMatrix {
    private final int rows;
    private final List<double[]> columns = new ArrayList<>();

    public DesignMatrix(int rows) {
        this.rows = rows;
    }

    public DesignMatrix intercept() {
        return column(StatsUtils.ones(rows, 1).getColumn(0));
    }

    /**
     * Adds a trend column {@code start, start + 1, ...}.
     */
    public DesignMatrix trend(double start) {
        return column(StatsUtils.fillValues(rows, 1, (row, column) -> start + row).getColumn(0));
    }

    public DesignMatrix deterministic(Specification specification) {
        if (specification.hasIntercept()) {
            intercept();
        }
        if (specification.hasTrend()) {
            trend(1.);
        }
        return this;
    }

    public DesignMatrix column(double[] values) {
        if (values.length != rows) {
            throw new IllegalArgumentException("column has " + values.length + " entries, expected " + rows);
        }
        columns.add(values.clone());
        return this;
    }

    /**
     * Adds {@code source[offset + row]} for each row.
     */
    public DesignMatrix slice(double[] source, int offset) {
        return column(StatsUtils.fillValues(rows, 1, (row, column) -> source[offset + row]).getColumn(0));
    }

    public int columnCount() {
        return columns.size();
    }

    public double[][] build() {
        double[][] data = new double[rows][columns.size()];
        for (int column = 0; column < columns.size(); column++) {
            double[] values = columns.get(column);
            for (int row = 0; row < rows; row++) {
                data[row][column] = values[row];
            }
        }
        return data;
    }
}
