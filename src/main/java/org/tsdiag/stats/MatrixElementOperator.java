package org.tsdiag.stats;

/**
 * Computes the value of a single matrix entry from its position.
 */
public interface MatrixElementOperator {
    double compute(int row, int column);
}
