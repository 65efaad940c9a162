package org.tsdiag.stats;

/**
 * A tabular data container able to hand out a named numeric column.
 * Implementations own the conversion from their storage types to {@code double}.
 */
public interface NumericColumnSource {

    /**
     * @throws IllegalArgumentException when no column of that name exists or it is not numeric
     */
    double[] column(String name);
}
