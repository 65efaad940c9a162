package org.tsdiag.stats;

/**
 * Raised when a numerically degenerate input (rank-deficient design, perfect fit, singular covariance)
 * would otherwise produce a meaningless statistic.
 */
public class DegenerateSeriesException extends IllegalArgumentException {

    public DegenerateSeriesException(String message) {
        super(message);
    }

    public DegenerateSeriesException(String message, Throwable cause) {
        super(message, cause);
    }
}
