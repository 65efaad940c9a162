package org.tsdiag.stats.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.tsdiag.stats.SeriesValidation;

import java.util.ArrayList;
import java.util.List;

/**
 * Convergent cross mapping (Sugihara et al., 2012).
 *
 * Each series is embedded in delay coordinates (s_t, s_{t+τ}, ..., s_{t+(E-1)τ}). For a library made of the first L
 * embedded points, every embedded point is predicted by simplex projection from its E+1 nearest library neighbours
 * on the other series' manifold; the cross-map skill is the Pearson correlation of predictions and actual values.
 * If x drives y, the shadow manifold of y carries information about x, so skill of x estimated from y rising with L
 * is evidence for x → y.
 */
@Slf4j
public class Ccm {
    /** Observations required on top of E * tau. */
    public static final int EXTRA_OBSERVATIONS = 11;
    public static final int DEFAULT_LIBRARY_STEPS = 5;

    private Ccm() {
    }

    public static CcmResult test(double[] x, double[] y) {
        return test(x, y, CcmOptions.defaults());
    }

    public static CcmResult test(double[] x, double[] y, int embeddingDimension, int timeLag) {
        return test(x, y, CcmOptions.of(embeddingDimension, timeLag));
    }

    public static CcmResult test(double[] x, double[] y, int embeddingDimension, int timeLag, List<Integer> librarySizes) {
        return test(x, y, CcmOptions.of(embeddingDimension, timeLag, librarySizes));
    }

    public static CcmResult test(double[] x, double[] y, CcmOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (x == null || y == null) {
            throw new IllegalArgumentException("Time series cannot be null");
        }
        SeriesValidation.requireSameLength(x, y);
        int n = x.length;
        int e = options.getEmbeddingDimension();
        int tau = options.getTimeLag();
        int minimum = e * tau + EXTRA_OBSERVATIONS;
        if (n < minimum) {
            throw new IllegalArgumentException("Need at least " + minimum + " observations for E=" + e + ", tau=" + tau + " (got " + n + ")");
        }
        int maxLibrary = embeddedLength(n, e, tau);
        List<Integer> librarySizes = options.getLibrarySizes() == null
                ? defaultLibrarySizes(n, e, tau) : options.getLibrarySizes();
        for (int size : librarySizes) {
            if (size < e + 1) {
                throw new IllegalArgumentException("Library size must be at least E+1 = " + (e + 1) + " (got " + size + ")");
            }
            if (size > maxLibrary) {
                throw new IllegalArgumentException("Library size " + size + " too large (max: " + maxLibrary + " for n=" + n + ", E=" + e + ", tau=" + tau + ")");
            }
        }
        SeriesValidation.requireSeries(x, "x", minimum);
        SeriesValidation.requireSeries(y, "y", minimum);

        double[][] manifoldX = embed(x, e, tau);
        double[][] manifoldY = embed(y, e, tau);
        int offset = (e - 1) * tau;
        double[] xFromY = new double[librarySizes.size()];
        double[] yFromX = new double[librarySizes.size()];
        for (int i = 0; i < librarySizes.size(); i++) {
            int size = librarySizes.get(i);
            xFromY[i] = crossMap(manifoldY, x, offset, size, e + 1);
            yFromX[i] = crossMap(manifoldX, y, offset, size, e + 1);
        }
        log.debug("ccm with E {}, tau {} on {} observations: x|M(y) {}, y|M(x) {}", e, tau, n,
                xFromY[xFromY.length - 1], yFromX[yFromX.length - 1]);
        return new CcmResult(xFromY, yFromX, librarySizes, e, tau, n);
    }

    static int embeddedLength(int n, int embeddingDimension, int timeLag) {
        return n - (embeddingDimension - 1) * timeLag;
    }

    /**
     * From E+1 to the number of embedded points in at most {@value #DEFAULT_LIBRARY_STEPS} steps, the maximum always
     * included.
     */
    static List<Integer> defaultLibrarySizes(int n, int embeddingDimension, int timeLag) {
        int maxLibrary = embeddedLength(n, embeddingDimension, timeLag);
        int minLibrary = embeddingDimension + 1;
        int step = Math.max(1, (maxLibrary - minLibrary) / DEFAULT_LIBRARY_STEPS);
        List<Integer> sizes = new ArrayList<>();
        for (int size = minLibrary; size <= maxLibrary; size += step) {
            sizes.add(size);
        }
        if (sizes.get(sizes.size() - 1) != maxLibrary) {
            sizes.add(maxLibrary);
        }
        return sizes;
    }

    static double[][] embed(double[] series, int embeddingDimension, int timeLag) {
        int points = embeddedLength(series.length, embeddingDimension, timeLag);
        double[][] manifold = new double[points][embeddingDimension];
        for (int t = 0; t < points; t++) {
            for (int d = 0; d < embeddingDimension; d++) {
                manifold[t][d] = series[t + d * timeLag];
            }
        }
        return manifold;
    }

    /**
     * Skill of predicting {@code target} from {@code manifold} with the first {@code librarySize} points as library.
     */
    static double crossMap(double[][] manifold, double[] target, int offset, int librarySize, int neighbours) {
        double[] predicted = new double[manifold.length];
        double[] actual = new double[manifold.length];
        for (int t = 0; t < manifold.length; t++) {
            predicted[t] = simplexProjection(nearestNeighbours(manifold, t, librarySize, neighbours), target, offset);
            actual[t] = target[t + offset];
        }
        return skill(predicted, actual);
    }

    /**
     * Library points sorted by distance to point {@code query}, itself excluded; equal distances keep index order.
     */
    static List<Pair<Integer, Double>> nearestNeighbours(double[][] manifold, int query, int librarySize, int count) {
        List<Pair<Integer, Double>> candidates = new ArrayList<>();
        for (int index = 0; index < librarySize; index++) {
            if (index != query) {
                candidates.add(new ImmutablePair<>(index, distance(manifold[query], manifold[index])));
            }
        }
        candidates.sort((first, second) -> Double.compare(first.getRight(), second.getRight()));
        return candidates.subList(0, Math.min(count, candidates.size()));
    }

    static double simplexProjection(List<Pair<Integer, Double>> neighbours, double[] target, int offset) {
        double nearest = neighbours.get(0).getRight();
        double[] weights = new double[neighbours.size()];
        double weightSum = 0;
        for (int i = 0; i < neighbours.size(); i++) {
            double d = neighbours.get(i).getRight();
            if (nearest > 0) {
                weights[i] = Math.exp(-d / nearest);
            } else {
                // only exact matches count when the nearest neighbour coincides with the query
                weights[i] = d == 0 ? 1. : 0.;
            }
            weightSum += weights[i];
        }
        double prediction = 0;
        for (int i = 0; i < neighbours.size(); i++) {
            prediction += weights[i] / weightSum * target[neighbours.get(i).getLeft() + offset];
        }
        return prediction;
    }

    static double skill(double[] predicted, double[] actual) {
        if (SeriesValidation.isConstant(predicted) || SeriesValidation.isConstant(actual)) {
            return 0.;
        }
        return new PearsonsCorrelation().correlation(predicted, actual);
    }

    private static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double difference = a[i] - b[i];
            sum += difference * difference;
        }
        return Math.sqrt(sum);
    }
}
