package org.tsdiag.stats.timeseries;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Cross-map skill curves of a CCM run, one entry per library size.
 */
public final class CcmResult {
    public static final double DEFAULT_THRESHOLD = 0.3;

    private final double[] xFromY;
    private final double[] yFromX;
    private final List<Integer> librarySizes;
    private final int embeddingDimension;
    private final int timeLag;
    private final int seriesLength;

    CcmResult(double[] xFromY, double[] yFromX, List<Integer> librarySizes, int embeddingDimension, int timeLag,
              int seriesLength) {
        this.xFromY = xFromY.clone();
        this.yFromX = yFromX.clone();
        this.librarySizes = Collections.unmodifiableList(new ArrayList<>(librarySizes));
        this.embeddingDimension = embeddingDimension;
        this.timeLag = timeLag;
        this.seriesLength = seriesLength;
    }

    /**
     * Skill of estimating x from the shadow manifold of y. Convergence is evidence that x drives y.
     */
    public double[] getXFromY() {
        return xFromY.clone();
    }

    /**
     * Skill of estimating y from the shadow manifold of x. Convergence is evidence that y drives x.
     */
    public double[] getYFromX() {
        return yFromX.clone();
    }

    public List<Integer> getLibrarySizes() {
        return librarySizes;
    }

    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    public int getTimeLag() {
        return timeLag;
    }

    public int getSeriesLength() {
        return seriesLength;
    }

    public boolean xCausesY() {
        return xCausesY(DEFAULT_THRESHOLD);
    }

    /**
     * Skill at the largest library above {@code threshold} and above the skill at the smallest one.
     */
    public boolean xCausesY(double threshold) {
        return converges(xFromY, threshold);
    }

    public boolean yCausesX() {
        return yCausesX(DEFAULT_THRESHOLD);
    }

    public boolean yCausesX(double threshold) {
        return converges(yFromX, threshold);
    }

    private static boolean converges(double[] skills, double threshold) {
        if (skills.length < 2) {
            return false;
        }
        double last = skills[skills.length - 1];
        return last > threshold && last > skills[0];
    }

    public String interpret() {
        String rule = StringUtils.repeat('-', 60);
        StringBuilder sb = new StringBuilder();
        sb.append("Convergent Cross Mapping Results:\n");
        sb.append(StringUtils.repeat('=', 60)).append("\n\n");
        sb.append("Configuration:\n");
        sb.append("  Embedding dimension (E): ").append(embeddingDimension).append('\n');
        sb.append("  Time lag (tau): ").append(timeLag).append('\n');
        sb.append("  Series length: ").append(seriesLength).append('\n');
        sb.append("  Library sizes: ").append(StringUtils.join(librarySizes, ", ")).append("\n\n");

        sb.append("Cross-map Skills:\n").append(rule).append('\n');
        sb.append(String.format("%-15s %-20s %-20s%n", "Library Size", "X|M(Y) (X→Y)", "Y|M(X) (Y→X)"));
        sb.append(rule).append('\n');
        for (int i = 0; i < librarySizes.size(); i++) {
            sb.append(String.format("%-15d %-20.4f %-20.4f%n", librarySizes.get(i), xFromY[i], yFromX[i]));
        }

        sb.append("\nInterpretation:\n").append(rule).append('\n');
        boolean xToY = xCausesY();
        boolean yToX = yCausesX();
        if (xToY && yToX) {
            sb.append("Bidirectional causality: X and Y appear to causally influence each other\n");
        } else if (xToY) {
            sb.append("Unidirectional causality: X appears to causally drive Y\n");
        } else if (yToX) {
            sb.append("Unidirectional causality: Y appears to causally drive X\n");
        } else {
            sb.append("No clear causal relationship detected\n");
        }
        sb.append("\nPositive cross-map skill increasing with library size indicates causal influence.\n");
        return sb.toString();
    }

    /**
     * One-line verdict with a custom skill threshold.
     */
    public String interpret(double threshold) {
        boolean xToY = xCausesY(threshold);
        boolean yToX = yCausesX(threshold);
        if (xToY && yToX) {
            return "Bidirectional causality (skill threshold " + threshold + ")";
        } else if (xToY) {
            return "X appears to causally drive Y (skill threshold " + threshold + ")";
        } else if (yToX) {
            return "Y appears to causally drive X (skill threshold " + threshold + ")";
        }
        return "No clear causal relationship detected (skill threshold " + threshold + ")";
    }

    public String evaluate() {
        int last = librarySizes.size() - 1;
        return String.format("Convergent Cross Mapping test:%n"
                        + "E = %d, tau = %d, series length: %d%n"
                        + "Library sizes: %d to %d (%d sizes)%n"
                        + "Skill X|M(Y): %.4f to %.4f%n"
                        + "Skill Y|M(X): %.4f to %.4f%n"
                        + "Conclusion: X drives Y: %s, Y drives X: %s",
                embeddingDimension, timeLag, seriesLength, librarySizes.get(0), librarySizes.get(last),
                librarySizes.size(), xFromY[0], xFromY[last], yFromX[0], yFromX[last], xCausesY(), yCausesX());
    }

    @Override
    public String toString() {
        return interpret();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CcmResult that = (CcmResult) o;
        return embeddingDimension == that.embeddingDimension
                && timeLag == that.timeLag
                && seriesLength == that.seriesLength
                && Arrays.equals(xFromY, that.xFromY)
                && Arrays.equals(yFromX, that.yFromX)
                && librarySizes.equals(that.librarySizes);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(librarySizes, embeddingDimension, timeLag, seriesLength);
        result = 31 * result + Arrays.hashCode(xFromY);
        result = 31 * result + Arrays.hashCode(yFromX);
        return result;
    }
}
