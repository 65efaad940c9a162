package org.tsdiag.stats.timeseries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Embedding parameters for convergent cross mapping. {@code null} library sizes are derived from the series length.
 */
public final class CcmOptions {
    public static final int DEFAULT_EMBEDDING_DIMENSION = 3;
    public static final int DEFAULT_TIME_LAG = 1;

    private final int embeddingDimension;
    private final int timeLag;
    private final List<Integer> librarySizes;

    private CcmOptions(int embeddingDimension, int timeLag, List<Integer> librarySizes) {
        if (embeddingDimension < 1) {
            throw new IllegalArgumentException("Embedding dimension E must be at least 1 (got " + embeddingDimension + ")");
        }
        if (timeLag < 1) {
            throw new IllegalArgumentException("Time delay tau must be at least 1 (got " + timeLag + ")");
        }
        if (librarySizes != null) {
            for (Integer size : librarySizes) {
                if (size == null) {
                    throw new IllegalArgumentException("library sizes cannot contain null");
                }
            }
        }
        this.embeddingDimension = embeddingDimension;
        this.timeLag = timeLag;
        this.librarySizes = librarySizes == null || librarySizes.isEmpty()
                ? null : Collections.unmodifiableList(new ArrayList<>(librarySizes));
    }

    public static CcmOptions defaults() {
        return new CcmOptions(DEFAULT_EMBEDDING_DIMENSION, DEFAULT_TIME_LAG, null);
    }

    public static CcmOptions of(int embeddingDimension, int timeLag) {
        return new CcmOptions(embeddingDimension, timeLag, null);
    }

    public static CcmOptions of(int embeddingDimension, int timeLag, List<Integer> librarySizes) {
        return new CcmOptions(embeddingDimension, timeLag, librarySizes);
    }

    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    public int getTimeLag() {
        return timeLag;
    }

    /**
     * @return the requested library sizes, or {@code null} for the defaults
     */
    public List<Integer> getLibrarySizes() {
        return librarySizes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CcmOptions that = (CcmOptions) o;
        return embeddingDimension == that.embeddingDimension
                && timeLag == that.timeLag
                && Objects.equals(librarySizes, that.librarySizes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(embeddingDimension, timeLag, librarySizes);
    }

    @Override
    public String toString() {
        return "CcmOptions{E=" + embeddingDimension + ", tau=" + timeLag
                + ", librarySizes=" + (librarySizes == null ? "auto" : librarySizes) + '}';
    }
}
