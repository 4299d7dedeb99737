package com.edgehistogram.server.descriptor;

/**
 * Immutable descriptor configuration. Block counts are checked when the block
 * grid is computed, not here.
 */
public final class EhdConfig {
    public static final double DEFAULT_THRESHOLD = 50.0;
    public static final boolean DEFAULT_NORMALIZE = false;
    public static final int DEFAULT_BLOCK_COUNT = 4;

    private final double threshold;
    private final boolean normalize;
    private final int horizontalBlockCount;
    private final int verticalBlockCount;

    public EhdConfig(double threshold, boolean normalize, int horizontalBlockCount, int verticalBlockCount) {
        if (Double.isNaN(threshold) || threshold < 0) {
            throw new IllegalArgumentException("threshold must be a non-negative number, got " + threshold);
        }
        this.threshold = threshold;
        this.normalize = normalize;
        this.horizontalBlockCount = horizontalBlockCount;
        this.verticalBlockCount = verticalBlockCount;
    }

    public static EhdConfig defaults() {
        return new EhdConfig(DEFAULT_THRESHOLD, DEFAULT_NORMALIZE, DEFAULT_BLOCK_COUNT, DEFAULT_BLOCK_COUNT);
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isNormalize() {
        return normalize;
    }

    public int getHorizontalBlockCount() {
        return horizontalBlockCount;
    }

    public int getVerticalBlockCount() {
        return verticalBlockCount;
    }

    public EhdConfig withThreshold(double threshold) {
        return new EhdConfig(threshold, normalize, horizontalBlockCount, verticalBlockCount);
    }

    public EhdConfig withNormalize(boolean normalize) {
        return new EhdConfig(threshold, normalize, horizontalBlockCount, verticalBlockCount);
    }

    public EhdConfig withBlockCounts(int horizontalBlockCount, int verticalBlockCount) {
        return new EhdConfig(threshold, normalize, horizontalBlockCount, verticalBlockCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EhdConfig))
            return false;
        EhdConfig other = (EhdConfig) o;
        return Double.compare(threshold, other.threshold) == 0
                && normalize == other.normalize
                && horizontalBlockCount == other.horizontalBlockCount
                && verticalBlockCount == other.verticalBlockCount;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(threshold);
        result = 31 * result + Boolean.hashCode(normalize);
        result = 31 * result + horizontalBlockCount;
        result = 31 * result + verticalBlockCount;
        return result;
    }

    @Override
    public String toString() {
        return "EhdConfig{t=" + threshold + ", n=" + normalize + ", h=" + horizontalBlockCount
                + ", v=" + verticalBlockCount + "}";
    }
}
