package com.edgehistogram.server.descriptor;

/**
 * Edge class assigned to a 2x2 cell. Every orientation except {@link #NONE}
 * owns one histogram bin.
 */
public enum EdgeOrientation {
    NONE(-1),
    VERTICAL(0),
    HORIZONTAL(1),
    DIAGONAL_45(2),
    DIAGONAL_135(3),
    NONDIRECTIONAL(4);

    public static final int BIN_COUNT = 5;

    private final int binIndex;

    EdgeOrientation(int binIndex) {
        this.binIndex = binIndex;
    }

    public int getBinIndex() {
        return binIndex;
    }

    public boolean isEdge() {
        return binIndex >= 0;
    }

    public static EdgeOrientation fromBinIndex(int binIndex) {
        for (EdgeOrientation o : values()) {
            if (o.binIndex == binIndex) {
                return o;
            }
        }
        throw new IllegalArgumentException("No orientation for bin index " + binIndex);
    }
}
