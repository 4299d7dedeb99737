package com.edgehistogram.server.descriptor;

/**
 * Raw (un-normalized) orientation histograms of every block, row-major.
 */
public final class BlockGrid {
    // [blockRow][blockCol][bin] -> cell count
    private final int[][][] bins;
    private final int blockWidth;
    private final int blockHeight;

    BlockGrid(int[][][] bins, int blockWidth, int blockHeight) {
        this.bins = bins;
        this.blockWidth = blockWidth;
        this.blockHeight = blockHeight;
    }

    public int getRows() {
        return bins.length;
    }

    public int getColumns() {
        return bins[0].length;
    }

    public int getBlockWidth() {
        return blockWidth;
    }

    public int getBlockHeight() {
        return blockHeight;
    }

    public int getCellsPerBlock() {
        return (blockWidth / 2) * (blockHeight / 2);
    }

    public int count(int blockRow, int blockCol, int bin) {
        return bins[blockRow][blockCol][bin];
    }

    public int[] histogram(int blockRow, int blockCol) {
        return bins[blockRow][blockCol].clone();
    }
}
