package com.edgehistogram.server.descriptor;

/**
 * Aggregates block histograms over rectangular block ranges.
 *
 * Region sums are normalized by cellsPerBlock * blocksInRegion. The per-block
 * vector is normalized by cellsPerBlock alone.
 */
public final class RegionAggregator {

    private static final int BINS = EdgeOrientation.BIN_COUNT;

    private RegionAggregator() {
    }

    /**
     * Sums the histograms of blocks in rows [fromRow, toRow] and columns
     * [fromCol, toCol], both inclusive.
     */
    public static double[] sumRegion(BlockGrid grid, int fromRow, int toRow, int fromCol, int toCol,
            boolean normalize) {
        if (fromRow < 0 || toRow >= grid.getRows() || fromRow > toRow
                || fromCol < 0 || toCol >= grid.getColumns() || fromCol > toCol) {
            throw new IllegalArgumentException("Region rows [" + fromRow + ", " + toRow + "] cols [" + fromCol
                    + ", " + toCol + "] outside " + grid.getRows() + "x" + grid.getColumns() + " grid");
        }

        double[] sum = new double[BINS];
        for (int y = fromRow; y <= toRow; y++) {
            for (int x = fromCol; x <= toCol; x++) {
                for (int b = 0; b < BINS; b++) {
                    sum[b] += grid.count(y, x, b);
                }
            }
        }

        if (normalize) {
            int blocks = (toRow - fromRow + 1) * (toCol - fromCol + 1);
            double denom = (double) grid.getCellsPerBlock() * blocks;
            for (int b = 0; b < BINS; b++) {
                sum[b] /= denom;
            }
        }
        return sum;
    }

    public static double[] globalBins(BlockGrid grid, boolean normalize) {
        return sumRegion(grid, 0, grid.getRows() - 1, 0, grid.getColumns() - 1, normalize);
    }

    public static double[] semiLocalBins(BlockGrid grid, boolean normalize) {
        int rows = grid.getRows();
        int cols = grid.getColumns();
        double[] out = new double[(rows + cols + 5) * BINS];
        int pos = 0;

        // 1. Row bands
        for (int y = 0; y < rows; y++) {
            pos = append(out, pos, sumRegion(grid, y, y, 0, cols - 1, normalize));
        }

        // 2. Column bands
        for (int x = 0; x < cols; x++) {
            pos = append(out, pos, sumRegion(grid, 0, rows - 1, x, x, normalize));
        }

        int halfRows = rows / 2;
        int halfCols = cols / 2;

        // 3. Quadrants: upper-left, upper-right, lower-left, lower-right
        pos = append(out, pos, sumRegion(grid, 0, halfRows - 1, 0, halfCols - 1, normalize));
        pos = append(out, pos, sumRegion(grid, 0, halfRows - 1, halfCols, cols - 1, normalize));
        pos = append(out, pos, sumRegion(grid, halfRows, rows - 1, 0, halfCols - 1, normalize));
        pos = append(out, pos, sumRegion(grid, halfRows, rows - 1, halfCols, cols - 1, normalize));

        // 4. Center
        pos = append(out, pos, sumRegion(grid, rows / 4, rows * 3 / 4 - 1, cols / 4, cols * 3 / 4 - 1, normalize));

        return out;
    }

    public static double[] blocksBins(BlockGrid grid, boolean normalize) {
        int rows = grid.getRows();
        int cols = grid.getColumns();
        double[] out = new double[rows * cols * BINS];
        double denom = grid.getCellsPerBlock();

        int idx = 0;
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                for (int b = 0; b < BINS; b++) {
                    double v = grid.count(y, x, b);
                    out[idx++] = normalize ? v / denom : v;
                }
            }
        }
        return out;
    }

    private static int append(double[] out, int pos, double[] bins) {
        System.arraycopy(bins, 0, out, pos, bins.length);
        return pos + bins.length;
    }
}
