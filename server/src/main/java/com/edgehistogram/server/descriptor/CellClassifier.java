package com.edgehistogram.server.descriptor;

/**
 * Classifies a 2x2 cell by correlating it with five fixed edge kernels.
 *
 * The vote of a kernel is |sum(cell .* kernel)|. The strongest vote wins, the
 * first kernel in table order wins a tie, and a winning vote below the
 * threshold means no edge.
 */
public final class CellClassifier {

    private static final double SQRT2 = Math.sqrt(2.0);

    // {top-left, top-right, bottom-left, bottom-right}, in bin order
    private static final double[][] KERNELS = {
            { 1, -1, 1, -1 }, // vertical
            { 1, 1, -1, -1 }, // horizontal
            { SQRT2, 0, 0, -SQRT2 }, // 45 degree diagonal
            { 0, SQRT2, -SQRT2, 0 }, // 135 degree diagonal
            { 2, -2, -2, 2 } // non-directional
    };

    private CellClassifier() {
    }

    public static EdgeOrientation classify(double[][] cell, double threshold) {
        checkCell(cell);
        return classify(cell[0][0], cell[0][1], cell[1][0], cell[1][1], threshold);
    }

    public static EdgeOrientation classify(double topLeft, double topRight, double bottomLeft, double bottomRight,
            double threshold) {
        int best = 0;
        double bestVote = Double.NEGATIVE_INFINITY;
        for (int k = 0; k < KERNELS.length; k++) {
            double vote = vote(KERNELS[k], topLeft, topRight, bottomLeft, bottomRight);
            // strict comparison keeps the earliest kernel on ties
            if (vote > bestVote) {
                bestVote = vote;
                best = k;
            }
        }
        if (bestVote < threshold) {
            return EdgeOrientation.NONE;
        }
        return EdgeOrientation.fromBinIndex(best);
    }

    /**
     * Returns the five kernel votes for the cell, in bin order.
     */
    public static double[] votes(double[][] cell) {
        checkCell(cell);
        double[] votes = new double[KERNELS.length];
        for (int k = 0; k < KERNELS.length; k++) {
            votes[k] = vote(KERNELS[k], cell[0][0], cell[0][1], cell[1][0], cell[1][1]);
        }
        return votes;
    }

    private static double vote(double[] kernel, double topLeft, double topRight, double bottomLeft,
            double bottomRight) {
        return Math.abs(kernel[0] * topLeft + kernel[1] * topRight + kernel[2] * bottomLeft
                + kernel[3] * bottomRight);
    }

    private static void checkCell(double[][] cell) {
        if (cell == null || cell.length != 2 || cell[0] == null || cell[0].length != 2 || cell[1] == null
                || cell[1].length != 2) {
            throw new IllegalArgumentException("Cell must be a 2x2 matrix");
        }
    }
}
