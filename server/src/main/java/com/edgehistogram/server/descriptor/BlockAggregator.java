package com.edgehistogram.server.descriptor;

import com.edgehistogram.server.descriptor.DescriptorValidationException.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits an image into blocks and blocks into 2x2 cells, counting the edge
 * orientation of every cell per block.
 */
public final class BlockAggregator {
    private static final Logger logger = LoggerFactory.getLogger(BlockAggregator.class);

    private BlockAggregator() {
    }

    /**
     * Histogram of a standalone block given as block[row][col]. Both sides must
     * be even.
     */
    public static int[] computeBlockHistogram(double[][] block, double threshold) {
        GrayImage img = GrayImage.fromSamples(block);
        if (img.getHeight() % 2 != 0 || img.getWidth() % 2 != 0) {
            throw new IllegalArgumentException(
                    "Block size must be even, got " + img.getHeight() + "x" + img.getWidth());
        }
        return computeBlockHistogram(img, 0, 0, img.getHeight(), img.getWidth(), threshold);
    }

    static int[] computeBlockHistogram(GrayImage image, int r0, int c0, int blockHeight, int blockWidth,
            double threshold) {
        int[] hist = new int[EdgeOrientation.BIN_COUNT];

        int cellRows = blockHeight / 2;
        int cellCols = blockWidth / 2;

        for (int y = 0; y < cellRows; y++) {
            int r = r0 + 2 * y;
            for (int x = 0; x < cellCols; x++) {
                int c = c0 + 2 * x;
                EdgeOrientation o = CellClassifier.classify(
                        image.get(r, c), image.get(r, c + 1),
                        image.get(r + 1, c), image.get(r + 1, c + 1),
                        threshold);
                if (o.isEdge()) {
                    hist[o.getBinIndex()]++;
                }
            }
        }
        return hist;
    }

    public static BlockGrid computeGrid(GrayImage image, EhdConfig config) {
        int hCount = config.getHorizontalBlockCount();
        int vCount = config.getVerticalBlockCount();

        // block counts must split evenly into halves and quarters for clustering
        if (hCount <= 0 || vCount <= 0 || hCount % 4 != 0 || vCount % 4 != 0) {
            throw new DescriptorValidationException(ErrorKind.INVALID_BLOCK_COUNT,
                    "EHD requires block counts to be positive multiples of 4, got horizontal=" + hCount
                            + ", vertical=" + vCount);
        }

        int width = image.getWidth();
        int height = image.getHeight();
        if (width % (2 * hCount) != 0 || height % (2 * vCount) != 0) {
            throw new DescriptorValidationException(ErrorKind.INVALID_IMAGE_SIZE,
                    "EHD requires image width to be a multiple of " + (2 * hCount) + " and height a multiple of "
                            + (2 * vCount) + ", got " + width + "x" + height);
        }

        long start = System.currentTimeMillis();

        int blockWidth = width / hCount;
        int blockHeight = height / vCount;
        int[][][] bins = new int[vCount][hCount][];

        for (int y = 0; y < vCount; y++) {
            for (int x = 0; x < hCount; x++) {
                bins[y][x] = computeBlockHistogram(image, y * blockHeight, x * blockWidth, blockHeight, blockWidth,
                        config.getThreshold());
            }
        }

        logger.debug("Computed {}x{} block grid ({}x{} px blocks) in {} ms", vCount, hCount, blockHeight,
                blockWidth, (System.currentTimeMillis() - start));
        return new BlockGrid(bins, blockWidth, blockHeight);
    }
}
