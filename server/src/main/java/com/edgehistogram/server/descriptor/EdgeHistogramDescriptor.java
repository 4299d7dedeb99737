package com.edgehistogram.server.descriptor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Edge Histogram Descriptor of one image under one configuration.
 *
 * The block grid is computed by the first query and reused by every later
 * one. Configuration cannot change after construction; use
 * {@link #withConfiguration(EhdConfig)} for a descriptor with other settings.
 */
public class EdgeHistogramDescriptor {
    private static final Logger logger = LoggerFactory.getLogger(EdgeHistogramDescriptor.class);

    private final GrayImage image;
    private final EhdConfig config;

    private volatile BlockGrid grid;

    public EdgeHistogramDescriptor(GrayImage image) {
        this(image, EhdConfig.defaults());
    }

    public EdgeHistogramDescriptor(GrayImage image, EhdConfig config) {
        if (image == null) {
            throw new IllegalArgumentException("image must not be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.image = image;
        this.config = config;
    }

    /**
     * Convenience constructor for planes laid out as [channel][row][col].
     * Fails with INVALID_CHANNEL_COUNT for more than one plane.
     */
    public EdgeHistogramDescriptor(double[][][] planes, EhdConfig config) {
        this(GrayImage.fromChannels(planes), config);
    }

    public EdgeHistogramDescriptor withConfiguration(EhdConfig newConfig) {
        return new EdgeHistogramDescriptor(image, newConfig);
    }

    public GrayImage getImage() {
        return image;
    }

    public EhdConfig getConfig() {
        return config;
    }

    public double[] getBlocksBinsVector() {
        return RegionAggregator.blocksBins(blockGrid(), config.isNormalize());
    }

    public double[] getSemiLocalBinsVector() {
        return RegionAggregator.semiLocalBins(blockGrid(), config.isNormalize());
    }

    public double[] getGlobalBinsVector() {
        return RegionAggregator.globalBins(blockGrid(), config.isNormalize());
    }

    public double[] getFullBinsVector() {
        double[] global = getGlobalBinsVector();
        double[] semiLocal = getSemiLocalBinsVector();
        double[] blocks = getBlocksBinsVector();

        double[] full = new double[global.length + semiLocal.length + blocks.length];
        System.arraycopy(global, 0, full, 0, global.length);
        System.arraycopy(semiLocal, 0, full, global.length, semiLocal.length);
        System.arraycopy(blocks, 0, full, global.length + semiLocal.length, blocks.length);
        return full;
    }

    public double[] getVector(DescriptorPart part) {
        switch (part) {
            case GLOBAL:
                return getGlobalBinsVector();
            case SEMI_LOCAL:
                return getSemiLocalBinsVector();
            case BLOCKS:
                return getBlocksBinsVector();
            case FULL:
                return getFullBinsVector();
            default:
                throw new IllegalArgumentException("Unknown descriptor part: " + part);
        }
    }

    /**
     * Block histograms, computing them on first use. A validation failure
     * leaves the cache empty.
     */
    public BlockGrid blockGrid() {
        BlockGrid g = grid;
        if (g == null) {
            synchronized (this) {
                g = grid;
                if (g == null) {
                    logger.debug("Computing block grid for {}x{} image with {}", image.getHeight(),
                            image.getWidth(), config);
                    g = BlockAggregator.computeGrid(image, config);
                    grid = g;
                }
            }
        }
        return g;
    }
}
