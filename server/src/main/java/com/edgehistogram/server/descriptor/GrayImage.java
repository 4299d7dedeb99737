package com.edgehistogram.server.descriptor;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Single-channel image. samples[row][col] holds the intensity; the grid is
 * copied on construction and never exposed.
 */
public final class GrayImage {
    private final double[][] samples;
    private final int height;
    private final int width;

    private GrayImage(double[][] samples) {
        this.samples = samples;
        this.height = samples.length;
        this.width = samples[0].length;
    }

    public static GrayImage fromSamples(double[][] samples) {
        checkRectangular(samples);
        double[][] copy = new double[samples.length][];
        for (int r = 0; r < samples.length; r++) {
            copy[r] = samples[r].clone();
        }
        return new GrayImage(copy);
    }

    /**
     * Builds an image from channel planes laid out as [channel][row][col].
     * Only a single plane is accepted.
     */
    public static GrayImage fromChannels(double[][][] planes) {
        if (planes == null || planes.length == 0) {
            throw new IllegalArgumentException("Image must have at least one channel");
        }
        if (planes.length > 1) {
            throw new DescriptorValidationException(DescriptorValidationException.ErrorKind.INVALID_CHANNEL_COUNT,
                    "EHD requires mono-channel (gray) images, got " + planes.length + " channels");
        }
        return fromSamples(planes[0]);
    }

    private static void checkRectangular(double[][] samples) {
        if (samples == null || samples.length == 0 || samples[0] == null || samples[0].length == 0) {
            throw new IllegalArgumentException("Image must have at least one row and one column");
        }
        int w = samples[0].length;
        for (int r = 1; r < samples.length; r++) {
            if (samples[r] == null || samples[r].length != w) {
                throw new IllegalArgumentException("Image row " + r + " does not match width " + w);
            }
        }
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public double get(int row, int col) {
        return samples[row][col];
    }

    /**
     * SHA-256 over the dimensions and raw sample bits, hex encoded.
     */
    public String contentHash() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            ByteBuffer buf = ByteBuffer.allocate(Double.BYTES);
            digest.update(ByteBuffer.allocate(2 * Integer.BYTES).putInt(height).putInt(width).array());
            for (int r = 0; r < height; r++) {
                for (int c = 0; c < width; c++) {
                    buf.clear();
                    buf.putDouble(samples[r][c]);
                    digest.update(buf.array());
                }
            }
            byte[] hash = digest.digest();
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1)
                    hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
