package com.edgehistogram.server.service;

import com.edgehistogram.server.descriptor.DescriptorPart;
import com.edgehistogram.server.descriptor.EhdConfig;

public class DescriptorResult {
    private final DescriptorPart part;
    private final double[] vector;
    private final EhdConfig configuration;
    private final String imageHash;
    private final boolean cacheHit;

    public DescriptorResult(DescriptorPart part, double[] vector, EhdConfig configuration, String imageHash,
            boolean cacheHit) {
        this.part = part;
        this.vector = vector;
        this.configuration = configuration;
        this.imageHash = imageHash;
        this.cacheHit = cacheHit;
    }

    public String getPart() {
        return part.getId();
    }

    public int getLength() {
        return vector.length;
    }

    public double[] getVector() {
        return vector;
    }

    public EhdConfig getConfiguration() {
        return configuration;
    }

    // null when the cache is disabled
    public String getImageHash() {
        return imageHash;
    }

    public boolean isCacheHit() {
        return cacheHit;
    }
}
