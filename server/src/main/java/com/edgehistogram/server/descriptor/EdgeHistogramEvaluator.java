package com.edgehistogram.server.descriptor;

public class EdgeHistogramEvaluator implements DescriptorEvaluator {

    private final DescriptorPart part;
    private final EhdConfig config;
    private final String version;

    public EdgeHistogramEvaluator(DescriptorPart part, EhdConfig config, String version) {
        this.part = part;
        this.config = config;
        this.version = version;
    }

    @Override
    public DescriptorPart getPart() {
        return part;
    }

    @Override
    public EhdConfig getConfig() {
        return config;
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public double[] computeVector(GrayImage image) {
        return new EdgeHistogramDescriptor(image, config).getVector(part);
    }
}
