package com.edgehistogram.server.descriptor;

public interface DescriptorEvaluator {
    DescriptorPart getPart();

    EhdConfig getConfig();

    String getVersion();

    double[] computeVector(GrayImage image);
}
