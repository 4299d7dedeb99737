package com.edgehistogram.util;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;

/**
 * Descriptor vectors as big-endian IEEE-754 doubles, for BLOB storage.
 */
public class DoubleArrayCodec {

    public static byte[] toBytes(double[] vector) {
        if (vector == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Double.BYTES);
        buffer.asDoubleBuffer().put(vector);
        return buffer.array();
    }

    public static double[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        if (bytes.length % Double.BYTES != 0) {
            throw new IllegalArgumentException("Blob length " + bytes.length + " is not a multiple of " + Double.BYTES);
        }
        DoubleBuffer buffer = ByteBuffer.wrap(bytes).asDoubleBuffer();
        double[] vector = new double[buffer.remaining()];
        buffer.get(vector);
        return vector;
    }
}
