package com.hmmtagger.util;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;

/**
 * Big-endian packing of double arrays for BLOB columns.
 */
public class DoubleArrayCodec {

    public static byte[] toBytes(double[] values) {
        if (values == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES);
        buffer.asDoubleBuffer().put(values);
        return buffer.array();
    }

    public static double[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        if (bytes.length % Double.BYTES != 0) {
            throw new IllegalArgumentException("Blob length " + bytes.length + " is not a multiple of "
                    + Double.BYTES);
        }
        DoubleBuffer buffer = ByteBuffer.wrap(bytes).asDoubleBuffer();
        double[] values = new double[buffer.remaining()];
        buffer.get(values);
        return values;
    }
}
