package com.anodi.util;

import java.nio.ByteBuffer;

/**
 * Binary form of a mostly-zero count vector: the vector length, the number of
 * non-zero entries, then (index, count) pairs in ascending index order.
 * A 4x4 histogram has 65536 bins but only a few hundred non-zero ones.
 */
public class SparseCountsCodec {

    private static final int HEADER_BYTES = 2 * Integer.BYTES;
    private static final int ENTRY_BYTES = 2 * Integer.BYTES;

    public static byte[] toBytes(int[] counts) {
        if (counts == null) {
            return null;
        }
        int nonZero = 0;
        for (int v : counts) {
            if (v != 0) {
                nonZero++;
            }
        }
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + nonZero * ENTRY_BYTES);
        buffer.putInt(counts.length);
        buffer.putInt(nonZero);
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] != 0) {
                buffer.putInt(i);
                buffer.putInt(counts[i]);
            }
        }
        return buffer.array();
    }

    public static int[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        if (buffer.remaining() < HEADER_BYTES) {
            throw new IllegalArgumentException("Truncated counts blob: " + bytes.length + " bytes");
        }
        int length = buffer.getInt();
        int nonZero = buffer.getInt();
        if (length < 0 || nonZero < 0 || nonZero > length
                || buffer.remaining() != (long) nonZero * ENTRY_BYTES) {
            throw new IllegalArgumentException("Corrupt counts blob: length=" + length + ", nonZero=" + nonZero
                    + ", payload=" + buffer.remaining() + " bytes");
        }
        int[] counts = new int[length];
        for (int k = 0; k < nonZero; k++) {
            int index = buffer.getInt();
            if (index < 0 || index >= length) {
                throw new IllegalArgumentException("Index " + index + " outside counts of length " + length);
            }
            counts[index] = buffer.getInt();
        }
        return counts;
    }
}
